package com.nevis.digest.service.task;

import com.nevis.digest.model.IndexResult;
import com.nevis.digest.service.SemanticIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SemanticIndexTaskHandler implements TaskHandler<SemanticIndexPayload, IndexResult> {

    private final SemanticIngestionService ingestionService;

    @Override
    public TaskType type() {
        return TaskType.SEARCH_SEMANTIC_INDEX;
    }

    @Override
    public Class<SemanticIndexPayload> payloadType() {
        return SemanticIndexPayload.class;
    }

    @Override
    public IndexResult handle(SemanticIndexPayload payload) {
        return ingestionService.indexPending(payload.filePath());
    }
}
