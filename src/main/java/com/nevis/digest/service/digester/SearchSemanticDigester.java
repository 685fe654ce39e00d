package com.nevis.digest.service.digester;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.model.Task;
import com.nevis.digest.model.TextSource;
import com.nevis.digest.service.SemanticIngestionService;
import com.nevis.digest.service.TaskQueueService;
import com.nevis.digest.service.TextSourceService;
import com.nevis.digest.service.task.SemanticIndexPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Chunks the file's text into search documents and queues their embedding.
 */
@Component
@RequiredArgsConstructor
public class SearchSemanticDigester implements Digester {

    private final SemanticIngestionService ingestionService;
    private final TaskQueueService taskQueueService;
    private final TextSourceService textSourceService;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return DigestTypes.SEARCH_SEMANTIC;
    }

    @Override
    public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
        return !file.isFolder();
    }

    @Override
    public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
        Optional<TextSource> source = textSourceService.resolve(file, existingDigests);
        if (source.isEmpty()) {
            return List.of(DigestInput.completed(name(), null));
        }

        int chunkCount = ingestionService.ingest(file.path(), source.get());
        ObjectNode content = objectMapper.createObjectNode()
            .put("sourceType", source.get().sourceType())
            .put("chunkCount", chunkCount);

        if (chunkCount > 0) {
            Task task = taskQueueService.enqueue(new SemanticIndexPayload(file.path(), source.get().sourceType()));
            content.put("taskId", task.id().toString());
        }
        return List.of(DigestInput.completed(name(), content.toString()));
    }

    @Override
    public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
        return Digests.upstreamChanged(file, existingDigests, name(), SearchKeywordDigester.UPSTREAM, true);
    }
}
