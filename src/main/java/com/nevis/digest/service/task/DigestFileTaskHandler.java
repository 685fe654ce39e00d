package com.nevis.digest.service.task;

import com.nevis.digest.model.FileDigestSummary;
import com.nevis.digest.service.DigestCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DigestFileTaskHandler implements TaskHandler<DigestFilePayload, FileDigestSummary> {

    private final DigestCoordinator digestCoordinator;

    @Override
    public TaskType type() {
        return TaskType.DIGEST_FILE;
    }

    @Override
    public Class<DigestFilePayload> payloadType() {
        return DigestFilePayload.class;
    }

    @Override
    public FileDigestSummary handle(DigestFilePayload payload) {
        FileDigestSummary summary = digestCoordinator.processFile(payload.filePath(), payload.reset());
        if (summary.locked()) {
            // nothing was written; the queue retries once the other worker is done
            throw new IllegalStateException("File " + payload.filePath() + " is being digested by another worker");
        }
        return summary;
    }
}
