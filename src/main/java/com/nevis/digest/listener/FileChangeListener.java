package com.nevis.digest.listener;

import com.nevis.digest.event.FileChangedEvent;
import com.nevis.digest.service.DigestCoordinator;
import com.nevis.digest.service.TaskQueueService;
import com.nevis.digest.service.task.DigestFilePayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class FileChangeListener {

    private final DigestCoordinator digestCoordinator;
    private final TaskQueueService taskQueueService;

    @EventListener
    public void onFileChanged(FileChangedEvent event) {
        if (event.isNew()) {
            int created = digestCoordinator.ensureDigestPlaceholders(event.filePath());
            log.info("New file {}: created {} digest placeholders", event.filePath(), created);
            taskQueueService.enqueue(new DigestFilePayload(event.filePath(), false));
        } else if (event.contentChanged()) {
            log.info("Content of {} changed, scheduling full re-digest", event.filePath());
            taskQueueService.enqueue(new DigestFilePayload(event.filePath(), true));
        }
    }
}
