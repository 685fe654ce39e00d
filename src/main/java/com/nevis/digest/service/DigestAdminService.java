package com.nevis.digest.service;

import com.nevis.digest.exception.EntityNotFoundException;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigesterStats;
import com.nevis.digest.model.Task;
import com.nevis.digest.repository.ArchiveRepository;
import com.nevis.digest.repository.DigestRepository;
import com.nevis.digest.repository.FileRepository;
import com.nevis.digest.service.task.DigestFilePayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-mostly queries and operator actions behind the status endpoints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DigestAdminService {

    private final DigestRepository digestRepository;
    private final FileRepository fileRepository;
    private final ArchiveRepository archiveRepository;
    private final TaskQueueService taskQueueService;

    public List<DigesterStats> getDigesterStats() {
        return digestRepository.countByDigester();
    }

    public List<Digest> getDigests(String filePath) {
        requireFile(filePath);
        return digestRepository.findByFilePath(filePath);
    }

    public byte[] getArchive(String name) {
        return archiveRepository.findByName(name)
            .orElseThrow(() -> new EntityNotFoundException(name));
    }

    public Task requestReprocess(String filePath) {
        requireFile(filePath);
        log.info("Re-digest of {} requested", filePath);
        return taskQueueService.enqueue(new DigestFilePayload(filePath, true));
    }

    private void requireFile(String filePath) {
        if (fileRepository.findByPath(filePath).isEmpty()) {
            throw new EntityNotFoundException(filePath);
        }
    }
}
