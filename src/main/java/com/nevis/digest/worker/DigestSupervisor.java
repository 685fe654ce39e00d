package com.nevis.digest.worker;

import com.nevis.digest.config.DigestProperties;
import com.nevis.digest.repository.DigestRepository;
import com.nevis.digest.service.DigestCoordinator;
import com.nevis.digest.service.FileLockService;
import com.nevis.digest.service.FileSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Picks files that still have digest work and runs the coordinator over them, a bounded
 * number at a time. Also sweeps digests and locks left behind by crashed passes.
 */
@Slf4j
@Component
public class DigestSupervisor {

    private final FileSelector fileSelector;
    private final DigestCoordinator digestCoordinator;
    private final DigestRepository digestRepository;
    private final FileLockService fileLockService;
    private final Executor executor;
    private final DigestProperties properties;
    private final Clock clock;

    public DigestSupervisor(
        FileSelector fileSelector,
        DigestCoordinator digestCoordinator,
        DigestRepository digestRepository,
        FileLockService fileLockService,
        @Qualifier("digestTaskExecutor") Executor executor,
        DigestProperties properties,
        Clock clock
    ) {
        this.fileSelector = fileSelector;
        this.digestCoordinator = digestCoordinator;
        this.digestRepository = digestRepository;
        this.fileLockService = fileLockService;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.digest.poll-interval-ms:5000}")
    public void digestPendingFiles() {
        if (!properties.supervisorEnabled()) {
            return;
        }

        List<String> paths;
        try {
            paths = fileSelector.findFilesNeedingDigestion(properties.batchSize());
        } catch (RuntimeException e) {
            log.error("File selection failed: {}", e.getMessage(), e);
            return;
        }
        if (paths.isEmpty()) {
            return;
        }

        log.debug("Digesting {} files", paths.size());
        CompletableFuture<?>[] passes = paths.stream()
            .map(path -> CompletableFuture.runAsync(() -> digest(path), executor))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(passes).join();
    }

    @Scheduled(fixedDelayString = "${app.digest.cleanup-interval-ms:60000}")
    public void cleanupStale() {
        if (!properties.supervisorEnabled()) {
            return;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime cutoff = now.minusMinutes(properties.staleThresholdMinutes());
        OffsetDateTime lockCutoff = now.minusMinutes(properties.lockTimeoutMinutes());
        try {
            int digests = digestRepository.resetStale(cutoff, now);
            int locks = fileLockService.releaseOlderThan(lockCutoff);
            if (digests > 0 || locks > 0) {
                log.info("Maintenance reset {} stale digests and released {} stale locks", digests, locks);
            }
        } catch (RuntimeException e) {
            log.error("Stale digest cleanup failed: {}", e.getMessage(), e);
        }
    }

    private void digest(String path) {
        try {
            digestCoordinator.processFile(path);
        } catch (RuntimeException e) {
            log.error("Digest pass failed for {}: {}", path, e.getMessage(), e);
        }
    }
}
