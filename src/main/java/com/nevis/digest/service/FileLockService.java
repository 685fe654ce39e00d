package com.nevis.digest.service;

import com.nevis.digest.repository.ProcessingLockRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-file advisory locks backed by the processing lock table, so several worker
 * processes can share one store.
 */
@Slf4j
@Service
public class FileLockService {

    private final ProcessingLockRepository lockRepository;
    private final Clock clock;
    private final String owner;

    public FileLockService(ProcessingLockRepository lockRepository, Clock clock) {
        this.lockRepository = lockRepository;
        this.clock = clock;
        this.owner = ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * @return the held lock, or empty when another owner holds it
     */
    public Optional<FileLock> tryAcquire(String filePath) {
        if (!lockRepository.tryAcquire(filePath, owner, OffsetDateTime.now(clock))) {
            return Optional.empty();
        }
        return Optional.of(new FileLock(filePath));
    }

    public int releaseOlderThan(OffsetDateTime cutoff) {
        return lockRepository.deleteOlderThan(cutoff);
    }

    public final class FileLock implements AutoCloseable {

        private final String filePath;

        private FileLock(String filePath) {
            this.filePath = filePath;
        }

        /**
         * Heartbeat for long passes, so the stale lock sweep leaves a live lock alone.
         *
         * @return false when the lock was swept or taken over in the meantime
         */
        public boolean refresh() {
            return lockRepository.refresh(filePath, owner, OffsetDateTime.now(clock));
        }

        @Override
        public void close() {
            lockRepository.release(filePath, owner);
            log.debug("Released lock on {}", filePath);
        }
    }
}
