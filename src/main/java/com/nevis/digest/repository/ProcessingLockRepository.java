package com.nevis.digest.repository;

import java.time.OffsetDateTime;

/**
 * Advisory per-file locks so that only one worker digests a file at a time.
 */
public interface ProcessingLockRepository {

    boolean tryAcquire(String filePath, String owner, OffsetDateTime now);

    void release(String filePath, String owner);

    /**
     * Moves {@code locked_at} forward while the owner still holds the lock.
     *
     * @return false when the lock is gone or held by someone else
     */
    boolean refresh(String filePath, String owner, OffsetDateTime now);

    int deleteOlderThan(OffsetDateTime cutoff);
}
