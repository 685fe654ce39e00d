package com.nevis.digest.model;

import java.util.UUID;

/**
 * Durable unit of asynchronous work. All timestamps are epoch milliseconds.
 */
public record Task(
    UUID id,
    String type,
    String input,
    TaskStatus status,
    int version,
    int attempts,
    Long lastAttemptAt,
    String output,
    String error,
    Long runAfter,
    long createdAt,
    long updatedAt,
    Long completedAt
) {

    public static Task create(String type, String input, Long runAfter, long now) {
        return new Task(UUID.randomUUID(), type, input, TaskStatus.TO_DO, 0, 0, null,
            null, null, runAfter, now, now, null);
    }

    public Task claimed(long now) {
        return new Task(id, type, input, TaskStatus.IN_PROGRESS, version + 1, attempts + 1, now,
            output, null, runAfter, createdAt, now, completedAt);
    }

    public Task succeeded(String result, long now) {
        return new Task(id, type, input, TaskStatus.SUCCESS, version + 1, attempts, lastAttemptAt,
            result, null, null, createdAt, now, now);
    }

    public Task failed(String message, int newAttempts, Long retryAt, long now) {
        return new Task(id, type, input, TaskStatus.FAILED, version + 1, newAttempts, lastAttemptAt,
            output, message, retryAt, createdAt, now, null);
    }

    public Task requeued(long now) {
        return new Task(id, type, input, TaskStatus.TO_DO, version + 1, attempts, lastAttemptAt,
            output, error, null, createdAt, now, null);
    }
}
