package com.nevis.digest.repository;

import com.nevis.digest.model.PendingTaskCount;
import com.nevis.digest.model.Task;
import com.nevis.digest.model.TaskStats;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TaskRepository {

    Task save(Task task);

    Optional<Task> findById(UUID id);

    /**
     * Writes the task only if the stored version still equals {@code expectedVersion}.
     *
     * @return false when another writer got there first
     */
    boolean updateIfVersion(Task task, int expectedVersion);

    List<Task> findReady(long now, int maxAttempts, int limit);

    List<Task> findStale(long lastAttemptBefore);

    boolean existsReady(long now, int maxAttempts);

    List<PendingTaskCount> countPendingByType(long now, int maxAttempts);

    TaskStats stats(int maxAttempts);
}
