package com.nevis.digest.service;

import com.nevis.digest.config.TaskQueueProperties;
import com.nevis.digest.model.PendingTaskCount;
import com.nevis.digest.model.Task;
import com.nevis.digest.model.TaskStats;
import com.nevis.digest.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Admission and retry policy over the task store.
 */
@Service
@RequiredArgsConstructor
public class TaskScheduler {

    private final TaskRepository taskRepository;
    private final TaskQueueProperties properties;
    private final Clock clock;

    /**
     * Exponential backoff with base 4, capped at {@code maxSeconds} and perturbed by a uniform
     * fraction in {@code [-jitterFactor, +jitterFactor]}.
     *
     * @param random source of values in {@code [0, 1)}
     * @return delay in whole seconds, never negative
     */
    public static long calculateRetryDelay(int attempts, long baseSeconds, long maxSeconds,
                                           double jitterFactor, DoubleSupplier random) {
        int exponent = Math.max(attempts, 1) - 1;
        double delay = Math.min(baseSeconds * Math.pow(4, exponent), maxSeconds);
        double jitter = (random.getAsDouble() * 2 - 1) * jitterFactor;
        return Math.max(0L, (long) Math.floor(delay * (1 + jitter)));
    }

    public long calculateRetryDelay(int attempts) {
        return calculateRetryDelay(
            attempts,
            properties.retryBaseSeconds(),
            properties.retryMaxSeconds(),
            properties.retryJitter(),
            () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    public List<Task> getReadyTasks(int limit, int maxAttempts) {
        return taskRepository.findReady(clock.millis(), maxAttempts, limit);
    }

    public List<Task> getStaleTasks(long timeoutSeconds) {
        return taskRepository.findStale(clock.millis() - timeoutSeconds * 1000);
    }

    public boolean hasReadyTasks(int maxAttempts) {
        return taskRepository.existsReady(clock.millis(), maxAttempts);
    }

    public List<PendingTaskCount> getPendingTaskCountByType(int maxAttempts) {
        return taskRepository.countPendingByType(clock.millis(), maxAttempts);
    }

    public TaskStats getTaskStats() {
        return taskRepository.stats(properties.maxAttempts());
    }

    /**
     * Earliest time a failed task may run again, in epoch milliseconds.
     */
    public long getNextRetryTime(Task task) {
        long lastAttempt = task.lastAttemptAt() != null ? task.lastAttemptAt() : task.createdAt();
        return lastAttempt + calculateRetryDelay(task.attempts()) * 1000;
    }
}
