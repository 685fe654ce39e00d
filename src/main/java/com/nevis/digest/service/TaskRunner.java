package com.nevis.digest.service;

import com.nevis.digest.config.TaskQueueProperties;
import com.nevis.digest.exception.EntityNotFoundException;
import com.nevis.digest.exception.TaskPayloadException;
import com.nevis.digest.model.Task;
import com.nevis.digest.model.TaskStatus;
import com.nevis.digest.repository.TaskRepository;
import com.nevis.digest.service.task.TaskHandler;
import com.nevis.digest.service.task.TaskPayload;
import com.nevis.digest.service.task.TaskPayloadCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Claims a single task, dispatches it to the handler registered for its type and records
 * the outcome. Claims use the task version as an optimistic lock.
 */
@Slf4j
@Service
public class TaskRunner {

    public enum Outcome { SUCCEEDED, FAILED, NOT_CLAIMED }

    private final TaskRepository taskRepository;
    private final TaskScheduler taskScheduler;
    private final TaskPayloadCodec payloadCodec;
    private final TaskQueueProperties properties;
    private final Clock clock;
    private final Map<String, TaskHandler<?, ?>> handlers = new HashMap<>();

    public TaskRunner(
        TaskRepository taskRepository,
        TaskScheduler taskScheduler,
        TaskPayloadCodec payloadCodec,
        List<TaskHandler<?, ?>> taskHandlers,
        TaskQueueProperties properties,
        Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.taskScheduler = taskScheduler;
        this.payloadCodec = payloadCodec;
        this.properties = properties;
        this.clock = clock;
        for (TaskHandler<?, ?> handler : taskHandlers) {
            TaskHandler<?, ?> previous = handlers.put(handler.type().value(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for task type " + handler.type().value());
            }
        }
    }

    public Outcome execute(UUID taskId) {
        Task task = taskRepository.findById(taskId)
            .orElseThrow(() -> new EntityNotFoundException(taskId));

        if (!isRunnable(task)) {
            log.debug("Task {} is {} with {} attempts, not running it", taskId, task.status(), task.attempts());
            return Outcome.NOT_CLAIMED;
        }

        Task claimed = task.claimed(clock.millis());
        if (!taskRepository.updateIfVersion(claimed, task.version())) {
            log.debug("Task {} was claimed by another worker", taskId);
            return Outcome.NOT_CLAIMED;
        }

        TaskHandler<?, ?> handler = handlers.get(claimed.type());
        if (handler == null) {
            failPermanently(claimed, "No handler registered for task type: " + claimed.type());
            return Outcome.FAILED;
        }

        String output;
        try {
            output = payloadCodec.encodeResult(invoke(handler, claimed));
        } catch (TaskPayloadException e) {
            failPermanently(claimed, e.getMessage());
            return Outcome.FAILED;
        } catch (Exception e) {
            // handlers may rethrow checked exceptions unchecked
            failWithRetry(claimed, e);
            return Outcome.FAILED;
        }

        Task succeeded = claimed.succeeded(output, clock.millis());
        if (!taskRepository.updateIfVersion(succeeded, claimed.version())) {
            log.warn("Task {} changed while running, result was not recorded", taskId);
        } else {
            log.info("Task {} ({}) succeeded on attempt {}", taskId, claimed.type(), claimed.attempts());
        }
        return Outcome.SUCCEEDED;
    }

    /**
     * Requeues in-progress tasks whose worker went silent; tasks out of attempts fail for good.
     *
     * @return number of tasks recovered or failed
     */
    public int recoverStaleTasks() {
        List<Task> stale = taskScheduler.getStaleTasks(properties.staleTimeoutSeconds());
        int handled = 0;
        for (Task task : stale) {
            long now = clock.millis();
            Task updated = task.attempts() < properties.maxAttempts()
                ? task.requeued(now)
                : task.failed("Task timed out after " + task.attempts() + " attempts", task.attempts(), null, now);

            if (taskRepository.updateIfVersion(updated, task.version())) {
                handled++;
                log.warn("Stale task {} ({}) moved to {}", task.id(), task.type(), updated.status());
            }
        }
        return handled;
    }

    private boolean isRunnable(Task task) {
        if (task.status() == TaskStatus.TO_DO) {
            return true;
        }
        return task.status() == TaskStatus.FAILED && task.attempts() < properties.maxAttempts();
    }

    private <P extends TaskPayload, R> R invoke(TaskHandler<P, R> handler, Task task) {
        P payload = payloadCodec.decode(task.input(), handler.payloadType());
        return handler.handle(payload);
    }

    private void failWithRetry(Task claimed, Exception e) {
        long now = clock.millis();
        long delaySeconds = taskScheduler.calculateRetryDelay(claimed.attempts());
        Task failed = claimed.failed(errorMessage(e), claimed.attempts(), now + delaySeconds * 1000, now);

        if (taskRepository.updateIfVersion(failed, claimed.version())) {
            log.warn("Task {} ({}) failed on attempt {}, retry in {}s: {}",
                claimed.id(), claimed.type(), claimed.attempts(), delaySeconds, e.getMessage(), e);
        } else {
            log.warn("Task {} changed while running, failure was not recorded", claimed.id());
        }
    }

    private void failPermanently(Task claimed, String message) {
        int attempts = Math.max(claimed.attempts(), properties.maxAttempts());
        Task failed = claimed.failed(message, attempts, null, clock.millis());
        taskRepository.updateIfVersion(failed, claimed.version());
        log.error("Task {} ({}) failed permanently: {}", claimed.id(), claimed.type(), message);
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
