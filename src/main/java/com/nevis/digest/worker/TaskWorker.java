package com.nevis.digest.worker;

import com.nevis.digest.config.TaskQueueProperties;
import com.nevis.digest.infra.RateLimiter;
import com.nevis.digest.model.Task;
import com.nevis.digest.model.WorkerStatus;
import com.nevis.digest.service.TaskRunner;
import com.nevis.digest.service.TaskScheduler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the task store and runs ready tasks. Each admitted task costs one rate limiter token;
 * tasks that find the bucket empty stay queued for the next poll.
 */
@Slf4j
@Component
public class TaskWorker {

    private final TaskScheduler taskScheduler;
    private final TaskRunner taskRunner;
    private final RateLimiter taskLimiter;
    private final Executor executor;
    private final TaskQueueProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicInteger activeTasks = new AtomicInteger(0);

    public TaskWorker(
        TaskScheduler taskScheduler,
        TaskRunner taskRunner,
        @Qualifier("taskLimiter") RateLimiter taskLimiter,
        @Qualifier("queueTaskExecutor") Executor executor,
        TaskQueueProperties properties
    ) {
        this.taskScheduler = taskScheduler;
        this.taskRunner = taskRunner;
        this.taskLimiter = taskLimiter;
        this.executor = executor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (properties.autoStart()) {
            start();
        }
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Task worker started (batch size {}, max attempts {})",
                properties.batchSize(), properties.maxAttempts());
        }
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Task worker stopped with {} tasks in flight", activeTasks.get());
        }
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Task worker paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Task worker resumed");
        }
    }

    public WorkerStatus getStatus() {
        return new WorkerStatus(running.get(), paused.get(), activeTasks.get());
    }

    @Scheduled(fixedDelayString = "${app.task-queue.poll-interval-ms:1000}")
    public void poll() {
        if (!running.get() || paused.get()) {
            return;
        }
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Task poll failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one batch of ready tasks and waits for it to finish.
     *
     * @return number of tasks admitted
     */
    int pollOnce() {
        List<Task> ready = taskScheduler.getReadyTasks(properties.batchSize(), properties.maxAttempts());
        if (ready.isEmpty()) {
            return 0;
        }

        List<CompletableFuture<Void>> inFlight = new ArrayList<>();
        for (Task task : ready) {
            if (!taskLimiter.tryConsume()) {
                log.debug("Rate limit reached, deferring {} tasks for {} ms",
                    ready.size() - inFlight.size(), taskLimiter.getTimeUntilNextToken());
                break;
            }
            activeTasks.incrementAndGet();
            inFlight.add(CompletableFuture.runAsync(() -> runTask(task.id()), executor));
        }

        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
        return inFlight.size();
    }

    @Scheduled(fixedDelayString = "${app.task-queue.recovery-interval-ms:60000}")
    public void recoverStaleTasks() {
        if (!running.get()) {
            return;
        }
        try {
            int recovered = taskRunner.recoverStaleTasks();
            if (recovered > 0) {
                log.info("Recovered {} stale tasks", recovered);
            }
        } catch (RuntimeException e) {
            log.error("Stale task recovery failed: {}", e.getMessage(), e);
        }
    }

    private void runTask(UUID taskId) {
        try {
            taskRunner.execute(taskId);
        } catch (RuntimeException e) {
            log.error("Task {} could not be executed: {}", taskId, e.getMessage(), e);
        } finally {
            activeTasks.decrementAndGet();
        }
    }
}
