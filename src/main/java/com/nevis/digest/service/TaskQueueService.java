package com.nevis.digest.service;

import com.nevis.digest.model.Task;
import com.nevis.digest.repository.TaskRepository;
import com.nevis.digest.service.task.TaskPayload;
import com.nevis.digest.service.task.TaskPayloadCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskQueueService {

    private final TaskRepository taskRepository;
    private final TaskPayloadCodec payloadCodec;
    private final Clock clock;

    public Task enqueue(TaskPayload payload) {
        return enqueue(payload, null);
    }

    /**
     * @param runAfter epoch milliseconds before which the task is not ready, or null
     */
    public Task enqueue(TaskPayload payload, Long runAfter) {
        Task task = Task.create(payload.type().value(), payloadCodec.encode(payload), runAfter, clock.millis());
        Task saved = taskRepository.save(task);
        log.info("Enqueued task {} of type {}", saved.id(), saved.type());
        return saved;
    }
}
