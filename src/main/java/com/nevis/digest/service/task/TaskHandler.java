package com.nevis.digest.service.task;

/**
 * Executes tasks of one type. The returned value is stored as the task output.
 */
public interface TaskHandler<P extends TaskPayload, R> {

    TaskType type();

    Class<P> payloadType();

    R handle(P payload);
}
