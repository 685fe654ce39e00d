package com.nevis.digest.service.task;

/**
 * Marker for typed task inputs. Each {@link TaskType} has exactly one payload record.
 */
public interface TaskPayload {

    TaskType type();
}
