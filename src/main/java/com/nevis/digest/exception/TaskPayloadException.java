package com.nevis.digest.exception;

public class TaskPayloadException extends RuntimeException {

    public TaskPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
