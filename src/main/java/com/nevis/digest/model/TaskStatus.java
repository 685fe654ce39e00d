package com.nevis.digest.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TaskStatus {
    TO_DO("to-do"),
    IN_PROGRESS("in-progress"),
    SUCCESS("success"),
    FAILED("failed");

    private final String dbValue;

    TaskStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static TaskStatus fromDb(String value) {
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + value));
    }
}
