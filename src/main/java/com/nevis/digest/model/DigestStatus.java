package com.nevis.digest.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DigestStatus {
    TODO("todo"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String dbValue;

    DigestStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED;
    }

    public static DigestStatus fromDb(String value) {
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown digest status: " + value));
    }
}
