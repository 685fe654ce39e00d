package com.nevis.digest.service.task;

public enum TaskType {
    DIGEST_FILE("digest-file"),
    SEARCH_SEMANTIC_INDEX("search-semantic-index");

    private final String value;

    TaskType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
