package com.nevis.digest.service.task;

public record SemanticIndexPayload(String filePath, String sourceType) implements TaskPayload {

    @Override
    public TaskType type() {
        return TaskType.SEARCH_SEMANTIC_INDEX;
    }
}
