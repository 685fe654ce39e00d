package com.nevis.digest.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final Object entityId;

    public EntityNotFoundException(Object entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }
}
