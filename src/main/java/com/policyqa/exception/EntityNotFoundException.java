package com.policyqa.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final Long entityId;

    public EntityNotFoundException(Long entityId) {
        this("Entity", entityId);
    }

    protected EntityNotFoundException(String entityName, Long entityId) {
        super(entityName + " not found: " + entityId);
        this.entityId = entityId;
    }
}
