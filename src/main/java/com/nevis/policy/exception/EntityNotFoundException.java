package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final String entityType;
    private final String entityId;

    public EntityNotFoundException(String entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public static EntityNotFoundException document(String source) {
        return new EntityNotFoundException("Policy", source);
    }

    public static EntityNotFoundException revision(String revisionId) {
        return new EntityNotFoundException("Revision", revisionId);
    }
}
