package com.perfwatch.core.error;

/**
 * Thrown when an operation references an entity id that is not registered.
 * Callers should not retry: the entity has to be registered first.
 *
 * @since 1.0.0
 */
public class InvalidEntityException extends MetricsException {

    private static final long serialVersionUID = 1L;

    private final String entityId;

    public InvalidEntityException(String entityId) {
        super("Entity not registered: '" + entityId + "'");
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
