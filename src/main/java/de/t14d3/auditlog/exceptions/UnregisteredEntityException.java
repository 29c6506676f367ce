package de.t14d3.auditlog.exceptions;

/**
 * Thrown when a history lookup is requested for an entity type that has no log source registered.
 * This is an integration defect, not a condition callers are expected to recover from.
 */
public class UnregisteredEntityException extends AuditlogException {
    private final Class<?> entityType;

    public UnregisteredEntityException(Class<?> entityType) {
        super("No log source registered for entity type " + entityType.getName());
        this.entityType = entityType;
    }

    public Class<?> getEntityType() {
        return entityType;
    }
}
