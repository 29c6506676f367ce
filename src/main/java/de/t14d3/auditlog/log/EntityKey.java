package de.t14d3.auditlog.log;

import de.t14d3.auditlog.mapping.EntityMetadata;

import java.util.Objects;

/**
 * Identifies the log entries of one entity instance.
 *
 * Uses the entity's content type (its table name) + a stringified primary key so that entries
 * can be matched without depending on the id's concrete Java type.
 */
public final class EntityKey {
    private final String contentType;
    private final String objectPk;

    public EntityKey(String contentType, String objectPk) {
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.objectPk = Objects.requireNonNull(objectPk, "objectPk");
    }

    /**
     * Derive the key of an entity from its {@link EntityMetadata}. An {@code EntityKey} is its own key.
     *
     * @throws IllegalArgumentException if the entity is null, not an @Entity, or has no id yet
     */
    public static EntityKey of(Object entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        if (entity instanceof EntityKey key) {
            return key;
        }
        EntityMetadata metadata = EntityMetadata.of(entity.getClass());
        Object id = metadata.getIdValue(entity);
        if (id == null) {
            throw new IllegalArgumentException("Entity " + entity.getClass().getName() + " has no id; unsaved entities have no history");
        }
        return new EntityKey(metadata.getTableName(), String.valueOf(id));
    }

    public static EntityKey of(Class<?> entityClass, Object id) {
        if (entityClass == null) {
            throw new IllegalArgumentException("entityClass must not be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        return new EntityKey(EntityMetadata.of(entityClass).getTableName(), String.valueOf(id));
    }

    public String contentType() {
        return contentType;
    }

    public String objectPk() {
        return objectPk;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityKey entityKey)) return false;
        return contentType.equals(entityKey.contentType) && objectPk.equals(entityKey.objectPk);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentType, objectPk);
    }

    @Override
    public String toString() {
        return contentType + "#" + objectPk;
    }
}
