package de.t14d3.auditlog.cache;

import de.t14d3.auditlog.log.EntityKey;

import java.time.Instant;
import java.util.Objects;

/**
 * Cache key of an object-level history lookup: which entity, as of which instant.
 */
public final class StateCacheKey {
    private final EntityKey entityKey;
    private final Instant timestamp;

    public StateCacheKey(EntityKey entityKey, Instant timestamp) {
        this.entityKey = Objects.requireNonNull(entityKey, "entityKey");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public EntityKey entityKey() {
        return entityKey;
    }

    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateCacheKey other)) return false;
        return entityKey.equals(other.entityKey) && timestamp.equals(other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityKey, timestamp);
    }

    @Override
    public String toString() {
        return entityKey + "@" + timestamp;
    }
}
