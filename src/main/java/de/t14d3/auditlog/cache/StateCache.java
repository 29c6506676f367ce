package de.t14d3.auditlog.cache;

import de.t14d3.auditlog.history.HistoricalObjectState;
import de.t14d3.auditlog.log.EntityKey;
import de.t14d3.auditlog.log.LogEntryListener;

import java.time.Duration;
import java.util.Optional;

/**
 * Caches object-level history lookups.
 *
 * A cached state stays valid only while no entry is appended to the entity's log; writers must
 * {@link #invalidate(EntityKey)} the entity on every append, e.g. by registering
 * {@link #invalidationListener()} with the store.
 */
public interface StateCache extends AutoCloseable {

    Optional<HistoricalObjectState> get(StateCacheKey key);

    void put(StateCacheKey key, HistoricalObjectState state, Duration ttl);

    /**
     * Drop every cached state of the given entity.
     */
    void invalidate(EntityKey entityKey);

    void clear();

    /**
     * @return a listener that invalidates the entity of each appended entry
     */
    default LogEntryListener invalidationListener() {
        return entry -> invalidate(entry.entityKey());
    }

    @Override
    default void close() {
        // no-op
    }
}
