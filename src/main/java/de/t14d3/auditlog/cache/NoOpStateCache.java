package de.t14d3.auditlog.cache;

import de.t14d3.auditlog.history.HistoricalObjectState;
import de.t14d3.auditlog.log.EntityKey;

import java.time.Duration;
import java.util.Optional;

public final class NoOpStateCache implements StateCache {
    @Override
    public Optional<HistoricalObjectState> get(StateCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(StateCacheKey key, HistoricalObjectState state, Duration ttl) {
        // no-op
    }

    @Override
    public void invalidate(EntityKey entityKey) {
        // no-op
    }

    @Override
    public void clear() {
        // no-op
    }
}
