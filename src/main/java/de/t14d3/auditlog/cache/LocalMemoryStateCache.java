package de.t14d3.auditlog.cache;

import de.t14d3.auditlog.history.HistoricalObjectState;
import de.t14d3.auditlog.log.EntityKey;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process cache with per-entry expiry.
 * <p>
 * Keys carry the requested instant, so most are never read twice. Expired entries are therefore
 * swept every {@link #SWEEP_INTERVAL} puts instead of waiting for their own key to come back.
 */
public final class LocalMemoryStateCache implements StateCache {
    public static final int SWEEP_INTERVAL = 256;

    private static final class Entry {
        private final HistoricalObjectState state;
        private final long expiresAtMillis; // Long.MAX_VALUE means no expiry

        private Entry(HistoricalObjectState state, long expiresAtMillis) {
            this.state = state;
            this.expiresAtMillis = expiresAtMillis;
        }

        private boolean isExpired(long nowMillis) {
            return expiresAtMillis != Long.MAX_VALUE && nowMillis > expiresAtMillis;
        }
    }

    private final ConcurrentHashMap<StateCacheKey, Entry> map = new ConcurrentHashMap<>();
    private final AtomicLong puts = new AtomicLong();

    @Override
    public Optional<HistoricalObjectState> get(StateCacheKey key) {
        Entry entry = map.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(System.currentTimeMillis())) {
            map.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.state);
    }

    @Override
    public void put(StateCacheKey key, HistoricalObjectState state, Duration ttl) {
        long expiresAtMillis;
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            expiresAtMillis = Long.MAX_VALUE;
        } else {
            expiresAtMillis = System.currentTimeMillis() + ttl.toMillis();
        }
        map.put(key, new Entry(state, expiresAtMillis));
        if (puts.incrementAndGet() % SWEEP_INTERVAL == 0) {
            evictExpired();
        }
    }

    /**
     * Remove every expired entry.
     *
     * @return the number of entries removed
     */
    public int evictExpired() {
        long now = System.currentTimeMillis();
        int before = map.size();
        map.values().removeIf(entry -> entry.isExpired(now));
        return Math.max(0, before - map.size());
    }

    @Override
    public void invalidate(EntityKey entityKey) {
        map.keySet().removeIf(key -> key.entityKey().equals(entityKey));
    }

    @Override
    public void clear() {
        map.clear();
    }

    public int size() {
        return map.size();
    }
}
