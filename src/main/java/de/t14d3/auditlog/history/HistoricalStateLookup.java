package de.t14d3.auditlog.history;

import de.t14d3.auditlog.cache.NoOpStateCache;
import de.t14d3.auditlog.cache.StateCache;
import de.t14d3.auditlog.cache.StateCacheKey;
import de.t14d3.auditlog.log.LogEntry;
import de.t14d3.auditlog.log.LogRecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reconstructs the state of an entity, or of one of its fields, as of a point in time.
 * <p>
 * The applicable log entry is the newest one whose timestamp is at or before the requested
 * instant; entries sharing that timestamp are resolved by highest id. Field lookups are
 * projected from the object lookup, so both always agree on the selected entry.
 * <p>
 * Lookups only read from the {@link LogRecordSource}; failures of the source propagate
 * unchanged. Instances are safe for concurrent use.
 *
 * @param <E> the entity type
 */
public class HistoricalStateLookup<E> {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistoricalStateLookup.class);

    private final LogRecordSource<? super E> source;
    private volatile StateCache cache;
    private volatile Duration cacheTtl;

    /**
     * Creates a lookup reading from the given source, without caching.
     *
     * @param source the log source for entities of type {@code E}
     */
    public HistoricalStateLookup(LogRecordSource<? super E> source) {
        this.source = Objects.requireNonNull(source, "source");
        this.cache = new NoOpStateCache();
        this.cacheTtl = Duration.ofMinutes(5);
    }

    /**
     * Cache object-level results. The cache must be invalidated whenever an entry is appended
     * to the log of a cached entity.
     *
     * @param cache the cache to use
     * @return this lookup
     */
    public HistoricalStateLookup<E> withCache(StateCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
        return this;
    }

    /**
     * @param ttl how long cached results stay valid; zero or negative for no expiry
     * @return this lookup
     */
    public HistoricalStateLookup<E> withCacheTtl(Duration ttl) {
        this.cacheTtl = Objects.requireNonNull(ttl, "ttl");
        return this;
    }

    public LogRecordSource<? super E> getSource() {
        return source;
    }

    /**
     * Get the state of an entity at a given instant.
     *
     * @param entity the entity subject to the historical search
     * @param timestamp the instant the state is requested for
     * @return the fields recorded by the newest log entry at or before {@code timestamp}
     */
    public HistoricalObjectState getObjectStateAtTimestamp(E entity, Instant timestamp) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(timestamp, "timestamp");

        StateCache currentCache = cache;
        StateCacheKey cacheKey = null;
        if (!(currentCache instanceof NoOpStateCache)) {
            cacheKey = new StateCacheKey(source.keyOf(entity), timestamp);
            Optional<HistoricalObjectState> cached = currentCache.get(cacheKey);
            if (cached.isPresent()) {
                LOGGER.debug("Cache hit for {}", cacheKey);
                return cached.get();
            }
        }

        HistoricalObjectState state = resolveObjectState(entity, timestamp);
        if (cacheKey != null) {
            currentCache.put(cacheKey, state, cacheTtl);
        }
        return state;
    }

    /**
     * Get the value of one field of an entity at a given instant.
     *
     * @param entity the entity subject to the historical search
     * @param fieldName the field (column) name as recorded in the snapshot
     * @param timestamp the instant the value is requested for
     * @return the field's value recorded by the newest log entry at or before {@code timestamp}
     */
    public HistoricalFieldState getFieldStateAtTimestamp(E entity, String fieldName, Instant timestamp) {
        Objects.requireNonNull(fieldName, "fieldName");
        HistoricalObjectState objectState = getObjectStateAtTimestamp(entity, timestamp);

        if (!objectState.logFound()) {
            return HistoricalFieldState.logNotFound(fieldName);
        }

        Instant logTimestamp = objectState.timestamp().orElseThrow();
        long logEntryId = objectState.logEntryId().orElseThrow();
        Optional<Map<String, Object>> fields = objectState.serializedFields();

        if (fields.isEmpty() || !fields.get().containsKey(fieldName)) {
            return HistoricalFieldState.fieldNotFound(fieldName, logTimestamp, logEntryId);
        }
        return HistoricalFieldState.found(fieldName, fields.get().get(fieldName), logTimestamp, logEntryId);
    }

    /**
     * Load the full log entry an object lookup selected. Issues a separate read against the source.
     */
    public Optional<LogEntry> fetchLogEntry(HistoricalObjectState state) {
        return fetch(state.logEntryId());
    }

    /**
     * Load the full log entry a field lookup selected. Issues a separate read against the source.
     */
    public Optional<LogEntry> fetchLogEntry(HistoricalFieldState state) {
        return fetch(state.logEntryId());
    }

    private Optional<LogEntry> fetch(OptionalLong logEntryId) {
        if (logEntryId.isEmpty()) {
            return Optional.empty();
        }
        return source.fetch(logEntryId.getAsLong());
    }

    private HistoricalObjectState resolveObjectState(E entity, Instant timestamp) {
        Optional<LogEntry> selected = source.recordsFor(entity)
                .notAfter(timestamp)
                .newestFirst()
                .first();

        if (selected.isEmpty()) {
            LOGGER.debug("No log entry at or before {} for {}", timestamp, entity);
            return HistoricalObjectState.notFound();
        }

        LogEntry entry = selected.get();
        Map<String, Object> fields = SerializedFields.decode(entry.serializedData()).orElse(null);
        if (fields == null && entry.serializedData() != null) {
            LOGGER.debug("Log entry {} carries no usable fields", entry.id());
        }
        LOGGER.debug("Selected log entry {} ({}) for {} at {}", entry.id(), entry.timestamp(), entry.entityKey(), timestamp);
        return HistoricalObjectState.found(fields, entry.timestamp(), entry.id());
    }
}
