package de.t14d3.auditlog.log;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable snapshot record of an entity, written once by the log store.
 * <p>
 * {@code serializedData} holds the JSON snapshot taken at {@code timestamp}, normally of the
 * form {@code {"model": ..., "pk": ..., "fields": {...}}}. It may be null or malformed; readers
 * decode it through {@link de.t14d3.auditlog.history.SerializedFields}.
 */
public final class LogEntry {

    /**
     * Newest first: timestamp descending, then id descending for entries sharing a timestamp.
     */
    public static final Comparator<LogEntry> NEWEST_FIRST =
            Comparator.comparing(LogEntry::timestamp).thenComparingLong(LogEntry::id).reversed();

    private final long id;
    private final EntityKey entityKey;
    private final LogAction action;
    private final Instant timestamp;
    private final String serializedData;

    public LogEntry(long id, EntityKey entityKey, LogAction action, Instant timestamp, String serializedData) {
        this.id = id;
        this.entityKey = Objects.requireNonNull(entityKey, "entityKey");
        this.action = Objects.requireNonNull(action, "action");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.serializedData = serializedData;
    }

    public long id() {
        return id;
    }

    public EntityKey entityKey() {
        return entityKey;
    }

    public LogAction action() {
        return action;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * @return the raw snapshot JSON, or null if none was recorded
     */
    public String serializedData() {
        return serializedData;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogEntry other)) return false;
        return id == other.id
                && entityKey.equals(other.entityKey)
                && action == other.action
                && timestamp.equals(other.timestamp)
                && Objects.equals(serializedData, other.serializedData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityKey, action, timestamp, serializedData);
    }

    @Override
    public String toString() {
        return "LogEntry{id=" + id + ", entity=" + entityKey + ", action=" + action + ", timestamp=" + timestamp + "}";
    }
}
