package de.t14d3.auditlog.history;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * State of an entity as recorded by the newest log entry at or before a point in time.
 * <p>
 * When no such entry exists, {@link #logFound()} is false and every other accessor is empty.
 * When one exists, {@link #timestamp()} and {@link #logEntryId()} are always present, while
 * {@link #serializedFields()} is empty if the entry carried no usable, non-empty field mapping.
 */
public final class HistoricalObjectState {
    private static final HistoricalObjectState NOT_FOUND = new HistoricalObjectState(false, null, null, 0L);

    private final boolean logFound;
    private final Map<String, Object> serializedFields;
    private final Instant timestamp;
    private final long logEntryId;

    private HistoricalObjectState(boolean logFound, Map<String, Object> serializedFields, Instant timestamp, long logEntryId) {
        this.logFound = logFound;
        this.serializedFields = serializedFields;
        this.timestamp = timestamp;
        this.logEntryId = logEntryId;
    }

    /**
     * No log entry exists at or before the requested instant.
     */
    public static HistoricalObjectState notFound() {
        return NOT_FOUND;
    }

    /**
     * @param serializedFields the entry's fields, or null if it had none; an empty map counts as none
     */
    public static HistoricalObjectState found(Map<String, Object> serializedFields, Instant timestamp, long logEntryId) {
        Map<String, Object> fields = null;
        if (serializedFields != null && !serializedFields.isEmpty()) {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(serializedFields));
        }
        return new HistoricalObjectState(true, fields, Objects.requireNonNull(timestamp, "timestamp"), logEntryId);
    }

    public boolean logFound() {
        return logFound;
    }

    /**
     * @return an unmodifiable field-name to value mapping; values may be null
     */
    public Optional<Map<String, Object>> serializedFields() {
        return Optional.ofNullable(serializedFields);
    }

    public Optional<Instant> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    /**
     * @return the id of the selected log entry, usable with {@link HistoricalStateLookup#fetchLogEntry}
     */
    public OptionalLong logEntryId() {
        return logFound ? OptionalLong.of(logEntryId) : OptionalLong.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistoricalObjectState other)) return false;
        return logFound == other.logFound
                && logEntryId == other.logEntryId
                && Objects.equals(serializedFields, other.serializedFields)
                && Objects.equals(timestamp, other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logFound, serializedFields, timestamp, logEntryId);
    }

    @Override
    public String toString() {
        if (!logFound) {
            return "HistoricalObjectState{logFound=false}";
        }
        return "HistoricalObjectState{logFound=true, logEntryId=" + logEntryId + ", timestamp=" + timestamp
                + ", serializedFields=" + serializedFields + "}";
    }
}
