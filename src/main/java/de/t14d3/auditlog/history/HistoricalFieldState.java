package de.t14d3.auditlog.history;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Value of a single entity field as recorded by the newest log entry at or before a point in time.
 * <p>
 * {@link #fieldFound()} implies {@link #logFound()}. The field name is always present; timestamp
 * and log entry id are present exactly when a log entry was found.
 */
public final class HistoricalFieldState {
    private final boolean logFound;
    private final boolean fieldFound;
    private final String fieldName;
    private final Object value;
    private final Instant timestamp;
    private final long logEntryId;

    private HistoricalFieldState(boolean logFound, boolean fieldFound, String fieldName, Object value,
                                 Instant timestamp, long logEntryId) {
        this.logFound = logFound;
        this.fieldFound = fieldFound;
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.value = value;
        this.timestamp = timestamp;
        this.logEntryId = logEntryId;
    }

    public static HistoricalFieldState logNotFound(String fieldName) {
        return new HistoricalFieldState(false, false, fieldName, null, null, 0L);
    }

    public static HistoricalFieldState fieldNotFound(String fieldName, Instant timestamp, long logEntryId) {
        return new HistoricalFieldState(true, false, fieldName, null, Objects.requireNonNull(timestamp, "timestamp"), logEntryId);
    }

    public static HistoricalFieldState found(String fieldName, Object value, Instant timestamp, long logEntryId) {
        return new HistoricalFieldState(true, true, fieldName, value, Objects.requireNonNull(timestamp, "timestamp"), logEntryId);
    }

    public boolean logFound() {
        return logFound;
    }

    public boolean fieldFound() {
        return fieldFound;
    }

    public String fieldName() {
        return fieldName;
    }

    /**
     * The recorded value. Null when the field was not found, and also when the snapshot
     * recorded null for it; use {@link #fieldFound()} to tell the two apart.
     */
    public Object value() {
        return value;
    }

    public Optional<Instant> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    public OptionalLong logEntryId() {
        return logFound ? OptionalLong.of(logEntryId) : OptionalLong.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistoricalFieldState other)) return false;
        return logFound == other.logFound
                && fieldFound == other.fieldFound
                && logEntryId == other.logEntryId
                && fieldName.equals(other.fieldName)
                && Objects.equals(value, other.value)
                && Objects.equals(timestamp, other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logFound, fieldFound, fieldName, value, timestamp, logEntryId);
    }

    @Override
    public String toString() {
        return "HistoricalFieldState{logFound=" + logFound + ", fieldFound=" + fieldFound + ", fieldName=" + fieldName
                + (fieldFound ? ", value=" + value : "")
                + (logFound ? ", logEntryId=" + logEntryId + ", timestamp=" + timestamp : "") + "}";
    }
}
