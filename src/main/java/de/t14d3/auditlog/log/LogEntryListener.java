package de.t14d3.auditlog.log;

/**
 * Notified after a log entry has been appended to a store.
 */
@FunctionalInterface
public interface LogEntryListener {
    void onAppend(LogEntry entry);
}
