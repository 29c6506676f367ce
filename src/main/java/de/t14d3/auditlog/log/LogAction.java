package de.t14d3.auditlog.log;

/**
 * The kind of change a log entry records.
 */
public enum LogAction {
    CREATE,
    UPDATE,
    DELETE,
    ACCESS
}
