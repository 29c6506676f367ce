package de.t14d3.auditlog.log;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A query over the log entries of one entity.
 *
 * Queries are immutable: refining methods return a new query and leave this one unchanged.
 * Nothing is read from the store until {@link #first()} or {@link #list()} is called.
 */
public interface LogEntryQuery {

    /**
     * Restrict to entries whose timestamp is at or before the given instant.
     */
    LogEntryQuery notAfter(Instant timestamp);

    /**
     * Order by timestamp descending; entries with equal timestamps are ordered by id descending.
     */
    LogEntryQuery newestFirst();

    /**
     * @return the first matching entry in query order, or empty if none matches
     */
    Optional<LogEntry> first();

    List<LogEntry> list();
}
