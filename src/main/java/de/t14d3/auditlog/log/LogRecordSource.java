package de.t14d3.auditlog.log;

import java.util.Optional;

/**
 * Supplies the log entries of entities of type {@code E}.
 * <p>
 * This is the only capability history lookups need from a log store. Implementations decide how
 * entries are stored and associated with entities; they must return consistent results within one
 * query. Failures while querying propagate to the caller unchanged.
 *
 * @param <E> the entity type served
 */
public interface LogRecordSource<E> {

    /**
     * @return the identity under which the entity's entries are logged
     */
    EntityKey keyOf(E entity);

    /**
     * @return an unfiltered, unordered query over the entity's log entries
     */
    LogEntryQuery recordsFor(E entity);

    /**
     * Load a single log entry by id. Used for explicit back-references from lookup results.
     */
    Optional<LogEntry> fetch(long logEntryId);
}
