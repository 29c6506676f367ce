package de.t14d3.auditlog.log.memory;

import de.t14d3.auditlog.log.EntityKey;
import de.t14d3.auditlog.log.LogAction;
import de.t14d3.auditlog.log.LogEntry;
import de.t14d3.auditlog.log.LogEntryListener;
import de.t14d3.auditlog.log.LogEntryQuery;
import de.t14d3.auditlog.log.LogRecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Keeps log entries in memory, in append order.
 *
 * Ids are assigned from 1 upwards. Safe for concurrent appends and reads; a query sees the
 * entries present when it is evaluated.
 */
public final class InMemoryLogEntryStore implements LogRecordSource<Object> {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryLogEntryStore.class);

    private final List<LogEntry> entries = new CopyOnWriteArrayList<>();
    private final List<LogEntryListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong(1L);

    /**
     * Append a snapshot of the given entity (or {@link EntityKey}).
     *
     * @return the stored entry with its assigned id
     */
    public LogEntry append(Object entity, LogAction action, Instant timestamp, String serializedData) {
        EntityKey key = EntityKey.of(entity);
        LogEntry entry = new LogEntry(nextId.getAndIncrement(), key, action, timestamp, serializedData);
        entries.add(entry);
        LOGGER.debug("Appended log entry {} for {} at {}", entry.id(), key, timestamp);
        for (LogEntryListener listener : listeners) {
            listener.onAppend(entry);
        }
        return entry;
    }

    public InMemoryLogEntryStore addListener(LogEntryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public EntityKey keyOf(Object entity) {
        return EntityKey.of(entity);
    }

    @Override
    public LogEntryQuery recordsFor(Object entity) {
        return new InMemoryQuery(keyOf(entity), null, false);
    }

    @Override
    public Optional<LogEntry> fetch(long logEntryId) {
        return entries.stream().filter(e -> e.id() == logEntryId).findFirst();
    }

    private final class InMemoryQuery implements LogEntryQuery {
        private final EntityKey key;
        private final Instant notAfter;
        private final boolean newestFirst;

        private InMemoryQuery(EntityKey key, Instant notAfter, boolean newestFirst) {
            this.key = key;
            this.notAfter = notAfter;
            this.newestFirst = newestFirst;
        }

        @Override
        public LogEntryQuery notAfter(Instant timestamp) {
            return new InMemoryQuery(key, Objects.requireNonNull(timestamp, "timestamp"), newestFirst);
        }

        @Override
        public LogEntryQuery newestFirst() {
            return new InMemoryQuery(key, notAfter, true);
        }

        @Override
        public Optional<LogEntry> first() {
            return stream().findFirst();
        }

        @Override
        public List<LogEntry> list() {
            return stream().toList();
        }

        private Stream<LogEntry> stream() {
            Stream<LogEntry> stream = entries.stream().filter(e -> e.entityKey().equals(key));
            if (notAfter != null) {
                stream = stream.filter(e -> !e.timestamp().isAfter(notAfter));
            }
            if (newestFirst) {
                stream = stream.sorted(LogEntry.NEWEST_FIRST);
            }
            return stream;
        }
    }
}
