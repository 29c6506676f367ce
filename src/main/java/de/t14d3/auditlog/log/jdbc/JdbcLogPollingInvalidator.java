package de.t14d3.auditlog.log.jdbc;

import de.t14d3.auditlog.cache.StateCache;
import de.t14d3.auditlog.log.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls a {@link JdbcLogEntryStore} for newly appended entries and invalidates a local {@link StateCache}.
 *
 * Keeps caches fresh when other processes write to the same log table.
 */
public final class JdbcLogPollingInvalidator implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcLogPollingInvalidator.class);
    private static final int BATCH_SIZE = 500;
    private static final long JOIN_TIMEOUT_MILLIS = 5_000L;

    private final JdbcLogEntryStore store;
    private final StateCache cache;
    private final Duration pollInterval;
    private final AtomicBoolean running;
    private volatile Thread thread;
    private volatile long lastSeenId;

    /**
     * Open a dedicated connection to the database holding the default log table.
     */
    public static JdbcLogPollingInvalidator connect(String jdbcUrl, StateCache cache, Duration pollInterval) {
        return new JdbcLogPollingInvalidator(JdbcLogEntryStore.connect(jdbcUrl), cache, pollInterval);
    }

    /**
     * @param store a store on a connection reserved for polling; closed with this invalidator
     */
    public JdbcLogPollingInvalidator(JdbcLogEntryStore store, StateCache cache, Duration pollInterval) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.running = new AtomicBoolean(false);
        this.lastSeenId = 0L;
    }

    /**
     * Start polling. Entries appended before this call are considered seen.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        lastSeenId = store.currentMaxId();
        thread = new Thread(this::runLoop, "auditlog-cache-invalidation");
        thread.setDaemon(true);
        thread.start();
        LOGGER.info("Polling {} every {} ms from id {}", store.getTable(), pollInterval.toMillis(), lastSeenId);
    }

    /**
     * Read and apply all entries appended since the last poll.
     *
     * @return the number of entries processed
     */
    public synchronized int pollOnce() {
        int processed = 0;
        List<LogEntry> batch;
        do {
            batch = store.readSince(lastSeenId, BATCH_SIZE);
            for (LogEntry entry : batch) {
                lastSeenId = Math.max(lastSeenId, entry.id());
                cache.invalidate(entry.entityKey());
            }
            processed += batch.size();
        } while (batch.size() == BATCH_SIZE);

        if (processed > 0) {
            LOGGER.debug("Invalidated cached states for {} appended entries, last id {}", processed, lastSeenId);
        }
        return processed;
    }

    public long getLastSeenId() {
        return lastSeenId;
    }

    private void runLoop() {
        while (running.get()) {
            try {
                pollOnce();
                Thread.sleep(Math.max(1L, pollInterval.toMillis()));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                // retried on the next tick
                LOGGER.warn("Polling {} failed: {}", store.getTable(), e.getMessage(), e);
                try {
                    Thread.sleep(Math.max(1L, pollInterval.toMillis()));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    @Override
    public void close() {
        running.set(false);
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(JOIN_TIMEOUT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        store.close();
        LOGGER.info("Stopped polling {}", store.getTable());
    }
}
