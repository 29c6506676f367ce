package de.t14d3.auditlog.log.jdbc;

import de.t14d3.auditlog.core.SqlExecutor;
import de.t14d3.auditlog.exceptions.AuditlogException;
import de.t14d3.auditlog.log.EntityKey;
import de.t14d3.auditlog.log.LogAction;
import de.t14d3.auditlog.log.LogEntry;
import de.t14d3.auditlog.log.LogEntryListener;
import de.t14d3.auditlog.log.LogEntryQuery;
import de.t14d3.auditlog.log.LogRecordSource;
import de.t14d3.auditlog.query.Dialect;
import de.t14d3.auditlog.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stores log entries in a table of the application database.
 *
 * The table is created on first use. Appends run on the store's connection, so when the caller
 * manages a transaction on that connection, entries become visible to other connections only after
 * commit. Point-in-time reads are a single indexed SELECT with {@code LIMIT 1}.
 */
public final class JdbcLogEntryStore implements LogRecordSource<Object>, AutoCloseable {
    public static final String TABLE = "auditlog_logentry";
    /**
     * Resolution of stored timestamps. Appended entries and query bounds are truncated to it.
     */
    public static final ChronoUnit TIMESTAMP_PRECISION = ChronoUnit.MICROS;

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcLogEntryStore.class);
    private static final String[] COLUMNS = {"id", "content_type", "object_pk", "action", "timestamp", "serialized_data"};

    private final SqlExecutor executor;
    private final Dialect dialect;
    private final String table;
    private final boolean ownsConnection;
    private final List<LogEntryListener> listeners;
    private volatile boolean schemaEnsured;

    /**
     * Open a connection to the given database and use the default table.
     */
    public static JdbcLogEntryStore connect(String jdbcUrl) {
        return connect(jdbcUrl, TABLE);
    }

    public static JdbcLogEntryStore connect(String jdbcUrl, String table) {
        try {
            Connection connection = DriverManager.getConnection(jdbcUrl);
            return new JdbcLogEntryStore(connection, Dialect.detectFromUrl(jdbcUrl), table, true);
        } catch (SQLException e) {
            throw new AuditlogException("Failed to open log store connection", e);
        }
    }

    public JdbcLogEntryStore(Connection connection, Dialect dialect) {
        this(connection, dialect, TABLE);
    }

    public JdbcLogEntryStore(Connection connection, Dialect dialect, String table) {
        this(connection, dialect, table, false);
    }

    private JdbcLogEntryStore(Connection connection, Dialect dialect, String table, boolean ownsConnection) {
        Objects.requireNonNull(connection, "connection");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.executor = new SqlExecutor(connection);
        this.table = Objects.requireNonNull(table, "table");
        this.ownsConnection = ownsConnection;
        this.listeners = new CopyOnWriteArrayList<>();
        this.schemaEnsured = false;
    }

    public String getTable() {
        return table;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public JdbcLogEntryStore addListener(LogEntryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    /**
     * Append a snapshot of the given entity (or {@link EntityKey}).
     *
     * @return the stored entry with its generated id and its timestamp truncated to {@link #TIMESTAMP_PRECISION}
     */
    public LogEntry append(Object entity, LogAction action, Instant timestamp, String serializedData) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
        ensureSchema();

        EntityKey key = EntityKey.of(entity);
        Instant stored = timestamp.truncatedTo(TIMESTAMP_PRECISION);
        Query insert = Query.insertInto(dialect, table)
                .value("content_type", key.contentType())
                .value("object_pk", key.objectPk())
                .value("action", action)
                .value("timestamp", stored)
                .value("serialized_data", serializedData)
                .build();

        Object generated = executor.executeInsert(insert);
        if (!(generated instanceof Number number)) {
            throw new AuditlogException("No generated id returned for log entry of " + key);
        }

        LogEntry entry = new LogEntry(number.longValue(), key, action, stored, serializedData);
        LOGGER.debug("Appended log entry {} for {} at {}", entry.id(), key, stored);
        for (LogEntryListener listener : listeners) {
            listener.onAppend(entry);
        }
        return entry;
    }

    @Override
    public EntityKey keyOf(Object entity) {
        return EntityKey.of(entity);
    }

    @Override
    public LogEntryQuery recordsFor(Object entity) {
        return new JdbcQuery(keyOf(entity), null, false);
    }

    @Override
    public Optional<LogEntry> fetch(long logEntryId) {
        ensureSchema();
        Query query = Query.select(dialect, COLUMNS)
                .from(table)
                .whereColumn("id", "=", logEntryId)
                .build();
        return executor.query(query, JdbcLogEntryStore::mapRow).stream().findFirst();
    }

    /**
     * Read entries appended after the given id, oldest first.
     */
    public List<LogEntry> readSince(long lastId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        ensureSchema();
        Query query = Query.select(dialect, COLUMNS)
                .from(table)
                .whereColumn("id", ">", lastId)
                .orderBy("id", false)
                .limit(limit)
                .build();
        return executor.query(query, JdbcLogEntryStore::mapRow);
    }

    public long currentMaxId() {
        ensureSchema();
        Query query = Query.select(dialect)
                .expression("COALESCE(MAX(" + dialect.quoteIdentifier("id") + "), 0)", "max_id")
                .from(table)
                .build();
        List<Long> rows = executor.query(query, rs -> rs.getLong("max_id"));
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    public synchronized void ensureSchema() {
        if (schemaEnsured) {
            return;
        }
        createTableIfMissing();
        schemaEnsured = true;
        LOGGER.info("Log table {} ready ({})", table, dialect);
    }

    private void createTableIfMissing() {
        String sql = "CREATE TABLE IF NOT EXISTS " + dialect.quoteIdentifier(table) + " (" +
                dialect.quoteIdentifier("id") + " " + dialect.identityColumnDefinition() + ", " +
                dialect.quoteIdentifier("content_type") + " VARCHAR(255) NOT NULL, " +
                dialect.quoteIdentifier("object_pk") + " VARCHAR(255) NOT NULL, " +
                dialect.quoteIdentifier("action") + " VARCHAR(16) NOT NULL, " +
                dialect.quoteIdentifier("timestamp") + " " + dialect.timestampType() + " NOT NULL, " +
                dialect.quoteIdentifier("serialized_data") + " " + dialect.largeTextType() +
                ")";
        executor.execute(sql, List.of());

        // Not all dialects support CREATE INDEX IF NOT EXISTS; an existing index is expected here.
        String index = "CREATE INDEX " + dialect.quoteIdentifier(table + "_entity_ts_idx") + " ON " + dialect.quoteIdentifier(table) + " (" +
                dialect.quoteIdentifier("content_type") + ", " + dialect.quoteIdentifier("object_pk") + ", " +
                dialect.quoteIdentifier("timestamp") + ")";
        try {
            executor.execute(index, List.of());
        } catch (AuditlogException e) {
            LOGGER.debug("Index on {} not created: {}", table, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    private static LogEntry mapRow(ResultSet rs) throws SQLException {
        EntityKey key = new EntityKey(rs.getString("content_type"), rs.getString("object_pk"));
        return new LogEntry(
                rs.getLong("id"),
                key,
                LogAction.valueOf(rs.getString("action")),
                rs.getObject("timestamp", OffsetDateTime.class).toInstant(),
                rs.getString("serialized_data"));
    }

    @Override
    public void close() {
        if (!ownsConnection) {
            return;
        }
        try {
            executor.getConnection().close();
        } catch (SQLException e) {
            throw new AuditlogException("Failed to close log store connection", e);
        }
    }

    private final class JdbcQuery implements LogEntryQuery {
        private final EntityKey key;
        private final Instant notAfter;
        private final boolean newestFirst;

        private JdbcQuery(EntityKey key, Instant notAfter, boolean newestFirst) {
            this.key = key;
            this.notAfter = notAfter;
            this.newestFirst = newestFirst;
        }

        @Override
        public LogEntryQuery notAfter(Instant timestamp) {
            return new JdbcQuery(key, Objects.requireNonNull(timestamp, "timestamp"), newestFirst);
        }

        @Override
        public LogEntryQuery newestFirst() {
            return new JdbcQuery(key, notAfter, true);
        }

        @Override
        public Optional<LogEntry> first() {
            return run(build().limit(1).build()).stream().findFirst();
        }

        @Override
        public List<LogEntry> list() {
            return run(build().build());
        }

        private Query.SelectBuilder build() {
            Query.SelectBuilder builder = Query.select(dialect, COLUMNS)
                    .from(table)
                    .whereColumn("content_type", "=", key.contentType())
                    .whereColumn("object_pk", "=", key.objectPk());
            if (notAfter != null) {
                // stored values are truncated, so flooring the bound keeps "<=" exact
                builder.whereColumn("timestamp", "<=", notAfter.truncatedTo(TIMESTAMP_PRECISION));
            }
            if (newestFirst) {
                builder.orderBy("timestamp", true).orderBy("id", true);
            } else {
                // append order
                builder.orderBy("id", false);
            }
            return builder;
        }

        private List<LogEntry> run(Query query) {
            ensureSchema();
            return executor.query(query, JdbcLogEntryStore::mapRow);
        }
    }
}
