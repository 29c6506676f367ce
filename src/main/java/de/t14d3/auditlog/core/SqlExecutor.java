package de.t14d3.auditlog.core;

import de.t14d3.auditlog.exceptions.AuditlogException;
import de.t14d3.auditlog.query.Query;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes SQL queries built with {@link Query} and maps result rows.
 *
 * Responsible for:
 *  - executing parameterized SQL statements
 *  - mapping result sets through a {@link RowMapper}
 *  - handling generated keys for inserts
 *
 * Every {@link SQLException} is rethrown as an {@link AuditlogException} carrying the SQL.
 */
public class SqlExecutor {
    private final Connection connection;

    /**
     * Maps the current row of a result set.
     */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    public SqlExecutor(Connection connection) {
        this.connection = connection;
    }

    public Connection getConnection() {
        return connection;
    }

    public void execute(String sql, List<Object> params) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, params);
            stmt.execute();
        } catch (SQLException e) {
            throw new AuditlogException("Failed to execute SQL: " + sql + " params=" + params, e);
        }
    }

    public Object executeInsert(Query query) {
        String sql = query.getSql();
        try (PreparedStatement stmt = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            setParameters(stmt, query.getParameters());
            stmt.executeUpdate();

            try (ResultSet rs = stmt.getGeneratedKeys()) {
                if (rs.next()) {
                    return rs.getObject(1);
                }
            }
            return null;
        } catch (SQLException e) {
            throw new AuditlogException("Failed to execute INSERT: " + query, e);
        }
    }

    public <T> List<T> query(Query query, RowMapper<T> mapper) {
        List<T> results = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(query.getSql())) {
            setParameters(stmt, query.getParameters());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new AuditlogException("Failed to execute query: " + query, e);
        }
    }

    // ---------------------------------------------------------------------
    // PreparedStatement parameter binding with simple type handling
    // ---------------------------------------------------------------------

    public static PreparedStatement setParameters(PreparedStatement stmt, List<Object> params) throws SQLException {
        if (params == null || params.isEmpty()) return stmt;

        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            int idx = i + 1;

            if (p == null) {
                stmt.setNull(idx, Types.NULL);
            } else if (p instanceof String s) {
                stmt.setString(idx, s);
            } else if (p instanceof Long l) {
                stmt.setLong(idx, l);
            } else if (p instanceof Instant instant) {
                // bound with an explicit offset so the session and JVM zones never apply
                stmt.setObject(idx, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
            } else if (p instanceof Enum<?> anEnum) {
                stmt.setString(idx, anEnum.name());
            } else {
                // fallback - let JDBC try to handle it
                stmt.setObject(idx, p);
            }
        }
        return stmt;
    }
}
