package de.t14d3.auditlog.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A parameterized SQL statement against the log table, built with {@link #select} or {@link #insertInto}.
 * <p>
 * Column and table names are quoted for the dialect; values are always bound as parameters.
 */
public final class Query {
    private final String sql;
    private final List<Object> parameters;

    private Query(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = new ArrayList<>(parameters);
    }

    public String getSql() {
        return sql;
    }

    /**
     * @return a copy of the values to bind, in placeholder order
     */
    public List<Object> getParameters() {
        return new ArrayList<>(parameters);
    }

    public static SelectBuilder select(Dialect dialect, String... columns) {
        return new SelectBuilder(dialect, columns);
    }

    public static InsertBuilder insertInto(Dialect dialect, String table) {
        return new InsertBuilder(dialect, table);
    }

    @Override
    public String toString() {
        return sql + " params=" + parameters;
    }

    public static final class SelectBuilder {
        private final Dialect dialect;
        private final List<String> columns = new ArrayList<>();
        private final List<String> conditions = new ArrayList<>();
        private final List<String> ordering = new ArrayList<>();
        private final List<Object> parameters = new ArrayList<>();
        private String table;
        private Integer limit;

        private SelectBuilder(Dialect dialect, String... columns) {
            this.dialect = Objects.requireNonNull(dialect, "dialect");
            for (String column : columns) {
                this.columns.add(dialect.quoteIdentifier(column));
            }
        }

        /**
         * Select a raw SQL expression, e.g. an aggregate, under the given alias.
         */
        public SelectBuilder expression(String expression, String alias) {
            columns.add(expression + " AS " + alias);
            return this;
        }

        public SelectBuilder from(String table) {
            this.table = table;
            return this;
        }

        /**
         * Add {@code column operator ?}. Conditions are joined with AND.
         */
        public SelectBuilder whereColumn(String column, String operator, Object value) {
            conditions.add(dialect.quoteIdentifier(column) + " " + operator + " ?");
            parameters.add(value);
            return this;
        }

        public SelectBuilder orderBy(String column, boolean descending) {
            ordering.add(dialect.quoteIdentifier(column) + (descending ? " DESC" : " ASC"));
            return this;
        }

        public SelectBuilder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be > 0");
            }
            this.limit = limit;
            return this;
        }

        public Query build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("SELECT query must specify columns");
            }
            if (table == null) {
                throw new IllegalStateException("SELECT query must specify a table");
            }

            StringBuilder sql = new StringBuilder("SELECT ")
                    .append(String.join(", ", columns))
                    .append(" FROM ").append(dialect.quoteIdentifier(table));
            if (!conditions.isEmpty()) {
                sql.append(" WHERE ").append(String.join(" AND ", conditions));
            }
            if (!ordering.isEmpty()) {
                sql.append(" ORDER BY ").append(String.join(", ", ordering));
            }
            if (limit != null) {
                sql.append(" LIMIT ").append(limit);
            }
            return new Query(sql.toString(), parameters);
        }
    }

    public static final class InsertBuilder {
        private final Dialect dialect;
        private final String table;
        private final List<String> columns = new ArrayList<>();
        private final List<Object> values = new ArrayList<>();

        private InsertBuilder(Dialect dialect, String table) {
            this.dialect = Objects.requireNonNull(dialect, "dialect");
            this.table = Objects.requireNonNull(table, "table");
        }

        public InsertBuilder value(String column, Object value) {
            columns.add(dialect.quoteIdentifier(column));
            values.add(value);
            return this;
        }

        public Query build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("INSERT query must specify values");
            }
            String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
            String sql = "INSERT INTO " + dialect.quoteIdentifier(table)
                    + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
            return new Query(sql, values);
        }
    }
}
