package de.t14d3.auditlog.query;

/**
 * SQL database dialects for identifier quoting and the column types of the log table.
 */
public enum Dialect {
    GENERIC,
    MYSQL,
    POSTGRESQL,
    SQLITE,
    H2;

    /**
     * Quote an identifier based on the dialect.
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.trim().isEmpty()) {
            return identifier;
        }

        return switch (this) {
            case MYSQL -> "`" + identifier.replace("`", "``") + "`";
            case POSTGRESQL, SQLITE -> "\"" + identifier.replace("\"", "\"\"") + "\"";
            case H2 -> ("\"" + identifier.replace("\"", "\"\"") + "\"").toUpperCase();
            default ->
                // No quoting for generic
                    identifier;
        };
    }

    /**
     * Column definition of a generated BIGINT primary key.
     */
    public String identityColumnDefinition() {
        return switch (this) {
            case POSTGRESQL -> "BIGSERIAL PRIMARY KEY";
            case SQLITE -> "INTEGER PRIMARY KEY AUTOINCREMENT";
            case H2, MYSQL, GENERIC -> "BIGINT AUTO_INCREMENT PRIMARY KEY";
        };
    }

    /**
     * Column type for unbounded text such as serialized snapshots.
     */
    public String largeTextType() {
        return switch (this) {
            case MYSQL -> "LONGTEXT";
            case POSTGRESQL, SQLITE -> "TEXT";
            case H2, GENERIC -> "CLOB";
        };
    }

    /**
     * Column type for log timestamps. Instants are stored as UTC offsets, so the JVM's default zone
     * never takes part; all types keep microseconds.
     */
    public String timestampType() {
        return switch (this) {
            case MYSQL -> "DATETIME(6)";
            case SQLITE -> "TEXT";
            case H2, POSTGRESQL, GENERIC -> "TIMESTAMP(6) WITH TIME ZONE";
        };
    }

    /**
     * Detect dialect from JDBC URL.
     */
    public static Dialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) return GENERIC;

        String lowerUrl = jdbcUrl.toLowerCase();
        if (lowerUrl.contains("mysql")) return MYSQL;
        if (lowerUrl.contains("postgresql") || lowerUrl.contains("postgres")) return POSTGRESQL;
        if (lowerUrl.contains("sqlite")) return SQLITE;
        if (lowerUrl.contains("h2")) return H2;

        return GENERIC;
    }
}
