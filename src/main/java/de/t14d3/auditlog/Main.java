package de.t14d3.auditlog;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import de.t14d3.auditlog.history.HistoricalFieldState;
import de.t14d3.auditlog.history.HistoricalObjectState;
import de.t14d3.auditlog.history.HistoricalStateLookup;
import de.t14d3.auditlog.log.EntityKey;
import de.t14d3.auditlog.log.LogEntry;
import de.t14d3.auditlog.log.jdbc.JdbcLogEntryStore;

import java.io.PrintStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * Auditlog CLI - point-in-time queries against a log table.
 *
 * Usage:
 *   java -cp ... de.t14d3.auditlog.Main [command] [options]
 *
 * Commands:
 *   object --type <t> --pk <pk> [--at <instant>]                 - State of an entity at an instant
 *   field --type <t> --pk <pk> --field <f> [--at <instant>]      - Value of one field at an instant
 *   show --id <id>                                               - Print a stored log entry
 *   help                                                         - Show this help message
 *
 * Options:
 *   --db-url <url>                - Database URL (default: jdbc:h2:mem:auditlog)
 *   --table <name>                - Log table (default: auditlog_logentry)
 *   --verbose                     - Print stack traces on failure
 */
public class Main {
    private static final String DEFAULT_DB_URL = "jdbc:h2:mem:auditlog";
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run a command and report the exit code instead of terminating the JVM.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printHelp(out);
            return 1;
        }

        String command = args[0].toLowerCase();
        Options options;
        try {
            options = Options.parse(Arrays.copyOfRange(args, 1, args.length));
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            switch (command) {
                case "help":
                case "--help":
                case "-h":
                    printHelp(out);
                    return 0;
                case "object":
                    return handleObject(options, out, err);
                case "field":
                    return handleField(options, out, err);
                case "show":
                    return handleShow(options, out, err);
                default:
                    err.println("Unknown command: " + command);
                    out.println();
                    printHelp(out);
                    return 1;
            }
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            if (options.verbose) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("Auditlog CLI - Point-in-time queries against an audit log table");
        out.println();
        out.println("Usage:");
        out.println("  java -cp ... de.t14d3.auditlog.Main [command] [options]");
        out.println();
        out.println("Commands:");
        out.println("  object --type <t> --pk <pk> [--at <instant>]             - State of an entity at an instant");
        out.println("  field --type <t> --pk <pk> --field <f> [--at <instant>]  - Value of one field at an instant");
        out.println("  show --id <id>                                           - Print a stored log entry");
        out.println("  help                                                     - Show this help message");
        out.println();
        out.println("Options:");
        out.println("  --db-url <url>                 - Database URL (default: " + DEFAULT_DB_URL + ")");
        out.println("  --table <name>                 - Log table (default: " + JdbcLogEntryStore.TABLE + ")");
        out.println("  --at <instant>                 - ISO-8601 instant, e.g. 2024-05-01T12:00:00Z (default: now)");
        out.println("  --verbose                      - Print stack traces on failure");
        out.println();
        out.println("Examples:");
        out.println("  java -cp ... de.t14d3.auditlog.Main object --db-url jdbc:h2:./data --type articles --pk 7 --at 2024-05-01T12:00:00Z");
        out.println("  java -cp ... de.t14d3.auditlog.Main field --type articles --pk 7 --field title");
    }

    private static int handleObject(Options options, PrintStream out, PrintStream err) {
        if (options.type == null || options.pk == null) {
            err.println("Error: object requires --type and --pk");
            return 1;
        }

        try (JdbcLogEntryStore store = JdbcLogEntryStore.connect(options.dbUrl, options.table)) {
            HistoricalStateLookup<EntityKey> lookup = new HistoricalStateLookup<>(store);
            HistoricalObjectState state = lookup.getObjectStateAtTimestamp(options.entityKey(), options.at);

            JsonObject json = new JsonObject();
            json.addProperty("log_found", state.logFound());
            state.timestamp().ifPresent(ts -> json.addProperty("timestamp", ts.toString()));
            state.logEntryId().ifPresent(id -> json.addProperty("log_entry_id", id));
            state.serializedFields().ifPresent(fields -> json.add("serialized_fields", GSON.toJsonTree(fields)));
            out.println(GSON.toJson(json));
        }
        return 0;
    }

    private static int handleField(Options options, PrintStream out, PrintStream err) {
        if (options.type == null || options.pk == null || options.field == null) {
            err.println("Error: field requires --type, --pk and --field");
            return 1;
        }

        try (JdbcLogEntryStore store = JdbcLogEntryStore.connect(options.dbUrl, options.table)) {
            HistoricalStateLookup<EntityKey> lookup = new HistoricalStateLookup<>(store);
            HistoricalFieldState state = lookup.getFieldStateAtTimestamp(options.entityKey(), options.field, options.at);

            JsonObject json = new JsonObject();
            json.addProperty("log_found", state.logFound());
            json.addProperty("field_found", state.fieldFound());
            json.addProperty("field_name", state.fieldName());
            if (state.fieldFound()) {
                json.add("value", GSON.toJsonTree(state.value()));
            }
            state.timestamp().ifPresent(ts -> json.addProperty("timestamp", ts.toString()));
            state.logEntryId().ifPresent(id -> json.addProperty("log_entry_id", id));
            out.println(GSON.toJson(json));
        }
        return 0;
    }

    private static int handleShow(Options options, PrintStream out, PrintStream err) {
        if (options.id == null) {
            err.println("Error: show requires --id");
            return 1;
        }

        try (JdbcLogEntryStore store = JdbcLogEntryStore.connect(options.dbUrl, options.table)) {
            Optional<LogEntry> found = store.fetch(options.id);
            if (found.isEmpty()) {
                err.println("Log entry " + options.id + " not found");
                return 1;
            }

            LogEntry entry = found.get();
            JsonObject json = new JsonObject();
            json.addProperty("id", entry.id());
            json.addProperty("content_type", entry.entityKey().contentType());
            json.addProperty("object_pk", entry.entityKey().objectPk());
            json.addProperty("action", entry.action().name());
            json.addProperty("timestamp", entry.timestamp().toString());
            json.addProperty("serialized_data", entry.serializedData());
            out.println(GSON.toJson(json));
        }
        return 0;
    }

    private static final class Options {
        private String dbUrl = DEFAULT_DB_URL;
        private String table = JdbcLogEntryStore.TABLE;
        private String type;
        private String pk;
        private String field;
        private Long id;
        private Instant at = Instant.now();
        private boolean verbose;

        private static Options parse(String[] args) {
            Options options = new Options();
            int i = 0;
            while (i < args.length) {
                String arg = args[i];
                if ("--verbose".equals(arg)) {
                    options.verbose = true;
                    i++;
                    continue;
                }
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(arg + " requires a value");
                }
                String value = args[i + 1];
                switch (arg) {
                    case "--db-url":
                        options.dbUrl = value;
                        break;
                    case "--table":
                        options.table = value;
                        break;
                    case "--type":
                        options.type = value;
                        break;
                    case "--pk":
                        options.pk = value;
                        break;
                    case "--field":
                        options.field = value;
                        break;
                    case "--id":
                        options.id = parseId(value);
                        break;
                    case "--at":
                        options.at = parseInstant(value);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + arg);
                }
                i += 2;
            }
            return options;
        }

        private static long parseId(String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--id must be a number: " + value);
            }
        }

        private static Instant parseInstant(String value) {
            try {
                return Instant.parse(value);
            } catch (java.time.format.DateTimeParseException e) {
                throw new IllegalArgumentException("--at must be an ISO-8601 instant: " + value);
            }
        }

        private EntityKey entityKey() {
            return new EntityKey(type, pk);
        }
    }
}
