package de.t14d3.auditlog.exceptions;

/**
 * Raised when the log store fails, e.g. a JDBC error while reading or appending entries.
 * <p>
 * A missing log entry or field is never reported through this exception; lookups encode
 * those outcomes in their result objects.
 */
public class AuditlogException extends RuntimeException {
    public AuditlogException(String message) {
        super(message);
    }

    public AuditlogException(Throwable cause) {
        super(cause);
    }

    public AuditlogException(String message, Throwable cause) {
        super(message, cause);
    }
}
