package de.t14d3.auditlog.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies the table name for an entity.
 * <p>
 * The table name doubles as the content type under which log entries of the entity are
 * stored. If not specified, it defaults to the lower-cased simple class name.
 *
 * @see Entity
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Table {
    /**
     * The name of the database table.
     */
    String name();
}
