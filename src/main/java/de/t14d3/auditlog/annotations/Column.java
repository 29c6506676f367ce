package de.t14d3.auditlog.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies the column mapping for a field.
 * <p>
 * The column name is the key a field's value is recorded under in the {@code fields}
 * mapping of a serialized snapshot, so historical field lookups use column names.
 *
 * @see Entity
 * @see Id
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    /**
     * The name of the database column.
     */
    String name();
}
