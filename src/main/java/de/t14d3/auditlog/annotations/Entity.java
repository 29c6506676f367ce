package de.t14d3.auditlog.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a tracked entity whose changes are recorded in the audit log.
 * <p>
 * Instances of an @Entity class are identified in the log by their table name and
 * primary key value. Annotated classes can be registered for history lookups in bulk
 * by scanning a package.
 *
 * @see Table
 * @see Id
 * @see de.t14d3.auditlog.history.HistoryRegistry#registerAnnotated
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Entity {
}
