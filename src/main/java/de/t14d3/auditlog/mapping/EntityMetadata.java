package de.t14d3.auditlog.mapping;

import de.t14d3.auditlog.annotations.Column;
import de.t14d3.auditlog.annotations.Entity;
import de.t14d3.auditlog.annotations.Id;
import de.t14d3.auditlog.annotations.Table;

import java.lang.reflect.Field;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds metadata information about an entity class using reflection.
 * <p>
 * Only what is needed to identify an entity in the audit log is kept: the table name
 * (the log's content type), the id field and the column names the snapshot fields are
 * recorded under.
 */
public class EntityMetadata {
    private static final Map<Class<?>, EntityMetadata> METADATA_CACHE = new ConcurrentHashMap<>();

    private final String tableName;
    private final Field idField;
    private final List<Field> fields;
    private final Map<Field, String> fieldToColumn;

    private EntityMetadata(Class<?> entityClass) {
        if (!entityClass.isAnnotationPresent(Entity.class)) {
            throw new IllegalArgumentException("Class " + entityClass.getName() + " is not annotated with @Entity");
        }

        Table tableAnnotation = entityClass.getAnnotation(Table.class);
        this.tableName = (tableAnnotation != null) ? tableAnnotation.name() : entityClass.getSimpleName().toLowerCase();

        this.fields = new ArrayList<>();
        this.fieldToColumn = new HashMap<>();
        Field foundIdField = null;

        for (Field field : entityClass.getDeclaredFields()) {
            boolean isId = field.isAnnotationPresent(Id.class);
            if (!isId && !field.isAnnotationPresent(Column.class)) {
                continue;
            }
            field.setAccessible(true);

            Column column = field.getAnnotation(Column.class);
            String columnName = column != null ? column.name() : field.getName();
            fields.add(field);
            fieldToColumn.put(field, columnName);

            if (isId) {
                foundIdField = field;
            }
        }

        if (foundIdField == null) {
            throw new IllegalArgumentException("Entity " + entityClass.getName() + " must have a field annotated with @Id");
        }

        this.idField = foundIdField;
    }

    /**
     * Get or create metadata for the given entity class.
     */
    public static EntityMetadata of(Class<?> entityClass) {
        return METADATA_CACHE.computeIfAbsent(entityClass, EntityMetadata::new);
    }

    public String getTableName() {
        return tableName;
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public String getColumnName(Field field) {
        return fieldToColumn.get(field);
    }

    /**
     * Gets the ID value from an entity instance.
     */
    public Object getIdValue(Object entity) {
        return getValue(idField, entity);
    }

    public Object getValue(Field field, Object entity) {
        try {
            return field.get(entity);
        } catch (IllegalAccessException e) {
            throw new RuntimeException("Cannot access field " + field.getName(), e);
        }
    }
}
