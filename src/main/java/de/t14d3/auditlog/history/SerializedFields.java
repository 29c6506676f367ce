package de.t14d3.auditlog.history;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import de.t14d3.auditlog.mapping.EntityMetadata;

import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes the {@code fields} mapping of a serialized snapshot.
 * <p>
 * A snapshot has the shape {@code {"model": ..., "pk": ..., "fields": {name: value, ...}}}.
 * Anything else degrades to "no fields":
 * <ul>
 *   <li>null, blank or unparsable text</li>
 *   <li>a JSON value that is not an object</li>
 *   <li>a missing or null {@code fields} member, or one that is not an object</li>
 *   <li>an empty {@code fields} object</li>
 * </ul>
 * Integral numbers decode to {@link Long}, other numbers to {@link Double}.
 */
public final class SerializedFields {
    public static final String FIELDS_KEY = "fields";

    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .serializeNulls()
            .create();
    private static final Type FIELDS_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private SerializedFields() {
    }

    /**
     * @return a fresh unmodifiable copy of the fields, or empty if the snapshot carries none
     */
    public static Optional<Map<String, Object>> decode(String serializedData) {
        if (serializedData == null || serializedData.isBlank()) {
            return Optional.empty();
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(serializedData);
        } catch (JsonParseException e) {
            return Optional.empty();
        }
        if (!root.isJsonObject()) {
            return Optional.empty();
        }

        JsonElement fields = root.getAsJsonObject().get(FIELDS_KEY);
        if (fields == null || !fields.isJsonObject()) {
            return Optional.empty();
        }

        Map<String, Object> decoded = GSON.fromJson(fields, FIELDS_TYPE);
        // an empty mapping is reported as no mapping at all
        if (decoded == null || decoded.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(decoded)));
    }

    /**
     * Encode a field mapping in snapshot form, e.g. to append entries to a log store.
     */
    public static String encode(String model, Object pk, Map<String, ?> fields) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("model", model);
        snapshot.put("pk", pk);
        snapshot.put(FIELDS_KEY, fields);
        return GSON.toJson(snapshot);
    }

    /**
     * Encode the current {@code @Id} and {@code @Column} values of an entity, keyed by column name.
     */
    public static String snapshot(Object entity) {
        EntityMetadata metadata = EntityMetadata.of(entity.getClass());
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Field field : metadata.getFields()) {
            fields.put(metadata.getColumnName(field), metadata.getValue(field, entity));
        }
        return encode(metadata.getTableName(), metadata.getIdValue(entity), fields);
    }
}
