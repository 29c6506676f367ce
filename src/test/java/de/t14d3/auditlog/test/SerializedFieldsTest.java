package de.t14d3.auditlog.test;

import de.t14d3.auditlog.history.SerializedFields;
import de.t14d3.auditlog.test.entities.Article;
import de.t14d3.auditlog.test.entities.Customer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SerializedFieldsTest {

    @Test
    void testDecodesFieldsOfWellFormedSnapshot() {
        Map<String, Object> fields = SerializedFields.decode(
                "{\"model\": \"articles\", \"pk\": 3, \"fields\": {\"title\": \"Hello\", \"views\": 7, \"tags\": [\"a\", \"b\"]}}")
                .orElseThrow();

        assertEquals("Hello", fields.get("title"));
        assertEquals(7L, fields.get("views"));
        assertEquals(List.of("a", "b"), fields.get("tags"));
        assertEquals(List.of("title", "views", "tags"), new ArrayList<>(fields.keySet()));
    }

    @Test
    void testAbsentPayloads() {
        assertTrue(SerializedFields.decode(null).isEmpty());
        assertTrue(SerializedFields.decode("").isEmpty());
        assertTrue(SerializedFields.decode("   ").isEmpty());
    }

    @Test
    void testNonObjectPayloads() {
        assertTrue(SerializedFields.decode("42").isEmpty());
        assertTrue(SerializedFields.decode("\"fields\"").isEmpty());
        assertTrue(SerializedFields.decode("[{\"fields\": {\"a\": 1}}]").isEmpty());
        assertTrue(SerializedFields.decode("null").isEmpty());
    }

    @Test
    void testUnparsablePayload() {
        assertTrue(SerializedFields.decode("{\"fields\": {\"a\": ").isEmpty());
    }

    @Test
    void testMissingNullOrMistypedFields() {
        assertTrue(SerializedFields.decode("{\"model\": \"articles\"}").isEmpty());
        assertTrue(SerializedFields.decode("{\"fields\": null}").isEmpty());
        assertTrue(SerializedFields.decode("{\"fields\": \"title\"}").isEmpty());
        assertTrue(SerializedFields.decode("{\"fields\": [\"title\"]}").isEmpty());
    }

    @Test
    void testEmptyFieldsAreAbsent() {
        assertTrue(SerializedFields.decode("{\"fields\": {}}").isEmpty());
    }

    @Test
    void testNullValuesAreKept() {
        Map<String, Object> fields = SerializedFields.decode("{\"fields\": {\"title\": null}}").orElseThrow();

        assertTrue(fields.containsKey("title"));
        assertNull(fields.get("title"));
    }

    @Test
    void testDecodedFieldsAreUnmodifiable() {
        Map<String, Object> fields = SerializedFields.decode("{\"fields\": {\"title\": \"x\"}}").orElseThrow();

        assertThrows(UnsupportedOperationException.class, () -> fields.remove("title"));
    }

    @Test
    void testEncodedSnapshotDecodesToSameFields() {
        Map<String, Object> original = new LinkedHashMap<>();
        original.put("title", "Hello");
        original.put("status", null);

        String json = SerializedFields.encode("articles", 3L, original);

        assertEquals(original, SerializedFields.decode(json).orElseThrow());
    }

    @Test
    void testSnapshotUsesColumnNames() {
        Map<String, Object> article = SerializedFields.decode(SerializedFields.snapshot(new Article(3L, "Hello", null))).orElseThrow();
        assertEquals(3L, article.get("id"));
        assertEquals("Hello", article.get("title"));
        assertTrue(article.containsKey("status"));
        assertNull(article.get("status"));

        Map<String, Object> customer = SerializedFields.decode(SerializedFields.snapshot(new Customer("ACME", "Acme Corp"))).orElseThrow();
        assertEquals(Map.of("code", "ACME", "display_name", "Acme Corp"), customer);
    }
}
