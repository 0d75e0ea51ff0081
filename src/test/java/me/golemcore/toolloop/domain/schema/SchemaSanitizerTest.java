package me.golemcore.toolloop.domain.schema;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class SchemaSanitizerTest {

    private static final List<String> PRIMITIVES = List.of("string", "integer", "number", "boolean");

    private final SchemaSanitizer sanitizer = new SchemaSanitizer();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> child(Map<String, Object> node, String... path) {
        Map<String, Object> current = node;
        for (String key : path) {
            current = (Map<String, Object>) current.get(key);
        }
        return current;
    }

    // ==================== Metadata ====================

    @Test
    void shouldStripMetadataAtEveryLevel() {
        Map<String, Object> schema = Map.of(
                "$schema", "https://json-schema.org/draft/2020-12/schema",
                "$id", "urn:tool",
                "title", "Arguments",
                "type", "object",
                "properties", Map.of("inner", Map.of(
                        "title", "Inner",
                        "type", "object",
                        "$defs", Map.of("Leftover", Map.of("type", "string")),
                        "properties", Map.of("x", Map.of("title", "X", "type", "string")))));

        Map<String, Object> sanitized = sanitizer.sanitize(schema);

        assertEquals(Map.of(
                "type", "object",
                "additionalProperties", false,
                "properties", Map.of("inner", Map.of(
                        "type", "object",
                        "additionalProperties", false,
                        "properties", Map.of("x", Map.of("type", "string"))))),
                sanitized);
    }

    @Test
    void shouldKeepPropertyNamedTitle() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("title", Map.of("type", "string", "title", "Title",
                        "description", "Book title")),
                "required", List.of("title"));

        Map<String, Object> sanitized = sanitizer.sanitize(schema);

        assertEquals(Map.of("type", "string", "description", "Book title"), child(sanitized, "properties", "title"));
        assertEquals(List.of("title"), sanitized.get("required"));
    }

    @Test
    void shouldNotModifyInput() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("title", "X");
        inner.put("type", "object");
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("x", inner);
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);

        sanitizer.sanitize(schema);

        assertEquals("X", inner.get("title"));
        assertFalse(inner.containsKey("additionalProperties"));
        assertFalse(schema.containsKey("additionalProperties"));
    }

    // ==================== Nullable unions ====================

    @Test
    void shouldCollapseNullableUnionForEveryPrimitive() {
        for (String type : PRIMITIVES) {
            Map<String, Object> schema = Map.of(
                    "anyOf", List.of(Map.of("type", type, "description", "branch"), Map.of("type", "null")),
                    "description", "Parent wins",
                    "title", "Value");

            assertEquals(Map.of("type", type, "description", "Parent wins"), sanitizer.sanitize(schema));
        }
    }

    @Test
    void shouldKeepBranchDescriptionWhenParentHasNone() {
        Map<String, Object> schema = Map.of(
                "oneOf", List.of(Map.of("type", "null"), Map.of("type", "integer", "description", "Count")));

        assertEquals(Map.of("type", "integer", "description", "Count"), sanitizer.sanitize(schema));
    }

    @Test
    void shouldCloseCollapsedObjectBranch() {
        Map<String, Object> schema = Map.of(
                "anyOf", List.of(
                        Map.of("type", "object", "properties", Map.of("x", Map.of("type", "string"))),
                        Map.of("type", "null")));

        Map<String, Object> sanitized = sanitizer.sanitize(schema);

        assertEquals("object", sanitized.get("type"));
        assertEquals(false, sanitized.get("additionalProperties"));
        assertFalse(sanitized.containsKey("anyOf"));
    }

    @Test
    void shouldKeepGenuineUnions() {
        Map<String, Object> schema = Map.of(
                "anyOf", List.of(Map.of("type", "string", "title", "S"), Map.of("type", "integer")));

        assertEquals(Map.of("anyOf", List.of(Map.of("type", "string"), Map.of("type", "integer"))),
                sanitizer.sanitize(schema));
    }

    @Test
    void shouldNotCollapseSingleBranchWithoutNull() {
        Map<String, Object> schema = Map.of("anyOf", List.of(Map.of("type", "string")));

        assertEquals(schema, sanitizer.sanitize(schema));
    }

    // ==================== Closed objects ====================

    @Test
    void shouldKeepExplicitAdditionalProperties() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "additionalProperties", Map.of("type", "integer", "title", "Count"));

        assertEquals(Map.of("type", "object", "additionalProperties", Map.of("type", "integer")),
                sanitizer.sanitize(schema));
    }

    @Test
    void shouldCloseObjectsInsideArrayItems() {
        Map<String, Object> schema = Map.of(
                "type", "array",
                "items", Map.of("type", "object", "properties", Map.of()));

        assertEquals(false, child(sanitizer.sanitize(schema), "items").get("additionalProperties"));
    }

    // ==================== Properties over random trees ====================

    @Test
    void shouldBeIdempotentAndCloseEveryObject() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            Map<String, Object> tree = randomSchema(random, 0);

            Map<String, Object> once = sanitizer.sanitize(tree);
            Map<String, Object> twice = sanitizer.sanitize(once);

            assertEquals(once, twice, "not idempotent for " + tree);
            assertAllObjectsClosed(once);
            assertNoMetadata(once);
        }
    }

    private static Map<String, Object> randomSchema(Random random, int depth) {
        Map<String, Object> node = new LinkedHashMap<>();
        int kind = depth >= 4 ? 0 : random.nextInt(4);
        switch (kind) {
        case 0 -> node.put("type", PRIMITIVES.get(random.nextInt(PRIMITIVES.size())));
        case 1 -> {
            node.put("type", "object");
            Map<String, Object> properties = new LinkedHashMap<>();
            int count = random.nextInt(4);
            for (int p = 0; p < count; p++) {
                // Property names deliberately collide with metadata keywords.
                String name = random.nextBoolean() ? "p" + p : (p % 2 == 0 ? "title" : "$id");
                properties.put(name, randomSchema(random, depth + 1));
            }
            node.put("properties", properties);
            if (!properties.isEmpty()) {
                node.put("required", new ArrayList<>(properties.keySet()));
            }
        }
        case 2 -> {
            node.put("type", "array");
            node.put("items", randomSchema(random, depth + 1));
        }
        default -> {
            List<Object> branches = new ArrayList<>();
            int count = 1 + random.nextInt(3);
            for (int b = 0; b < count; b++) {
                branches.add(random.nextInt(3) == 0 ? Map.of("type", "null") : randomSchema(random, depth + 1));
            }
            node.put(random.nextBoolean() ? "anyOf" : "oneOf", branches);
        }
        }
        if (random.nextBoolean()) {
            node.put("description", "d" + depth);
        }
        if (random.nextInt(3) == 0) {
            node.put("title", "T" + depth);
        }
        if (random.nextInt(5) == 0) {
            node.put("$schema", "https://json-schema.org/draft/2020-12/schema");
        }
        return node;
    }

    @SuppressWarnings("unchecked")
    private static void assertAllObjectsClosed(Object node) {
        if (node instanceof List<?> list) {
            list.forEach(SchemaSanitizerTest::assertAllObjectsClosed);
            return;
        }
        if (!(node instanceof Map<?, ?>)) {
            return;
        }
        Map<String, Object> schema = (Map<String, Object>) node;
        if ("object".equals(schema.get("type"))) {
            assertEquals(false, schema.get("additionalProperties"), "open object: " + schema);
        }
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            properties.values().forEach(SchemaSanitizerTest::assertAllObjectsClosed);
        }
        assertAllObjectsClosed(schema.get("items"));
        assertAllObjectsClosed(schema.get("anyOf"));
        assertAllObjectsClosed(schema.get("oneOf"));
    }

    @SuppressWarnings("unchecked")
    private static void assertNoMetadata(Object node) {
        if (node instanceof List<?> list) {
            list.forEach(SchemaSanitizerTest::assertNoMetadata);
            return;
        }
        if (!(node instanceof Map<?, ?>)) {
            return;
        }
        Map<String, Object> schema = (Map<String, Object>) node;
        assertFalse(schema.containsKey("title"), "title left in " + schema);
        assertFalse(schema.containsKey("$schema"), "$schema left in " + schema);
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            properties.values().forEach(SchemaSanitizerTest::assertNoMetadata);
        }
        assertNoMetadata(schema.get("items"));
        assertNoMetadata(schema.get("anyOf"));
        assertNoMetadata(schema.get("oneOf"));
    }

    @Test
    void shouldReturnNullForNullInput() {
        assertNull(sanitizer.sanitize(null));
    }
}
