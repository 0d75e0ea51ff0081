package me.golemcore.toolloop.domain.schema;

import me.golemcore.toolloop.domain.exception.SchemaDepthExceededException;
import me.golemcore.toolloop.domain.exception.ToolValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaResolverTest {

    private static final Map<String, Object> SELF_REFERENCING = Map.of(
            "type", "object",
            "properties", Map.of("root", Map.of("$ref", "#/$defs/Node")),
            "$defs", Map.of("Node", Map.of(
                    "type", "object",
                    "properties", Map.of("next", Map.of("$ref", "#/$defs/Node")))));

    private final SchemaResolver resolver = new SchemaResolver();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> child(Map<String, Object> node, String... path) {
        Map<String, Object> current = node;
        for (String key : path) {
            current = (Map<String, Object>) current.get(key);
        }
        return current;
    }

    // ==================== Cycle detection ====================

    @Test
    void shouldDetectDirectCycle() {
        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> resolver.assertNoRecursiveRefs(SELF_REFERENCING));

        assertTrue(exception.getMessage().contains("Recursive structure detected: #/$defs/Node"));
        assertTrue(exception.getMessage().contains("parent_id"));
    }

    @Test
    void shouldDetectIndirectCycleThroughArrayItems() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("a", Map.of("$ref", "#/$defs/A")),
                "$defs", Map.of(
                        "A", Map.of("type", "object", "properties",
                                Map.of("bs", Map.of("type", "array", "items", Map.of("$ref", "#/$defs/B")))),
                        "B", Map.of("anyOf", List.of(Map.of("$ref", "#/$defs/A"), Map.of("type", "null")))));

        assertThrows(ToolValidationException.class, () -> resolver.assertNoRecursiveRefs(schema));
    }

    @Test
    void shouldRejectCycleBeforeInlining() {
        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> resolver.resolve(SELF_REFERENCING));

        assertFalse(exception instanceof SchemaDepthExceededException);
    }

    @Test
    void shouldAcceptSharedDefinitionUsedTwice() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "from", Map.of("$ref", "#/$defs/Point"),
                        "to", Map.of("$ref", "#/$defs/Point")),
                "$defs", Map.of("Point", Map.of("type", "object", "properties",
                        Map.of("x", Map.of("type", "number")))));

        assertDoesNotThrow(() -> resolver.assertNoRecursiveRefs(schema));
        Map<String, Object> resolved = resolver.resolve(schema);
        assertEquals("object", child(resolved, "properties", "from").get("type"));
        assertEquals("object", child(resolved, "properties", "to").get("type"));
    }

    // ==================== Inlining ====================

    @Test
    void shouldInlineReferencesAndDropDefinitions() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("color", Map.of("$ref", "#/$defs/Color", "description", "Paint color")),
                "$defs", Map.of("Color", Map.of("type", "string", "enum", List.of("red", "green"),
                        "description", "A color")));

        Map<String, Object> resolved = resolver.resolve(schema);

        Map<String, Object> color = child(resolved, "properties", "color");
        assertFalse(resolved.containsKey("$defs"));
        assertFalse(color.containsKey("$ref"));
        assertEquals("string", color.get("type"));
        assertEquals(List.of("red", "green"), color.get("enum"));
        assertEquals("Paint color", color.get("description"));
    }

    @Test
    void shouldInlineLegacyDefinitionsTable() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("id", Map.of("$ref", "#/definitions/Id")),
                "definitions", Map.of("Id", Map.of("type", "integer")));

        Map<String, Object> resolved = resolver.resolve(schema);

        assertFalse(resolved.containsKey("definitions"));
        assertEquals("integer", child(resolved, "properties", "id").get("type"));
    }

    @Test
    void shouldInlineInsideUnionBranches() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("tag", Map.of("anyOf",
                        List.of(Map.of("$ref", "#/$defs/Tag"), Map.of("type", "null")))),
                "$defs", Map.of("Tag", Map.of("type", "string")));

        Map<String, Object> resolved = resolver.resolve(schema);

        List<?> branches = (List<?>) child(resolved, "properties", "tag").get("anyOf");
        assertEquals(Map.of("type", "string"), branches.get(0));
    }

    @Test
    void shouldLeaveNonLocalReferencesUntouched() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("ext", Map.of("$ref", "https://example.com/schema.json")));

        assertEquals(schema, resolver.resolve(schema));
    }

    @Test
    void shouldFailOnUnknownLocalReference() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("x", Map.of("$ref", "#/$defs/Missing")));

        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> resolver.resolve(schema));
        assertTrue(exception.getMessage().contains("#/$defs/Missing"));
    }

    // ==================== Depth limit ====================

    @Test
    void shouldStopInliningAtMaxDepth() {
        SchemaResolver shallow = new SchemaResolver(5);

        SchemaDepthExceededException exception = assertThrows(SchemaDepthExceededException.class,
                () -> shallow.inline(SELF_REFERENCING));

        assertTrue(exception.getMessage().contains("Max recursion depth"));
        assertEquals(5, exception.getMaxDepth());
    }

    @Test
    void shouldRejectDeepAcyclicChainBeyondLimit() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("a", Map.of("$ref", "#/$defs/A")),
                "$defs", Map.of(
                        "A", Map.of("type", "object", "properties", Map.of("b", Map.of("$ref", "#/$defs/B"))),
                        "B", Map.of("type", "object", "properties", Map.of("c", Map.of("$ref", "#/$defs/C"))),
                        "C", Map.of("type", "string")));

        assertDoesNotThrow(() -> new SchemaResolver(2).assertNoRecursiveRefs(schema));
        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> new SchemaResolver(2).resolve(schema));
        assertInstanceOf(SchemaDepthExceededException.class, exception);

        Map<String, Object> resolved = new SchemaResolver(3).resolve(schema);
        assertEquals("string", child(resolved, "properties", "a", "properties", "b", "properties", "c").get("type"));
    }

    @Test
    void shouldRejectWideSharedReferenceGraphQuickly() {
        Map<String, Object> defs = new HashMap<>();
        for (int level = 0; level < 30; level++) {
            String next = "#/$defs/Level" + (level + 1);
            defs.put("Level" + level, Map.of("type", "object", "properties", Map.of(
                    "left", Map.of("$ref", next),
                    "right", Map.of("$ref", next))));
        }
        defs.put("Level30", Map.of("type", "string"));
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("root", Map.of("$ref", "#/$defs/Level0")),
                "$defs", defs);

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            resolver.assertNoRecursiveRefs(schema);
            assertThrows(SchemaDepthExceededException.class, () -> resolver.resolve(schema));
        });
    }

    @Test
    void shouldRejectNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new SchemaResolver(0));
    }
}
