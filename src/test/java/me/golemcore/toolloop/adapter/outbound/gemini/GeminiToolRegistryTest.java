package me.golemcore.toolloop.adapter.outbound.gemini;

import me.golemcore.toolloop.domain.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeminiToolRegistryTest {

    private GeminiToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new GeminiToolRegistry();
    }

    @Test
    void shouldReturnEmptyManifestWithoutTools() {
        assertTrue(registry.manifest().isEmpty());
    }

    @Test
    void shouldStripAdditionalPropertiesAtEveryLevel() {
        registry.register("create_user", "Creates a user.", arguments -> "ok", Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string", "description", "User name"),
                        "address", Map.of("type", "object", "description", "Postal address",
                                "properties", Map.of("city", Map.of("type", "string", "description", "City")))),
                "required", List.of("name")));

        Map<String, Object> declaration = registry.manifest().get(0);

        assertEquals("create_user", declaration.get("name"));
        assertEquals(Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string", "description", "User name"),
                        "address", Map.of("type", "object", "description", "Postal address",
                                "properties", Map.of("city", Map.of("type", "string", "description", "City")))),
                "required", List.of("name")), declaration.get("parameters"));
    }

    @Test
    void shouldDropRequiredNamesWithoutProperty() {
        Map<String, Object> converted = GeminiToolRegistry.toGeminiSchema(Map.of(
                "type", "object",
                "properties", Map.of("a", Map.of("type", "string")),
                "required", List.of("a", "ghost"),
                "additionalProperties", false));

        assertEquals(List.of("a"), converted.get("required"));
        assertFalse(converted.containsKey("additionalProperties"));
    }

    @Test
    void shouldKeepPropertyNamedAdditionalProperties() {
        Map<String, Object> converted = GeminiToolRegistry.toGeminiSchema(Map.of(
                "type", "object",
                "properties", Map.of("additionalProperties", Map.of("type", "boolean")),
                "required", List.of("additionalProperties")));

        assertEquals(Map.of("additionalProperties", Map.of("type", "boolean")), converted.get("properties"));
        assertEquals(List.of("additionalProperties"), converted.get("required"));
    }

    @Test
    void shouldOmitParametersForToolWithoutArguments() {
        registry.register(ToolDefinition.simple("ping", "Replies pong.", arguments -> "pong"));

        Map<String, Object> declaration = registry.manifest().get(0);

        assertEquals(Map.of("name", "ping", "description", "Replies pong."), declaration);
    }
}
