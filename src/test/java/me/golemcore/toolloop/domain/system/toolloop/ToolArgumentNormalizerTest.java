package me.golemcore.toolloop.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolloop.domain.exception.ToolExecutionException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolArgumentNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolArgumentNormalizer normalizer = new ToolArgumentNormalizer(objectMapper);

    record SearchArguments(String query, int limit) {
    }

    @Test
    void shouldTreatAbsentArgumentsAsEmpty() {
        assertEquals(Map.of(), normalizer.normalize(null));
        assertEquals(Map.of(), normalizer.normalize(""));
        assertEquals(Map.of(), normalizer.normalize("   "));
        assertEquals(Map.of(), normalizer.normalize("null"));
    }

    @Test
    void shouldUseMapsAsIs() {
        assertEquals(Map.of("a", 1), normalizer.normalize(Map.of("a", 1)));
    }

    @Test
    void shouldParseJsonObjects() {
        Map<String, Object> arguments = normalizer.normalize("{\"a\": 2, \"tags\": [\"x\"]}");

        assertEquals(2, arguments.get("a"));
        assertEquals(List.of("x"), arguments.get("tags"));
    }

    @Test
    void shouldConvertJsonNodes() throws Exception {
        assertEquals(Map.of("a", 2), normalizer.normalize(objectMapper.readTree("{\"a\":2}")));
    }

    @Test
    void shouldFailOnMalformedJson() {
        ToolExecutionException exception = assertThrows(ToolExecutionException.class,
                () -> normalizer.normalize("{not json"));

        assertTrue(exception.getMessage().startsWith("Invalid JSON"));
    }

    @Test
    void shouldFailWhenJsonIsNotAnObject() {
        ToolExecutionException exception = assertThrows(ToolExecutionException.class,
                () -> normalizer.normalize("[1, 2]"));

        assertEquals("Function arguments must decode to a JSON object.", exception.getMessage());
        assertThrows(ToolExecutionException.class, () -> normalizer.normalize("42"));
    }

    @Test
    void shouldCoerceBeansToMaps() {
        assertEquals(Map.of("query", "java", "limit", 3), normalizer.normalize(new SearchArguments("java", 3)));
    }

    @Test
    void shouldFailForValuesThatAreNotObjects() {
        assertThrows(ToolExecutionException.class, () -> normalizer.normalize(List.of(1, 2)));
        assertThrows(ToolExecutionException.class, () -> normalizer.normalize(7));
    }
}
