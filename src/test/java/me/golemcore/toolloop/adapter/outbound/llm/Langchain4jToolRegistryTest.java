package me.golemcore.toolloop.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import me.golemcore.toolloop.domain.schema.Tool;
import me.golemcore.toolloop.domain.schema.ToolParam;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jToolRegistryTest {

    private Langchain4jToolRegistry registry;

    enum Priority {
        LOW, HIGH
    }

    record Assignee(@ToolParam("Login name") String login) {
    }

    static class TaskTools {

        @Tool("Creates a task.")
        public String createTask(@ToolParam("Task title") String title,
                @ToolParam("Priority level") Priority priority,
                @ToolParam("Estimate in hours") int estimate,
                @ToolParam("Labels") List<String> labels,
                @ToolParam("Person responsible") Assignee assignee) {
            return title;
        }
    }

    @BeforeEach
    void setUp() {
        registry = new Langchain4jToolRegistry();
    }

    @Test
    void shouldReturnEmptyManifestWithoutTools() {
        assertTrue(registry.manifest().isEmpty());
    }

    @Test
    void shouldConvertSchemaToToolSpecification() {
        registry.registerAll(new TaskTools());

        ToolSpecification specification = registry.manifest().get(0);

        assertEquals("createTask", specification.name());
        assertEquals("Creates a task.", specification.description());
        JsonObjectSchema parameters = specification.parameters();
        assertEquals(List.of("title", "priority", "estimate", "labels", "assignee"), parameters.required());
        assertInstanceOf(JsonStringSchema.class, parameters.properties().get("title"));
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("priority"));
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("estimate"));

        JsonArraySchema labels = (JsonArraySchema) parameters.properties().get("labels");
        assertInstanceOf(JsonStringSchema.class, labels.items());

        JsonObjectSchema assignee = (JsonObjectSchema) parameters.properties().get("assignee");
        assertEquals("Person responsible", assignee.description());
        assertEquals(List.of("login"), assignee.required());
        assertEquals(Boolean.FALSE, assignee.additionalProperties());
    }
}
