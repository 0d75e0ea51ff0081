/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.toolloop.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonAnyOfSchema;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNullSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.domain.registry.ToolRegistry;
import me.golemcore.toolloop.domain.schema.SchemaKeys;
import me.golemcore.toolloop.domain.schema.SchemaResolver;
import me.golemcore.toolloop.domain.schema.SchemaSanitizer;
import me.golemcore.toolloop.domain.schema.ToolParameterIntrospector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Registry producing langchain4j {@link ToolSpecification}s, usable with any
 * {@code ChatModel} integration.
 */
public class Langchain4jToolRegistry extends ToolRegistry<List<ToolSpecification>> {

    public Langchain4jToolRegistry() {
        super();
    }

    public Langchain4jToolRegistry(ToolParameterIntrospector introspector, SchemaResolver resolver,
            SchemaSanitizer sanitizer) {
        super(introspector, resolver, sanitizer);
    }

    @Override
    public List<ToolSpecification> manifest() {
        return getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getParameters();
        if (schema != null && schema.get(SchemaKeys.PROPERTIES) instanceof Map<?, ?>) {
            builder.parameters(toObjectSchema(schema));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonObjectSchema toObjectSchema(Map<String, Object> schema) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        String description = (String) schema.get(SchemaKeys.DESCRIPTION);
        if (description != null && !description.isBlank()) {
            builder.description(description);
        }
        Object properties = schema.get(SchemaKeys.PROPERTIES);
        if (properties instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                builder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
        }
        Object required = schema.get(SchemaKeys.REQUIRED);
        if (required instanceof List<?> names && !names.isEmpty()) {
            builder.required((List<String>) names);
        }
        if (Boolean.FALSE.equals(schema.get(SchemaKeys.ADDITIONAL_PROPERTIES))) {
            builder.additionalProperties(false);
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String description = (String) paramSchema.get(SchemaKeys.DESCRIPTION);
        List<String> enumValues = (List<String>) paramSchema.get(SchemaKeys.ENUM);

        // Enum values take priority
        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        Object union = paramSchema.get(SchemaKeys.ANY_OF);
        if (union == null) {
            union = paramSchema.get(SchemaKeys.ONE_OF);
        }
        if (union instanceof List<?> branches) {
            List<JsonSchemaElement> elements = new ArrayList<>();
            for (Object branch : branches) {
                elements.add(toJsonSchemaElement((Map<String, Object>) branch));
            }
            JsonAnyOfSchema.Builder builder = JsonAnyOfSchema.builder().anyOf(elements);
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        Object typeValue = paramSchema.get(SchemaKeys.TYPE);
        String type = typeValue instanceof String value ? value : SchemaKeys.TYPE_STRING;

        switch (type) {
        case SchemaKeys.TYPE_INTEGER -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case SchemaKeys.TYPE_NUMBER -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case SchemaKeys.TYPE_BOOLEAN -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case SchemaKeys.TYPE_NULL -> {
            return new JsonNullSchema();
        }
        case SchemaKeys.TYPE_ARRAY -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            if (paramSchema.get(SchemaKeys.ITEMS) instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            return builder.build();
        }
        case SchemaKeys.TYPE_OBJECT -> {
            return toObjectSchema(paramSchema);
        }
        default -> {
            // Unknown types degrade to string
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }
}
