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

package me.golemcore.toolloop.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import me.golemcore.toolloop.domain.component.ToolArgumentModel;
import me.golemcore.toolloop.domain.component.ToolFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Defines a function/tool that the LLM can call. Contains the tool name,
 * description, the implementation, and the resolved JSON Schema for its input
 * parameters. Immutable once built.
 */
@Value
public class ToolDefinition {

    String name;
    String description;
    ToolFunction function;
    Map<String, Object> parameters; // JSON Schema, resolved and sanitized
    ToolArgumentModel argumentModel;
    boolean async;

    /**
     * The parameter schema is copied into unmodifiable maps and lists at every
     * level.
     */
    @Builder
    public ToolDefinition(@NonNull String name, @NonNull String description, @NonNull ToolFunction function,
            Map<String, Object> parameters, ToolArgumentModel argumentModel, boolean async) {
        this.name = name;
        this.description = description;
        this.function = function;
        this.parameters = parameters != null ? immutableMap(parameters) : null;
        this.argumentModel = argumentModel;
        this.async = async;
    }

    /**
     * Creates a simple tool definition without input parameters.
     */
    public static ToolDefinition simple(String name, String description, ToolFunction function) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.of());
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .function(function)
                .parameters(schema)
                .build();
    }

    /**
     * Checks if the schema declares at least one parameter.
     */
    public boolean hasParameters() {
        if (parameters == null) {
            return false;
        }
        Object properties = parameters.get("properties");
        return properties instanceof Map<?, ?> map && !map.isEmpty();
    }

    /**
     * Names of the required parameters, empty when none are declared.
     */
    @SuppressWarnings("unchecked")
    public List<String> requiredParameters() {
        if (parameters == null || !(parameters.get("required") instanceof List<?>)) {
            return List.of();
        }
        return (List<String>) parameters.get("required");
    }

    private static Map<String, Object> immutableMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), immutableValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(immutableValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
