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

package me.golemcore.toolloop.adapter.outbound.openai;

import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.domain.registry.ToolRegistry;
import me.golemcore.toolloop.domain.schema.SchemaKeys;
import me.golemcore.toolloop.domain.schema.SchemaResolver;
import me.golemcore.toolloop.domain.schema.SchemaSanitizer;
import me.golemcore.toolloop.domain.schema.ToolParameterIntrospector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry producing the OpenAI Chat Completions {@code tools} array:
 *
 * <pre>
 * [{"type": "function", "function": {"name": ..., "description": ..., "parameters": {...}}}]
 * </pre>
 *
 * Tools without parameters get an empty object schema.
 */
public class OpenAiToolRegistry extends ToolRegistry<List<Map<String, Object>>> {

    private static final String TYPE_FUNCTION = "function";

    public OpenAiToolRegistry() {
        super();
    }

    public OpenAiToolRegistry(ToolParameterIntrospector introspector, SchemaResolver resolver,
            SchemaSanitizer sanitizer) {
        super(introspector, resolver, sanitizer);
    }

    @Override
    public List<Map<String, Object>> manifest() {
        List<Map<String, Object>> tools = new ArrayList<>();
        for (ToolDefinition definition : getTools()) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", definition.getName());
            function.put(SchemaKeys.DESCRIPTION, definition.getDescription());
            function.put("parameters", parametersOf(definition));

            Map<String, Object> tool = new LinkedHashMap<>();
            tool.put(SchemaKeys.TYPE, TYPE_FUNCTION);
            tool.put(TYPE_FUNCTION, function);
            tools.add(tool);
        }
        return tools;
    }

    private static Map<String, Object> parametersOf(ToolDefinition definition) {
        Map<String, Object> parameters = definition.getParameters();
        if (parameters != null && !parameters.isEmpty()) {
            return parameters;
        }
        Map<String, Object> empty = new LinkedHashMap<>();
        empty.put(SchemaKeys.TYPE, SchemaKeys.TYPE_OBJECT);
        empty.put(SchemaKeys.PROPERTIES, Map.of());
        return empty;
    }
}
