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

package me.golemcore.toolloop.adapter.outbound.gemini;

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
 * Registry producing Gemini function declarations
 * ({@code {"name", "description", "parameters"}}).
 *
 * <p>
 * Gemini's schema dialect rejects {@code additionalProperties} and fails on
 * {@code required} entries that name undeclared properties, so both are
 * cleaned up at every level. Tools without parameters omit the
 * {@code parameters} key.
 */
public class GeminiToolRegistry extends ToolRegistry<List<Map<String, Object>>> {

    public GeminiToolRegistry() {
        super();
    }

    public GeminiToolRegistry(ToolParameterIntrospector introspector, SchemaResolver resolver,
            SchemaSanitizer sanitizer) {
        super(introspector, resolver, sanitizer);
    }

    @Override
    public List<Map<String, Object>> manifest() {
        List<Map<String, Object>> declarations = new ArrayList<>();
        for (ToolDefinition definition : getTools()) {
            Map<String, Object> declaration = new LinkedHashMap<>();
            declaration.put("name", definition.getName());
            declaration.put(SchemaKeys.DESCRIPTION, definition.getDescription());
            if (definition.hasParameters()) {
                declaration.put("parameters", toGeminiSchema(definition.getParameters()));
            }
            declarations.add(declaration);
        }
        return declarations;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> toGeminiSchema(Map<String, Object> schema) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : schema.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (SchemaKeys.ADDITIONAL_PROPERTIES.equals(key)) {
                continue;
            }
            if (SchemaKeys.PROPERTIES.equals(key) && value instanceof Map<?, ?> properties) {
                Map<String, Object> converted = new LinkedHashMap<>();
                properties.forEach((name, propertySchema) -> converted.put(String.valueOf(name),
                        propertySchema instanceof Map<?, ?> nested
                                ? toGeminiSchema((Map<String, Object>) nested)
                                : propertySchema));
                result.put(key, converted);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, toGeminiSchema((Map<String, Object>) nested));
            } else if (value instanceof List<?> list) {
                List<Object> converted = new ArrayList<>(list.size());
                for (Object item : list) {
                    converted.add(item instanceof Map<?, ?> nested ? toGeminiSchema((Map<String, Object>) nested)
                            : item);
                }
                result.put(key, converted);
            } else {
                result.put(key, value);
            }
        }

        Object required = result.get(SchemaKeys.REQUIRED);
        if (required instanceof List<?> names) {
            Object properties = result.get(SchemaKeys.PROPERTIES);
            List<Object> declared = new ArrayList<>();
            for (Object name : names) {
                if (properties instanceof Map<?, ?> map && map.containsKey(name)) {
                    declared.add(name);
                }
            }
            if (declared.isEmpty()) {
                result.remove(SchemaKeys.REQUIRED);
            } else {
                result.put(SchemaKeys.REQUIRED, declared);
            }
        }
        return result;
    }
}
