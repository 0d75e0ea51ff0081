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

package me.golemcore.toolloop.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolloop.domain.exception.ToolExecutionException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw call arguments into a name to value map.
 *
 * <ul>
 * <li>{@code null} or a blank string: empty map</li>
 * <li>a map: copied as-is</li>
 * <li>a string: parsed as JSON; {@code null} gives an empty map, anything but
 * an object fails</li>
 * <li>anything else: converted with Jackson, or fails</li>
 * </ul>
 * Failures are {@link ToolExecutionException}s, so they stay recoverable.
 */
public class ToolArgumentNormalizer {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ToolArgumentNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> normalize(Object raw) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> arguments = new LinkedHashMap<>();
            map.forEach((key, value) -> arguments.put(String.valueOf(key), value));
            return arguments;
        }
        if (raw instanceof CharSequence text) {
            return parseJson(text.toString());
        }
        if (raw instanceof JsonNode node) {
            return fromNode(node);
        }
        try {
            return objectMapper.convertValue(raw, MAP_TYPE_REF);
        } catch (IllegalArgumentException e) {
            throw new ToolExecutionException("Cannot convert arguments of type " + raw.getClass().getSimpleName()
                    + " to a JSON object.", e);
        }
    }

    private Map<String, Object> parseJson(String text) {
        if (text.isBlank()) {
            return new LinkedHashMap<>();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return fromNode(node);
    }

    private Map<String, Object> fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new ToolExecutionException("Function arguments must decode to a JSON object.");
        }
        return objectMapper.convertValue(node, MAP_TYPE_REF);
    }
}
