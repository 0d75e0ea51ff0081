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

package me.golemcore.toolloop.domain.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites a resolved schema into the shape LLM providers accept:
 * <ul>
 * <li>metadata keys ({@code $schema}, {@code $id}, {@code title}, leftover
 * definitions) are removed from every schema node;</li>
 * <li>{@code anyOf}/{@code oneOf} of one non-null branch plus {@code null}
 * collapses to that branch, keeping the enclosing description;</li>
 * <li>object nodes without an explicit {@code additionalProperties} become
 * closed.</li>
 * </ul>
 * Recursion follows schema structure only, so a property that happens to be
 * named {@code title} is kept. The input is never modified and
 * {@code sanitize(sanitize(x))} equals {@code sanitize(x)}.
 */
public class SchemaSanitizer {

    /** Keywords whose value is a single sub-schema. */
    private static final Set<String> SCHEMA_VALUED = Set.of(SchemaKeys.ITEMS, SchemaKeys.NOT,
            SchemaKeys.ADDITIONAL_PROPERTIES, "contains", "if", "then", "else");

    /** Keywords whose value is a list of sub-schemas. */
    private static final Set<String> SCHEMA_LIST_VALUED = Set.of(SchemaKeys.PREFIX_ITEMS, SchemaKeys.ANY_OF,
            SchemaKeys.ONE_OF, SchemaKeys.ALL_OF);

    /** Keywords whose value maps names to sub-schemas. */
    private static final Set<String> SCHEMA_MAP_VALUED = Set.of(SchemaKeys.PROPERTIES, "patternProperties",
            "dependentSchemas");

    public Map<String, Object> sanitize(Map<String, Object> schema) {
        if (schema == null) {
            return null;
        }
        return sanitizeNode(schema);
    }

    private Map<String, Object> sanitizeNode(Map<?, ?> schema) {
        Map<String, Object> collapsed = collapseNullableUnion(schema);
        if (collapsed != null) {
            return sanitizeNode(collapsed);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : schema.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (SchemaKeys.METADATA_KEYS.contains(key)) {
                continue;
            }
            result.put(key, sanitizeValue(key, entry.getValue()));
        }

        if (isObjectType(result.get(SchemaKeys.TYPE)) && !result.containsKey(SchemaKeys.ADDITIONAL_PROPERTIES)) {
            result.put(SchemaKeys.ADDITIONAL_PROPERTIES, false);
        }
        return result;
    }

    private Object sanitizeValue(String key, Object value) {
        if (SCHEMA_VALUED.contains(key)) {
            if (value instanceof Map<?, ?> map) {
                return sanitizeNode(map);
            }
            if (value instanceof List<?> list) {
                // Tuple form of items.
                return sanitizeList(list);
            }
            return value;
        }
        if (SCHEMA_LIST_VALUED.contains(key) && value instanceof List<?> list) {
            return sanitizeList(list);
        }
        if (SCHEMA_MAP_VALUED.contains(key) && value instanceof Map<?, ?> map) {
            Map<String, Object> properties = new LinkedHashMap<>();
            for (Map.Entry<?, ?> property : map.entrySet()) {
                Object propertySchema = property.getValue();
                properties.put(String.valueOf(property.getKey()),
                        propertySchema instanceof Map<?, ?> nested ? sanitizeNode(nested) : propertySchema);
            }
            return properties;
        }
        return value;
    }

    private List<Object> sanitizeList(List<?> list) {
        List<Object> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(item instanceof Map<?, ?> map ? sanitizeNode(map) : item);
        }
        return result;
    }

    /**
     * Returns the surviving branch (with the parent description applied) when
     * the node is a union of exactly one non-null branch and at least one null
     * branch, otherwise {@code null}.
     */
    private Map<String, Object> collapseNullableUnion(Map<?, ?> schema) {
        Object union = schema.get(SchemaKeys.ANY_OF);
        if (!(union instanceof List<?>)) {
            union = schema.get(SchemaKeys.ONE_OF);
        }
        if (!(union instanceof List<?> branches)) {
            return null;
        }

        Map<?, ?> nonNull = null;
        int nonNullCount = 0;
        int nullCount = 0;
        for (Object branch : branches) {
            if (branch instanceof Map<?, ?> map && SchemaKeys.TYPE_NULL.equals(map.get(SchemaKeys.TYPE))) {
                nullCount++;
            } else {
                nonNullCount++;
                nonNull = branch instanceof Map<?, ?> map ? map : null;
            }
        }
        if (nonNullCount != 1 || nullCount == 0 || nonNull == null) {
            return null;
        }

        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : nonNull.entrySet()) {
            merged.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        Object description = schema.get(SchemaKeys.DESCRIPTION);
        if (description != null) {
            merged.put(SchemaKeys.DESCRIPTION, description);
        }
        return merged;
    }

    private static boolean isObjectType(Object type) {
        if (SchemaKeys.TYPE_OBJECT.equals(type)) {
            return true;
        }
        return type instanceof List<?> types && types.contains(SchemaKeys.TYPE_OBJECT);
    }
}
