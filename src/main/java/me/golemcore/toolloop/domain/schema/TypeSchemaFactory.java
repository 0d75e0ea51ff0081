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

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps Java types to raw JSON Schema fragments. Structured types (records and
 * plain classes) are emitted once into a definitions table and referenced by
 * {@code #/$defs/<SimpleName>}, so a self-referencing type yields a cyclic
 * reference graph instead of infinite output. Distinct classes sharing a simple
 * name get distinct definition names.
 *
 * <p>
 * One instance accumulates the definitions of one tool; not thread-safe.
 */
final class TypeSchemaFactory {

    private final Map<String, Object> definitions = new LinkedHashMap<>();
    private final Map<Class<?>, String> definitionNames = new HashMap<>();

    Map<String, Object> definitions() {
        return definitions;
    }

    /**
     * Schema for a property: the type schema plus title and optional
     * description.
     */
    Map<String, Object> propertySchema(String name, Type type, String description) {
        Map<String, Object> schema = new LinkedHashMap<>();
        Type optionalValue = optionalValueType(type);
        if (optionalValue != null) {
            List<Object> branches = new ArrayList<>();
            branches.add(schemaFor(optionalValue));
            branches.add(Map.of(SchemaKeys.TYPE, SchemaKeys.TYPE_NULL));
            schema.put(SchemaKeys.ANY_OF, branches);
            schema.put(SchemaKeys.DEFAULT, null);
        } else {
            schema.putAll(schemaFor(type));
        }
        if (!schema.containsKey(SchemaKeys.REF)) {
            schema.put(SchemaKeys.TITLE, titleOf(name));
        }
        if (description != null && !description.isBlank()) {
            schema.put(SchemaKeys.DESCRIPTION, description);
        }
        return schema;
    }

    Map<String, Object> schemaFor(Type type) {
        if (type instanceof Class<?> clazz) {
            return schemaForClass(clazz);
        }
        if (type instanceof ParameterizedType parameterized) {
            return schemaForParameterized(parameterized);
        }
        if (type instanceof GenericArrayType arrayType) {
            return arrayOf(schemaFor(arrayType.getGenericComponentType()));
        }
        if (type instanceof WildcardType wildcard) {
            Type[] upper = wildcard.getUpperBounds();
            return upper.length > 0 ? schemaFor(upper[0]) : new LinkedHashMap<>();
        }
        if (type instanceof TypeVariable<?>) {
            return new LinkedHashMap<>();
        }
        return new LinkedHashMap<>();
    }

    /**
     * Returns the value type of {@code Optional<T>}, or {@code null} if the type
     * is not an Optional.
     */
    static Type optionalValueType(Type type) {
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() == Optional.class) {
            return parameterized.getActualTypeArguments()[0];
        }
        if (type == Optional.class) {
            return Object.class;
        }
        return null;
    }

    private Map<String, Object> schemaForParameterized(ParameterizedType type) {
        Class<?> raw = (Class<?>) type.getRawType();
        Type[] args = type.getActualTypeArguments();
        if (raw == Optional.class) {
            // Nested Optional (e.g. List<Optional<String>>) is treated as its value type.
            return schemaFor(args[0]);
        }
        if (Collection.class.isAssignableFrom(raw)) {
            return arrayOf(schemaFor(args[0]));
        }
        if (Map.class.isAssignableFrom(raw)) {
            Map<String, Object> schema = typed(SchemaKeys.TYPE_OBJECT);
            schema.put(SchemaKeys.ADDITIONAL_PROPERTIES, schemaFor(args[1]));
            return schema;
        }
        return schemaForClass(raw);
    }

    private Map<String, Object> schemaForClass(Class<?> clazz) {
        if (clazz == String.class || clazz == char.class || clazz == Character.class
                || CharSequence.class.isAssignableFrom(clazz)) {
            return typed(SchemaKeys.TYPE_STRING);
        }
        if (clazz == int.class || clazz == Integer.class || clazz == long.class || clazz == Long.class
                || clazz == short.class || clazz == Short.class || clazz == byte.class || clazz == Byte.class
                || clazz == BigInteger.class) {
            return typed(SchemaKeys.TYPE_INTEGER);
        }
        if (clazz == double.class || clazz == Double.class || clazz == float.class || clazz == Float.class
                || clazz == BigDecimal.class) {
            return typed(SchemaKeys.TYPE_NUMBER);
        }
        if (clazz == boolean.class || clazz == Boolean.class) {
            return typed(SchemaKeys.TYPE_BOOLEAN);
        }
        if (clazz.isEnum()) {
            Map<String, Object> schema = typed(SchemaKeys.TYPE_STRING);
            List<String> values = new ArrayList<>();
            for (Object constant : clazz.getEnumConstants()) {
                values.add(((Enum<?>) constant).name());
            }
            schema.put(SchemaKeys.ENUM, values);
            return schema;
        }
        if (clazz == UUID.class) {
            Map<String, Object> schema = typed(SchemaKeys.TYPE_STRING);
            schema.put(SchemaKeys.FORMAT, "uuid");
            return schema;
        }
        if (Temporal.class.isAssignableFrom(clazz)) {
            Map<String, Object> schema = typed(SchemaKeys.TYPE_STRING);
            schema.put(SchemaKeys.FORMAT, "date-time");
            return schema;
        }
        if (clazz.isArray()) {
            return arrayOf(schemaFor(clazz.getComponentType()));
        }
        if (Collection.class.isAssignableFrom(clazz)) {
            return typed(SchemaKeys.TYPE_ARRAY);
        }
        if (Map.class.isAssignableFrom(clazz)) {
            return typed(SchemaKeys.TYPE_OBJECT);
        }
        if (clazz == Object.class || clazz.isInterface() || clazz.isPrimitive()) {
            return new LinkedHashMap<>();
        }
        return reference(clazz);
    }

    private Map<String, Object> reference(Class<?> clazz) {
        String name = definitionNames.get(clazz);
        if (name == null) {
            name = uniqueDefinitionName(clazz);
            // Registered before the body is built so self references resolve to it.
            definitionNames.put(clazz, name);
            definitions.put(name, objectSchema(clazz));
        }
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put(SchemaKeys.REF, SchemaKeys.DEFS_PREFIX + name);
        return ref;
    }

    /**
     * Simple name, qualified by the enclosing classes when another type already
     * took it, then suffixed with a counter as a last resort.
     */
    private String uniqueDefinitionName(Class<?> clazz) {
        String simple = clazz.getSimpleName().isEmpty() ? clazz.getName() : clazz.getSimpleName();
        if (!definitionNames.containsValue(simple)) {
            return simple;
        }
        StringBuilder qualified = new StringBuilder(simple);
        for (Class<?> outer = clazz.getEnclosingClass(); outer != null; outer = outer.getEnclosingClass()) {
            qualified.insert(0, outer.getSimpleName() + "_");
            if (!definitionNames.containsValue(qualified.toString())) {
                return qualified.toString();
            }
        }
        String base = qualified.toString();
        int suffix = 2;
        while (definitionNames.containsValue(base + suffix)) {
            suffix++;
        }
        return base + suffix;
    }

    private Map<String, Object> objectSchema(Class<?> clazz) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();

        if (clazz.isRecord()) {
            for (RecordComponent component : clazz.getRecordComponents()) {
                addProperty(properties, required, component.getName(), component.getGenericType(), component);
            }
        } else {
            for (Field field : instanceFields(clazz)) {
                addProperty(properties, required, field.getName(), field.getGenericType(), field);
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(SchemaKeys.TITLE, clazz.getSimpleName());
        schema.put(SchemaKeys.TYPE, SchemaKeys.TYPE_OBJECT);
        schema.put(SchemaKeys.PROPERTIES, properties);
        if (!required.isEmpty()) {
            schema.put(SchemaKeys.REQUIRED, required);
        }
        return schema;
    }

    private void addProperty(Map<String, Object> properties, List<String> required, String name, Type type,
            AnnotatedElement element) {
        ToolParam param = element.getAnnotation(ToolParam.class);
        String propertyName = param != null && !param.name().isBlank() ? param.name() : name;
        String description = param != null ? param.value() : null;
        properties.put(propertyName, propertySchema(propertyName, type, description));
        boolean optional = optionalValueType(type) != null || (param != null && !param.required());
        if (!optional) {
            required.add(propertyName);
        }
    }

    private static List<Field> instanceFields(Class<?> clazz) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> current = clazz; current != null && current != Object.class; current = current
                .getSuperclass()) {
            hierarchy.add(0, current);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> current : hierarchy) {
            for (Field field : current.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                fields.add(field);
            }
        }
        return fields;
    }

    private static Map<String, Object> arrayOf(Map<String, Object> items) {
        Map<String, Object> schema = typed(SchemaKeys.TYPE_ARRAY);
        schema.put(SchemaKeys.ITEMS, items);
        return schema;
    }

    private static Map<String, Object> typed(String type) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(SchemaKeys.TYPE, type);
        return schema;
    }

    static String titleOf(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder title = new StringBuilder();
        for (String part : name.split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return title.toString();
    }
}
