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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolloop.domain.component.ToolArgumentModel;
import me.golemcore.toolloop.domain.exception.ToolValidationException;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Argument model derived from a method signature. Checks that required
 * arguments are present and converts each value to the declared parameter type
 * with Jackson. Unknown argument names are ignored.
 */
public class MethodArgumentModel implements ToolArgumentModel {

    private final String toolName;
    private final List<ParameterSpec> parameters;
    private final ObjectMapper objectMapper;

    public MethodArgumentModel(String toolName, List<ParameterSpec> parameters, ObjectMapper objectMapper) {
        this.toolName = toolName;
        this.parameters = List.copyOf(parameters);
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
    }

    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    @Override
    public Map<String, Object> validate(Map<String, Object> arguments) {
        Map<String, Object> coerced = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();
        for (ParameterSpec parameter : parameters) {
            boolean present = arguments.containsKey(parameter.name());
            Object raw = arguments.get(parameter.name());
            if (!present || raw == null) {
                if (parameter.required()) {
                    problems.add("missing required argument '" + parameter.name() + "'");
                } else {
                    coerced.put(parameter.name(), absentValue(parameter.type()));
                }
                continue;
            }
            try {
                coerced.put(parameter.name(), convert(raw, parameter.type()));
            } catch (IllegalArgumentException e) {
                problems.add("invalid value for argument '" + parameter.name() + "': " + rootMessage(e));
            }
        }
        if (!problems.isEmpty()) {
            throw new ToolValidationException("Tool '" + toolName + "': " + String.join("; ", problems));
        }
        return coerced;
    }

    /**
     * Positional invocation arguments. Values that already have the declared
     * type are passed through; absent optional parameters get their empty
     * value.
     */
    Object[] toInvocationArguments(Map<String, Object> arguments) {
        Object[] values = new Object[parameters.size()];
        for (int i = 0; i < values.length; i++) {
            ParameterSpec parameter = parameters.get(i);
            Object raw = arguments.get(parameter.name());
            if (raw == null) {
                if (parameter.required()) {
                    throw new ToolValidationException("Tool '" + toolName + "': missing required argument '"
                            + parameter.name() + "'");
                }
                values[i] = absentValue(parameter.type());
            } else if (TypeSchemaFactory.optionalValueType(parameter.type()) == null
                    && raw.getClass() == rawClass(parameter.type())) {
                values[i] = raw;
            } else if (raw instanceof Optional<?>) {
                values[i] = raw;
            } else {
                values[i] = convert(raw, parameter.type());
            }
        }
        return values;
    }

    private Object convert(Object raw, Type type) {
        Type optionalValue = TypeSchemaFactory.optionalValueType(type);
        if (optionalValue != null) {
            if (raw instanceof Optional<?> optional) {
                return optional;
            }
            return Optional.ofNullable(convert(raw, optionalValue));
        }
        JavaType javaType = objectMapper.getTypeFactory().constructType(type);
        return objectMapper.convertValue(raw, javaType);
    }

    private static Object absentValue(Type type) {
        if (TypeSchemaFactory.optionalValueType(type) != null) {
            return Optional.empty();
        }
        Class<?> clazz = rawClass(type);
        if (clazz == boolean.class) {
            return false;
        }
        if (clazz == char.class) {
            return '\0';
        }
        if (clazz == byte.class) {
            return (byte) 0;
        }
        if (clazz == short.class) {
            return (short) 0;
        }
        if (clazz == int.class) {
            return 0;
        }
        if (clazz == long.class) {
            return 0L;
        }
        if (clazz == float.class) {
            return 0f;
        }
        if (clazz == double.class) {
            return 0d;
        }
        return null;
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> clazz) {
            return clazz;
        }
        if (type instanceof java.lang.reflect.ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> clazz) {
            return clazz;
        }
        return Object.class;
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        if (message == null) {
            return current.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }

    /**
     * One formal parameter of the tool method.
     */
    public record ParameterSpec(String name, Type type, boolean required) {
    }
}
