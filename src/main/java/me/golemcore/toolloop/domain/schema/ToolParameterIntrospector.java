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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.exception.ToolValidationException;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Builds a raw parameter schema from a {@link Tool}-annotated method.
 *
 * <p>
 * Every parameter must carry a {@link ToolParam} description. A parameter is
 * required unless its type is {@code Optional<T>} or it is declared with
 * {@code required = false}. Structured parameter types are emitted as
 * {@code $defs} entries referenced by {@code $ref}; call
 * {@link SchemaResolver} and {@link SchemaSanitizer} before handing the schema
 * to a provider.
 */
@Slf4j
public class ToolParameterIntrospector {

    private final ObjectMapper objectMapper;

    public ToolParameterIntrospector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public IntrospectedTool introspect(Object target, Method method) {
        return introspect(target, method, null, null);
    }

    /**
     * @param target
     *            receiver for instance methods, ignored for static ones
     * @param nameOverride
     *            tool name, or {@code null} to use the annotation or method name
     * @param descriptionOverride
     *            tool description, or {@code null} to use the annotation value
     * @throws ToolValidationException
     *             when a description or parameter name is missing, or the method
     *             declares a variadic parameter
     */
    public IntrospectedTool introspect(Object target, Method method, String nameOverride,
            String descriptionOverride) {
        Tool annotation = method.getAnnotation(Tool.class);
        String name = resolveName(method, annotation, nameOverride);
        String description = resolveDescription(annotation, descriptionOverride);
        if (description == null) {
            throw new ToolValidationException("Tool '" + name
                    + "' is missing a description. LLMs need a description of what the tool does.");
        }
        if (!Modifier.isStatic(method.getModifiers()) && target == null) {
            throw new ToolValidationException("Tool '" + name + "' is an instance method but no target was given.");
        }
        if (method.isVarArgs()) {
            throw new ToolValidationException("Tool '" + name
                    + "' declares a variable argument list, which cannot be described as a parameter schema.");
        }

        TypeSchemaFactory factory = new TypeSchemaFactory();
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        List<MethodArgumentModel.ParameterSpec> specs = new ArrayList<>();

        for (Parameter parameter : method.getParameters()) {
            ToolParam param = parameter.getAnnotation(ToolParam.class);
            String paramName = resolveParameterName(name, parameter, param);
            if (param == null || param.value().isBlank()) {
                throw new ToolValidationException("Parameter '" + paramName + "' in tool '" + name
                        + "' is missing a description.\nUsage: @ToolParam(\"What this parameter means\") "
                        + parameter.getType().getSimpleName() + " " + paramName);
            }
            boolean optionalType = TypeSchemaFactory.optionalValueType(parameter.getParameterizedType()) != null;
            boolean isRequired = param.required() && !optionalType;

            properties.put(paramName, factory.propertySchema(paramName, parameter.getParameterizedType(),
                    param.value()));
            if (isRequired) {
                required.add(paramName);
            }
            specs.add(new MethodArgumentModel.ParameterSpec(paramName, parameter.getParameterizedType(),
                    isRequired));
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(SchemaKeys.TITLE, TypeSchemaFactory.titleOf(name) + "Arguments");
        schema.put(SchemaKeys.TYPE, SchemaKeys.TYPE_OBJECT);
        schema.put(SchemaKeys.PROPERTIES, properties);
        if (!required.isEmpty()) {
            schema.put(SchemaKeys.REQUIRED, required);
        }
        if (!factory.definitions().isEmpty()) {
            schema.put(SchemaKeys.DEFS, factory.definitions());
        }

        MethodArgumentModel argumentModel = new MethodArgumentModel(name, specs, objectMapper);
        Object receiver = Modifier.isStatic(method.getModifiers()) ? null : target;
        MethodToolFunction function = new MethodToolFunction(receiver, method, argumentModel);
        boolean async = CompletionStage.class.isAssignableFrom(method.getReturnType());

        log.debug("[Schema] Introspected tool '{}' with {} parameter(s), {} definition(s)", name, specs.size(),
                factory.definitions().size());
        return new IntrospectedTool(name, description, schema, function, argumentModel, async);
    }

    private static String resolveName(Method method, Tool annotation, String nameOverride) {
        if (nameOverride != null && !nameOverride.isBlank()) {
            return nameOverride;
        }
        if (annotation != null && !annotation.name().isBlank()) {
            return annotation.name();
        }
        return method.getName();
    }

    private static String resolveDescription(Tool annotation, String descriptionOverride) {
        if (descriptionOverride != null && !descriptionOverride.isBlank()) {
            return descriptionOverride.strip();
        }
        if (annotation != null && !annotation.value().isBlank()) {
            return annotation.value().strip();
        }
        return null;
    }

    private static String resolveParameterName(String toolName, Parameter parameter, ToolParam param) {
        if (param != null && !param.name().isBlank()) {
            return param.name();
        }
        if (!parameter.isNamePresent()) {
            throw new ToolValidationException("Cannot determine the name of parameter '" + parameter.getName()
                    + "' in tool '" + toolName + "'. Compile with -parameters or set @ToolParam(name = ...).");
        }
        return parameter.getName();
    }
}
