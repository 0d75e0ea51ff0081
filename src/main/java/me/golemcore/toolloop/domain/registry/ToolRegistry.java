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

package me.golemcore.toolloop.domain.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.component.ToolFunction;
import me.golemcore.toolloop.domain.exception.ToolNotFoundException;
import me.golemcore.toolloop.domain.exception.ToolRegistrationException;
import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.domain.schema.IntrospectedTool;
import me.golemcore.toolloop.domain.schema.SchemaResolver;
import me.golemcore.toolloop.domain.schema.SchemaSanitizer;
import me.golemcore.toolloop.domain.schema.Tool;
import me.golemcore.toolloop.domain.schema.ToolParameterIntrospector;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the tool name to {@link ToolDefinition} mapping and turns callables into
 * definitions (introspect, resolve, sanitize).
 *
 * <p>
 * Names are exact and case-sensitive. Registering a name twice fails; nothing
 * is overwritten. Lookups take no lock: callers that mutate the registry while
 * turns are running must serialize that themselves.
 *
 * @param <M>
 *            provider-specific manifest type
 */
@Slf4j
public abstract class ToolRegistry<M> {

    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();
    private final ToolParameterIntrospector introspector;
    private final SchemaResolver resolver;
    private final SchemaSanitizer sanitizer;

    protected ToolRegistry() {
        this(new ToolParameterIntrospector(new ObjectMapper()), new SchemaResolver(), new SchemaSanitizer());
    }

    protected ToolRegistry(ToolParameterIntrospector introspector, SchemaResolver resolver,
            SchemaSanitizer sanitizer) {
        this.introspector = introspector;
        this.resolver = resolver;
        this.sanitizer = sanitizer;
    }

    /**
     * Builds the provider-specific tool listing from the registered definitions.
     */
    public abstract M manifest();

    // ==================== Registration ====================

    /**
     * Registers a ready-made definition as-is.
     */
    public ToolDefinition register(ToolDefinition definition) {
        if (definition == null) {
            throw new ToolRegistrationException("Tool definition must not be null.");
        }
        ToolDefinition existing = tools.putIfAbsent(definition.getName(), definition);
        if (existing != null) {
            throw new ToolRegistrationException("Tool '" + definition.getName() + "' is already registered.");
        }
        log.debug("[Tools] Registered tool '{}'", definition.getName());
        return definition;
    }

    /**
     * Registers an explicit implementation with a hand-written schema. The
     * schema is checked for cycles, inlined and sanitized like an introspected
     * one.
     */
    public ToolDefinition register(String name, String description, ToolFunction function,
            Map<String, Object> parameters) {
        if (name == null || name.isBlank()) {
            throw new ToolRegistrationException("Tool name is required.");
        }
        if (function == null) {
            throw new ToolRegistrationException("Tool '" + name + "' requires an implementation.");
        }
        if (description == null || description.isBlank()) {
            throw new ToolRegistrationException("Tool '" + name + "' requires a description.");
        }
        if (parameters == null) {
            throw new ToolRegistrationException("Tool '" + name + "' requires a parameter schema.");
        }
        return register(ToolDefinition.builder()
                .name(name)
                .description(description)
                .function(function)
                .parameters(prepareSchema(parameters))
                .build());
    }

    /**
     * Introspects a {@link Tool}-annotated method and registers it.
     */
    public ToolDefinition register(Object target, Method method) {
        return register(target, method, null, null);
    }

    /**
     * Introspects a method, overriding the name and/or description.
     */
    public ToolDefinition register(Object target, Method method, String name, String description) {
        return register(build(target, method, name, description));
    }

    /**
     * Registers the single method called {@code methodName} on the target (or,
     * for a {@link Class}, its static method).
     */
    public ToolDefinition register(Object target, String methodName) {
        Class<?> type = target instanceof Class<?> clazz ? clazz : target.getClass();
        List<Method> candidates = Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(methodName))
                .toList();
        if (candidates.size() != 1) {
            throw new ToolRegistrationException("Expected exactly one public method '" + methodName + "' on "
                    + type.getSimpleName() + ", found " + candidates.size() + ".");
        }
        return register(target instanceof Class<?> ? null : target, candidates.get(0));
    }

    /**
     * Registers every {@link Tool}-annotated public method of the target. Passing
     * a {@link Class} registers its static tool methods. Either all methods are
     * registered or none.
     */
    public List<ToolDefinition> registerAll(Object target) {
        boolean staticOnly = target instanceof Class<?>;
        Class<?> type = staticOnly ? (Class<?>) target : target.getClass();
        Object receiver = staticOnly ? null : target;

        List<Method> toolMethods = Arrays.stream(type.getMethods())
                .filter(m -> m.isAnnotationPresent(Tool.class))
                .filter(m -> !staticOnly || Modifier.isStatic(m.getModifiers()))
                .sorted(Comparator.comparing(Method::getName))
                .toList();
        if (toolMethods.isEmpty()) {
            throw new ToolRegistrationException(noToolMethodsMessage(type, staticOnly));
        }
        List<ToolDefinition> definitions = new ArrayList<>();
        toolMethods.forEach(m -> definitions.add(build(receiver, m, null, null)));

        List<String> registered = new ArrayList<>();
        try {
            for (ToolDefinition definition : definitions) {
                register(definition);
                registered.add(definition.getName());
            }
        } catch (ToolRegistrationException e) {
            registered.forEach(tools::remove);
            throw e;
        }
        log.info("[Tools] Registered {} tool(s) from {}", definitions.size(), type.getSimpleName());
        return definitions;
    }

    /**
     * Removes a tool.
     *
     * @throws ToolNotFoundException
     *             if no tool has that name
     */
    public ToolDefinition unregister(String name) {
        ToolDefinition removed = name != null ? tools.remove(name) : null;
        if (removed == null) {
            throw new ToolNotFoundException("Tool '" + name + "' not found in the registry.");
        }
        log.debug("[Tools] Unregistered tool '{}'", name);
        return removed;
    }

    // ==================== Lookup ====================

    /**
     * @return the definition, or {@code null} if absent
     */
    public ToolDefinition getTool(String name) {
        return name != null ? tools.get(name) : null;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Snapshot of the registered definitions, ordered by name.
     */
    public List<ToolDefinition> getTools() {
        List<ToolDefinition> snapshot = new ArrayList<>(tools.values());
        snapshot.sort(Comparator.comparing(ToolDefinition::getName));
        return snapshot;
    }

    /**
     * Read-only view from tool name to implementation.
     */
    public Map<String, ToolFunction> implementations() {
        Map<String, ToolFunction> view = new LinkedHashMap<>();
        for (ToolDefinition definition : getTools()) {
            view.put(definition.getName(), definition.getFunction());
        }
        return Collections.unmodifiableMap(view);
    }

    public int size() {
        return tools.size();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    // ==================== Internals ====================

    private ToolDefinition build(Object target, Method method, String name, String description) {
        if (method == null) {
            throw new ToolRegistrationException("Tool method must not be null.");
        }
        IntrospectedTool introspected = introspector.introspect(target, method, name, description);
        return ToolDefinition.builder()
                .name(introspected.name())
                .description(introspected.description())
                .function(introspected.function())
                .parameters(prepareSchema(introspected.rawSchema()))
                .argumentModel(introspected.argumentModel())
                .async(introspected.async())
                .build();
    }

    private static String noToolMethodsMessage(Class<?> type, boolean staticOnly) {
        StringBuilder message = new StringBuilder("No ").append(staticOnly ? "static " : "")
                .append("public @").append(Tool.class.getName()).append(" methods found on ")
                .append(type.getName()).append('.');
        Arrays.stream(type.getMethods())
                .flatMap(m -> Arrays.stream(m.getAnnotations()))
                .map(Annotation::annotationType)
                .filter(annotation -> annotation != Tool.class
                        && annotation.getSimpleName().equals(Tool.class.getSimpleName()))
                .findFirst()
                .ifPresent(annotation -> message.append(" Found @").append(annotation.getName())
                        .append(", which is not recognized."));
        return message.toString();
    }

    private Map<String, Object> prepareSchema(Map<String, Object> raw) {
        return sanitizer.sanitize(resolver.resolve(raw));
    }
}
