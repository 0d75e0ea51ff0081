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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.exception.SchemaDepthExceededException;
import me.golemcore.toolloop.domain.exception.ToolValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a schema-with-references into a flat tree.
 *
 * <p>
 * Resolution runs in two steps:
 * <ol>
 * <li>{@link #assertNoRecursiveRefs(Map)} walks the reference graph depth
 * first with an explicit stack and rejects any reference that reappears on its
 * own path.</li>
 * <li>{@link #inline(Map)} substitutes every local {@code $ref} with the fields
 * of its target definition. Fields already present on the referencing node are
 * kept. The definitions table is dropped afterwards.</li>
 * </ol>
 * Only local references ({@code #/$defs/...} and {@code #/definitions/...})
 * are considered; anything else is left untouched.
 */
@Slf4j
public class SchemaResolver {

    public static final int DEFAULT_MAX_DEPTH = 20;

    private static final String LOCAL_REF_PREFIX = "#/";

    private final int maxDepth;

    public SchemaResolver() {
        this(DEFAULT_MAX_DEPTH);
    }

    public SchemaResolver(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Checks for cycles, then inlines. The input map is not modified.
     */
    public Map<String, Object> resolve(Map<String, Object> schema) {
        assertNoRecursiveRefs(schema);
        return inline(schema);
    }

    /**
     * Fails with {@link ToolValidationException} if the reference graph contains
     * a cycle. Each definition is explored once, so shared definitions do not
     * multiply the work.
     */
    public void assertNoRecursiveRefs(Map<String, Object> schema) {
        if (schema == null) {
            return;
        }
        Set<String> explored = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        Deque<RefFrame> stack = new ArrayDeque<>();

        for (String start : directRefs(schema)) {
            if (explored.contains(start)) {
                continue;
            }
            onPath.add(start);
            stack.push(new RefFrame(start, directRefs(lookup(schema, start)).iterator()));

            while (!stack.isEmpty()) {
                RefFrame frame = stack.peek();
                if (frame.children().hasNext()) {
                    String next = frame.children().next();
                    if (onPath.contains(next)) {
                        throw new ToolValidationException("Recursive structure detected: " + next
                                + ". Recursive structures are not allowed in tool inputs. "
                                + "Use parent_id, lists, or a workflow loop instead.");
                    }
                    if (!explored.contains(next)) {
                        onPath.add(next);
                        stack.push(new RefFrame(next, directRefs(lookup(schema, next)).iterator()));
                    }
                } else {
                    stack.pop();
                    onPath.remove(frame.reference());
                    explored.add(frame.reference());
                }
            }
        }
    }

    /**
     * Local references found under a node without following them. Definition
     * tables are skipped; they are only reachable through references.
     */
    private static Set<String> directRefs(Object root) {
        Set<String> refs = new LinkedHashSet<>();
        Deque<Object> pending = new ArrayDeque<>();
        if (root != null) {
            pending.push(root);
        }
        while (!pending.isEmpty()) {
            Object node = pending.pop();
            if (node instanceof Map<?, ?> map) {
                if (map.get(SchemaKeys.REF) instanceof String reference && isLocal(reference)) {
                    refs.add(reference);
                }
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    String key = String.valueOf(entry.getKey());
                    if (SchemaKeys.DEFS.equals(key) || SchemaKeys.DEFINITIONS.equals(key)) {
                        continue;
                    }
                    if (entry.getValue() instanceof Map<?, ?> || entry.getValue() instanceof List<?>) {
                        pending.push(entry.getValue());
                    }
                }
            } else if (node instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Map<?, ?> || item instanceof List<?>) {
                        pending.push(item);
                    }
                }
            }
        }
        return refs;
    }

    /**
     * Inlines all local references and drops the definitions table at the root.
     *
     * @throws SchemaDepthExceededException
     *             when nested reference expansions exceed the depth limit
     * @throws ToolValidationException
     *             when a local reference has no target
     */
    public Map<String, Object> inline(Map<String, Object> schema) {
        if (schema == null) {
            return null;
        }
        Map<String, Object> result = inlineMap(schema, schema, 0);
        result.remove(SchemaKeys.DEFS);
        result.remove(SchemaKeys.DEFINITIONS);
        return result;
    }

    private Object inlineNode(Object node, Map<String, Object> root, int depth) {
        if (node instanceof Map<?, ?> map) {
            return inlineMap(map, root, depth);
        }
        if (node instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(inlineNode(item, root, depth));
            }
            return copy;
        }
        return node;
    }

    private Map<String, Object> inlineMap(Map<?, ?> node, Map<String, Object> root, int depth) {
        Object ref = node.get(SchemaKeys.REF);
        if (ref instanceof String reference && isLocal(reference)) {
            if (depth >= maxDepth) {
                throw new SchemaDepthExceededException(maxDepth, reference);
            }
            Object target = lookup(root, reference);
            if (!(target instanceof Map<?, ?> targetMap)) {
                throw new ToolValidationException("Unresolvable schema reference: " + reference);
            }
            Map<String, Object> merged = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : node.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!SchemaKeys.REF.equals(key)) {
                    merged.put(key, entry.getValue());
                }
            }
            for (Map.Entry<?, ?> entry : targetMap.entrySet()) {
                merged.putIfAbsent(String.valueOf(entry.getKey()), entry.getValue());
            }
            log.trace("[Schema] Inlined {} at depth {}", reference, depth + 1);
            return inlineMap(merged, root, depth + 1);
        }

        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : node.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (SchemaKeys.DEFS.equals(key) || SchemaKeys.DEFINITIONS.equals(key)) {
                // The root table is dropped by inline(); nested ones are left for the sanitizer.
                if (node != root) {
                    copy.put(key, entry.getValue());
                }
                continue;
            }
            copy.put(key, inlineNode(entry.getValue(), root, depth));
        }
        return copy;
    }

    private static boolean isLocal(String reference) {
        return reference.startsWith(LOCAL_REF_PREFIX);
    }

    /**
     * Follows a local JSON pointer such as {@code #/$defs/Node} from the root.
     */
    private static Object lookup(Map<String, Object> root, String reference) {
        Object current = root;
        for (String token : reference.substring(LOCAL_REF_PREFIX.length()).split("/")) {
            String key = token.replace("~1", "/").replace("~0", "~");
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    private record RefFrame(String reference, Iterator<String> children) {
    }
}
