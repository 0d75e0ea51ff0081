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

import me.golemcore.toolloop.domain.component.ToolArgumentModel;
import me.golemcore.toolloop.domain.component.ToolFunction;

import java.util.Map;

/**
 * Output of introspecting one tool method. The schema still carries
 * {@code $defs}, references and titles; the registry resolves and sanitizes it.
 */
public record IntrospectedTool(String name, String description, Map<String, Object> rawSchema,
        ToolFunction function, ToolArgumentModel argumentModel, boolean async) {
}
