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

package me.golemcore.toolloop.domain.model;

/**
 * Provider-agnostic tool call extracted from a model response.
 *
 * @param name
 *            requested tool name
 * @param arguments
 *            raw arguments: a map, a JSON string, {@code null}, or anything the
 *            normalizer can coerce into a map
 * @param callId
 *            correlation id as issued by the provider, may be {@code null}
 */
public record ToolCallRequest(String name, Object arguments, String callId) {

    public static ToolCallRequest of(String name, Object arguments) {
        return new ToolCallRequest(name, arguments, null);
    }
}
