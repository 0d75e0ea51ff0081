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

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of a single tool call. The response payload is either
 * {@code {"result": value}} or {@code {"error": message}}, never both.
 *
 * @param name
 *            tool name as requested
 * @param response
 *            result or error payload
 * @param callId
 *            correlation id echoed from the originating request
 * @param failureKind
 *            failure classification, {@code null} on success
 */
public record ToolCallResult(String name, Map<String, Object> response, String callId,
        ToolFailureKind failureKind) {

    public static final String RESULT_KEY = "result";
    public static final String ERROR_KEY = "error";

    public static ToolCallResult success(ToolCallRequest request, Object value) {
        return new ToolCallResult(request.name(), Collections.singletonMap(RESULT_KEY, value), request.callId(),
                null);
    }

    public static ToolCallResult failure(ToolCallRequest request, ToolFailureKind kind, String message) {
        return new ToolCallResult(request.name(), Collections.singletonMap(ERROR_KEY, message), request.callId(),
                kind);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public Object result() {
        return response.get(RESULT_KEY);
    }

    public String error() {
        Object error = response.get(ERROR_KEY);
        return error != null ? error.toString() : null;
    }
}
