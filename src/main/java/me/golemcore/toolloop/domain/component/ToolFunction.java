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

package me.golemcore.toolloop.domain.component;

import java.util.Map;

/**
 * Executable body of a tool. Receives the normalized (and, when the definition
 * carries an argument model, validated) arguments keyed by parameter name.
 *
 * <p>
 * Returning a {@link java.util.concurrent.CompletionStage} marks the call as
 * asynchronous: the loop awaits the stage and reports its value as the result.
 */
@FunctionalInterface
public interface ToolFunction {

    /**
     * Invokes the tool.
     *
     * @param arguments
     *            arguments keyed by parameter name, never {@code null}
     * @return the tool result, possibly a {@code CompletionStage}
     * @throws Exception
     *             any failure; the loop decides whether it is recoverable
     */
    Object invoke(Map<String, Object> arguments) throws Exception;
}
