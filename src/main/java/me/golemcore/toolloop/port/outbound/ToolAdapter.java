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

package me.golemcore.toolloop.port.outbound;

import me.golemcore.toolloop.domain.model.ToolCallRequest;
import me.golemcore.toolloop.domain.model.ToolCallResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Provider-specific translation between native responses/messages and the
 * generic tool call vocabulary. One implementation per LLM provider; the loop
 * never looks inside {@code R} or {@code M}.
 *
 * @param <R>
 *            native model response type
 * @param <M>
 *            native outgoing message type
 */
public interface ToolAdapter<R, M> {

    /**
     * Tool calls requested by the response, empty when it is a final answer.
     */
    List<ToolCallRequest> extractCalls(R response);

    /**
     * Appends the response to the conversation history. Called before any
     * results for its tool calls are sent.
     */
    void recordAssistantMessage(R response);

    /**
     * Builds the outgoing message for one result. The message must carry the
     * result's call id.
     */
    M buildResultMessage(ToolCallResult result);

    /**
     * Sends a batch of result messages and returns the model's next response.
     */
    CompletableFuture<R> sendResults(List<M> messages);
}
