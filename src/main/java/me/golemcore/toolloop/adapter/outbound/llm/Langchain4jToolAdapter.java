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

package me.golemcore.toolloop.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.model.ToolCallRequest;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.port.outbound.ToolAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * {@link ToolAdapter} over a langchain4j {@link ChatModel}.
 *
 * <p>
 * Keeps the conversation in a caller-owned message list: assistant messages
 * are appended as the loop records them, tool results as they are sent. Tool
 * specifications are taken from the registry on every request.
 */
@Slf4j
public class Langchain4jToolAdapter implements ToolAdapter<ChatResponse, ChatMessage> {

    private final ChatModel chatModel;
    private final Langchain4jToolRegistry registry;
    private final List<ChatMessage> history;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public Langchain4jToolAdapter(ChatModel chatModel, Langchain4jToolRegistry registry,
            List<ChatMessage> history, ObjectMapper objectMapper) {
        this(chatModel, registry, history, objectMapper, ForkJoinPool.commonPool());
    }

    public Langchain4jToolAdapter(ChatModel chatModel, Langchain4jToolRegistry registry,
            List<ChatMessage> history, ObjectMapper objectMapper, Executor executor) {
        this.chatModel = chatModel;
        this.registry = registry;
        this.history = history;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public List<ChatMessage> getHistory() {
        return history;
    }

    /**
     * Sends the current history (plus registered tools) and returns the
     * response, which seeds the tool loop. Does not record the response.
     */
    public ChatResponse chat() {
        return chatModel.chat(buildRequest());
    }

    @Override
    public List<ToolCallRequest> extractCalls(ChatResponse response) {
        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        if (aiMessage == null || !aiMessage.hasToolExecutionRequests()) {
            return List.of();
        }
        List<ToolCallRequest> calls = new ArrayList<>();
        for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
            calls.add(new ToolCallRequest(request.name(), request.arguments(), request.id()));
        }
        log.trace("[LLM] Parsed {} tool calls from response", calls.size());
        return calls;
    }

    @Override
    public void recordAssistantMessage(ChatResponse response) {
        if (response != null && response.aiMessage() != null) {
            history.add(response.aiMessage());
        }
    }

    @Override
    public ChatMessage buildResultMessage(ToolCallResult result) {
        return ToolExecutionResultMessage.from(result.callId(), result.name(), serialize(result));
    }

    @Override
    public CompletableFuture<ChatResponse> sendResults(List<ChatMessage> messages) {
        history.addAll(messages);
        ChatRequest request = buildRequest();
        return CompletableFuture.supplyAsync(() -> chatModel.chat(request), executor);
    }

    private ChatRequest buildRequest() {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(new ArrayList<>(history));
        List<ToolSpecification> tools = registry.manifest();
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
        }
        return builder.build();
    }

    private String serialize(ToolCallResult result) {
        try {
            return objectMapper.writeValueAsString(result.response());
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize result of '{}', falling back to toString: {}", result.name(),
                    e.getMessage());
            return String.valueOf(result.response());
        }
    }
}
