package me.golemcore.toolloop.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.toolloop.domain.model.ToolCallRequest;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolFailureKind;
import me.golemcore.toolloop.domain.schema.Tool;
import me.golemcore.toolloop.domain.schema.ToolParam;
import me.golemcore.toolloop.domain.system.toolloop.ToolExecutionLoop;
import me.golemcore.toolloop.domain.system.toolloop.ToolLoopState;
import me.golemcore.toolloop.domain.system.toolloop.ToolLoopTurnResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jToolAdapterTest {

    private static final String USER_PROMPT = "What is 2 + 3?";

    @Mock
    private ChatModel chatModel;

    private Langchain4jToolRegistry registry;
    private List<ChatMessage> history;
    private Langchain4jToolAdapter adapter;

    static class Calculator {

        @Tool("Adds two integers.")
        public int add(@ToolParam("First operand") int a, @ToolParam("Second operand") int b) {
            return a + b;
        }
    }

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new Langchain4jToolRegistry();
        registry.registerAll(new Calculator());
        history = new ArrayList<>();
        history.add(UserMessage.from(USER_PROMPT));
        adapter = new Langchain4jToolAdapter(chatModel, registry, history, new ObjectMapper(), Runnable::run);
    }

    private static ChatResponse toolCallResponse(String id, String name, String arguments) {
        ToolExecutionRequest request = ToolExecutionRequest.builder()
                .id(id)
                .name(name)
                .arguments(arguments)
                .build();
        return ChatResponse.builder().aiMessage(AiMessage.from(List.of(request))).build();
    }

    private static ChatResponse textResponse(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Test
    void shouldExtractToolExecutionRequests() {
        List<ToolCallRequest> calls = adapter.extractCalls(toolCallResponse("call-1", "add", "{\"a\":2,\"b\":3}"));

        assertEquals(List.of(new ToolCallRequest("add", "{\"a\":2,\"b\":3}", "call-1")), calls);
    }

    @Test
    void shouldReturnNoCallsForTextResponse() {
        assertTrue(adapter.extractCalls(textResponse("Hi")).isEmpty());
    }

    @Test
    void shouldEncodeResultPayloadAsJson() {
        ToolCallResult result = ToolCallResult.failure(new ToolCallRequest("add", null, "call-9"),
                ToolFailureKind.NOT_FOUND, "Tool 'add' not found in registry.");

        ToolExecutionResultMessage message = (ToolExecutionResultMessage) adapter.buildResultMessage(result);

        assertEquals("call-9", message.id());
        assertEquals("add", message.toolName());
        assertEquals("{\"error\":\"Tool 'add' not found in registry.\"}", message.text());
    }

    @Test
    void shouldDriveLoopAgainstChatModel() {
        ChatResponse initial = toolCallResponse("call-1", "add", "{\"a\":2,\"b\":3}");
        ChatResponse finalAnswer = textResponse("2 + 3 = 5");
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(finalAnswer);

        ToolLoopTurnResult<ChatResponse> result = ToolExecutionLoop.builder()
                .registry(registry)
                .build()
                .run(initial, adapter);

        assertEquals(ToolLoopState.DONE, result.state());
        assertSame(finalAnswer, result.response());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest request = captor.getValue();
        assertEquals(3, request.messages().size());
        assertInstanceOf(UserMessage.class, request.messages().get(0));
        assertSame(initial.aiMessage(), request.messages().get(1));
        ToolExecutionResultMessage toolResult = (ToolExecutionResultMessage) request.messages().get(2);
        assertEquals("call-1", toolResult.id());
        assertEquals("{\"result\":5}", toolResult.text());
        assertEquals("add", request.toolSpecifications().get(0).name());

        assertEquals(4, history.size());
        assertSame(finalAnswer.aiMessage(), history.get(3));
    }

    @Test
    void shouldSendHistoryWithToolsOnInitialChat() {
        ChatResponse response = textResponse("Hello");
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response);

        assertSame(response, adapter.chat());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(1, captor.getValue().messages().size());
        assertEquals(1, captor.getValue().toolSpecifications().size());
    }
}
