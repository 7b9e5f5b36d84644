package me.golemcore.pragent.adapter.outbound.llm;

import me.golemcore.pragent.domain.model.LlmRequest;
import me.golemcore.pragent.domain.model.LlmResponse;
import me.golemcore.pragent.domain.model.Message;
import me.golemcore.pragent.domain.model.ToolDefinition;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.infrastructure.config.AutoConfiguration;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String MODEL = "openai/gpt-test";

    private ChatModel chatModel;
    private Langchain4jAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        adapter = new Langchain4jAdapter(new AgentProperties(), AutoConfiguration.objectMapper());
        chatModel = mock(ChatModel.class);
        Map<String, ChatModel> models = (Map<String, ChatModel>) ReflectionTestUtils.getField(adapter, "models");
        models.put(MODEL, chatModel);
    }

    private static LlmRequest.LlmRequestBuilder request() {
        return LlmRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.builder().role(Message.ROLE_USER).content("Add dark mode").build()));
    }

    private ChatRequest captureRequest() {
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        return captor.getValue();
    }

    // ==================== Request parameters ====================

    @Test
    void shouldPassRequestLimitsToModel() {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());

        LlmResponse response = adapter.chat(request().maxTokens(512).temperature(0.0).build()).join();

        assertEquals("ok", response.getContent());
        ChatRequest sent = captureRequest();
        assertEquals(512, sent.parameters().maxOutputTokens());
        assertEquals(0.0, sent.parameters().temperature());
        assertEquals(1, sent.messages().size());
    }

    @Test
    void shouldKeepModelDefaultsWhenRequestHasNoLimits() {
        ChatRequest sent = adapter.buildChatRequest(request().build());

        assertNull(sent.parameters().maxOutputTokens());
        assertNull(sent.parameters().temperature());
        assertTrue(sent.toolSpecifications() == null || sent.toolSpecifications().isEmpty());
    }

    // ==================== Tools ====================

    @Test
    void shouldSendToolsAndParseToolCalls() {
        ToolDefinition readFile = ToolDefinition.builder()
                .name("read_file")
                .description("Read a file")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of("path", Map.of("type", "string", "description", "File path")),
                        "required", List.of("path")))
                .build();
        ToolExecutionRequest call = ToolExecutionRequest.builder()
                .id("call_1")
                .name("read_file")
                .arguments("{\"path\":\"index.html\"}")
                .build();
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(call)).build());

        LlmResponse response = adapter.chat(request().tools(List.of(readFile)).build()).join();

        assertEquals("read_file", captureRequest().toolSpecifications().get(0).name());
        assertEquals(1, response.getToolCalls().size());
        assertEquals("call_1", response.getToolCalls().get(0).getId());
        assertEquals("index.html", response.getToolCalls().get(0).getArguments().get("path"));
    }

    // ==================== Failures ====================

    @Test
    void shouldWrapModelFailures() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("rate limit exceeded"));

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.chat(request().build()).join());

        IllegalStateException cause = assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("LLM chat failed: rate limit exceeded", cause.getMessage());
    }
}
