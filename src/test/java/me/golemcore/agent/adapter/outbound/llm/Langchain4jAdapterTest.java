package me.golemcore.agent.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jAdapterTest {

    private static final String CONVERT_ARGS_TO_JSON = "convertArgsToJson";
    private static final String PARSE_JSON_ARGS = "parseJsonArgs";
    private static final String CONVERT_TOOLS = "convertTools";
    private static final String SUPPRESS_UNCHECKED = "unchecked";
    private static final Instant NOW = Instant.parse("2026-02-14T10:00:00Z");

    private AgentProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        adapter = new Langchain4jAdapter(properties, new ObjectMapper());
    }

    // ===== availability =====

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());
        properties.getLlm().setApiKey(" ");
        assertFalse(adapter.isAvailable());
        properties.getLlm().setApiKey("sk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldFailChatWhenNotConfigured() {
        CompletableFuture<LlmResponse> future = adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.user("hi", NOW)))
                .build());

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("not configured"));
    }

    // ===== convertMessages =====

    @Test
    void shouldConvertConversationWithToolRoundTrip() {
        Message.ToolCall call = Message.ToolCall.builder()
                .id("tc-1").name("datetime").arguments(Map.of("timezone", "UTC")).build();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("Be brief.")
                .messages(List.of(
                        Message.system("[Conversation summary]\nearlier"),
                        Message.user("what time is it?", NOW),
                        Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(call)).build(),
                        Message.builder().role(Message.ROLE_TOOL).toolCallId("tc-1").toolName("datetime")
                                .content("10:00").build(),
                        Message.assistant("It is 10:00", NOW)))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(6, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(SystemMessage.class, messages.get(1));
        assertInstanceOf(UserMessage.class, messages.get(2));
        AiMessage toolRequest = assertInstanceOf(AiMessage.class, messages.get(3));
        assertTrue(toolRequest.hasToolExecutionRequests());
        assertEquals("datetime", toolRequest.toolExecutionRequests().get(0).name());
        assertTrue(toolRequest.toolExecutionRequests().get(0).arguments().contains("UTC"));
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(4));
        assertEquals("tc-1", result.id());
        assertEquals("10:00", result.text());
        assertEquals("It is 10:00", ((AiMessage) messages.get(5)).text());
    }

    // ===== argument json =====

    @Test
    void shouldConvertEmptyArgsToEmptyJson() {
        String result = ReflectionTestUtils.invokeMethod(adapter, CONVERT_ARGS_TO_JSON, Collections.emptyMap());
        assertEquals("{}", result);
    }

    @Test
    void shouldParseInvalidJsonToEmptyMap() {
        @SuppressWarnings(SUPPRESS_UNCHECKED)
        Map<String, Object> result = (Map<String, Object>) ReflectionTestUtils.invokeMethod(adapter, PARSE_JSON_ARGS,
                "invalid json");
        assertTrue(result.isEmpty());
    }

    @Test
    void shouldParseValidJson() {
        @SuppressWarnings(SUPPRESS_UNCHECKED)
        Map<String, Object> result = (Map<String, Object>) ReflectionTestUtils.invokeMethod(adapter, PARSE_JSON_ARGS,
                "{\"days\":3}");
        assertEquals(3, result.get("days"));
    }

    // ===== convertTools =====

    @Test
    void shouldConvertToolDefinitions() {
        ToolDefinition tool = ToolDefinition.builder()
                .name("calculate_date")
                .description("Calculates a date")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "days", Map.of("type", "integer", "description", "Days to add"),
                                "unit", Map.of("type", "string", "enum", List.of("days", "weeks")),
                                "tags", Map.of("type", "array", "items", Map.of("type", "string"))),
                        "required", List.of("days")))
                .build();

        LlmRequest request = LlmRequest.builder().tools(List.of(tool)).build();
        @SuppressWarnings(SUPPRESS_UNCHECKED)
        List<ToolSpecification> result = (List<ToolSpecification>) ReflectionTestUtils.invokeMethod(adapter,
                CONVERT_TOOLS, request);

        assertEquals(1, result.size());
        assertEquals("calculate_date", result.get(0).name());
        assertEquals(3, result.get(0).parameters().properties().size());
        assertEquals(List.of("days"), result.get(0).parameters().required());
    }

    @Test
    void shouldReturnEmptyForNoTools() {
        LlmRequest request = LlmRequest.builder().tools(List.of()).build();
        @SuppressWarnings(SUPPRESS_UNCHECKED)
        List<Object> result = (List<Object>) ReflectionTestUtils.invokeMethod(adapter, CONVERT_TOOLS, request);
        assertTrue(result.isEmpty());
    }
}
