package com.example.courserag.ai;

import com.example.courserag.ai.dto.ChatMessage;
import com.example.courserag.ai.dto.CompletionRequest;
import com.example.courserag.ai.dto.CompletionResponse;
import com.example.courserag.ai.dto.StopReason;
import com.example.courserag.ai.dto.TextBlock;
import com.example.courserag.ai.dto.ToolResult;
import com.example.courserag.ai.dto.ToolUseBlock;
import com.example.courserag.config.AiProperties;
import com.example.courserag.tools.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpringAiCompletionClientTests {

    private ChatModel chatModel;
    private AiProperties properties;
    private SpringAiCompletionClient client;

    @BeforeEach
    void setUp() {
        chatModel = Mockito.mock(ChatModel.class);
        properties = new AiProperties();
        properties.setModel("test-model");
        client = new SpringAiCompletionClient(chatModel, new ObjectMapper(), properties);
    }

    @Test
    void toolCallsAreMappedToToolUseBlocks() {
        AssistantMessage output = new AssistantMessage("", Map.of(), List.of(
                new AssistantMessage.ToolCall("call-1", "function", "search_course_content",
                        "{\"query\":\"MCP\",\"lesson_number\":2}")));
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of(new Generation(output))));

        CompletionResponse response = client.complete(CompletionRequest.withTools("sys",
                List.of(ChatMessage.user("q")), List.of(definition())));

        assertThat(response.stopReason()).isEqualTo(StopReason.TOOL_USE);
        assertThat(response.toolUses()).hasSize(1);
        ToolUseBlock use = response.toolUses().get(0);
        assertThat(use.id()).isEqualTo("call-1");
        assertThat(use.name()).isEqualTo("search_course_content");
        assertThat(use.input()).containsEntry("query", "MCP").containsEntry("lesson_number", 2);
    }

    @Test
    void plainTextIsEndTurn() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("Hello")))));

        CompletionResponse response = client.complete(CompletionRequest.withoutTools("sys", List.of(ChatMessage.user("q"))));

        assertThat(response.stopReason()).isEqualTo(StopReason.END_TURN);
        assertThat(response.firstText()).contains("Hello");
    }

    @Test
    void malformedArgumentsBecomeEmptyInput() {
        AssistantMessage output = new AssistantMessage("", Map.of(), List.of(
                new AssistantMessage.ToolCall("call-1", "function", "get_course_outline", "{not json")));
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of(new Generation(output))));

        CompletionResponse response = client.complete(CompletionRequest.withTools("sys",
                List.of(ChatMessage.user("q")), List.of(definition())));

        assertThat(response.toolUses().get(0).input()).isEmpty();
    }

    @Test
    void optionsCarryToolsOnlyWhenEnabled() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("ok")))));
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);

        client.complete(CompletionRequest.withTools("sys", List.of(ChatMessage.user("q")), List.of(definition())));
        client.complete(CompletionRequest.withoutTools("sys", List.of(ChatMessage.user("q"))));

        verify(chatModel, Mockito.times(2)).call(captor.capture());
        OpenAiChatOptions withTools = (OpenAiChatOptions) captor.getAllValues().get(0).getOptions();
        OpenAiChatOptions withoutTools = (OpenAiChatOptions) captor.getAllValues().get(1).getOptions();

        assertThat(withTools.getModel()).isEqualTo("test-model");
        assertThat(withTools.getTemperature()).isEqualTo(0.0);
        assertThat(withTools.getMaxTokens()).isEqualTo(800);
        assertThat(withTools.getInternalToolExecutionEnabled()).isFalse();
        assertThat(withTools.getToolCallbacks()).hasSize(1);
        assertThat(withTools.getToolCallbacks().get(0).getToolDefinition().name()).isEqualTo("search_course_content");
        assertThat(withoutTools.getToolCallbacks()).isEmpty();
    }

    @Test
    void conversationIsTranslatedWithToolResponses() {
        CompletionRequest request = CompletionRequest.withoutTools("sys", List.of(
                ChatMessage.user("q"),
                ChatMessage.assistant(List.of(
                        new TextBlock("looking"),
                        new ToolUseBlock("t1", "search_course_content", Map.of("query", "x")))),
                ChatMessage.toolResults(List.of(ToolResult.success("t1", "payload")))));

        List<Message> messages = client.toMessages(request);

        assertThat(messages).extracting(Message::getMessageType).containsExactly(
                MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT, MessageType.TOOL);
        AssistantMessage assistant = (AssistantMessage) messages.get(2);
        assertThat(assistant.getText()).isEqualTo("looking");
        assertThat(assistant.getToolCalls()).extracting(AssistantMessage.ToolCall::arguments)
                .containsExactly("{\"query\":\"x\"}");
        ToolResponseMessage tool = (ToolResponseMessage) messages.get(3);
        assertThat(tool.getResponses()).containsExactly(
                new ToolResponseMessage.ToolResponse("t1", "search_course_content", "payload"));
    }

    @Test
    void abandonedToolCallsAreNotSent() {
        CompletionRequest request = CompletionRequest.withoutTools("sys", List.of(
                ChatMessage.user("q"),
                ChatMessage.assistant(List.of(
                        new ToolUseBlock("t1", "search_course_content", Map.of("query", "x")),
                        new ToolUseBlock("t2", "get_course_outline", Map.of("course_name", "y")))),
                ChatMessage.toolResults(List.of(ToolResult.error("t1", "Tool execution failed: boom")))));

        List<Message> messages = client.toMessages(request);

        AssistantMessage assistant = (AssistantMessage) messages.get(2);
        assertThat(assistant.getToolCalls()).extracting(AssistantMessage.ToolCall::id).containsExactly("t1");
        ToolResponseMessage tool = (ToolResponseMessage) messages.get(3);
        assertThat(tool.getResponses()).extracting(ToolResponseMessage.ToolResponse::name)
                .containsExactly("search_course_content");
    }

    private static ToolDefinition definition() {
        return new ToolDefinition("search_course_content", "search",
                Map.of("type", "object", "properties", Map.of("query", Map.of("type", "string"))));
    }
}
