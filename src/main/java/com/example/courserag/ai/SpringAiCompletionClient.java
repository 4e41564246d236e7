package com.example.courserag.ai;

import com.example.courserag.ai.dto.ChatMessage;
import com.example.courserag.ai.dto.CompletionRequest;
import com.example.courserag.ai.dto.CompletionResponse;
import com.example.courserag.ai.dto.ContentBlock;
import com.example.courserag.ai.dto.StopReason;
import com.example.courserag.ai.dto.TextBlock;
import com.example.courserag.ai.dto.ToolResult;
import com.example.courserag.ai.dto.ToolUseBlock;
import com.example.courserag.config.AiProperties;
import com.example.courserag.tools.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link CompletionClient} backed by a Spring AI {@link ChatModel}.
 *
 * <p>Tool definitions are registered as placeholder callbacks with internal tool execution
 * disabled, so Spring AI hands tool calls back to the caller instead of running them.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringAiCompletionClient implements CompletionClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ChatModel chatModel;
    private final ObjectMapper mapper;
    private final AiProperties properties;

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        Prompt prompt = new Prompt(toMessages(request), buildOptions(request));
        log.debug("Executing chat call with model={} mode={} tools={}",
                properties.getModel(), properties.getMode(), request.tools().size());
        ChatResponse response = chatModel.call(prompt);
        return toCompletionResponse(response);
    }

    List<Message> toMessages(CompletionRequest request) {
        List<Message> messages = new ArrayList<>();
        if (StringUtils.hasText(request.system())) {
            messages.add(new SystemMessage(request.system()));
        }
        Set<String> answeredIds = answeredToolUseIds(request);
        Map<String, String> toolNamesById = new HashMap<>();
        for (ChatMessage message : request.messages()) {
            if (message.role() == ChatMessage.Role.ASSISTANT) {
                messages.add(toAssistantMessage(message, answeredIds, toolNamesById));
            } else {
                messages.addAll(toUserMessages(message, toolNamesById));
            }
        }
        return messages;
    }

    private static Set<String> answeredToolUseIds(CompletionRequest request) {
        Set<String> ids = new HashSet<>();
        for (ChatMessage message : request.messages()) {
            for (ContentBlock block : message.content()) {
                if (block instanceof ToolResult result) {
                    ids.add(result.toolUseId());
                }
            }
        }
        return ids;
    }

    private AssistantMessage toAssistantMessage(ChatMessage message,
                                                Set<String> answeredIds,
                                                Map<String, String> toolNamesById) {
        StringBuilder text = new StringBuilder();
        List<AssistantMessage.ToolCall> toolCalls = new ArrayList<>();
        for (ContentBlock block : message.content()) {
            if (block instanceof TextBlock textBlock) {
                text.append(textBlock.text());
            } else if (block instanceof ToolUseBlock use) {
                // calls abandoned after a failed one have no result; providers reject unanswered calls
                if (!answeredIds.contains(use.id())) {
                    log.debug("Dropping unanswered tool call id={} name={}", use.id(), use.name());
                    continue;
                }
                toolNamesById.put(use.id(), use.name());
                toolCalls.add(new AssistantMessage.ToolCall(use.id(), "function", use.name(), writeArguments(use.input())));
            } else {
                throw new IllegalArgumentException("Unsupported assistant content block: " + block.getClass().getSimpleName());
            }
        }
        return new AssistantMessage(text.toString(), Map.of(), toolCalls);
    }

    private List<Message> toUserMessages(ChatMessage message, Map<String, String> toolNamesById) {
        StringBuilder text = new StringBuilder();
        List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>();
        for (ContentBlock block : message.content()) {
            if (block instanceof TextBlock textBlock) {
                text.append(textBlock.text());
            } else if (block instanceof ToolResult result) {
                String name = toolNamesById.getOrDefault(result.toolUseId(), "");
                responses.add(new ToolResponseMessage.ToolResponse(result.toolUseId(), name, result.content()));
            } else {
                throw new IllegalArgumentException("Unsupported user content block: " + block.getClass().getSimpleName());
            }
        }
        List<Message> converted = new ArrayList<>(2);
        if (!responses.isEmpty()) {
            converted.add(new ToolResponseMessage(responses));
        }
        if (!text.isEmpty() || responses.isEmpty()) {
            converted.add(new UserMessage(text.toString()));
        }
        return converted;
    }

    private ToolCallingChatOptions buildOptions(CompletionRequest request) {
        OptionsBuilder builder = properties.getMode() == AiProperties.Mode.OPENAI
                ? new OpenAiOptionsBuilder(OpenAiChatOptions.builder())
                : new GenericOptionsBuilder(ToolCallingChatOptions.builder());

        if (properties.getModel() != null) builder.model(properties.getModel());
        builder.temperature(properties.getTemperature());
        builder.maxTokens(properties.getMaxTokens());
        builder.internalToolExecutionEnabled(Boolean.FALSE);

        if (request.toolsEnabled()) {
            List<ToolCallback> callbacks = request.tools().stream()
                    .map(this::toCallback)
                    .toList();
            builder.toolCallbacks(callbacks);
            builder.toolChoice("auto");
            // one tool at a time keeps rounds sequential
            builder.parallelToolCalls(Boolean.FALSE);
            log.debug("[TOOLS-ALLOWED] {}", request.tools().stream().map(ToolDefinition::name).toList());
        }
        return builder.build();
    }

    private ToolCallback toCallback(ToolDefinition definition) {
        return new DefinitionOnlyCallback(org.springframework.ai.tool.definition.ToolDefinition.builder()
                .name(definition.name())
                .description(definition.description())
                .inputSchema(writeSchema(definition.inputSchema()))
                .build());
    }

    CompletionResponse toCompletionResponse(ChatResponse response) {
        List<ContentBlock> blocks = new ArrayList<>();
        List<ContentBlock> toolUses = new ArrayList<>();
        if (response != null) {
            for (Generation generation : response.getResults()) {
                AssistantMessage message = generation.getOutput();
                if (message == null) continue;
                if (StringUtils.hasText(message.getText())) {
                    blocks.add(new TextBlock(message.getText()));
                }
                for (AssistantMessage.ToolCall call : message.getToolCalls()) {
                    toolUses.add(new ToolUseBlock(call.id(), call.name(), readArguments(call.name(), call.arguments())));
                }
            }
        }
        blocks.addAll(toolUses);
        StopReason stopReason = toolUses.isEmpty() ? StopReason.END_TURN : StopReason.TOOL_USE;
        log.debug("Chat call returned stopReason={} textBlocks={} toolUses={}",
                stopReason, blocks.size() - toolUses.size(), toolUses.size());
        return new CompletionResponse(stopReason, blocks);
    }

    private Map<String, Object> readArguments(String toolName, String argumentsJson) {
        if (!StringUtils.hasText(argumentsJson)) {
            return Map.of();
        }
        try {
            return mapper.readValue(argumentsJson, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Tool '{}' arguments are not a JSON object; passing none. raw={}", toolName, argumentsJson, ex);
            return Map.of();
        }
    }

    private String writeArguments(Map<String, Object> input) {
        try {
            return mapper.writeValueAsString(input);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize tool arguments", ex);
        }
    }

    private String writeSchema(Map<String, Object> schema) {
        try {
            return mapper.writeValueAsString(new LinkedHashMap<>(schema));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize tool schema", ex);
        }
    }

    private interface OptionsBuilder {
        void model(String model);
        void temperature(Double temperature);
        void maxTokens(Integer maxTokens);
        void toolCallbacks(List<ToolCallback> callbacks);
        void internalToolExecutionEnabled(Boolean enabled);
        void toolChoice(String toolChoice);
        void parallelToolCalls(Boolean parallel);
        ToolCallingChatOptions build();
    }

    private static final class GenericOptionsBuilder implements OptionsBuilder {
        private final ToolCallingChatOptions.Builder delegate;
        private GenericOptionsBuilder(ToolCallingChatOptions.Builder delegate) { this.delegate = delegate; }
        @Override public void model(String model) { delegate.model(model); }
        @Override public void temperature(Double temperature) { delegate.temperature(temperature); }
        @Override public void maxTokens(Integer maxTokens) { delegate.maxTokens(maxTokens); }
        @Override public void toolCallbacks(List<ToolCallback> callbacks) { delegate.toolCallbacks(callbacks); }
        @Override public void internalToolExecutionEnabled(Boolean enabled) { delegate.internalToolExecutionEnabled(enabled); }
        @Override public void toolChoice(String toolChoice) { /* not supported */ }
        @Override public void parallelToolCalls(Boolean parallel) { /* not supported */ }
        @Override public ToolCallingChatOptions build() { return delegate.build(); }
    }

    private static final class OpenAiOptionsBuilder implements OptionsBuilder {
        private final OpenAiChatOptions.Builder delegate;
        private OpenAiOptionsBuilder(OpenAiChatOptions.Builder delegate) { this.delegate = delegate; }
        @Override public void model(String model) { delegate.model(model); }
        @Override public void temperature(Double temperature) { delegate.temperature(temperature); }
        @Override public void maxTokens(Integer maxTokens) { delegate.maxTokens(maxTokens); }
        @Override public void toolCallbacks(List<ToolCallback> callbacks) { delegate.toolCallbacks(callbacks); }
        @Override public void internalToolExecutionEnabled(Boolean enabled) { delegate.internalToolExecutionEnabled(enabled); }
        @Override public void toolChoice(String toolChoice) { delegate.toolChoice(toolChoice); }
        @Override public void parallelToolCalls(Boolean parallel) { delegate.parallelToolCalls(parallel); }
        @Override public ToolCallingChatOptions build() { return delegate.build(); }
    }

    private static final class DefinitionOnlyCallback implements ToolCallback {
        private final org.springframework.ai.tool.definition.ToolDefinition definition;
        private DefinitionOnlyCallback(org.springframework.ai.tool.definition.ToolDefinition definition) {
            this.definition = definition;
        }
        @Override public org.springframework.ai.tool.definition.ToolDefinition getToolDefinition() { return definition; }
        @Override public String call(String toolInput) {
            throw new UnsupportedOperationException("tool '" + definition.name() + "' is executed by the orchestrator");
        }
    }
}
