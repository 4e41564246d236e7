package com.example.courserag.ai.dto;

import com.example.courserag.tools.ToolDefinition;

import java.util.List;

/**
 * One call to the completion service. When {@code toolChoice} is {@link ToolChoice#NONE}
 * the tool list is empty and the model is expected to answer in text.
 */
public record CompletionRequest(String system,
                                List<ChatMessage> messages,
                                List<ToolDefinition> tools,
                                ToolChoice toolChoice) {

    public CompletionRequest {
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static CompletionRequest withTools(String system, List<ChatMessage> messages, List<ToolDefinition> tools) {
        return new CompletionRequest(system, messages, tools, ToolChoice.AUTO);
    }

    public static CompletionRequest withoutTools(String system, List<ChatMessage> messages) {
        return new CompletionRequest(system, messages, List.of(), ToolChoice.NONE);
    }

    public boolean toolsEnabled() {
        return toolChoice == ToolChoice.AUTO && !tools.isEmpty();
    }
}
