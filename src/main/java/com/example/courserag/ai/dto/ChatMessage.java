package com.example.courserag.ai.dto;

import java.util.List;

public record ChatMessage(Role role, List<ContentBlock> content) {

    public enum Role {
        USER, ASSISTANT
    }

    public ChatMessage {
        content = List.copyOf(content);
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, List.of(new TextBlock(text)));
    }

    public static ChatMessage toolResults(List<ToolResult> results) {
        return new ChatMessage(Role.USER, List.copyOf(results));
    }

    public static ChatMessage assistant(List<ContentBlock> content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }
}
