package com.example.courserag.ai.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record CompletionResponse(StopReason stopReason, List<ContentBlock> content) {

    public CompletionResponse {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public Optional<String> firstText() {
        for (ContentBlock block : content) {
            if (block instanceof TextBlock text) {
                return Optional.ofNullable(text.text());
            }
        }
        return Optional.empty();
    }

    public List<ToolUseBlock> toolUses() {
        List<ToolUseBlock> uses = new ArrayList<>();
        for (ContentBlock block : content) {
            if (block instanceof ToolUseBlock use) {
                uses.add(use);
            }
        }
        return uses;
    }

    public boolean requestsTools() {
        return stopReason == StopReason.TOOL_USE && !toolUses().isEmpty();
    }
}
