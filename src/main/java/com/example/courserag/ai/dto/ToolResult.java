package com.example.courserag.ai.dto;

public record ToolResult(String toolUseId, String content, boolean error) implements ContentBlock {

    public static ToolResult success(String toolUseId, String content) {
        return new ToolResult(toolUseId, content, false);
    }

    public static ToolResult error(String toolUseId, String message) {
        return new ToolResult(toolUseId, message, true);
    }
}
