package com.example.courserag.ai.dto;

/**
 * One element of a {@link ChatMessage}'s content.
 *
 * <p>Completion responses only ever carry {@link TextBlock} and {@link ToolUseBlock}.
 * {@link ToolResult} blocks travel in the user message that answers a tool round.</p>
 */
public interface ContentBlock {
}
