package com.example.courserag.ai.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation requested by the model. {@code input} holds the decoded arguments
 * and may contain null values.
 */
public record ToolUseBlock(String id, String name, Map<String, Object> input) implements ContentBlock {

    public ToolUseBlock {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }
}
