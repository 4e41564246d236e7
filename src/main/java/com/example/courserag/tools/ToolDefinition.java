package com.example.courserag.tools;

import java.util.Map;

/**
 * Capability contract handed to the completion service: name, purpose and a JSON schema
 * for the arguments.
 */
public record ToolDefinition(String name, String description, Map<String, Object> inputSchema) {

    public ToolDefinition {
        inputSchema = inputSchema == null ? Map.of() : Map.copyOf(inputSchema);
    }
}
