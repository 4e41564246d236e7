package com.example.courserag.tools;

public class UnknownToolException extends RuntimeException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Tool '" + toolName + "' not found");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
