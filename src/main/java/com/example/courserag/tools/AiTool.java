package com.example.courserag.tools;

import java.util.List;
import java.util.Map;

public interface AiTool {
    String name();

    String description();

    Map<String, Object> parametersSchema();

    String execute(Map<String, Object> args) throws Exception;

    /**
     * Sources recorded by the most recent {@link #execute(Map)} call.
     */
    List<Source> lastSources();

    void resetSources();

    default ToolDefinition definition() {
        return new ToolDefinition(name(), description(), parametersSchema());
    }
}
