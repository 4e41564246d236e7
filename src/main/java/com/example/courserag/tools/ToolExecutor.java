package com.example.courserag.tools;

import java.util.Map;

@FunctionalInterface
public interface ToolExecutor {

    String execute(String name, Map<String, Object> input) throws Exception;
}
