package com.example.courserag.tools;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Base class for tools that keep the citations of their last execution.
 *
 * <p>Instances hold mutable state and must not be shared between concurrent queries.</p>
 */
public abstract class SourceRecordingTool implements AiTool {

    private List<Source> lastSources = List.of();

    @Override
    public List<Source> lastSources() {
        return lastSources;
    }

    @Override
    public void resetSources() {
        lastSources = List.of();
    }

    protected void recordSources(List<Source> sources) {
        lastSources = List.copyOf(sources);
    }

    protected static String requireString(Map<String, Object> args, String key) {
        String value = optionalString(args, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument '" + key + "'");
        }
        return value;
    }

    @Nullable
    protected static String optionalString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value == null ? null : value.toString();
    }

    @Nullable
    protected static Integer optionalInteger(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Argument '" + key + "' must be an integer but was '" + text + "'", ex);
        }
    }
}
