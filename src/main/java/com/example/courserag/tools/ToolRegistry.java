package com.example.courserag.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the tools offered to the model for one query and the citations they record.
 *
 * <p>Prototype scoped: every query obtains its own registry together with fresh tool
 * instances, so collected sources never leak between concurrent queries. Callers drain
 * {@link #getLastSources()} and then call {@link #resetSources()}.</p>
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Slf4j
public class ToolRegistry implements ToolExecutor {
    private final Map<String, AiTool> tools = new LinkedHashMap<>();
    private final Map<String, AiTool> lookup = new LinkedHashMap<>();
    private final List<Source> collectedSources = new ArrayList<>();

    public ToolRegistry(List<AiTool> toolBeans) {
        log.debug("Initializing ToolRegistry with {} tool bean(s)", toolBeans.size());
        toolBeans.forEach(this::register);
    }

    public void register(AiTool tool) {
        AiTool previous = tools.put(tool.name(), tool);
        if (previous != null) {
            // last registration wins
            log.warn("Tool '{}' re-registered; replacing {} with {}",
                    tool.name(), previous.getClass().getSimpleName(), tool.getClass().getSimpleName());
        }
        lookup.put(tool.name(), tool);
        lookup.put(tool.name().toLowerCase(Locale.ROOT), tool);
        log.debug("Registered tool '{}' ({})", tool.name(), tool.getClass().getSimpleName());
    }

    public Optional<AiTool> get(String name) {
        if (name == null) {
            log.debug("Tool lookup requested with null name");
            return Optional.empty();
        }
        AiTool tool = lookup.get(name);
        if (tool != null) {
            return Optional.of(tool);
        }
        AiTool normalized = lookup.get(name.toLowerCase(Locale.ROOT));
        if (normalized != null) {
            log.debug("Resolved tool '{}' via case-insensitive match", name);
        } else {
            log.debug("Tool '{}' not found in registry", name);
        }
        return Optional.ofNullable(normalized);
    }

    public List<ToolDefinition> getToolDefinitions() {
        return tools.values().stream()
                .map(AiTool::definition)
                .toList();
    }

    @Override
    public String execute(String name, Map<String, Object> input) throws Exception {
        AiTool tool = get(name).orElseThrow(() -> new UnknownToolException(name));
        log.debug("Executing tool '{}' argKeys={}", tool.name(), input != null ? input.keySet() : "null");
        String result = tool.execute(input != null ? input : Map.of());
        List<Source> recorded = tool.lastSources();
        collectedSources.addAll(recorded);
        log.debug("Tool '{}' produced payloadLength={} sources={}",
                tool.name(), result != null ? result.length() : 0, recorded.size());
        return result;
    }

    /**
     * Sources recorded by every successful execution since the last reset, in execution order.
     */
    public List<Source> getLastSources() {
        return Collections.unmodifiableList(new ArrayList<>(collectedSources));
    }

    public void resetSources() {
        log.trace("Resetting {} collected source(s)", collectedSources.size());
        collectedSources.clear();
        tools.values().forEach(AiTool::resetSources);
    }
}
