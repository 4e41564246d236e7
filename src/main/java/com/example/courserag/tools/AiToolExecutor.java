package com.example.courserag.tools;

import com.example.courserag.ai.dto.ToolResult;
import com.example.courserag.ai.dto.ToolUseBlock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the tool-use blocks of a single round, one after another, in the order the model
 * sent them. The first failure ends the round; later blocks are not executed.
 */
@Component
@Slf4j
public class AiToolExecutor {

    public record RoundOutcome(List<ToolResult> results, boolean failed) {
        public RoundOutcome {
            results = List.copyOf(results);
        }
    }

    public RoundOutcome executeRound(List<ToolUseBlock> calls, ToolExecutor executor) {
        log.debug("Executing {} tool call(s)", calls.size());
        List<ToolResult> results = new ArrayList<>();
        for (ToolUseBlock call : calls) {
            log.debug("Executing tool call id={} name={}", call.id(), call.name());
            String content;
            try {
                content = executor.execute(call.name(), call.input());
            } catch (Exception ex) {
                log.warn("Tool '{}' execution failed id={}; abandoning {} remaining call(s)",
                        call.name(), call.id(), calls.size() - results.size() - 1, ex);
                results.add(ToolResult.error(call.id(), "Tool execution failed: " + ex.getMessage()));
                return new RoundOutcome(results, true);
            }
            results.add(ToolResult.success(call.id(), content != null ? content : ""));
            log.trace("Tool '{}' call id={} produced payloadLength={}",
                    call.name(), call.id(), content != null ? content.length() : 0);
        }
        log.debug("Completed execution of {} tool call(s)", results.size());
        return new RoundOutcome(results, false);
    }
}
