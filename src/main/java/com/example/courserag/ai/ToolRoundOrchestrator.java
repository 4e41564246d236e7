package com.example.courserag.ai;

import com.example.courserag.ai.dto.ChatMessage;
import com.example.courserag.ai.dto.CompletionRequest;
import com.example.courserag.ai.dto.CompletionResponse;
import com.example.courserag.config.AiProperties;
import com.example.courserag.tools.AiToolExecutor;
import com.example.courserag.tools.ToolDefinition;
import com.example.courserag.tools.ToolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the model-call / tool-execution cycle for one query.
 *
 * <p>Three conditions end a run: the model answers directly, a tool fails (one final call
 * without tools), or the round budget is spent (one final call without tools). A tool failure
 * is checked before the budget. Only exceptions thrown by the {@link CompletionClient}
 * escape {@link #generate}.</p>
 */
@Service
@Slf4j
public class ToolRoundOrchestrator {

    static final String MAX_ROUNDS_SENTINEL = "Error: Maximum rounds exceeded without proper termination";

    static final String SYSTEM_PROMPT = """
            You are an AI assistant specialized in course materials and educational content, with access to search tools for course information.

            Available tools:
            1. search_course_content: search course content, optionally filtered by course and lesson
            2. get_course_outline: fetch a course's title, link and complete lesson list

            Tool usage:
            - Course outline or structure questions: use get_course_outline
            - Questions about specific content: use search_course_content
            - Multi-part questions may use tools up to TWO times per query; prefer a single search when it is enough
            - Each tool call should gather distinct, complementary information
            - If a tool yields no results, say so plainly without offering alternatives

            Responses:
            - General knowledge questions: answer from existing knowledge without tools
            - No meta-commentary: do not mention searches, tools or question-type analysis
            - When presenting an outline include the course title and link, and every lesson with its number, title and link when available

            Every answer must be brief, educational, clear and example-supported where that helps.
            Provide only the direct answer to what was asked.
            """;

    private final CompletionClient completionClient;
    private final AiToolExecutor toolExecutor;
    private final int maxRounds;

    public ToolRoundOrchestrator(CompletionClient completionClient,
                                 AiToolExecutor toolExecutor,
                                 AiProperties properties) {
        this.completionClient = completionClient;
        this.toolExecutor = toolExecutor;
        this.maxRounds = Math.max(1, properties.getTools().getMaxRounds());
        log.info("Tool round orchestrator initialized with maxRounds={}", this.maxRounds);
    }

    public String generate(String query) {
        return generate(query, null, null, null);
    }

    public String generate(String query,
                           @Nullable String conversationHistory,
                           @Nullable List<ToolDefinition> toolDefinitions,
                           @Nullable ToolExecutor executor) {
        RunContext ctx = new RunContext(systemPrompt(conversationHistory), toolDefinitions, executor);
        RoundState state = RoundState.INIT;
        while (state != RoundState.DONE) {
            RoundState next = switch (state) {
                case INIT -> init(ctx, query);
                case MODEL_CALL -> modelCall(ctx);
                case DIRECT_ANSWER -> directAnswer(ctx);
                case TOOL_ROUND -> toolRound(ctx);
                case FINALIZE -> finalizeAnswer(ctx);
                case DONE -> RoundState.DONE;
            };
            log.trace("Round state {} -> {}", state, next);
            state = next;
        }
        log.debug("Generation finished rounds={} completionCalls={} answerLength={}",
                ctx.round, ctx.completionCalls, ctx.answer.length());
        return ctx.answer;
    }

    private RoundState init(RunContext ctx, String query) {
        ctx.messages.add(ChatMessage.user(query));
        return RoundState.MODEL_CALL;
    }

    private RoundState modelCall(RunContext ctx) {
        ctx.response = call(ctx, ctx.toolsAvailable());
        if (ctx.executor != null && ctx.response.requestsTools()) {
            return RoundState.TOOL_ROUND;
        }
        return RoundState.DIRECT_ANSWER;
    }

    private RoundState directAnswer(RunContext ctx) {
        ctx.answer = ctx.response.firstText().orElse("");
        return RoundState.DONE;
    }

    private RoundState toolRound(RunContext ctx) {
        if (ctx.round >= maxRounds) {
            log.warn("Entered a tool round with the budget of {} already spent", maxRounds);
            ctx.answer = MAX_ROUNDS_SENTINEL;
            return RoundState.DONE;
        }
        ctx.round++;
        ctx.messages.add(ChatMessage.assistant(ctx.response.content()));

        AiToolExecutor.RoundOutcome outcome = toolExecutor.executeRound(ctx.response.toolUses(), ctx.executor);
        if (!outcome.results().isEmpty()) {
            ctx.messages.add(ChatMessage.toolResults(outcome.results()));
        }

        if (outcome.failed()) {
            log.info("Tool failure in round {}; finalizing without tools", ctx.round);
            return RoundState.FINALIZE;
        }
        if (ctx.round >= maxRounds) {
            log.debug("Round budget of {} spent; finalizing without tools", maxRounds);
            return RoundState.FINALIZE;
        }

        ctx.response = call(ctx, true);
        return ctx.response.requestsTools() ? RoundState.TOOL_ROUND : RoundState.DIRECT_ANSWER;
    }

    private RoundState finalizeAnswer(RunContext ctx) {
        CompletionResponse response = call(ctx, false);
        if (response.requestsTools()) {
            log.debug("Ignoring {} tool request(s) in the final response", response.toolUses().size());
        }
        ctx.answer = response.firstText().orElse("");
        return RoundState.DONE;
    }

    private CompletionResponse call(RunContext ctx, boolean withTools) {
        CompletionRequest request = withTools
                ? CompletionRequest.withTools(ctx.system, ctx.messages, ctx.toolDefinitions)
                : CompletionRequest.withoutTools(ctx.system, ctx.messages);
        ctx.completionCalls++;
        log.debug("Completion call #{} messages={} toolsEnabled={}",
                ctx.completionCalls, request.messages().size(), request.toolsEnabled());
        CompletionResponse response = completionClient.complete(request);
        log.debug("Completion call #{} stopReason={} blocks={}",
                ctx.completionCalls, response.stopReason(), response.content().size());
        return response;
    }

    private String systemPrompt(@Nullable String conversationHistory) {
        return StringUtils.hasText(conversationHistory)
                ? SYSTEM_PROMPT + "\n\nPrevious conversation:\n" + conversationHistory
                : SYSTEM_PROMPT;
    }

    private static final class RunContext {
        private final String system;
        private final List<ToolDefinition> toolDefinitions;
        @Nullable
        private final ToolExecutor executor;
        private final List<ChatMessage> messages = new ArrayList<>();
        private CompletionResponse response;
        private String answer = "";
        private int round;
        private int completionCalls;

        private RunContext(String system, @Nullable List<ToolDefinition> toolDefinitions, @Nullable ToolExecutor executor) {
            this.system = system;
            this.toolDefinitions = toolDefinitions == null ? List.of() : List.copyOf(toolDefinitions);
            this.executor = executor;
        }

        private boolean toolsAvailable() {
            return !toolDefinitions.isEmpty() && executor != null;
        }
    }
}
