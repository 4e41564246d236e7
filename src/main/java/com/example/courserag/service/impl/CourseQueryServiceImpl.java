package com.example.courserag.service.impl;

import com.example.courserag.ai.ToolRoundOrchestrator;
import com.example.courserag.config.AiProperties;
import com.example.courserag.service.ConversationMemoryService;
import com.example.courserag.service.CourseQueryService;
import com.example.courserag.tools.Source;
import com.example.courserag.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

@Service
@Slf4j
public class CourseQueryServiceImpl implements CourseQueryService {

    private static final String PROMPT_PREFIX = "Answer this question about course materials: ";

    private final ToolRoundOrchestrator orchestrator;
    private final ObjectProvider<ToolRegistry> registryProvider;
    private final ConversationMemoryService memoryService;
    private final Duration timeout;

    public CourseQueryServiceImpl(ToolRoundOrchestrator orchestrator,
                                  ObjectProvider<ToolRegistry> registryProvider,
                                  ConversationMemoryService memoryService,
                                  AiProperties properties) {
        this.orchestrator = orchestrator;
        this.registryProvider = registryProvider;
        this.memoryService = memoryService;
        this.timeout = Duration.ofMillis(Math.max(1, properties.getClient().getTimeoutMs()));
    }

    @Override
    public QueryResult query(String query, @Nullable String sessionId) {
        log.debug("query invoked sessionId={} queryLength={}", sessionId, query != null ? query.length() : 0);
        String history = sessionId != null ? memoryService.formatHistory(sessionId) : null;

        ToolRegistry registry = registryProvider.getObject();
        String answer = orchestrator.generate(PROMPT_PREFIX + query, history, registry.getToolDefinitions(), registry);

        List<Source> sources = registry.getLastSources();
        registry.resetSources();

        if (sessionId != null) {
            memoryService.appendExchange(sessionId, query, answer);
        }
        log.debug("query completed sessionId={} answerLength={} sources={}", sessionId, answer.length(), sources.size());
        return new QueryResult(answer, sources);
    }

    @Override
    public Mono<QueryResult> queryAsync(String query, @Nullable String sessionId) {
        return Mono.fromCallable(() -> query(query, sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .doOnError(error -> log.error("queryAsync failed sessionId={}", sessionId, error));
    }
}
