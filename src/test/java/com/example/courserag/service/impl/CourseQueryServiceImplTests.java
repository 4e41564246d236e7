package com.example.courserag.service.impl;

import com.example.courserag.ai.ToolRoundOrchestrator;
import com.example.courserag.config.AiProperties;
import com.example.courserag.service.ConversationMemoryService;
import com.example.courserag.service.CourseQueryService;
import com.example.courserag.tools.Source;
import com.example.courserag.tools.ToolDefinition;
import com.example.courserag.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.beans.factory.ObjectProvider;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CourseQueryServiceImplTests {

    private static final List<ToolDefinition> DEFINITIONS = List.of(
            new ToolDefinition("search_course_content", "search", Map.of("type", "object")));

    private ToolRoundOrchestrator orchestrator;
    private ToolRegistry registry;
    private ConversationMemoryService memory;
    private CourseQueryServiceImpl service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        orchestrator = Mockito.mock(ToolRoundOrchestrator.class);
        registry = Mockito.mock(ToolRegistry.class);
        memory = Mockito.mock(ConversationMemoryService.class);
        ObjectProvider<ToolRegistry> provider = Mockito.mock(ObjectProvider.class);
        when(provider.getObject()).thenReturn(registry);
        when(registry.getToolDefinitions()).thenReturn(DEFINITIONS);
        service = new CourseQueryServiceImpl(orchestrator, provider, memory, new AiProperties());
    }

    @Test
    void queryDrainsSourcesAndRecordsExchange() {
        List<Source> sources = List.of(new Source("MCP - Lesson 1", "https://example.com/l1"));
        when(memory.formatHistory("session_1")).thenReturn("User: hi\nAssistant: hello");
        when(orchestrator.generate(anyString(), any(), anyList(), any())).thenReturn("MCP is a protocol.");
        when(registry.getLastSources()).thenReturn(sources);

        CourseQueryService.QueryResult result = service.query("What is MCP?", "session_1");

        assertThat(result.answer()).isEqualTo("MCP is a protocol.");
        assertThat(result.sources()).isEqualTo(sources);
        verify(orchestrator).generate(
                eq("Answer this question about course materials: What is MCP?"),
                eq("User: hi\nAssistant: hello"),
                eq(DEFINITIONS),
                eq(registry));
        InOrder order = inOrder(registry, memory);
        order.verify(registry).getLastSources();
        order.verify(registry).resetSources();
        order.verify(memory).appendExchange("session_1", "What is MCP?", "MCP is a protocol.");
    }

    @Test
    void queryWithoutSessionSkipsMemory() {
        when(orchestrator.generate(anyString(), isNull(), anyList(), any())).thenReturn("answer");
        when(registry.getLastSources()).thenReturn(List.of());

        CourseQueryService.QueryResult result = service.query("q", null);

        assertThat(result.sources()).isEmpty();
        verify(memory, never()).formatHistory(anyString());
        verify(memory, never()).appendExchange(anyString(), anyString(), anyString());
    }

    @Test
    void orchestratorFailureLeavesHistoryUntouched() {
        when(orchestrator.generate(anyString(), any(), anyList(), any()))
                .thenThrow(new IllegalStateException("model unavailable"));

        StepVerifier.create(service.queryAsync("q", "session_1"))
                .expectErrorMessage("model unavailable")
                .verify();

        verify(memory, never()).appendExchange(anyString(), anyString(), anyString());
    }

    @Test
    void queryAsyncEmitsResult() {
        when(orchestrator.generate(anyString(), any(), anyList(), any())).thenReturn("answer");
        when(registry.getLastSources()).thenReturn(List.of());

        StepVerifier.create(service.queryAsync("q", null))
                .assertNext(result -> assertThat(result.answer()).isEqualTo("answer"))
                .verifyComplete();
    }
}
