package com.example.courserag.tools;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTests {

    @Test
    void definitionsFollowRegistrationOrder() {
        ToolRegistry registry = new ToolRegistry(List.of(
                new StubTool("search_course_content", "s"),
                new StubTool("get_course_outline", "o")));

        assertThat(registry.getToolDefinitions())
                .extracting(ToolDefinition::name)
                .containsExactly("search_course_content", "get_course_outline");
        assertThat(registry.getToolDefinitions().get(0).inputSchema()).containsEntry("type", "object");
    }

    @Test
    void emptyRegistryHasNoDefinitions() {
        assertThat(new ToolRegistry(List.of()).getToolDefinitions()).isEmpty();
    }

    @Test
    void unknownToolThrows() {
        ToolRegistry registry = new ToolRegistry(List.of());

        assertThatThrownBy(() -> registry.execute("missing", Map.of()))
                .isInstanceOf(UnknownToolException.class)
                .hasMessage("Tool 'missing' not found");
    }

    @Test
    void reRegistrationReplacesPreviousTool() throws Exception {
        ToolRegistry registry = new ToolRegistry(List.of(new StubTool("search_course_content", "old")));

        registry.register(new StubTool("search_course_content", "new"));

        assertThat(registry.getToolDefinitions()).hasSize(1);
        assertThat(registry.execute("search_course_content", Map.of())).isEqualTo("new");
    }

    @Test
    void lookupFallsBackToCaseInsensitiveMatch() {
        ToolRegistry registry = new ToolRegistry(List.of(new StubTool("get_course_outline", "o")));

        assertThat(registry.get("GET_COURSE_OUTLINE")).isPresent();
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void sourcesAccumulateAcrossExecutionsUntilReset() throws Exception {
        StubTool search = new StubTool("search_course_content", "s",
                new Source("MCP - Lesson 1", "https://x/1"));
        StubTool outline = new StubTool("get_course_outline", "o",
                new Source("MCP", "https://x"));
        ToolRegistry registry = new ToolRegistry(List.of(search, outline));

        registry.execute("search_course_content", Map.of());
        registry.execute("get_course_outline", Map.of());

        assertThat(registry.getLastSources()).containsExactly(
                new Source("MCP - Lesson 1", "https://x/1"),
                new Source("MCP", "https://x"));

        registry.resetSources();

        assertThat(registry.getLastSources()).isEmpty();
        assertThat(search.lastSources()).isEmpty();
        assertThat(outline.lastSources()).isEmpty();
    }

    @Test
    void failedExecutionRecordsNoSources() {
        ToolRegistry registry = new ToolRegistry(List.of(new FailingTool()));

        assertThatThrownBy(() -> registry.execute("failing", Map.of()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.getLastSources()).isEmpty();
    }

    private static final class StubTool extends SourceRecordingTool {
        private final String name;
        private final String payload;
        private final List<Source> sources;

        private StubTool(String name, String payload, Source... sources) {
            this.name = name;
            this.payload = payload;
            this.sources = List.of(sources);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String description() {
            return "stub " + name;
        }

        @Override
        public Map<String, Object> parametersSchema() {
            return Map.of("type", "object", "properties", Map.of());
        }

        @Override
        public String execute(Map<String, Object> args) {
            recordSources(sources);
            return payload;
        }
    }

    private static final class FailingTool extends SourceRecordingTool {
        @Override
        public String name() {
            return "failing";
        }

        @Override
        public String description() {
            return "always fails";
        }

        @Override
        public Map<String, Object> parametersSchema() {
            return Map.of("type", "object");
        }

        @Override
        public String execute(Map<String, Object> args) {
            recordSources(List.of(new Source("ignored", null)));
            throw new IllegalStateException("boom");
        }
    }
}
