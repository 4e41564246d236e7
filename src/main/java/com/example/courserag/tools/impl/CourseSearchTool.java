package com.example.courserag.tools.impl;

import com.example.courserag.retrieval.CourseRetrievalBackend;
import com.example.courserag.retrieval.SearchResults;
import com.example.courserag.tools.Source;
import com.example.courserag.tools.SourceRecordingTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@RequiredArgsConstructor
public class CourseSearchTool extends SourceRecordingTool {

    public static final String NAME = "search_course_content";

    private final CourseRetrievalBackend backend;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Search course materials with smart course name matching and lesson filtering";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "What to search for in the course content"),
                        "course_name", Map.of(
                                "type", "string",
                                "description", "Course title (partial matches work, e.g. 'MCP', 'Introduction')"),
                        "lesson_number", Map.of(
                                "type", "integer",
                                "description", "Specific lesson number to search within (e.g. 1, 2, 3)")
                ),
                "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> args) {
        String query = requireString(args, "query");
        String courseName = optionalString(args, "course_name");
        Integer lessonNumber = optionalInteger(args, "lesson_number");
        return execute(query, courseName, lessonNumber);
    }

    public String execute(String query, @Nullable String courseName, @Nullable Integer lessonNumber) {
        log.debug("Searching course content course={} lesson={}", courseName, lessonNumber);
        SearchResults results = backend.search(query, courseName, lessonNumber);

        if (results.hasError()) {
            log.debug("Backend reported error: {}", results.error());
            recordSources(List.of());
            return results.error();
        }

        if (results.isEmpty()) {
            recordSources(List.of());
            return "No relevant content found" + filterQualifier(courseName, lessonNumber) + ".";
        }

        return formatResults(results);
    }

    private String filterQualifier(@Nullable String courseName, @Nullable Integer lessonNumber) {
        StringBuilder qualifier = new StringBuilder();
        if (courseName != null && !courseName.isBlank()) {
            qualifier.append(" in course '").append(courseName).append("'");
        }
        if (lessonNumber != null) {
            qualifier.append(" in lesson ").append(lessonNumber);
        }
        return qualifier.toString();
    }

    private String formatResults(SearchResults results) {
        List<String> blocks = new ArrayList<>(results.documents().size());
        // keyed by citation text, keeps first-seen order
        Map<String, Source> sources = new LinkedHashMap<>();

        for (int i = 0; i < results.documents().size(); i++) {
            Map<String, Object> meta = results.metadata().get(i);
            String courseTitle = courseTitle(meta);
            Integer lessonNumber = lessonNumber(meta);

            String label = lessonNumber != null ? courseTitle + " - Lesson " + lessonNumber : courseTitle;
            blocks.add("[" + label + "]\n" + results.documents().get(i));

            if (!sources.containsKey(label)) {
                String link = lessonNumber != null
                        ? backend.getLessonLink(courseTitle, lessonNumber).orElse(null)
                        : null;
                sources.put(label, new Source(label, link));
            }
        }

        recordSources(new ArrayList<>(sources.values()));
        log.debug("Formatted {} result(s) into {} distinct source(s)", blocks.size(), sources.size());
        return String.join("\n\n", blocks);
    }

    private static String courseTitle(Map<String, Object> meta) {
        Object title = meta.get("course_title");
        return title != null ? title.toString() : "unknown";
    }

    @Nullable
    private static Integer lessonNumber(Map<String, Object> meta) {
        Object value = meta.get("lesson_number");
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException ex) {
                log.debug("Ignoring non-numeric lesson_number '{}'", text);
            }
        }
        return null;
    }
}
