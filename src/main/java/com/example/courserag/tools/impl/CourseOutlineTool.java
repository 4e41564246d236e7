package com.example.courserag.tools.impl;

import com.example.courserag.retrieval.CourseOutline;
import com.example.courserag.retrieval.CourseRetrievalBackend;
import com.example.courserag.retrieval.LessonOutline;
import com.example.courserag.tools.Source;
import com.example.courserag.tools.SourceRecordingTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Returns a course's title, link, instructor and lesson list.
 *
 * <p>Citations are deduplicated by link value, so two lessons that share a URL (or a
 * lesson that points at the course page) produce a single citation.</p>
 */
@Slf4j
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@RequiredArgsConstructor
public class CourseOutlineTool extends SourceRecordingTool {

    public static final String NAME = "get_course_outline";

    private final CourseRetrievalBackend backend;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Get the complete outline of a course: title, link, instructor and every lesson with its number and title";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "course_name", Map.of(
                                "type", "string",
                                "description", "Course title or partial name (e.g. 'MCP', 'Introduction')")
                ),
                "required", List.of("course_name")
        );
    }

    @Override
    public String execute(Map<String, Object> args) {
        return execute(requireString(args, "course_name"));
    }

    public String execute(String courseName) {
        Optional<CourseOutline> resolved = backend.getCourseOutline(courseName);
        if (resolved.isEmpty()) {
            log.debug("No outline found for course '{}'", courseName);
            recordSources(List.of());
            return "No course found matching '" + courseName + "'";
        }
        CourseOutline outline = resolved.get();
        recordSources(collectSources(outline));
        return format(outline);
    }

    private String format(CourseOutline outline) {
        StringBuilder out = new StringBuilder();
        out.append("Course: ").append(outline.courseTitle()).append('\n');
        out.append("Course Link: ").append(orNotAvailable(outline.courseLink())).append('\n');
        out.append("Instructor: ").append(orNotAvailable(outline.instructor())).append('\n');
        out.append('\n');
        out.append("Lessons (").append(outline.lessons().size()).append(" total):");
        for (LessonOutline lesson : outline.lessons()) {
            out.append('\n')
                    .append("  Lesson ").append(lesson.lessonNumber()).append(": ").append(lesson.lessonTitle());
            if (StringUtils.hasText(lesson.lessonLink())) {
                out.append('\n').append("    Link: ").append(lesson.lessonLink());
            }
        }
        return out.toString();
    }

    private List<Source> collectSources(CourseOutline outline) {
        List<Source> sources = new ArrayList<>();
        Set<String> seenLinks = new LinkedHashSet<>();
        if (StringUtils.hasText(outline.courseLink()) && seenLinks.add(outline.courseLink())) {
            sources.add(new Source(outline.courseTitle(), outline.courseLink()));
        }
        for (LessonOutline lesson : outline.lessons()) {
            String link = lesson.lessonLink();
            if (StringUtils.hasText(link) && seenLinks.add(link)) {
                sources.add(new Source(outline.courseTitle() + " - Lesson " + lesson.lessonNumber(), link));
            }
        }
        log.debug("Outline '{}' yielded {} distinct link(s) from {} lesson(s)",
                outline.courseTitle(), sources.size(), outline.lessons().size());
        return sources;
    }

    private static String orNotAvailable(String value) {
        return StringUtils.hasText(value) ? value : "N/A";
    }
}
