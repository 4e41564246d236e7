package com.example.courserag.retrieval;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Search capabilities the retrieval tools rely on. Implementations report semantic
 * problems (for example an unmatched course filter) through {@link SearchResults#error()}
 * rather than by throwing, and a failed lesson-link lookup yields no link.
 */
public interface CourseRetrievalBackend {

    SearchResults search(String query, @Nullable String courseName, @Nullable Integer lessonNumber);

    Optional<String> getLessonLink(String courseTitle, int lessonNumber);

    Optional<CourseOutline> getCourseOutline(String courseName);

    /**
     * Distinct titles of every catalogued course, sorted. Store failures propagate.
     */
    List<String> getCourseTitles();
}
