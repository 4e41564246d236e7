package com.example.courserag.retrieval;

import org.springframework.lang.Nullable;

import java.util.List;

public record CourseOutline(String courseTitle,
                            @Nullable String courseLink,
                            @Nullable String instructor,
                            List<LessonOutline> lessons) {

    public CourseOutline {
        lessons = lessons == null ? List.of() : List.copyOf(lessons);
    }
}
