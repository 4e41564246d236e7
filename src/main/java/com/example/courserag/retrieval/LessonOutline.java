package com.example.courserag.retrieval;

import org.springframework.lang.Nullable;

public record LessonOutline(int lessonNumber, String lessonTitle, @Nullable String lessonLink) {
}
