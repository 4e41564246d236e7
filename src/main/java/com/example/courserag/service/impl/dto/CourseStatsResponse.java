package com.example.courserag.service.impl.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class CourseStatsResponse {
    @JsonProperty("total_courses")
    private final int totalCourses;

    @JsonProperty("course_titles")
    private final List<String> courseTitles;
}
