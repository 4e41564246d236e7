package com.example.courserag.service;

import java.util.List;

public interface CourseCatalogService {

    record CourseStats(int totalCourses, List<String> courseTitles) {
        public CourseStats {
            courseTitles = List.copyOf(courseTitles);
        }
    }

    CourseStats courseStats();
}
