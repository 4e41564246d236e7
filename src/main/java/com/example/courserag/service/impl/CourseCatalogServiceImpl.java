package com.example.courserag.service.impl;

import com.example.courserag.retrieval.CourseRetrievalBackend;
import com.example.courserag.service.CourseCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class CourseCatalogServiceImpl implements CourseCatalogService {

    private final CourseRetrievalBackend backend;

    @Override
    public CourseStats courseStats() {
        List<String> titles = backend.getCourseTitles();
        log.debug("courseStats totalCourses={}", titles.size());
        return new CourseStats(titles.size(), titles);
    }
}
