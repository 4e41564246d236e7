package com.example.courserag.service.impl;

import com.example.courserag.retrieval.CourseRetrievalBackend;
import com.example.courserag.service.CourseCatalogService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

class CourseCatalogServiceImplTests {

    private final CourseRetrievalBackend backend = Mockito.mock(CourseRetrievalBackend.class);
    private final CourseCatalogServiceImpl service = new CourseCatalogServiceImpl(backend);

    @Test
    void countMatchesTitles() {
        when(backend.getCourseTitles()).thenReturn(List.of("Advanced Python", "Introduction to MCP"));

        CourseCatalogService.CourseStats stats = service.courseStats();

        assertThat(stats.totalCourses()).isEqualTo(2);
        assertThat(stats.courseTitles()).containsExactly("Advanced Python", "Introduction to MCP");
    }

    @Test
    void emptyCatalog() {
        when(backend.getCourseTitles()).thenReturn(List.of());

        assertThat(service.courseStats().totalCourses()).isZero();
    }

    @Test
    void storeFailurePropagates() {
        when(backend.getCourseTitles()).thenThrow(new IllegalStateException("Vector store unavailable"));

        assertThatThrownBy(service::courseStats).hasMessage("Vector store unavailable");
    }
}
