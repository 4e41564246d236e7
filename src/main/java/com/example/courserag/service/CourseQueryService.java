package com.example.courserag.service;

import com.example.courserag.tools.Source;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.List;

public interface CourseQueryService {

    record QueryResult(String answer, List<Source> sources) {
        public QueryResult {
            sources = List.copyOf(sources);
        }
    }

    QueryResult query(String query, @Nullable String sessionId);

    Mono<QueryResult> queryAsync(String query, @Nullable String sessionId);
}
