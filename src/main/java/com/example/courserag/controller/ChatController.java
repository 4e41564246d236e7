package com.example.courserag.controller;

import com.example.courserag.service.ConversationMemoryService;
import com.example.courserag.service.CourseCatalogService;
import com.example.courserag.service.CourseQueryService;
import com.example.courserag.service.impl.dto.CourseStatsResponse;
import com.example.courserag.service.impl.dto.QueryRequest;
import com.example.courserag.service.impl.dto.QueryResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Tag(name = "Course Query")
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {
    private final CourseQueryService queryService;
    private final ConversationMemoryService memoryService;
    private final CourseCatalogService catalogService;

    @Operation(summary = "Ask a question about the course materials",
            description = "Creates a session when session_id is absent. Returns the answer with its sources.")
    @PostMapping("/query")
    public Mono<QueryResponse> query(@RequestBody QueryRequest request) {
        // an empty query is still answered; only a missing one is rejected
        if (request == null || request.getQuery() == null) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "query is required");
        }
        String sessionId = StringUtils.hasText(request.getSessionId())
                ? request.getSessionId()
                : memoryService.createSession();
        log.debug("Handling /api/query sessionId={} queryLength={}", sessionId, request.getQuery().length());
        return queryService.queryAsync(request.getQuery(), sessionId)
                .map(result -> new QueryResponse(result.answer(), result.sources(), sessionId))
                .doOnSuccess(response -> log.debug("query succeeded sessionId={} sources={}",
                        sessionId, response != null ? response.getSources().size() : 0))
                .onErrorMap(error -> !(error instanceof ResponseStatusException),
                        error -> new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, error.getMessage(), error));
    }

    @Operation(summary = "List catalogued courses",
            description = "Returns the number of courses and their titles.")
    @GetMapping("/courses")
    public Mono<CourseStatsResponse> courses() {
        log.debug("Handling /api/courses");
        return Mono.fromCallable(catalogService::courseStats)
                .subscribeOn(Schedulers.boundedElastic())
                .map(stats -> new CourseStatsResponse(stats.totalCourses(), stats.courseTitles()))
                .doOnError(error -> log.error("courses failed", error))
                .onErrorMap(error -> !(error instanceof ResponseStatusException),
                        error -> new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, error.getMessage(), error));
    }

    @Operation(summary = "Forget a session's conversation history")
    @DeleteMapping("/session/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> clearSession(@PathVariable("sessionId") String sessionId) {
        log.debug("Handling DELETE /api/session/{}", sessionId);
        return Mono.fromRunnable(() -> memoryService.clear(sessionId));
    }
}
