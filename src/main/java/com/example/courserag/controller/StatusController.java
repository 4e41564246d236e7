package com.example.courserag.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@Tag(name = "Status")
@RestController
public class StatusController {

    @Operation(summary = "Liveness check")
    @GetMapping("/")
    public Mono<Map<String, String>> status() {
        return Mono.just(Map.of("status", "ok", "message", "Course Materials Assistant API"));
    }
}
