package com.example.courserag.service.impl.dto;

import com.example.courserag.tools.Source;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class QueryResponse {
    private final String answer;
    private final List<Source> sources;

    @JsonProperty("session_id")
    private final String sessionId;
}
