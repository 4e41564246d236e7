package com.example.courserag.service.impl.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class QueryRequest {
    private String query;

    @JsonProperty("session_id")
    private String sessionId;
}
