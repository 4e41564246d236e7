package com.example.courserag.ai.dto;

public enum ToolChoice {
    AUTO, NONE
}
