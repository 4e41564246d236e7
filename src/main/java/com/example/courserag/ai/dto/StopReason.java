package com.example.courserag.ai.dto;

public enum StopReason {
    TOOL_USE, END_TURN
}
