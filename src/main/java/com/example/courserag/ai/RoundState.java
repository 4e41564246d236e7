package com.example.courserag.ai;

/**
 * States of {@link ToolRoundOrchestrator}. Every run starts in {@link #INIT} and ends in {@link #DONE}.
 */
public enum RoundState {
    INIT,
    MODEL_CALL,
    DIRECT_ANSWER,
    TOOL_ROUND,
    FINALIZE,
    DONE
}
