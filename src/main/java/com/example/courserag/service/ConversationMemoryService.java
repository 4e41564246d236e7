package com.example.courserag.service;

import org.springframework.lang.Nullable;

public interface ConversationMemoryService {

    String createSession();

    void appendExchange(String sessionId, String question, String answer);

    /**
     * Renders the kept exchanges as {@code "User: ...\nAssistant: ..."} lines, or {@code null}
     * when the session has no history.
     */
    @Nullable
    String formatHistory(String sessionId);

    void clear(String sessionId);
}
