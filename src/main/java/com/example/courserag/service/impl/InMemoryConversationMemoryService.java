package com.example.courserag.service.impl;

import com.example.courserag.config.AiProperties;
import com.example.courserag.service.ConversationMemoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@Slf4j
public class InMemoryConversationMemoryService implements ConversationMemoryService {

    private record Turn(String role, String content) {}

    private final Map<String, List<Turn>> sessions = new ConcurrentHashMap<>();
    private final AtomicLong sessionCounter = new AtomicLong();
    private final int maxHistory;

    public InMemoryConversationMemoryService(AiProperties properties) {
        this.maxHistory = Math.max(0, properties.getMemory().getMaxHistory());
    }

    @Override
    public String createSession() {
        String sessionId = "session_" + sessionCounter.incrementAndGet();
        sessions.put(sessionId, List.of());
        log.debug("Created session {}", sessionId);
        return sessionId;
    }

    @Override
    public void appendExchange(String sessionId, String question, String answer) {
        int maxTurns = maxHistory * 2;
        sessions.compute(sessionId, (id, existing) -> {
            List<Turn> target = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            target.add(new Turn("User", question));
            target.add(new Turn("Assistant", answer));
            if (target.size() > maxTurns) {
                target = new ArrayList<>(target.subList(target.size() - maxTurns, target.size()));
            }
            log.debug("Appended exchange sessionId={} -> total={} turn(s)", sessionId, target.size());
            return List.copyOf(target);
        });
    }

    @Override
    @Nullable
    public String formatHistory(String sessionId) {
        List<Turn> turns = sessions.get(sessionId);
        if (turns == null || turns.isEmpty()) {
            log.trace("No history for sessionId={}", sessionId);
            return null;
        }
        return turns.stream()
                .map(turn -> turn.role() + ": " + turn.content())
                .collect(Collectors.joining("\n"));
    }

    @Override
    public void clear(String sessionId) {
        List<Turn> removed = sessions.remove(sessionId);
        if (removed != null) {
            log.debug("Cleared session {} removedTurns={}", sessionId, removed.size());
        } else {
            log.debug("No session found to clear sessionId={}", sessionId);
        }
    }
}
