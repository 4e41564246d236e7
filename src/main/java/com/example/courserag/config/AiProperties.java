package com.example.courserag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Central application properties for the course assistant.
 *
 * <p>{@code ai.mode} picks the Spring AI chat model; the remaining groups tune the tool
 * rounds, session memory, retrieval and the web-edge timeout.</p>
 */
@Data
@ConfigurationProperties(prefix = "ai")
public class AiProperties {

    public enum Mode {
        OPENAI, OLLAMA
    }

    private Mode mode = Mode.OPENAI;

    private String model = "gpt-4o-mini";
    private double temperature = 0.0;
    private int maxTokens = 800;

    private Tools tools = new Tools();
    private Memory memory = new Memory();
    private Retrieval retrieval = new Retrieval();
    private Client client = new Client();

    @Data
    public static class Tools {
        private int maxRounds = 2;
    }

    @Data
    public static class Memory {
        /**
         * Number of question/answer exchanges kept per session.
         */
        private int maxHistory = 2;
    }

    @Data
    public static class Retrieval {
        private int maxResults = 5;
        /**
         * Optional file written by {@code SimpleVectorStore#save}; loaded at startup when present.
         */
        private String storePath;
    }

    @Data
    public static class Client {
        private long timeoutMs = 60_000;
    }
}
