package com.example.courserag.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.util.StringUtils;

import java.io.File;

/**
 * Spring AI wiring. {@link AiProperties#getMode()} decides which {@link ChatModel} and
 * {@link EmbeddingModel} are used; both the OpenAI and Ollama starters contribute their
 * model beans, so this configuration only routes between them. Model-level settings such
 * as base URLs and API keys stay under {@code spring.ai.openai.*} / {@code spring.ai.ollama.*}.
 */
@Configuration
@EnableConfigurationProperties(AiProperties.class)
@Slf4j
public class SpringAiConfig {

    private final AiProperties properties;

    public SpringAiConfig(AiProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Primary
    public ChatModel routingChatModel(
            ObjectProvider<OpenAiChatModel> openAiChatModelProvider,
            ObjectProvider<OllamaChatModel> ollamaChatModelProvider) {
        AiProperties.Mode mode = properties.getMode();
        log.info("Configuring Spring AI chat model for mode={} model={}", mode, properties.getModel());
        return switch (mode) {
            case OPENAI -> openAiChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("OpenAI mode selected but OpenAiChatModel bean is missing. " +
                        "Ensure spring-ai-starter-model-openai is on the classpath and configured.");
            });
            case OLLAMA -> ollamaChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("Ollama mode selected but OllamaChatModel bean is missing. " +
                        "Ensure spring-ai-starter-model-ollama is on the classpath and configured.");
            });
        };
    }

    @Bean
    @ConditionalOnMissingBean(VectorStore.class)
    public SimpleVectorStore courseVectorStore(
            ObjectProvider<OpenAiEmbeddingModel> openAiEmbeddingModelProvider,
            ObjectProvider<OllamaEmbeddingModel> ollamaEmbeddingModelProvider) {
        EmbeddingModel embeddingModel = switch (properties.getMode()) {
            case OPENAI -> openAiEmbeddingModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("OpenAI mode selected but OpenAiEmbeddingModel bean is missing.");
            });
            case OLLAMA -> ollamaEmbeddingModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("Ollama mode selected but OllamaEmbeddingModel bean is missing.");
            });
        };
        SimpleVectorStore store = SimpleVectorStore.builder(embeddingModel).build();

        String storePath = properties.getRetrieval().getStorePath();
        if (StringUtils.hasText(storePath)) {
            File file = new File(storePath);
            if (file.isFile()) {
                store.load(file);
                log.info("Loaded course vector store from {}", file.getAbsolutePath());
            } else {
                log.warn("Configured course store {} does not exist; starting with an empty store", file.getAbsolutePath());
            }
        } else {
            log.info("No course store configured; starting with an empty in-memory vector store");
        }
        return store;
    }
}
