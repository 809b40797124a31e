package com.policyqa.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainConfig {

    public static final int EMBEDDING_DIMENSIONS = 768;

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Bean
    public ChatModel chatLanguageModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName("gemini-2.0-flash")
            .temperature(0.0)
            .timeout(Duration.ofSeconds(20))
            .maxRetries(1)
            .build();
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName("gemini-embedding-001")
            .outputDimensionality(EMBEDDING_DIMENSIONS)
            .maxRetries(1)
            .build();
    }
}
