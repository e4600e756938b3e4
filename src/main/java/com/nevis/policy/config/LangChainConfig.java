package com.nevis.policy.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
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
    public EmbeddingModel embeddingModel() {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName("gemini-embedding-001")
            .outputDimensionality(EMBEDDING_DIMENSIONS)
            .timeout(Duration.ofSeconds(60))
            .maxRetries(5)
            .build();
    }
}
