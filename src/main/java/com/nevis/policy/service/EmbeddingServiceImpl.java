package com.nevis.policy.service;

import com.nevis.policy.exception.QueryEmbeddingException;
import com.nevis.policy.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private static final int MAX_QUERY_LENGTH = 1000;

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;

    public EmbeddingServiceImpl(
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        EmbeddingModel embeddingModel
    ) {
        this.embeddingLimiter = embeddingLimiter;
        this.embeddingModel = embeddingModel;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttempts = 3,
        backoff = @Backoff(delayExpression = "${app.ingestion.retry-delay-ms:1000}", multiplier = 2)
    )
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        int estimatedTokens = texts.stream().mapToInt(String::length).sum() / 4;
        Response<List<Embedding>> response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens,
            () -> embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList()));

        List<Embedding> embeddings = response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new RetriableException("Embedding count mismatch: sent %d, received %d"
                .formatted(texts.size(), embeddings == null ? 0 : embeddings.size()));
        }

        log.debug("Embedded batch of {} chunks", texts.size());
        return embeddings.stream().map(Embedding::vector).toList();
    }

    @Override
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        String query = inputQuery.trim();
        if (query.length() > MAX_QUERY_LENGTH) {
            query = query.substring(0, MAX_QUERY_LENGTH);
            log.warn("Query was truncated for embedding: {}", query);
        }

        log.debug("Generating embedding for query: '{}'", query);

        try {
            String text = query;
            float[] vector = embeddingLimiter.execute(EMBEDDING_LIMIT, Math.max(1, text.length() / 4),
                () -> embeddingModel.embed(text).content().vector());
            if (vector == null || vector.length == 0) {
                throw new IllegalStateException("Embedding model returned an empty vector for query: " + query);
            }

            return vector;

        } catch (Exception e) {
            log.error("Failed to generate embedding for query: {}", query, e);
            throw new QueryEmbeddingException("Error during query vectorization", e);
        }
    }
}
