package com.policyqa.service;

import com.policyqa.exception.EmbeddingException;
import com.policyqa.infra.RateLimiter;
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
import java.util.Locale;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    static final int MAX_QUERY_CHARS = 1000;

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;

    public EmbeddingServiceImpl(
        EmbeddingModel embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
    }

    @Override
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        String query = inputQuery.trim().toLowerCase(Locale.ROOT);
        if (query.length() > MAX_QUERY_CHARS) {
            query = query.substring(0, MAX_QUERY_CHARS);
            log.warn("Query was truncated to {} characters for embedding", MAX_QUERY_CHARS);
        }

        log.debug("Generating embedding for query: '{}'", query);

        String text = query;
        try {
            float[] vector = embeddingLimiter.execute(estimateTokens(text),
                () -> embeddingModel.embed(text).content().vector());
            if (vector == null || vector.length == 0) {
                throw new IllegalStateException("Embedding model returned an empty vector");
            }
            return vector;
        } catch (Exception e) {
            log.error("Failed to generate embedding for query: {}", text, e);
            throw new EmbeddingException("Error during query vectorization", e);
        }
    }

    /**
     * Used by the indexer. Retries provider hiccups here; the query path retries at the pipeline level instead.
     */
    @Override
    @Retryable(
        retryFor = {RetriableException.class, EmbeddingResponseMismatchException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        int estimatedTokens = texts.stream().mapToInt(EmbeddingServiceImpl::estimateTokens).sum();
        Response<List<Embedding>> response = embeddingLimiter.execute(estimatedTokens,
            () -> embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList()));

        List<Embedding> embeddings = response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingResponseMismatchException(texts.size(), embeddings == null ? 0 : embeddings.size());
        }

        log.debug("Embedded batch of {} texts (~{} tokens)", texts.size(), estimatedTokens);
        return embeddings.stream().map(Embedding::vector).toList();
    }

    private static int estimateTokens(String text) {
        return Math.max(1, text.length() / 4);
    }

    static class EmbeddingResponseMismatchException extends RuntimeException {
        EmbeddingResponseMismatchException(int expected, int actual) {
            super("Expected " + expected + " embeddings but received " + actual);
        }
    }
}
