package com.legaldedup.service.embedding;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.legaldedup.config.EmbeddingConfig;
import com.legaldedup.exception.EmbeddingException;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls the Python embedding server ({@code POST /embed}, body {@code {"texts": [...]}}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemoteEmbeddingClient implements EmbeddingClient {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final EmbeddingConfig embeddingConfig;
    private final WebClient embeddingWebClient;

    @Override
    @Cacheable(
            value = "embeddings",
            key = "#maxChars + ':' + T(org.apache.commons.codec.digest.DigestUtils).sha256Hex(#text)",
            unless = "#result == null"
    )
    @CircuitBreaker(name = "embedding", fallbackMethod = "embeddingUnavailable")
    @Retry(name = "embedding")
    public List<Double> embed(String text, int maxChars) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Text is empty");
        }

        String truncated = text.length() > maxChars ? text.substring(0, maxChars) : text;
        log.debug("Calling embedding service ({} chars)", truncated.length());

        Map<String, Object> response;
        try {
            response = embeddingWebClient.post()
                    .uri("/embed")
                    .bodyValue(Map.of("texts", List.of(truncated)))
                    .retrieve()
                    .bodyToMono(RESPONSE_TYPE)
                    .block(Duration.ofSeconds(embeddingConfig.getTimeoutSeconds()));
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        }

        return extractVector(response);
    }

    /**
     * Open circuit or exhausted retries. There is no substitute vector: a placeholder
     * would be compared as if it were real, so the failure is surfaced instead.
     */
    public List<Double> embeddingUnavailable(String text, int maxChars, Throwable ex) {
        log.warn("Embedding service unavailable: {}", ex.getMessage());
        if (ex instanceof EmbeddingException embeddingException) {
            throw embeddingException;
        }
        throw new EmbeddingException("Embedding service unavailable", ex);
    }

    List<Double> extractVector(Map<String, Object> response) {
        if (response == null || !response.containsKey("embeddings")) {
            throw new EmbeddingException("Invalid response from embedding service");
        }

        Object embeddings = response.get("embeddings");
        if (!(embeddings instanceof List<?> rows) || rows.isEmpty() || !(rows.get(0) instanceof List<?> row)) {
            throw new EmbeddingException("Empty embedding response from embedding service");
        }

        List<Double> vector = row.stream()
                .map(value -> {
                    if (!(value instanceof Number number)) {
                        throw new EmbeddingException("Non-numeric embedding component: " + value);
                    }
                    return number.doubleValue();
                })
                .toList();

        if (vector.size() != embeddingConfig.getDimension()) {
            log.warn(
                "Embedding dimension mismatch: expected {}, got {}",
                embeddingConfig.getDimension(),
                vector.size()
            );
        }

        return vector;
    }
}
