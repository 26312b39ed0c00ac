package com.legaldedup.service.fingerprint;

import com.legaldedup.config.DedupConfig;
import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.service.comparison.ComparisonCache;
import com.legaldedup.service.embedding.EmbeddingClient;
import com.legaldedup.service.visual.PerceptualHashService;
import com.legaldedup.util.FingerprintHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Builds document fingerprints and registers them. Optional signals whose
 * collaborator fails or times out are left absent; creation itself never fails on them.
 */
@Slf4j
@Service
public class FingerprintService {

    private static final int WORDS_PER_PAGE = 250;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final FingerprintRegistry registry;
    private final ComparisonCache comparisonCache;
    private final TfIdfVectorizer tfIdfVectorizer;
    private final StructuralFeatureExtractor structuralFeatureExtractor;
    private final EmbeddingClient embeddingClient;
    private final PerceptualHashService perceptualHashService;
    private final DedupConfig dedupConfig;
    private final Executor signalExecutor;

    private final AtomicLong generations = new AtomicLong();

    public FingerprintService(
            FingerprintRegistry registry,
            ComparisonCache comparisonCache,
            TfIdfVectorizer tfIdfVectorizer,
            StructuralFeatureExtractor structuralFeatureExtractor,
            EmbeddingClient embeddingClient,
            PerceptualHashService perceptualHashService,
            DedupConfig dedupConfig,
            @Qualifier("signalExecutor") Executor signalExecutor
    ) {
        this.registry = registry;
        this.comparisonCache = comparisonCache;
        this.tfIdfVectorizer = tfIdfVectorizer;
        this.structuralFeatureExtractor = structuralFeatureExtractor;
        this.embeddingClient = embeddingClient;
        this.perceptualHashService = perceptualHashService;
        this.dedupConfig = dedupConfig;
        this.signalExecutor = signalExecutor;
    }

    public DocumentFingerprint create(String documentId, String text) {
        return create(documentId, text, null, null);
    }

    /**
     * Fingerprints a document, replaces any previous fingerprint with the same id
     * and evicts every cached score that involves the id.
     */
    public DocumentFingerprint create(
            String documentId,
            String text,
            Map<String, Object> metadata,
            String imageRef
    ) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        if (text == null) {
            throw new IllegalArgumentException("Document text is required for " + documentId);
        }

        log.info("Creating fingerprint for document: {}", documentId);
        long startTime = System.nanoTime();

        // Collaborators run while the local signals are computed
        CompletableFuture<List<Double>> embedding = dedupConfig.isEmbeddingEnabled() && !text.isBlank()
                ? submit(() -> embeddingClient.embed(text, dedupConfig.getEmbeddingMaxChars()), "Embedding", documentId)
                : null;
        CompletableFuture<String> visual = imageRef != null && !imageRef.isBlank()
                ? submit(() -> perceptualHashService.perceptualHash(imageRef), "Visual hash", documentId)
                : null;

        Map<String, Object> safeMetadata = metadata != null ? metadata : Map.of();
        String contentHash = FingerprintHasher.contentHash(text);
        String fuzzyHash = FingerprintHasher.fuzzyHash(text);
        String metadataHash = FingerprintHasher.metadataHash(safeMetadata);
        Map<String, Object> structuralFeatures = structuralFeatureExtractor.extract(text);
        Map<String, Double> tfidfVector = extractTfidf(documentId, text);

        int wordCount = countWords(text);

        DocumentFingerprint fingerprint = DocumentFingerprint.builder()
                .documentId(documentId)
                .contentHash(contentHash)
                .fuzzyHash(fuzzyHash)
                .metadataHash(metadataHash)
                .structuralFeatures(structuralFeatures)
                .tfidfVector(tfidfVector)
                .semanticVector(usableEmbedding(documentId,
                        await(embedding, dedupConfig.getEmbeddingTimeoutSeconds(), "Embedding", documentId)))
                .visualHash(usableVisualHash(
                        await(visual, dedupConfig.getVisualTimeoutSeconds(), "Visual hash", documentId)))
                .wordCount(wordCount)
                .charCount(text.codePointCount(0, text.length()))
                .pageCount(Math.max(1, wordCount / WORDS_PER_PAGE))
                .createdAt(Instant.now())
                .generation(generations.incrementAndGet())
                .build();

        boolean replaced = registry.put(fingerprint).isPresent();
        int evicted = comparisonCache.evictDocument(documentId);

        log.info("Fingerprint ready: {} | words={} | tfidf={} | semantic={} | visual={} | replaced={} | evicted={} | {}ms",
                documentId, wordCount,
                fingerprint.hasTfidfVector(), fingerprint.hasSemanticVector(), fingerprint.hasVisualHash(),
                replaced, evicted, (System.nanoTime() - startTime) / 1_000_000);

        return fingerprint;
    }

    private Map<String, Double> extractTfidf(String documentId, String text) {
        try {
            return tfIdfVectorizer.vectorize(documentId, text);
        } catch (RuntimeException e) {
            log.warn("TF-IDF extraction failed for {}: {}", documentId, e.getMessage());
            return null;
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task, String signal, String documentId) {
        try {
            return CompletableFuture.supplyAsync(task, signalExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("{} rejected for {}, signal pool saturated - signal left absent", signal, documentId);
            return null;
        }
    }

    private <T> T await(CompletableFuture<T> future, int timeoutSeconds, String signal, String documentId) {
        if (future == null) {
            return null;
        }
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}s for {} - signal left absent", signal, timeoutSeconds, documentId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} failed for {} - signal left absent: {}", signal, documentId, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("{} interrupted for {} - signal left absent", signal, documentId);
        }
        return null;
    }

    private List<Double> usableEmbedding(String documentId, List<Double> vector) {
        if (vector == null || vector.isEmpty()) {
            return null;
        }
        boolean allZero = true;
        for (Double value : vector) {
            if (value == null || value.isNaN() || value.isInfinite()) {
                log.warn("Embedding for {} contains non-finite values - discarded", documentId);
                return null;
            }
            if (value != 0.0) {
                allZero = false;
            }
        }
        if (allZero) {
            log.warn("Embedding for {} is a zero vector - discarded", documentId);
            return null;
        }
        return List.copyOf(vector);
    }

    private static String usableVisualHash(String hash) {
        return hash == null || hash.isBlank() ? null : hash.trim().toLowerCase(Locale.ROOT);
    }

    static int countWords(String text) {
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return collapsed.isEmpty() ? 0 : collapsed.split(" ").length;
    }
}
