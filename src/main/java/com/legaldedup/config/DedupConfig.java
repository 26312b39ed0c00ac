package com.legaldedup.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Detection, fingerprinting, batch and monitoring settings.
 * Embedding transport settings live in {@link EmbeddingConfig}.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "legal-dedup")
public class DedupConfig {

    private Detection detection;
    private Fingerprint fingerprint;
    private Batch batch;
    private Monitoring monitoring;

    // ============================================================
    // Detection Configuration
    // ============================================================
    @Data
    public static class Detection {
        private Double similarityThreshold;  // Reporting cutoff for find/batch results
    }

    // ============================================================
    // Fingerprint Configuration
    // ============================================================
    @Data
    public static class Fingerprint {
        private Boolean embeddingEnabled;
        private Integer embeddingMaxChars;
        private Integer embeddingTimeoutSeconds;
        private Integer visualTimeoutSeconds;
    }

    // ============================================================
    // Batch Configuration
    // ============================================================
    @Data
    public static class Batch {
        private Integer timeoutSeconds;
        private Integer parallelism;
    }

    // ============================================================
    // Monitoring Configuration
    // ============================================================
    @Data
    public static class Monitoring {
        private Boolean enabled;
        private Integer maxOperationHistory;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public double getSimilarityThreshold() {
        return detection != null && detection.getSimilarityThreshold() != null
                ? detection.getSimilarityThreshold()
                : 0.8;
    }

    public boolean isEmbeddingEnabled() {
        return fingerprint == null || fingerprint.getEmbeddingEnabled() == null
                || fingerprint.getEmbeddingEnabled();
    }

    public int getEmbeddingMaxChars() {
        return fingerprint != null && fingerprint.getEmbeddingMaxChars() != null
                ? fingerprint.getEmbeddingMaxChars()
                : 512;
    }

    public int getEmbeddingTimeoutSeconds() {
        return fingerprint != null && fingerprint.getEmbeddingTimeoutSeconds() != null
                ? fingerprint.getEmbeddingTimeoutSeconds()
                : 10;
    }

    public int getVisualTimeoutSeconds() {
        return fingerprint != null && fingerprint.getVisualTimeoutSeconds() != null
                ? fingerprint.getVisualTimeoutSeconds()
                : 10;
    }

    public int getBatchTimeoutSeconds() {
        return batch != null && batch.getTimeoutSeconds() != null
                ? batch.getTimeoutSeconds()
                : 300;
    }

    public int getBatchParallelism() {
        return batch != null && batch.getParallelism() != null
                ? batch.getParallelism()
                : Runtime.getRuntime().availableProcessors();
    }

    public boolean isMonitoringEnabled() {
        return monitoring == null || monitoring.getEnabled() == null || monitoring.getEnabled();
    }

    public int getMaxOperationHistory() {
        return monitoring != null && monitoring.getMaxOperationHistory() != null
                ? monitoring.getMaxOperationHistory()
                : 100;
    }

    // ============================================================
    // Initialization & Logging
    // ============================================================

    @PostConstruct
    public void init() {
        if (getSimilarityThreshold() < 0.0 || getSimilarityThreshold() > 1.0) {
            throw new IllegalStateException(
                    "legal-dedup.detection.similarity-threshold must be within [0, 1], got " + getSimilarityThreshold());
        }

        log.info("=".repeat(70));
        log.info("DEDUPLICATION CONFIGURATION INITIALIZED");
        log.info("=".repeat(70));
        log.info("  Similarity threshold : {}", getSimilarityThreshold());
        log.info("  Embedding enabled    : {} (max {} chars, timeout {}s)",
                isEmbeddingEnabled(), getEmbeddingMaxChars(), getEmbeddingTimeoutSeconds());
        log.info("  Visual hash timeout  : {}s", getVisualTimeoutSeconds());
        log.info("  Batch                : parallelism={}, timeout={}s",
                getBatchParallelism(), getBatchTimeoutSeconds());
        log.info("  Monitoring           : enabled={}, history={}",
                isMonitoringEnabled(), getMaxOperationHistory());
        log.info("=".repeat(70));
    }
}
