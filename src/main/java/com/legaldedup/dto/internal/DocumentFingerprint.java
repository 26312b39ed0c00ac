package com.legaldedup.dto.internal;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable bundle of hashes, vectors and features derived once from a document.
 * Optional signals are either complete or {@code null}, never partially filled.
 */
@Value
@Builder(toBuilder = true)
public class DocumentFingerprint {

    String documentId;

    String contentHash;

    String fuzzyHash;

    String metadataHash;

    /**
     * Integer counts and boolean flags keyed by feature name.
     */
    Map<String, Object> structuralFeatures;

    /**
     * Sparse L2-normalized term weights, or null when no terms survived tokenization.
     */
    Map<String, Double> tfidfVector;

    /**
     * Embedding from the embedding service, or null when it was unavailable.
     */
    List<Double> semanticVector;

    /**
     * Hex perceptual hash of the rendered page, or null without an image.
     */
    String visualHash;

    int wordCount;

    int charCount;

    int pageCount;

    Instant createdAt;

    long generation;

    public boolean hasTfidfVector() {
        return tfidfVector != null && !tfidfVector.isEmpty();
    }

    public boolean hasSemanticVector() {
        return semanticVector != null && !semanticVector.isEmpty();
    }

    public boolean hasVisualHash() {
        return visualHash != null && !visualHash.isEmpty();
    }
}
