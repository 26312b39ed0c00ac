package com.legaldedup.service.comparison;

import com.legaldedup.dto.internal.SimilarityBreakdown;

/**
 * Weights of the six component similarities in the fused score.
 */
public record SimilarityWeights(
        double fuzzy,
        double tfidf,
        double semantic,
        double structural,
        double visual,
        double metadata) {

    public SimilarityWeights {
        double sum = fuzzy + tfidf + semantic + structural + visual + metadata;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException(
                    String.format("Weights must sum to 1.0, got %.3f", sum));
        }
    }

    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.20, 0.30, 0.25, 0.15, 0.05, 0.05);
    }

    public double combine(
            double fuzzyScore,
            double tfidfScore,
            double semanticScore,
            double structuralScore,
            double visualScore,
            double metadataScore) {
        return fuzzy * fuzzyScore
                + tfidf * tfidfScore
                + semantic * semanticScore
                + structural * structuralScore
                + visual * visualScore
                + metadata * metadataScore;
    }

    public SimilarityBreakdown breakdown(
            double fuzzyScore,
            double tfidfScore,
            double semanticScore,
            double structuralScore,
            double visualScore,
            double metadataScore) {
        return new SimilarityBreakdown(
                fuzzyScore, tfidfScore, semanticScore, structuralScore, visualScore, metadataScore,
                combine(fuzzyScore, tfidfScore, semanticScore, structuralScore, visualScore, metadataScore),
                false);
    }
}
