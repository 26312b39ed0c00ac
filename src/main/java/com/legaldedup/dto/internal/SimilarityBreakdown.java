package com.legaldedup.dto.internal;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Component similarities of one pair and their weighted fusion. A content hash match
 * skips the components entirely: they stay 0 and {@code fused} is 1.
 */
public record SimilarityBreakdown(
        double fuzzy,
        double tfidf,
        double semantic,
        double structural,
        double visual,
        double metadata,
        double fused,
        boolean hashMatch
) {

    public static SimilarityBreakdown ofHashMatch() {
        return new SimilarityBreakdown(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 1.0, true);
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (hashMatch) {
            details.put("hash_match", true);
            return details;
        }
        details.put("fuzzy_similarity", fuzzy);
        details.put("tfidf_similarity", tfidf);
        details.put("semantic_similarity", semantic);
        details.put("structural_similarity", structural);
        details.put("visual_similarity", visual);
        details.put("metadata_similarity", metadata);
        return details;
    }
}
