package com.legaldedup.dto.internal;

import com.legaldedup.model.DuplicateType;
import com.legaldedup.model.SimilarityMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Derived comparison outcome for a canonically ordered document pair
 * ({@code documentId1 < documentId2}).
 */
@Value
@Builder
public class DuplicateMatch {

    String documentId1;

    String documentId2;

    DuplicateType duplicateType;

    double similarityScore;

    double confidence;

    SimilarityMethod methodUsed;

    Map<String, Object> details;

    Instant detectedAt;
}
