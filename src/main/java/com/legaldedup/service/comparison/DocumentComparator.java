package com.legaldedup.service.comparison;

import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.dto.internal.DuplicateMatch;
import com.legaldedup.dto.internal.SimilarityBreakdown;
import com.legaldedup.model.DuplicateType;
import com.legaldedup.model.SimilarityMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fuses the component similarities of two fingerprints into a scored, classified match.
 * Works on fingerprints only: no I/O, no shared state.
 */
@Slf4j
@Component
public class DocumentComparator {

    /** Fused scores below this are not reported at all. */
    public static final double REPORTING_FLOOR = 0.3;

    private static final double EXACT_THRESHOLD = 0.95;
    private static final double NEAR_EXACT_THRESHOLD = 0.85;
    private static final double SIMILAR_THRESHOLD = 0.7;
    private static final double PARTIAL_THRESHOLD = 0.4;

    private final SimilarityWeights weights = SimilarityWeights.defaults();

    /**
     * @return the match, or null when the fused score is below {@link #REPORTING_FLOOR}
     */
    public DuplicateMatch compare(DocumentFingerprint fp1, DocumentFingerprint fp2) {
        return toMatch(fp1, fp2, evaluate(fp1, fp2));
    }

    /**
     * Component and fused scores without the reporting floor. Evaluation order is fixed
     * by document id, so swapping the arguments gives bit-identical results.
     */
    public SimilarityBreakdown evaluate(DocumentFingerprint fp1, DocumentFingerprint fp2) {
        if (fp1.getDocumentId().compareTo(fp2.getDocumentId()) > 0) {
            return evaluate(fp2, fp1);
        }

        if (fp1.getContentHash().equals(fp2.getContentHash())) {
            return SimilarityBreakdown.ofHashMatch();
        }

        SimilarityBreakdown breakdown = weights.breakdown(
                SimilarityCalculator.fuzzy(fp1.getFuzzyHash(), fp2.getFuzzyHash()),
                SimilarityCalculator.tfidf(fp1.getTfidfVector(), fp2.getTfidfVector()),
                SimilarityCalculator.semantic(fp1.getSemanticVector(), fp2.getSemanticVector()),
                SimilarityCalculator.structural(fp1.getStructuralFeatures(), fp2.getStructuralFeatures()),
                SimilarityCalculator.visual(fp1.getVisualHash(), fp2.getVisualHash()),
                SimilarityCalculator.metadata(fp1.getMetadataHash(), fp2.getMetadataHash())
        );

        log.debug("Compared {} / {}: {}", fp1.getDocumentId(), fp2.getDocumentId(), breakdown);
        return breakdown;
    }

    /**
     * Builds the match for an already evaluated pair.
     */
    public DuplicateMatch toMatch(DocumentFingerprint fp1, DocumentFingerprint fp2, SimilarityBreakdown breakdown) {
        if (fp1.getDocumentId().compareTo(fp2.getDocumentId()) > 0) {
            return toMatch(fp2, fp1, breakdown);
        }

        if (breakdown.hashMatch()) {
            return DuplicateMatch.builder()
                    .documentId1(fp1.getDocumentId())
                    .documentId2(fp2.getDocumentId())
                    .duplicateType(DuplicateType.EXACT)
                    .similarityScore(1.0)
                    .confidence(1.0)
                    .methodUsed(SimilarityMethod.HASH)
                    .details(breakdown.toDetails())
                    .detectedAt(Instant.now())
                    .build();
        }

        if (breakdown.fused() < REPORTING_FLOOR) {
            return null;
        }

        Map<String, Object> details = breakdown.toDetails();
        details.put("word_count_diff", Math.abs(fp1.getWordCount() - fp2.getWordCount()));
        details.put("page_count_diff", Math.abs(fp1.getPageCount() - fp2.getPageCount()));

        return DuplicateMatch.builder()
                .documentId1(fp1.getDocumentId())
                .documentId2(fp2.getDocumentId())
                .duplicateType(classify(breakdown))
                .similarityScore(breakdown.fused())
                .confidence(confidence(breakdown))
                .methodUsed(primaryMethod(breakdown))
                .details(details)
                .detectedAt(Instant.now())
                .build();
    }

    /**
     * First matching rule wins; the structural/tfidf rules sit between the
     * NEAR_EXACT and SIMILAR score bands.
     */
    public static DuplicateType classify(SimilarityBreakdown breakdown) {
        double fused = breakdown.fused();
        if (fused >= EXACT_THRESHOLD) {
            return DuplicateType.EXACT;
        }
        if (fused >= NEAR_EXACT_THRESHOLD) {
            return DuplicateType.NEAR_EXACT;
        }
        if (breakdown.structural() >= 0.8 && breakdown.tfidf() >= 0.6) {
            return DuplicateType.VERSION;
        }
        if (breakdown.structural() >= 0.9 && breakdown.tfidf() < 0.4) {
            return DuplicateType.TEMPLATE;
        }
        if (fused >= SIMILAR_THRESHOLD) {
            return DuplicateType.SIMILAR;
        }
        if (fused >= PARTIAL_THRESHOLD) {
            return DuplicateType.PARTIAL;
        }
        return DuplicateType.NOT_DUPLICATE;
    }

    /**
     * Highest of the four primary components, earlier ones winning ties. Visual and
     * metadata only corroborate and are never reported as the method.
     */
    public static SimilarityMethod primaryMethod(SimilarityBreakdown breakdown) {
        SimilarityMethod method = SimilarityMethod.FUZZY;
        double best = breakdown.fuzzy();
        if (breakdown.tfidf() > best) {
            method = SimilarityMethod.TFIDF;
            best = breakdown.tfidf();
        }
        if (breakdown.semantic() > best) {
            method = SimilarityMethod.SEMANTIC;
            best = breakdown.semantic();
        }
        if (breakdown.structural() > best) {
            method = SimilarityMethod.STRUCTURAL;
        }
        return method;
    }

    /**
     * Agreement of the non-zero primary components: 0.5 with fewer than two,
     * otherwise {@code max(0.1, 1 - 2 * stdev)}, plus 0.2 (capped at 1) when their mean is at least 0.8.
     */
    public static double confidence(SimilarityBreakdown breakdown) {
        List<Double> values = List.of(
                        breakdown.fuzzy(), breakdown.tfidf(), breakdown.semantic(), breakdown.structural())
                .stream()
                .filter(value -> value > 0.0)
                .toList();

        if (values.size() < 2) {
            return 0.5;
        }

        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = values.stream()
                .mapToDouble(value -> (value - mean) * (value - mean))
                .sum() / values.size();

        double confidence = Math.max(0.1, 1.0 - 2.0 * Math.sqrt(variance));
        if (mean >= 0.8) {
            confidence = Math.min(1.0, confidence + 0.2);
        }
        return confidence;
    }
}
