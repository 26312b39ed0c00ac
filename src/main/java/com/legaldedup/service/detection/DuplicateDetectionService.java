package com.legaldedup.service.detection;

import com.legaldedup.config.DedupConfig;
import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.dto.internal.DuplicateMatch;
import com.legaldedup.dto.internal.SimilarityBreakdown;
import com.legaldedup.exception.DedupException;
import com.legaldedup.exception.DetectionTimeoutException;
import com.legaldedup.service.comparison.ComparisonCache;
import com.legaldedup.service.comparison.DocumentComparator;
import com.legaldedup.service.fingerprint.FingerprintRegistry;
import com.legaldedup.service.monitoring.OperationTimer;
import com.legaldedup.service.monitoring.PerformanceMonitorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One-to-many and all-pairs duplicate detection over the fingerprint registry.
 * Every pair goes through the comparison cache: a cached score below the threshold
 * skips the comparison, anything else is recomputed and written back.
 */
@Slf4j
@Service
public class DuplicateDetectionService {

    static final Comparator<DuplicateMatch> BY_SCORE_DESC = Comparator
            .comparingDouble(DuplicateMatch::getSimilarityScore).reversed()
            .thenComparing(DuplicateMatch::getDocumentId1)
            .thenComparing(DuplicateMatch::getDocumentId2);

    private final FingerprintRegistry registry;
    private final DocumentComparator comparator;
    private final ComparisonCache comparisonCache;
    private final PerformanceMonitorService performanceMonitor;
    private final DedupConfig dedupConfig;
    private final Executor comparisonExecutor;

    private final AtomicLong comparisonsPerformed = new AtomicLong();

    public DuplicateDetectionService(
            FingerprintRegistry registry,
            DocumentComparator comparator,
            ComparisonCache comparisonCache,
            PerformanceMonitorService performanceMonitor,
            DedupConfig dedupConfig,
            @Qualifier("comparisonExecutor") Executor comparisonExecutor
    ) {
        this.registry = registry;
        this.comparator = comparator;
        this.comparisonCache = comparisonCache;
        this.performanceMonitor = performanceMonitor;
        this.dedupConfig = dedupConfig;
        this.comparisonExecutor = comparisonExecutor;
    }

    public List<DuplicateMatch> findDuplicates(String documentId) {
        return findDuplicates(documentId, null);
    }

    /**
     * Compares one document against the given targets, or against every other
     * registered document when no targets are given.
     *
     * @return matches at or above the similarity threshold, highest score first
     */
    public List<DuplicateMatch> findDuplicates(String documentId, Collection<String> targetIds) {
        OperationTimer timer = OperationTimer.start("find_duplicates");
        DocumentFingerprint source = registry.require(documentId);

        Collection<DocumentFingerprint> targets = targetIds == null || targetIds.isEmpty()
                ? registry.snapshot().values()
                : registry.requireAll(targetIds).values();
        timer.mark("Resolve");

        double threshold = dedupConfig.getSimilarityThreshold();
        List<DuplicateMatch> matches = new ArrayList<>();
        for (DocumentFingerprint target : targets) {
            if (target.getDocumentId().equals(documentId)) {
                continue;
            }
            DuplicateMatch match = compareCached(source, target, threshold);
            if (match != null) {
                matches.add(match);
            }
        }
        matches.sort(BY_SCORE_DESC);
        timer.mark("Compare");

        log.info("find_duplicates({}) -> {} matches over {} targets", documentId, matches.size(), targets.size());
        performanceMonitor.record(timer, targets.size(), matches.size());
        return matches;
    }

    public List<DuplicateMatch> batchDetectDuplicates(Collection<String> documentIds) {
        return batchDetectDuplicates(documentIds, null);
    }

    /**
     * All-pairs sweep (each unordered pair once) over a snapshot of the chosen documents,
     * or of the whole registry. The sweep is quadratic in the number of documents; rows are
     * spread over the comparison pool and the whole run is bounded by {@code timeout}
     * (the configured batch timeout when null).
     *
     * @return matches at or above the similarity threshold, highest score first
     * @throws DetectionTimeoutException when the sweep does not finish in time
     */
    public List<DuplicateMatch> batchDetectDuplicates(Collection<String> documentIds, Duration timeout) {
        OperationTimer timer = OperationTimer.start("batch_detect_duplicates");
        SortedMap<String, DocumentFingerprint> snapshot = documentIds == null || documentIds.isEmpty()
                ? registry.snapshot()
                : registry.requireAll(documentIds);
        List<DocumentFingerprint> ordered = new ArrayList<>(snapshot.values());
        timer.mark("Snapshot");

        Duration limit = timeout != null ? timeout : Duration.ofSeconds(dedupConfig.getBatchTimeoutSeconds());
        long deadline = System.nanoTime() + limit.toNanos();
        double threshold = dedupConfig.getSimilarityThreshold();
        AtomicBoolean cancelled = new AtomicBoolean(false);

        List<CompletableFuture<List<DuplicateMatch>>> rows = new ArrayList<>();
        List<Integer> surplusRows = new ArrayList<>();
        for (int i = 0; i < ordered.size() - 1; i++) {
            int row = i;
            try {
                rows.add(CompletableFuture.supplyAsync(
                        () -> compareRow(ordered, row, threshold, cancelled, deadline), comparisonExecutor));
            } catch (RejectedExecutionException e) {
                surplusRows.add(row);
            }
        }

        List<DuplicateMatch> matches = new ArrayList<>();
        try {
            if (!surplusRows.isEmpty()) {
                log.debug("Comparison pool saturated, sweeping {} rows on the caller", surplusRows.size());
                for (int row : surplusRows) {
                    matches.addAll(compareRow(ordered, row, threshold, cancelled, deadline));
                }
            }
            long remaining = Math.max(0L, deadline - System.nanoTime());
            CompletableFuture.allOf(rows.toArray(new CompletableFuture<?>[0]))
                    .get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | CancellationException e) {
            throw timedOut(rows, cancelled, limit, ordered.size(), e);
        } catch (InterruptedException e) {
            cancel(rows, cancelled);
            Thread.currentThread().interrupt();
            throw new DedupException("Duplicate detection interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException && System.nanoTime() - deadline >= 0) {
                throw timedOut(rows, cancelled, limit, ordered.size(), cause);
            }
            cancel(rows, cancelled);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new DedupException("Duplicate detection failed", cause);
        }

        rows.forEach(row -> matches.addAll(row.join()));
        matches.sort(BY_SCORE_DESC);
        timer.mark("Compare");

        log.info("batch_detect_duplicates -> {} matches over {} documents", matches.size(), ordered.size());
        performanceMonitor.record(timer, ordered.size(), matches.size());
        return matches;
    }

    public Map<String, Object> getStatistics() {
        SortedMap<String, DocumentFingerprint> snapshot = registry.snapshot();

        Map<String, Object> coverage = new LinkedHashMap<>();
        coverage.put("tfidf", snapshot.values().stream().filter(DocumentFingerprint::hasTfidfVector).count());
        coverage.put("semantic", snapshot.values().stream().filter(DocumentFingerprint::hasSemanticVector).count());
        coverage.put("visual", snapshot.values().stream().filter(DocumentFingerprint::hasVisualHash).count());

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_documents", snapshot.size());
        stats.put("cached_comparisons", comparisonCache.size());
        stats.put("similarity_threshold", dedupConfig.getSimilarityThreshold());
        stats.put("cache_hits", comparisonCache.getHits());
        stats.put("cache_misses", comparisonCache.getMisses());
        stats.put("comparisons_performed", comparisonsPerformed.get());
        stats.put("signal_coverage", coverage);
        stats.put("fingerprint_creation_times", snapshot.values().stream()
                .map(fp -> fp.getCreatedAt().toString())
                .toList());
        return stats;
    }

    public void clearCache() {
        comparisonCache.clear();
    }

    private List<DuplicateMatch> compareRow(
            List<DocumentFingerprint> ordered,
            int row,
            double threshold,
            AtomicBoolean cancelled,
            long deadline
    ) {
        DocumentFingerprint first = ordered.get(row);
        List<DuplicateMatch> matches = new ArrayList<>();
        for (int column = row + 1; column < ordered.size(); column++) {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Batch sweep cancelled");
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new CancellationException("Batch sweep past its deadline");
            }
            DuplicateMatch match = compareCached(first, ordered.get(column), threshold);
            if (match != null) {
                matches.add(match);
            }
        }
        return matches;
    }

    private DuplicateMatch compareCached(DocumentFingerprint fp1, DocumentFingerprint fp2, double threshold) {
        OptionalDouble cached = comparisonCache.lookup(fp1, fp2);
        if (cached.isPresent() && cached.getAsDouble() < threshold) {
            return null;
        }

        SimilarityBreakdown breakdown = comparator.evaluate(fp1, fp2);
        comparisonsPerformed.incrementAndGet();
        comparisonCache.store(fp1, fp2, breakdown.fused());

        if (breakdown.fused() < threshold) {
            return null;
        }
        return comparator.toMatch(fp1, fp2, breakdown);
    }

    private static DetectionTimeoutException timedOut(
            List<? extends CompletableFuture<?>> rows,
            AtomicBoolean cancelled,
            Duration limit,
            int documentCount,
            Throwable cause
    ) {
        cancel(rows, cancelled);
        log.warn("batch_detect_duplicates timed out after {}ms over {} documents", limit.toMillis(), documentCount);
        return new DetectionTimeoutException(limit, cause);
    }

    private static void cancel(List<? extends CompletableFuture<?>> rows, AtomicBoolean cancelled) {
        cancelled.set(true);
        rows.forEach(row -> row.cancel(true));
    }
}
