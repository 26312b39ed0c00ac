package com.legaldedup.service.detection;

import com.legaldedup.config.DedupConfig;
import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.dto.internal.DuplicateMatch;
import com.legaldedup.exception.DetectionTimeoutException;
import com.legaldedup.exception.DocumentNotFoundException;
import com.legaldedup.model.DuplicateType;
import com.legaldedup.service.comparison.ComparisonCache;
import com.legaldedup.service.comparison.DocumentComparator;
import com.legaldedup.service.comparison.SimilarityWeights;
import com.legaldedup.service.embedding.EmbeddingClient;
import com.legaldedup.service.fingerprint.FingerprintRegistry;
import com.legaldedup.service.fingerprint.FingerprintService;
import com.legaldedup.service.fingerprint.StructuralFeatureExtractor;
import com.legaldedup.service.fingerprint.TfIdfVectorizer;
import com.legaldedup.service.monitoring.PerformanceMonitorService;
import com.legaldedup.service.visual.PerceptualHashService;
import com.legaldedup.util.LegalTextTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DuplicateDetectionServiceTest {

    private static final String LEASE = "WHEREAS the Landlord owns the premises.\n\n"
            + "1. Tenant shall pay rent monthly.\n2. Deposit is refundable.";
    private static final String LEASE_REFORMATTED = "whereas the landlord owns the premises.\n"
            + "1. tenant shall pay rent monthly.   2. deposit is refundable.";
    private static final String NDA = "This Non-Disclosure Agreement protects confidential information "
            + "exchanged between the disclosing party and the recipient.";
    private static final String NDA_COPY = "THIS NON-DISCLOSURE AGREEMENT protects confidential information "
            + "exchanged between the disclosing party and the recipient.";

    private FingerprintRegistry registry;
    private ComparisonCache comparisonCache;
    private DedupConfig dedupConfig;
    private ExecutorService executor;
    private FingerprintService fingerprintService;
    private DuplicateDetectionService detectionService;

    @BeforeEach
    void setUp() {
        registry = new FingerprintRegistry();
        comparisonCache = new ComparisonCache();
        dedupConfig = new DedupConfig();
        dedupConfig.setFingerprint(new DedupConfig.Fingerprint());
        dedupConfig.getFingerprint().setEmbeddingEnabled(false);
        executor = Executors.newFixedThreadPool(2);

        fingerprintService = new FingerprintService(
                registry,
                comparisonCache,
                new TfIdfVectorizer(new LegalTextTokenizer()),
                new StructuralFeatureExtractor(),
                mock(EmbeddingClient.class),
                mock(PerceptualHashService.class),
                dedupConfig,
                executor
        );
        detectionService = newDetectionService(new DocumentComparator());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void findsDuplicatesAboveThreshold() {
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);
        fingerprintService.create("nda", NDA);

        List<DuplicateMatch> matches = detectionService.findDuplicates("lease-b");

        assertThat(matches).hasSize(1);
        DuplicateMatch match = matches.get(0);
        assertThat(match.getDocumentId1()).isEqualTo("lease-a");
        assertThat(match.getDocumentId2()).isEqualTo("lease-b");
        assertThat(match.getDuplicateType()).isEqualTo(DuplicateType.EXACT);
        assertThat(match.getSimilarityScore()).isEqualTo(1.0);
    }

    @Test
    void unknownSourceIsNotFound() {
        assertThatThrownBy(() -> detectionService.findDuplicates("missing"))
                .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void unknownTargetsAreReportedTogether() {
        fingerprintService.create("lease-a", LEASE);

        assertThatThrownBy(() -> detectionService.findDuplicates("lease-a", List.of("x", "lease-a", "y")))
                .isInstanceOfSatisfying(DocumentNotFoundException.class,
                        ex -> assertThat(ex.getDocumentIds()).containsExactly("x", "y"));
    }

    @Test
    void sourceListedAmongTargetsIsSkipped() {
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);

        List<DuplicateMatch> matches = detectionService.findDuplicates("lease-a", List.of("lease-a", "lease-b"));

        assertThat(matches).extracting(DuplicateMatch::getDocumentId2).containsExactly("lease-b");
    }

    @Test
    void cachedScoreBelowThresholdSkipsComparison() {
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);
        fingerprintService.create("nda", NDA);

        detectionService.findDuplicates("lease-a");
        List<DuplicateMatch> again = detectionService.findDuplicates("lease-a");

        Map<String, Object> stats = detectionService.getStatistics();
        assertThat(again).hasSize(1);
        assertThat(stats.get("cache_hits")).isEqualTo(2L);
        // lease-a/nda is answered from the cache, lease-a/lease-b is recomputed
        assertThat(stats.get("comparisons_performed")).isEqualTo(3L);
        assertThat(stats.get("cached_comparisons")).isEqualTo(2);
    }

    @Test
    void refingerprintingInvalidatesCachedMatches() {
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);
        assertThat(detectionService.findDuplicates("lease-a")).hasSize(1);

        fingerprintService.create("lease-b", NDA);

        assertThat(comparisonCache.size()).isZero();
        assertThat(detectionService.findDuplicates("lease-a")).isEmpty();
    }

    @Test
    void batchComparesEveryPairOnce() {
        fingerprintService.create("nda-2", NDA_COPY);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);
        fingerprintService.create("nda-1", NDA);
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("other", "Deed of trust for the property located at Main Street.");

        List<DuplicateMatch> matches = detectionService.batchDetectDuplicates(null);

        assertThat(matches).extracting(m -> m.getDocumentId1() + "|" + m.getDocumentId2())
                .containsExactly("lease-a|lease-b", "nda-1|nda-2");
        assertThat(detectionService.getStatistics().get("comparisons_performed")).isEqualTo(10L);
    }

    @Test
    void batchOverSelectedDocumentsOnly() {
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);
        fingerprintService.create("nda", NDA);

        assertThat(detectionService.batchDetectDuplicates(List.of("lease-a", "nda"))).isEmpty();
        assertThat(detectionService.batchDetectDuplicates(List.of("lease-b", "lease-a"))).hasSize(1);
    }

    @Test
    void batchRejectsUnknownIds() {
        fingerprintService.create("lease-a", LEASE);

        assertThatThrownBy(() -> detectionService.batchDetectDuplicates(List.of("lease-a", "ghost")))
                .isInstanceOfSatisfying(DocumentNotFoundException.class,
                        ex -> assertThat(ex.getDocumentIds()).containsExactly("ghost"));
    }

    @Test
    void batchOverEmptyRegistryFindsNothing() {
        assertThat(detectionService.batchDetectDuplicates(null)).isEmpty();
    }

    @Test
    void slowBatchTimesOut() {
        DocumentComparator slowComparator = mock(DocumentComparator.class);
        when(slowComparator.evaluate(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return SimilarityWeights.defaults().breakdown(0, 0, 0, 0, 0, 0);
        });
        DuplicateDetectionService slowService = newDetectionService(slowComparator);
        for (String id : List.of("a", "b", "c", "d")) {
            registry.put(DocumentFingerprint.builder().documentId(id).generation(1).build());
        }

        long start = System.nanoTime();
        assertThatThrownBy(() -> slowService.batchDetectDuplicates(null, Duration.ofMillis(200)))
                .isInstanceOfSatisfying(DetectionTimeoutException.class,
                        ex -> assertThat(ex.getTimeout()).isEqualTo(Duration.ofMillis(200)));
        assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(1_500);
    }

    @Test
    void saturatedPoolStillSweepsEveryRow() {
        fingerprintService.create("nda-2", NDA_COPY);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);
        fingerprintService.create("nda-1", NDA);
        fingerprintService.create("lease-a", LEASE);

        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolExecutor saturated = saturatedPool(release);
        try {
            List<DuplicateMatch> matches = newDetectionService(new DocumentComparator(), saturated)
                    .batchDetectDuplicates(null);

            assertThat(matches).extracting(m -> m.getDocumentId1() + "|" + m.getDocumentId2())
                    .containsExactly("lease-a|lease-b", "nda-1|nda-2");
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    void rowsSweptOnCallerStillHonourTheDeadline() {
        DocumentComparator slowComparator = mock(DocumentComparator.class);
        when(slowComparator.evaluate(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(300);
            return SimilarityWeights.defaults().breakdown(0, 0, 0, 0, 0, 0);
        });
        for (String id : List.of("a", "b", "c", "d", "e")) {
            registry.put(DocumentFingerprint.builder().documentId(id).generation(1).build());
        }

        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolExecutor saturated = saturatedPool(release);
        try {
            DuplicateDetectionService slowService = newDetectionService(slowComparator, saturated);

            long start = System.nanoTime();
            assertThatThrownBy(() -> slowService.batchDetectDuplicates(null, Duration.ofMillis(200)))
                    .isInstanceOf(DetectionTimeoutException.class);
            assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(1_500);
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    void statisticsDescribeRegistryAndCache() {
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("empty", "");

        Map<String, Object> stats = detectionService.getStatistics();

        assertThat(stats)
                .containsEntry("total_documents", 2)
                .containsEntry("similarity_threshold", 0.8)
                .containsEntry("signal_coverage", Map.of("tfidf", 1L, "semantic", 0L, "visual", 0L))
                .containsKeys("cached_comparisons", "cache_hits", "cache_misses", "fingerprint_creation_times");
        assertThat((List<?>) stats.get("fingerprint_creation_times")).hasSize(2);
    }

    @Test
    void clearCacheDropsAllScores() {
        fingerprintService.create("lease-a", LEASE);
        fingerprintService.create("lease-b", LEASE_REFORMATTED);
        detectionService.batchDetectDuplicates(null);

        detectionService.clearCache();

        assertThat(comparisonCache.size()).isZero();
    }

    private DuplicateDetectionService newDetectionService(DocumentComparator comparator) {
        return newDetectionService(comparator, executor);
    }

    private DuplicateDetectionService newDetectionService(DocumentComparator comparator, Executor pool) {
        return new DuplicateDetectionService(
                registry,
                comparator,
                comparisonCache,
                new PerformanceMonitorService(dedupConfig),
                dedupConfig,
                pool
        );
    }

    /** One worker, no queue, worker held until {@code release} opens: every submission is rejected. */
    private static ThreadPoolExecutor saturatedPool(CountDownLatch release) {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        pool.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        return pool;
    }
}
