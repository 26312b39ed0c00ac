package com.legaldedup.service.fingerprint;

import com.legaldedup.config.DedupConfig;
import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.exception.EmbeddingException;
import com.legaldedup.exception.VisualHashException;
import com.legaldedup.service.comparison.ComparisonCache;
import com.legaldedup.service.embedding.EmbeddingClient;
import com.legaldedup.service.visual.PerceptualHashService;
import com.legaldedup.util.FingerprintHasher;
import com.legaldedup.util.LegalTextTokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FingerprintServiceTest {

    private static final String LEASE = "WHEREAS the Landlord owns the premises.\n\n"
            + "1. Tenant shall pay rent monthly.\n2. Deposit is refundable.";

    private final EmbeddingClient embeddingClient = mock(EmbeddingClient.class);
    private final PerceptualHashService perceptualHashService = mock(PerceptualHashService.class);

    private FingerprintRegistry registry;
    private ComparisonCache comparisonCache;
    private DedupConfig dedupConfig;
    private ExecutorService executor;
    private FingerprintService service;

    @BeforeEach
    void setUp() {
        registry = new FingerprintRegistry();
        comparisonCache = new ComparisonCache();
        dedupConfig = new DedupConfig();
        dedupConfig.setFingerprint(new DedupConfig.Fingerprint());
        dedupConfig.getFingerprint().setEmbeddingTimeoutSeconds(1);
        dedupConfig.getFingerprint().setVisualTimeoutSeconds(1);
        executor = Executors.newCachedThreadPool();

        service = new FingerprintService(
                registry,
                comparisonCache,
                new TfIdfVectorizer(new LegalTextTokenizer()),
                new StructuralFeatureExtractor(),
                embeddingClient,
                perceptualHashService,
                dedupConfig,
                executor
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void buildsAndRegistersFingerprintWithAllSignals() {
        when(embeddingClient.embed(LEASE, 512)).thenReturn(List.of(0.1, 0.2, 0.3));
        when(perceptualHashService.perceptualHash("page-1.png")).thenReturn("ABCDEF0123456789");

        DocumentFingerprint fingerprint = service.create("lease-1", LEASE, Map.of("type", "lease"), "page-1.png");

        assertThat(fingerprint.getContentHash()).isEqualTo(FingerprintHasher.contentHash(LEASE));
        assertThat(fingerprint.getFuzzyHash()).isEqualTo(FingerprintHasher.fuzzyHash(LEASE));
        assertThat(fingerprint.getMetadataHash()).isEqualTo(FingerprintHasher.metadataHash(Map.of("type", "lease")));
        assertThat(fingerprint.getSemanticVector()).containsExactly(0.1, 0.2, 0.3);
        assertThat(fingerprint.getVisualHash()).isEqualTo("abcdef0123456789");
        assertThat(fingerprint.hasTfidfVector()).isTrue();
        assertThat(fingerprint.getStructuralFeatures()).containsEntry(StructuralFeatureExtractor.WHEREAS_COUNT, 1);
        assertThat(fingerprint.getWordCount()).isEqualTo(16);
        assertThat(fingerprint.getPageCount()).isEqualTo(1);
        assertThat(fingerprint.getCreatedAt()).isNotNull();
        assertThat(registry.require("lease-1")).isSameAs(fingerprint);
    }

    @Test
    void embeddingFailureLeavesSemanticVectorAbsent() {
        when(embeddingClient.embed(anyString(), anyInt())).thenThrow(new EmbeddingException("service down"));

        DocumentFingerprint fingerprint = service.create("lease-1", LEASE);

        assertThat(fingerprint.getSemanticVector()).isNull();
        assertThat(fingerprint.hasTfidfVector()).isTrue();
    }

    @Test
    void zeroEmbeddingIsDiscarded() {
        when(embeddingClient.embed(anyString(), anyInt())).thenReturn(List.of(0.0, 0.0, 0.0));

        assertThat(service.create("lease-1", LEASE).getSemanticVector()).isNull();
    }

    @Test
    void nonFiniteEmbeddingIsDiscarded() {
        when(embeddingClient.embed(anyString(), anyInt())).thenReturn(List.of(0.5, Double.NaN));

        assertThat(service.create("lease-1", LEASE).getSemanticVector()).isNull();
    }

    @Test
    void slowEmbeddingTimesOutToAbsentSignal() {
        when(embeddingClient.embed(anyString(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of(1.0, 0.0);
        });

        long start = System.nanoTime();
        DocumentFingerprint fingerprint = service.create("lease-1", LEASE);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertThat(fingerprint.getSemanticVector()).isNull();
        assertThat(elapsedMillis).isLessThan(4_000);
    }

    @Test
    void saturatedSignalPoolLeavesSignalsAbsentWithoutBlocking() {
        when(embeddingClient.embed(anyString(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of(1.0, 0.0);
        });
        when(perceptualHashService.perceptualHash(anyString())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return "abcdef0123456789";
        });

        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolExecutor saturated = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        saturated.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        FingerprintService saturatedService = new FingerprintService(
                registry,
                comparisonCache,
                new TfIdfVectorizer(new LegalTextTokenizer()),
                new StructuralFeatureExtractor(),
                embeddingClient,
                perceptualHashService,
                dedupConfig,
                saturated
        );

        try {
            long start = System.nanoTime();
            DocumentFingerprint fingerprint = saturatedService.create("lease-1", LEASE, null, "page-1.png");
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            assertThat(fingerprint.getSemanticVector()).isNull();
            assertThat(fingerprint.getVisualHash()).isNull();
            assertThat(fingerprint.hasTfidfVector()).isTrue();
            assertThat(elapsedMillis).isLessThan(1_000);
            verify(embeddingClient, never()).embed(anyString(), anyInt());
            verify(perceptualHashService, never()).perceptualHash(anyString());
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    void unreadableImageLeavesVisualHashAbsent() {
        when(perceptualHashService.perceptualHash("missing.png"))
                .thenThrow(new VisualHashException("Image not readable: missing.png"));

        DocumentFingerprint fingerprint = service.create("lease-1", LEASE, null, "missing.png");

        assertThat(fingerprint.getVisualHash()).isNull();
        assertThat(fingerprint.getMetadataHash()).isEqualTo(FingerprintHasher.metadataHash(Map.of()));
    }

    @Test
    void blankImageReferenceSkipsVisualHashing() {
        service.create("lease-1", LEASE, null, "  ");

        verify(perceptualHashService, never()).perceptualHash(anyString());
    }

    @Test
    void disabledEmbeddingIsNeverCalled() {
        dedupConfig.getFingerprint().setEmbeddingEnabled(false);

        DocumentFingerprint fingerprint = service.create("lease-1", LEASE);

        assertThat(fingerprint.getSemanticVector()).isNull();
        verify(embeddingClient, never()).embed(anyString(), anyInt());
    }

    @Test
    void emptyTextHasNoLexicalOrSemanticSignals() {
        DocumentFingerprint fingerprint = service.create("empty", "");

        assertThat(fingerprint.getTfidfVector()).isNull();
        assertThat(fingerprint.getSemanticVector()).isNull();
        assertThat(fingerprint.getWordCount()).isZero();
        assertThat(fingerprint.getPageCount()).isEqualTo(1);
        verify(embeddingClient, never()).embed(anyString(), anyInt());
    }

    @Test
    void pageCountIsDerivedFromWordCount() {
        String text = "clause ".repeat(600);

        assertThat(service.create("long", text).getPageCount()).isEqualTo(2);
    }

    @Test
    void rebuildingReplacesFingerprintAndEvictsCachedScores() {
        DocumentFingerprint first = service.create("a", LEASE);
        DocumentFingerprint other = service.create("b", "Unrelated patent assignment.");
        comparisonCache.store(first, other, 0.2);

        DocumentFingerprint rebuilt = service.create("a", LEASE + "\n3. Pets are not allowed.");

        assertThat(comparisonCache.size()).isZero();
        assertThat(rebuilt.getGeneration()).isGreaterThan(first.getGeneration());
        assertThat(registry.require("a")).isSameAs(rebuilt);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void rejectsMissingIdOrText() {
        assertThatThrownBy(() -> service.create(" ", LEASE)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.create("a", null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void countsWhitespaceSeparatedWords() {
        assertThat(FingerprintService.countWords("  one two\nthree\t four ")).isEqualTo(4);
        assertThat(FingerprintService.countWords("   ")).isZero();
        assertThat(FingerprintService.countWords("Lease\u00a0Agreement\u2003between parties")).isEqualTo(4);
        assertThat(FingerprintService.countWords("\u00a0\u2003")).isZero();
    }
}
