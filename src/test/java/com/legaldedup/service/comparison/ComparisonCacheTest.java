package com.legaldedup.service.comparison;

import com.legaldedup.dto.internal.DocumentFingerprint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComparisonCacheTest {

    private final ComparisonCache cache = new ComparisonCache();

    @Test
    void lookupIsSymmetric() {
        DocumentFingerprint a = fingerprint("a", 1);
        DocumentFingerprint b = fingerprint("b", 2);

        cache.store(b, a, 0.42);

        assertThat(cache.lookup(a, b)).hasValue(0.42);
        assertThat(cache.lookup(b, a)).hasValue(0.42);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.getHits()).isEqualTo(2);
    }

    @Test
    void missIsCounted() {
        assertThat(cache.lookup(fingerprint("a", 1), fingerprint("b", 2))).isEmpty();
        assertThat(cache.getMisses()).isEqualTo(1);
    }

    @Test
    void entryFromOlderGenerationIsIgnoredAndDropped() {
        DocumentFingerprint a = fingerprint("a", 1);
        DocumentFingerprint b = fingerprint("b", 2);
        cache.store(a, b, 0.9);

        DocumentFingerprint rebuiltB = fingerprint("b", 3);

        assertThat(cache.lookup(a, rebuiltB)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void recomputedScoreReplacesCachedOne() {
        DocumentFingerprint a = fingerprint("a", 1);
        DocumentFingerprint b = fingerprint("b", 2);
        cache.store(a, b, 0.9);

        cache.store(a, b, 0.5);

        assertThat(cache.lookup(a, b)).hasValue(0.5);
    }

    @Test
    void evictDocumentRemovesEveryPairWithTheId() {
        DocumentFingerprint a = fingerprint("a", 1);
        DocumentFingerprint b = fingerprint("b", 2);
        DocumentFingerprint c = fingerprint("c", 3);
        cache.store(a, b, 0.1);
        cache.store(a, c, 0.2);
        cache.store(b, c, 0.3);

        assertThat(cache.evictDocument("a")).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.lookup(b, c)).hasValue(0.3);
    }

    @Test
    void clearEmptiesTheCache() {
        cache.store(fingerprint("a", 1), fingerprint("b", 2), 0.1);

        cache.clear();

        assertThat(cache.size()).isZero();
    }

    private static DocumentFingerprint fingerprint(String id, long generation) {
        return DocumentFingerprint.builder().documentId(id).generation(generation).build();
    }
}
