package com.legaldedup.service.comparison;

import com.legaldedup.dto.internal.DocumentFingerprint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fused pair scores keyed by {@link PairKey}. Entries never expire; they are evicted
 * whenever either document is re-fingerprinted. Each entry also records the fingerprint
 * generations it was computed from, so a score written by a comparison that raced
 * with a re-fingerprint is recognized as stale and ignored.
 */
@Slf4j
@Component
public class ComparisonCache {

    private static final double SCORE_TOLERANCE = 1e-12;

    private final Map<PairKey, CachedScore> scores = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public OptionalDouble lookup(DocumentFingerprint fp1, DocumentFingerprint fp2) {
        PairKey key = PairKey.of(fp1.getDocumentId(), fp2.getDocumentId());
        CachedScore cached = scores.get(key);

        if (cached == null) {
            misses.incrementAndGet();
            return OptionalDouble.empty();
        }
        if (!cached.matches(key, fp1, fp2)) {
            scores.remove(key, cached);
            misses.incrementAndGet();
            log.debug("Dropped stale cache entry for {}", key);
            return OptionalDouble.empty();
        }

        hits.incrementAndGet();
        return OptionalDouble.of(cached.score());
    }

    /**
     * Stores a freshly computed score. The fresh value always wins; disagreeing with
     * an entry for the same fingerprint generations means an invalidation was missed.
     */
    public void store(DocumentFingerprint fp1, DocumentFingerprint fp2, double score) {
        PairKey key = PairKey.of(fp1.getDocumentId(), fp2.getDocumentId());
        CachedScore entry = CachedScore.of(key, fp1, fp2, score);

        CachedScore previous = scores.put(key, entry);
        if (previous != null
                && previous.sameGenerations(entry)
                && Math.abs(previous.score() - score) > SCORE_TOLERANCE) {
            log.warn("Cached score disagreement for {}: cached={} recomputed={} - keeping recomputed",
                    key, previous.score(), score);
        }
    }

    /**
     * @return number of entries removed
     */
    public int evictDocument(String documentId) {
        int evicted = 0;
        Iterator<PairKey> keys = scores.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().involves(documentId)) {
                keys.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} cached comparisons for {}", evicted, documentId);
        }
        return evicted;
    }

    public void clear() {
        scores.clear();
        log.info("Similarity cache cleared");
    }

    public int size() {
        return scores.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    private record CachedScore(double score, long firstGeneration, long secondGeneration) {

        static CachedScore of(PairKey key, DocumentFingerprint fp1, DocumentFingerprint fp2, double score) {
            boolean inOrder = key.first().equals(fp1.getDocumentId());
            DocumentFingerprint first = inOrder ? fp1 : fp2;
            DocumentFingerprint second = inOrder ? fp2 : fp1;
            return new CachedScore(score, first.getGeneration(), second.getGeneration());
        }

        boolean matches(PairKey key, DocumentFingerprint fp1, DocumentFingerprint fp2) {
            return sameGenerations(of(key, fp1, fp2, score));
        }

        boolean sameGenerations(CachedScore other) {
            return firstGeneration == other.firstGeneration && secondGeneration == other.secondGeneration;
        }
    }
}
