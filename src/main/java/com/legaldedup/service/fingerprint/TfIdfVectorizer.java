package com.legaldedup.service.fingerprint;

import com.legaldedup.util.LegalTextTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TF-IDF over unigrams and bigrams (weighted 80:20) with corpus document frequencies
 * kept per document id. The IDF snapshot at vectorization time is frozen into the
 * returned vector, so later corpus growth never changes an existing fingerprint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TfIdfVectorizer {

    private static final double UNIGRAM_WEIGHT = 0.8;
    private static final double BIGRAM_WEIGHT = 0.2;

    private final LegalTextTokenizer tokenizer;

    private final Map<String, Set<String>> documentTerms = new ConcurrentHashMap<>();
    private final Map<String, Integer> documentFrequency = new ConcurrentHashMap<>();

    /**
     * Registers the document's terms in the corpus statistics and returns its
     * L2-normalized weight vector, or null when the text has no usable terms.
     */
    public Map<String, Double> vectorize(String documentId, String text) {
        LegalTextTokenizer.TokenResult tokens = tokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            forget(documentId);
            return null;
        }

        Map<String, Double> termFreq = new HashMap<>();
        tokens.unigrams().forEach(term -> termFreq.merge(term, UNIGRAM_WEIGHT, Double::sum));
        tokens.bigrams().forEach(term -> termFreq.merge(term, BIGRAM_WEIGHT, Double::sum));

        register(documentId, Set.copyOf(termFreq.keySet()));

        int numDocs = Math.max(1, documentTerms.size());
        Map<String, Double> weights = new LinkedHashMap<>();
        double norm = 0.0;
        for (Map.Entry<String, Double> entry : termFreq.entrySet()) {
            int df = Math.max(1, documentFrequency.getOrDefault(entry.getKey(), 1));
            double idf = Math.log((1.0 + numDocs) / (1.0 + df)) + 1.0;
            double weight = entry.getValue() * idf;
            weights.put(entry.getKey(), weight);
            norm += weight * weight;
        }

        norm = Math.sqrt(norm);
        if (norm == 0.0) {
            return null;
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            entry.setValue(entry.getValue() / norm);
        }

        log.debug("TF-IDF vector for {}: {} terms over {} documents", documentId, weights.size(), numDocs);
        return Collections.unmodifiableMap(weights);
    }

    /**
     * Drops a document's contribution to the document frequencies.
     */
    public void forget(String documentId) {
        Set<String> previous = documentTerms.remove(documentId);
        if (previous != null) {
            decrement(previous);
        }
    }

    public int getCorpusSize() {
        return documentTerms.size();
    }

    public int documentFrequency(String term) {
        return documentFrequency.getOrDefault(term, 0);
    }

    private void register(String documentId, Set<String> terms) {
        Set<String> previous = documentTerms.put(documentId, terms);
        if (previous != null) {
            decrement(previous);
        }
        for (String term : terms) {
            documentFrequency.merge(term, 1, Integer::sum);
        }
    }

    private void decrement(Set<String> terms) {
        for (String term : terms) {
            documentFrequency.computeIfPresent(term, (key, count) -> count <= 1 ? null : count - 1);
        }
    }
}
