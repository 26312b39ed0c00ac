package com.legaldedup.service.fingerprint;

import com.legaldedup.util.LegalTextTokenizer;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TfIdfVectorizerTest {

    private final TfIdfVectorizer vectorizer = new TfIdfVectorizer(new LegalTextTokenizer());

    @Test
    void vectorIsUnitLength() {
        Map<String, Double> vector = vectorizer.vectorize("a", "The tenant shall pay rent to the landlord monthly");

        double norm = vector.values().stream().mapToDouble(v -> v * v).sum();
        assertThat(norm).isCloseTo(1.0, within(1e-9));
        assertThat(vector).containsKeys("tenant", "tenant_shall", "landlord_monthly");
    }

    @Test
    void sharedTermsWeighLessThanRareOnes() {
        vectorizer.vectorize("a", "lease agreement");
        Map<String, Double> vector = vectorizer.vectorize("b", "lease premises");

        assertThat(vectorizer.documentFrequency("lease")).isEqualTo(2);
        assertThat(vector.get("premises")).isGreaterThan(vector.get("lease"));
        assertThat(vector.get("lease_premises")).isLessThan(vector.get("premises"));
    }

    @Test
    void refingerprintingReplacesCorpusContribution() {
        vectorizer.vectorize("a", "lease term");
        vectorizer.vectorize("a", "rent due");

        assertThat(vectorizer.getCorpusSize()).isEqualTo(1);
        assertThat(vectorizer.documentFrequency("lease")).isZero();
        assertThat(vectorizer.documentFrequency("rent")).isEqualTo(1);
    }

    @Test
    void textWithoutTermsHasNoVector() {
        vectorizer.vectorize("a", "lease term");

        assertThat(vectorizer.vectorize("a", "the of and to")).isNull();
        assertThat(vectorizer.getCorpusSize()).isZero();
        assertThat(vectorizer.documentFrequency("lease")).isZero();
    }

    @Test
    void vectorsAreImmutable() {
        Map<String, Double> vector = vectorizer.vectorize("a", "lease term");

        assertThatThrownBy(() -> vector.put("other", 1.0)).isInstanceOf(UnsupportedOperationException.class);
    }
}
