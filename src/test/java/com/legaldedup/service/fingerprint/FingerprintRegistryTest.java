package com.legaldedup.service.fingerprint;

import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.exception.DocumentNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprintRegistryTest {

    private final FingerprintRegistry registry = new FingerprintRegistry();

    @Test
    void putReturnsReplacedFingerprint() {
        DocumentFingerprint first = fingerprint("a");
        DocumentFingerprint second = fingerprint("a");

        assertThat(registry.put(first)).isEmpty();
        assertThat(registry.put(second)).containsSame(first);
        assertThat(registry.find("a")).containsSame(second);
    }

    @Test
    void requireAllReportsEveryMissingId() {
        registry.put(fingerprint("a"));

        assertThatThrownBy(() -> registry.requireAll(List.of("x", "a", "y")))
                .isInstanceOfSatisfying(DocumentNotFoundException.class,
                        ex -> assertThat(ex.getDocumentIds()).containsExactly("x", "y"));
    }

    @Test
    void snapshotIsOrderedAndDetached() {
        registry.put(fingerprint("c"));
        registry.put(fingerprint("a"));

        var snapshot = registry.snapshot();
        registry.put(fingerprint("b"));

        assertThat(snapshot.keySet()).containsExactly("a", "c");
        assertThat(registry.contains("b")).isTrue();
    }

    @Test
    void requireFailsForUnknownId() {
        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(DocumentNotFoundException.class)
                .hasMessageContaining("nope");
    }

    private static DocumentFingerprint fingerprint(String id) {
        return DocumentFingerprint.builder().documentId(id).build();
    }
}
