package com.legaldedup.service.fingerprint;

import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.exception.DocumentNotFoundException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sole owner of the fingerprints, keyed by document id.
 */
@Component
public class FingerprintRegistry {

    private final Map<String, DocumentFingerprint> fingerprints = new ConcurrentHashMap<>();

    /**
     * Inserts or replaces the fingerprint for its document id.
     *
     * @return the replaced fingerprint, if any
     */
    public Optional<DocumentFingerprint> put(DocumentFingerprint fingerprint) {
        return Optional.ofNullable(fingerprints.put(fingerprint.getDocumentId(), fingerprint));
    }

    public Optional<DocumentFingerprint> find(String documentId) {
        return Optional.ofNullable(fingerprints.get(documentId));
    }

    public DocumentFingerprint require(String documentId) {
        DocumentFingerprint fingerprint = documentId != null ? fingerprints.get(documentId) : null;
        if (fingerprint == null) {
            throw new DocumentNotFoundException(String.valueOf(documentId));
        }
        return fingerprint;
    }

    /**
     * Resolves every id, failing with all missing ids at once.
     *
     * @return fingerprints keyed and ordered by document id
     */
    public SortedMap<String, DocumentFingerprint> requireAll(Collection<String> documentIds) {
        SortedMap<String, DocumentFingerprint> resolved = new TreeMap<>();
        List<String> missing = new ArrayList<>();
        for (String documentId : documentIds) {
            DocumentFingerprint fingerprint = documentId != null ? fingerprints.get(documentId) : null;
            if (fingerprint == null) {
                missing.add(String.valueOf(documentId));
            } else {
                resolved.put(documentId, fingerprint);
            }
        }
        if (!missing.isEmpty()) {
            throw new DocumentNotFoundException(missing);
        }
        return resolved;
    }

    /**
     * Point-in-time copy ordered by document id.
     */
    public SortedMap<String, DocumentFingerprint> snapshot() {
        return new TreeMap<>(fingerprints);
    }

    public boolean contains(String documentId) {
        return fingerprints.containsKey(documentId);
    }

    public int size() {
        return fingerprints.size();
    }
}
