package com.legaldedup.exception;

import lombok.Getter;

import java.util.Collection;
import java.util.List;

/**
 * Raised when an operation references a document id that has no fingerprint.
 */
@Getter
public class DocumentNotFoundException extends DedupException {

    private final List<String> documentIds;

    public DocumentNotFoundException(String documentId) {
        this(List.of(documentId));
    }

    public DocumentNotFoundException(Collection<String> documentIds) {
        super("No fingerprint registered for document(s): " + String.join(", ", documentIds));
        this.documentIds = List.copyOf(documentIds);
    }
}
