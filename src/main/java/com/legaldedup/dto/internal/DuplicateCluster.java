package com.legaldedup.dto.internal;

import java.util.List;

/**
 * Transitively connected document family; ids sorted ascending.
 */
public record DuplicateCluster(List<String> documentIds) {

    public DuplicateCluster {
        documentIds = List.copyOf(documentIds);
    }

    public int size() {
        return documentIds.size();
    }

    public String firstDocumentId() {
        return documentIds.get(0);
    }
}
