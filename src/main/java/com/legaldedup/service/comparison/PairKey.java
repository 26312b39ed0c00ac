package com.legaldedup.service.comparison;

/**
 * Unordered document pair, stored with the lexicographically smaller id first.
 */
public record PairKey(String first, String second) {

    public static PairKey of(String documentId1, String documentId2) {
        return documentId1.compareTo(documentId2) <= 0
                ? new PairKey(documentId1, documentId2)
                : new PairKey(documentId2, documentId1);
    }

    public boolean involves(String documentId) {
        return first.equals(documentId) || second.equals(documentId);
    }
}
