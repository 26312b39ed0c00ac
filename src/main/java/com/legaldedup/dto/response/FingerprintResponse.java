package com.legaldedup.dto.response;

import com.legaldedup.dto.internal.DocumentFingerprint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a registered fingerprint; vectors are left out of the payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FingerprintResponse {

    private String documentId;

    private String contentHash;

    private String fuzzyHash;

    private String metadataHash;

    private int wordCount;

    private int charCount;

    private int pageCount;

    private boolean tfidfAvailable;

    private boolean semanticAvailable;

    private boolean visualAvailable;

    private String createdAt;

    public static FingerprintResponse from(DocumentFingerprint fingerprint) {
        return FingerprintResponse.builder()
                .documentId(fingerprint.getDocumentId())
                .contentHash(fingerprint.getContentHash())
                .fuzzyHash(fingerprint.getFuzzyHash())
                .metadataHash(fingerprint.getMetadataHash())
                .wordCount(fingerprint.getWordCount())
                .charCount(fingerprint.getCharCount())
                .pageCount(fingerprint.getPageCount())
                .tfidfAvailable(fingerprint.hasTfidfVector())
                .semanticAvailable(fingerprint.hasSemanticVector())
                .visualAvailable(fingerprint.hasVisualHash())
                .createdAt(fingerprint.getCreatedAt().toString())
                .build();
    }
}
