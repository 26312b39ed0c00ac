package com.legaldedup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SimilarityMethod {
    HASH,
    FUZZY,
    TFIDF,
    SEMANTIC,
    STRUCTURAL,
    VISUAL,
    METADATA;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
