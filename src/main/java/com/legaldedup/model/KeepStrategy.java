package com.legaldedup.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Rule for choosing the surviving document of a duplicate cluster.
 */
public enum KeepStrategy {
    NEWEST,
    OLDEST,
    LONGEST,
    SHORTEST;

    @JsonCreator
    public static KeepStrategy from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Keep strategy is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (KeepStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException(String.format(
                "Unknown keep strategy '%s', expected one of %s",
                value,
                Arrays.stream(values()).map(KeepStrategy::wireName).collect(Collectors.joining(", "))
        ));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
