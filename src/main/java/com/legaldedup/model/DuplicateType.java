package com.legaldedup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Classified relationship between two documents, strongest first.
 */
public enum DuplicateType {

    /** Identical content. */
    EXACT,
    /** Minor formatting differences. */
    NEAR_EXACT,
    /** Same structure, materially revised text. */
    VERSION,
    /** Same structure, unrelated fill-in content. */
    TEMPLATE,
    /** Similar content or structure. */
    SIMILAR,
    /** Partial overlap. */
    PARTIAL,
    NOT_DUPLICATE;

    private static final Set<DuplicateType> CLUSTER_FORMING =
            EnumSet.of(EXACT, NEAR_EXACT, VERSION, SIMILAR);

    /**
     * PARTIAL and TEMPLATE matches are reportable but never join two documents into a cluster.
     */
    public boolean isClusterForming() {
        return CLUSTER_FORMING.contains(this);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
