package com.legaldedup.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Content, fuzzy and metadata hashes. The normalization rules are part of the
 * fingerprint format: changing them makes new fingerprints incomparable with old ones.
 */
@Slf4j
public final class FingerprintHasher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .findAndRegisterModules();

    private FingerprintHasher() {
    }

    /**
     * MD5 of the trimmed, whitespace-collapsed, lower-cased text.
     */
    public static String contentHash(String text) {
        return DigestUtils.md5Hex(normalizeContent(text).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * SHA-256 of the alphabetically sorted words longer than three characters,
     * after punctuation is stripped. Insensitive to reordering of sentences and paragraphs.
     */
    public static String fuzzyHash(String text) {
        return DigestUtils.sha256Hex(fuzzyKeyContent(text).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * MD5 of the key-sorted JSON rendering of the metadata map.
     */
    public static String metadataHash(Map<String, ?> metadata) {
        return DigestUtils.md5Hex(canonicalMetadata(metadata).getBytes(StandardCharsets.UTF_8));
    }

    static String normalizeContent(String text) {
        // String.strip() keeps no-break spaces, so collapse first
        return WHITESPACE.matcher(text).replaceAll(" ").strip().toLowerCase(Locale.ROOT);
    }

    static String fuzzyKeyContent(String text) {
        String stripped = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").strip();
        if (collapsed.isEmpty()) {
            return "";
        }
        return Arrays.stream(collapsed.split(" "))
                .filter(word -> word.length() > 3)
                .sorted()
                .collect(Collectors.joining(" "));
    }

    static String canonicalMetadata(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return CANONICAL_MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Metadata not serializable as JSON, hashing its string form: {}", e.getMessage());
            return metadata.entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .sorted()
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }
}
