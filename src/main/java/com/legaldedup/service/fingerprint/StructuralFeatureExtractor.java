package com.legaldedup.service.fingerprint;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layout and legal-form signals of a document: counts are {@link Integer}, flags are {@link Boolean}.
 */
@Component
public class StructuralFeatureExtractor {

    public static final String LINE_COUNT = "line_count";
    public static final String PARAGRAPH_COUNT = "paragraph_count";
    public static final String SENTENCE_COUNT = "sentence_count";
    public static final String HAS_SIGNATURE_BLOCK = "has_signature_block";
    public static final String HAS_DATE_LINE = "has_date_line";
    public static final String HAS_PARTIES = "has_parties";
    public static final String WHEREAS_COUNT = "whereas_count";
    public static final String NUMBERED_SECTION_COUNT = "numbered_section_count";
    public static final String CAPITALIZED_WORDS = "capitalized_words";
    public static final String QUOTED_TEXT = "quoted_text";
    public static final String PARENTHETICAL_TEXT = "parenthetical_text";
    public static final String CITATION_COUNT = "citation_count";

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private static final Pattern SIGNATURE = Pattern.compile("signature|signed|executed", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_LINE = Pattern.compile("dated|date:", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARTIES = Pattern.compile("plaintiff|defendant|party|parties", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHEREAS = Pattern.compile("\\bwhereas\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED_SECTION = Pattern.compile("^\\s*\\d+\\.", Pattern.MULTILINE);

    private static final Pattern CAPITALIZED_RUN = Pattern.compile("\\b[A-Z]{2,}\\b");
    private static final Pattern QUOTED = Pattern.compile("\"[^\"]*\"");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");

    // e.g. "12 Ala. 345", "5 Wash. 200"; multi-capital reporters such as "U.S." do not match
    private static final Pattern CITATION = Pattern.compile("\\d+\\s+[A-Z][a-z.]+\\s+\\d+");

    public Map<String, Object> extract(String content) {
        Map<String, Object> features = new LinkedHashMap<>();

        features.put(LINE_COUNT, content.split("\n", -1).length);
        features.put(PARAGRAPH_COUNT, PARAGRAPH_BREAK.split(content, -1).length);
        features.put(SENTENCE_COUNT, SENTENCE_END.split(content, -1).length);

        features.put(HAS_SIGNATURE_BLOCK, SIGNATURE.matcher(content).find());
        features.put(HAS_DATE_LINE, DATE_LINE.matcher(content).find());
        features.put(HAS_PARTIES, PARTIES.matcher(content).find());
        features.put(WHEREAS_COUNT, count(WHEREAS, content));
        features.put(NUMBERED_SECTION_COUNT, count(NUMBERED_SECTION, content));

        features.put(CAPITALIZED_WORDS, count(CAPITALIZED_RUN, content));
        features.put(QUOTED_TEXT, count(QUOTED, content));
        features.put(PARENTHETICAL_TEXT, count(PARENTHETICAL, content));
        features.put(CITATION_COUNT, count(CITATION, content));

        return Collections.unmodifiableMap(features);
    }

    private static int count(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
