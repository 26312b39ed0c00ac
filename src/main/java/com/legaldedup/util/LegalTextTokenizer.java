package com.legaldedup.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word tokenizer for English legal prose, producing unigrams and underscore-joined bigrams.
 */
@Component
public class LegalTextTokenizer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "been", "but", "by",
        "for", "from", "had", "has", "have", "he", "her", "his", "if", "in",
        "into", "is", "it", "its", "no", "nor", "not", "of", "on", "or",
        "our", "she", "so", "such", "than", "that", "the", "their", "them", "then",
        "there", "these", "they", "this", "those", "to", "was", "we", "were", "what",
        "when", "which", "who", "will", "with", "would", "you", "your"
    );

    /**
     * Lower-cased words longer than one character, stop words removed.
     */
    public List<String> tokenizeUnigram(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() > 1 && !STOP_WORDS.contains(word)) {
                tokens.add(word);
            }
        }
        return tokens;
    }

    /**
     * Pairs of consecutive unigrams, joined with an underscore.
     */
    public List<String> tokenizeBigram(String text) {
        return bigrams(tokenizeUnigram(text));
    }

    public TokenResult tokenize(String text) {
        List<String> unigrams = tokenizeUnigram(text);
        return new TokenResult(unigrams, bigrams(unigrams));
    }

    private List<String> bigrams(List<String> tokens) {
        List<String> bigrams = new ArrayList<>();
        for (int i = 0; i < tokens.size() - 1; i++) {
            bigrams.add(tokens.get(i) + "_" + tokens.get(i + 1));
        }
        return bigrams;
    }

    public record TokenResult(List<String> unigrams, List<String> bigrams) {

        public boolean isEmpty() {
            return unigrams.isEmpty();
        }

        public List<String> allTerms() {
            List<String> terms = new ArrayList<>(unigrams.size() + bigrams.size());
            terms.addAll(unigrams);
            terms.addAll(bigrams);
            return terms;
        }
    }
}
