package com.legaldedup.service.comparison;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Component similarity functions. Each returns a value in [0, 1] and returns 0 when
 * its input is missing on either side.
 */
public final class SimilarityCalculator {

    private SimilarityCalculator() {
    }

    /**
     * Share of equal characters at equal positions; 0 for hashes of different length.
     */
    public static double fuzzy(String hash1, String hash2) {
        if (hash1 == null || hash2 == null || hash1.isEmpty() || hash2.isEmpty()) {
            return 0.0;
        }
        if (hash1.length() != hash2.length()) {
            return 0.0;
        }

        int differences = 0;
        for (int i = 0; i < hash1.length(); i++) {
            if (hash1.charAt(i) != hash2.charAt(i)) {
                differences++;
            }
        }
        return 1.0 - (double) differences / hash1.length();
    }

    /**
     * Cosine of two sparse term-weight vectors, floored at 0.
     */
    public static double tfidf(Map<String, Double> vector1, Map<String, Double> vector2) {
        if (vector1 == null || vector2 == null || vector1.isEmpty() || vector2.isEmpty()) {
            return 0.0;
        }

        Map<String, Double> smaller = vector1.size() <= vector2.size() ? vector1 : vector2;
        Map<String, Double> larger = smaller == vector1 ? vector2 : vector1;

        double dot = 0.0;
        for (Map.Entry<String, Double> entry : smaller.entrySet()) {
            Double other = larger.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }

        double norm = norm(vector1.values()) * norm(vector2.values());
        if (norm == 0.0) {
            return 0.0;
        }
        return clamp(dot / norm);
    }

    /**
     * Cosine of the unit-normalized embeddings, floored at 0; 0 for mismatched dimensions.
     */
    public static double semantic(List<Double> embedding1, List<Double> embedding2) {
        if (embedding1 == null || embedding2 == null || embedding1.isEmpty() || embedding2.isEmpty()) {
            return 0.0;
        }
        if (embedding1.size() != embedding2.size()) {
            return 0.0;
        }

        double norm1 = norm(embedding1);
        double norm2 = norm(embedding2);
        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }

        double dot = 0.0;
        for (int i = 0; i < embedding1.size(); i++) {
            dot += (embedding1.get(i) / norm1) * (embedding2.get(i) / norm2);
        }
        return clamp(dot);
    }

    /**
     * Mean per-feature similarity over the union of feature names. Two booleans score
     * 1 when equal; numbers (booleans counting as 0/1, missing as 0) score min/max,
     * with two zeros scoring 1 and a single zero scoring 0. Other values are skipped.
     */
    public static double structural(Map<String, Object> features1, Map<String, Object> features2) {
        if (features1 == null || features2 == null || features1.isEmpty() || features2.isEmpty()) {
            return 0.0;
        }

        Set<String> keys = new HashSet<>(features1.keySet());
        keys.addAll(features2.keySet());

        double total = 0.0;
        int counted = 0;
        for (String key : keys) {
            Object value1 = features1.getOrDefault(key, 0);
            Object value2 = features2.getOrDefault(key, 0);

            double score;
            if (value1 instanceof Boolean flag1 && value2 instanceof Boolean flag2) {
                score = flag1.equals(flag2) ? 1.0 : 0.0;
            } else {
                Double number1 = numeric(value1);
                Double number2 = numeric(value2);
                if (number1 == null || number2 == null) {
                    continue;
                }
                score = ratio(number1, number2);
            }

            total += score;
            counted++;
        }

        return counted > 0 ? total / counted : 0.0;
    }

    /**
     * One minus the normalized Hamming distance between two hex hashes; 0 when either
     * hash is malformed or the lengths differ.
     */
    public static double visual(String hash1, String hash2) {
        if (hash1 == null || hash2 == null || hash1.isEmpty() || hash2.isEmpty()) {
            return 0.0;
        }
        if (hash1.length() != hash2.length()) {
            return 0.0;
        }

        int distance = 0;
        for (int i = 0; i < hash1.length(); i++) {
            int nibble1 = Character.digit(hash1.charAt(i), 16);
            int nibble2 = Character.digit(hash2.charAt(i), 16);
            if (nibble1 < 0 || nibble2 < 0) {
                return 0.0;
            }
            distance += Integer.bitCount(nibble1 ^ nibble2);
        }

        int maxDistance = hash1.length() * 4;
        return clamp(1.0 - (double) distance / maxDistance);
    }

    public static double metadata(String hash1, String hash2) {
        return hash1 != null && hash1.equals(hash2) ? 1.0 : 0.0;
    }

    private static Double numeric(Object value) {
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    private static double ratio(double value1, double value2) {
        if (value1 == 0.0 && value2 == 0.0) {
            return 1.0;
        }
        if (value1 == 0.0 || value2 == 0.0) {
            return 0.0;
        }
        return Math.min(value1, value2) / Math.max(value1, value2);
    }

    private static double norm(Iterable<Double> values) {
        double sum = 0.0;
        for (Double value : values) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
