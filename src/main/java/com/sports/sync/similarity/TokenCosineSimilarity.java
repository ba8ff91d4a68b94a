package com.sports.sync.similarity;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cosine similarity of normalized token-frequency vectors.
 * Both strings are normalized with {@link TextNormalizer}, split into tokens and
 * compared over the union vocabulary of the two token lists.
 */
public class TokenCosineSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        List<String> tokens1 = TextNormalizer.tokens(s1);
        List<String> tokens2 = TextNormalizer.tokens(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        if (tokens1.equals(tokens2)) {
            return 1.0;
        }

        Map<String, Integer> frequencies1 = frequencies(tokens1);
        Map<String, Integer> frequencies2 = frequencies(tokens2);

        long dot = 0;
        for (Map.Entry<String, Integer> entry : frequencies1.entrySet()) {
            Integer other = frequencies2.get(entry.getKey());
            if (other != null) {
                dot += (long) entry.getValue() * other;
            }
        }
        if (dot == 0) {
            return 0.0;
        }

        double norm = Math.sqrt(squaredNorm(frequencies1)) * Math.sqrt(squaredNorm(frequencies2));
        return Math.min(1.0, dot / norm);
    }

    @Override
    public String getName() {
        return "Token-Cosine";
    }

    private static Map<String, Integer> frequencies(List<String> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    private static long squaredNorm(Map<String, Integer> frequencies) {
        long sum = 0;
        for (int count : frequencies.values()) {
            sum += (long) count * count;
        }
        return sum;
    }
}
