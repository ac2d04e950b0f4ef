package io.teleops.evaluation;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cosine similarity of token frequency vectors after normalization.
 * <p>
 * Text is lowercased and every character outside {@code [a-z0-9]} becomes a separator.
 */
@Component
public class LexicalSimilarity implements SimilarityFunction {

    public static final String METHOD = "lexical_cosine_similarity";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    @Override
    public double similarity(String a, String b) {
        Map<String, Integer> left = termFrequencies(a);
        Map<String, Integer> right = termFrequencies(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        double dot = 0.0;
        for (Map.Entry<String, Integer> entry : left.entrySet()) {
            Integer other = right.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * (double) other;
            }
        }
        double cosine = dot / (norm(left) * norm(right));
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> frequencies = new HashMap<>();
        if (text == null) {
            return frequencies;
        }
        String normalized = NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (normalized.isEmpty()) {
            return frequencies;
        }
        for (String token : normalized.split(" ")) {
            frequencies.merge(token, 1, Integer::sum);
        }
        return frequencies;
    }

    private static double norm(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int value : vector.values()) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }
}
