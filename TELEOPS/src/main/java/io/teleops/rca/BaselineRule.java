package io.teleops.rca;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * One entry of the baseline rule table: keyword patterns and the hypothesis they indicate.
 */
@Value
@Builder
public class BaselineRule {

    String id;

    /** Lowercase substrings searched for in the incident text, in declaration order */
    @Singular
    List<String> patterns;

    String hypothesis;

    /** Fixed confidence reported when this rule wins, in [0, 1] */
    double confidence;

    /** Supporting description attached as evidence */
    String evidence;

    /**
     * Patterns contained in the given lowercase corpus. Each pattern counts once.
     */
    public List<String> matchedPatterns(String corpus) {
        return patterns.stream()
                .filter(pattern -> corpus.contains(pattern.toLowerCase(Locale.ROOT)))
                .toList();
    }
}
