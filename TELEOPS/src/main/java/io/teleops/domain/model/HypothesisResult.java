package io.teleops.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root-cause hypothesis set produced for one incident.
 * <p>
 * Handed to consumers verbatim; the baseline engine always returns exactly one hypothesis.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HypothesisResult {

    /** Source tag of the rule-based engine */
    public static final String BASELINE_MODEL = "baseline-rules";

    String incidentSummary;

    /** Ordered hypotheses, best first */
    @Builder.Default
    List<String> hypotheses = List.of();

    /** Hypothesis to confidence (0.0 to 1.0) */
    @Builder.Default
    Map<String, Double> confidenceScores = Map.of();

    Evidence evidence;

    Instant generatedAt;

    /** Model or source tag that produced the hypotheses */
    String model;

    public String topHypothesis() {
        return hypotheses.isEmpty() ? null : hypotheses.get(0);
    }

    /**
     * Highest reported confidence, 0.0 when none was reported. Null scores are ignored.
     */
    public double maxConfidence() {
        return confidenceScores.values().stream()
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);
    }

    /**
     * Why the hypothesis was chosen.
     */
    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Evidence {
        /** Supporting description of the alerts that drove the choice */
        String alerts;
        /** Number of rule patterns found in the incident text */
        int matchCount;
        @Builder.Default
        List<String> matchedPatterns = List.of();
        String ruleId;
    }
}
