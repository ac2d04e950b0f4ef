package io.teleops.evaluation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of a synthetic evaluation run.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EvaluationReport {

    int runs;

    String scoringMethod;

    Map<String, Double> thresholds;

    double baselineAvg;

    double baselineMedian;

    /** Mean score per source; null for a source that was never attempted */
    Map<String, Double> sourceAverages;

    /** Quality per source; null for a source without attempted records */
    Map<String, QualityMetrics> qualityMetrics;

    List<ScenarioResult> perScenario;

    /** Present when a manual label file was found */
    ManualLabelReport manualLabels;

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ScenarioResult {
        String scenarioType;
        long seed;
        String groundTruth;
        List<SourceOutcome> outcomes;
    }

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SourceOutcome {
        String source;
        String hypothesis;
        /** Null when the source failed */
        Double score;
        Double confidence;
    }
}
