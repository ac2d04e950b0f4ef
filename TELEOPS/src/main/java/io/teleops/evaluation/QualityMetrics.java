package io.teleops.evaluation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate hypothesis quality over a set of graded records.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QualityMetrics {

    /** Correct over attempted */
    double precision;

    /** Correct over all records considered */
    double recall;

    /** Wrong-but-confident over attempted */
    double wrongButConfidentRate;

    int wrongButConfidentCount;

    /** Null when no correct record carried a confidence */
    Double meanConfidenceCorrect;

    /** Null when no incorrect record carried a confidence */
    Double meanConfidenceIncorrect;

    int totalAttempted;

    int totalCorrect;

    int totalConsidered;
}
