package io.teleops.evaluation;

import lombok.Builder;
import lombok.Value;

/**
 * One graded hypothesis outcome.
 * <p>
 * A null score means the source was not attempted (for example it failed).
 */
@Value
@Builder
public class ScoredIncident {

    String source;

    /** Similarity to ground truth in [0, 1], null when not attempted */
    Double score;

    /** Highest confidence the source reported, may be null */
    Double confidence;

    public boolean isAttempted() {
        return score != null;
    }

    public static ScoredIncident notAttempted(String source) {
        return ScoredIncident.builder().source(source).build();
    }
}
