package io.teleops.evaluation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.teleops.stats.PercentileEstimator;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Latency statistics of one benchmark series, in milliseconds.
 * <p>
 * All statistics are null for an empty series.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LatencySummary {

    int count;
    Double avgMs;
    Double minMs;
    Double p50Ms;
    Double p90Ms;
    Double p99Ms;
    Double maxMs;

    public static LatencySummary of(List<Double> samplesMs) {
        if (samplesMs == null || samplesMs.isEmpty()) {
            return new LatencySummary(0, null, null, null, null, null, null);
        }
        List<Double> sorted = new ArrayList<>(samplesMs);
        Collections.sort(sorted);
        double avg = sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new LatencySummary(
                sorted.size(),
                avg,
                sorted.get(0),
                PercentileEstimator.percentileOfSorted(sorted, 50),
                PercentileEstimator.percentileOfSorted(sorted, 90),
                PercentileEstimator.percentileOfSorted(sorted, 99),
                sorted.get(sorted.size() - 1));
    }
}
