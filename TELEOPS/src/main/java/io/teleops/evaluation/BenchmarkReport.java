package io.teleops.evaluation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.time.Instant;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BenchmarkReport {
    int runs;
    Instant generatedAt;
    String javaVersion;
    LatencySummary baseline;
}
