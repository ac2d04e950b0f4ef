package io.teleops.evaluation;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one synthetic scenario.
 */
@Value
@Builder
public class ScenarioConfig {

    @Builder.Default
    String incidentType = ScenarioType.NETWORK_DEGRADATION.getId();

    @Builder.Default
    int alertRatePerMin = 20;

    @Builder.Default
    int durationMin = 10;

    @Builder.Default
    int noiseRatePerMin = 5;

    /** Random seed; null for a non-reproducible scenario */
    @Builder.Default
    Long seed = 42L;
}
