package io.teleops.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scenario generation request. Omitted fields take the generator defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerateScenarioRequest {

    private String incidentType;

    @Positive
    private Integer alertRatePerMin;

    @Positive
    private Integer durationMin;

    @PositiveOrZero
    private Integer noiseRatePerMin;

    private Long seed;
}
