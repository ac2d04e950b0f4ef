package io.teleops.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Correlation request. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CorrelateRequest {

    /** Stored alerts to correlate; all stored alerts when null */
    private List<String> alertIds;

    /** Overrides the configured correlation window */
    @Positive
    private Integer windowMinutes;

    /** Overrides the configured minimum alert count */
    @Positive
    private Integer minAlerts;
}
