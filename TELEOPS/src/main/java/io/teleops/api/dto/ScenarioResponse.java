package io.teleops.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.teleops.evaluation.GroundTruth;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScenarioResponse {
    private int alertsInserted;
    private List<IncidentDto> incidentsCreated;
    private GroundTruth groundTruth;
}
