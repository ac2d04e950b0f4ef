package io.teleops.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResetResponse {
    public static final String STATUS_OK = "ok";

    private String status;
    private int alertsDeleted;
    private int incidentsDeleted;
    private int artifactsDeleted;
}
