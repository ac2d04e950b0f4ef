package io.teleops.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * DTO for alert representation in API responses.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertDto {
    private String id;
    private Instant timestamp;
    private String sourceSystem;
    private String host;
    private String service;
    private String severity;
    private String alertType;
    private String message;
    private Map<String, Object> tags;
    private Map<String, Object> rawPayload;
    private String tenantId;
}
