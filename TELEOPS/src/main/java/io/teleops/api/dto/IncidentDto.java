package io.teleops.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IncidentDto {
    private String id;
    private Instant startTime;
    private Instant endTime;
    private String severity;
    private String status;
    private List<String> relatedAlertIds;
    private int alertCount;
    private String summary;
    private String suspectedRootCause;
    private String impactScope;
    private String owner;
    private String createdBy;
    private String tenantId;
    private String correlationTag;
    private Instant createdAt;
    private Instant closedAt;
}
