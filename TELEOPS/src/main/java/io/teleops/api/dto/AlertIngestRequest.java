package io.teleops.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Alert as received from upstream collectors.
 * <p>
 * Field names follow the collectors' snake_case wire format. The timestamp carries its
 * own offset and is normalized to UTC on ingestion; a missing timestamp means "now".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertIngestRequest {

    private String id;

    private OffsetDateTime timestamp;
    private String sourceSystem;

    private String host;

    private String service;

    private String severity;
    private String alertType;

    private String message;

    @Builder.Default
    private Map<String, Object> tags = new HashMap<>();
    @Builder.Default
    private Map<String, Object> rawPayload = new HashMap<>();
    private String tenantId;
}
