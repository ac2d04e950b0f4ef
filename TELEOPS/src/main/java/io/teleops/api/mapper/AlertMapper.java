package io.teleops.api.mapper;

import io.teleops.api.dto.AlertDto;
import io.teleops.api.dto.AlertIngestRequest;
import io.teleops.domain.model.Alert;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Converts between the alert wire format and the domain alert.
 */
public final class AlertMapper {

    private AlertMapper() {}

    /**
     * @param receivedAt timestamp used when the request carries none
     */
    public static Alert toDomain(AlertIngestRequest request, Instant receivedAt) {
        return Alert.builder()
                .id(request.getId() != null && !request.getId().isBlank()
                        ? request.getId()
                        : UUID.randomUUID().toString())
                .timestamp(request.getTimestamp() != null ? request.getTimestamp().toInstant() : receivedAt)
                .sourceSystem(request.getSourceSystem())
                .host(request.getHost())
                .service(request.getService())
                .severity(request.getSeverity())
                .alertType(request.getAlertType())
                .message(request.getMessage())
                .tags(copyOf(request.getTags()))
                .rawPayload(copyOf(request.getRawPayload()))
                .tenantId(request.getTenantId())
                .build();
    }

    public static AlertDto toDto(Alert alert) {
        return AlertDto.builder()
                .id(alert.getId())
                .timestamp(alert.getTimestamp())
                .sourceSystem(alert.getSourceSystem())
                .host(alert.getHost())
                .service(alert.getService())
                .severity(alert.getSeverity())
                .alertType(alert.getAlertType())
                .message(alert.getMessage())
                .tags(alert.getTags())
                .rawPayload(alert.getRawPayload())
                .tenantId(alert.getTenantId())
                .build();
    }

    // Payloads may carry null values, which Map.copyOf rejects
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(source));
    }
}
