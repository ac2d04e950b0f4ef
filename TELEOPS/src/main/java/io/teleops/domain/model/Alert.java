package io.teleops.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Canonical representation of a telemetry alert across the service.
 * <p>
 * Alerts are immutable once ingested; the correlation engine only reads and groups them.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    /** Tag key holding the correlation tag. */
    public static final String INCIDENT_TAG_KEY = "incident";

    /** Correlation tag used when an alert carries none. */
    public static final String UNKNOWN_TAG = "unknown";

    String id;

    /** Event time, normalized to UTC */
    Instant timestamp;

    String sourceSystem;
    String host;
    String service;
    String severity;
    String alertType;
    String message;

    @Builder.Default
    Map<String, Object> tags = Map.of();

    @Builder.Default
    Map<String, Object> rawPayload = Map.of();

    /** Tenant identifier, may be null */
    String tenantId;

    /**
     * Correlation tag carried under {@code tags.incident}, or {@code "unknown"}.
     */
    public String correlationTag() {
        if (tags == null) {
            return UNKNOWN_TAG;
        }
        Object tag = tags.get(INCIDENT_TAG_KEY);
        return tag != null ? tag.toString() : UNKNOWN_TAG;
    }
}
