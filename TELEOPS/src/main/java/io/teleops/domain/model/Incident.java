package io.teleops.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Incident entity representing a group of correlated alerts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    public static final String SEVERITY_CRITICAL = "critical";
    public static final String IMPACT_SCOPE_NETWORK = "network";
    public static final String CREATED_BY_CORRELATOR = "correlator";
    public static final String SUMMARY_PREFIX = "Correlated incident for tag: ";

    /** Unique incident identifier, {@code {tag}_{yyyyMMdd}_{HHmmss}_{hex4}} */
    private String id;

    /** Timestamp of the earliest member alert */
    private Instant startTime;

    /** Timestamp of the latest member alert */
    private Instant endTime;

    @Builder.Default
    private String severity = SEVERITY_CRITICAL;

    @Builder.Default
    private IncidentStatus status = IncidentStatus.OPEN;

    /** Member alert IDs, in timestamp order */
    @Builder.Default
    private List<String> relatedAlertIds = new ArrayList<>();

    private String summary;

    /** Null until a hypothesis is attached */
    private String suspectedRootCause;

    private String impactScope;

    private String owner;

    private String createdBy;

    private String tenantId;

    /** Correlation tag the incident was built from */
    private String correlationTag;

    private Instant createdAt;

    private Instant closedAt;

    public static String summaryFor(String tag) {
        return SUMMARY_PREFIX + tag;
    }

    /**
     * Record the top hypothesis as the suspected root cause.
     */
    public void attachRootCause(String rootCause) {
        this.suspectedRootCause = rootCause;
    }

    /**
     * Mark incident as closed.
     */
    public void close(Instant at) {
        this.status = IncidentStatus.CLOSED;
        this.closedAt = at;
    }

    public boolean isActive() {
        return status == IncidentStatus.OPEN;
    }

    /**
     * Incident status enum.
     */
    public enum IncidentStatus {
        OPEN,
        CLOSED
    }
}
