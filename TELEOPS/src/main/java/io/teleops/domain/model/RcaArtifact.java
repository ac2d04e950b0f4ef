package io.teleops.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored outcome of one RCA run against an incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RcaArtifact {

    public static final String STATUS_PENDING_REVIEW = "pending_review";

    private String id;

    private String incidentId;

    private HypothesisResult result;

    /** Time spent producing the hypothesis */
    private double durationMs;

    @Builder.Default
    private String status = STATUS_PENDING_REVIEW;

    private Instant createdAt;
}
