package io.teleops.api.mapper;

import io.teleops.api.dto.IncidentDto;
import io.teleops.domain.model.Incident;

import java.util.List;

/**
 * Mapper for incident to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(Incident incident) {
        List<String> alertIds = incident.getRelatedAlertIds() != null
                ? List.copyOf(incident.getRelatedAlertIds())
                : List.of();
        return IncidentDto.builder()
                .id(incident.getId())
                .startTime(incident.getStartTime())
                .endTime(incident.getEndTime())
                .severity(incident.getSeverity())
                .status(incident.getStatus().name())
                .relatedAlertIds(alertIds)
                .alertCount(alertIds.size())
                .summary(incident.getSummary())
                .suspectedRootCause(incident.getSuspectedRootCause())
                .impactScope(incident.getImpactScope())
                .owner(incident.getOwner())
                .createdBy(incident.getCreatedBy())
                .tenantId(incident.getTenantId())
                .correlationTag(incident.getCorrelationTag())
                .createdAt(incident.getCreatedAt())
                .closedAt(incident.getClosedAt())
                .build();
    }
}
