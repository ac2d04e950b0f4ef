package io.teleops.api.v1;

import io.teleops.api.dto.AlertDto;
import io.teleops.api.dto.CorrelateRequest;
import io.teleops.api.dto.IncidentDto;
import io.teleops.api.dto.IncidentListResponse;
import io.teleops.api.mapper.AlertMapper;
import io.teleops.api.mapper.IncidentMapper;
import io.teleops.domain.model.Incident;
import io.teleops.domain.service.IncidentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * REST API controller for incident correlation and lifecycle.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident correlation and lifecycle")
public class IncidentController {

    private final IncidentService incidentService;

    public IncidentController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    @PostMapping("/correlate")
    @Operation(summary = "Correlate alerts",
               description = "Group stored alerts into incidents, optionally overriding window and minimum count")
    public Mono<ResponseEntity<List<IncidentDto>>> correlate(
            @Valid @RequestBody(required = false) CorrelateRequest request) {

        CorrelateRequest effective = request != null ? request : new CorrelateRequest();
        return Mono.fromCallable(() -> {
            Duration window = effective.getWindowMinutes() != null
                    ? Duration.ofMinutes(effective.getWindowMinutes())
                    : null;
            List<Incident> incidents = incidentService.correlateStoredAlerts(
                    effective.getAlertIds(), window, effective.getMinAlerts());
            log.info("Correlation produced {} incidents", incidents.size());
            return ResponseEntity.ok(incidents.stream().map(IncidentMapper::toDto).toList());
        });
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "List incidents with optional filters")
    public Mono<ResponseEntity<IncidentListResponse>> listIncidents(
            @Parameter(description = "Filter by status (open, closed)")
            @RequestParam(required = false) String status,
            @Parameter(description = "Filter by tenant")
            @RequestParam(name = "tenant_id", required = false) String tenantId,
            @Parameter(description = "Page number")
            @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "20") int size) {

        if (page < 0 || size < 1) {
            return Mono.error(new IllegalArgumentException("page must be >= 0 and size >= 1"));
        }
        return Mono.fromCallable(() -> {
            List<Incident> matching = incidentService.listIncidents(status, tenantId);
            List<IncidentDto> pageContent = matching.stream()
                    .skip((long) page * size)
                    .limit(size)
                    .map(IncidentMapper::toDto)
                    .toList();

            return ResponseEntity.ok(IncidentListResponse.builder()
                    .incidents(pageContent)
                    .total(matching.size())
                    .page(page)
                    .size(size)
                    .hasMore((long) (page + 1) * size < matching.size())
                    .status(status)
                    .tenantId(tenantId)
                    .build());
        });
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Get incident details by ID")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.justOrEmpty(incidentService.getIncident(id))
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/alerts")
    @Operation(summary = "Get incident alerts", description = "Member alerts of an incident in time order")
    public Mono<ResponseEntity<List<AlertDto>>> getIncidentAlerts(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.fromCallable(() -> ResponseEntity.ok(incidentService.getIncidentAlerts(id).stream()
                .map(AlertMapper::toDto)
                .toList()));
    }

    @PostMapping("/{id}/close")
    @Operation(summary = "Close incident", description = "Mark an incident as closed")
    public Mono<ResponseEntity<IncidentDto>> closeIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.fromCallable(() -> incidentService.closeIncident(id))
                .flatMap(Mono::justOrEmpty)
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
