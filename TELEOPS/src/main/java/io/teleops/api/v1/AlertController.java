package io.teleops.api.v1;

import io.teleops.api.dto.AlertDto;
import io.teleops.api.dto.AlertIngestRequest;
import io.teleops.api.dto.IngestResponse;
import io.teleops.api.mapper.AlertMapper;
import io.teleops.domain.model.Alert;
import io.teleops.domain.service.IncidentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * REST API controller for alert ingestion and listing.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert ingestion")
public class AlertController {

    private final IncidentService incidentService;
    private final Clock clock;

    public AlertController(IncidentService incidentService, Clock clock) {
        this.incidentService = incidentService;
        this.clock = clock;
    }

    @GetMapping
    @Operation(summary = "List alerts", description = "Every stored alert in timestamp order")
    public Mono<ResponseEntity<List<AlertDto>>> listAlerts() {
        return Mono.fromCallable(() -> ResponseEntity.ok(incidentService.listAlerts().stream()
                .map(AlertMapper::toDto)
                .toList()));
    }

    @PostMapping
    @Operation(summary = "Ingest alerts", description = "Store a batch of alerts for later correlation")
    public Mono<ResponseEntity<IngestResponse>> ingest(@RequestBody List<AlertIngestRequest> request) {
        return Mono.fromCallable(() -> {
            Instant receivedAt = clock.instant();
            List<Alert> alerts = request.stream()
                    .map(item -> AlertMapper.toDomain(item, receivedAt))
                    .toList();
            List<Alert> saved = incidentService.ingestAlerts(alerts);
            log.debug("Ingested {} alerts", saved.size());

            return ResponseEntity.status(HttpStatus.CREATED).body(IngestResponse.builder()
                    .accepted(saved.size())
                    .alertIds(saved.stream().map(Alert::getId).toList())
                    .build());
        });
    }
}
