package io.teleops.api.v1;

import io.teleops.api.dto.GenerateScenarioRequest;
import io.teleops.api.dto.ScenarioResponse;
import io.teleops.api.mapper.IncidentMapper;
import io.teleops.domain.service.ScenarioService;
import io.teleops.domain.service.ScenarioService.ScenarioRun;
import io.teleops.evaluation.ScenarioConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST API controller for synthetic scenario injection.
 */
@RestController
@RequestMapping("/api/v1/scenarios")
@Tag(name = "Scenarios", description = "Synthetic alert scenarios")
public class ScenarioController {

    private final ScenarioService scenarioService;

    public ScenarioController(ScenarioService scenarioService) {
        this.scenarioService = scenarioService;
    }

    @PostMapping("/generate")
    @Operation(summary = "Generate scenario",
               description = "Generate a synthetic alert stream, store it and correlate the generated alerts")
    public Mono<ResponseEntity<ScenarioResponse>> generate(
            @Valid @RequestBody(required = false) GenerateScenarioRequest request) {

        ScenarioConfig config = toConfig(request != null ? request : new GenerateScenarioRequest());
        return Mono.fromCallable(() -> {
            ScenarioRun run = scenarioService.inject(config);
            return ResponseEntity.status(HttpStatus.CREATED).body(ScenarioResponse.builder()
                    .alertsInserted(run.getAlertsInserted())
                    .incidentsCreated(run.getIncidents().stream().map(IncidentMapper::toDto).toList())
                    .groundTruth(run.getGroundTruth())
                    .build());
        });
    }

    private static ScenarioConfig toConfig(GenerateScenarioRequest request) {
        ScenarioConfig.ScenarioConfigBuilder builder = ScenarioConfig.builder();
        if (request.getIncidentType() != null) {
            builder.incidentType(request.getIncidentType());
        }
        if (request.getAlertRatePerMin() != null) {
            builder.alertRatePerMin(request.getAlertRatePerMin());
        }
        if (request.getDurationMin() != null) {
            builder.durationMin(request.getDurationMin());
        }
        if (request.getNoiseRatePerMin() != null) {
            builder.noiseRatePerMin(request.getNoiseRatePerMin());
        }
        if (request.getSeed() != null) {
            builder.seed(request.getSeed());
        }
        return builder.build();
    }
}
