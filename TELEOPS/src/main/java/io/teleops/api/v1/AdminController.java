package io.teleops.api.v1;

import io.teleops.api.dto.ResetResponse;
import io.teleops.domain.service.IncidentService;
import io.teleops.domain.service.IncidentService.StoreReset;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Operational endpoints for demo and test environments.
 */
@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin", description = "Store maintenance")
public class AdminController {

    private final IncidentService incidentService;

    public AdminController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset stores", description = "Delete every stored alert, incident and RCA artifact")
    public Mono<ResponseEntity<ResetResponse>> reset() {
        return Mono.fromCallable(() -> {
            StoreReset reset = incidentService.resetStores();
            return ResponseEntity.ok(ResetResponse.builder()
                    .status(ResetResponse.STATUS_OK)
                    .alertsDeleted(reset.alerts())
                    .incidentsDeleted(reset.incidents())
                    .artifactsDeleted(reset.artifacts())
                    .build());
        });
    }
}
