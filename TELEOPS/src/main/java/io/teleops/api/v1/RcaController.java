package io.teleops.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.RcaArtifact;
import io.teleops.domain.service.IncidentService;
import io.teleops.rca.BaselineRule;
import io.teleops.rca.RuleTable;
import io.teleops.rca.RuleTableProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * REST API controller for baseline root cause analysis.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/rca")
@Tag(name = "RCA", description = "Baseline root cause analysis")
public class RcaController {

    private final IncidentService incidentService;
    private final RuleTableProvider ruleTableProvider;

    public RcaController(IncidentService incidentService, RuleTableProvider ruleTableProvider) {
        this.incidentService = incidentService;
        this.ruleTableProvider = ruleTableProvider;
    }

    @PostMapping("/{incidentId}/baseline")
    @Operation(summary = "Run baseline RCA",
               description = "Match the incident against the rule table and record the suspected root cause")
    public Mono<ResponseEntity<RcaArtifact>> runBaseline(
            @Parameter(description = "Incident ID") @PathVariable String incidentId) {

        log.info("Baseline RCA requested for incident: {}", incidentId);
        return Mono.fromCallable(() -> ResponseEntity.ok(incidentService.runBaselineRca(incidentId)));
    }

    @GetMapping("/{incidentId}")
    @Operation(summary = "Get latest RCA", description = "Most recent RCA artifact for an incident")
    public Mono<ResponseEntity<RcaArtifact>> getLatest(
            @Parameter(description = "Incident ID") @PathVariable String incidentId) {

        return Mono.fromCallable(() -> incidentService.getLatestArtifact(incidentId))
                .flatMap(Mono::justOrEmpty)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{incidentId}/history")
    @Operation(summary = "Get RCA history", description = "All RCA artifacts for an incident, oldest first")
    public Mono<ResponseEntity<List<RcaArtifact>>> getHistory(
            @Parameter(description = "Incident ID") @PathVariable String incidentId) {

        return Mono.fromCallable(() -> ResponseEntity.ok(incidentService.getArtifacts(incidentId)));
    }

    @GetMapping("/rules")
    @Operation(summary = "Get rule table", description = "Active baseline rule table")
    public Mono<ResponseEntity<RuleTableResponse>> getRules() {
        return Mono.fromCallable(() -> ResponseEntity.ok(RuleTableResponse.from(ruleTableProvider.current())));
    }

    @PutMapping("/rules")
    @Operation(summary = "Replace rule table",
               description = "Validate and atomically install a new rule table; the active table is kept on rejection")
    public Mono<ResponseEntity<RuleTableResponse>> replaceRules(@RequestBody RuleTableRequest request) {
        return Mono.fromCallable(() -> {
            RuleTable installed = ruleTableProvider.replace(
                    () -> RuleTable.fromDefinitions(request.getVersion(), request.getRules()));
            return ResponseEntity.ok(RuleTableResponse.from(installed));
        });
    }

    // ========== Request/Response DTOs ==========

    @lombok.Data
    public static class RuleTableRequest {
        private String version;
        private List<TeleopsProperties.RuleDefinition> rules = new ArrayList<>();
    }

    @lombok.Data
    @lombok.Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RuleTableResponse {
        private String version;
        private String fallbackRuleId;
        private List<BaselineRule> rules;

        static RuleTableResponse from(RuleTable table) {
            return RuleTableResponse.builder()
                    .version(table.getVersion())
                    .fallbackRuleId(table.fallbackRule().getId())
                    .rules(table.getRules())
                    .build();
        }
    }
}
