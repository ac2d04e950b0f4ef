package io.teleops.api.v1;

import io.teleops.TestAlerts;
import io.teleops.TestEngine;
import io.teleops.api.error.GlobalExceptionHandler;
import io.teleops.domain.service.ScenarioService;
import io.teleops.evaluation.ScenarioGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScenarioControllerTest {

    private TestEngine engine;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        ScenarioService scenarioService =
                new ScenarioService(new ScenarioGenerator(engine.clock), engine.incidentService);
        client = WebTestClient.bindToController(new ScenarioController(scenarioService))
                .controllerAdvice(new GlobalExceptionHandler(engine.clock))
                .build();
    }

    @Test
    void generatedScenarioIsStoredAndCorrelated() {
        client.post().uri("/api/v1/scenarios/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("incident_type", "dns_outage", "alert_rate_per_min", 5,
                        "duration_min", 3, "noise_rate_per_min", 2, "seed", 7))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.alerts_inserted").isEqualTo(21)
                .jsonPath("$.incidents_created.length()").isEqualTo(1)
                .jsonPath("$.incidents_created[0].correlation_tag").isEqualTo("dns_outage")
                .jsonPath("$.incidents_created[0].alert_count").isEqualTo(15)
                .jsonPath("$.ground_truth.incident_type").isEqualTo("dns_outage")
                .jsonPath("$.ground_truth.root_cause").isNotEmpty()
                .jsonPath("$.ground_truth.remediation_steps").isArray();

        assertThat(engine.alertRepository.count()).isEqualTo(21);
        assertThat(engine.incidentService.listIncidents("open", null)).hasSize(1);
    }

    @Test
    void emptyBodyUsesGeneratorDefaults() {
        client.post().uri("/api/v1/scenarios/generate")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.alerts_inserted").isEqualTo(250)
                .jsonPath("$.incidents_created.length()").isEqualTo(1)
                .jsonPath("$.ground_truth.incident_type").isEqualTo("network_degradation");
    }

    @Test
    void onlyTheGeneratedAlertsAreCorrelated() {
        engine.incidentService.ingestAlerts(TestAlerts.burst("bgp_flap", 12, engine.clock.instant(), 15));

        client.post().uri("/api/v1/scenarios/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("incident_type", "fiber_cut", "alert_rate_per_min", 4,
                        "duration_min", 3, "noise_rate_per_min", 0))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.incidents_created.length()").isEqualTo(1)
                .jsonPath("$.incidents_created[0].correlation_tag").isEqualTo("fiber_cut");
    }

    @Test
    void unknownIncidentTypeIsBadRequest() {
        client.post().uri("/api/v1/scenarios/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("incident_type", "solar_flare"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("BAD_REQUEST");

        assertThat(engine.alertRepository.count()).isZero();
    }

    @Test
    void nonPositiveRateFailsValidation() {
        client.post().uri("/api/v1/scenarios/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("alert_rate_per_min", 0))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_FAILED");
    }
}
