package io.teleops.api.v1;

import io.teleops.TestAlerts;
import io.teleops.TestEngine;
import io.teleops.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

class AdminControllerTest {

    private TestEngine engine;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        client = WebTestClient.bindToController(new AdminController(engine.incidentService))
                .controllerAdvice(new GlobalExceptionHandler(engine.clock))
                .build();
    }

    @Test
    void resetClearsEveryStore() {
        engine.incidentService.ingestAlerts(TestAlerts.burst("dns_outage", 12, engine.clock.instant(), 10,
                "dns_timeout", "servfail from resolver"));
        String id = engine.incidentService.correlateStoredAlerts(null, null, null).get(0).getId();
        engine.incidentService.runBaselineRca(id);
        assertThat(engine.metrics.getOpenIncidents()).isEqualTo(1);

        client.post().uri("/api/v1/admin/reset")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.alerts_deleted").isEqualTo(12)
                .jsonPath("$.incidents_deleted").isEqualTo(1)
                .jsonPath("$.artifacts_deleted").isEqualTo(1);

        assertThat(engine.alertRepository.count()).isZero();
        assertThat(engine.incidentService.getIncident(id)).isEmpty();
        assertThat(engine.incidentService.listIncidents(null, null)).isEmpty();
        assertThat(engine.artifactRepository.findByIncidentId(id)).isEmpty();
        assertThat(engine.metrics.getOpenIncidents()).isZero();
    }

    @Test
    void resetOnEmptyStoresIsOk() {
        client.post().uri("/api/v1/admin/reset")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.alerts_deleted").isEqualTo(0);
    }
}
