package io.teleops.api.v1;

import io.teleops.TestEngine;
import io.teleops.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

class EvaluationControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        TestEngine engine = new TestEngine();
        client = WebTestClient.bindToController(
                        new EvaluationController(engine.evaluationService, engine.benchmarkService))
                .controllerAdvice(new GlobalExceptionHandler(engine.clock))
                .build();
    }

    @Test
    void evaluationRunReportsBaselineQuality() {
        client.post().uri("/api/v1/evaluation/run?runs=3")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runs").isEqualTo(3)
                .jsonPath("$.scoring_method").isEqualTo("lexical_cosine_similarity")
                .jsonPath("$.per_scenario.length()").isEqualTo(3)
                .jsonPath("$.quality_metrics.baseline.precision").isEqualTo(1.0)
                .jsonPath("$.manual_labels.cases").isEqualTo(12);
    }

    @Test
    void nonPositiveRunsIsBadRequest() {
        client.post().uri("/api/v1/evaluation/run?runs=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("BAD_REQUEST");
    }

    @Test
    void benchmarkReportsLatency() {
        client.post().uri("/api/v1/evaluation/benchmark?runs=2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runs").isEqualTo(2)
                .jsonPath("$.baseline.count").isEqualTo(2)
                .jsonPath("$.baseline.p50_ms").exists()
                .jsonPath("$.java_version").exists();
    }
}
