package io.teleops.health;

import io.teleops.TestAlerts;
import io.teleops.TestEngine;
import io.teleops.rca.RuleTable;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class TeleopsHealthIndicatorTest {

    @Test
    void reportsRuleTableAndStoreCounts() {
        TestEngine engine = new TestEngine();
        engine.incidentService.ingestAlerts(TestAlerts.burst("dns_outage", 12, engine.clock.instant(), 10));
        engine.incidentService.correlateStoredAlerts(null, null, null);
        TeleopsHealthIndicator indicator = new TeleopsHealthIndicator(engine.ruleTableProvider,
                engine.incidentRepository, engine.alertRepository, engine.properties);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("ruleTable.version", RuleTable.DEFAULT_VERSION)
                            .containsEntry("ruleTable.size", 11)
                            .containsEntry("ruleTable.fallback", "network_degradation")
                            .containsEntry("alertsStored", 12L)
                            .containsEntry("openIncidents", 1L)
                            .containsEntry("minAlerts", 10)
                            .containsEntry("correlationWindow", "PT15M");
                })
                .verifyComplete();
    }
}
