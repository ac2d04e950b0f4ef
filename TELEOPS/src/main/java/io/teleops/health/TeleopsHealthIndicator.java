package io.teleops.health;

import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Incident.IncidentStatus;
import io.teleops.domain.repository.AlertRepository;
import io.teleops.domain.repository.IncidentRepository;
import io.teleops.rca.RuleTable;
import io.teleops.rca.RuleTableProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the TeleOps service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Active baseline rule table</li>
 *     <li>Stored alerts and open incidents</li>
 *     <li>Correlation settings in effect</li>
 * </ul>
 */
@Slf4j
@Component
public class TeleopsHealthIndicator implements ReactiveHealthIndicator {

    private final RuleTableProvider ruleTableProvider;
    private final IncidentRepository incidentRepository;
    private final AlertRepository alertRepository;
    private final TeleopsProperties properties;

    public TeleopsHealthIndicator(RuleTableProvider ruleTableProvider,
                                  IncidentRepository incidentRepository,
                                  AlertRepository alertRepository,
                                  TeleopsProperties properties) {
        this.ruleTableProvider = ruleTableProvider;
        this.incidentRepository = incidentRepository;
        this.alertRepository = alertRepository;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        RuleTable table = ruleTableProvider.current();
        if (table == null) {
            log.error("Health check found no active rule table");
            details.put("ruleTable.error", "No rule table loaded");
            return Health.down().withDetails(details).build();
        }
        details.put("ruleTable.version", table.getVersion());
        details.put("ruleTable.size", table.size());
        details.put("ruleTable.fallback", table.fallbackRule().getId());

        details.put("alertsStored", alertRepository.count());
        details.put("openIncidents", incidentRepository.countByStatus(IncidentStatus.OPEN));

        TeleopsProperties.Correlation correlation = properties.getCorrelation();
        details.put("correlationWindow", correlation.getWindow().toString());
        details.put("minAlerts", correlation.getMinAlerts());
        details.put("noisePercentile", correlation.getNoisePercentile());

        return Health.up().withDetails(details).build();
    }
}
