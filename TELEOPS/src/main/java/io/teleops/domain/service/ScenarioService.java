package io.teleops.domain.service;

import io.teleops.domain.model.Alert;
import io.teleops.domain.model.Incident;
import io.teleops.evaluation.GroundTruth;
import io.teleops.evaluation.Scenario;
import io.teleops.evaluation.ScenarioConfig;
import io.teleops.evaluation.ScenarioGenerator;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Injects synthetic scenarios into the live stores: the generated alerts are stored and
 * correlated like ingested ones, so a scenario exercises the whole intake path.
 */
@Slf4j
@Service
public class ScenarioService {

    private final ScenarioGenerator generator;
    private final IncidentService incidentService;

    public ScenarioService(ScenarioGenerator generator, IncidentService incidentService) {
        this.generator = generator;
        this.incidentService = incidentService;
    }

    /**
     * Generate a scenario, store its alerts and correlate exactly those alerts with the
     * configured window and minimum count.
     *
     * @throws IllegalArgumentException if the incident type is unknown
     */
    public ScenarioRun inject(ScenarioConfig config) {
        Scenario scenario = generator.generate(config);
        List<Alert> stored = incidentService.ingestAlerts(scenario.getAlerts());
        List<Incident> incidents = incidentService.correlateStoredAlerts(
                stored.stream().map(Alert::getId).toList(), null, null);
        log.info("Injected scenario {} | alerts={} incidents={}",
                config.getIncidentType(), stored.size(), incidents.size());
        return new ScenarioRun(stored.size(), incidents, scenario.getGroundTruth());
    }

    /**
     * Outcome of one scenario injection.
     */
    @Value
    public static class ScenarioRun {
        int alertsInserted;
        List<Incident> incidents;
        GroundTruth groundTruth;
    }
}
