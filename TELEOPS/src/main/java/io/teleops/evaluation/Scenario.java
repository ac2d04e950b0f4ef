package io.teleops.evaluation;

import io.teleops.domain.model.Alert;
import lombok.Value;

import java.util.List;

/**
 * Generated alerts with the ground truth they were built from.
 */
@Value
public class Scenario {

    List<Alert> alerts;
    GroundTruth groundTruth;

    /**
     * Alerts tagged with the scenario's incident type, excluding noise.
     */
    public List<Alert> incidentAlerts() {
        return alerts.stream()
                .filter(alert -> groundTruth.getIncidentType().equals(alert.correlationTag()))
                .toList();
    }
}
