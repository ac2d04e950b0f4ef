package io.teleops.correlation;

import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Alert;
import io.teleops.domain.model.Incident;
import io.teleops.observability.TeleopsMetrics;
import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.observability.TeleopsStructuredLogger.CorrelationEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Correlates a batch of alerts into incidents.
 * <p>
 * Groups alerts by correlation tag and hands the groups to the {@link IncidentSelector}.
 * Runs are stateless; persisting the incidents is left to the caller.
 */
@Slf4j
@Service
public class AlertCorrelator {

    private final AlertGrouper grouper;
    private final IncidentSelector selector;
    private final TeleopsProperties properties;
    private final TeleopsMetrics metrics;
    private final TeleopsStructuredLogger structuredLogger;

    public AlertCorrelator(AlertGrouper grouper,
                           IncidentSelector selector,
                           TeleopsProperties properties,
                           TeleopsMetrics metrics,
                           TeleopsStructuredLogger structuredLogger) {
        this.grouper = grouper;
        this.selector = selector;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Correlate with the configured window and minimum alert count.
     */
    public List<Incident> correlate(Collection<Alert> alerts) {
        TeleopsProperties.Correlation config = properties.getCorrelation();
        return correlate(alerts, config.getWindow(), config.getMinAlerts());
    }

    /**
     * Correlate with explicit admissibility parameters.
     */
    public List<Incident> correlate(Collection<Alert> alerts, Duration window, int minAlerts) {
        int alertCount = alerts == null ? 0 : alerts.size();
        String runId = UUID.randomUUID().toString();
        metrics.recordCorrelationRun(alertCount);
        structuredLogger.logCorrelationEvent(runId, CorrelationEventType.STARTED, "Correlation started",
                Map.of("alerts", alertCount, "windowMinutes", window.toMinutes(), "minAlerts", minAlerts));

        Map<String, AlertGroup> groups = grouper.group(alerts);
        groups.values().forEach(group -> metrics.recordGroupSize(group.getCount()));

        IncidentSelector.Selection selection = selector.evaluate(groups.values(), window, minAlerts);

        for (IncidentSelector.Discard discard : selection.getDiscarded()) {
            metrics.recordGroupDiscarded(discard.getReason());
            structuredLogger.logCorrelationEvent(runId, CorrelationEventType.GROUP_DISCARDED,
                    "Alert group rejected",
                    Map.of("tag", discard.getTag(), "count", discard.getCount(), "reason", discard.getReason()));
        }

        Map<String, Object> details = new HashMap<>();
        details.put("alerts", alertCount);
        details.put("groups", groups.size());
        details.put("incidents", selection.getIncidents().size());
        details.put("discarded", selection.getDiscarded().size());
        details.put("noiseThreshold", selection.getNoiseThreshold());
        details.put("windowMinutes", window.toMinutes());
        details.put("minAlerts", minAlerts);
        structuredLogger.logCorrelationEvent(runId, CorrelationEventType.COMPLETED,
                "Correlation completed", details);

        log.debug("Correlated {} alerts into {} incidents", alertCount, selection.getIncidents().size());
        return selection.getIncidents();
    }
}
