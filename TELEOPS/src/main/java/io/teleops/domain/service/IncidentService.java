package io.teleops.domain.service;

import io.micrometer.core.instrument.Timer;
import io.teleops.config.TeleopsProperties;
import io.teleops.correlation.AlertCorrelator;
import io.teleops.domain.model.Alert;
import io.teleops.domain.model.HypothesisResult;
import io.teleops.domain.model.Incident;
import io.teleops.domain.model.Incident.IncidentStatus;
import io.teleops.domain.model.RcaArtifact;
import io.teleops.domain.repository.AlertRepository;
import io.teleops.domain.repository.IncidentRepository;
import io.teleops.domain.repository.RcaArtifactRepository;
import io.teleops.observability.TeleopsMetrics;
import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.observability.TeleopsStructuredLogger.IncidentEventType;
import io.teleops.observability.TeleopsStructuredLogger.RcaEventType;
import io.teleops.rca.BaselineHypothesisMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Central service for alert intake and incident lifecycle state.
 */
@Slf4j
@Service
public class IncidentService {

    private final AlertRepository alertRepository;
    private final IncidentRepository incidentRepository;
    private final RcaArtifactRepository artifactRepository;
    private final AlertCorrelator correlator;
    private final BaselineHypothesisMatcher baselineMatcher;
    private final TeleopsProperties properties;
    private final TeleopsMetrics metrics;
    private final TeleopsStructuredLogger structuredLogger;
    private final Clock clock;

    public IncidentService(AlertRepository alertRepository,
                           IncidentRepository incidentRepository,
                           RcaArtifactRepository artifactRepository,
                           AlertCorrelator correlator,
                           BaselineHypothesisMatcher baselineMatcher,
                           TeleopsProperties properties,
                           TeleopsMetrics metrics,
                           TeleopsStructuredLogger structuredLogger,
                           Clock clock) {
        this.alertRepository = alertRepository;
        this.incidentRepository = incidentRepository;
        this.artifactRepository = artifactRepository;
        this.correlator = correlator;
        this.baselineMatcher = baselineMatcher;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Store a batch of alerts.
     */
    public List<Alert> ingestAlerts(Collection<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return List.of();
        }
        List<Alert> saved = alertRepository.saveAll(alerts);
        metrics.recordAlertsIngested(saved.size());
        return saved;
    }

    /**
     * Correlate stored alerts and persist the resulting incidents.
     *
     * @param alertIds   subset to correlate, or null for every stored alert
     * @param window     window override, or null for the configured window
     * @param minAlerts  minimum count override, or null for the configured minimum
     */
    public List<Incident> correlateStoredAlerts(Collection<String> alertIds, Duration window, Integer minAlerts) {
        List<Alert> alerts = alertIds == null ? alertRepository.findAll() : alertRepository.findAllById(alertIds);
        TeleopsProperties.Correlation config = properties.getCorrelation();
        List<Incident> incidents = correlator.correlate(alerts,
                window != null ? window : config.getWindow(),
                minAlerts != null ? minAlerts : config.getMinAlerts());

        for (Incident incident : incidents) {
            incidentRepository.save(incident);
            metrics.recordIncidentCreated();
            structuredLogger.logIncidentEvent(incident.getId(), incident.getTenantId(),
                    IncidentEventType.CREATED, "Incident created",
                    Map.of("tag", incident.getCorrelationTag(),
                            "alerts", incident.getRelatedAlertIds().size()));
        }
        return incidents;
    }

    public Optional<Incident> getIncident(String incidentId) {
        return incidentRepository.findById(incidentId);
    }

    /**
     * Incidents, newest first, optionally filtered by status and tenant.
     *
     * @throws IllegalArgumentException if status names no known incident status
     */
    public List<Incident> listIncidents(String status, String tenantId) {
        return incidentRepository.findByStatusAndTenant(parseStatus(status), tenantId);
    }

    /**
     * Every stored alert in timestamp order.
     */
    public List<Alert> listAlerts() {
        return alertRepository.findAll().stream()
                .sorted(Comparator.comparing(Alert::getTimestamp).thenComparing(Alert::getId))
                .toList();
    }

    /**
     * Drop every stored alert, incident and RCA artifact.
     */
    public StoreReset resetStores() {
        long open = incidentRepository.countByStatus(IncidentStatus.OPEN);
        StoreReset reset = new StoreReset(
                alertRepository.deleteAll(),
                incidentRepository.deleteAll(),
                artifactRepository.deleteAll());
        metrics.recordIncidentsDiscarded((int) open);
        log.warn("Cleared all stores | alerts={} incidents={} artifacts={}",
                reset.alerts(), reset.incidents(), reset.artifacts());
        return reset;
    }

    /**
     * Member alerts of an incident in timestamp order. Alerts no longer stored are skipped.
     */
    public List<Alert> getIncidentAlerts(String incidentId) {
        Incident incident = requireIncident(incidentId);
        return alertRepository.findAllById(incident.getRelatedAlertIds()).stream()
                .sorted(Comparator.comparing(Alert::getTimestamp))
                .toList();
    }

    /**
     * Run the baseline matcher for an incident and attach the result.
     */
    public RcaArtifact runBaselineRca(String incidentId) {
        Incident incident = requireIncident(incidentId);
        List<Alert> alerts = alertRepository.findAllById(incident.getRelatedAlertIds());

        Timer.Sample sample = metrics.startRcaTimer();
        long started = System.nanoTime();
        HypothesisResult result;
        try {
            result = baselineMatcher.match(incident.getSummary(), alerts);
        } catch (RuntimeException e) {
            metrics.recordRcaFailed(sample);
            structuredLogger.logRcaEvent(incidentId, RcaEventType.ANALYSIS_FAILED,
                    "Baseline RCA failed", Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
        double durationMs = (System.nanoTime() - started) / 1_000_000.0;
        String ruleId = result.getEvidence() != null ? result.getEvidence().getRuleId() : null;
        metrics.recordRcaCompleted(sample, ruleId, result.maxConfidence());

        return attachHypothesis(incident, result, durationMs);
    }

    /**
     * Record a hypothesis result against an incident.
     */
    public RcaArtifact attachHypothesis(String incidentId, HypothesisResult result, double durationMs) {
        return attachHypothesis(requireIncident(incidentId), result, durationMs);
    }

    public Optional<RcaArtifact> getLatestArtifact(String incidentId) {
        return artifactRepository.findLatestByIncidentId(incidentId);
    }

    /**
     * Every RCA artifact of an incident, oldest first.
     */
    public List<RcaArtifact> getArtifacts(String incidentId) {
        requireIncident(incidentId);
        return artifactRepository.findByIncidentId(incidentId);
    }

    /**
     * Close an incident. Closing a closed incident is a no-op.
     */
    public Optional<Incident> closeIncident(String incidentId) {
        return incidentRepository.findById(incidentId)
                .map(incident -> {
                    if (!incident.isActive()) {
                        return incident;
                    }
                    incident.close(clock.instant());
                    incidentRepository.save(incident);
                    metrics.recordIncidentClosed();
                    structuredLogger.logIncidentEvent(incident.getId(), incident.getTenantId(),
                            IncidentEventType.CLOSED, "Incident closed", null);
                    return incident;
                });
    }

    private RcaArtifact attachHypothesis(Incident incident, HypothesisResult result, double durationMs) {
        incident.attachRootCause(result.topHypothesis());
        incidentRepository.save(incident);

        RcaArtifact artifact = artifactRepository.save(RcaArtifact.builder()
                .id(UUID.randomUUID().toString())
                .incidentId(incident.getId())
                .result(result)
                .durationMs(durationMs)
                .status(RcaArtifact.STATUS_PENDING_REVIEW)
                .createdAt(clock.instant())
                .build());

        Map<String, Object> details = new HashMap<>();
        details.put("hypothesis", result.topHypothesis());
        details.put("confidence", result.maxConfidence());
        details.put("model", result.getModel());
        details.put("durationMs", durationMs);
        if (result.getEvidence() != null) {
            details.put("ruleId", result.getEvidence().getRuleId());
            details.put("matchCount", result.getEvidence().getMatchCount());
        }
        RcaEventType eventType = result.maxConfidence() < properties.getRca().getLowConfidenceThreshold()
                ? RcaEventType.LOW_CONFIDENCE
                : RcaEventType.HYPOTHESIS_GENERATED;
        structuredLogger.logRcaEvent(incident.getId(), eventType, "Hypothesis attached", details);
        structuredLogger.logIncidentEvent(incident.getId(), incident.getTenantId(),
                IncidentEventType.ROOT_CAUSE_ATTACHED, "Suspected root cause recorded",
                Map.of("artifactId", artifact.getId()));
        return artifact;
    }

    private static IncidentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return IncidentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown incident status: " + status, e);
        }
    }

    private Incident requireIncident(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    /**
     * Counts removed by {@link #resetStores()}.
     */
    public record StoreReset(int alerts, int incidents, int artifacts) {
    }
}
