package io.teleops.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the TeleOps service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Correlation runs (alerts processed, groups discarded by reason)</li>
 *     <li>Incident lifecycle (created, closed, open)</li>
 *     <li>Baseline RCA (latency, confidence, rule hits)</li>
 *     <li>Hypothesis quality evaluation runs</li>
 * </ul>
 */
@Component
public class TeleopsMetrics {

    private final MeterRegistry meterRegistry;

    // Correlation metrics
    @Getter
    private final Counter correlationRuns;
    @Getter
    private final Counter alertsProcessed;
    @Getter
    private final Counter alertsIngested;
    private final DistributionSummary groupSizes;
    private final Map<String, Counter> discardsByReason = new ConcurrentHashMap<>();

    // Incident metrics
    @Getter
    private final Counter incidentsCreated;
    @Getter
    private final Counter incidentsClosed;
    private final AtomicInteger openIncidents;

    // RCA metrics
    @Getter
    private final Counter rcaCompleted;
    @Getter
    private final Counter rcaFailed;
    private final Timer rcaLatency;
    private final DistributionSummary rcaConfidence;
    private final Map<String, Counter> ruleHits = new ConcurrentHashMap<>();

    // Evaluation metrics
    @Getter
    private final Counter evaluationRuns;
    @Getter
    private final Counter hypothesisSourceFailures;

    public TeleopsMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.correlationRuns = Counter.builder("teleops.correlation.runs")
                .description("Correlation runs executed")
                .register(meterRegistry);
        this.alertsProcessed = Counter.builder("teleops.correlation.alerts.processed")
                .description("Alerts fed through correlation")
                .register(meterRegistry);
        this.alertsIngested = Counter.builder("teleops.alerts.ingested")
                .description("Alerts accepted by the ingestion endpoint")
                .register(meterRegistry);
        this.groupSizes = DistributionSummary.builder("teleops.correlation.group.size")
                .description("Alerts per correlation tag group")
                .publishPercentiles(0.25, 0.5, 0.95)
                .register(meterRegistry);

        this.incidentsCreated = Counter.builder("teleops.incidents.created")
                .description("Incidents created by correlation")
                .register(meterRegistry);
        this.incidentsClosed = Counter.builder("teleops.incidents.closed")
                .description("Incidents closed")
                .register(meterRegistry);
        this.openIncidents = meterRegistry.gauge("teleops.incidents.open", new AtomicInteger(0));

        this.rcaCompleted = Counter.builder("teleops.rca.completed")
                .description("Baseline RCA runs completed")
                .register(meterRegistry);
        this.rcaFailed = Counter.builder("teleops.rca.failed")
                .description("RCA runs failed")
                .register(meterRegistry);
        this.rcaLatency = Timer.builder("teleops.rca.latency")
                .description("Hypothesis generation latency")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(meterRegistry);
        this.rcaConfidence = DistributionSummary.builder("teleops.rca.confidence")
                .description("Top hypothesis confidence")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        this.evaluationRuns = Counter.builder("teleops.evaluation.runs")
                .description("Hypothesis quality evaluation runs")
                .register(meterRegistry);
        this.hypothesisSourceFailures = Counter.builder("teleops.evaluation.source.failures")
                .description("Hypothesis source failures during evaluation")
                .register(meterRegistry);
    }

    // ========== Correlation Methods ==========

    public void recordCorrelationRun(int alertCount) {
        correlationRuns.increment();
        alertsProcessed.increment(alertCount);
    }

    public void recordAlertsIngested(int count) {
        alertsIngested.increment(count);
    }

    public void recordGroupSize(int size) {
        groupSizes.record(size);
    }

    public void recordGroupDiscarded(String reason) {
        discardsByReason.computeIfAbsent(reason, r ->
                Counter.builder("teleops.correlation.groups.discarded")
                        .tag("reason", r)
                        .description("Alert groups rejected by the incident selector")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Incident Methods ==========

    public void recordIncidentCreated() {
        incidentsCreated.increment();
        openIncidents.incrementAndGet();
    }

    public void recordIncidentClosed() {
        incidentsClosed.increment();
        openIncidents.decrementAndGet();
    }

    /**
     * Incidents dropped without being closed, e.g. when the stores are cleared.
     */
    public void recordIncidentsDiscarded(int openCount) {
        openIncidents.addAndGet(-openCount);
    }

    public int getOpenIncidents() {
        return openIncidents.get();
    }

    // ========== RCA Methods ==========

    public Timer.Sample startRcaTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRcaCompleted(Timer.Sample sample, String ruleId, double topConfidence) {
        sample.stop(rcaLatency);
        rcaCompleted.increment();
        rcaConfidence.record(topConfidence);
        if (ruleId != null) {
            getRuleHitCounter(ruleId).increment();
        }
    }

    public void recordRcaFailed(Timer.Sample sample) {
        sample.stop(rcaLatency);
        rcaFailed.increment();
    }

    public double getRuleHits(String ruleId) {
        Counter counter = ruleHits.get(ruleId);
        return counter != null ? counter.count() : 0.0;
    }

    private Counter getRuleHitCounter(String ruleId) {
        return ruleHits.computeIfAbsent(ruleId, id ->
                Counter.builder("teleops.rca.rule.hits")
                        .tag("rule_id", id)
                        .description("Baseline rule selections by rule")
                        .register(meterRegistry));
    }

    // ========== Evaluation Methods ==========

    public void recordEvaluationRun() {
        evaluationRuns.increment();
    }

    public void recordHypothesisSourceFailure() {
        hypothesisSourceFailures.increment();
    }
}
