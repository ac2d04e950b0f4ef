package io.teleops.evaluation;

import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Incident;
import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.observability.TeleopsStructuredLogger.EvaluationEventType;
import io.teleops.rca.BaselineHypothesisMatcher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Measures baseline matcher latency over synthetic scenarios.
 * <p>
 * Only the match call is timed; scenario generation is excluded.
 */
@Service
public class RcaBenchmarkService {

    private static final ScenarioType[] SCENARIO_TYPES = ScenarioType.values();

    private final ScenarioGenerator scenarioGenerator;
    private final BaselineHypothesisMatcher matcher;
    private final TeleopsProperties properties;
    private final Clock clock;
    private final TeleopsStructuredLogger structuredLogger;

    public RcaBenchmarkService(ScenarioGenerator scenarioGenerator,
                               BaselineHypothesisMatcher matcher,
                               TeleopsProperties properties,
                               Clock clock,
                               TeleopsStructuredLogger structuredLogger) {
        this.scenarioGenerator = scenarioGenerator;
        this.matcher = matcher;
        this.properties = properties;
        this.clock = clock;
        this.structuredLogger = structuredLogger;
    }

    public BenchmarkReport run() {
        return run(properties.getEvaluation().getBenchmarkRuns());
    }

    /**
     * @throws IllegalArgumentException if {@code runs} is not positive
     */
    public BenchmarkReport run(int runs) {
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be positive, got " + runs);
        }
        List<Double> samplesMs = new ArrayList<>(runs);
        for (int seed = 0; seed < runs; seed++) {
            ScenarioType type = SCENARIO_TYPES[seed % SCENARIO_TYPES.length];
            Scenario scenario = scenarioGenerator.generate(ScenarioConfig.builder()
                    .incidentType(type.getId())
                    .seed((long) seed)
                    .build());
            String summary = Incident.summaryFor(type.getId());

            long started = System.nanoTime();
            matcher.match(summary, scenario.incidentAlerts());
            samplesMs.add((System.nanoTime() - started) / 1_000_000.0);
        }

        LatencySummary summary = LatencySummary.of(samplesMs);
        Map<String, Object> details = new HashMap<>();
        details.put("runs", runs);
        details.put("p50Ms", summary.getP50Ms());
        details.put("p99Ms", summary.getP99Ms());
        structuredLogger.logEvaluationEvent(EvaluationEventType.BENCHMARK_COMPLETED,
                "RCA latency benchmark completed", details);

        return new BenchmarkReport(runs, clock.instant(), System.getProperty("java.version"), summary);
    }
}
