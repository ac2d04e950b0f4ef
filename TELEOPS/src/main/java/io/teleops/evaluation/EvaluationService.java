package io.teleops.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Alert;
import io.teleops.domain.model.HypothesisResult;
import io.teleops.domain.model.Incident;
import io.teleops.observability.TeleopsMetrics;
import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.observability.TeleopsStructuredLogger.EvaluationEventType;
import io.teleops.rca.BaselineHypothesisMatcher;
import io.teleops.rca.HypothesisSource;
import io.teleops.stats.PercentileEstimator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grades every registered hypothesis source against synthetic and manually labeled ground truth.
 * <p>
 * Scenario {@code seed} uses type {@code types[seed % types.length]}, so a run of N covers the
 * scenario types round robin. A source that throws is recorded as not attempted for that
 * scenario and the run continues.
 */
@Slf4j
@Service
public class EvaluationService {

    private static final ScenarioType[] SCENARIO_TYPES = ScenarioType.values();

    private final ScenarioGenerator scenarioGenerator;
    private final List<HypothesisSource> sources;
    private final BaselineHypothesisMatcher baselineMatcher;
    private final QualityScorer qualityScorer;
    private final TeleopsProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final TeleopsMetrics metrics;
    private final TeleopsStructuredLogger structuredLogger;

    public EvaluationService(ScenarioGenerator scenarioGenerator,
                             List<HypothesisSource> sources,
                             BaselineHypothesisMatcher baselineMatcher,
                             QualityScorer qualityScorer,
                             TeleopsProperties properties,
                             ResourceLoader resourceLoader,
                             ObjectMapper objectMapper,
                             TeleopsMetrics metrics,
                             TeleopsStructuredLogger structuredLogger) {
        this.scenarioGenerator = scenarioGenerator;
        this.sources = sources;
        this.baselineMatcher = baselineMatcher;
        this.qualityScorer = qualityScorer;
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Run the configured number of synthetic scenarios plus the manual label set.
     */
    public EvaluationReport run() {
        return run(properties.getEvaluation().getDefaultRuns());
    }

    /**
     * Run {@code runs} synthetic scenarios and, when the label file exists, the manual label set.
     *
     * @throws IllegalArgumentException if {@code runs} is not positive
     */
    public EvaluationReport run(int runs) {
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be positive, got " + runs);
        }
        metrics.recordEvaluationRun();
        structuredLogger.logEvaluationEvent(EvaluationEventType.RUN_STARTED, "Evaluation started",
                Map.of("runs", runs, "sources", sourceNames()));

        List<ScoredIncident> records = new ArrayList<>();
        Map<String, List<Double>> scoresBySource = new LinkedHashMap<>();
        sources.forEach(source -> scoresBySource.put(source.name(), new ArrayList<>()));
        List<EvaluationReport.ScenarioResult> perScenario = new ArrayList<>(runs);

        for (int seed = 0; seed < runs; seed++) {
            ScenarioType type = SCENARIO_TYPES[seed % SCENARIO_TYPES.length];
            Scenario scenario = scenarioGenerator.generate(ScenarioConfig.builder()
                    .incidentType(type.getId())
                    .seed((long) seed)
                    .build());
            String summary = Incident.summaryFor(type.getId());
            String rootCause = scenario.getGroundTruth().getRootCause();
            List<Alert> incidentAlerts = scenario.incidentAlerts();

            List<EvaluationReport.SourceOutcome> outcomes = new ArrayList<>(sources.size());
            for (HypothesisSource source : sources) {
                EvaluationReport.SourceOutcome outcome = evaluateSource(source, summary, incidentAlerts, rootCause);
                outcomes.add(outcome);
                records.add(ScoredIncident.builder()
                        .source(source.name())
                        .score(outcome.getScore())
                        .confidence(outcome.getConfidence())
                        .build());
                if (outcome.getScore() != null) {
                    scoresBySource.get(source.name()).add(outcome.getScore());
                }
            }
            perScenario.add(new EvaluationReport.ScenarioResult(type.getId(), seed, rootCause, outcomes));
        }

        Map<String, Double> sourceAverages = new LinkedHashMap<>();
        scoresBySource.forEach((source, scores) -> sourceAverages.put(source, scores.isEmpty() ? null : mean(scores)));
        List<Double> baselineScores = scoresBySource.getOrDefault(baselineMatcher.name(), List.of());

        EvaluationReport report = EvaluationReport.builder()
                .runs(runs)
                .scoringMethod(LexicalSimilarity.METHOD)
                .thresholds(qualityScorer.thresholds())
                .baselineAvg(baselineScores.isEmpty() ? 0.0 : mean(baselineScores))
                .baselineMedian(PercentileEstimator.percentile(baselineScores, 50))
                .sourceAverages(sourceAverages)
                .qualityMetrics(qualityScorer.aggregateBySource(records))
                .perScenario(perScenario)
                .manualLabels(evaluateConfiguredLabels())
                .build();

        structuredLogger.logEvaluationEvent(EvaluationEventType.RUN_COMPLETED, "Evaluation completed",
                Map.of("runs", runs,
                        "baselineAvg", report.getBaselineAvg(),
                        "baselineMedian", report.getBaselineMedian()));
        return report;
    }

    /**
     * Score the baseline matcher against each label, using the label summary as the only input.
     */
    public ManualLabelReport evaluateManualLabels(List<ManualLabel> labels) {
        List<Double> scores = new ArrayList<>(labels.size());
        for (ManualLabel label : labels) {
            String summary = label.getIncidentSummary() != null ? label.getIncidentSummary() : "";
            String rootCause = label.getRootCause() != null ? label.getRootCause() : "";
            HypothesisResult result = baselineMatcher.match(summary, List.of());
            scores.add(qualityScorer.score(result.getHypotheses(), rootCause));
        }
        return new ManualLabelReport(labels.size(),
                scores.isEmpty() ? 0.0 : mean(scores),
                PercentileEstimator.percentile(scores, 50));
    }

    /**
     * Parse a JSONL label file; blank lines are skipped.
     */
    public List<ManualLabel> loadManualLabels(Resource resource) {
        List<ManualLabel> labels = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                labels.add(objectMapper.readValue(line.strip(), ManualLabel.class));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read manual labels from " + resource.getDescription(), e);
        }
        structuredLogger.logEvaluationEvent(EvaluationEventType.LABELS_LOADED, "Manual labels loaded",
                Map.of("cases", labels.size(), "resource", resource.getDescription()));
        return labels;
    }

    private ManualLabelReport evaluateConfiguredLabels() {
        String location = properties.getEvaluation().getLabelsFile();
        if (location == null || location.isBlank()) {
            return null;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.debug("Manual label file {} not found, skipping", location);
            return null;
        }
        return evaluateManualLabels(loadManualLabels(resource));
    }

    private EvaluationReport.SourceOutcome evaluateSource(HypothesisSource source, String summary,
                                                          List<Alert> alerts, String rootCause) {
        try {
            HypothesisResult result = source.propose(summary, alerts);
            double score = qualityScorer.score(result.getHypotheses(), rootCause);
            return new EvaluationReport.SourceOutcome(source.name(), result.topHypothesis(),
                    score, result.maxConfidence());
        } catch (RuntimeException e) {
            metrics.recordHypothesisSourceFailure();
            structuredLogger.logEvaluationEvent(EvaluationEventType.SOURCE_FAILED,
                    "Hypothesis source failed, marking as not attempted",
                    Map.of("source", source.name(), "summary", summary,
                            "error", String.valueOf(e.getMessage())));
            return new EvaluationReport.SourceOutcome(source.name(), null, null, null);
        }
    }

    private List<String> sourceNames() {
        return sources.stream().map(HypothesisSource::name).toList();
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
