package io.teleops.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Alert;
import io.teleops.domain.model.HypothesisResult;
import io.teleops.observability.TeleopsMetrics;
import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.rca.BaselineHypothesisMatcher;
import io.teleops.rca.HypothesisSource;
import io.teleops.rca.RuleTable;
import io.teleops.rca.RuleTableProvider;
import io.teleops.testing.fixtures.TestDataFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EvaluationServiceTest {

    private final Clock clock = Clock.fixed(TestDataFactories.FIXED_INSTANT, ZoneOffset.UTC);
    private final ObjectMapper objectMapper = new ObjectMapper();

    private TeleopsProperties properties;
    private TeleopsMetrics metrics;
    private BaselineHypothesisMatcher matcher;
    private QualityScorer scorer;
    private TeleopsStructuredLogger structuredLogger;

    @BeforeEach
    void setUp() {
        properties = new TeleopsProperties();
        properties.getEvaluation().setLabelsFile("classpath:evaluation/test_labels.jsonl");
        metrics = new TeleopsMetrics(new SimpleMeterRegistry());
        structuredLogger = new TeleopsStructuredLogger(objectMapper);
        matcher = new BaselineHypothesisMatcher(
                new RuleTableProvider(RuleTable.defaults(), structuredLogger), clock, properties);
        scorer = new QualityScorer(new LexicalSimilarity(), properties);
    }

    private EvaluationService service(List<HypothesisSource> sources) {
        return new EvaluationService(new ScenarioGenerator(clock), sources, matcher, scorer, properties,
                new DefaultResourceLoader(), objectMapper, metrics, structuredLogger);
    }

    @Test
    @DisplayName("Baseline recovers the root cause of every synthetic scenario type")
    void baselineScoresPerfectlyOnSyntheticScenarios() {
        EvaluationReport report = service(List.of(matcher)).run(ScenarioType.values().length);

        assertThat(report.getRuns()).isEqualTo(11);
        assertThat(report.getScoringMethod()).isEqualTo(LexicalSimilarity.METHOD);
        assertThat(report.getBaselineAvg()).isCloseTo(1.0, within(1e-9));
        assertThat(report.getBaselineMedian()).isCloseTo(1.0, within(1e-9));
        assertThat(report.getPerScenario())
                .extracting(EvaluationReport.ScenarioResult::getScenarioType)
                .containsExactly(Arrays.stream(ScenarioType.values())
                        .map(ScenarioType::getId).toArray(String[]::new));

        QualityMetrics baseline = report.getQualityMetrics().get(BaselineHypothesisMatcher.SOURCE_NAME);
        assertThat(baseline.getPrecision()).isEqualTo(1.0);
        assertThat(baseline.getRecall()).isEqualTo(1.0);
        assertThat(baseline.getWrongButConfidentCount()).isZero();
        assertThat(metrics.getEvaluationRuns().count()).isEqualTo(1.0);
    }

    @Test
    void scenarioTypesRotateBySeed() {
        EvaluationReport report = service(List.of(matcher)).run(13);

        EvaluationReport.ScenarioResult twelfth = report.getPerScenario().get(11);
        assertThat(twelfth.getSeed()).isEqualTo(11);
        assertThat(twelfth.getScenarioType()).isEqualTo(ScenarioType.values()[0].getId());
    }

    @Test
    @DisplayName("A failing source is recorded as not attempted and the run continues")
    void failingSourceIsNotAttempted() {
        HypothesisSource failing = new HypothesisSource() {
            @Override
            public String name() {
                return "llm";
            }

            @Override
            public HypothesisResult propose(String incidentSummary, List<Alert> alerts) {
                throw new IllegalStateException("model endpoint unavailable");
            }
        };

        EvaluationReport report = service(List.of(matcher, failing)).run(3);

        assertThat(report.getSourceAverages()).containsEntry("llm", null);
        assertThat(report.getQualityMetrics()).containsEntry("llm", null);
        assertThat(report.getQualityMetrics().get(BaselineHypothesisMatcher.SOURCE_NAME).getTotalAttempted())
                .isEqualTo(3);
        assertThat(report.getPerScenario().get(0).getOutcomes())
                .filteredOn(outcome -> "llm".equals(outcome.getSource()))
                .singleElement()
                .satisfies(outcome -> {
                    assertThat(outcome.getScore()).isNull();
                    assertThat(outcome.getHypothesis()).isNull();
                });
        assertThat(metrics.getHypothesisSourceFailures().count()).isEqualTo(3.0);
    }

    @Test
    void manualLabelsAreScoredWhenFilePresent() {
        EvaluationReport report = service(List.of(matcher)).run(1);

        ManualLabelReport labels = report.getManualLabels();
        assertThat(labels.getCases()).isEqualTo(2);
        assertThat(labels.getAverage()).isCloseTo(0.5, within(1e-9));
        assertThat(labels.getMedian()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void missingLabelFileIsSkipped() {
        properties.getEvaluation().setLabelsFile("classpath:evaluation/does_not_exist.jsonl");

        assertThat(service(List.of(matcher)).run(1).getManualLabels()).isNull();
    }

    @Test
    void loadsLabelsSkippingBlankLines() {
        List<ManualLabel> labels = service(List.of(matcher))
                .loadManualLabels(new ClassPathResource("evaluation/test_labels.jsonl"));

        assertThat(labels).extracting(ManualLabel::getIncidentSummary)
                .containsExactly("DNS servers are reporting failures", "generic network issue");
    }

    @Test
    void unreadableLabelFileFails() {
        EvaluationService service = service(List.of(matcher));

        assertThatThrownBy(() -> service.loadManualLabels(new ClassPathResource("evaluation/does_not_exist.jsonl")))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void emptyLabelSetScoresZero() {
        ManualLabelReport report = service(List.of(matcher)).evaluateManualLabels(List.of());

        assertThat(report.getCases()).isZero();
        assertThat(report.getAverage()).isZero();
        assertThat(report.getMedian()).isZero();
    }

    @Test
    void nonPositiveRunsAreRejected() {
        assertThatThrownBy(() -> service(List.of(matcher)).run(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
