package io.teleops.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the TeleOps service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Alert correlation admissibility rules</li>
 *     <li>Baseline RCA rule table and alert sampling</li>
 *     <li>Hypothesis quality evaluation thresholds</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "teleops")
public class TeleopsProperties {

    @Valid
    private final Correlation correlation = new Correlation();
    @Valid
    private final Rca rca = new Rca();
    @Valid
    private final Evaluation evaluation = new Evaluation();

    /**
     * Alert correlation configuration.
     */
    @Data
    public static class Correlation {
        /** Maximum time span of an incident's alerts */
        @NotNull
        private Duration window = Duration.ofMinutes(15);

        /** Minimum alerts sharing a tag before an incident is considered */
        @Positive
        private int minAlerts = 10;

        /** Percentile of group sizes at or below which a group is treated as noise */
        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double noisePercentile = 25.0;
    }

    /**
     * Baseline root cause analysis configuration.
     */
    @Data
    public static class Rca {
        /** Alerts scanned per incident when building the match corpus */
        @Positive
        private int alertSampleLimit = 20;

        /** Top confidence below which an RCA result is logged as low confidence */
        private double lowConfidenceThreshold = 0.6;

        /** Version label of a configured rule table */
        private String rulesVersion = "configured";

        /** Rule table override; the built-in table is used when empty */
        @Valid
        private List<RuleDefinition> rules = new ArrayList<>();
    }

    /**
     * One configured baseline rule.
     */
    @Data
    public static class RuleDefinition {
        @NotBlank
        private String id;
        private List<String> patterns = new ArrayList<>();
        private String hypothesis;
        /** Required, in [0, 1] */
        private Double confidence;
        private String evidence;
    }

    /**
     * Hypothesis quality evaluation configuration.
     */
    @Data
    public static class Evaluation {
        /** Similarity at or above which a hypothesis counts as correct */
        private double correctThreshold = 0.75;

        /** Similarity below which a hypothesis counts as wrong */
        private double wrongSimilarityThreshold = 0.5;

        /** Confidence at or above which a wrong hypothesis is "wrong but confident" */
        private double wrongConfidenceThreshold = 0.7;

        /** Synthetic scenarios per evaluation run */
        @Positive
        private int defaultRuns = 50;

        /** Scenarios per latency benchmark */
        @Positive
        private int benchmarkRuns = 20;

        /** JSONL file of manually labeled incidents */
        private String labelsFile = "classpath:evaluation/manual_labels.jsonl";
    }
}
