package io.teleops.rca;

import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Alert;
import io.teleops.domain.model.HypothesisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-based root-cause matcher.
 * <p>
 * Builds a lowercase corpus from the incident summary plus the type and message of the
 * first alerts, counts how many patterns of each rule occur in it, and reports the
 * hypothesis of the rule with the highest count. Ties go to the earlier rule; when no
 * pattern matches, the table's fallback rule is reported with a match count of zero.
 */
@Slf4j
@Component
public class BaselineHypothesisMatcher implements HypothesisSource {

    public static final String SOURCE_NAME = "baseline";

    private final RuleTableProvider ruleTableProvider;
    private final Clock clock;
    private final int alertSampleLimit;

    public BaselineHypothesisMatcher(RuleTableProvider ruleTableProvider, Clock clock,
                                     TeleopsProperties properties) {
        this.ruleTableProvider = ruleTableProvider;
        this.clock = clock;
        this.alertSampleLimit = properties.getRca().getAlertSampleLimit();
    }

    @Override
    public String name() {
        return SOURCE_NAME;
    }

    @Override
    public HypothesisResult propose(String incidentSummary, List<Alert> alerts) {
        return match(incidentSummary, alerts);
    }

    public HypothesisResult match(String incidentSummary, List<Alert> alerts) {
        RuleTable table = ruleTableProvider.current();
        String corpus = buildCorpus(incidentSummary, alerts);

        BaselineRule best = table.fallbackRule();
        List<String> bestMatches = List.of();
        for (BaselineRule rule : table.getRules()) {
            List<String> matches = rule.matchedPatterns(corpus);
            if (matches.size() > bestMatches.size()) {
                best = rule;
                bestMatches = matches;
            }
        }

        log.debug("Baseline rule {} selected with {} pattern matches (table {})",
                best.getId(), bestMatches.size(), table.getVersion());

        return HypothesisResult.builder()
                .incidentSummary(incidentSummary)
                .hypotheses(List.of(best.getHypothesis()))
                .confidenceScores(Map.of(best.getHypothesis(), best.getConfidence()))
                .evidence(HypothesisResult.Evidence.builder()
                        .alerts(best.getEvidence())
                        .matchCount(bestMatches.size())
                        .matchedPatterns(bestMatches)
                        .ruleId(best.getId())
                        .build())
                .generatedAt(clock.instant())
                .model(HypothesisResult.BASELINE_MODEL)
                .build();
    }

    String buildCorpus(String incidentSummary, List<Alert> alerts) {
        StringBuilder corpus = new StringBuilder(incidentSummary != null ? incidentSummary : "");
        if (alerts != null) {
            alerts.stream()
                    .limit(alertSampleLimit)
                    .forEach(alert -> corpus.append(' ')
                            .append(nullToEmpty(alert.getAlertType()))
                            .append(' ')
                            .append(nullToEmpty(alert.getMessage())));
        }
        return corpus.toString().toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
