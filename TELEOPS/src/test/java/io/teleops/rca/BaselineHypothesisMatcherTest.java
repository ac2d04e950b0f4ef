package io.teleops.rca;

import io.teleops.TestAlerts;
import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Alert;
import io.teleops.domain.model.HypothesisResult;
import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.testing.fixtures.TestDataFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class BaselineHypothesisMatcherTest {

    private final Clock clock = Clock.fixed(TestDataFactories.FIXED_INSTANT, ZoneOffset.UTC);

    private TeleopsProperties properties;
    private RuleTableProvider provider;
    private BaselineHypothesisMatcher matcher;

    @BeforeEach
    void setUp() {
        properties = new TeleopsProperties();
        provider = new RuleTableProvider(RuleTable.defaults(), mock(TeleopsStructuredLogger.class));
        matcher = new BaselineHypothesisMatcher(provider, clock, properties);
    }

    private static List<Alert> alerts(String alertType, String message, int count) {
        return TestAlerts.burst("inc", count, TestDataFactories.FIXED_INSTANT, 10, alertType, message);
    }

    @Test
    @DisplayName("DNS failures map to the DNS outage hypothesis")
    void dnsAlertsMatchDnsRule() {
        HypothesisResult result = matcher.match("dns_outage: 12 alerts",
                alerts("dns_timeout", "servfail rising on resolver", 12));

        assertThat(result.getHypotheses()).containsExactly("authoritative DNS cluster outage in region-east");
        assertThat(result.getConfidenceScores())
                .containsEntry("authoritative DNS cluster outage in region-east", 0.7);
        assertThat(result.getEvidence().getRuleId()).isEqualTo("dns_outage");
        assertThat(result.getEvidence().getMatchedPatterns()).containsExactly("dns", "servfail", "resolver");
        assertThat(result.getEvidence().getMatchCount()).isEqualTo(3);
        assertThat(result.getModel()).isEqualTo(HypothesisResult.BASELINE_MODEL);
        assertThat(result.getGeneratedAt()).isEqualTo(TestDataFactories.FIXED_INSTANT);
    }

    @Test
    void bgpAlertsMatchBgpRule() {
        HypothesisResult result = matcher.match("incident on peering edge",
                alerts("bgp_session_flap", "route_withdrawal toward AS65010", 5));

        assertThat(result.topHypothesis()).isEqualTo("unstable BGP session with upstream AS65010");
        assertThat(result.getEvidence().getMatchCount()).isGreaterThan(1);
    }

    @Test
    void ddosAlertsMatchEdgeRule() {
        HypothesisResult result = matcher.match("edge incident", alerts("syn_flood", "traffic_spike observed", 3));

        assertThat(result.getEvidence().getRuleId()).isEqualTo("ddos_edge");
        assertThat(result.maxConfidence()).isEqualTo(0.7);
    }

    @Test
    void summaryIsMatchedCaseInsensitively() {
        HypothesisResult result = matcher.match("DNS servers are reporting failures", List.of());

        assertThat(result.getEvidence().getRuleId()).isEqualTo("dns_outage");
    }

    @Test
    @DisplayName("Falls back to the last rule with zero matches")
    void fallsBackWhenNothingMatches() {
        HypothesisResult result = matcher.match("generic network issue", List.of());

        assertThat(result.topHypothesis()).isEqualTo("link congestion on core-router-1 causing packet loss");
        assertThat(result.getEvidence().getRuleId()).isEqualTo("network_degradation");
        assertThat(result.getEvidence().getMatchCount()).isZero();
        assertThat(result.getEvidence().getMatchedPatterns()).isEmpty();
    }

    @Test
    void nullSummaryAndAlertsFallBack() {
        HypothesisResult result = matcher.match(null, null);

        assertThat(result.getEvidence().getRuleId()).isEqualTo("network_degradation");
    }

    @Test
    @DisplayName("Earlier rule wins a tie")
    void tieGoesToEarlierRule() {
        HypothesisResult result = matcher.match("dns bgp", List.of());

        assertThat(result.getEvidence().getRuleId()).isEqualTo("dns_outage");
        assertThat(result.getEvidence().getMatchCount()).isEqualTo(1);
    }

    @Test
    void repeatedMatchesAreIdentical() {
        List<Alert> input = alerts("link_down", "loss_of_signal on optical span", 4);

        assertThat(matcher.match("fiber_cut: 4 alerts", input))
                .isEqualTo(matcher.match("fiber_cut: 4 alerts", input));
    }

    @Test
    @DisplayName("Only the first alerts up to the sample limit feed the corpus")
    void alertSampleLimitIsHonored() {
        properties.getRca().setAlertSampleLimit(1);
        matcher = new BaselineHypothesisMatcher(provider, clock, properties);
        List<Alert> input = List.of(
                TestAlerts.alert("a-1", "inc", TestDataFactories.FIXED_INSTANT, "packet_loss", "congestion on uplink"),
                TestAlerts.alert("a-2", "inc", TestDataFactories.FIXED_INSTANT, "bgp", "route_withdrawal session_flap"));

        assertThat(matcher.buildCorpus("incident", input)).doesNotContain("route_withdrawal");
        assertThat(matcher.match("incident", input).getEvidence().getRuleId()).isEqualTo("network_degradation");
    }

    @Test
    void replacedRuleTableIsUsedForNextMatch() {
        provider.replace(() -> new RuleTable("v2", List.of(BaselineRule.builder()
                .id("custom")
                .pattern("dns")
                .hypothesis("resolver pool exhausted")
                .confidence(0.9)
                .evidence("custom evidence")
                .build())));

        HypothesisResult result = matcher.match("dns alerts", List.of());

        assertThat(result.topHypothesis()).isEqualTo("resolver pool exhausted");
        assertThat(result.getEvidence().getAlerts()).isEqualTo("custom evidence");
    }

    @Test
    void actsAsBaselineHypothesisSource() {
        assertThat(matcher.name()).isEqualTo(BaselineHypothesisMatcher.SOURCE_NAME);
        assertThat(matcher.propose("dns", List.of()).getModel()).isEqualTo(HypothesisResult.BASELINE_MODEL);
    }
}
