package io.teleops.rca;

import io.teleops.config.TeleopsProperties;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, validated set of baseline rules.
 * <p>
 * Earlier rules win ties. The last rule is the fallback used when nothing matches,
 * so it should describe the most generic failure.
 */
@Getter
public final class RuleTable {

    public static final String DEFAULT_VERSION = "builtin-1";

    private final String version;
    private final List<BaselineRule> rules;

    /**
     * @throws InvalidRuleTableException if the version is blank, the rules are empty or any rule is malformed
     */
    public RuleTable(String version, List<BaselineRule> rules) {
        if (version == null || version.isBlank()) {
            throw new InvalidRuleTableException("Rule table version must not be blank");
        }
        validate(rules);
        this.version = version;
        this.rules = List.copyOf(rules);
    }

    public BaselineRule fallbackRule() {
        return rules.get(rules.size() - 1);
    }

    public int size() {
        return rules.size();
    }

    /**
     * Build a table from configured rule definitions.
     */
    public static RuleTable fromDefinitions(String version, List<TeleopsProperties.RuleDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new InvalidRuleTableException("Rule table must contain at least one rule");
        }
        List<BaselineRule> rules = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            TeleopsProperties.RuleDefinition definition = definitions.get(i);
            if (definition == null) {
                throw new InvalidRuleTableException("Rule at position " + i + " is null");
            }
            if (definition.getConfidence() == null) {
                throw new InvalidRuleTableException("Rule " + definition.getId() + " has no confidence");
            }
            rules.add(BaselineRule.builder()
                    .id(definition.getId())
                    .patterns(definition.getPatterns() != null ? definition.getPatterns() : List.of())
                    .hypothesis(definition.getHypothesis())
                    .confidence(definition.getConfidence())
                    .evidence(definition.getEvidence())
                    .build());
        }
        return new RuleTable(version, rules);
    }

    private static void validate(List<BaselineRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new InvalidRuleTableException("Rule table must contain at least one rule");
        }
        Set<String> ids = new HashSet<>();
        for (BaselineRule rule : rules) {
            if (rule == null) {
                throw new InvalidRuleTableException("Rule table must not contain null rules");
            }
            if (rule.getId() == null || rule.getId().isBlank()) {
                throw new InvalidRuleTableException("Rule id must not be blank");
            }
            if (!ids.add(rule.getId())) {
                throw new InvalidRuleTableException("Duplicate rule id: " + rule.getId());
            }
            if (rule.getPatterns().isEmpty()) {
                throw new InvalidRuleTableException("Rule " + rule.getId() + " has no patterns");
            }
            for (String pattern : rule.getPatterns()) {
                if (pattern == null || pattern.isBlank()) {
                    throw new InvalidRuleTableException("Rule " + rule.getId() + " has a blank pattern");
                }
            }
            if (rule.getHypothesis() == null || rule.getHypothesis().isBlank()) {
                throw new InvalidRuleTableException("Rule " + rule.getId() + " has a blank hypothesis");
            }
            if (rule.getEvidence() == null || rule.getEvidence().isBlank()) {
                throw new InvalidRuleTableException("Rule " + rule.getId() + " has a blank evidence text");
            }
            if (!(rule.getConfidence() >= 0.0 && rule.getConfidence() <= 1.0)) {
                throw new InvalidRuleTableException(
                        "Rule " + rule.getId() + " confidence must be in [0, 1], got " + rule.getConfidence());
            }
        }
    }

    /**
     * Built-in telecom rule table. Network degradation is last and acts as the fallback.
     */
    public static RuleTable defaults() {
        return new RuleTable(DEFAULT_VERSION, List.of(
                rule("dns_outage",
                        List.of("dns", "servfail", "nx_domain", "resolver"),
                        "authoritative DNS cluster outage in region-east", 0.7,
                        "servfail/nx_domain spike across authoritative DNS resolvers"),
                rule("bgp_flap",
                        List.of("bgp", "route_withdrawal", "route withdrawal", "session_flap", "as65010"),
                        "unstable BGP session with upstream AS65010", 0.65,
                        "BGP session flaps and route withdrawals toward AS65010"),
                rule("fiber_cut",
                        List.of("fiber", "link_down", "loss_of_signal", "loss of signal", "optical"),
                        "fiber cut on metro ring segment A", 0.7,
                        "link_down/loss_of_signal on metro ring optical path"),
                rule("router_freeze",
                        List.of("control_plane", "control plane", "cpu_spike", "router_freeze", "stall"),
                        "control plane freeze on core-router-1", 0.6,
                        "control plane stall with cpu_spike on core-router-1"),
                rule("isp_peering_congestion",
                        List.of("peering", "peer", "isp", "peering congestion", "as64512"),
                        "congestion on ISP peering link with AS64512", 0.6,
                        "latency and loss concentrated on peering edge toward AS64512"),
                rule("ddos_edge",
                        List.of("ddos", "syn_flood", "traffic_spike", "traffic spike", "scrubbing"),
                        "volumetric DDoS targeting edge-router-3", 0.7,
                        "syn_flood/traffic_spike on edge-router-3"),
                rule("mpls_vpn_leak",
                        List.of("mpls", "vrf", "route_leak", "vpn", "l3vpn"),
                        "VRF misconfiguration causing MPLS/L3VPN route leak", 0.65,
                        "route leak and VRF mismatch on PE routers"),
                rule("cdn_cache_stampede",
                        List.of("cdn", "cache", "stampede", "origin_latency"),
                        "CDN cache stampede due to misconfigured TTLs", 0.6,
                        "cache miss spike with rising origin latency"),
                rule("firewall_rule_misconfig",
                        List.of("firewall", "blocked_port", "policy_violation", "blocked traffic"),
                        "firewall rule misconfiguration blocking critical port", 0.65,
                        "blocked_port/policy_violation on edge firewalls"),
                rule("database_latency_spike",
                        List.of("database", "query_latency", "lock_waits", "db-"),
                        "database contention causing latency spike on MSP hosted apps", 0.6,
                        "query_latency/lock_waits on MSP database hosts"),
                rule("network_degradation",
                        List.of("packet_loss", "high_latency", "congestion", "degraded network"),
                        "link congestion on core-router-1 causing packet loss", 0.55,
                        "packet_loss/high_latency burst on core-router-1")
        ));
    }

    private static BaselineRule rule(String id, List<String> patterns, String hypothesis,
                                     double confidence, String evidence) {
        return BaselineRule.builder()
                .id(id)
                .patterns(patterns)
                .hypothesis(hypothesis)
                .confidence(confidence)
                .evidence(evidence)
                .build();
    }
}
