package io.teleops.evaluation;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * Synthetic incident scenarios with their ground truth.
 */
@Getter
public enum ScenarioType {

    NETWORK_DEGRADATION("network_degradation",
            List.of("core-router-1", "edge-router-3", "agg-switch-2"),
            List.of("backbone", "edge", "aggregation"),
            List.of("packet_loss", "high_latency"),
            "link congestion on core-router-1 causing packet loss",
            List.of("Reroute traffic away from core-router-1",
                    "Apply QoS policy to throttle non-critical traffic",
                    "Inspect interface errors and clear if safe"),
            "net-snmp", "%s reports degraded network performance"),

    DNS_OUTAGE("dns_outage",
            List.of("dns-auth-1", "dns-auth-2", "dns-rec-1"),
            List.of("dns", "resolver"),
            List.of("dns_timeout", "servfail_spike", "nx_domain_spike"),
            "authoritative DNS cluster outage in region-east",
            List.of("Fail over DNS traffic to secondary region",
                    "Restart unhealthy DNS pods or services",
                    "Verify zone file integrity and replication"),
            "net-snmp", "%s reports DNS failures"),

    BGP_FLAP("bgp_flap",
            List.of("core-router-1", "core-router-2"),
            List.of("routing"),
            List.of("bgp_session_flap", "route_withdrawal"),
            "unstable BGP session with upstream AS65010",
            List.of("Stabilize the affected BGP session and damp flaps",
                    "Engage upstream to validate peering health",
                    "Apply route dampening policy for noisy prefixes"),
            "net-snmp", "%s reports BGP instability"),

    FIBER_CUT("fiber_cut",
            List.of("metro-ring-1", "dwdm-2", "edge-router-3"),
            List.of("transport", "backhaul"),
            List.of("link_down", "loss_of_signal"),
            "fiber cut on metro ring segment A",
            List.of("Reroute traffic over redundant path",
                    "Dispatch field team to inspect fiber segment",
                    "Validate optical power levels post-repair"),
            "optical-nms", "%s reports optical link failure"),

    ROUTER_FREEZE("router_freeze",
            List.of("core-router-1"),
            List.of("control-plane"),
            List.of("cpu_spike", "control_plane_hang"),
            "control plane freeze on core-router-1",
            List.of("Fail over routing to standby control plane",
                    "Collect core dump and reboot if required",
                    "Upgrade firmware to latest stable release"),
            "net-snmp", "%s reports control plane stall"),

    ISP_PEERING_CONGESTION("isp_peering_congestion",
            List.of("peering-edge-1", "peering-edge-2"),
            List.of("peering"),
            List.of("high_latency", "packet_loss"),
            "congestion on ISP peering link with AS64512",
            List.of("Shift traffic to alternate peer",
                    "Coordinate capacity upgrade with peer",
                    "Apply traffic engineering for hot prefixes"),
            "net-snmp", "%s reports peering congestion"),

    DDOS_EDGE("ddos_edge",
            List.of("edge-router-3", "scrubbing-1"),
            List.of("edge", "security"),
            List.of("traffic_spike", "syn_flood"),
            "volumetric DDoS targeting edge-router-3",
            List.of("Activate scrubbing center routing",
                    "Apply rate limiting at edge",
                    "Block offending IP ranges upstream"),
            "security-monitor", "%s reports DDoS indicators"),

    MPLS_VPN_LEAK("mpls_vpn_leak",
            List.of("pe-core-1", "pe-core-2"),
            List.of("mpls"),
            List.of("route_leak_detected", "vrf_mismatch"),
            "VRF misconfiguration causing MPLS/L3VPN route leak",
            List.of("Rollback recent VRF policy changes",
                    "Validate route targets and import/export rules",
                    "Flush leaked routes and monitor reconvergence"),
            "net-snmp", "%s reports VPN route leak"),

    CDN_CACHE_STAMPEDE("cdn_cache_stampede",
            List.of("cdn-edge-1", "cdn-edge-2"),
            List.of("cdn"),
            List.of("cache_miss_spike", "origin_latency"),
            "CDN cache stampede due to misconfigured TTLs",
            List.of("Restore cache TTL defaults",
                    "Warm cache for hot content",
                    "Throttle origin requests temporarily"),
            "cdn-monitor", "%s reports cache stampede"),

    FIREWALL_RULE_MISCONFIG("firewall_rule_misconfig",
            List.of("fw-edge-1", "fw-core-1"),
            List.of("security"),
            List.of("blocked_port", "policy_violation"),
            "firewall rule misconfiguration blocking critical port",
            List.of("Rollback recent firewall rule changes",
                    "Add explicit allow rule for critical service",
                    "Audit policy deployment pipeline"),
            "firewall", "%s reports blocked traffic"),

    DATABASE_LATENCY_SPIKE("database_latency_spike",
            List.of("db-primary-1", "db-replica-2"),
            List.of("msp-database"),
            List.of("query_latency", "lock_waits"),
            "database contention causing latency spike on MSP hosted apps",
            List.of("Identify top blocking queries",
                    "Scale read replicas or route traffic",
                    "Apply indexing or query optimization"),
            "db", "%s reports database latency");

    private final String id;
    private final List<String> hosts;
    private final List<String> services;
    private final List<String> alertTypes;
    private final String rootCause;
    private final List<String> remediationSteps;
    private final String sourceSystem;
    private final String messageTemplate;

    ScenarioType(String id, List<String> hosts, List<String> services, List<String> alertTypes,
                 String rootCause, List<String> remediationSteps, String sourceSystem,
                 String messageTemplate) {
        this.id = id;
        this.hosts = hosts;
        this.services = services;
        this.alertTypes = alertTypes;
        this.rootCause = rootCause;
        this.remediationSteps = remediationSteps;
        this.sourceSystem = sourceSystem;
        this.messageTemplate = messageTemplate;
    }

    /**
     * @throws IllegalArgumentException for an unknown scenario id
     */
    public static ScenarioType fromId(String id) {
        return Arrays.stream(values())
                .filter(type -> type.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported incident type: " + id));
    }

    public String message(String host) {
        return String.format(messageTemplate, host);
    }
}
