package io.teleops.evaluation;

import io.teleops.domain.model.Alert;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Generates synthetic telecom alert streams with known root causes.
 * <p>
 * Each minute of the scenario emits {@code alertRatePerMin} incident alerts tagged with the
 * incident type followed by {@code noiseRatePerMin} unrelated alerts tagged {@value #NOISE_TAG}.
 * The same seed and clock always yield the same scenario.
 */
@Component
public class ScenarioGenerator {

    public static final String NOISE_TAG = "noise";
    public static final String TENANT = "tenant-a";

    private static final List<String> NOISE_SOURCES = List.of("k8s-node", "db", "web-app");
    private static final List<String> NOISE_SERVICES = List.of("billing", "auth", "api-gateway");
    private static final List<String> NOISE_SEVERITIES = List.of("warning", "info");
    private static final List<String> NOISE_TYPES = List.of("cpu_spike", "disk_io", "http_5xx");

    private final Clock clock;

    public ScenarioGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if the incident type is unknown
     */
    public Scenario generate(ScenarioConfig config) {
        ScenarioType type = ScenarioType.fromId(config.getIncidentType());
        Random rng = config.getSeed() != null ? new Random(config.getSeed()) : new Random();
        Instant start = clock.instant();

        List<Alert> alerts = new ArrayList<>(
                config.getDurationMin() * (config.getAlertRatePerMin() + config.getNoiseRatePerMin()));
        for (int minute = 0; minute < config.getDurationMin(); minute++) {
            Instant timestamp = start.plus(Duration.ofMinutes(minute));
            for (int i = 0; i < config.getAlertRatePerMin(); i++) {
                alerts.add(incidentAlert(type, rng, timestamp));
            }
            for (int i = 0; i < config.getNoiseRatePerMin(); i++) {
                alerts.add(noiseAlert(rng, timestamp));
            }
        }

        return new Scenario(List.copyOf(alerts),
                new GroundTruth(type.getId(), type.getRootCause(), type.getRemediationSteps()));
    }

    private Alert incidentAlert(ScenarioType type, Random rng, Instant timestamp) {
        String host = pick(rng, type.getHosts());
        return Alert.builder()
                .id(nextId(rng))
                .timestamp(timestamp)
                .sourceSystem(type.getSourceSystem())
                .host(host)
                .service(pick(rng, type.getServices()))
                .severity("critical")
                .alertType(pick(rng, type.getAlertTypes()))
                .message(type.message(host))
                .tags(Map.of(Alert.INCIDENT_TAG_KEY, type.getId()))
                .rawPayload(Map.of("value", 1 + rng.nextInt(100)))
                .tenantId(TENANT)
                .build();
    }

    private Alert noiseAlert(Random rng, Instant timestamp) {
        return Alert.builder()
                .id(nextId(rng))
                .timestamp(timestamp)
                .sourceSystem(pick(rng, NOISE_SOURCES))
                .host("host-" + (10 + rng.nextInt(90)))
                .service(pick(rng, NOISE_SERVICES))
                .severity(pick(rng, NOISE_SEVERITIES))
                .alertType(pick(rng, NOISE_TYPES))
                .message("Unrelated transient alert")
                .tags(Map.of(Alert.INCIDENT_TAG_KEY, NOISE_TAG))
                .rawPayload(Map.of("value", 1 + rng.nextInt(100)))
                .tenantId(TENANT)
                .build();
    }

    private static String nextId(Random rng) {
        return new UUID(rng.nextLong(), rng.nextLong()).toString();
    }

    private static <T> T pick(Random rng, List<T> options) {
        return options.get(rng.nextInt(options.size()));
    }
}
