package io.teleops.correlation;

import io.teleops.config.TeleopsProperties;
import io.teleops.domain.model.Incident;
import io.teleops.stats.PercentileEstimator;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides which alert groups become incidents.
 * <p>
 * A group is admitted when it
 * <ol>
 *     <li>holds at least {@code minCount} alerts,</li>
 *     <li>is strictly larger than the noise threshold (the configured percentile of
 *     the sizes of the groups that passed step 1; skipped when fewer than two groups
 *     remain or all sizes are equal),</li>
 *     <li>spans no more than the correlation window.</li>
 * </ol>
 */
@Component
public class IncidentSelector {

    private final IncidentIdGenerator idGenerator;
    private final Clock clock;
    private final double noisePercentile;

    @Autowired
    public IncidentSelector(IncidentIdGenerator idGenerator, Clock clock, TeleopsProperties properties) {
        this(idGenerator, clock, properties.getCorrelation().getNoisePercentile());
    }

    IncidentSelector(IncidentIdGenerator idGenerator, Clock clock, double noisePercentile) {
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.noisePercentile = noisePercentile;
    }

    /**
     * Admit groups and build one incident per admitted group.
     */
    public List<Incident> select(Collection<AlertGroup> groups, Duration window, int minCount) {
        return evaluate(groups, window, minCount).getIncidents();
    }

    /**
     * Same as {@link #select} but also reports every rejected group and the noise threshold used.
     */
    public Selection evaluate(Collection<AlertGroup> groups, Duration window, int minCount) {
        List<Discard> discarded = new ArrayList<>();
        if (groups == null || groups.isEmpty()) {
            return new Selection(List.of(), discarded, null);
        }

        List<AlertGroup> candidates = new ArrayList<>();
        for (AlertGroup group : groups) {
            if (group.getCount() < minCount) {
                discarded.add(new Discard(group.getTag(), group.getCount(), Discard.BELOW_MIN_COUNT));
            } else {
                candidates.add(group);
            }
        }

        Double noiseThreshold = null;
        if (candidates.size() >= 2 && hasDistinctCounts(candidates)) {
            double threshold = PercentileEstimator.percentile(
                    candidates.stream().map(AlertGroup::getCount).toList(), noisePercentile);
            noiseThreshold = threshold;

            List<AlertGroup> aboveNoise = new ArrayList<>();
            for (AlertGroup group : candidates) {
                if (group.getCount() <= threshold) {
                    discarded.add(new Discard(group.getTag(), group.getCount(), Discard.NOISE));
                } else {
                    aboveNoise.add(group);
                }
            }
            candidates = aboveNoise;
        }

        List<Incident> incidents = new ArrayList<>();
        for (AlertGroup group : candidates) {
            if (group.span().compareTo(window) > 0) {
                discarded.add(new Discard(group.getTag(), group.getCount(), Discard.WINDOW));
            } else {
                incidents.add(toIncident(group));
            }
        }

        return new Selection(List.copyOf(incidents), List.copyOf(discarded), noiseThreshold);
    }

    private boolean hasDistinctCounts(List<AlertGroup> groups) {
        int first = groups.get(0).getCount();
        return groups.stream().anyMatch(group -> group.getCount() != first);
    }

    private Incident toIncident(AlertGroup group) {
        return Incident.builder()
                .id(idGenerator.nextId(group.getTag()))
                .startTime(group.getStartTime())
                .endTime(group.getEndTime())
                .severity(Incident.SEVERITY_CRITICAL)
                .status(Incident.IncidentStatus.OPEN)
                .relatedAlertIds(new ArrayList<>(group.alertIds()))
                .summary(Incident.summaryFor(group.getTag()))
                .impactScope(Incident.IMPACT_SCOPE_NETWORK)
                .createdBy(Incident.CREATED_BY_CORRELATOR)
                .tenantId(group.tenantId())
                .correlationTag(group.getTag())
                .createdAt(clock.instant())
                .build();
    }

    /**
     * Outcome of one selection pass.
     */
    @Value
    public static class Selection {
        List<Incident> incidents;
        List<Discard> discarded;
        /** Noise threshold applied, null when the noise filter was skipped */
        Double noiseThreshold;
    }

    /**
     * A group rejected by the selector and why.
     */
    @Value
    public static class Discard {
        public static final String BELOW_MIN_COUNT = "below_min_count";
        public static final String NOISE = "noise";
        public static final String WINDOW = "window";

        String tag;
        int count;
        String reason;
    }
}
