package io.teleops.correlation;

import io.teleops.domain.model.Alert;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Alerts sharing one correlation tag, ordered by timestamp.
 * <p>
 * Never empty. Start and end time are the first and last member timestamps.
 */
@Getter
@ToString(of = {"tag", "count", "startTime", "endTime"})
@EqualsAndHashCode(of = {"tag", "alerts"})
public final class AlertGroup {

    private static final Comparator<Alert> BY_TIMESTAMP = Comparator.comparing(Alert::getTimestamp);

    private final String tag;
    private final List<Alert> alerts;
    private final Instant startTime;
    private final Instant endTime;
    private final int count;

    private AlertGroup(String tag, List<Alert> sortedAlerts) {
        this.tag = tag;
        this.alerts = List.copyOf(sortedAlerts);
        this.startTime = sortedAlerts.get(0).getTimestamp();
        this.endTime = sortedAlerts.get(sortedAlerts.size() - 1).getTimestamp();
        this.count = sortedAlerts.size();
    }

    /**
     * Build a group, sorting a copy of the members ascending by timestamp.
     *
     * @throws IllegalArgumentException if {@code alerts} is empty
     */
    public static AlertGroup of(String tag, List<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            throw new IllegalArgumentException("Alert group '" + tag + "' must contain at least one alert");
        }
        List<Alert> sorted = new ArrayList<>(alerts);
        sorted.sort(BY_TIMESTAMP);
        return new AlertGroup(tag, sorted);
    }

    public Duration span() {
        return Duration.between(startTime, endTime);
    }

    public List<String> alertIds() {
        return alerts.stream().map(Alert::getId).toList();
    }

    /**
     * Tenant of the earliest alert, may be null.
     */
    public String tenantId() {
        return alerts.get(0).getTenantId();
    }
}
