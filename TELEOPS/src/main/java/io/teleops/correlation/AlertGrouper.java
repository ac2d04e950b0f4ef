package io.teleops.correlation;

import io.teleops.domain.model.Alert;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions alerts by correlation tag.
 * <p>
 * Every input alert lands in exactly one group; alerts without a tag share the
 * {@value Alert#UNKNOWN_TAG} group.
 */
@Component
public class AlertGrouper {

    /**
     * Group alerts by tag, preserving first-seen tag order.
     *
     * @return tag to group, empty for null or empty input
     */
    public Map<String, AlertGroup> group(Collection<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return Map.of();
        }

        Map<String, List<Alert>> buckets = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            buckets.computeIfAbsent(alert.correlationTag(), tag -> new ArrayList<>()).add(alert);
        }

        Map<String, AlertGroup> groups = new LinkedHashMap<>();
        buckets.forEach((tag, members) -> groups.put(tag, AlertGroup.of(tag, members)));
        return groups;
    }
}
