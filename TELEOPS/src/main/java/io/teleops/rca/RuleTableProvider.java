package io.teleops.rca;

import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.observability.TeleopsStructuredLogger.RcaEventType;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active rule table and swaps it atomically.
 * <p>
 * Readers take one snapshot per match via {@link #current()}; a replacement that fails
 * validation leaves the active table in place.
 */
public class RuleTableProvider {

    private final AtomicReference<RuleTable> current;
    private final TeleopsStructuredLogger structuredLogger;

    public RuleTableProvider(RuleTable initial, TeleopsStructuredLogger structuredLogger) {
        this.current = new AtomicReference<>(initial);
        this.structuredLogger = structuredLogger;
    }

    public RuleTable current() {
        return current.get();
    }

    /**
     * Install a new table built by the given factory.
     *
     * @return the table now active
     * @throws InvalidRuleTableException if the new table is rejected
     */
    public RuleTable replace(RuleTableFactory factory) {
        RuleTable previous = current.get();
        RuleTable next;
        try {
            next = factory.build();
        } catch (InvalidRuleTableException e) {
            Map<String, Object> details = new HashMap<>();
            details.put("activeVersion", previous.getVersion());
            details.put("error", e.getMessage());
            structuredLogger.logRcaEvent(null, RcaEventType.RULE_TABLE_REJECTED,
                    "Rule table rejected, keeping active table", details);
            throw e;
        }
        current.set(next);

        Map<String, Object> details = new HashMap<>();
        details.put("previousVersion", previous.getVersion());
        details.put("version", next.getVersion());
        details.put("rules", next.size());
        structuredLogger.logRcaEvent(null, RcaEventType.RULE_TABLE_REPLACED, "Rule table replaced", details);
        return next;
    }

    /**
     * Deferred rule table construction, so validation failures surface inside {@link #replace}.
     */
    @FunctionalInterface
    public interface RuleTableFactory {
        RuleTable build();
    }
}
