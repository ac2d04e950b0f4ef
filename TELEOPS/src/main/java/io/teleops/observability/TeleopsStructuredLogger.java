package io.teleops.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the TeleOps service.
 * <p>
 * Every event is written as {@code message | data={json}} with the event name
 * and its identifiers in the JSON payload, and the identifiers mirrored into MDC
 * for the duration of the log call.
 */
@Slf4j
@Component
public class TeleopsStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_TENANT_ID = "tenantId";

    private final ObjectMapper objectMapper;

    public TeleopsStructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Log a correlation run event.
     */
    public void logCorrelationEvent(String runId, CorrelationEventType eventType,
                                    String message, Map<String, Object> details) {
        try (var scope = withCorrelationId(runId)) {
            Map<String, Object> logData = eventData(eventType.name(), details);
            logData.put("runId", runId);

            switch (eventType) {
                case GROUP_DISCARDED -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an incident lifecycle event.
     */
    public void logIncidentEvent(String incidentId, String tenantId, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(MDC_INCIDENT_ID, incidentId);
        if (tenantId != null) {
            context.put(MDC_TENANT_ID, tenantId);
        }
        try (var scope = withContext(context)) {
            Map<String, Object> logData = eventData(eventType.name(), details);
            logData.put("incidentId", incidentId);
            log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log an RCA event.
     */
    public void logRcaEvent(String incidentId, RcaEventType eventType,
                            String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, incidentId != null ? incidentId : ""))) {
            Map<String, Object> logData = eventData(eventType.name(), details);
            if (incidentId != null) {
                logData.put("incidentId", incidentId);
            }

            switch (eventType) {
                case ANALYSIS_FAILED, LOW_CONFIDENCE, RULE_TABLE_REJECTED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an evaluation event.
     */
    public void logEvaluationEvent(EvaluationEventType eventType, String message,
                                   Map<String, Object> details) {
        Map<String, Object> logData = eventData(eventType.name(), details);
        if (eventType == EvaluationEventType.SOURCE_FAILED) {
            log.warn("{} | data={}", message, formatLogData(logData));
        } else {
            log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    /**
     * Set correlation ID in MDC.
     */
    public MDCScope withCorrelationId(String correlationId) {
        MDC.put(MDC_CORRELATION_ID, correlationId);
        return new MDCScope(MDC_CORRELATION_ID);
    }

    private Map<String, Object> eventData(String event, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", event);
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    String formatLogData(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to toString for log data: {}", e.getMessage());
            return String.valueOf(data);
        }
    }

    // ========== Event Type Enums ==========

    public enum CorrelationEventType {
        STARTED, GROUP_DISCARDED, COMPLETED
    }

    public enum IncidentEventType {
        CREATED, ROOT_CAUSE_ATTACHED, CLOSED
    }

    public enum RcaEventType {
        HYPOTHESIS_GENERATED, LOW_CONFIDENCE, ANALYSIS_FAILED, RULE_TABLE_REPLACED, RULE_TABLE_REJECTED
    }

    public enum EvaluationEventType {
        RUN_STARTED, SOURCE_FAILED, RUN_COMPLETED, LABELS_LOADED, BENCHMARK_COMPLETED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
