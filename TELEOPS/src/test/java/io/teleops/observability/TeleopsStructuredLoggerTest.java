package io.teleops.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TeleopsStructuredLoggerTest {

    private final TeleopsStructuredLogger logger = new TeleopsStructuredLogger(new ObjectMapper());

    @Test
    void formatsDataAsJson() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", "CREATED");
        data.put("alerts", 12);

        assertThat(logger.formatLogData(data)).isEqualTo("{\"event\":\"CREATED\",\"alerts\":12}");
    }

    @Test
    void scopeClearsMdcOnClose() {
        try (var scope = logger.withContext(Map.of(TeleopsStructuredLogger.MDC_INCIDENT_ID, "bgp_flap_1"))) {
            assertThat(MDC.get(TeleopsStructuredLogger.MDC_INCIDENT_ID)).isEqualTo("bgp_flap_1");
        }
        assertThat(MDC.get(TeleopsStructuredLogger.MDC_INCIDENT_ID)).isNull();
    }

    @Test
    void eventLoggingLeavesNoMdcBehind() {
        logger.logIncidentEvent("inc-1", "tenant-a", TeleopsStructuredLogger.IncidentEventType.CLOSED,
                "Incident closed", null);
        logger.logCorrelationEvent("run-1", TeleopsStructuredLogger.CorrelationEventType.COMPLETED,
                "Correlation completed", Map.of("incidents", 1));

        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }
}
