package io.teleops.config;

import io.teleops.observability.TeleopsStructuredLogger;
import io.teleops.rca.RuleTable;
import io.teleops.rca.RuleTableProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the correlation and RCA engine.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Active rule table holder. Configured rules replace the built-in table; an invalid
     * configured table fails startup.
     */
    @Bean
    public RuleTableProvider ruleTableProvider(TeleopsProperties properties,
                                               TeleopsStructuredLogger structuredLogger) {
        TeleopsProperties.Rca rca = properties.getRca();
        RuleTable table;
        if (rca.getRules().isEmpty()) {
            table = RuleTable.defaults();
        } else {
            table = RuleTable.fromDefinitions(rca.getRulesVersion(), rca.getRules());
        }
        log.info("Loaded baseline rule table {} with {} rules", table.getVersion(), table.size());
        return new RuleTableProvider(table, structuredLogger);
    }
}
