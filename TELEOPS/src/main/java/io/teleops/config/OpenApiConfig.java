package io.teleops.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for the TeleOps service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI teleopsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TeleOps Correlation & RCA API")
                        .description("""
                                Groups network alerts into incidents and proposes rule-based root causes.

                                ## Features

                                - **Correlation**: tag grouping, adaptive noise threshold, time window
                                - **Baseline RCA**: keyword rule matching with fixed confidences
                                - **Evaluation**: hypothesis quality scoring and latency benchmarks
                                """)
                        .version("0.1.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")))
                .tags(List.of(
                        new Tag().name("Alerts").description("Alert ingestion"),
                        new Tag().name("Incidents").description("Incident correlation and lifecycle"),
                        new Tag().name("RCA").description("Baseline root cause analysis"),
                        new Tag().name("Evaluation").description("Hypothesis quality and latency evaluation"),
                        new Tag().name("Scenarios").description("Synthetic alert scenarios"),
                        new Tag().name("Admin").description("Store maintenance")));
    }
}
