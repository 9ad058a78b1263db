package com.soundforge.prometheus.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for PROMETHEUS service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI prometheusOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PROMETHEUS Telemetry Service API")
                        .description("""
                                PROMETHEUS watches the runtime of the SoundForge platform.

                                ## Features

                                - **Analytics**: Rolling 24h summary, trends and next-hour forecast
                                - **Predictions**: Per-model forecasts with confidence bands
                                - **Automation**: Rule-driven automated responses
                                - **Providers**: AI provider health, quotas and fallback
                                - **Notifications**: Operator notification log

                                Live updates are served over the `/ws/prometheus` WebSocket.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag().name("Telemetry").description("Metrics, statistics and predictions"),
                        new Tag().name("Providers").description("AI provider health and quotas"),
                        new Tag().name("Automation").description("Automation rules and responses"),
                        new Tag().name("Notifications").description("Operator notification log")
                ));
    }
}
