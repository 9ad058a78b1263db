package com.soundforge.prometheus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * PROMETHEUS - Operational telemetry core for the SoundForge platform.
 *
 * <p>PROMETHEUS provides:
 * <ul>
 *   <li>Rolling analytics - 24h metric window, summaries, trends and threshold anomalies</li>
 *   <li>Forecasting - Per-model exponential smoothing with confidence intervals</li>
 *   <li>Automation - Rule evaluation and automated responses with outcome bookkeeping</li>
 *   <li>Provider fallback - Ordered, quota-aware execution across AI providers</li>
 *   <li>Notifications - Capped operator log with live broadcast</li>
 * </ul>
 *
 * <p>All state is held in memory and resets on restart.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class PrometheusApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrometheusApplication.class, args);
    }
}
