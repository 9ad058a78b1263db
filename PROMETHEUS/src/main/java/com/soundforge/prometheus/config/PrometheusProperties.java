package com.soundforge.prometheus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for PROMETHEUS service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Analytics window and anomaly thresholds</li>
 *     <li>Forecasting parameters</li>
 *     <li>Automation rule thresholds and simulated action latency</li>
 *     <li>AI provider order and daily limits</li>
 *     <li>Notification log capacity and the synthetic metrics stream</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "prometheus")
public class PrometheusProperties {

    private final Analytics analytics = new Analytics();
    private final Prediction prediction = new Prediction();
    private final Automation automation = new Automation();
    private final Providers providers = new Providers();
    private final Notifications notifications = new Notifications();
    private final Stream stream = new Stream();

    /**
     * Rolling analytics configuration.
     */
    @Data
    public static class Analytics {
        /** Retention of the metric window */
        private Duration window = Duration.ofHours(24);

        /** Points considered by trend classification */
        @Positive
        private int trendSampleSize = 10;

        /** Points required before a next-hour forecast is produced */
        @Positive
        private int forecastSampleSize = 24;

        /** Retention of the recent-anomaly log */
        private Duration anomalyRetention = Duration.ofHours(1);

        /** Feature name to limit; merged at runtime by updateThresholds */
        private Map<String, Double> thresholds = defaultThresholds();

        private static Map<String, Double> defaultThresholds() {
            Map<String, Double> defaults = new LinkedHashMap<>();
            defaults.put("latency", 200.0);
            defaults.put("errorRate", 0.1);
            defaults.put("requestSpike", 100.0);
            return defaults;
        }
    }

    /**
     * Forecasting configuration.
     */
    @Data
    public static class Prediction {
        private Duration window = Duration.ofHours(24);

        /** Minimum history, also the size of the sample each forecast uses */
        @Positive
        private int minDataPoints = 10;

        /** Exponential smoothing factor */
        private double smoothingFactor = 0.3;

        /** Z-score of the confidence interval */
        private double intervalZScore = 1.96;
    }

    /**
     * Automation rule configuration. Independent of the analytics thresholds.
     */
    @Data
    public static class Automation {
        private double cpuThreshold = 80.0;
        private double errorRateThreshold = 0.1;
        private double quotaUsageThreshold = 90.0;

        /** Latency of the simulated response action */
        private Duration actionDelay = Duration.ofSeconds(1);
    }

    /**
     * AI provider quota configuration.
     */
    @Data
    public static class Providers {
        @NotEmpty
        private List<String> defaultOrder = new ArrayList<>(List.of("HuggingFace", "OpenAI", "Replicate"));

        private Map<String, Integer> dailyLimits = defaultLimits();

        /** Limit applied to providers without an explicit entry */
        @Positive
        private int fallbackLimit = 100;

        /** Simulated duration of the optimize action */
        private Duration optimizeDelay = Duration.ofSeconds(2);

        private static Map<String, Integer> defaultLimits() {
            Map<String, Integer> limits = new LinkedHashMap<>();
            limits.put("HuggingFace", 10000);
            limits.put("OpenAI", 200);
            limits.put("Replicate", 1000);
            return limits;
        }
    }

    @Data
    public static class Notifications {
        @Positive
        private int capacity = 100;
    }

    @Data
    public static class Stream {
        private Duration interval = Duration.ofSeconds(5);

        /** Start the synthetic metrics stream with the application */
        private boolean autoStart = true;
    }
}
