package com.soundforge.prometheus.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One frame of the live metrics stream.
 */
@Value
@Builder
public class SystemMetricsSnapshot {

    Instant timestamp;
    SystemLoad system;
    AiLoad ai;

    @Value
    @Builder
    public static class SystemLoad {
        /** Percentage */
        double cpu;
        /** Percentage */
        double memory;
        int activeConnections;
    }

    @Value
    @Builder
    public static class AiLoad {
        int requestsPerSecond;
        /** Percentage */
        double successRate;
        /** Milliseconds */
        double averageLatency;
    }
}
