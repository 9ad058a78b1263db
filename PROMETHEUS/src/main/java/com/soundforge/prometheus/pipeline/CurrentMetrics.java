package com.soundforge.prometheus.pipeline;

import com.soundforge.prometheus.domain.model.Trend;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view served by {@code GET /metrics}.
 */
@Value
@Builder
public class CurrentMetrics {

    Instant timestamp;

    /** Requests charged to all providers since the last quota reset */
    long requestsPerMinute;

    double successRate;

    double latency;

    Map<String, Trend> trends;
}
