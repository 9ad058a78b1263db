package com.soundforge.prometheus.pipeline;

import com.soundforge.prometheus.analytics.AnalyticsEngine.NextHourForecast;
import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.Trend;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view served by {@code GET /stats}.
 */
@Value
@Builder
public class SystemStats {

    Current current;
    Map<String, Trend> trends;
    NextHourForecast predictions;
    List<AnomalyRecord> anomalies;

    @Value
    @Builder
    public static class Current {
        long dailyUsage;
        double successRate;
        double averageLatency;
    }
}
