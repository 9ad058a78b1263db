package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A metric value judged abnormal, either against a fixed threshold or against
 * the confidence band of a forecast.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyRecord {

    Source source;

    /** Anomaly type, e.g. {@code latency}, {@code error_rate}, {@code request_spike} */
    String type;

    /** Forecasting model key, deviation anomalies only */
    String model;

    /** Offending feature, deviation anomalies only */
    String feature;

    double value;

    /** Limit that was crossed, threshold anomalies only */
    Double threshold;

    /** Forecast value, deviation anomalies only */
    Double expected;

    /** Confidence band that was left, deviation anomalies only */
    ConfidenceInterval bounds;

    AnomalySeverity severity;

    Instant detectedAt;

    public enum Source {
        THRESHOLD, DEVIATION
    }
}
