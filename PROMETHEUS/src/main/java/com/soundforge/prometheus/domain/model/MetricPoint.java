package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One timestamped sample of runtime measurements.
 * <p>
 * Known features are typed fields; any other named feature goes into
 * {@link #getExtensions()}. Instances are never mutated after creation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MetricPoint {

    public static final String LATENCY = "latency";
    public static final String ERROR_RATE = "errorRate";
    public static final String REQUESTS_PER_MINUTE = "requestsPerMinute";
    public static final String REQUEST_RATE = "requestRate";
    public static final String SUCCESS_RATE = "successRate";
    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String QUOTA_USAGE = "quotaUsage";
    public static final String DISK_IO = "diskIO";
    public static final String NETWORK_IO = "networkIO";

    Instant timestamp;

    /** Response latency in milliseconds */
    Double latency;

    /** Error ratio, 0.0 to 1.0 */
    Double errorRate;

    Double requestsPerMinute;
    Double requestRate;
    Double successRate;

    /** CPU usage percentage */
    Double cpu;

    /** Memory usage percentage */
    Double memory;

    /** Provider quota usage percentage */
    Double quotaUsage;

    Double diskIO;
    Double networkIO;

    @Singular
    Map<String, Double> extensions;

    /**
     * Resolve a feature by name.
     *
     * @param feature feature name, e.g. {@code latency} or an extension key
     * @return the value, or {@code null} when the point does not carry it
     */
    public Double value(String feature) {
        return switch (feature) {
            case LATENCY -> latency;
            case ERROR_RATE -> errorRate;
            case REQUESTS_PER_MINUTE -> requestsPerMinute;
            case REQUEST_RATE -> requestRate;
            case SUCCESS_RATE -> successRate;
            case CPU -> cpu;
            case MEMORY -> memory;
            case QUOTA_USAGE -> quotaUsage;
            case DISK_IO -> diskIO;
            case NETWORK_IO -> networkIO;
            default -> extensions.get(feature);
        };
    }

    /**
     * Feature value with absent features read as zero.
     */
    public double valueOrZero(String feature) {
        Double value = value(feature);
        return value != null ? value : 0.0;
    }

    @JsonIgnore
    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public MetricPoint withTimestamp(Instant timestamp) {
        return toBuilder().timestamp(timestamp).build();
    }
}
