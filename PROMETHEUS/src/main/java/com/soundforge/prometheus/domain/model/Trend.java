package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction label of a metric series.
 */
public enum Trend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    /** Relative change beyond which a series is no longer stable */
    public static final double THRESHOLD = 0.1;

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Classify a relative change. NaN classifies as stable.
     */
    public static Trend fromRelativeChange(double relativeChange) {
        if (relativeChange > THRESHOLD) {
            return INCREASING;
        }
        if (relativeChange < -THRESHOLD) {
            return DECREASING;
        }
        return STABLE;
    }
}
