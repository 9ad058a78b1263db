package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * Band around a series mean. {@code lower} and {@code upper} are {@code null}
 * when the series is too short to estimate a spread.
 */
@Value
public class ConfidenceInterval {

    Double lower;
    Double upper;
    Double mean;

    public static ConfidenceInterval of(double lower, double upper, double mean) {
        return new ConfidenceInterval(lower, upper, mean);
    }

    public static ConfidenceInterval unbounded(Double mean) {
        return new ConfidenceInterval(null, null, mean);
    }

    @JsonIgnore
    public boolean isBounded() {
        return lower != null && upper != null;
    }

    public boolean contains(double value) {
        return !isBounded() || (value >= lower && value <= upper);
    }

    @JsonIgnore
    public double width() {
        return isBounded() ? upper - lower : 0.0;
    }
}
