package com.soundforge.prometheus.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Latest forecast of one model. Superseded on every new data point.
 */
@Value
@Builder
public class Prediction {

    Instant timestamp;

    /** Model registry key */
    String model;

    String modelName;

    Duration horizon;

    /** Feature to smoothed forecast */
    Map<String, Double> predictions;

    Map<String, Trend> trends;

    Map<String, ConfidenceInterval> intervals;

    double confidence;
}
