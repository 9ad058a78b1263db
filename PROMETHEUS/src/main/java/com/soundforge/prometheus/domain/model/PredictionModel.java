package com.soundforge.prometheus.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Named forecasting configuration. Immutable once registered.
 */
@Value
@Builder
public class PredictionModel {

    /** Registry key, e.g. {@code performance} */
    String key;

    /** Display name */
    String name;

    @Singular
    List<String> features;

    /** How far ahead the forecast looks */
    Duration horizon;

    /** Target confidence level, 0.0 to 1.0 */
    double confidence;
}
