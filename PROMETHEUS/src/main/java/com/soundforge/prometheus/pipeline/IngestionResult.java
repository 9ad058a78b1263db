package com.soundforge.prometheus.pipeline;

import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.MetricPoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of pushing one metric point through the pipeline.
 */
@Value
@Builder
public class IngestionResult {

    /** The point as stored, timestamp assigned */
    MetricPoint point;

    List<AnomalyRecord> thresholdAnomalies;

    List<AnomalyRecord> deviationAnomalies;

    /** Ids of the automation rules that fired */
    List<String> triggeredRules;
}
