package com.soundforge.prometheus.api.dto;

import com.soundforge.prometheus.domain.model.Prediction;
import com.soundforge.prometheus.domain.model.PredictionModel;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for model forecasts.
 */
@Data
@Builder
public class PredictionsResponse {
    /** Latest forecast per model key; models without enough history are absent */
    private Map<String, Prediction> predictions;
    private List<PredictionModel> models;
}
