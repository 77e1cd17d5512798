package com.loadforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ModelVersionResponse {
    String experimentName;
    String runId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant registeredAt;
    String algtype;
    List<String> featureNames;
    Map<String, Object> hyperparameters;
    Map<String, Double> featureImportance;
}
