package com.loadforecast.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Registry-owned description of a trained model: the features it needs and the
 * hyperparameters it was trained with. Loaded read-only.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelSpecification {
    String id;
    @Builder.Default
    List<String> featureNames = List.of();
    @Builder.Default
    List<String> featureModules = List.of();
    @Builder.Default
    Map<String, Object> hyperparameters = Map.of();
}
