package com.loadforecast.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Configuration of one forecasting target. Immutable for the duration of a pipeline run.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PredictionJob {

    @NotNull(message = "id is required")
    Long id;

    @NotBlank(message = "name is required")
    String name;

    String description;

    @NotBlank(message = "type is required")
    String type;

    @Min(value = 1, message = "resolutionMinutes must be >= 1")
    @Builder.Default
    int resolutionMinutes = 15;

    @NotEmpty(message = "quantiles must not be empty")
    List<@DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) Double> quantiles;

    /** {@code null} disables flatliner detection. */
    Integer flatlinerThresholdMinutes;

    boolean detectNonZeroFlatliner;

    @DecimalMin(value = "0.0", message = "completenessThreshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "completenessThreshold must be between 0 and 1")
    @Builder.Default
    double completenessThreshold = 0.5;

    @Min(value = 0, message = "minimalTableLength must be >= 0")
    @Builder.Default
    int minimalTableLength = 100;

    /** {@link FallbackStrategy} identifier; unknown identifiers are rejected when a fallback is needed. */
    String fallbackStrategy;

    Long alternativeForecastModelPid;

    /** Bean name of a custom data preparation. */
    String dataPrepClass;

    String modelRunId;

    /** Experiment under which this job's model is registered. */
    public String modelExperimentName() {
        return String.valueOf(alternativeForecastModelPid != null ? alternativeForecastModelPid : id);
    }
}
