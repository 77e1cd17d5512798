package com.loadforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A prediction job plus its input: historic load measurements and the timestamps to
 * forecast, which carry no load value.
 */
@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotNull(message = "job is required")
    @Valid
    PredictionJob job;

    @NotEmpty(message = "measurements must not be empty")
    List<@Valid @NotNull MeasurementPoint> measurements;
}
