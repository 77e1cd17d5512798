package com.loadforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class MeasurementPoint {

    @NotNull(message = "timestamp is required")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    /** {@code null} for timestamps to forecast. */
    Double load;

    /** Exogenous inputs such as weather or prices, by feature name. */
    @Builder.Default
    Map<String, Double> features = Map.of();
}
