package com.loadforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ForecastResponse {
    Long   pid;
    String algtype;
    String forecastType;
    Map<String, String> metadata;
    List<Point> points;
    String requestId;

    @Value
    @Builder
    public static class Point {
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant timestamp;
        Double forecast;
        Double stdev;
        Map<String, Double> quantiles;
    }
}
