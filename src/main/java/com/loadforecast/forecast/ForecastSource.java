package com.loadforecast.forecast;

public enum ForecastSource {
    MODEL("model"),
    FALLBACK("fallback");

    private final String id;

    ForecastSource(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
