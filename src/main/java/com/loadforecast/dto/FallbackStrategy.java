package com.loadforecast.dto;

import com.loadforecast.exception.UnsupportedFallbackStrategyException;

import java.util.Arrays;

public enum FallbackStrategy {
    EXTREME_DAY("extreme_day"),
    RAISE_ERROR("raise_error");

    private final String id;

    FallbackStrategy(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolves a configured identifier, accepting the enum name or its lower case id.
     * A {@code null} or blank identifier means {@link #EXTREME_DAY}.
     */
    public static FallbackStrategy fromId(String value) {
        if (value == null || value.isBlank()) {
            return EXTREME_DAY;
        }
        return Arrays.stream(values())
            .filter(s -> s.name().equalsIgnoreCase(value.trim()) || s.id.equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new UnsupportedFallbackStrategyException(value));
    }
}
