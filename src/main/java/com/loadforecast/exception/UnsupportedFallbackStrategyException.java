package com.loadforecast.exception;

public class UnsupportedFallbackStrategyException extends LoadForecastException {
    public UnsupportedFallbackStrategyException(String strategy) {
        super("UNSUPPORTED_FALLBACK_STRATEGY", "Fallback strategy '" + strategy + "' is not supported.");
    }
}
