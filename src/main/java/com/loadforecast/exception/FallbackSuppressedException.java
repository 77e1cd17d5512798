package com.loadforecast.exception;

public class FallbackSuppressedException extends LoadForecastException {
    public FallbackSuppressedException() {
        super("FALLBACK_SUPPRESSED",
              "Input data is insufficient and the fallback forecast is suppressed by configuration (RAISE_ERROR).");
    }
}
