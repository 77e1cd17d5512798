package com.loadforecast.exception;

public class InsufficientLoadDataException extends LoadForecastException {
    public InsufficientLoadDataException(String message) {
        super("INSUFFICIENT_LOAD_DATA", message);
    }
}
