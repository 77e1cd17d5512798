package com.loadforecast.exception;

public class InvalidTuningSetupException extends LoadForecastException {
    public InvalidTuningSetupException(String message) {
        super("INVALID_TUNING_SETUP", message);
    }
}
