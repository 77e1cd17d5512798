package com.loadforecast.exception;

public class DataPreparationException extends LoadForecastException {
    public DataPreparationException(String message) {
        super("DATA_PREPARATION_ERROR", message);
    }
}
