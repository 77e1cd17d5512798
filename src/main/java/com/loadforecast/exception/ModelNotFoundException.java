package com.loadforecast.exception;

public class ModelNotFoundException extends LoadForecastException {
    public ModelNotFoundException(String experimentName, String runId) {
        super("MODEL_NOT_FOUND", runId == null
            ? "No model found for experiment '" + experimentName + "'."
            : "No model found for experiment '" + experimentName + "' and run '" + runId + "'.");
    }
}
