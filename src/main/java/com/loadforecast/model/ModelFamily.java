package com.loadforecast.model;

/**
 * Closed set of regression model families that can be tuned and served.
 */
public enum ModelFamily {
    XGB("xgb"),
    XGB_QUANTILE("xgb_quantile"),
    XGB_MULTIOUTPUT_QUANTILE("xgb_multioutput_quantile"),
    LGB("lgb"),
    LINEAR("linear"),
    ARIMA("arima");

    private final String path;

    ModelFamily(String path) {
        this.path = path;
    }

    /** Algorithm identifier attached to forecasts produced by a model of this family. */
    public String getPath() {
        return path;
    }
}
