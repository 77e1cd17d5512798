package com.loadforecast.forecast;

import com.loadforecast.model.TrainedModel;
import com.loadforecast.table.TimeSeriesTable;

import java.util.List;

/**
 * Adds uncertainty columns to a point forecast.
 */
public interface ConfidenceIntervalApplicator {

    /**
     * @param forecast      point forecast indexed like {@code forecastInput}
     * @param model         the model whose residual statistics and quantile models are used
     * @param forecastInput features the point forecast was computed from
     * @param quantiles     requested quantiles, each in (0, 1)
     * @return the forecast with one {@code quantile_Pxx} column per requested quantile
     */
    Forecast addConfidenceInterval(Forecast forecast, TrainedModel model, TimeSeriesTable forecastInput,
                                   List<Double> quantiles);
}
