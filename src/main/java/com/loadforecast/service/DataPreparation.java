package com.loadforecast.service;

import com.loadforecast.dto.PredictionJob;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.model.TrainedModel;
import com.loadforecast.table.TimeSeriesTable;

/**
 * Custom replacement for feature application and forecast-window selection, selected
 * per job by bean name.
 */
public interface DataPreparation {

    PreparedInput prepareForecastData(PredictionJob job, TimeSeriesTable validatedData,
                                      TrainedModel model, ModelSpecification specification);

    /**
     * @param forecastInput    features for the timestamps to forecast, without the target column
     * @param dataWithFeatures the full feature table the sufficiency check runs on
     */
    record PreparedInput(TimeSeriesTable forecastInput, TimeSeriesTable dataWithFeatures) {}
}
