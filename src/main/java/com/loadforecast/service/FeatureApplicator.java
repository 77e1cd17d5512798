package com.loadforecast.service;

import com.loadforecast.dto.PredictionJob;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.table.TimeSeriesTable;

/**
 * Turns validated input into a model-ready table: target first, the model's features in
 * their trained order, horizon last.
 */
public interface FeatureApplicator {

    TimeSeriesTable addFeatures(TimeSeriesTable validatedData, PredictionJob job, ModelSpecification specification);
}
