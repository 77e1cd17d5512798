package com.loadforecast.tuning;

import com.loadforecast.model.TrainedModel;

import java.util.Map;

/**
 * Outcome of one evaluated hyperparameter assignment. The model is an immutable snapshot
 * owned by this record.
 *
 * @param score lower is better
 */
public record Trial(int number, Map<String, Object> params, double score, TrainedModel model) {

    public Trial {
        params = Map.copyOf(params);
    }
}
