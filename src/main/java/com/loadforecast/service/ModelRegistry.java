package com.loadforecast.service;

import com.loadforecast.model.ModelSpecification;
import com.loadforecast.model.TrainedModel;

/**
 * Store of trained models, grouped per experiment. One experiment holds every run
 * registered for one prediction job.
 */
public interface ModelRegistry {

    /**
     * Loads a run of the experiment, the latest one when {@code runId} is {@code null}.
     *
     * @throws com.loadforecast.exception.ModelNotFoundException when no such run exists
     */
    RegisteredModel load(String experimentName, String runId);

    RegisteredModel save(String experimentName, TrainedModel model, ModelSpecification specification);
}
