package com.loadforecast.service;

import com.loadforecast.model.ModelSpecification;
import com.loadforecast.model.TrainedModel;

import java.time.Instant;

public record RegisteredModel(
    String experimentName,
    String runId,
    Instant registeredAt,
    TrainedModel model,
    ModelSpecification specification
) {}
