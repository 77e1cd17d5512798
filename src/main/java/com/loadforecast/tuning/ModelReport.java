package com.loadforecast.tuning;

import lombok.Builder;
import lombok.Value;

/**
 * Scores of a trained model on each subset of the split it was tuned on.
 */
@Value
@Builder
public class ModelReport {
    String modelPath;
    SplitMetrics train;
    SplitMetrics validation;
    SplitMetrics test;

    @Value
    @Builder
    public static class SplitMetrics {
        long sampleCount;
        Double mae;
        Double rmse;
    }
}
