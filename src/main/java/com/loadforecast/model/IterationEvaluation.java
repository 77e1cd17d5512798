package com.loadforecast.model;

import java.util.Map;

/**
 * Metric values of one fit iteration, keyed by eval set name and then metric name.
 */
public record IterationEvaluation(int iteration, Map<String, Map<String, Double>> results) {

    public IterationEvaluation {
        results = Map.copyOf(results);
    }

    public double value(String evalSetName, String metricName) {
        Map<String, Double> perMetric = results.get(evalSetName);
        if (perMetric == null || !perMetric.containsKey(metricName)) {
            throw new IllegalArgumentException("No value for " + evalSetName + "-" + metricName
                + " in iteration " + iteration + ", available: " + results);
        }
        return perMetric.get(metricName);
    }
}
