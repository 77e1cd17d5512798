package com.loadforecast.model;

import com.loadforecast.table.TimeSeriesTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Iterative stand-in for an external regressor: predicts the training mean and reports
 * eval-set metrics after each of a fixed number of iterations, naming them the way the
 * family's own library would.
 */
public class StubRegressor implements Regressor {

    private final ModelFamily family;
    private final Set<String> acceptedParams;
    private final int iterations;
    private final AtomicInteger fitCalls;
    private final List<FitCallback> seenCallbacks;
    private Map<String, Object> params = new LinkedHashMap<>();
    private List<String> featureNames = List.of();
    private double level = Double.NaN;

    public StubRegressor(ModelFamily family, Set<String> acceptedParams, int iterations) {
        this(family, acceptedParams, iterations, new AtomicInteger(), new ArrayList<>());
    }

    private StubRegressor(ModelFamily family, Set<String> acceptedParams, int iterations,
                          AtomicInteger fitCalls, List<FitCallback> seenCallbacks) {
        this.family = family;
        this.acceptedParams = Set.copyOf(acceptedParams);
        this.iterations = iterations;
        this.fitCalls = fitCalls;
        this.seenCallbacks = seenCallbacks;
    }

    /** Fit calls on this instance and every copy of it. */
    public int fitCalls() {
        return fitCalls.get();
    }

    /** Callbacks passed to fit calls on this instance and every copy of it. */
    public List<FitCallback> seenCallbacks() {
        return seenCallbacks;
    }

    @Override
    public ModelFamily family() {
        return family;
    }

    @Override
    public Map<String, Object> getParams() {
        Map<String, Object> current = new LinkedHashMap<>();
        acceptedParams.forEach(name -> current.put(name, params.getOrDefault(name, "default")));
        return current;
    }

    @Override
    public void setParams(Map<String, ?> newParams) {
        newParams.forEach((key, value) -> {
            if (!acceptedParams.contains(key)) {
                throw new IllegalArgumentException("Unknown parameter " + key);
            }
            params.put(key, value);
        });
    }

    @Override
    public void fit(TimeSeriesTable features, double[] target, FitOptions options) {
        fitCalls.incrementAndGet();
        seenCallbacks.addAll(options.callbacks());
        featureNames = features.columnNames();
        level = Arrays.stream(target).filter(v -> !Double.isNaN(v)).average().orElse(0.0);

        String metricName = family == ModelFamily.LGB && options.evalMetric() == EvalMetric.MAE
            ? "l1" : options.evalMetric().getMetricName();
        for (int i = 0; i < iterations; i++) {
            Map<String, Map<String, Double>> results = new LinkedHashMap<>();
            for (EvalSet evalSet : options.evalSets()) {
                double score = options.evalMetric().score(evalSet.target(), predict(evalSet.features())) / (i + 1);
                results.put(evalSet.name(), Map.of(metricName, score));
            }
            IterationEvaluation evaluation = new IterationEvaluation(i, results);
            boolean stop = false;
            for (FitCallback callback : options.callbacks()) {
                stop |= callback.afterIteration(evaluation);
            }
            if (stop) {
                break;
            }
        }
    }

    @Override
    public double[] predict(TimeSeriesTable features) {
        double[] out = new double[features.rowCount()];
        Arrays.fill(out, level);
        return out;
    }

    @Override
    public Map<String, Double> featureImportance() {
        Map<String, Double> importance = new LinkedHashMap<>();
        featureNames.forEach(f -> importance.put(f, 1.0 / featureNames.size()));
        return importance;
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }

    @Override
    public StubRegressor copy() {
        StubRegressor copy = new StubRegressor(family, acceptedParams, iterations, fitCalls, seenCallbacks);
        copy.params = new LinkedHashMap<>(params);
        copy.featureNames = List.copyOf(featureNames);
        copy.level = level;
        return copy;
    }
}
