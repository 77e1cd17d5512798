package com.loadforecast.model;

import com.loadforecast.table.TimeSeriesTable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a fitted model together with the data derived from it after
 * fitting: feature importances and residual standard deviations. The wrapped regressor
 * is a private copy, so later fits of the original instance never leak into a snapshot.
 */
public final class TrainedModel {

    private final Regressor regressor;
    private final Map<String, Double> featureImportance;
    private final ResidualStandardDeviation standardDeviation;

    private TrainedModel(Regressor regressor, Map<String, Double> featureImportance,
                         ResidualStandardDeviation standardDeviation) {
        this.regressor = regressor;
        this.featureImportance = Map.copyOf(featureImportance);
        this.standardDeviation = Objects.requireNonNull(standardDeviation);
    }

    public static TrainedModel snapshot(Regressor fitted) {
        Regressor copy = fitted.copy();
        return new TrainedModel(copy, copy.featureImportance(), ResidualStandardDeviation.empty());
    }

    public TrainedModel withStandardDeviation(ResidualStandardDeviation standardDeviation) {
        return new TrainedModel(regressor, featureImportance, standardDeviation);
    }

    public double[] predict(TimeSeriesTable features) {
        return regressor.predict(features);
    }

    public double[] predictQuantile(TimeSeriesTable features, double quantile) {
        return regressor.predictQuantile(features, quantile);
    }

    public Set<Double> quantiles() {
        return regressor.quantiles();
    }

    public List<String> featureNames() {
        return regressor.featureNames();
    }

    public Map<String, Object> params() {
        return Map.copyOf(regressor.getParams());
    }

    public ModelFamily family() {
        return regressor.family();
    }

    public String path() {
        return regressor.path();
    }

    public Map<String, Double> getFeatureImportance() {
        return featureImportance;
    }

    public ResidualStandardDeviation getStandardDeviation() {
        return standardDeviation;
    }
}
