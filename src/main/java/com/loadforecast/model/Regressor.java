package com.loadforecast.model;

import com.loadforecast.table.TimeSeriesTable;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A regression model that can be configured, fitted and queried.
 * <p>
 * Instances are mutable and not thread safe: one instance is mutated in place by a
 * single fit call. Anything that outlives the fit (trial snapshots, registered
 * models) holds a {@link #copy()}.
 */
public interface Regressor {

    ModelFamily family();

    /** Current hyperparameters, keyed by the names this model accepts. */
    Map<String, Object> getParams();

    /**
     * Updates hyperparameters.
     *
     * @throws IllegalArgumentException when a key is not accepted by this model
     */
    void setParams(Map<String, ?> params);

    void fit(TimeSeriesTable features, double[] target, FitOptions options);

    double[] predict(TimeSeriesTable features);

    /** Feature name to relative importance; empty before fitting. */
    Map<String, Double> featureImportance();

    /** Feature names seen during fitting, in fitting order. */
    List<String> featureNames();

    /** Quantiles for which a dedicated model was fitted. */
    default Set<Double> quantiles() {
        return Set.of();
    }

    default double[] predictQuantile(TimeSeriesTable features, double quantile) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no model for quantile " + quantile);
    }

    /** Deep copy, sharing no mutable state with this instance. */
    Regressor copy();

    default String path() {
        return family().getPath();
    }
}
