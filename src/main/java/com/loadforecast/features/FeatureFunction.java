package com.loadforecast.features;

import java.time.Instant;
import java.util.List;

/**
 * Pure function of a row's timestamp. Returns one value per index entry.
 */
@FunctionalInterface
public interface FeatureFunction {

    double[] apply(List<Instant> index);
}
