package com.loadforecast.features;

import java.util.Map;

public interface FeatureFunctionProvider {

    /** Feature name to function; names are stable across calls. */
    Map<String, FeatureFunction> featureFunctions();
}
