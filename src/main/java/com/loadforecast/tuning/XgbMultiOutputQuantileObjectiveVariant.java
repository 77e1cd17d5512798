package com.loadforecast.tuning;

import com.loadforecast.model.EvalMetric;
import com.loadforecast.model.FitCallback;
import com.loadforecast.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A single multi-output boosting model for all quantiles, trained on an arctan-smoothed
 * pinball loss.
 */
@Component
public class XgbMultiOutputQuantileObjectiveVariant extends BoostingObjectiveVariant {

    @Override
    public ModelFamily family() {
        return ModelFamily.XGB_MULTIOUTPUT_QUANTILE;
    }

    @Override
    protected Map<String, Object> familyParameters(TrialContext trial) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("gamma", trial.suggestFloat("gamma", 1e-8, 1.0));
        params.put("arctan_smoothing", trial.suggestFloat("arctan_smoothing", 0.025, 0.15));
        return params;
    }

    @Override
    protected Map<String, Object> familyDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("gamma", 0.0);
        defaults.put("arctan_smoothing", 0.055);
        return defaults;
    }

    @Override
    public Optional<FitCallback> pruningHook(TrialContext trial, EvalMetric metric) {
        return Optional.of(new PruningCallback(trial, evalSetName(1), metricName(metric)));
    }
}
