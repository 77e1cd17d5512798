package com.loadforecast.tuning;

import com.loadforecast.model.EvalMetric;
import com.loadforecast.model.FitCallback;
import com.loadforecast.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * One boosting model per quantile. No early stopping.
 */
@Component
public class XgbQuantileObjectiveVariant extends BoostingObjectiveVariant {

    @Override
    public ModelFamily family() {
        return ModelFamily.XGB_QUANTILE;
    }

    @Override
    protected Map<String, Object> familyParameters(TrialContext trial) {
        return Map.of("gamma", trial.suggestFloat("gamma", 1e-8, 1.0));
    }

    @Override
    protected Map<String, Object> familyDefaults() {
        return Map.of("gamma", 0.0);
    }

    @Override
    public Optional<FitCallback> pruningHook(TrialContext trial, EvalMetric metric) {
        return Optional.of(new PruningCallback(trial, evalSetName(1), metricName(metric)));
    }
}
