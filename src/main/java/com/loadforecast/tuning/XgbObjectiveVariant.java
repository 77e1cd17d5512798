package com.loadforecast.tuning;

import com.loadforecast.model.EarlyStoppingCallback;
import com.loadforecast.model.EvalMetric;
import com.loadforecast.model.FitCallback;
import com.loadforecast.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class XgbObjectiveVariant extends BoostingObjectiveVariant {

    @Override
    public ModelFamily family() {
        return ModelFamily.XGB;
    }

    @Override
    protected Map<String, Object> familyParameters(TrialContext trial) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("gamma", trial.suggestFloat("gamma", 0.0, 1.0));
        params.put("booster", trial.suggestCategorical("booster", List.of("gbtree", "dart")));
        return params;
    }

    @Override
    protected Map<String, Object> familyDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("gamma", 0.0);
        defaults.put("booster", "gbtree");
        return defaults;
    }

    @Override
    public Optional<FitCallback> earlyStoppingHook(EvalMetric metric) {
        return Optional.of(new EarlyStoppingCallback(EARLY_STOPPING_ROUNDS, metricName(metric),
            evalSetName(1), false));
    }

    @Override
    public Optional<FitCallback> pruningHook(TrialContext trial, EvalMetric metric) {
        return Optional.of(new PruningCallback(trial, evalSetName(1), metricName(metric)));
    }
}
