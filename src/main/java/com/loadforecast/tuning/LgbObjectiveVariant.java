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

/**
 * Leaf-wise boosting. Its fit reports eval sets as {@code valid_n} and MAE as {@code l1}.
 */
@Component
public class LgbObjectiveVariant extends BoostingObjectiveVariant {

    @Override
    public ModelFamily family() {
        return ModelFamily.LGB;
    }

    @Override
    protected Map<String, Object> familyParameters(TrialContext trial) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("num_leaves", trial.suggestInt("num_leaves", 16, 62));
        params.put("boosting_type", trial.suggestCategorical("boosting_type", List.of("gbdt", "dart", "rf")));
        params.put("tree_learner", trial.suggestCategorical("tree_learner",
            List.of("serial", "feature", "data", "voting")));
        params.put("n_estimators", trial.suggestInt("n_estimators", 50, 150));
        params.put("min_split_gain", trial.suggestFloat("min_split_gain", 1e-8, 1.0));
        params.put("subsample_freq", trial.suggestInt("subsample_freq", 1, 10));
        return params;
    }

    @Override
    protected Map<String, Object> familyDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("num_leaves", 31);
        defaults.put("boosting_type", "gbdt");
        defaults.put("tree_learner", "serial");
        defaults.put("n_estimators", 100);
        defaults.put("min_split_gain", 0.0);
        defaults.put("subsample_freq", 0);
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

    @Override
    public String evalSetName(int position) {
        return "valid_" + position;
    }

    @Override
    public String metricName(EvalMetric metric) {
        return metric == EvalMetric.MAE ? "l1" : metric.getMetricName();
    }
}
