package com.loadforecast.tuning;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Shared tree-boosting search space. Only the parameters the model actually accepts are
 * suggested; family-specific ones are added on top.
 */
public abstract class BoostingObjectiveVariant implements ObjectiveVariant {

    private static final Map<String, Function<TrialContext, Object>> COMMON_SPACE = commonSpace();

    private static final Map<String, Object> COMMON_DEFAULTS = commonDefaults();

    @Override
    public Map<String, Object> parameterSpace(TrialContext trial, Set<String> acceptedParams) {
        Map<String, Object> params = new LinkedHashMap<>();
        COMMON_SPACE.forEach((name, suggestion) -> {
            if (acceptedParams.contains(name)) {
                params.put(name, suggestion.apply(trial));
            }
        });
        params.putAll(familyParameters(trial));
        return params;
    }

    @Override
    public Set<String> searchableParams() {
        Set<String> names = new LinkedHashSet<>(COMMON_SPACE.keySet());
        names.addAll(familyDefaults().keySet());
        return names;
    }

    @Override
    public Map<String, Object> defaultValues() {
        Map<String, Object> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
        defaults.putAll(familyDefaults());
        return defaults;
    }

    protected abstract Map<String, Object> familyParameters(TrialContext trial);

    /** Neutral defaults of exactly the keys {@link #familyParameters} suggests. */
    protected abstract Map<String, Object> familyDefaults();

    private static Map<String, Function<TrialContext, Object>> commonSpace() {
        Map<String, Function<TrialContext, Object>> space = new LinkedHashMap<>();
        space.put("learning_rate", t -> t.suggestFloat("learning_rate", 0.01, 0.5));
        space.put("alpha", t -> t.suggestFloat("alpha", 0.0, 1.0));
        space.put("lambda", t -> t.suggestFloat("lambda", 1e-8, 1.0));
        space.put("subsample", t -> t.suggestFloat("subsample", 0.4, 1.0));
        space.put("min_child_weight", t -> t.suggestInt("min_child_weight", 1, 16));
        space.put("max_depth", t -> t.suggestInt("max_depth", 3, 10));
        space.put("colsample_bytree", t -> t.suggestFloat("colsample_bytree", 0.5, 1.0));
        space.put("max_delta_step", t -> t.suggestInt("max_delta_step", 0, 10));
        return space;
    }

    private static Map<String, Object> commonDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("learning_rate", 0.3);
        defaults.put("alpha", 0.0);
        defaults.put("lambda", 1.0);
        defaults.put("subsample", 1.0);
        defaults.put("min_child_weight", 1);
        defaults.put("max_depth", 6);
        defaults.put("colsample_bytree", 1.0);
        defaults.put("max_delta_step", 0);
        return defaults;
    }
}
