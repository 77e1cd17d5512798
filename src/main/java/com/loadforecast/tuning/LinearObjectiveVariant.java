package com.loadforecast.tuning;

import com.loadforecast.model.ImputationStrategy;
import com.loadforecast.model.LinearRegressor;
import com.loadforecast.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class LinearObjectiveVariant implements ObjectiveVariant {

    private static final List<String> STRATEGIES = Arrays.stream(ImputationStrategy.values())
        .map(ImputationStrategy::getId)
        .toList();

    @Override
    public ModelFamily family() {
        return ModelFamily.LINEAR;
    }

    @Override
    public Map<String, Object> parameterSpace(TrialContext trial, Set<String> acceptedParams) {
        return Map.of(LinearRegressor.IMPUTATION_STRATEGY,
            trial.suggestCategorical(LinearRegressor.IMPUTATION_STRATEGY, STRATEGIES));
    }

    @Override
    public Set<String> searchableParams() {
        return Set.of(LinearRegressor.IMPUTATION_STRATEGY);
    }

    @Override
    public Map<String, Object> defaultValues() {
        return Map.of(LinearRegressor.IMPUTATION_STRATEGY, ImputationStrategy.MEAN.getId());
    }
}
