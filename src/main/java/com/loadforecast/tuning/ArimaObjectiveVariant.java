package com.loadforecast.tuning;

import com.loadforecast.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Statistical time-series model. Only the trend term is searched: "n" none, "c" constant,
 * "t" linear trend, "ct" both.
 */
@Component
public class ArimaObjectiveVariant implements ObjectiveVariant {

    public static final String TREND = "trend";

    @Override
    public ModelFamily family() {
        return ModelFamily.ARIMA;
    }

    @Override
    public Map<String, Object> parameterSpace(TrialContext trial, Set<String> acceptedParams) {
        return Map.of(TREND, trial.suggestCategorical(TREND, List.of("n", "c", "t", "ct")));
    }

    @Override
    public Set<String> searchableParams() {
        return Set.of(TREND);
    }

    @Override
    public Map<String, Object> defaultValues() {
        return Map.of(TREND, "n");
    }
}
