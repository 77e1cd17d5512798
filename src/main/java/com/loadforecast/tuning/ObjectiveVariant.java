package com.loadforecast.tuning;

import com.loadforecast.model.EvalMetric;
import com.loadforecast.model.FitCallback;
import com.loadforecast.model.FitOptions;
import com.loadforecast.model.ModelFamily;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Family-specific part of the tuning objective: which hyperparameters are searched and
 * how early stopping and pruning are wired into the fit.
 */
public interface ObjectiveVariant {

    int EARLY_STOPPING_ROUNDS = 10;

    ModelFamily family();

    /**
     * Hyperparameter assignment for one trial.
     *
     * @param acceptedParams parameter names the model under tuning accepts
     */
    Map<String, Object> parameterSpace(TrialContext trial, Set<String> acceptedParams);

    /** Every key {@link #parameterSpace} can produce for a model accepting all of them. */
    Set<String> searchableParams();

    /** Non-tuned baseline configuration; keys are a subset of {@link #searchableParams()}. */
    Map<String, Object> defaultValues();

    default Optional<FitCallback> earlyStoppingHook(EvalMetric metric) {
        return Optional.empty();
    }

    default Optional<FitCallback> pruningHook(TrialContext trial, EvalMetric metric) {
        return Optional.empty();
    }

    /** Name under which the fit reports the eval set at {@code position}. */
    default String evalSetName(int position) {
        return FitOptions.evalSetName(position);
    }

    /** Name under which the fit reports {@code metric}. */
    default String metricName(EvalMetric metric) {
        return metric.getMetricName();
    }
}
