package com.loadforecast.model;

import java.util.List;

/**
 * Arguments of a single {@link Regressor#fit} call.
 *
 * @param evalSets   evaluated after every iteration, named {@code validation_0}, {@code validation_1}, ...
 * @param evalMetric metric reported for every eval set
 * @param callbacks  invoked after every iteration in order; any of them may stop the fit
 */
public record FitOptions(List<EvalSet> evalSets, EvalMetric evalMetric, List<FitCallback> callbacks) {

    public FitOptions {
        evalSets = List.copyOf(evalSets);
        callbacks = List.copyOf(callbacks);
    }

    public static FitOptions none() {
        return new FitOptions(List.of(), EvalMetric.MAE, List.of());
    }

    public static String evalSetName(int position) {
        return "validation_" + position;
    }
}
