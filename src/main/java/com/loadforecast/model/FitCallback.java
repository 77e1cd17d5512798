package com.loadforecast.model;

@FunctionalInterface
public interface FitCallback {

    /**
     * Called by the regressor after each boosting (or fitting) iteration.
     *
     * @return {@code true} to stop fitting after this iteration
     */
    boolean afterIteration(IterationEvaluation evaluation);
}
