package com.loadforecast.tuning;

import com.loadforecast.exception.TrialPrunedException;
import com.loadforecast.model.FitCallback;
import com.loadforecast.model.IterationEvaluation;

/**
 * Reports the observed eval-set metric to the trial after every iteration and aborts the
 * fit when the search driver decides to prune.
 */
public class PruningCallback implements FitCallback {

    private final TrialContext trial;
    private final String dataName;
    private final String metricName;

    public PruningCallback(TrialContext trial, String dataName, String metricName) {
        this.trial = trial;
        this.dataName = dataName;
        this.metricName = metricName;
    }

    public String observationKey() {
        return dataName + "-" + metricName;
    }

    @Override
    public boolean afterIteration(IterationEvaluation evaluation) {
        trial.report(evaluation.value(dataName, metricName), evaluation.iteration());
        if (trial.shouldPrune()) {
            throw new TrialPrunedException(trial.number(), evaluation.iteration());
        }
        return false;
    }
}
