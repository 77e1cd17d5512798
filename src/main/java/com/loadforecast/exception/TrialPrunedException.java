package com.loadforecast.exception;

/**
 * Signals the external search driver that a trial was stopped by its pruning checkpoint.
 */
public class TrialPrunedException extends LoadForecastException {
    public TrialPrunedException(int trialNumber, int step) {
        super("TRIAL_PRUNED", "Trial " + trialNumber + " pruned at step " + step + ".");
    }
}
