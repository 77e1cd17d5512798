package com.loadforecast.tuning;

import java.util.List;

/**
 * One trial of the external hyperparameter search driver. The driver decides which
 * values are suggested and when a trial should be pruned; the objective only asks.
 */
public interface TrialContext {

    int number();

    double suggestFloat(String name, double low, double high);

    int suggestInt(String name, int low, int high);

    String suggestCategorical(String name, List<String> choices);

    /** Intermediate objective value at a fit step, used by the driver's pruner. */
    void report(double value, int step);

    boolean shouldPrune();

    void setUserAttribute(String key, Object value);
}
