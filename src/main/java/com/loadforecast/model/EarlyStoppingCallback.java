package com.loadforecast.model;

import lombok.Getter;

/**
 * Stops fitting when the monitored metric has not improved for {@code rounds} iterations.
 * One instance serves a single fit call.
 */
@Getter
public class EarlyStoppingCallback implements FitCallback {

    private final int rounds;
    private final String metricName;
    private final String dataName;
    private final boolean maximize;

    private int bestIteration = -1;
    private double bestScore = Double.NaN;

    public EarlyStoppingCallback(int rounds, String metricName, String dataName, boolean maximize) {
        if (rounds < 1) {
            throw new IllegalArgumentException("rounds must be >= 1");
        }
        this.rounds = rounds;
        this.metricName = metricName;
        this.dataName = dataName;
        this.maximize = maximize;
    }

    @Override
    public boolean afterIteration(IterationEvaluation evaluation) {
        double score = evaluation.value(dataName, metricName);
        if (bestIteration < 0 || improves(score)) {
            bestScore = score;
            bestIteration = evaluation.iteration();
            return false;
        }
        return evaluation.iteration() - bestIteration >= rounds;
    }

    private boolean improves(double score) {
        if (Double.isNaN(score)) {
            return false;
        }
        if (Double.isNaN(bestScore)) {
            return true;
        }
        return maximize ? score > bestScore : score < bestScore;
    }
}
