package com.loadforecast.model;

import java.util.Arrays;

/**
 * Regression scores, lower is better. Pairs with a missing actual or predicted value are skipped.
 */
public enum EvalMetric {
    MAE("mae") {
        @Override
        public double score(double[] actual, double[] predicted) {
            double sum = 0.0;
            int n = 0;
            for (int i = 0; i < actual.length; i++) {
                if (!Double.isNaN(actual[i]) && !Double.isNaN(predicted[i])) {
                    sum += Math.abs(predicted[i] - actual[i]);
                    n++;
                }
            }
            return n == 0 ? Double.NaN : sum / n;
        }
    },
    RMSE("rmse") {
        @Override
        public double score(double[] actual, double[] predicted) {
            double sum = 0.0;
            int n = 0;
            for (int i = 0; i < actual.length; i++) {
                if (!Double.isNaN(actual[i]) && !Double.isNaN(predicted[i])) {
                    double err = predicted[i] - actual[i];
                    sum += err * err;
                    n++;
                }
            }
            return n == 0 ? Double.NaN : Math.sqrt(sum / n);
        }
    },
    /** MAE relative to the range of the actual values. */
    R_MAE("r_mae") {
        @Override
        public double score(double[] actual, double[] predicted) {
            double[] present = Arrays.stream(actual).filter(v -> !Double.isNaN(v)).toArray();
            if (present.length == 0) {
                return Double.NaN;
            }
            double range = Arrays.stream(present).max().getAsDouble() - Arrays.stream(present).min().getAsDouble();
            double mae = MAE.score(actual, predicted);
            return range == 0.0 ? Double.NaN : mae / range;
        }
    };

    private final String metricName;

    EvalMetric(String metricName) {
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }

    public abstract double score(double[] actual, double[] predicted);

    public static EvalMetric fromName(String name) {
        return Arrays.stream(values())
            .filter(m -> m.metricName.equalsIgnoreCase(name) || m.name().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown eval metric '" + name + "'"));
    }
}
