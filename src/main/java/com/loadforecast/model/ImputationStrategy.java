package com.loadforecast.model;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

public enum ImputationStrategy {
    MEAN("mean"),
    MEDIAN("median"),
    MOST_FREQUENT("most_frequent");

    private final String id;

    ImputationStrategy(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /** Fill value for a column; 0 when the column has no values at all. */
    public double fillValue(double[] column) {
        double[] present = Arrays.stream(column).filter(v -> !Double.isNaN(v)).toArray();
        if (present.length == 0) {
            return 0.0;
        }
        return switch (this) {
            case MEAN -> StatUtils.mean(present);
            case MEDIAN -> new Median().evaluate(present);
            // smallest of the most frequent values
            case MOST_FREQUENT -> StatUtils.mode(present)[0];
        };
    }

    public static ImputationStrategy fromId(String id) {
        return Arrays.stream(values())
            .filter(s -> s.id.equalsIgnoreCase(id) || s.name().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown imputation strategy '" + id + "'"));
    }
}
