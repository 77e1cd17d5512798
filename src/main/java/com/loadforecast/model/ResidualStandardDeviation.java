package com.loadforecast.model;

import java.util.Comparator;
import java.util.List;

/**
 * Standard deviation of validation residuals per forecast horizon (hours) and hour of day.
 */
public record ResidualStandardDeviation(List<Entry> entries) {

    public ResidualStandardDeviation {
        entries = List.copyOf(entries);
    }

    public static ResidualStandardDeviation empty() {
        return new ResidualStandardDeviation(List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Standard deviation for the hour of day at the horizon closest to the requested one,
     * or NaN when nothing was recorded for that hour.
     */
    public double lookup(int hourOfDay, double horizon) {
        return entries.stream()
            .filter(e -> e.hour() == hourOfDay)
            .min(Comparator.comparingDouble(e -> Math.abs(e.horizon() - horizon)))
            .map(Entry::stdev)
            .orElse(Double.NaN);
    }

    public record Entry(double horizon, int hour, double stdev) {}
}
