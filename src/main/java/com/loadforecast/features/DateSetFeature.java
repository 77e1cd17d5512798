package com.loadforecast.features;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 1.0 for timestamps whose UTC date is in a fixed set of dates, 0.0 otherwise. The label
 * and dates are captured when the feature is built and never change afterwards.
 */
public final class DateSetFeature implements FeatureFunction {

    private final String label;
    private final Set<LocalDate> dates;

    public DateSetFeature(String label, Collection<LocalDate> dates) {
        this.label = label;
        this.dates = Set.copyOf(dates);
    }

    public String getLabel() {
        return label;
    }

    public Set<LocalDate> getDates() {
        return dates;
    }

    public boolean contains(LocalDate date) {
        return dates.contains(date);
    }

    @Override
    public double[] apply(List<Instant> index) {
        double[] out = new double[index.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = dates.contains(index.get(i).atZone(ZoneOffset.UTC).toLocalDate()) ? 1.0 : 0.0;
        }
        return out;
    }

    @Override
    public String toString() {
        return "DateSetFeature{" + label + ", " + dates.size() + " dates}";
    }
}
