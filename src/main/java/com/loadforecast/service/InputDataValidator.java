package com.loadforecast.service;

import com.loadforecast.exception.OngoingFlatlinerException;
import com.loadforecast.model.TrainedModel;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Input quality checks run before and after feature application.
 */
@Slf4j
@Component
public class InputDataValidator {

    /**
     * Sorts the input by time and rejects it when the most recent load is an ongoing
     * flatliner. A {@code null} threshold disables flatliner detection.
     *
     * @throws OngoingFlatlinerException when the latest {@code thresholdMinutes} of load are constant
     */
    public TimeSeriesTable validate(long pid, TimeSeriesTable data, Integer flatlinerThresholdMinutes,
                                    boolean detectNonZeroFlatliner) {
        TimeSeriesTable sorted = data.sortByIndex();
        if (flatlinerThresholdMinutes != null
                && detectOngoingFlatliner(sorted, flatlinerThresholdMinutes, detectNonZeroFlatliner)) {
            log.warn("Ongoing flatliner detected | pid={} | thresholdMinutes={}", pid, flatlinerThresholdMinutes);
            throw new OngoingFlatlinerException(pid, flatlinerThresholdMinutes);
        }
        return sorted;
    }

    /**
     * True when every non-missing load value in the last {@code thresholdMinutes} before
     * the latest measurement is zero, or, with {@code detectNonZero}, identical.
     */
    public boolean detectOngoingFlatliner(TimeSeriesTable data, int thresholdMinutes, boolean detectNonZero) {
        if (!data.hasColumn(DataSplit.TARGET_COLUMN)) {
            return false;
        }
        double[] load = data.column(DataSplit.TARGET_COLUMN);
        List<Instant> index = data.getIndex();
        Instant latest = null;
        for (int r = 0; r < load.length; r++) {
            if (!Double.isNaN(load[r]) && (latest == null || index.get(r).isAfter(latest))) {
                latest = index.get(r);
            }
        }
        if (latest == null) {
            return false;
        }
        Instant windowStart = latest.minusSeconds(thresholdMinutes * 60L);

        boolean allZero = true;
        boolean allEqual = true;
        double first = Double.NaN;
        for (int r = 0; r < load.length; r++) {
            if (Double.isNaN(load[r]) || index.get(r).isBefore(windowStart)) {
                continue;
            }
            if (Double.isNaN(first)) {
                first = load[r];
            }
            allZero &= load[r] == 0.0;
            allEqual &= load[r] == first;
        }
        return allZero || (detectNonZero && allEqual);
    }

    /**
     * Fraction of non-missing feature values. Features are weighted by the model's
     * feature importance when it has any, otherwise equally. Target and horizon columns
     * are not counted.
     */
    public double completeness(TimeSeriesTable dataWithFeatures, Map<String, Double> weights) {
        List<String> features = dataWithFeatures.columnNames().stream()
            .filter(c -> !c.equals(DataSplit.TARGET_COLUMN) && !c.equals(DataSplit.HORIZON_COLUMN))
            .toList();
        if (features.isEmpty() || dataWithFeatures.isEmpty()) {
            return dataWithFeatures.isEmpty() ? 0.0 : 1.0;
        }
        double totalWeight = features.stream().mapToDouble(f -> weights.getOrDefault(f, 0.0)).sum();
        boolean weighted = totalWeight > 0;

        double completeness = 0.0;
        for (String feature : features) {
            double[] values = dataWithFeatures.column(feature);
            long present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).count();
            double fraction = (double) present / values.length;
            double weight = weighted ? weights.getOrDefault(feature, 0.0) / totalWeight : 1.0 / features.size();
            completeness += fraction * weight;
        }
        return completeness;
    }

    public boolean isDataSufficient(TimeSeriesTable dataWithFeatures, double completenessThreshold,
                                    int minimalTableLength, TrainedModel model) {
        double completeness = completeness(dataWithFeatures,
            model != null ? model.getFeatureImportance() : Map.of());
        int length = dataWithFeatures.rowCount();
        boolean sufficient = completeness >= completenessThreshold && length >= minimalTableLength;
        if (!sufficient) {
            log.info("Input data insufficient | completeness={} | threshold={} | rows={} | minimalRows={}",
                     completeness, completenessThreshold, length, minimalTableLength);
        }
        return sufficient;
    }
}
