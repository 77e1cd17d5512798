package com.loadforecast.split;

import com.loadforecast.table.TimeSeriesTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Splits on whole UTC days so that no day is shared between train, validation and test.
 */
@Slf4j
@Component
public class DayBasedDataSplitter implements DataSplitter {

    @Override
    public DataSplit split(TimeSeriesTable data, double testFraction, double validationFraction, SplitOptions options) {
        if (testFraction < 0 || validationFraction < 0 || testFraction + validationFraction >= 1.0) {
            throw new IllegalArgumentException("Invalid fractions: test=" + testFraction
                + ", validation=" + validationFraction);
        }
        List<LocalDate> rowDays = data.getIndex().stream().map(t -> t.atZone(ZoneOffset.UTC).toLocalDate()).toList();
        List<LocalDate> days = rowDays.stream().distinct().sorted().toList();
        int nDays = days.size();

        int nTest = testFraction > 0 ? (int) Math.ceil(nDays * testFraction) : 0;
        nTest = Math.min(nTest, Math.max(0, nDays - 1));
        List<LocalDate> testDays = options.backTest()
            ? days.subList(nDays - nTest, nDays)
            : days.subList(0, nTest);
        List<LocalDate> remaining = new ArrayList<>(days);
        remaining.removeAll(testDays);

        int nValidation = (int) Math.round(remaining.size() * validationFraction / (1.0 - testFraction));
        if (validationFraction > 0 && remaining.size() >= 2) {
            nValidation = Math.max(1, nValidation);
        }
        nValidation = Math.min(nValidation, Math.max(0, remaining.size() - 1));

        Set<LocalDate> pinnedToTrain = new HashSet<>();
        if (options.stratificationMinMax() && remaining.size() >= 3 && data.columnCount() > 0) {
            Map<LocalDate, Double> peaks = dailyPeaks(data, rowDays, remaining);
            if (!peaks.isEmpty()) {
                pinnedToTrain.add(Collections.max(peaks.entrySet(), Map.Entry.comparingByValue()).getKey());
                pinnedToTrain.add(Collections.min(peaks.entrySet(), Map.Entry.comparingByValue()).getKey());
            }
        }

        List<LocalDate> candidates = new ArrayList<>(remaining);
        candidates.removeAll(pinnedToTrain);
        Collections.shuffle(candidates, new Random(options.seed()));
        Set<LocalDate> validationDays = new HashSet<>(candidates.subList(0, Math.min(nValidation, candidates.size())));
        Set<LocalDate> testDaySet = new HashSet<>(testDays);

        TimeSeriesTable train = data.filterRows(r -> !testDaySet.contains(rowDays.get(r))
            && !validationDays.contains(rowDays.get(r)));
        TimeSeriesTable validation = data.filterRows(r -> validationDays.contains(rowDays.get(r)));
        TimeSeriesTable test = data.filterRows(r -> testDaySet.contains(rowDays.get(r)));

        log.debug("Split {} days | train={} | validation={} | test={}",
            nDays, nDays - validationDays.size() - testDaySet.size(), validationDays.size(), testDaySet.size());
        return new DataSplit(train, validation, test, operationalScore(test));
    }

    private Map<LocalDate, Double> dailyPeaks(TimeSeriesTable data, List<LocalDate> rowDays, List<LocalDate> days) {
        double[] target = data.column(data.columnName(0));
        Set<LocalDate> wanted = new HashSet<>(days);
        Map<LocalDate, Double> peaks = new LinkedHashMap<>();
        IntStream.range(0, target.length)
            .filter(r -> wanted.contains(rowDays.get(r)) && !Double.isNaN(target[r]))
            .forEach(r -> peaks.merge(rowDays.get(r), target[r], Math::max));
        return peaks;
    }

    /** Test period rows at the shortest horizon, the one served operationally. */
    private TimeSeriesTable operationalScore(TimeSeriesTable test) {
        if (test.isEmpty() || !test.hasColumn(DataSplit.HORIZON_COLUMN)) {
            return test;
        }
        double[] horizons = test.column(DataSplit.HORIZON_COLUMN);
        double shortest = Arrays.stream(horizons).filter(h -> !Double.isNaN(h)).min().orElse(Double.NaN);
        return test.filterRows(r -> horizons[r] == shortest);
    }
}
