package com.loadforecast.forecast;

import com.loadforecast.dto.FallbackStrategy;
import com.loadforecast.exception.FallbackSuppressedException;
import com.loadforecast.exception.InsufficientLoadDataException;
import com.loadforecast.table.TimeSeriesTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Heuristic forecast used when a model forecast cannot be trusted.
 * <p>
 * {@link FallbackStrategy#EXTREME_DAY} replays the complete historic day holding the
 * highest load measurement: every forecast timestamp gets that day's load at the same
 * UTC time of day, or NaN when the day has no measurement at that time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackForecastGenerator {

    private final Clock clock;

    /**
     * @param forecastIndex timestamps to forecast
     * @param loadHistory   table whose first column holds the load measurements
     * @param strategyId    {@link FallbackStrategy} identifier, {@code null} for the default
     * @throws com.loadforecast.exception.UnsupportedFallbackStrategyException for an unknown strategy
     * @throws InsufficientLoadDataException when the history holds no load measurement
     * @throws FallbackSuppressedException   for {@link FallbackStrategy#RAISE_ERROR}
     */
    public TimeSeriesTable generate(List<Instant> forecastIndex, TimeSeriesTable loadHistory, String strategyId) {
        FallbackStrategy strategy = FallbackStrategy.fromId(strategyId);

        TimeSeriesTable load = measuredLoad(loadHistory);
        if (load.isEmpty()) {
            throw new InsufficientLoadDataException("No historic load data available, cannot generate a fallback forecast.");
        }

        return switch (strategy) {
            case RAISE_ERROR -> throw new FallbackSuppressedException();
            case EXTREME_DAY -> extremeDay(forecastIndex, load);
        };
    }

    private TimeSeriesTable extremeDay(List<Instant> forecastIndex, TimeSeriesTable load) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        TimeSeriesTable history = load.filterRows(r -> dateOf(load.getIndex().get(r)).isBefore(today));
        if (history.isEmpty()) {
            throw new InsufficientLoadDataException("No load measurements before " + today + ", cannot determine an extreme day.");
        }

        double[] values = history.column(history.columnName(0));
        int peak = 0;
        for (int r = 1; r < values.length; r++) {
            if (values[r] > values[peak]) {
                peak = r;
            }
        }
        LocalDate extremeDay = dateOf(history.getIndex().get(peak));

        Map<LocalTime, Double> profile = new HashMap<>();
        for (int r = 0; r < values.length; r++) {
            Instant t = history.getIndex().get(r);
            if (dateOf(t).equals(extremeDay)) {
                profile.putIfAbsent(timeOf(t), values[r]);
            }
        }
        log.debug("Extreme day fallback | day={} | peak={} | profilePoints={}", extremeDay, values[peak], profile.size());

        List<Instant> sortedIndex = new ArrayList<>(forecastIndex);
        sortedIndex.sort(Comparator.naturalOrder());
        double[] forecast = new double[sortedIndex.size()];
        for (int i = 0; i < forecast.length; i++) {
            forecast[i] = profile.getOrDefault(timeOf(sortedIndex.get(i)), Double.NaN);
        }
        return TimeSeriesTable.builder(sortedIndex)
            .column(Forecast.FORECAST_COLUMN, forecast)
            .build();
    }

    private static TimeSeriesTable measuredLoad(TimeSeriesTable loadHistory) {
        if (loadHistory.columnCount() == 0) {
            return TimeSeriesTable.empty(List.of());
        }
        String loadColumn = loadHistory.columnName(0);
        TimeSeriesTable load = loadHistory.selectColumns(List.of(loadColumn));
        double[] values = load.column(loadColumn);
        return load.filterRows(r -> !Double.isNaN(values[r]));
    }

    private static LocalDate dateOf(Instant t) {
        return t.atZone(ZoneOffset.UTC).toLocalDate();
    }

    private static LocalTime timeOf(Instant t) {
        return t.atZone(ZoneOffset.UTC).toLocalTime();
    }
}
