package com.loadforecast.forecast;

import com.loadforecast.table.TimeSeriesTable;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Point forecast plus optional {@code stdev} and {@code quantile_Pxx} columns, and the
 * job metadata attached at the end of a pipeline run.
 */
public final class Forecast {

    public static final String FORECAST_COLUMN = "forecast";
    public static final String STDEV_COLUMN = "stdev";
    public static final String QUANTILE_PREFIX = "quantile_P";

    private final TimeSeriesTable values;
    private final ForecastSource source;
    private final Map<String, String> attributes;

    public Forecast(TimeSeriesTable values, ForecastSource source) {
        this(values, source, Map.of());
    }

    private Forecast(TimeSeriesTable values, ForecastSource source, Map<String, String> attributes) {
        if (!values.hasColumn(FORECAST_COLUMN)) {
            throw new IllegalArgumentException("Forecast table has no '" + FORECAST_COLUMN + "' column: " + values);
        }
        this.values = values;
        this.source = source;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Column name for a quantile, e.g. 0.05 becomes {@code quantile_P05}. */
    public static String quantileColumn(double quantile) {
        BigDecimal percent = BigDecimal.valueOf(quantile).movePointRight(2).stripTrailingZeros();
        if (percent.scale() <= 0) {
            return String.format(Locale.ROOT, "%s%02d", QUANTILE_PREFIX, percent.intValueExact());
        }
        return QUANTILE_PREFIX + percent.toPlainString().replace('.', '_');
    }

    /** Quantile columns ordered by increasing quantile. */
    public List<String> quantileColumns() {
        return values.columnNames().stream()
            .filter(name -> name.startsWith(QUANTILE_PREFIX))
            .sorted(Comparator.comparingDouble(Forecast::percentOf))
            .toList();
    }

    private static double percentOf(String column) {
        return Double.parseDouble(column.substring(QUANTILE_PREFIX.length()).replace('_', '.'));
    }

    public Forecast withValues(TimeSeriesTable newValues) {
        return new Forecast(newValues, source, attributes);
    }

    public Forecast withAttributes(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(attributes);
        merged.putAll(extra);
        return new Forecast(values, source, merged);
    }

    public TimeSeriesTable getValues() {
        return values;
    }

    public ForecastSource getSource() {
        return source;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }
}
