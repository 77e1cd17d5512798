package com.loadforecast.forecast;

import com.loadforecast.TestTables;
import com.loadforecast.table.TimeSeriesTable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class QuantileSorterTest {

    private final QuantileSorter sorter = new QuantileSorter();
    private final List<Instant> index = TestTables.index(TestTables.START, Duration.ofMinutes(15), 3);

    @Test
    void sort_crossingQuantiles_becomeNonDecreasing() {
        TimeSeriesTable values = TimeSeriesTable.builder(index)
            .column(Forecast.FORECAST_COLUMN, new double[]{10, 20, 30})
            .column("quantile_P90", new double[]{12, 15, 40})
            .column("quantile_P10", new double[]{8, 25, 20})
            .column("quantile_P50", new double[]{10, 30, 30})
            .build();

        Forecast sorted = sorter.sort(new Forecast(values, ForecastSource.MODEL));

        TimeSeriesTable out = sorted.getValues();
        assertThat(out.column("quantile_P10")).containsExactly(8, 15, 20);
        assertThat(out.column("quantile_P50")).containsExactly(10, 25, 30);
        assertThat(out.column("quantile_P90")).containsExactly(12, 30, 40);
        assertThat(out.column(Forecast.FORECAST_COLUMN)).containsExactly(10, 20, 30);
        assertThat(out.columnNames()).containsExactly(Forecast.FORECAST_COLUMN, "quantile_P90", "quantile_P10", "quantile_P50");
    }

    @Test
    void sort_everyRowIsMonotone() {
        double[][] q = {
            {5, 1, 9, 3},
            {4, 4, 2, 8},
            {7, 6, 5, 4}};
        TimeSeriesTable.Builder builder = TimeSeriesTable.builder(index).column(Forecast.FORECAST_COLUMN, new double[3]);
        String[] names = {"quantile_P05", "quantile_P30", "quantile_P70", "quantile_P95"};
        for (int c = 0; c < names.length; c++) {
            builder.column(names[c], new double[]{q[0][c], q[1][c], q[2][c]});
        }

        TimeSeriesTable out = sorter.sort(new Forecast(builder.build(), ForecastSource.MODEL)).getValues();

        for (int r = 0; r < 3; r++) {
            for (int c = 1; c < names.length; c++) {
                assertThat(out.value(r, names[c])).isGreaterThanOrEqualTo(out.value(r, names[c - 1]));
            }
        }
    }

    @Test
    void sort_missingValuesStayInPlace() {
        TimeSeriesTable values = TimeSeriesTable.builder(index.subList(0, 1))
            .column(Forecast.FORECAST_COLUMN, new double[]{1})
            .column("quantile_P10", new double[]{5})
            .column("quantile_P50", new double[]{Double.NaN})
            .column("quantile_P90", new double[]{2})
            .build();

        TimeSeriesTable out = sorter.sort(new Forecast(values, ForecastSource.MODEL)).getValues();

        assertThat(out.value(0, "quantile_P10")).isEqualTo(2.0);
        assertThat(out.value(0, "quantile_P50")).isNaN();
        assertThat(out.value(0, "quantile_P90")).isEqualTo(5.0);
    }

    @Test
    void quantileColumn_namesPercentiles() {
        assertThat(Forecast.quantileColumn(0.05)).isEqualTo("quantile_P05");
        assertThat(Forecast.quantileColumn(0.5)).isEqualTo("quantile_P50");
        assertThat(Forecast.quantileColumn(0.9)).isEqualTo("quantile_P90");
        assertThat(Forecast.quantileColumn(0.025)).isEqualTo("quantile_P2_5");
    }

    @Test
    void quantileColumns_orderedByQuantile() {
        TimeSeriesTable values = TimeSeriesTable.builder(index)
            .column(Forecast.FORECAST_COLUMN, new double[3])
            .column("quantile_P90", new double[3])
            .column("quantile_P2_5", new double[3])
            .column("quantile_P10", new double[3])
            .build();
        assertThat(new Forecast(values, ForecastSource.FALLBACK).quantileColumns())
            .containsExactly("quantile_P2_5", "quantile_P10", "quantile_P90");
    }
}
