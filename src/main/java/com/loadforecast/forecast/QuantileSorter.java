package com.loadforecast.forecast;

import com.loadforecast.table.TimeSeriesTable;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Repairs crossing quantiles: per row, the quantile values are sorted so that they are
 * non-decreasing in quantile order. Missing values are left where they are.
 */
@Component
public class QuantileSorter {

    public Forecast sort(Forecast forecast) {
        List<String> columns = forecast.quantileColumns();
        if (columns.size() < 2) {
            return forecast;
        }
        TimeSeriesTable table = forecast.getValues();
        double[][] values = new double[columns.size()][];
        for (int c = 0; c < columns.size(); c++) {
            values[c] = table.column(columns.get(c));
        }

        for (int r = 0; r < table.rowCount(); r++) {
            int present = 0;
            double[] row = new double[columns.size()];
            for (double[] column : values) {
                if (!Double.isNaN(column[r])) {
                    row[present++] = column[r];
                }
            }
            Arrays.sort(row, 0, present);
            int next = 0;
            for (double[] column : values) {
                if (!Double.isNaN(column[r])) {
                    column[r] = row[next++];
                }
            }
        }

        TimeSeriesTable repaired = table;
        for (int c = 0; c < columns.size(); c++) {
            repaired = repaired.withColumn(columns.get(c), values[c]);
        }
        return forecast.withValues(repaired);
    }
}
