package com.loadforecast.split;

import com.loadforecast.exception.ColumnOrderException;
import com.loadforecast.table.TimeSeriesTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Four disjoint row subsets of one dataset. Every subset keeps column 0 = {@value #TARGET_COLUMN}
 * and the last column = {@value #HORIZON_COLUMN}; everything in between is a feature.
 */
public record DataSplit(TimeSeriesTable train,
                        TimeSeriesTable validation,
                        TimeSeriesTable test,
                        TimeSeriesTable operationalScore) {

    public static final String TARGET_COLUMN = "load";
    public static final String HORIZON_COLUMN = "horizon";

    /**
     * @throws ColumnOrderException when train, validation or test does not follow the column contract
     */
    public void verifyColumnOrder() {
        Map<String, TimeSeriesTable> subsets = new LinkedHashMap<>();
        subsets.put("train", train);
        subsets.put("validation", validation);
        subsets.put("test", test);
        subsets.forEach(DataSplit::verifyColumnOrder);
    }

    public static void verifyColumnOrder(String subset, TimeSeriesTable table) {
        if (table.columnCount() < 2) {
            throw new ColumnOrderException(subset,
                table.columnCount() == 0 ? null : table.columnName(0), null);
        }
        String first = table.columnName(0);
        String last = table.columnName(-1);
        if (!TARGET_COLUMN.equals(first) || !HORIZON_COLUMN.equals(last)) {
            throw new ColumnOrderException(subset, first, last);
        }
    }

    /** Feature columns: everything between the target and the horizon. */
    public static TimeSeriesTable features(TimeSeriesTable table) {
        return table.sliceColumns(1, -1);
    }

    public static double[] target(TimeSeriesTable table) {
        return table.column(table.columnName(0));
    }
}
