package com.loadforecast.forecast;

import com.loadforecast.exception.InsufficientLoadDataException;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;

import java.time.Instant;
import java.util.List;

/**
 * Timestamps to forecast: from the first missing load after the last measurement up
 * to the end of the input.
 */
public record ForecastWindow(Instant start, Instant end) {

    public static ForecastWindow of(TimeSeriesTable data) {
        List<Instant> index = data.getIndex();
        if (index.isEmpty()) {
            throw new InsufficientLoadDataException("Input data is empty, no forecast window.");
        }
        double[] load = data.column(DataSplit.TARGET_COLUMN);
        int lastMeasured = -1;
        for (int r = 0; r < load.length; r++) {
            if (!Double.isNaN(load[r])) {
                lastMeasured = r;
            }
        }
        if (lastMeasured == load.length - 1) {
            throw new InsufficientLoadDataException("Input data has no timestamps without load, nothing to forecast.");
        }
        return new ForecastWindow(index.get(lastMeasured + 1), index.get(index.size() - 1));
    }

    /** Rows of {@code data} inside the window, target column dropped. */
    public TimeSeriesTable select(TimeSeriesTable data) {
        return data.between(start, end).withoutColumn(DataSplit.TARGET_COLUMN);
    }
}
