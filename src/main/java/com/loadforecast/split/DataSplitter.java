package com.loadforecast.split;

import com.loadforecast.table.TimeSeriesTable;

public interface DataSplitter {

    /**
     * Partitions a feature-augmented dataset. Deterministic for identical input and options.
     */
    DataSplit split(TimeSeriesTable data, double testFraction, double validationFraction, SplitOptions options);
}
