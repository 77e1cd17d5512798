package com.loadforecast.model;

import com.loadforecast.TestTables;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StandardDeviationGeneratorTest {

    private final StandardDeviationGenerator generator = new StandardDeviationGenerator();

    @Test
    void generate_sampleStdevPerHourAndHorizon() {
        TimeSeriesTable train = TestTables.linearDataset(3);
        LinearRegressor regressor = new LinearRegressor();
        regressor.fit(DataSplit.features(train), DataSplit.target(train), FitOptions.none());

        // residuals at 05:00 become +1 and -1 on alternating days
        TimeSeriesTable validation = TestTables.linearDataset(4);
        double[] load = validation.column("load");
        for (int day = 0; day < 4; day++) {
            load[day * 24 + 5] += day % 2 == 0 ? 1.0 : -1.0;
        }

        TrainedModel trained = generator.generate(TrainedModel.snapshot(regressor), validation.withColumn("load", load));

        ResidualStandardDeviation stdev = trained.getStandardDeviation();
        // sample stdev of {1, -1, 1, -1} = sqrt(4 / 3)
        assertThat(stdev.lookup(5, 0.25)).isCloseTo(Math.sqrt(4.0 / 3.0), within(1e-3));
        assertThat(stdev.lookup(6, 0.25)).isCloseTo(0.0, within(1e-3));
        assertThat(stdev.lookup(6, 48.0)).isCloseTo(0.0, within(1e-3));
    }

    @Test
    void generate_emptyValidation_leavesNoEstimates() {
        TimeSeriesTable train = TestTables.linearDataset(2);
        LinearRegressor regressor = new LinearRegressor();
        regressor.fit(DataSplit.features(train), DataSplit.target(train), FitOptions.none());

        TrainedModel trained = generator.generate(TrainedModel.snapshot(regressor), train.filterRows(r -> false));

        assertThat(trained.getStandardDeviation().isEmpty()).isTrue();
        assertThat(trained.getStandardDeviation().lookup(5, 0.25)).isNaN();
    }
}
