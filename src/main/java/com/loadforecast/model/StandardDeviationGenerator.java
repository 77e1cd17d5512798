package com.loadforecast.model;

import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Derives residual-based uncertainty from a validation set: for every horizon present,
 * the model predicts the validation rows and the sample standard deviation of the
 * residuals is taken per hour of day (UTC).
 */
@Component
public class StandardDeviationGenerator {

    public TrainedModel generate(TrainedModel model, TimeSeriesTable validation) {
        if (validation.isEmpty()) {
            return model.withStandardDeviation(ResidualStandardDeviation.empty());
        }
        double[] horizons = validation.column(DataSplit.HORIZON_COLUMN);
        List<ResidualStandardDeviation.Entry> entries = new ArrayList<>();

        for (double horizon : Arrays.stream(horizons).distinct().sorted().toArray()) {
            TimeSeriesTable subset = validation.filterRows(r -> horizons[r] == horizon);
            double[] realised = subset.column(DataSplit.TARGET_COLUMN);
            double[] predicted = model.predict(DataSplit.features(subset));

            TreeMap<Integer, List<Double>> residualsByHour = new TreeMap<>();
            IntStream.range(0, subset.rowCount())
                .filter(r -> !Double.isNaN(realised[r]) && !Double.isNaN(predicted[r]))
                .forEach(r -> residualsByHour
                    .computeIfAbsent(subset.getIndex().get(r).atZone(ZoneOffset.UTC).getHour(), h -> new ArrayList<>())
                    .add(realised[r] - predicted[r]));

            residualsByHour.forEach((hour, residuals) -> {
                if (residuals.size() > 1) {
                    double stdev = new StandardDeviation()
                        .evaluate(residuals.stream().mapToDouble(Double::doubleValue).toArray());
                    entries.add(new ResidualStandardDeviation.Entry(horizon, hour, stdev));
                }
            });
        }
        return model.withStandardDeviation(new ResidualStandardDeviation(entries));
    }
}
