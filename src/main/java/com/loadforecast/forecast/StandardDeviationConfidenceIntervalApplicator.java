package com.loadforecast.forecast;

import com.loadforecast.model.ResidualStandardDeviation;
import com.loadforecast.model.TrainedModel;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives quantiles from the model's residual standard deviation, assuming normally
 * distributed errors. Model forecasts from a model with a dedicated quantile model use
 * that model's prediction instead.
 */
@Slf4j
@Component
public class StandardDeviationConfidenceIntervalApplicator implements ConfidenceIntervalApplicator {

    private final NormalDistribution standardNormal = new NormalDistribution(null, 0.0, 1.0);

    @Override
    public Forecast addConfidenceInterval(Forecast forecast, TrainedModel model, TimeSeriesTable forecastInput,
                                          List<Double> quantiles) {
        TimeSeriesTable values = forecast.getValues();
        double[] point = values.column(Forecast.FORECAST_COLUMN);
        double[] stdev = standardDeviation(values.getIndex(), model.getStandardDeviation(), forecastInput);
        values = values.withColumn(Forecast.STDEV_COLUMN, stdev);

        boolean modelForecast = forecast.getSource() == ForecastSource.MODEL;
        for (double q : quantiles) {
            double[] column;
            if (modelForecast && model.quantiles().contains(q)) {
                column = model.predictQuantile(forecastInput, q);
            } else {
                double z = standardNormal.inverseCumulativeProbability(q);
                column = new double[point.length];
                for (int r = 0; r < point.length; r++) {
                    column[r] = point[r] + stdev[r] * z;
                }
            }
            values = values.withColumn(Forecast.quantileColumn(q), column);
        }
        return forecast.withValues(values);
    }

    private double[] standardDeviation(List<Instant> index, ResidualStandardDeviation residuals,
                                       TimeSeriesTable forecastInput) {
        double[] stdev = new double[index.size()];
        if (residuals.isEmpty() || index.isEmpty()) {
            log.debug("No residual standard deviation available, quantiles collapse onto the forecast");
            return stdev;
        }
        Map<Instant, Double> horizons = horizonsByTimestamp(forecastInput);
        Instant start = index.get(0);
        for (int r = 0; r < stdev.length; r++) {
            Instant t = index.get(r);
            double horizon = horizons.getOrDefault(t, Duration.between(start, t).toMinutes() / 60.0);
            double value = residuals.lookup(t.atZone(ZoneOffset.UTC).getHour(), horizon);
            stdev[r] = Double.isNaN(value) ? 0.0 : value;
        }
        return stdev;
    }

    private static Map<Instant, Double> horizonsByTimestamp(TimeSeriesTable forecastInput) {
        Map<Instant, Double> horizons = new HashMap<>();
        if (forecastInput.hasColumn(DataSplit.HORIZON_COLUMN)) {
            double[] h = forecastInput.column(DataSplit.HORIZON_COLUMN);
            for (int r = 0; r < h.length; r++) {
                horizons.put(forecastInput.getIndex().get(r), h[r]);
            }
        }
        return horizons;
    }
}
