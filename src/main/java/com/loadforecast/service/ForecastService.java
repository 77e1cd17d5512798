package com.loadforecast.service;

import com.loadforecast.dto.ForecastRequest;
import com.loadforecast.dto.ForecastResponse;
import com.loadforecast.dto.MeasurementPoint;
import com.loadforecast.dto.PredictionJob;
import com.loadforecast.exception.TooManyMeasurementsException;
import com.loadforecast.forecast.Forecast;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps forecast requests onto the pipeline's table model and back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final ForecastPipeline forecastPipeline;

    @Value("${forecast.api.max-measurements:20000}")
    private int maxMeasurements;

    public ForecastResponse forecast(ForecastRequest request, String requestId) {
        PredictionJob job = request.getJob();
        if (request.getMeasurements().size() > maxMeasurements) {
            throw new TooManyMeasurementsException(request.getMeasurements().size(), maxMeasurements);
        }
        TimeSeriesTable input = toTable(request.getMeasurements());
        Forecast forecast = forecastPipeline.createForecast(job, input);
        return toResponse(forecast, job, requestId);
    }

    static TimeSeriesTable toTable(List<MeasurementPoint> measurements) {
        List<MeasurementPoint> sorted = new ArrayList<>(measurements);
        sorted.sort(Comparator.comparing(MeasurementPoint::getTimestamp));

        List<Instant> index = new ArrayList<>(sorted.size());
        TreeSet<String> featureNames = new TreeSet<>();
        for (MeasurementPoint p : sorted) {
            index.add(p.getTimestamp());
            if (p.getFeatures() != null) {
                featureNames.addAll(p.getFeatures().keySet());
            }
        }

        double[] load = new double[sorted.size()];
        for (int r = 0; r < load.length; r++) {
            Double value = sorted.get(r).getLoad();
            load[r] = value != null ? value : Double.NaN;
        }
        TimeSeriesTable.Builder builder = TimeSeriesTable.builder(index).column(DataSplit.TARGET_COLUMN, load);
        for (String feature : featureNames) {
            double[] values = new double[sorted.size()];
            for (int r = 0; r < values.length; r++) {
                Map<String, Double> features = sorted.get(r).getFeatures();
                Double value = features != null ? features.get(feature) : null;
                values[r] = value != null ? value : Double.NaN;
            }
            builder.column(feature, values);
        }
        return builder.build();
    }

    private ForecastResponse toResponse(Forecast forecast, PredictionJob job, String requestId) {
        TimeSeriesTable values = forecast.getValues();
        List<String> quantileColumns = forecast.quantileColumns();
        boolean hasStdev = values.hasColumn(Forecast.STDEV_COLUMN);

        List<ForecastResponse.Point> points = new ArrayList<>(values.rowCount());
        for (int r = 0; r < values.rowCount(); r++) {
            Map<String, Double> quantiles = new LinkedHashMap<>();
            for (String column : quantileColumns) {
                quantiles.put(column, finiteOrNull(values.value(r, column)));
            }
            points.add(ForecastResponse.Point.builder()
                .timestamp(values.getIndex().get(r))
                .forecast(finiteOrNull(values.value(r, Forecast.FORECAST_COLUMN)))
                .stdev(hasStdev ? finiteOrNull(values.value(r, Forecast.STDEV_COLUMN)) : null)
                .quantiles(quantiles)
                .build());
        }

        return ForecastResponse.builder()
            .pid(job.getId())
            .algtype(forecast.getAttributes().get("algtype"))
            .forecastType(forecast.getSource().getId())
            .metadata(forecast.getAttributes())
            .points(points)
            .requestId(requestId)
            .build();
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
