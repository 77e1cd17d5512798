package com.loadforecast.service;

import com.loadforecast.dto.FallbackStrategy;
import com.loadforecast.dto.PredictionJob;
import com.loadforecast.exception.DataPreparationException;
import com.loadforecast.forecast.ConfidenceIntervalApplicator;
import com.loadforecast.forecast.FallbackForecastGenerator;
import com.loadforecast.forecast.Forecast;
import com.loadforecast.forecast.ForecastSource;
import com.loadforecast.forecast.ForecastWindow;
import com.loadforecast.forecast.QuantileSorter;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.model.TrainedModel;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the operational forecast of one prediction job: validate the input, build
 * features, forecast with the registered model or fall back to a heuristic when the
 * input is not complete enough, then add quantiles and job metadata.
 * <p>
 * Stateless; concurrent calls for different jobs share nothing mutable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastPipeline {

    private final ModelRegistry modelRegistry;
    private final InputDataValidator inputDataValidator;
    private final FeatureApplicator featureApplicator;
    private final Map<String, DataPreparation> dataPreparations;
    private final FallbackForecastGenerator fallbackForecastGenerator;
    private final ConfidenceIntervalApplicator confidenceIntervalApplicator;
    private final QuantileSorter quantileSorter;

    /**
     * Loads the job's model from the registry and forecasts.
     *
     * @throws com.loadforecast.exception.ModelNotFoundException    when no model is registered for the job
     * @throws com.loadforecast.exception.OngoingFlatlinerException when the recent load is flat
     */
    public Forecast createForecast(PredictionJob job, TimeSeriesTable inputData) {
        RegisteredModel registered = modelRegistry.load(job.modelExperimentName(), job.getModelRunId());
        log.info("Model loaded | pid={} | experiment={} | runId={} | algtype={}",
                 job.getId(), registered.experimentName(), registered.runId(), registered.model().path());
        return createForecast(job, inputData, registered.model(), registered.specification());
    }

    public Forecast createForecast(PredictionJob job, TimeSeriesTable inputData,
                                   TrainedModel model, ModelSpecification specification) {
        TimeSeriesTable validated = inputDataValidator.validate(
            job.getId(), inputData, job.getFlatlinerThresholdMinutes(), job.isDetectNonZeroFlatliner());

        DataPreparation.PreparedInput prepared = prepare(job, validated, model, specification);
        TimeSeriesTable forecastInput = prepared.forecastInput();

        Forecast forecast;
        if (inputDataValidator.isDataSufficient(prepared.dataWithFeatures(), job.getCompletenessThreshold(),
                                                job.getMinimalTableLength(), model)) {
            double[] predicted = model.predict(forecastInput);
            forecast = new Forecast(TimeSeriesTable.builder(forecastInput.getIndex())
                .column(Forecast.FORECAST_COLUMN, predicted)
                .build(), ForecastSource.MODEL);
        } else {
            log.warn("Using fallback forecast | pid={} | fallbackStrategy={}", job.getId(), strategyLabel(job));
            TimeSeriesTable fallback = fallbackForecastGenerator.generate(
                forecastInput.getIndex(),
                validated.selectColumns(List.of(DataSplit.TARGET_COLUMN)),
                job.getFallbackStrategy());
            forecast = new Forecast(fallback, ForecastSource.FALLBACK);
        }

        List<Double> quantiles = job.getQuantiles() != null ? job.getQuantiles() : List.of();
        forecast = confidenceIntervalApplicator.addConfidenceInterval(forecast, model, forecastInput, quantiles);
        forecast = quantileSorter.sort(forecast);
        forecast = forecast.withAttributes(metadata(job, model, forecast.getSource()));

        log.info("Forecast created | pid={} | rows={} | forecastType={}",
                 job.getId(), forecast.getValues().rowCount(), forecast.getSource().getId());
        return forecast;
    }

    private DataPreparation.PreparedInput prepare(PredictionJob job, TimeSeriesTable validated,
                                                  TrainedModel model, ModelSpecification specification) {
        String prepName = job.getDataPrepClass();
        if (prepName != null && !prepName.isBlank()) {
            DataPreparation preparation = dataPreparations.get(prepName);
            if (preparation == null) {
                throw new DataPreparationException("No data preparation named '" + prepName
                    + "', available: " + dataPreparations.keySet());
            }
            log.debug("Custom data preparation | pid={} | dataPrep={}", job.getId(), prepName);
            return preparation.prepareForecastData(job, validated, model, specification);
        }

        TimeSeriesTable withFeatures = featureApplicator.addFeatures(validated, job, specification);
        ForecastWindow window = ForecastWindow.of(withFeatures);
        return new DataPreparation.PreparedInput(window.select(withFeatures), withFeatures);
    }

    private static String strategyLabel(PredictionJob job) {
        String configured = job.getFallbackStrategy();
        return configured == null || configured.isBlank() ? FallbackStrategy.EXTREME_DAY.getId() : configured;
    }

    private static Map<String, String> metadata(PredictionJob job, TrainedModel model, ForecastSource source) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("pid", String.valueOf(job.getId()));
        attributes.put("customer", job.getName());
        attributes.put("description", job.getDescription() != null ? job.getDescription() : job.getName());
        attributes.put("type", job.getType());
        attributes.put("algtype", model.path());
        attributes.put("forecast_type", source.getId());
        return attributes;
    }
}
