package com.loadforecast.service;

import com.loadforecast.TestTables;
import com.loadforecast.dto.PredictionJob;
import com.loadforecast.exception.DataPreparationException;
import com.loadforecast.exception.OngoingFlatlinerException;
import com.loadforecast.forecast.FallbackForecastGenerator;
import com.loadforecast.forecast.Forecast;
import com.loadforecast.forecast.ForecastSource;
import com.loadforecast.forecast.ForecastWindow;
import com.loadforecast.forecast.QuantileSorter;
import com.loadforecast.forecast.StandardDeviationConfidenceIntervalApplicator;
import com.loadforecast.model.FitOptions;
import com.loadforecast.model.LinearRegressor;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.model.TrainedModel;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class ForecastPipelineTest {

    private static final Instant NOW = Instant.parse("2024-01-04T00:00:00Z");

    @Mock
    private ModelRegistry modelRegistry;

    private TrainedModel model;
    private ModelSpecification specification;
    private TimeSeriesTable input;

    @BeforeEach
    void setUp() {
        TimeSeriesTable history = TestTables.linearDataset(3);
        LinearRegressor regressor = new LinearRegressor();
        regressor.fit(DataSplit.features(history), DataSplit.target(history), FitOptions.none());
        model = TrainedModel.snapshot(regressor);
        specification = ModelSpecification.builder()
            .id("307")
            .featureNames(List.of("temperature", "radiation"))
            .build();

        // three measured days followed by one day to forecast
        TimeSeriesTable fourDays = TestTables.linearDataset(4).withoutColumn(DataSplit.HORIZON_COLUMN);
        double[] load = fourDays.column(DataSplit.TARGET_COLUMN);
        Arrays.fill(load, 72, 96, Double.NaN);
        input = fourDays.withColumn(DataSplit.TARGET_COLUMN, load);
    }

    private ForecastPipeline pipeline(Map<String, DataPreparation> preparations) {
        return new ForecastPipeline(
            modelRegistry,
            new InputDataValidator(),
            new OperationalFeatureApplicator(List.of()),
            preparations,
            new FallbackForecastGenerator(Clock.fixed(NOW, ZoneOffset.UTC)),
            new StandardDeviationConfidenceIntervalApplicator(),
            new QuantileSorter());
    }

    private static PredictionJob.PredictionJobBuilder job() {
        return PredictionJob.builder()
            .id(307L)
            .name("Substation North")
            .type("demand")
            .quantiles(List.of(0.1, 0.9))
            .minimalTableLength(10);
    }

    @Test
    void createForecast_completeInput_usesModel() {
        Forecast forecast = pipeline(Map.of()).createForecast(job().build(), input, model, specification);

        TimeSeriesTable values = forecast.getValues();
        assertThat(forecast.getSource()).isEqualTo(ForecastSource.MODEL);
        assertThat(values.rowCount()).isEqualTo(24);
        assertThat(values.getIndex().get(0)).isEqualTo(NOW);

        double[] expected = TestTables.linearDataset(4).column(DataSplit.TARGET_COLUMN);
        double[] predicted = values.column(Forecast.FORECAST_COLUMN);
        for (int i = 0; i < predicted.length; i++) {
            assertThat(predicted[i]).isCloseTo(expected[72 + i], within(1e-4));
        }
        assertThat(values.column(Forecast.STDEV_COLUMN)).containsOnly(0.0);
        assertThat(forecast.quantileColumns()).containsExactly("quantile_P10", "quantile_P90");
    }

    @Test
    void createForecast_attachesJobMetadata() {
        Forecast forecast = pipeline(Map.of()).createForecast(job().build(), input, model, specification);

        assertThat(forecast.getAttributes())
            .containsEntry("pid", "307")
            .containsEntry("customer", "Substation North")
            .containsEntry("description", "Substation North")
            .containsEntry("type", "demand")
            .containsEntry("algtype", "linear")
            .containsEntry("forecast_type", "model");
    }

    @Test
    void createForecast_insufficientInput_fallsBackToExtremeDay(CapturedOutput output) {
        PredictionJob job = job().minimalTableLength(1000).build();

        Forecast forecast = pipeline(Map.of()).createForecast(job, input, model, specification);

        assertThat(forecast.getSource()).isEqualTo(ForecastSource.FALLBACK);
        assertThat(forecast.getAttributes()).containsEntry("forecast_type", "fallback");
        // the highest load was measured on 2024-01-03, which is replayed for the next day
        double[] extremeDay = Arrays.copyOfRange(input.column(DataSplit.TARGET_COLUMN), 48, 72);
        assertThat(forecast.getValues().column(Forecast.FORECAST_COLUMN)).containsExactly(extremeDay);
        assertThat(output).contains("Using fallback forecast").contains("pid=307").contains("fallbackStrategy=extreme_day");
    }

    @Test
    void createForecast_incompleteFeatures_fallsBackToExtremeDay(CapturedOutput output) {
        double[] temperature = input.column("temperature");
        double[] radiation = input.column("radiation");
        Arrays.fill(temperature, 0, 80, Double.NaN);
        Arrays.fill(radiation, 0, 80, Double.NaN);
        TimeSeriesTable incomplete = input.withColumn("temperature", temperature).withColumn("radiation", radiation);
        PredictionJob job = job().completenessThreshold(0.7).build();

        Forecast forecast = pipeline(Map.of()).createForecast(job, incomplete, model, specification);

        assertThat(forecast.getSource()).isEqualTo(ForecastSource.FALLBACK);
        double[] extremeDay = Arrays.copyOfRange(input.column(DataSplit.TARGET_COLUMN), 48, 72);
        assertThat(forecast.getValues().column(Forecast.FORECAST_COLUMN)).containsExactly(extremeDay);
        assertThat(output).contains("WARN").contains("Using fallback forecast | pid=307");
    }

    @Test
    void createForecast_ongoingFlatliner_propagates() {
        double[] load = input.column(DataSplit.TARGET_COLUMN);
        Arrays.fill(load, 60, 72, 0.0);
        TimeSeriesTable flat = input.withColumn(DataSplit.TARGET_COLUMN, load);
        PredictionJob job = job().flatlinerThresholdMinutes(120).build();

        assertThatThrownBy(() -> pipeline(Map.of()).createForecast(job, flat, model, specification))
            .isInstanceOf(OngoingFlatlinerException.class);
    }

    @Test
    void createForecast_unknownDataPreparation_throws() {
        PredictionJob job = job().dataPrepClass("doesNotExist").build();

        assertThatThrownBy(() -> pipeline(Map.of()).createForecast(job, input, model, specification))
            .isInstanceOf(DataPreparationException.class)
            .hasMessageContaining("doesNotExist");
    }

    @Test
    void createForecast_customDataPreparation_replacesFeatureApplication() {
        DataPreparation firstHalfOnly = (forecastJob, validated, trained, spec) -> {
            TimeSeriesTable withHorizon = validated.withColumn(DataSplit.HORIZON_COLUMN, new double[validated.rowCount()]);
            TimeSeriesTable window = ForecastWindow.of(withHorizon).select(withHorizon);
            return new DataPreparation.PreparedInput(window.selectRows(new int[]{0, 1, 2}), withHorizon);
        };
        PredictionJob job = job().dataPrepClass("firstHalfOnly").build();

        Forecast forecast = pipeline(Map.of("firstHalfOnly", firstHalfOnly))
            .createForecast(job, input, model, specification);

        assertThat(forecast.getValues().rowCount()).isEqualTo(3);
    }

    @Test
    void createForecast_loadsModelOfAlternativeJob() {
        RegisteredModel registered = new RegisteredModel("42", "run-1", NOW, model, specification);
        when(modelRegistry.load("42", null)).thenReturn(registered);
        PredictionJob job = job().alternativeForecastModelPid(42L).build();

        Forecast forecast = pipeline(Map.of()).createForecast(job, input);

        assertThat(forecast.getSource()).isEqualTo(ForecastSource.MODEL);
        verify(modelRegistry).load("42", null);
    }
}
