package com.loadforecast.controller;

import com.loadforecast.TestTables;
import com.loadforecast.dto.ForecastRequest;
import com.loadforecast.dto.MeasurementPoint;
import com.loadforecast.dto.PredictionJob;
import com.loadforecast.model.FitOptions;
import com.loadforecast.model.LinearRegressor;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.model.TrainedModel;
import com.loadforecast.service.InMemoryModelRegistry;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ForecastControllerIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-01-04T00:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired TestRestTemplate restTemplate;
    @Autowired InMemoryModelRegistry modelRegistry;

    @BeforeEach
    void registerModel() {
        TimeSeriesTable history = TestTables.linearDataset(3);
        LinearRegressor regressor = new LinearRegressor();
        regressor.fit(DataSplit.features(history), DataSplit.target(history), FitOptions.none());
        modelRegistry.save("307", TrainedModel.snapshot(regressor), ModelSpecification.builder()
            .featureNames(List.of("temperature", "radiation"))
            .hyperparameters(Map.of(LinearRegressor.IMPUTATION_STRATEGY, "mean"))
            .build());
    }

    private static PredictionJob.PredictionJobBuilder job(long id) {
        return PredictionJob.builder()
            .id(id)
            .name("Substation North")
            .type("demand")
            .quantiles(List.of(0.05, 0.5, 0.95))
            .minimalTableLength(10);
    }

    /** Three measured days, then one day of weather without load. */
    private static List<MeasurementPoint> measurements() {
        TimeSeriesTable data = TestTables.linearDataset(4);
        List<MeasurementPoint> points = new ArrayList<>();
        for (int r = 0; r < data.rowCount(); r++) {
            points.add(MeasurementPoint.builder()
                .timestamp(data.getIndex().get(r))
                .load(r < 72 ? data.value(r, "load") : null)
                .features(Map.of("temperature", data.value(r, "temperature"),
                                 "radiation", data.value(r, "radiation")))
                .build());
        }
        return points;
    }

    @Test
    @SuppressWarnings("unchecked")
    void forecast_returnsCreatedWithPoints() {
        ForecastRequest request = ForecastRequest.builder().job(job(307).build()).measurements(measurements()).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isNotBlank();
        assertThat(resp.getBody()).containsEntry("forecastType", "model").containsEntry("algtype", "linear");
        List<Map<String, Object>> points = (List<Map<String, Object>>) resp.getBody().get("points");
        assertThat(points).hasSize(24);
        assertThat(points.get(0)).containsEntry("timestamp", "2024-01-04T00:00:00Z");
        assertThat((Map<String, Object>) points.get(0).get("quantiles"))
            .containsOnlyKeys("quantile_P05", "quantile_P50", "quantile_P95");
    }

    @Test
    void forecast_echoesRequestIdHeader() {
        ForecastRequest request = ForecastRequest.builder().job(job(307).build()).measurements(measurements()).build();
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "req-123");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts",
            new HttpEntity<>(request, headers), Map.class);

        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("req-123");
        assertThat(resp.getBody()).containsEntry("requestId", "req-123");
    }

    @Test
    void forecast_unknownModel_returns404() {
        ForecastRequest request = ForecastRequest.builder().job(job(999).build()).measurements(measurements()).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).containsEntry("errorCode", "MODEL_NOT_FOUND");
    }

    @Test
    void forecast_invalidJob_returns422() {
        ForecastRequest request = ForecastRequest.builder()
            .job(job(307).name("").build())
            .measurements(measurements())
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void forecast_flatlinerInput_returns422() {
        List<MeasurementPoint> flat = new ArrayList<>();
        for (MeasurementPoint p : measurements()) {
            flat.add(MeasurementPoint.builder()
                .timestamp(p.getTimestamp())
                .load(p.getLoad() != null ? 0.0 : null)
                .features(p.getFeatures())
                .build());
        }
        ForecastRequest request = ForecastRequest.builder()
            .job(job(307).flatlinerThresholdMinutes(60).build())
            .measurements(flat)
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsEntry("errorCode", "INPUT_DATA_ONGOING_FLATLINER");
    }

    @Test
    void latestModel_describesRegisteredModel() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/307", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("experimentName", "307").containsEntry("algtype", "linear");
    }
}
