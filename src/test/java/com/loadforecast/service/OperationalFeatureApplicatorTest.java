package com.loadforecast.service;

import com.loadforecast.TestTables;
import com.loadforecast.dto.PredictionJob;
import com.loadforecast.features.FeatureFunctionProvider;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.table.TimeSeriesTable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class OperationalFeatureApplicatorTest {

    private final FeatureFunctionProvider constant = () -> Map.of("is_test_day", index -> {
        double[] out = new double[index.size()];
        Arrays.fill(out, 1.0);
        return out;
    });

    private final OperationalFeatureApplicator applicator = new OperationalFeatureApplicator(List.of(constant));

    @Test
    void addFeatures_ordersLoadFeaturesHorizon() {
        TimeSeriesTable data = TimeSeriesTable.builder(TestTables.index(TestTables.START, Duration.ofMinutes(15), 4))
            .column("temperature", new double[]{1, 2, 3, 4})
            .column("load", new double[]{5, 6, Double.NaN, Double.NaN})
            .column("unused", new double[4])
            .build();
        ModelSpecification spec = ModelSpecification.builder()
            .featureNames(List.of("is_test_day", "temperature", "wind", "horizon"))
            .build();
        PredictionJob job = PredictionJob.builder().id(1L).resolutionMinutes(15).build();

        TimeSeriesTable result = applicator.addFeatures(data, job, spec);

        assertThat(result.columnNames()).containsExactly("load", "is_test_day", "temperature", "wind", "horizon");
        assertThat(result.column("is_test_day")).containsOnly(1.0);
        assertThat(result.column("temperature")).containsExactly(1, 2, 3, 4);
        assertThat(result.column("wind")).containsOnly(Double.NaN);
        assertThat(result.column("horizon")).containsOnly(0.25);
    }

    @Test
    void addFeatures_withoutLoad_addsMissingLoad() {
        TimeSeriesTable data = TimeSeriesTable.builder(TestTables.index(TestTables.START, Duration.ofHours(1), 2))
            .column("temperature", new double[]{1, 2})
            .build();
        PredictionJob job = PredictionJob.builder().id(1L).resolutionMinutes(60).build();

        TimeSeriesTable result = applicator.addFeatures(data, job,
            ModelSpecification.builder().featureNames(List.of("temperature")).build());

        assertThat(result.column("load")).containsOnly(Double.NaN);
        assertThat(result.column("horizon")).containsOnly(1.0);
    }
}
