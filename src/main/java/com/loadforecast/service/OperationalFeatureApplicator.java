package com.loadforecast.service;

import com.loadforecast.dto.PredictionJob;
import com.loadforecast.features.FeatureFunction;
import com.loadforecast.features.FeatureFunctionProvider;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.split.DataSplit;
import com.loadforecast.table.TimeSeriesTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature application for a single operational horizon. Each requested feature is
 * taken from the input when present, else computed by a registered feature function,
 * else added as an all-missing column.
 */
@Slf4j
@Component
public class OperationalFeatureApplicator implements FeatureApplicator {

    private final Map<String, FeatureFunction> functions = new HashMap<>();

    public OperationalFeatureApplicator(List<FeatureFunctionProvider> providers) {
        providers.forEach(p -> functions.putAll(p.featureFunctions()));
    }

    @Override
    public TimeSeriesTable addFeatures(TimeSeriesTable validatedData, PredictionJob job, ModelSpecification specification) {
        TimeSeriesTable.Builder builder = TimeSeriesTable.builder(validatedData.getIndex());
        if (validatedData.hasColumn(DataSplit.TARGET_COLUMN)) {
            builder.column(DataSplit.TARGET_COLUMN, validatedData.column(DataSplit.TARGET_COLUMN));
        } else {
            builder.constantColumn(DataSplit.TARGET_COLUMN, Double.NaN);
        }

        List<String> missing = new ArrayList<>();
        for (String feature : specification.getFeatureNames()) {
            if (feature.equals(DataSplit.TARGET_COLUMN) || feature.equals(DataSplit.HORIZON_COLUMN)) {
                continue;
            }
            if (validatedData.hasColumn(feature)) {
                builder.column(feature, validatedData.column(feature));
            } else if (functions.containsKey(feature)) {
                builder.column(feature, functions.get(feature).apply(validatedData.getIndex()));
            } else {
                missing.add(feature);
                builder.constantColumn(feature, Double.NaN);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Features not available, added as missing | pid={} | features={}", job.getId(), missing);
        }

        builder.constantColumn(DataSplit.HORIZON_COLUMN, job.getResolutionMinutes() / 60.0);
        return builder.build();
    }
}
