package com.loadforecast.tuning;

import com.loadforecast.exception.InvalidTuningSetupException;
import com.loadforecast.model.EvalMetric;
import com.loadforecast.model.Regressor;
import com.loadforecast.model.StandardDeviationGenerator;
import com.loadforecast.split.DataSplitter;
import com.loadforecast.split.SplitOptions;
import com.loadforecast.table.TimeSeriesTable;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Creates one {@link RegressorObjective} per tuning session, picking the family variant by
 * the model's {@link com.loadforecast.model.ModelFamily}.
 */
@Service
@RequiredArgsConstructor
public class RegressorObjectiveFactory {

    private final ObjectiveVariantRegistry variantRegistry;
    private final DataSplitter dataSplitter;
    private final StandardDeviationGenerator standardDeviationGenerator;

    @Value("${forecast.tuning.test-fraction:0.15}")
    private double testFraction;

    @Value("${forecast.tuning.validation-fraction:0.15}")
    private double validationFraction;

    @Value("${forecast.tuning.eval-metric:mae}")
    private String evalMetric;

    @Value("${forecast.tuning.split-seed:42}")
    private long splitSeed;

    public RegressorObjective create(Regressor model, TimeSeriesTable inputData) {
        return create(model, inputData, new SplitOptions(true, true, splitSeed));
    }

    public RegressorObjective create(Regressor model, TimeSeriesTable inputData, SplitOptions splitOptions) {
        return create(model, inputData, splitOptions, testFraction, validationFraction, resolveMetric());
    }

    public RegressorObjective create(Regressor model, TimeSeriesTable inputData, SplitOptions splitOptions,
                                     double testFraction, double validationFraction, EvalMetric metric) {
        return new RegressorObjective(variantRegistry.forFamily(model.family()), model, inputData,
            dataSplitter, splitOptions, testFraction, validationFraction, metric, standardDeviationGenerator);
    }

    private EvalMetric resolveMetric() {
        try {
            return EvalMetric.fromName(evalMetric);
        } catch (IllegalArgumentException ex) {
            throw new InvalidTuningSetupException("Configured eval metric is not supported: " + evalMetric);
        }
    }
}
