package com.loadforecast.tuning;

import com.loadforecast.exception.ColumnOrderException;
import com.loadforecast.exception.InvalidTuningSetupException;
import com.loadforecast.exception.TrialPrunedException;
import com.loadforecast.model.EvalMetric;
import com.loadforecast.model.EvalSet;
import com.loadforecast.model.FitCallback;
import com.loadforecast.model.FitOptions;
import com.loadforecast.model.Regressor;
import com.loadforecast.model.StandardDeviationGenerator;
import com.loadforecast.model.TrainedModel;
import com.loadforecast.split.DataSplit;
import com.loadforecast.split.DataSplitter;
import com.loadforecast.split.SplitOptions;
import com.loadforecast.table.TimeSeriesTable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-trial tuning objective for one model family.
 * <p>
 * Each evaluation fits a private copy of the model under tuning, so trials may be
 * evaluated concurrently or out of order. The split is computed once, on the first
 * evaluation, and shared read-only afterwards. Results are appended to the
 * {@link TrialLog} the caller passes in.
 */
@Slf4j
public class RegressorObjective {

    public static final String MODEL_ATTRIBUTE = "model";

    @Getter
    private final ObjectiveVariant variant;
    private final Regressor model;
    private final TimeSeriesTable inputData;
    private final DataSplitter splitter;
    private final SplitOptions splitOptions;
    @Getter
    private final double testFraction;
    @Getter
    private final double validationFraction;
    @Getter
    private final EvalMetric evalMetric;
    private final StandardDeviationGenerator standardDeviationGenerator;

    private DataSplit dataSplit;

    RegressorObjective(ObjectiveVariant variant, Regressor model, TimeSeriesTable inputData,
                       DataSplitter splitter, SplitOptions splitOptions,
                       double testFraction, double validationFraction, EvalMetric evalMetric,
                       StandardDeviationGenerator standardDeviationGenerator) {
        if (variant.family() != model.family()) {
            throw new InvalidTuningSetupException("Objective for " + variant.family()
                + " cannot tune a " + model.family() + " model");
        }
        this.variant = variant;
        this.model = model.copy();
        this.inputData = inputData;
        this.splitter = splitter;
        this.splitOptions = splitOptions;
        this.testFraction = testFraction;
        this.validationFraction = validationFraction;
        this.evalMetric = evalMetric;
        this.standardDeviationGenerator = standardDeviationGenerator;
    }

    /**
     * Scalar score of one trial, lower is better.
     */
    public double score(TrialContext trial, TrialLog trialLog) {
        return evaluate(trial, trialLog).score();
    }

    /**
     * Fits and scores the model for the hyperparameters suggested by {@code trial}.
     *
     * @throws ColumnOrderException  when the split violates the column contract; no model call is made
     * @throws TrialPrunedException  when the driver prunes the trial during the fit
     */
    public Trial evaluate(TrialContext trial, TrialLog trialLog) {
        DataSplit split = dataSplit();

        TimeSeriesTable trainX = DataSplit.features(split.train());
        double[] trainY = DataSplit.target(split.train());
        TimeSeriesTable validX = DataSplit.features(split.validation());
        double[] validY = DataSplit.target(split.validation());
        TimeSeriesTable testX = DataSplit.features(split.test());
        double[] testY = DataSplit.target(split.test());

        List<EvalSet> evalSets = List.of(
            new EvalSet(variant.evalSetName(0), trainX, trainY),
            new EvalSet(variant.evalSetName(1), validX, validY));

        Map<String, Object> hyperParams = variant.parameterSpace(trial, model.getParams().keySet());

        Regressor candidate = model.copy();
        candidate.setParams(hyperParams);

        List<FitCallback> callbacks = new ArrayList<>();
        variant.earlyStoppingHook(evalMetric).ifPresent(callbacks::add);
        variant.pruningHook(trial, evalMetric).ifPresent(callbacks::add);

        try {
            candidate.fit(trainX, trainY, new FitOptions(evalSets, evalMetric, callbacks));
        } catch (TrialPrunedException ex) {
            log.info("Trial pruned | trial={} | family={} | {}", trial.number(), variant.family(), ex.getMessage());
            throw ex;
        }

        TrainedModel trained = standardDeviationGenerator.generate(TrainedModel.snapshot(candidate), split.validation());

        double score = evalMetric.score(testY, trained.predict(testX));
        Trial result = new Trial(trial.number(), hyperParams, score, trained);
        trialLog.append(result);
        trial.setUserAttribute(MODEL_ATTRIBUTE, trained);

        log.debug("Trial finished | trial={} | family={} | {}={}", trial.number(), variant.family(),
            evalMetric.getMetricName(), score);
        return result;
    }

    /** The split, computed on first use and verified against the column contract. */
    public synchronized DataSplit dataSplit() {
        if (dataSplit == null) {
            DataSplit split = splitter.split(inputData, testFraction, validationFraction, splitOptions);
            try {
                split.verifyColumnOrder();
            } catch (ColumnOrderException ex) {
                log.error("Aborting tuning of {} model: {}", variant.family(), ex.getMessage());
                throw ex;
            }
            dataSplit = split;
        }
        return dataSplit;
    }

    public Map<String, Object> defaultValues() {
        return variant.defaultValues();
    }

    public ModelReport createReport(TrainedModel trained) {
        DataSplit split = dataSplit();
        return ModelReport.builder()
            .modelPath(trained.path())
            .train(metrics(trained, split.train()))
            .validation(metrics(trained, split.validation()))
            .test(metrics(trained, split.test()))
            .build();
    }

    private ModelReport.SplitMetrics metrics(TrainedModel trained, TimeSeriesTable subset) {
        if (subset.isEmpty()) {
            return ModelReport.SplitMetrics.builder().sampleCount(0).build();
        }
        double[] actual = DataSplit.target(subset);
        double[] predicted = trained.predict(DataSplit.features(subset));
        return ModelReport.SplitMetrics.builder()
            .sampleCount(subset.rowCount())
            .mae(round(EvalMetric.MAE.score(actual, predicted)))
            .rmse(round(EvalMetric.RMSE.score(actual, predicted)))
            .build();
    }

    private Double round(double value) {
        if (Double.isNaN(value)) {
            return null;
        }
        return Math.round(value * 10000.0) / 10000.0;
    }
}
