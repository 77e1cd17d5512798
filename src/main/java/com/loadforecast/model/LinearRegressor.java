package com.loadforecast.model;

import com.loadforecast.table.TimeSeriesTable;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordinary least squares with an intercept, preceded by per-column imputation of missing
 * feature values. A tiny ridge term keeps the normal equations solvable for constant or
 * collinear features.
 */
public class LinearRegressor implements Regressor {

    public static final String IMPUTATION_STRATEGY = "imputation_strategy";

    private static final double RIDGE = 1e-8;

    private ImputationStrategy imputationStrategy = ImputationStrategy.MEAN;
    private List<String> featureNames = List.of();
    private double[] fillValues = new double[0];
    private double[] coefficients = new double[0];
    private double intercept;
    private Map<String, Double> importance = Map.of();

    @Override
    public ModelFamily family() {
        return ModelFamily.LINEAR;
    }

    @Override
    public Map<String, Object> getParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(IMPUTATION_STRATEGY, imputationStrategy.getId());
        return params;
    }

    @Override
    public void setParams(Map<String, ?> params) {
        params.forEach((key, value) -> {
            if (!IMPUTATION_STRATEGY.equals(key)) {
                throw new IllegalArgumentException("LinearRegressor does not accept parameter '" + key + "'");
            }
            imputationStrategy = ImputationStrategy.fromId(String.valueOf(value));
        });
    }

    @Override
    public void fit(TimeSeriesTable features, double[] target, FitOptions options) {
        featureNames = features.columnNames();
        int p = featureNames.size();
        fillValues = new double[p];
        for (int c = 0; c < p; c++) {
            fillValues[c] = imputationStrategy.fillValue(features.column(featureNames.get(c)));
        }

        List<double[]> rows = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        double[][] x = impute(features);
        for (int r = 0; r < x.length; r++) {
            if (!Double.isNaN(target[r])) {
                double[] row = new double[p + 1];
                row[0] = 1.0;
                System.arraycopy(x[r], 0, row, 1, p);
                rows.add(row);
                y.add(target[r]);
            }
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a linear model without target values");
        }

        RealMatrix design = new Array2DRowRealMatrix(rows.toArray(new double[0][]), false);
        RealVector response = new ArrayRealVector(y.stream().mapToDouble(Double::doubleValue).toArray(), false);
        RealMatrix normal = design.transpose().multiply(design);
        for (int i = 1; i <= p; i++) {
            normal.addToEntry(i, i, RIDGE * Math.max(1.0, normal.getEntry(i, i)));
        }
        RealVector solution = new LUDecomposition(normal).getSolver()
            .solve(design.transpose().operate(response));

        intercept = solution.getEntry(0);
        coefficients = new double[p];
        for (int c = 0; c < p; c++) {
            coefficients[c] = solution.getEntry(c + 1);
        }
        importance = computeImportance(x);

        // single pass: report once so callbacks see the same contract as iterative models
        if (!options.callbacks().isEmpty()) {
            IterationEvaluation evaluation = evaluate(options);
            for (FitCallback callback : options.callbacks()) {
                if (callback.afterIteration(evaluation)) {
                    break;
                }
            }
        }
    }

    @Override
    public double[] predict(TimeSeriesTable features) {
        if (coefficients.length != featureNames.size()) {
            throw new IllegalStateException("LinearRegressor is not fitted");
        }
        double[][] x = impute(features.selectColumns(featureNames));
        double[] out = new double[x.length];
        for (int r = 0; r < x.length; r++) {
            double value = intercept;
            for (int c = 0; c < coefficients.length; c++) {
                value += coefficients[c] * x[r][c];
            }
            out[r] = value;
        }
        return out;
    }

    @Override
    public Map<String, Double> featureImportance() {
        return importance;
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }

    @Override
    public Set<Double> quantiles() {
        return Set.of();
    }

    @Override
    public LinearRegressor copy() {
        LinearRegressor copy = new LinearRegressor();
        copy.imputationStrategy = imputationStrategy;
        copy.featureNames = List.copyOf(featureNames);
        copy.fillValues = fillValues.clone();
        copy.coefficients = coefficients.clone();
        copy.intercept = intercept;
        copy.importance = Map.copyOf(importance);
        return copy;
    }

    private double[][] impute(TimeSeriesTable features) {
        double[][] x = features.toMatrix();
        for (double[] row : x) {
            for (int c = 0; c < row.length && c < fillValues.length; c++) {
                if (Double.isNaN(row[c])) {
                    row[c] = fillValues[c];
                }
            }
        }
        return x;
    }

    private Map<String, Double> computeImportance(double[][] x) {
        double[] raw = new double[coefficients.length];
        double total = 0.0;
        for (int c = 0; c < coefficients.length; c++) {
            double[] column = new double[x.length];
            for (int r = 0; r < x.length; r++) {
                column[r] = x[r][c];
            }
            double spread = x.length > 1 ? new StandardDeviation().evaluate(column) : 0.0;
            raw[c] = Math.abs(coefficients[c]) * spread;
            total += raw[c];
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (int c = 0; c < raw.length; c++) {
            out.put(featureNames.get(c), total > 0 ? raw[c] / total : 0.0);
        }
        return Map.copyOf(out);
    }

    private IterationEvaluation evaluate(FitOptions options) {
        Map<String, Map<String, Double>> results = new LinkedHashMap<>();
        for (EvalSet evalSet : options.evalSets()) {
            double score = options.evalMetric().score(evalSet.target(), predict(evalSet.features()));
            results.put(evalSet.name(), Map.of(options.evalMetric().getMetricName(), score));
        }
        return new IterationEvaluation(0, results);
    }
}
