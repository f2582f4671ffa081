/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.analysis.core.analyzer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

import ml.shifu.analysis.chart.Chart;
import ml.shifu.analysis.chart.ChartProvider;
import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.ConfusionMatrixObject;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.container.FittedRegression;
import ml.shifu.analysis.container.PerformanceObject;
import ml.shifu.analysis.container.RegressionFit;
import ml.shifu.analysis.core.eval.ConfusionMatrixCalculator;
import ml.shifu.analysis.di.builtin.AbstractRegressionBackend;
import ml.shifu.analysis.di.builtin.FullRegressionBackend;
import ml.shifu.analysis.di.spi.RegressionBackend;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Constants;

/**
 * Linear, polynomial, multiple and logistic regression. Estimation is delegated to the injected
 * {@link RegressionBackend}; this class prepares the design, shapes the output and draws the charts.
 * 
 * <p>
 * {@link #fit(String, List, RegressionType, int)} returns an immutable {@link FittedRegression}.
 * {@link #analyze(String, List, RegressionType, int, boolean)} additionally keeps the last model on the instance for
 * {@link #predict(DataTable)} and {@link #modelDiagnostics()}.
 */
public class RegressionAnalyzer extends AbstractAnalyzer {

    private static Logger log = LoggerFactory.getLogger(RegressionAnalyzer.class);

    public static final String ANALYSIS_TYPE = "regression";

    public static final int DEFAULT_DEGREE = 2;

    private static final int CURVE_POINTS = 100;

    private final RegressionBackend backend;

    private FittedRegression model;

    public RegressionAnalyzer() {
        this(new FullRegressionBackend(), null);
    }

    public RegressionAnalyzer(Dataset dataset) {
        this();
        setDataset(dataset);
    }

    @Inject
    public RegressionAnalyzer(RegressionBackend backend, ChartProvider chartProvider) {
        super(chartProvider);
        this.backend = backend;
    }

    /**
     * Reads {@code dependent_var}, {@code independent_vars}, {@code regression_type}, {@code polynomial_degree} and
     * {@code include_charts} from the parameters.
     */
    @Override
    public AnalysisResult analyze() {
        String dependent = param("dependent_var", null);
        if(dependent == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Parameter dependent_var is required");
        }
        List<String> independents = listParam("independent_vars");
        if(independents == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Parameter independent_vars is required");
        }
        Object type = parameters.get("regression_type");
        RegressionType regressionType = type == null ? RegressionType.LINEAR
                : type instanceof RegressionType ? (RegressionType) type : RegressionType.of(type.toString());
        return analyze(dependent, independents, regressionType, intParam("polynomial_degree", DEFAULT_DEGREE),
                boolParam("include_charts", true));
    }

    public AnalysisResult analyze(String dependentVar, List<String> independentVars, RegressionType type,
            int polynomialDegree, boolean includeCharts) {
        FittedRegression fitted = fit(dependentVar, independentVars, type, polynomialDegree);
        this.model = fitted;

        Map<String, Object> data = output(fitted);

        Map<String, Object> metadata = new LinkedHashMap<String, Object>();
        metadata.put(Constants.ANALYSIS_TYPE, ANALYSIS_TYPE);
        metadata.put("regression_type", fitted.getType().name().toLowerCase());
        metadata.put("dependent_var", dependentVar);
        metadata.put("independent_vars", new ArrayList<String>(independentVars));
        if(fitted.getType() == RegressionType.POLYNOMIAL) {
            metadata.put("polynomial_degree", fitted.getDegree());
        }
        metadata.put("sample_size", fitted.getObservationCount());
        metadata.put("backend", fitted.getBackendName());

        List<Chart> charts = includeCharts ? createCharts(fitted) : new ArrayList<Chart>();
        return createResult(data, metadata, charts);
    }

    public AnalysisResult linearRegression(String dependentVar, List<String> independentVars, boolean includeCharts) {
        return analyze(dependentVar, independentVars, RegressionType.LINEAR, DEFAULT_DEGREE, includeCharts);
    }

    public AnalysisResult polynomialRegression(String dependentVar, String independentVar, int degree,
            boolean includeCharts) {
        return analyze(dependentVar, Arrays.asList(independentVar), RegressionType.POLYNOMIAL, degree, includeCharts);
    }

    public AnalysisResult logisticRegression(String dependentVar, List<String> independentVars,
            boolean includeCharts) {
        return analyze(dependentVar, independentVars, RegressionType.LOGISTIC, DEFAULT_DEGREE, includeCharts);
    }

    /**
     * Fits a model on the complete rows of the named variables without touching the analyzer state.
     */
    public FittedRegression fit(String dependentVar, List<String> independentVars, RegressionType type, int degree) {
        validateDataset();
        if(independentVars == null || independentVars.isEmpty()) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "At least one independent variable is needed");
        }
        List<String> all = new ArrayList<String>();
        all.add(dependentVar);
        all.addAll(independentVars);
        requireNumericColumns(all);

        RegressionType actual = RegressionType.resolve(type, independentVars.size());
        if(actual != type) {
            log.info("{} regression with {} predictors is fitted as {}", type, independentVars.size(), actual);
        }
        if(actual == RegressionType.POLYNOMIAL && degree < 2) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Polynomial degree must be at least 2, got "
                    + degree);
        }
        int usedDegree = actual == RegressionType.POLYNOMIAL ? degree : 1;

        DataTable clean = table().dropMissing(all);
        int dropped = table().getRowCount() - clean.getRowCount();
        if(dropped > 0) {
            log.info("Dropped {} rows with missing values before the regression fit", dropped);
        }
        double[][] predictors = clean.toMatrix(independentVars);
        double[] response = clean.getColumn(dependentVar).toDoubleArray();
        if(actual == RegressionType.LOGISTIC) {
            for(double v: response) {
                if(v != 0d && v != 1d) {
                    throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Logistic regression needs a 0/1 "
                            + "dependent variable, found " + v + " in " + dependentVar);
                }
            }
        }

        List<String> termNames = termNames(actual, independentVars, usedDegree);
        double[][] design = FittedRegression.expand(actual, usedDegree, predictors);
        RegressionFit fit = actual == RegressionType.LOGISTIC ? backend.fitLogistic(design, response, termNames)
                : backend.fitLinear(design, response, termNames);
        log.debug("Fitted {} regression of {} on {} with the {} backend", actual, dependentVar, termNames,
                backend.getName());
        return new FittedRegression(actual, dependentVar, independentVars, usedDegree, termNames, backend.getName(),
                predictors, response, fit);
    }

    private static List<String> termNames(RegressionType type, List<String> independentVars, int degree) {
        if(type != RegressionType.POLYNOMIAL) {
            return new ArrayList<String>(independentVars);
        }
        List<String> names = new ArrayList<String>();
        for(int d = 1; d <= degree; d++) {
            names.add("x^" + d);
        }
        return names;
    }

    private Map<String, Object> output(FittedRegression fitted) {
        double[] coefficients = fitted.getCoefficients();
        List<String> termNames = fitted.getTermNames();
        Map<String, Double> keyed = new LinkedHashMap<String, Double>();
        keyed.put(AbstractRegressionBackend.INTERCEPT, coefficients[0]);
        for(int j = 0; j < termNames.size(); j++) {
            keyed.put(termNames.get(j), coefficients[j + 1]);
        }

        Map<String, Object> data = new LinkedHashMap<String, Object>();
        data.put("coefficients", keyed);
        data.put("intercept", coefficients[0]);
        data.put("equation", equation(fitted));
        if(fitted.isLogistic()) {
            double[] probs = fitted.getFitted();
            double[] labels = new double[probs.length];
            for(int i = 0; i < probs.length; i++) {
                labels[i] = probs[i] >= ConfusionMatrixCalculator.DEFAULT_THRESHOLD ? 1d : 0d;
            }
            data.put("predictions", labels);
            data.put("prediction_probs", probs);
            data.put("residuals", fitted.getResiduals());
            data.putAll(fitted.getStatistics());
            data.putAll(classificationMetrics(fitted));
        } else {
            data.put("predictions", fitted.getFitted());
            data.put("residuals", fitted.getResiduals());
            data.putAll(fitted.getStatistics());
        }
        return data;
    }

    static String equation(FittedRegression fitted) {
        double[] coefficients = fitted.getCoefficients();
        List<String> termNames = fitted.getTermNames();
        StringBuilder sb = new StringBuilder(fitted.isLogistic() ? "logit(p) = " : "y = ");
        sb.append(String.format("%.4f", coefficients[0]));
        for(int j = 0; j < termNames.size(); j++) {
            double c = coefficients[j + 1];
            sb.append(c < 0 ? " - " : " + ").append(String.format("%.4f", Math.abs(c))).append(termNames.get(j));
        }
        return sb.toString();
    }

    private static Map<String, Object> classificationMetrics(FittedRegression fitted) {
        ConfusionMatrixCalculator calculator = new ConfusionMatrixCalculator(fitted.getResponse(), fitted.getFitted());
        ConfusionMatrixObject cmo = calculator.atThreshold(ConfusionMatrixCalculator.DEFAULT_THRESHOLD);
        Map<String, Object> metrics = new LinkedHashMap<String, Object>();
        metrics.put("accuracy", cmo.getAccuracy());
        metrics.put("precision", cmo.getPrecision());
        metrics.put("recall", cmo.getRecall());
        metrics.put("f1_score", cmo.getF1());
        metrics.put("confusion_matrix", cmo.toMatrix());
        metrics.put("auc", calculator.auc());
        return metrics;
    }

    /**
     * Predictions for every row of {@code data}; probabilities for logistic models. Rows with a missing predictor get
     * NaN.
     */
    public double[] predict(FittedRegression fitted, DataTable data) {
        List<String> vars = fitted.getIndependentVars();
        for(String var: vars) {
            if(!data.hasColumn(var)) {
                throw new AnalysisException(AnalysisErrorCode.COLUMN_NOT_FOUND, "Column " + var
                        + " used by the model is not in the prediction data");
            }
        }
        double[][] raw = data.toMatrix(vars);
        double[] predictions = new double[raw.length];
        for(int i = 0; i < raw.length; i++) {
            boolean complete = true;
            for(double v: raw[i]) {
                if(Double.isNaN(v)) {
                    complete = false;
                    break;
                }
            }
            predictions[i] = complete ? fitted.predict(raw[i]) : Double.NaN;
        }
        return predictions;
    }

    public double[] predict(DataTable data) {
        return predict(getModel(), data);
    }

    /**
     * Residual tests from the backend, or the classification metrics for a logistic model.
     */
    public Map<String, Object> diagnostics(FittedRegression fitted) {
        if(fitted.isLogistic()) {
            return classificationMetrics(fitted);
        }
        return backend.diagnostics(fitted);
    }

    public Map<String, Object> modelDiagnostics() {
        return diagnostics(getModel());
    }

    /**
     * @throws AnalysisException
     *             with {@link AnalysisErrorCode#MODEL_NOT_TRAINED} before the first successful analyze call
     */
    public FittedRegression getModel() {
        if(model == null) {
            throw new AnalysisException(AnalysisErrorCode.MODEL_NOT_TRAINED);
        }
        return model;
    }

    public RegressionBackend getBackend() {
        return backend;
    }

    private List<Chart> createCharts(FittedRegression fitted) {
        List<Chart> charts = new ArrayList<Chart>();
        String dependent = fitted.getDependentVar();
        double[] actual = fitted.getResponse();
        double[] predicted = fitted.getFitted();
        double[] residuals = fitted.getResiduals();

        charts.add(chartProvider.scatter("Actual vs predicted " + dependent, "actual", "predicted", actual, predicted,
                null));
        charts.add(chartProvider.scatter("Residuals vs fitted", "fitted", "residual", predicted, residuals, null));
        charts.add(chartProvider.histogram("Residual distribution", "residuals", residuals));

        if(fitted.getIndependentVars().size() == 1) {
            String independent = fitted.getIndependentVars().get(0);
            double[][] predictors = fitted.getPredictors();
            double[] x = new double[predictors.length];
            double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
            for(int i = 0; i < x.length; i++) {
                x[i] = predictors[i][0];
                min = Math.min(min, x[i]);
                max = Math.max(max, x[i]);
            }
            charts.add(chartProvider.scatter(dependent + " vs " + independent, independent, dependent, x, actual,
                    null));
            double[] grid = new double[CURVE_POINTS];
            double[] curve = new double[CURVE_POINTS];
            for(int i = 0; i < CURVE_POINTS; i++) {
                grid[i] = min + (max - min) * i / (CURVE_POINTS - 1);
                curve[i] = fitted.predict(new double[] { grid[i] });
            }
            Map<String, double[]> series = new LinkedHashMap<String, double[]>();
            series.put("fitted", curve);
            charts.add(chartProvider.lineChart(dependent + " vs " + independent + " regression line", independent,
                    dependent, grid, series));
        }

        if(fitted.isLogistic()) {
            List<PerformanceObject> roc = new ConfusionMatrixCalculator(actual, predicted).roc();
            if(!roc.isEmpty()) {
                double[] fpr = new double[roc.size()];
                double[] tpr = new double[roc.size()];
                for(int i = 0; i < roc.size(); i++) {
                    fpr[i] = roc.get(i).fpr;
                    tpr[i] = roc.get(i).recall;
                }
                Map<String, double[]> series = new LinkedHashMap<String, double[]>();
                series.put("roc", tpr);
                charts.add(chartProvider.lineChart("ROC curve", "false positive rate", "true positive rate", fpr,
                        series));
            }
        }
        return charts;
    }
}
