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
package ml.shifu.analysis.di.builtin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.container.FittedRegression;
import ml.shifu.analysis.container.RegressionFit;
import ml.shifu.analysis.core.ConvergeJudger;
import ml.shifu.analysis.core.stats.LeastSquares;
import ml.shifu.analysis.core.stats.ResidualTests;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Backend with full statistical inference: OLS through commons-math3 with standard errors, confidence intervals, F
 * test and information criteria; logistic regression by iteratively reweighted least squares with z tests.
 */
public class FullRegressionBackend extends AbstractRegressionBackend {

    private static Logger log = LoggerFactory.getLogger(FullRegressionBackend.class);

    public static final String NAME = "full";

    public static final int MAX_IRLS_ITERATIONS = 35;

    public static final double IRLS_TOLERANCE = 1e-8d;

    private static final double LOG_2PI = Math.log(2d * Math.PI);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RegressionFit fitLinear(double[][] design, double[] y, List<String> termNames) {
        int n = y.length;
        int p = termNames.size() + 1;
        checkObservations(n, p);

        OLSMultipleLinearRegression ols = LeastSquares.fit(design, y, true);
        double[] beta = ols.estimateRegressionParameters();
        double[] stdErrors = ols.estimateRegressionParametersStandardErrors();
        double[] fitted = multiply(withConstant(design), beta);
        double rss = ols.calculateResidualSumOfSquares();
        double tss = ols.calculateTotalSumOfSquares();
        double df = n - p;

        double[] t = divide(beta, stdErrors);
        double[] pValues = tPValues(t, df);
        double critical = new TDistribution(df).inverseCumulativeProbability(0.975d);
        double[] lower = new double[p], upper = new double[p];
        for(int j = 0; j < p; j++) {
            lower[j] = beta[j] - critical * stdErrors[j];
            upper[j] = beta[j] + critical * stdErrors[j];
        }

        double rSquared = tss == 0d ? Double.NaN : 1d - rss / tss;
        double adjRSquared = tss == 0d ? Double.NaN : 1d - (1d - rSquared) * (n - 1d) / df;
        double fStatistic = ((tss - rss) / (p - 1)) / (rss / df);
        double fPValue = Double.isNaN(fStatistic) || Double.isInfinite(fStatistic) ? Double.NaN
                : 1d - new FDistribution(p - 1, df).cumulativeProbability(fStatistic);
        double logLikelihood = -n / 2d * (LOG_2PI + Math.log(rss / n) + 1d);
        double aic = -2d * logLikelihood + 2d * p;
        double bic = -2d * logLikelihood + p * Math.log(n);

        List<String> names = parameterNames(termNames);
        Map<String, Object> stats = new LinkedHashMap<String, Object>();
        stats.put("std_errors", keyed(names, stdErrors));
        stats.put("t_values", keyed(names, t));
        stats.put("p_values", keyed(names, pValues));
        stats.put("confidence_intervals", keyedIntervals(names, lower, upper));
        stats.put("r_squared", rSquared);
        stats.put("adj_r_squared", adjRSquared);
        stats.put("f_statistic", fStatistic);
        stats.put("f_pvalue", fPValue);
        stats.put("aic", aic);
        stats.put("bic", bic);
        stats.put("log_likelihood", logLikelihood);
        stats.put("mse", rss / n);
        stats.put("n_observations", n);
        if(termNames.size() > 1) {
            stats.put("vif", vifRecords(termNames, design));
        }

        Map<String, Double> footer = new LinkedHashMap<String, Double>();
        footer.put("R-squared", rSquared);
        footer.put("Adj. R-squared", adjRSquared);
        footer.put("F-statistic", fStatistic);
        footer.put("AIC", aic);
        footer.put("BIC", bic);
        stats.put("model_summary", summary("OLS Regression Results (n=" + n + ")", names, beta, stdErrors, pValues,
                footer));

        log.debug("OLS fit on {} observations, R^2 = {}", n, rSquared);
        return new RegressionFit(beta, fitted, stats);
    }

    @Override
    public RegressionFit fitLogistic(double[][] design, double[] y, List<String> termNames) {
        int n = y.length;
        int p = termNames.size() + 1;
        checkObservations(n, p);

        double[][] x = withConstant(design);
        RealMatrix matrix = new Array2DRowRealMatrix(x, false);
        double[] beta = new double[p];
        ConvergeJudger judger = new ConvergeJudger();
        DecompositionSolver solver = null;
        boolean converged = false;
        int iteration = 0;
        try {
            for(iteration = 1; iteration <= MAX_IRLS_ITERATIONS; iteration++) {
                double[] probs = probabilities(x, beta);
                double[] gradient = new double[p];
                double[][] hessian = new double[p][p];
                for(int i = 0; i < n; i++) {
                    double w = Math.max(probs[i] * (1d - probs[i]), 1e-10d);
                    double r = y[i] - probs[i];
                    for(int a = 0; a < p; a++) {
                        gradient[a] += x[i][a] * r;
                        for(int b = a; b < p; b++) {
                            hessian[a][b] += w * x[i][a] * x[i][b];
                        }
                    }
                }
                for(int a = 0; a < p; a++) {
                    for(int b = 0; b < a; b++) {
                        hessian[a][b] = hessian[b][a];
                    }
                }
                solver = new LUDecomposition(new Array2DRowRealMatrix(hessian, false)).getSolver();
                double[] step = solver.solve(new ArrayRealVector(gradient, false)).toArray();
                double maxStep = 0d;
                for(int j = 0; j < p; j++) {
                    beta[j] += step[j];
                    maxStep = Math.max(maxStep, Math.abs(step[j]));
                }
                if(judger.judge(maxStep, IRLS_TOLERANCE)) {
                    converged = true;
                    break;
                }
            }
        } catch (SingularMatrixException e) {
            throw new AnalysisException(AnalysisErrorCode.MODEL_FIT_FAILED, e,
                    "Logistic fit failed, the data may be perfectly separated");
        }
        if(!converged) {
            log.warn("Logistic regression did not converge in {} iterations", MAX_IRLS_ITERATIONS);
        }

        double[] probs = probabilities(x, beta);
        double[] stdErrors = standardErrors(matrix, probs);
        double[] z = divide(beta, stdErrors);
        NormalDistribution normal = new NormalDistribution(0d, 1d);
        double[] pValues = new double[p], lower = new double[p], upper = new double[p];
        double critical = normal.inverseCumulativeProbability(0.975d);
        for(int j = 0; j < p; j++) {
            pValues[j] = Double.isNaN(z[j]) ? Double.NaN : 2d * normal.cumulativeProbability(-Math.abs(z[j]));
            lower[j] = beta[j] - critical * stdErrors[j];
            upper[j] = beta[j] + critical * stdErrors[j];
        }

        double logLikelihood = logLikelihood(y, probs);
        double mean = 0d;
        for(double v: y) {
            mean += v;
        }
        mean /= n;
        double[] nullProbs = new double[n];
        Arrays.fill(nullProbs, mean);
        double nullLogLikelihood = logLikelihood(y, nullProbs);
        double pseudoR2 = nullLogLikelihood == 0d ? Double.NaN : 1d - logLikelihood / nullLogLikelihood;

        List<String> names = parameterNames(termNames);
        Map<String, Object> stats = new LinkedHashMap<String, Object>();
        stats.put("std_errors", keyed(names, stdErrors));
        stats.put("z_values", keyed(names, z));
        stats.put("p_values", keyed(names, pValues));
        stats.put("confidence_intervals", keyedIntervals(names, lower, upper));
        stats.put("log_likelihood", logLikelihood);
        stats.put("pseudo_r_squared", pseudoR2);
        stats.put("aic", -2d * logLikelihood + 2d * p);
        stats.put("bic", -2d * logLikelihood + p * Math.log(n));
        stats.put("converged", converged);
        stats.put("iterations", Math.min(iteration, MAX_IRLS_ITERATIONS));
        stats.put("n_observations", n);

        Map<String, Double> footer = new LinkedHashMap<String, Double>();
        footer.put("Log-Likelihood", logLikelihood);
        footer.put("Pseudo R-squ.", pseudoR2);
        stats.put("model_summary", summary("Logit Regression Results (n=" + n + ")", names, beta, stdErrors, pValues,
                footer));
        return new RegressionFit(beta, probs, stats);
    }

    private static double[] standardErrors(RealMatrix x, double[] probs) {
        int p = x.getColumnDimension();
        double[][] information = new double[p][p];
        for(int i = 0; i < x.getRowDimension(); i++) {
            double w = probs[i] * (1d - probs[i]);
            for(int a = 0; a < p; a++) {
                for(int b = 0; b < p; b++) {
                    information[a][b] += w * x.getEntry(i, a) * x.getEntry(i, b);
                }
            }
        }
        double[] se = new double[p];
        try {
            RealMatrix covariance = new LUDecomposition(new Array2DRowRealMatrix(information, false)).getSolver()
                    .getInverse();
            for(int j = 0; j < p; j++) {
                se[j] = Math.sqrt(covariance.getEntry(j, j));
            }
        } catch (SingularMatrixException e) {
            log.warn("Singular information matrix, standard errors are undefined");
            Arrays.fill(se, Double.NaN);
        }
        return se;
    }

    static double[] probabilities(double[][] x, double[] beta) {
        double[] linear = multiply(x, beta);
        double[] probs = new double[linear.length];
        for(int i = 0; i < linear.length; i++) {
            probs[i] = FittedRegression.sigmoid(linear[i]);
        }
        return probs;
    }

    static double logLikelihood(double[] y, double[] probs) {
        double ll = 0d;
        for(int i = 0; i < y.length; i++) {
            double prob = Math.min(Math.max(probs[i], 1e-15d), 1d - 1e-15d);
            ll += y[i] * Math.log(prob) + (1d - y[i]) * Math.log(1d - prob);
        }
        return ll;
    }

    private static List<Map<String, Object>> vifRecords(List<String> termNames, double[][] design) {
        double[] vif = ResidualTests.varianceInflation(design);
        List<Map<String, Object>> records = new ArrayList<Map<String, Object>>();
        List<String> names = new ArrayList<String>();
        names.add("const");
        names.addAll(termNames);
        for(int j = 0; j < names.size(); j++) {
            Map<String, Object> record = new LinkedHashMap<String, Object>();
            record.put("variable", names.get(j));
            record.put("vif", vif[j]);
            records.add(record);
        }
        return records;
    }

    @Override
    public Map<String, Object> diagnostics(FittedRegression model) {
        double[] residuals = model.getResiduals();
        double[][] predictors = model.getPredictors();
        Map<String, Object> result = new LinkedHashMap<String, Object>();

        result.put("heteroscedasticity_test", ResidualTests.breuschPagan(residuals, model.expand(predictors)));

        double[] lb = ResidualTests.ljungBox(residuals);
        Map<String, Object> autocorrelation = new LinkedHashMap<String, Object>();
        autocorrelation.put("lb_statistic", lb[0]);
        autocorrelation.put("lb_p_value", lb[1]);
        result.put("autocorrelation_test", autocorrelation);

        result.put("durbin_watson", ResidualTests.durbinWatson(residuals));

        if(predictors[0].length > 1) {
            result.put("multicollinearity_test", vifRecords(model.getIndependentVars(), predictors));
        }

        double[] jb = ResidualTests.jarqueBera(residuals);
        Map<String, Object> normality = new LinkedHashMap<String, Object>();
        normality.put("jb_statistic", jb[0]);
        normality.put("jb_p_value", jb[1]);
        result.put("normality_test", normality);
        return result;
    }
}
