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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.container.FittedRegression;
import ml.shifu.analysis.container.RegressionFit;
import ml.shifu.analysis.core.BasicStatsCalculator;
import ml.shifu.analysis.core.ConvergeJudger;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Minimal backend: closed-form normal equations for the linear family with t tests derived from the residual
 * variance, and an L2-regularized gradient descent for logistic regression. Diagnostics are limited to residual
 * summaries.
 */
public class ReducedRegressionBackend extends AbstractRegressionBackend {

    private static Logger log = LoggerFactory.getLogger(ReducedRegressionBackend.class);

    public static final String NAME = "reduced";

    public static final int MAX_ITERATIONS = 5000;

    public static final double LEARNING_RATE = 0.5d;

    /**
     * Inverse regularization strength.
     */
    public static final double C = 1d;

    private static final double GRADIENT_TOLERANCE = 1e-7d;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RegressionFit fitLinear(double[][] design, double[] y, List<String> termNames) {
        int n = y.length;
        int p = termNames.size() + 1;
        checkObservations(n, p);

        RealMatrix x = new Array2DRowRealMatrix(withConstant(design), false);
        RealMatrix xtx = x.transpose().multiply(x);
        RealMatrix inverse;
        try {
            inverse = new LUDecomposition(xtx).getSolver().getInverse();
        } catch (SingularMatrixException e) {
            throw new AnalysisException(AnalysisErrorCode.MODEL_FIT_FAILED, e, "Singular normal equations");
        }
        double[] beta = inverse.operate(x.transpose().operate(y));
        double[] fitted = x.operate(beta);

        double rss = residualSumOfSquares(y, fitted);
        double tss = totalSumOfSquares(y);
        double sigma2 = rss / (n - p);
        double[] stdErrors = new double[p];
        for(int j = 0; j < p; j++) {
            stdErrors[j] = Math.sqrt(sigma2 * inverse.getEntry(j, j));
        }
        double[] t = divide(beta, stdErrors);
        double[] pValues = tPValues(t, n - p);
        double rSquared = tss == 0d ? Double.NaN : 1d - rss / tss;

        List<String> names = parameterNames(termNames);
        Map<String, Object> stats = new LinkedHashMap<String, Object>();
        stats.put("r_squared", rSquared);
        stats.put("mse", rss / n);
        stats.put("std_errors", keyed(names, stdErrors));
        stats.put("t_values", keyed(names, t));
        stats.put("p_values", keyed(names, pValues));
        stats.put("n_observations", n);

        Map<String, Double> footer = new LinkedHashMap<String, Double>();
        footer.put("R-squared", rSquared);
        footer.put("MSE", rss / n);
        stats.put("model_summary", summary("Linear Regression Results (n=" + n + ")", names, beta, stdErrors, pValues,
                footer));
        return new RegressionFit(beta, fitted, stats);
    }

    /**
     * Minimizes the log-loss plus {@code ||w||^2 / (2C)} over internally standardized features; the intercept is not
     * penalized. Coefficients are mapped back to the original feature scale.
     */
    @Override
    public RegressionFit fitLogistic(double[][] design, double[] y, List<String> termNames) {
        int n = y.length;
        int k = termNames.size();
        checkObservations(n, k + 1);

        double[] means = new double[k];
        double[] scales = new double[k];
        for(int j = 0; j < k; j++) {
            double[] column = new double[n];
            for(int i = 0; i < n; i++) {
                column[i] = design[i][j];
            }
            BasicStatsCalculator calculator = new BasicStatsCalculator(column);
            means[j] = calculator.getMean();
            double sd = calculator.getPopulationStdDev();
            scales[j] = sd == 0d || Double.isNaN(sd) ? 1d : sd;
        }
        double[][] z = new double[n][k + 1];
        for(int i = 0; i < n; i++) {
            z[i][0] = 1d;
            for(int j = 0; j < k; j++) {
                z[i][j + 1] = (design[i][j] - means[j]) / scales[j];
            }
        }

        double[] w = new double[k + 1];
        ConvergeJudger judger = new ConvergeJudger();
        boolean converged = false;
        int iteration;
        for(iteration = 1; iteration <= MAX_ITERATIONS; iteration++) {
            double[] probs = FullRegressionBackend.probabilities(z, w);
            double[] gradient = new double[k + 1];
            for(int i = 0; i < n; i++) {
                double r = probs[i] - y[i];
                for(int j = 0; j <= k; j++) {
                    gradient[j] += r * z[i][j];
                }
            }
            double maxGradient = 0d;
            for(int j = 0; j <= k; j++) {
                if(j > 0) {
                    gradient[j] += w[j] / C;
                }
                gradient[j] /= n;
                maxGradient = Math.max(maxGradient, Math.abs(gradient[j]));
                w[j] -= LEARNING_RATE * gradient[j];
            }
            if(judger.judge(maxGradient, GRADIENT_TOLERANCE)) {
                converged = true;
                break;
            }
        }
        if(!converged) {
            log.warn("Gradient descent did not converge in {} iterations", MAX_ITERATIONS);
        }

        double[] beta = new double[k + 1];
        beta[0] = w[0];
        for(int j = 0; j < k; j++) {
            beta[j + 1] = w[j + 1] / scales[j];
            beta[0] -= w[j + 1] * means[j] / scales[j];
        }
        double[] probs = FullRegressionBackend.probabilities(withConstant(design), beta);

        Map<String, Object> stats = new LinkedHashMap<String, Object>();
        stats.put("log_likelihood", FullRegressionBackend.logLikelihood(y, probs));
        stats.put("converged", converged);
        stats.put("iterations", Math.min(iteration, MAX_ITERATIONS));
        stats.put("n_observations", n);
        return new RegressionFit(beta, probs, stats);
    }

    @Override
    public Map<String, Object> diagnostics(FittedRegression model) {
        double[] residuals = model.getResiduals();
        double[] y = model.getResponse();
        double mse = 0d, mae = 0d;
        for(double e: residuals) {
            mse += e * e;
            mae += Math.abs(e);
        }
        int n = residuals.length;
        double tss = totalSumOfSquares(y);
        BasicStatsCalculator residualStats = new BasicStatsCalculator(residuals);

        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("mse", mse / n);
        result.put("mae", mae / n);
        result.put("r_squared", tss == 0d ? Double.NaN : 1d - mse / tss);
        result.put("residuals_mean", residualStats.getMean());
        result.put("residuals_std", residualStats.getPopulationStdDev());
        return result;
    }
}
