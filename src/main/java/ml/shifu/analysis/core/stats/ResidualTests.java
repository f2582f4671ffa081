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
package ml.shifu.analysis.core.stats;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.FDistribution;

/**
 * Residual diagnostics of a linear fit.
 */
public final class ResidualTests {

    private ResidualTests() {
    }

    /**
     * Breusch-Pagan heteroscedasticity test: the squared residuals are regressed on the predictors plus a constant.
     * 
     * @return lagrange_multiplier, p_value, f_value and f_p_value
     */
    public static Map<String, Object> breuschPagan(double[] residuals, double[][] predictors) {
        int n = residuals.length;
        int k = predictors[0].length + 1;
        double[] squared = new double[n];
        for(int i = 0; i < n; i++) {
            squared[i] = residuals[i] * residuals[i];
        }
        double r2 = LeastSquares.rSquared(predictors, squared, true);
        double lm = n * r2;
        double lmPValue = 1d - new ChiSquaredDistribution(k - 1).cumulativeProbability(lm);
        double f = Double.NaN, fPValue = Double.NaN;
        if(n > k) {
            f = (r2 / (k - 1)) / ((1d - r2) / (n - k));
            fPValue = 1d - new FDistribution(k - 1, n - k).cumulativeProbability(f);
        }
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("lagrange_multiplier", lm);
        result.put("p_value", lmPValue);
        result.put("f_value", f);
        result.put("f_p_value", fPValue);
        return result;
    }

    /**
     * Ljung-Box statistic at lag 1.
     * 
     * @return {Q, p-value}
     */
    public static double[] ljungBox(double[] residuals) {
        int n = residuals.length;
        double mean = 0d;
        for(double e: residuals) {
            mean += e;
        }
        mean /= n;
        double denominator = 0d, numerator = 0d;
        for(int t = 0; t < n; t++) {
            denominator += (residuals[t] - mean) * (residuals[t] - mean);
            if(t + 1 < n) {
                numerator += (residuals[t] - mean) * (residuals[t + 1] - mean);
            }
        }
        if(denominator == 0d || n < 2) {
            return new double[] { Double.NaN, Double.NaN };
        }
        double r1 = numerator / denominator;
        double q = n * (n + 2d) * r1 * r1 / (n - 1d);
        return new double[] { q, 1d - new ChiSquaredDistribution(1d).cumulativeProbability(q) };
    }

    public static double durbinWatson(double[] residuals) {
        double numerator = 0d, denominator = 0d;
        for(int t = 0; t < residuals.length; t++) {
            denominator += residuals[t] * residuals[t];
            if(t > 0) {
                double d = residuals[t] - residuals[t - 1];
                numerator += d * d;
            }
        }
        return denominator == 0d ? Double.NaN : numerator / denominator;
    }

    /**
     * Jarque-Bera normality test with the biased sample skewness and kurtosis.
     * 
     * @return {JB, p-value}
     */
    public static double[] jarqueBera(double[] residuals) {
        int n = residuals.length;
        double mean = 0d;
        for(double e: residuals) {
            mean += e;
        }
        mean /= n;
        double m2 = 0d, m3 = 0d, m4 = 0d;
        for(double e: residuals) {
            double d = e - mean;
            m2 += d * d;
            m3 += d * d * d;
            m4 += d * d * d * d;
        }
        m2 /= n;
        m3 /= n;
        m4 /= n;
        if(m2 == 0d) {
            return new double[] { Double.NaN, Double.NaN };
        }
        double skew = m3 / Math.pow(m2, 1.5d);
        double kurtosis = m4 / (m2 * m2);
        double jb = n / 6d * (skew * skew + (kurtosis - 3d) * (kurtosis - 3d) / 4d);
        return new double[] { jb, 1d - new ChiSquaredDistribution(2d).cumulativeProbability(jb) };
    }

    /**
     * Variance inflation factors of the design [const, x1, ..., xk]. Each column is regressed on the others; the
     * constant column uses the uncentered R squared since the remaining columns carry no intercept.
     * 
     * @return k + 1 factors, the constant first
     */
    public static double[] varianceInflation(double[][] predictors) {
        int n = predictors.length;
        int k = predictors[0].length;
        double[] vif = new double[k + 1];

        double[] ones = new double[n];
        Arrays.fill(ones, 1d);
        vif[0] = inflation(LeastSquares.rSquared(predictors, ones, false));

        for(int j = 0; j < k; j++) {
            double[][] others = new double[n][k - 1];
            double[] target = new double[n];
            for(int i = 0; i < n; i++) {
                target[i] = predictors[i][j];
                for(int c = 0, o = 0; c < k; c++) {
                    if(c != j) {
                        others[i][o++] = predictors[i][c];
                    }
                }
            }
            vif[j + 1] = inflation(k == 1 ? 0d : LeastSquares.rSquared(others, target, true));
        }
        return vif;
    }

    private static double inflation(double r2) {
        return r2 >= 1d ? Double.POSITIVE_INFINITY : 1d / (1d - r2);
    }
}
