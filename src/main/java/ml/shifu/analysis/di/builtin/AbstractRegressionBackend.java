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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.distribution.TDistribution;

import ml.shifu.analysis.di.spi.RegressionBackend;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Helpers shared by the regression backends.
 */
public abstract class AbstractRegressionBackend implements RegressionBackend {

    public static final String INTERCEPT = "intercept";

    protected static double[][] withConstant(double[][] design) {
        double[][] x = new double[design.length][];
        for(int i = 0; i < design.length; i++) {
            x[i] = new double[design[i].length + 1];
            x[i][0] = 1d;
            System.arraycopy(design[i], 0, x[i], 1, design[i].length);
        }
        return x;
    }

    protected static List<String> parameterNames(List<String> termNames) {
        List<String> names = new ArrayList<String>(termNames.size() + 1);
        names.add(INTERCEPT);
        names.addAll(termNames);
        return names;
    }

    protected static Map<String, Object> keyed(List<String> names, double[] values) {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for(int i = 0; i < names.size(); i++) {
            map.put(names.get(i), values[i]);
        }
        return map;
    }

    protected static Map<String, Object> keyedIntervals(List<String> names, double[] lower, double[] upper) {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for(int i = 0; i < names.size(); i++) {
            map.put(names.get(i), new double[] { lower[i], upper[i] });
        }
        return map;
    }

    protected static void checkObservations(int n, int p) {
        if(n <= p) {
            throw new AnalysisException(AnalysisErrorCode.INSUFFICIENT_DATA, "Need more than " + p
                    + " observations to fit " + p + " parameters, got " + n);
        }
    }

    protected static double[] multiply(double[][] x, double[] beta) {
        double[] result = new double[x.length];
        for(int i = 0; i < x.length; i++) {
            double v = 0d;
            for(int j = 0; j < beta.length; j++) {
                v += x[i][j] * beta[j];
            }
            result[i] = v;
        }
        return result;
    }

    protected static double residualSumOfSquares(double[] y, double[] fitted) {
        double rss = 0d;
        for(int i = 0; i < y.length; i++) {
            double e = y[i] - fitted[i];
            rss += e * e;
        }
        return rss;
    }

    protected static double totalSumOfSquares(double[] y) {
        double mean = 0d;
        for(double v: y) {
            mean += v;
        }
        mean /= y.length;
        double tss = 0d;
        for(double v: y) {
            tss += (v - mean) * (v - mean);
        }
        return tss;
    }

    /**
     * Two-sided p-values of t statistics with the given residual degrees of freedom.
     */
    protected static double[] tPValues(double[] t, double df) {
        TDistribution dist = new TDistribution(df);
        double[] p = new double[t.length];
        for(int i = 0; i < t.length; i++) {
            p[i] = Double.isNaN(t[i]) ? Double.NaN : 2d * dist.cumulativeProbability(-Math.abs(t[i]));
        }
        return p;
    }

    protected static double[] divide(double[] a, double[] b) {
        double[] result = new double[a.length];
        for(int i = 0; i < a.length; i++) {
            result[i] = b[i] == 0d ? Double.NaN : a[i] / b[i];
        }
        return result;
    }

    /**
     * Plain-text coefficient table.
     */
    protected static String summary(String title, List<String> names, double[] coefficients, double[] stdErrors,
            double[] pValues, Map<String, Double> footer) {
        StringBuilder sb = new StringBuilder(title).append('\n');
        sb.append(String.format("%-16s %14s %14s %12s%n", "term", "coef", "std err", "P>|t|"));
        for(int i = 0; i < names.size(); i++) {
            sb.append(String.format("%-16s %14.6f %14.6f %12.6f%n", names.get(i), coefficients[i], stdErrors[i],
                    pValues[i]));
        }
        for(Map.Entry<String, Double> entry: footer.entrySet()) {
            sb.append(String.format("%-16s %14.6f%n", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }
}
