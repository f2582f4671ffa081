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

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Shapiro-Wilk normality test using Royston's (1995) approximation for the coefficients and the p-value, valid for
 * 3 &lt;= n &lt;= 5000.
 */
public final class ShapiroWilk {

    private static final double[] C1 = { 0.0d, 0.221157d, -0.147981d, -2.071190d, 4.434685d, -2.706056d };
    private static final double[] C2 = { 0.0d, 0.042981d, -0.293762d, -1.752461d, 5.682633d, -3.582633d };
    private static final double[] C3 = { 0.5440d, -0.39978d, 0.025054d, -6.714e-4d };
    private static final double[] C4 = { 1.3822d, -0.77857d, 0.062767d, -0.0020322d };
    private static final double[] C5 = { -1.5861d, -0.31082d, -0.083751d, 0.0038915d };
    private static final double[] C6 = { -0.4803d, -0.082676d, 0.0030302d };
    private static final double[] G = { -2.273d, 0.459d };

    private static final NormalDistribution STD_NORMAL = new NormalDistribution(0d, 1d);

    private ShapiroWilk() {
    }

    /**
     * @param values
     *            sample without missing values
     * @return {W, p-value}
     * @throws IllegalArgumentException
     *             if n is out of [3, 5000] or the data has zero range
     */
    public static double[] test(double[] values) {
        int n = values.length;
        if(n < 3 || n > 5000) {
            throw new IllegalArgumentException("Shapiro-Wilk needs 3 <= n <= 5000, got " + n);
        }
        double[] x = Arrays.copyOf(values, n);
        Arrays.sort(x);
        double range = x[n - 1] - x[0];
        if(range <= 1e-19d) {
            throw new IllegalArgumentException("Shapiro-Wilk is undefined for data with zero range");
        }

        double[] a = coefficients(n);

        double mean = 0d;
        for(double v: x) {
            mean += v;
        }
        mean /= n;
        double ss = 0d, num = 0d;
        for(int i = 0; i < n; i++) {
            ss += (x[i] - mean) * (x[i] - mean);
            num += a[i] * x[i];
        }
        double w = Math.min(1d, (num * num) / ss);
        return new double[] { w, pValue(w, n) };
    }

    /**
     * Full antisymmetric coefficient vector, normalized to unit length.
     */
    static double[] coefficients(int n) {
        int nn2 = n / 2;
        double[] half = new double[nn2 + 1];
        if(n == 3) {
            half[1] = Math.sqrt(0.5d);
        } else {
            double an25 = n + 0.25d;
            double summ2 = 0d;
            for(int i = 1; i <= nn2; i++) {
                half[i] = -STD_NORMAL.inverseCumulativeProbability((i - 0.375d) / an25);
                summ2 += half[i] * half[i];
            }
            summ2 *= 2d;
            double ssumm2 = Math.sqrt(summ2);
            double rsn = 1d / Math.sqrt(n);
            double a1 = poly(C1, rsn) - half[1] / ssumm2;

            int i1;
            double fac;
            if(n > 5) {
                i1 = 3;
                double a2 = -half[2] / ssumm2 + poly(C2, rsn);
                fac = Math.sqrt((summ2 - 2d * half[1] * half[1] - 2d * half[2] * half[2])
                        / (1d - 2d * a1 * a1 - 2d * a2 * a2));
                half[2] = a2;
            } else {
                i1 = 2;
                fac = Math.sqrt((summ2 - 2d * half[1] * half[1]) / (1d - 2d * a1 * a1));
            }
            half[1] = a1;
            for(int i = i1; i <= nn2; i++) {
                half[i] = -half[i] / fac;
            }
        }

        // half[i] pairs the i-th smallest (negative weight) with the i-th largest value
        double[] a = new double[n];
        for(int i = 1; i <= nn2; i++) {
            double weight = Math.abs(half[i]);
            a[i - 1] = -weight;
            a[n - i] = weight;
        }
        return a;
    }

    private static double pValue(double w, int n) {
        if(n == 3) {
            double pi6 = 6d / Math.PI;
            double stqr = Math.asin(Math.sqrt(0.75d));
            return Math.max(0d, Math.min(1d, pi6 * (Math.asin(Math.sqrt(w)) - stqr)));
        }
        double w1 = Math.log(1d - w);
        double m, s;
        if(n <= 11) {
            double gamma = poly(G, n);
            if(w1 >= gamma) {
                return 1e-99d;
            }
            w1 = -Math.log(gamma - w1);
            m = poly(C3, n);
            s = Math.exp(poly(C4, n));
        } else {
            double xx = Math.log(n);
            m = poly(C5, xx);
            s = Math.exp(poly(C6, xx));
        }
        return 1d - new NormalDistribution(m, s).cumulativeProbability(w1);
    }

    /**
     * c[0] + c[1] x + c[2] x^2 + ...
     */
    private static double poly(double[] c, double x) {
        double result = 0d;
        for(int i = c.length - 1; i >= 0; i--) {
            result = result * x + c[i];
        }
        return result;
    }
}
