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

import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.apache.commons.math3.util.CombinatoricsUtils;

/**
 * Pairwise correlation coefficients together with their two-sided p-values. All methods expect paired arrays
 * without missing values.
 */
public final class CorrelationCalculator {

    private CorrelationCalculator() {
    }

    /**
     * @return {r, p}; both NaN when fewer than 3 pairs or a constant input
     */
    public static double[] pearson(double[] x, double[] y) {
        if(x.length < 3) {
            return new double[] { Double.NaN, Double.NaN };
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        return new double[] { r, tTestPValue(r, x.length) };
    }

    public static double[] spearman(double[] x, double[] y) {
        if(x.length < 3) {
            return new double[] { Double.NaN, Double.NaN };
        }
        NaturalRanking ranking = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE);
        double r = new PearsonsCorrelation().correlation(ranking.rank(x), ranking.rank(y));
        return new double[] { r, tTestPValue(r, x.length) };
    }

    /**
     * Largest sample size for which the exact null distribution of Kendall's statistic is used.
     */
    static final int KENDALL_EXACT_MAX_SIZE = 33;

    /**
     * Kendall tau-b. The p-value is exact when neither input has ties and either n is at most 33 or the discordant
     * count is within 1 of its extremes; otherwise it uses the tie-corrected normal approximation.
     */
    public static double[] kendall(double[] x, double[] y) {
        int n = x.length;
        if(n < 3) {
            return new double[] { Double.NaN, Double.NaN };
        }
        long concordant = 0, discordant = 0, tiesX = 0, tiesY = 0;
        for(int i = 0; i < n; i++) {
            for(int j = i + 1; j < n; j++) {
                double dx = Math.signum(x[j] - x[i]);
                double dy = Math.signum(y[j] - y[i]);
                if(dx == 0d && dy == 0d) {
                    continue;
                } else if(dx == 0d) {
                    tiesX++;
                } else if(dy == 0d) {
                    tiesY++;
                } else if(dx == dy) {
                    concordant++;
                } else {
                    discordant++;
                }
            }
        }
        double denominator = Math.sqrt((double) (concordant + discordant + tiesX)
                * (double) (concordant + discordant + tiesY));
        if(denominator == 0d) {
            return new double[] { Double.NaN, Double.NaN };
        }
        double tau = (concordant - discordant) / denominator;

        double[] tx = tieGroupSums(x);
        double[] ty = tieGroupSums(y);
        long total = n * (n - 1L) / 2L;
        if(tx[2] == 0d && ty[2] == 0d
                && (n <= KENDALL_EXACT_MAX_SIZE || Math.min(discordant, total - discordant) <= 1L)) {
            return new double[] { tau, kendallExactPValue(n, discordant) };
        }
        double v0 = n * (n - 1d) * (2d * n + 5d);
        double var = (v0 - tx[0] - ty[0]) / 18d + (tx[1] * ty[1]) / (9d * n * (n - 1d) * (n - 2d))
                + (tx[2] * ty[2]) / (2d * n * (n - 1d));
        if(var <= 0d) {
            return new double[] { tau, Double.NaN };
        }
        double z = (concordant - discordant) / Math.sqrt(var);
        double p = Erf.erfc(Math.abs(z) / Math.sqrt(2d));
        return new double[] { tau, Math.min(1d, p) };
    }

    /**
     * Two-sided exact p-value for {@code discordant} discordant pairs among n untied pairs, from the number of
     * permutations of n items with at most c inversions, c = min(discordant, total - discordant).
     */
    static double kendallExactPValue(int n, long discordant) {
        long total = n * (n - 1L) / 2L;
        long c = Math.min(discordant, total - discordant);
        if(n <= 2 || 2L * c == total) {
            return 1d;
        }
        if(c == 0L) {
            return 2d * Math.exp(-CombinatoricsUtils.factorialLog(n));
        }
        if(c == 1L) {
            return 2d * Math.exp(-CombinatoricsUtils.factorialLog(n - 1));
        }
        int limit = (int) c;
        // counts[k]: permutations of j items with exactly k inversions, for k <= c
        double[] counts = new double[limit + 1];
        counts[0] = 1d;
        counts[1] = 1d;
        for(int j = 3; j <= n; j++) {
            double[] previous = counts.clone();
            for(int k = 1; k < Math.min(j, limit + 1); k++) {
                counts[k] += counts[k - 1];
            }
            for(int k = j; k <= limit; k++) {
                counts[k] += counts[k - 1] - previous[k - j];
            }
        }
        double cumulative = 0d;
        for(double count: counts) {
            cumulative += count;
        }
        double p = 2d * cumulative / CombinatoricsUtils.factorialDouble(n);
        return Math.max(0d, Math.min(1d, p));
    }

    /**
     * For tie groups of size t: {sum t(t-1)(2t+5), sum t(t-1)(t-2), sum t(t-1)}.
     */
    private static double[] tieGroupSums(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double a = 0d, b = 0d, c = 0d;
        int i = 0;
        while(i < sorted.length) {
            int j = i;
            while(j + 1 < sorted.length && sorted[j + 1] == sorted[i]) {
                j++;
            }
            double t = j - i + 1;
            if(t > 1) {
                a += t * (t - 1) * (2 * t + 5);
                b += t * (t - 1) * (t - 2);
                c += t * (t - 1);
            }
            i = j + 1;
        }
        return new double[] { a, b, c };
    }

    /**
     * Two-sided p-value of r under H0: rho = 0 using a t statistic with n - 2 degrees of freedom.
     */
    public static double tTestPValue(double r, int n) {
        if(Double.isNaN(r) || n < 3) {
            return Double.NaN;
        }
        if(Math.abs(r) >= 1d) {
            return 0d;
        }
        double t = r * Math.sqrt((n - 2d) / (1d - r * r));
        TDistribution dist = new TDistribution(n - 2d);
        return 2d * dist.cumulativeProbability(-Math.abs(t));
    }
}
