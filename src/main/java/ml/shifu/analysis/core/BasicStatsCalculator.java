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
package ml.shifu.analysis.core;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.moment.Kurtosis;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calculator, it helps to calculate count, sum, min, max, mean, sample variance, percentiles and shape statistics for
 * a numeric column. Missing values (NaN) are ignored.
 * 
 * <p>
 * Percentiles use linear interpolation between closest ranks, skewness and kurtosis are the bias corrected sample
 * statistics.
 */
public class BasicStatsCalculator {

    private static Logger log = LoggerFactory.getLogger(BasicStatsCalculator.class);

    /**
     * non-missing values, sorted ascending
     */
    private final double[] sorted;

    private double sum = 0d;
    private double min = Double.NaN;
    private double max = Double.NaN;
    private double mean = Double.NaN;
    private double variance = Double.NaN;

    public BasicStatsCalculator(double[] values) {
        int n = 0;
        double[] buffer = new double[values.length];
        for(double v: values) {
            if(Double.isNaN(v)) {
                continue;
            }
            buffer[n++] = v;
        }
        this.sorted = Arrays.copyOf(buffer, n);
        Arrays.sort(this.sorted);
        calculateStats();
    }

    private void calculateStats() {
        int n = sorted.length;
        if(n == 0) {
            log.debug("No valid value to compute stats");
            return;
        }
        min = sorted[0];
        max = sorted[n - 1];
        for(double v: sorted) {
            sum += v;
        }
        mean = sum / n;
        if(n > 1) {
            double squared = 0d;
            for(double v: sorted) {
                squared += (v - mean) * (v - mean);
            }
            variance = squared / (n - 1);
        }
    }

    public int getCount() {
        return sorted.length;
    }

    public double getSum() {
        return sum;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    /**
     * Sample variance (ddof = 1), NaN when fewer than two values.
     */
    public double getVariance() {
        return variance;
    }

    /**
     * Sample standard deviation (ddof = 1).
     */
    public double getStdDev() {
        return Math.sqrt(variance);
    }

    /**
     * Population standard deviation (ddof = 0).
     */
    public double getPopulationStdDev() {
        int n = sorted.length;
        if(n == 0) {
            return Double.NaN;
        }
        if(n == 1) {
            return 0d;
        }
        return Math.sqrt(variance * (n - 1) / n);
    }

    public double getMedian() {
        return quantile(0.5d);
    }

    /**
     * @param q
     *            quantile in [0, 1]
     */
    public double quantile(double q) {
        return quantileOfSorted(sorted, q);
    }

    public double getIqr() {
        return quantile(0.75d) - quantile(0.25d);
    }

    public double getSkewness() {
        return sorted.length < 3 ? Double.NaN : new Skewness().evaluate(sorted);
    }

    /**
     * Excess kurtosis.
     */
    public double getKurtosis() {
        return sorted.length < 4 ? Double.NaN : new Kurtosis().evaluate(sorted);
    }

    public double[] getSortedValues() {
        return Arrays.copyOf(sorted, sorted.length);
    }

    /**
     * Linear interpolation quantile of already sorted data.
     */
    public static double quantileOfSorted(double[] sortedValues, double q) {
        if(sortedValues.length == 0) {
            return Double.NaN;
        }
        if(sortedValues.length == 1) {
            return sortedValues[0];
        }
        if(q <= 0d) {
            return sortedValues[0];
        }
        if(q >= 1d) {
            return sortedValues[sortedValues.length - 1];
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(sortedValues, q * 100d);
    }

    /**
     * Linear interpolation quantile ignoring NaN.
     */
    public static double quantile(double[] values, double q) {
        return new BasicStatsCalculator(values).quantile(q);
    }
}
