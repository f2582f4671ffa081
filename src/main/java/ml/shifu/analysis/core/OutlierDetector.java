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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.container.Column;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.core.stats.IsolationForest;

/**
 * Per-column outlier masks. Missing values are never flagged.
 */
public class OutlierDetector {

    private static Logger log = LoggerFactory.getLogger(OutlierDetector.class);

    private OutlierDetector() {
    }

    /**
     * Flag |z| &gt; threshold. The mask is all false when the standard deviation is zero or undefined.
     * 
     * @param sampleStd
     *            use the sample (ddof = 1) standard deviation, else the population one
     */
    public static boolean[] zScoreMask(double[] values, double threshold, boolean sampleStd) {
        double[] z = zScores(values, sampleStd);
        boolean[] mask = new boolean[values.length];
        if(z == null) {
            return mask;
        }
        for(int i = 0; i < values.length; i++) {
            mask[i] = !Double.isNaN(z[i]) && Math.abs(z[i]) > threshold;
        }
        return mask;
    }

    /**
     * @return z-scores, NaN for missing, or null if the standard deviation is zero or undefined
     */
    public static double[] zScores(double[] values, boolean sampleStd) {
        BasicStatsCalculator stats = new BasicStatsCalculator(values);
        double std = sampleStd ? stats.getStdDev() : stats.getPopulationStdDev();
        if(Double.isNaN(std) || std == 0d) {
            return null;
        }
        double[] z = new double[values.length];
        for(int i = 0; i < values.length; i++) {
            z[i] = Normalizer.computeZScore(values[i], stats.getMean(), std);
        }
        return z;
    }

    /**
     * @return {lower, upper} = {Q1 - t*IQR, Q3 + t*IQR}
     */
    public static double[] iqrBounds(double[] values, double threshold) {
        BasicStatsCalculator stats = new BasicStatsCalculator(values);
        double q1 = stats.quantile(0.25d);
        double q3 = stats.quantile(0.75d);
        double iqr = q3 - q1;
        return new double[] { q1 - threshold * iqr, q3 + threshold * iqr };
    }

    /**
     * Flag values outside the IQR fences.
     * 
     * @param skipZeroIqr
     *            return an all false mask when Q3 == Q1
     */
    public static boolean[] iqrMask(double[] values, double threshold, boolean skipZeroIqr) {
        boolean[] mask = new boolean[values.length];
        BasicStatsCalculator stats = new BasicStatsCalculator(values);
        if(stats.getCount() == 0 || (skipZeroIqr && stats.getIqr() == 0d)) {
            return mask;
        }
        double[] bounds = iqrBounds(values, threshold);
        for(int i = 0; i < values.length; i++) {
            mask[i] = values[i] < bounds[0] || values[i] > bounds[1];
        }
        return mask;
    }

    /**
     * Isolation forest mask on a single column, contamination is the expected share of outliers.
     */
    public static boolean[] isolationForestMask(double[] values, double contamination, int trees, long seed) {
        List<Integer> positions = new ArrayList<Integer>();
        for(int i = 0; i < values.length; i++) {
            if(!Double.isNaN(values[i])) {
                positions.add(i);
            }
        }
        boolean[] mask = new boolean[values.length];
        if(positions.size() < 2) {
            return mask;
        }
        double[][] data = new double[positions.size()][1];
        for(int i = 0; i < data.length; i++) {
            data[i][0] = values[positions.get(i)];
        }
        IsolationForest forest = new IsolationForest(trees, IsolationForest.DEFAULT_SAMPLE_SIZE, seed);
        forest.fit(data);
        boolean[] outliers = forest.predict(data, contamination);
        for(int i = 0; i < outliers.length; i++) {
            mask[positions.get(i)] = outliers[i];
        }
        return mask;
    }

    /**
     * Build the per-column report: mask, outlier row labels and count, plus the method-specific fields.
     */
    public static Map<String, Object> report(DataTable table, Column column, OutlierMethod method, double threshold,
            int trees, long seed) {
        double[] values = column.toDoubleArray();
        Map<String, Object> report = new LinkedHashMap<String, Object>();
        boolean[] mask;
        switch(method) {
            case IQR:
                mask = iqrMask(values, threshold, false);
                double[] bounds = iqrBounds(values, threshold);
                report.put("lower_bound", bounds[0]);
                report.put("upper_bound", bounds[1]);
                break;
            case ZSCORE:
                mask = zScoreMask(values, threshold, false);
                report.put("z_scores", zScores(values, false));
                report.put("threshold", threshold);
                break;
            case ISOLATION_FOREST:
                mask = isolationForestMask(values, threshold, trees, seed);
                report.put("contamination", threshold);
                break;
            default:
                throw new IllegalArgumentException("Unsupported outlier method " + method);
        }
        List<Integer> indices = new ArrayList<Integer>();
        for(int i = 0; i < mask.length; i++) {
            if(mask[i]) {
                indices.add(table.getRowIndex().get(i));
            }
        }
        report.put("is_outlier", mask);
        report.put("outlier_indices", indices);
        report.put("outlier_count", indices.size());
        log.debug("Column {} has {} outliers by {}", column.getName(), indices.size(), method);
        return report;
    }
}
