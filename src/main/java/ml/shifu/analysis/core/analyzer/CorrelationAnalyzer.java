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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

import ml.shifu.analysis.chart.Chart;
import ml.shifu.analysis.chart.ChartProvider;
import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.core.stats.LeastSquares;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Constants;
import ml.shifu.analysis.util.Environment;

/**
 * Correlation analysis over numeric columns with pairwise-complete observations.
 */
public class CorrelationAnalyzer extends AbstractAnalyzer {

    private static Logger log = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    public static final String ANALYSIS_TYPE = "correlation";

    public CorrelationAnalyzer() {
        this((ChartProvider) null);
    }

    public CorrelationAnalyzer(Dataset dataset) {
        this((ChartProvider) null);
        setDataset(dataset);
    }

    @Inject
    public CorrelationAnalyzer(ChartProvider chartProvider) {
        super(chartProvider);
    }

    /**
     * Reads {@code columns}, {@code method}, {@code include_p_values} and {@code include_charts} from the parameters.
     */
    @Override
    public AnalysisResult analyze() {
        Object method = parameters.get("method");
        return analyze(listParam("columns"), method == null ? CorrelationMethod.PEARSON
                : method instanceof CorrelationMethod ? (CorrelationMethod) method : CorrelationMethod.of(method
                        .toString()), boolParam("include_p_values", true), boolParam("include_charts", true));
    }

    public AnalysisResult analyze(List<String> columns, CorrelationMethod method, boolean includePValues,
            boolean includeCharts) {
        validateDataset();
        List<String> selected = numericColumns(columns);
        log.info("{} correlation over {} columns", method.getValue(), selected.size());

        double[][] corr = new double[selected.size()][selected.size()];
        double[][] pValues = new double[selected.size()][selected.size()];
        computeMatrices(selected, method, corr, pValues);

        Map<String, Object> data = new LinkedHashMap<String, Object>();
        data.put("correlation", toNestedMap(selected, corr));
        if(includePValues) {
            data.put("p_values", toNestedMap(selected, pValues));
        }

        Map<String, Object> metadata = new LinkedHashMap<String, Object>();
        metadata.put(Constants.ANALYSIS_TYPE, ANALYSIS_TYPE);
        metadata.put("method", method.getValue());
        metadata.put("columns", selected);
        metadata.put("include_p_values", includePValues);

        List<Chart> charts = new ArrayList<Chart>();
        if(includeCharts) {
            charts = createCharts(selected, corr, includePValues ? pValues : null);
        }
        return createResult(data, metadata, charts);
    }

    public AnalysisResult analyze(List<String> columns, CorrelationMethod method) {
        return analyze(columns, method, true, true);
    }

    /**
     * Columns to analyze: all numeric columns when {@code columns} is null, otherwise the numeric subset of
     * {@code columns}. Dropped names are reported as warnings.
     */
    private List<String> numericColumns(List<String> columns) {
        DataTable df = table();
        List<String> selected;
        if(columns == null) {
            selected = df.getNumericColumnNames();
        } else {
            requireColumns(columns);
            selected = new ArrayList<String>();
            for(String name: columns) {
                if(df.getColumn(name).isNumeric()) {
                    selected.add(name);
                } else {
                    log.warn("Column {} is not numeric and is left out of the correlation analysis", name);
                }
            }
        }
        if(selected.isEmpty()) {
            throw new AnalysisException(AnalysisErrorCode.EMPTY_COLUMNS, "No numeric columns to analyze");
        }
        return selected;
    }

    private void computeMatrices(List<String> columns, CorrelationMethod method, double[][] corr, double[][] p) {
        int k = columns.size();
        for(int i = 0; i < k; i++) {
            corr[i][i] = 1d;
            p[i][i] = 0d;
            for(int j = i + 1; j < k; j++) {
                double[][] pair = completePairs(columns.get(i), columns.get(j));
                double[] test = method.test(pair[0], pair[1]);
                corr[i][j] = corr[j][i] = test[0];
                p[i][j] = p[j][i] = test[1];
            }
        }
    }

    /**
     * Values of both columns at rows where neither is missing.
     */
    private double[][] completePairs(String first, String second) {
        double[] x = table().getColumn(first).toDoubleArray();
        double[] y = table().getColumn(second).toDoubleArray();
        double[] px = new double[x.length], py = new double[y.length];
        int n = 0;
        for(int i = 0; i < x.length; i++) {
            if(!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
                px[n] = x[i];
                py[n] = y[i];
                n++;
            }
        }
        return new double[][] { Arrays.copyOf(px, n), Arrays.copyOf(py, n) };
    }

    private static Map<String, Map<String, Double>> toNestedMap(List<String> names, double[][] matrix) {
        Map<String, Map<String, Double>> result = new LinkedHashMap<String, Map<String, Double>>();
        for(int i = 0; i < names.size(); i++) {
            Map<String, Double> row = new LinkedHashMap<String, Double>();
            for(int j = 0; j < names.size(); j++) {
                row.put(names.get(j), matrix[i][j]);
            }
            result.put(names.get(i), row);
        }
        return result;
    }

    private List<Chart> createCharts(List<String> columns, double[][] corr, double[][] pValues) {
        List<Chart> charts = new ArrayList<Chart>();
        charts.add(chartProvider.heatmap("Correlation heatmap", columns, columns, corr));
        if(pValues != null) {
            charts.add(chartProvider.heatmap("Correlation p-value heatmap", columns, columns, pValues));
        }

        List<int[]> pairs = new ArrayList<int[]>();
        for(int i = 0; i < columns.size(); i++) {
            for(int j = i + 1; j < columns.size(); j++) {
                if(!Double.isNaN(corr[i][j])) {
                    pairs.add(new int[] { i, j });
                }
            }
        }
        final double[][] matrix = corr;
        Collections.sort(pairs, new Comparator<int[]>() {
            @Override
            public int compare(int[] a, int[] b) {
                return Double.compare(Math.abs(matrix[b[0]][b[1]]), Math.abs(matrix[a[0]][a[1]]));
            }
        });
        int top = Environment.getInt(Environment.CORRELATION_TOP_PAIRS, 10);
        for(int[] pair: pairs.subList(0, Math.min(top, pairs.size()))) {
            String first = columns.get(pair[0]), second = columns.get(pair[1]);
            double[][] values = completePairs(first, second);
            charts.add(chartProvider.scatter(
                    String.format("%s vs %s (r = %.3f)", first, second, Math.abs(corr[pair[0]][pair[1]])), first,
                    second, values[0], values[1], null));
        }
        return charts;
    }

    /**
     * Correlation matrix as a nested mapping row -&gt; column -&gt; coefficient.
     */
    public Map<String, Map<String, Double>> correlationMatrix(List<String> columns, CorrelationMethod method) {
        validateDataset();
        List<String> selected = numericColumns(columns);
        double[][] corr = new double[selected.size()][selected.size()];
        double[][] p = new double[selected.size()][selected.size()];
        computeMatrices(selected, method, corr, p);
        return toNestedMap(selected, corr);
    }

    /**
     * Upper-triangle pairs with {@code |r| >= threshold} and {@code p <= alpha}, strongest first.
     */
    public List<Map<String, Object>> significantCorrelations(List<String> columns, CorrelationMethod method,
            double threshold, double alpha) {
        validateDataset();
        List<String> selected = numericColumns(columns);
        double[][] corr = new double[selected.size()][selected.size()];
        double[][] p = new double[selected.size()][selected.size()];
        computeMatrices(selected, method, corr, p);

        List<Map<String, Object>> pairs = new ArrayList<Map<String, Object>>();
        for(int i = 0; i < selected.size(); i++) {
            for(int j = i + 1; j < selected.size(); j++) {
                if(Math.abs(corr[i][j]) >= threshold && p[i][j] <= alpha) {
                    Map<String, Object> pair = new LinkedHashMap<String, Object>();
                    pair.put("variable1", selected.get(i));
                    pair.put("variable2", selected.get(j));
                    pair.put("correlation", corr[i][j]);
                    pair.put("p_value", p[i][j]);
                    pair.put("significant", "Yes");
                    pairs.add(pair);
                }
            }
        }
        Collections.sort(pairs, new Comparator<Map<String, Object>>() {
            @Override
            public int compare(Map<String, Object> a, Map<String, Object> b) {
                return Double.compare(Math.abs((Double) b.get("correlation")),
                        Math.abs((Double) a.get("correlation")));
            }
        });
        return pairs;
    }

    public List<Map<String, Object>> significantCorrelations(List<String> columns, CorrelationMethod method) {
        return significantCorrelations(columns, method, 0.5d, 0.05d);
    }

    /**
     * Pearson correlation of {@code var1} and {@code var2} after removing the linear effect of the control variables
     * from both.
     * 
     * @return {r, p} with the p-value from a t test on n - 2 - k degrees of freedom
     */
    public double[] partialCorrelation(String var1, String var2, List<String> controlVars) {
        validateDataset();
        List<String> all = new ArrayList<String>();
        all.add(var1);
        all.add(var2);
        all.addAll(controlVars);
        requireNumericColumns(all);

        double[][] data = table().dropMissing(all).toMatrix(all);
        int n = data.length;
        int k = controlVars.size();
        if(n < k + 3) {
            throw new AnalysisException(AnalysisErrorCode.INSUFFICIENT_DATA, "Partial correlation with " + k
                    + " control variables needs at least " + (k + 3) + " complete rows, got " + n);
        }
        double[] x = new double[n], y = new double[n];
        double[][] controls = new double[n][k];
        for(int i = 0; i < n; i++) {
            x[i] = data[i][0];
            y[i] = data[i][1];
            System.arraycopy(data[i], 2, controls[i], 0, k);
        }
        double[] rx = LeastSquares.residuals(controls, x, true);
        double[] ry = LeastSquares.residuals(controls, y, true);
        double r = new PearsonsCorrelation().correlation(rx, ry);

        double df = n - 2d - k;
        double p;
        if(Double.isNaN(r)) {
            p = Double.NaN;
        } else if(Math.abs(r) >= 1d) {
            p = 0d;
        } else {
            double t = r * Math.sqrt(df / (1d - r * r));
            p = 2d * new TDistribution(df).cumulativeProbability(-Math.abs(t));
        }
        log.debug("Partial correlation of {} and {} given {}: r={}, p={}", var1, var2, controlVars, r, p);
        return new double[] { r, p };
    }

    /**
     * Single pair test with a 95% confidence interval from Fisher's z transform.
     */
    public Map<String, Object> correlationTest(String var1, String var2, CorrelationMethod method) {
        validateDataset();
        requireNumericColumns(Arrays.asList(var1, var2));
        double[][] pair = completePairs(var1, var2);
        int n = pair[0].length;
        if(n < 4) {
            throw new AnalysisException(AnalysisErrorCode.INSUFFICIENT_DATA,
                    "A correlation confidence interval needs at least 4 complete pairs, got " + n);
        }
        double[] test = method.test(pair[0], pair[1]);
        double r = test[0];
        double z = 0.5d * Math.log((1d + r) / (1d - r));
        double se = 1d / Math.sqrt(n - 3d);
        double critical = new NormalDistribution(0d, 1d).inverseCumulativeProbability(0.975d);

        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("method", method.getDescription());
        result.put("variable1", var1);
        result.put("variable2", var2);
        result.put("correlation", r);
        result.put("p_value", test[1]);
        result.put("sample_size", n);
        result.put("ci_lower", Math.tanh(z - critical * se));
        result.put("ci_upper", Math.tanh(z + critical * se));
        result.put("significant", test[1] < 0.05d);
        return result;
    }
}
