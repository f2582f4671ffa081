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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

import ml.shifu.analysis.chart.Chart;
import ml.shifu.analysis.chart.ChartProvider;
import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.Column;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.container.DataType;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.core.BasicStatsCalculator;
import ml.shifu.analysis.core.OutlierDetector;
import ml.shifu.analysis.core.OutlierMethod;
import ml.shifu.analysis.core.stats.ShapiroWilk;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Constants;
import ml.shifu.analysis.util.Environment;

/**
 * Descriptive statistics: basic and distribution statistics per numeric column, pluggable outlier detection, missing
 * value summary and frequency tables.
 */
public class DescriptiveAnalyzer extends AbstractAnalyzer {

    private static Logger log = LoggerFactory.getLogger(DescriptiveAnalyzer.class);

    public static final String ANALYSIS_TYPE = "descriptive";

    public DescriptiveAnalyzer() {
        this((ChartProvider) null);
    }

    public DescriptiveAnalyzer(Dataset dataset) {
        this((ChartProvider) null);
        setDataset(dataset);
    }

    @Inject
    public DescriptiveAnalyzer(ChartProvider chartProvider) {
        super(chartProvider);
    }

    /**
     * Reads {@code columns}, {@code stat_type}, {@code basic_stats}, {@code distribution_stats}, {@code outliers},
     * {@code outlier_method}, {@code outlier_threshold}, {@code frequency_table} and {@code include_charts} from the
     * parameters.
     */
    @Override
    public AnalysisResult analyze() {
        Object statType = parameters.get("stat_type");
        Object method = parameters.get("outlier_method");
        DescriptiveOptions options = new DescriptiveOptions()
                .columns(listParam("columns"))
                .statType(statType == null ? StatType.ALL : statType instanceof StatType ? (StatType) statType
                        : StatType.of(statType.toString()))
                .basicStats(boolParam("basic_stats", true))
                .distributionStats(boolParam("distribution_stats", true))
                .outliers(boolParam("outliers", false))
                .outlierMethod(method == null ? OutlierMethod.IQR : method instanceof OutlierMethod ? (OutlierMethod) method
                        : OutlierMethod.of(method.toString()))
                .outlierThreshold(doubleParamOrNull("outlier_threshold"))
                .frequencyTable(boolParam("frequency_table", false))
                .includeCharts(boolParam("include_charts", true));
        return analyze(options);
    }

    public AnalysisResult analyze(DescriptiveOptions options) {
        validateDataset();
        DataTable df = table();
        log.info("Descriptive analysis on table of shape {}x{} with {}", df.getRowCount(), df.getColumnCount(),
                options);

        List<String> columns = options.getColumns();
        if(columns == null) {
            columns = options.isFrequencyTable() ? df.getColumnNames() : df.getNumericColumnNames();
        } else {
            requireColumns(columns);
        }
        List<String> numericCols = new ArrayList<String>();
        List<String> categoricalCols = new ArrayList<String>();
        for(String name: columns) {
            DataType type = df.getColumn(name).getType();
            if(type.isNumeric()) {
                numericCols.add(name);
            } else if(type == DataType.STRING || type == DataType.CATEGORY) {
                categoricalCols.add(name);
            }
        }
        if(!options.isFrequencyTable() && numericCols.isEmpty()) {
            throw new AnalysisException(AnalysisErrorCode.EMPTY_COLUMNS, "No numeric columns to analyze");
        }
        if(options.isFrequencyTable() && numericCols.isEmpty() && categoricalCols.isEmpty()) {
            throw new AnalysisException(AnalysisErrorCode.EMPTY_COLUMNS, "No columns to build frequency tables for");
        }

        Map<String, Object> data = new LinkedHashMap<String, Object>();
        if(options.isBasicStats() && options.getStatType().includesBasic() && !numericCols.isEmpty()) {
            data.put("basic_stats", basicStats(df, numericCols));
        }
        if(options.isDistributionStats() && options.getStatType().includesDistribution() && !numericCols.isEmpty()) {
            data.put("distribution_stats", distributionStats(df, numericCols));
        }
        if(options.isOutliers() && !numericCols.isEmpty()) {
            data.put("outliers", outliers(df, numericCols, options.getOutlierMethod(), options.getOutlierThreshold()));
        }
        data.put("missing_values", missingValues(df, columns));
        if(options.isFrequencyTable()) {
            List<String> freqCols = new ArrayList<String>(categoricalCols);
            freqCols.addAll(numericCols);
            data.put("frequency_table", frequencyTables(df, freqCols));
        }

        List<Chart> charts = new ArrayList<Chart>();
        if(options.isIncludeCharts()) {
            charts = createCharts(df, numericCols, categoricalCols);
        }

        Map<String, Object> metadata = new LinkedHashMap<String, Object>();
        metadata.put(Constants.ANALYSIS_TYPE, ANALYSIS_TYPE);
        metadata.put("columns", columns);
        metadata.put("stat_type", options.getStatType().name());
        return createResult(data, metadata, charts);
    }

    private Map<String, Object> basicStats(DataTable df, List<String> numericCols) {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for(String name: numericCols) {
            BasicStatsCalculator calculator = new BasicStatsCalculator(df.getColumn(name).toDoubleArray());
            if(calculator.getCount() == 0) {
                log.debug("Column {} has no values, basic stats skipped", name);
                continue;
            }
            Map<String, Object> stats = new LinkedHashMap<String, Object>();
            stats.put("count", calculator.getCount());
            stats.put("mean", calculator.getMean());
            stats.put("std", calculator.getStdDev());
            stats.put("min", calculator.getMin());
            stats.put("max", calculator.getMax());
            stats.put("median", calculator.getMedian());
            stats.put("sum", calculator.getSum());
            stats.put("variance", calculator.getVariance());
            result.put(name, stats);
        }
        return result;
    }

    private Map<String, Object> distributionStats(DataTable df, List<String> numericCols) {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for(String name: numericCols) {
            BasicStatsCalculator calculator = new BasicStatsCalculator(df.getColumn(name).toDoubleArray());
            if(calculator.getCount() == 0) {
                continue;
            }
            Map<String, Object> stats = new LinkedHashMap<String, Object>();
            stats.put("skewness", calculator.getSkewness());
            stats.put("kurtosis", calculator.getKurtosis());
            double q1 = calculator.quantile(0.25d);
            double q3 = calculator.quantile(0.75d);
            stats.put("quantile_25", q1);
            stats.put("quantile_50", calculator.quantile(0.5d));
            stats.put("quantile_75", q3);
            stats.put("iqr", q3 - q1);
            stats.put("normality_test", normalityTest(name, calculator.getSortedValues()));
            result.put(name, stats);
        }
        return result;
    }

    private static Map<String, Object> normalityTest(String name, double[] values) {
        Map<String, Object> test = new LinkedHashMap<String, Object>();
        Double statistic = null, pValue = null;
        if(values.length >= 3) {
            try {
                double[] sw = ShapiroWilk.test(values);
                statistic = sw[0];
                pValue = sw[1];
            } catch (IllegalArgumentException e) {
                log.debug("Normality test skipped for {}: {}", name, e.getMessage());
            }
        }
        test.put("statistic", statistic);
        test.put("p_value", pValue);
        return test;
    }

    private Map<String, Object> outliers(DataTable df, List<String> numericCols, OutlierMethod method,
            double threshold) {
        int trees = Environment.getInt(Environment.ISOLATION_FOREST_TREES, 100);
        long seed = Environment.getInt(Environment.RANDOM_SEED, (int) Constants.DEFAULT_RANDOM_SEED);
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for(String name: numericCols) {
            result.put(name, OutlierDetector.report(df, df.getColumn(name), method, threshold, trees, seed));
        }
        return result;
    }

    private static Map<String, Object> missingValues(DataTable df, List<String> columns) {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        int total = df.getRowCount();
        for(String name: columns) {
            int missing = df.getColumn(name).getMissingCount();
            Map<String, Object> info = new LinkedHashMap<String, Object>();
            info.put("count", missing);
            info.put("percentage", total > 0 ? missing * 100d / total : 0d);
            result.put(name, info);
        }
        return result;
    }

    private static Map<String, Object> frequencyTables(DataTable df, List<String> columns) {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        int total = df.getRowCount();
        for(String name: columns) {
            Map<String, Object> table = new LinkedHashMap<String, Object>();
            for(Map.Entry<Object, Integer> entry: valueCounts(df.getColumn(name))) {
                Map<String, Object> cell = new LinkedHashMap<String, Object>();
                cell.put("count", entry.getValue());
                cell.put("percentage", total > 0 ? entry.getValue() * 100d / total : 0d);
                String key = entry.getKey() == null ? Constants.MISSING_BUCKET : entry.getKey().toString();
                table.put(key, cell);
            }
            result.put(name, table);
        }
        return result;
    }

    /**
     * Value counts sorted by descending count; ties keep first-appearance order. Missing values count under a null
     * key.
     */
    static List<Map.Entry<Object, Integer>> valueCounts(Column column) {
        Map<Object, Integer> counts = new LinkedHashMap<Object, Integer>();
        for(int i = 0; i < column.size(); i++) {
            Object key = column.isMissing(i) ? null : column.get(i);
            Integer count = counts.get(key);
            counts.put(key, count == null ? 1 : count + 1);
        }
        List<Map.Entry<Object, Integer>> entries = new ArrayList<Map.Entry<Object, Integer>>(counts.entrySet());
        Collections.sort(entries, new Comparator<Map.Entry<Object, Integer>>() {
            @Override
            public int compare(Map.Entry<Object, Integer> a, Map.Entry<Object, Integer> b) {
                return b.getValue().compareTo(a.getValue());
            }
        });
        return entries;
    }

    private List<Chart> createCharts(DataTable df, List<String> numericCols, List<String> categoricalCols) {
        List<Chart> charts = new ArrayList<Chart>();
        for(String name: numericCols) {
            double[] values = df.getColumn(name).nonMissingDoubles();
            charts.add(chartProvider.histogram(name + " distribution", name, values));
            charts.add(chartProvider.boxPlot(name + " box plot", name, values));
        }
        for(String name: categoricalCols) {
            List<String> categories = new ArrayList<String>();
            List<Number> counts = new ArrayList<Number>();
            for(Map.Entry<Object, Integer> entry: valueCounts(df.getColumn(name))) {
                if(entry.getKey() != null) {
                    categories.add(entry.getKey().toString());
                    counts.add(entry.getValue());
                }
            }
            charts.add(chartProvider.barChart(name + " frequency", categories, counts));
        }
        return charts;
    }

    /**
     * A describe-style table: one row per statistic (count, mean, std, min, 25%, 50%, 75%, max) and one column per
     * numeric variable. Non-numeric names in {@code columns} are dropped.
     */
    public DataTable summary(List<String> columns) {
        validateDataset();
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
                }
            }
        }
        if(selected.isEmpty()) {
            throw new AnalysisException(AnalysisErrorCode.EMPTY_COLUMNS, "No numeric columns to summarize");
        }
        List<String> statistics = Arrays.asList("count", "mean", "std", "min", "25%", "50%", "75%", "max");
        DataTable summary = new DataTable();
        summary.addColumn(new Column("statistic", DataType.STRING, statistics));
        for(String name: selected) {
            BasicStatsCalculator c = new BasicStatsCalculator(df.getColumn(name).toDoubleArray());
            double[] values = new double[] { c.getCount(), c.getMean(), c.getStdDev(), c.getMin(), c.quantile(0.25d),
                    c.quantile(0.5d), c.quantile(0.75d), c.getMax() };
            summary.addColumn(Column.ofDoubles(name, values));
        }
        return summary;
    }

    /**
     * Frequency table of one column. Numeric columns are cut into {@code bins} equal-width bins (default: the number
     * of distinct values, at most 10) with columns bin, bin_start, bin_end, frequency and percentage; other columns get
     * value, frequency and percentage with missing values kept. Percentages are relative to all rows.
     */
    public DataTable frequencyTable(String column, Integer bins) {
        validateDataset();
        requireColumns(Collections.singletonList(column));
        DataTable df = table();
        Column col = df.getColumn(column);
        int total = df.getRowCount();
        DataTable result = new DataTable();

        if(col.isNumeric()) {
            double[] values = col.nonMissingDoubles();
            Set<Double> distinct = new HashSet<Double>();
            for(double v: values) {
                distinct.add(v);
            }
            int binCount = bins == null ? Math.min(10, distinct.size()) : bins;
            if(binCount < 1) {
                throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "bins must be >= 1");
            }
            BasicStatsCalculator calculator = new BasicStatsCalculator(values);
            double min = values.length == 0 ? 0d : calculator.getMin();
            double max = values.length == 0 ? 1d : calculator.getMax();
            if(min == max) {
                min -= 0.5d;
                max += 0.5d;
            }
            double width = (max - min) / binCount;
            long[] counts = new long[binCount];
            for(double v: values) {
                int bin = (int) ((v - min) / width);
                counts[Math.min(Math.max(bin, 0), binCount - 1)]++;
            }
            List<Object> labels = new ArrayList<Object>();
            double[] starts = new double[binCount], ends = new double[binCount], percentages = new double[binCount];
            List<Object> frequencies = new ArrayList<Object>();
            for(int b = 0; b < binCount; b++) {
                starts[b] = min + b * width;
                ends[b] = b == binCount - 1 ? max : min + (b + 1) * width;
                frequencies.add(counts[b]);
                percentages[b] = total > 0 ? counts[b] * 100d / total : 0d;
                labels.add(String.format("%.2f - %.2f", starts[b], ends[b]));
            }
            result.addColumn(new Column("bin", DataType.STRING, labels));
            result.addColumn(Column.ofDoubles("bin_start", starts));
            result.addColumn(Column.ofDoubles("bin_end", ends));
            result.addColumn(new Column("frequency", DataType.INTEGER, frequencies));
            result.addColumn(Column.ofDoubles("percentage", percentages));
        } else {
            List<Object> valueList = new ArrayList<Object>();
            List<Object> frequencies = new ArrayList<Object>();
            List<Map.Entry<Object, Integer>> entries = valueCounts(col);
            double[] percentages = new double[entries.size()];
            for(int i = 0; i < entries.size(); i++) {
                valueList.add(entries.get(i).getKey());
                frequencies.add(entries.get(i).getValue());
                percentages[i] = total > 0 ? entries.get(i).getValue() * 100d / total : 0d;
            }
            result.addColumn(new Column("value", col.getType(), valueList));
            result.addColumn(new Column("frequency", DataType.INTEGER, frequencies));
            result.addColumn(Column.ofDoubles("percentage", percentages));
        }
        return result;
    }

    /**
     * Rows holding an outlier in any of the numeric {@code columns}, with one boolean {@code <column>_is_outlier} flag
     * column appended per examined column. Z-scores here use the sample standard deviation.
     */
    public DataTable outlierRows(List<String> columns, OutlierMethod method) {
        validateDataset();
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
                }
            }
            if(selected.isEmpty()) {
                throw new AnalysisException(AnalysisErrorCode.EMPTY_COLUMNS, "No numeric columns to check");
            }
        }
        Map<String, boolean[]> masks = new LinkedHashMap<String, boolean[]>();
        boolean[] any = new boolean[df.getRowCount()];
        for(String name: selected) {
            double[] values = df.getColumn(name).toDoubleArray();
            boolean[] mask;
            if(method == OutlierMethod.IQR) {
                mask = OutlierDetector.iqrMask(values, Constants.DEFAULT_IQR_THRESHOLD, false);
            } else if(method == OutlierMethod.ZSCORE) {
                mask = OutlierDetector.zScoreMask(values, Constants.DEFAULT_ZSCORE_THRESHOLD, true);
            } else {
                throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported method: " + method
                        + ", expected iqr or zscore");
            }
            masks.put(name, mask);
            for(int i = 0; i < mask.length; i++) {
                any[i] |= mask[i];
            }
        }
        List<Integer> positions = new ArrayList<Integer>();
        for(int i = 0; i < any.length; i++) {
            if(any[i]) {
                positions.add(i);
            }
        }
        DataTable outliers = df.take(positions);
        for(Map.Entry<String, boolean[]> entry: masks.entrySet()) {
            List<Object> flags = new ArrayList<Object>(positions.size());
            for(int position: positions) {
                flags.add(entry.getValue()[position]);
            }
            outliers.addColumn(new Column(entry.getKey() + "_is_outlier", DataType.BOOLEAN, flags));
        }
        return outliers;
    }
}
