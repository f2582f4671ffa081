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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.container.Column;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.container.DataType;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.container.PreprocessSummary;
import ml.shifu.analysis.core.Normalizer.NormalizeMethod;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Chainable table cleaner. The preprocessor owns a private working copy of the input table, every operation mutates
 * only that copy and returns {@code this}.
 * 
 * <pre>
 * DataTable cleaned = new Preprocessor(table)
 *         .handleMissingValues(MissingValueStrategy.FILL_MEDIAN, Arrays.asList("age"))
 *         .normalize(null, NormalizeMethod.STANDARD)
 *         .filterRows("age &gt; 0")
 *         .getProcessedData();
 * </pre>
 */
public class Preprocessor {

    private static Logger log = LoggerFactory.getLogger(Preprocessor.class);

    private final DataTable original;
    private final Map<String, DataType> originalTypes;
    private DataTable df;

    public Preprocessor(DataTable table) {
        this.original = table.copy();
        this.df = table.copy();
        Map<String, DataType> types = new LinkedHashMap<String, DataType>();
        for(Column c: table.getColumns()) {
            types.put(c.getName(), c.getType());
        }
        this.originalTypes = Collections.unmodifiableMap(types);
    }

    public Preprocessor(Dataset dataset) {
        this(dataset.getData());
    }

    /**
     * Handle missing values on all columns.
     */
    public Preprocessor handleMissingValues(MissingValueStrategy strategy) {
        return handleMissingValues(strategy, null);
    }

    /**
     * Handle missing values of the given columns. Columns without missing values are untouched, unknown columns are
     * skipped.
     * 
     * @param columns
     *            target columns, null for all columns
     */
    public Preprocessor handleMissingValues(MissingValueStrategy strategy, List<String> columns) {
        List<String> targets = (columns == null ? df.getColumnNames() : columns);
        for(String name: targets) {
            if(!df.hasColumn(name)) {
                log.warn("Column {} not found, skip missing value handling", name);
                continue;
            }
            Column column = df.getColumn(name);
            if(column.getMissingCount() == 0) {
                continue;
            }
            log.debug("Handling {} missing values of column {} with {}", column.getMissingCount(), name, strategy);
            switch(strategy.getKind()) {
                case DROP:
                    df = df.dropMissing(Collections.singletonList(name));
                    break;
                case FILL_MEAN:
                    requireNumeric(column, strategy);
                    fill(column, new BasicStatsCalculator(column.toDoubleArray()).getMean());
                    break;
                case FILL_MEDIAN:
                    requireNumeric(column, strategy);
                    fill(column, new BasicStatsCalculator(column.toDoubleArray()).getMedian());
                    break;
                case FILL_MODE:
                    Object mode = mode(column);
                    if(mode == null) {
                        log.warn("Column {} has no value to take the mode from, skip", name);
                    } else {
                        fill(column, mode);
                    }
                    break;
                case FILL_VALUE:
                    fill(column, strategy.getFillValue());
                    break;
                case INTERPOLATE:
                    requireNumeric(column, strategy);
                    interpolate(column);
                    break;
                default:
                    throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported strategy "
                            + strategy);
            }
        }
        return this;
    }

    private static void requireNumeric(Column column, MissingValueStrategy strategy) {
        if(!column.isNumeric()) {
            throw new AnalysisException(AnalysisErrorCode.NON_NUMERIC_COLUMN, "Strategy " + strategy
                    + " needs a numeric column, " + column.getName() + " is " + column.getType());
        }
    }

    private void fill(Column column, Object value) {
        if(value instanceof Double && ((Double) value).isNaN()) {
            log.warn("Column {} has no valid value to compute the fill value, skip", column.getName());
            return;
        }
        if(column.isNumeric() && !(value instanceof Number)) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Fill value " + value
                    + " is not compatible with numeric column " + column.getName());
        }
        if(column.getType() == DataType.INTEGER && value instanceof Number
                && ((Number) value).doubleValue() != Math.rint(((Number) value).doubleValue())) {
            column.castTo(DataType.FLOAT);
        }
        for(int i = 0; i < column.size(); i++) {
            if(column.isMissing(i)) {
                column.set(i, value);
            }
        }
    }

    /**
     * Most frequent value, the smallest one on ties when values are comparable.
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Object mode(Column column) {
        Map<Object, Integer> counts = new LinkedHashMap<Object, Integer>();
        for(int i = 0; i < column.size(); i++) {
            if(!column.isMissing(i)) {
                Object v = column.get(i);
                Integer c = counts.get(v);
                counts.put(v, c == null ? 1 : c + 1);
            }
        }
        Object best = null;
        int bestCount = 0;
        for(Map.Entry<Object, Integer> entry: counts.entrySet()) {
            Object v = entry.getKey();
            int c = entry.getValue();
            if(c > bestCount) {
                best = v;
                bestCount = c;
            } else if(c == bestCount && v instanceof Comparable && best != null
                    && v.getClass().equals(best.getClass()) && ((Comparable) v).compareTo(best) < 0) {
                best = v;
            }
        }
        return best;
    }

    /**
     * Linear interpolation by position. Leading missing values stay missing, trailing ones take the last valid value.
     */
    private static void interpolate(Column column) {
        if(column.getType() == DataType.INTEGER) {
            column.castTo(DataType.FLOAT);
        }
        double[] values = column.toDoubleArray();
        int prev = -1;
        for(int i = 0; i < values.length; i++) {
            if(Double.isNaN(values[i])) {
                continue;
            }
            if(prev >= 0 && i - prev > 1) {
                double step = (values[i] - values[prev]) / (i - prev);
                for(int k = prev + 1; k < i; k++) {
                    column.set(k, values[prev] + step * (k - prev));
                }
            }
            prev = i;
        }
        if(prev >= 0) {
            for(int k = prev + 1; k < values.length; k++) {
                column.set(k, values[prev]);
            }
        }
    }

    /**
     * Cast columns to the given types, re-inferring the remaining string columns.
     */
    public Preprocessor convertDtypes(Map<String, DataType> typeMap) {
        return convertDtypes(typeMap, true);
    }

    /**
     * Cast columns to the given types. Cast failures propagate as the JDK's conversion exceptions.
     * 
     * @param inferObjects
     *            also re-infer string columns not in the map whose values all parse as numbers or booleans
     */
    public Preprocessor convertDtypes(Map<String, DataType> typeMap, boolean inferObjects) {
        Map<String, DataType> map = (typeMap == null ? new HashMap<String, DataType>() : typeMap);
        for(Map.Entry<String, DataType> entry: map.entrySet()) {
            Column column = df.getColumn(entry.getKey());
            if(column == null) {
                log.warn("Column {} not found, skip type conversion", entry.getKey());
                continue;
            }
            column.castTo(entry.getValue());
        }
        if(inferObjects) {
            for(Column column: df.getColumns()) {
                if(column.getType() == DataType.STRING && !map.containsKey(column.getName())) {
                    DataType inferred = inferFromText(column);
                    if(inferred != DataType.STRING) {
                        log.debug("Column {} re-inferred as {}", column.getName(), inferred);
                        column.castTo(inferred);
                    }
                }
            }
        }
        return this;
    }

    private static DataType inferFromText(Column column) {
        boolean allLong = true, allDouble = true, allBoolean = true, any = false;
        for(int i = 0; i < column.size(); i++) {
            if(column.isMissing(i)) {
                continue;
            }
            any = true;
            String text = column.get(i).toString().trim();
            allBoolean &= ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text));
            try {
                Long.parseLong(text);
            } catch (NumberFormatException e) {
                allLong = false;
            }
            if(!allLong) {
                try {
                    Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    allDouble = false;
                }
            }
            if(!allDouble && !allBoolean) {
                return DataType.STRING;
            }
        }
        if(!any) {
            return DataType.STRING;
        }
        if(allLong) {
            return column.getMissingCount() > 0 ? DataType.FLOAT : DataType.INTEGER;
        }
        if(allDouble) {
            return DataType.FLOAT;
        }
        return allBoolean ? DataType.BOOLEAN : DataType.STRING;
    }

    /**
     * Normalize numeric columns in the working copy. Non-numeric or unknown names are dropped from the targets. Use
     * {@link #normalizeCopy} to get the scaled columns without changing the working copy.
     * 
     * @param columns
     *            target columns, null for all numeric columns
     */
    public Preprocessor normalize(List<String> columns, NormalizeMethod method) {
        for(Column scaled: normalizedColumns(columns, method)) {
            df.replaceColumn(scaled);
        }
        return this;
    }

    /**
     * Scaled numeric columns as a new table, the working copy is not changed.
     */
    public DataTable normalizeCopy(List<String> columns, NormalizeMethod method) {
        DataTable table = new DataTable(df.getRowIndex());
        for(Column scaled: normalizedColumns(columns, method)) {
            table.addColumn(scaled);
        }
        return table;
    }

    private List<Column> normalizedColumns(List<String> columns, NormalizeMethod method) {
        List<Column> result = new ArrayList<Column>();
        for(String name: numericTargets(columns)) {
            Column column = df.getColumn(name);
            double[] scaled = Normalizer.normalize(column.toDoubleArray(), method);
            if(scaled == null) {
                log.warn("Column {} has zero or undefined scale for {} normalization, left unchanged", name, method);
                result.add(column.copy());
            } else {
                result.add(Column.ofDoubles(name, scaled));
            }
        }
        return result;
    }

    private List<String> numericTargets(List<String> columns) {
        List<String> numeric = df.getNumericColumnNames();
        if(columns == null || columns.isEmpty()) {
            return numeric;
        }
        List<String> targets = new ArrayList<String>();
        for(String name: columns) {
            if(numeric.contains(name)) {
                targets.add(name);
            }
        }
        return targets;
    }

    /**
     * Z-score outliers with threshold 3.0 on all numeric columns.
     */
    public boolean[] detectOutliers() {
        return detectOutliers(null, OutlierMethod.ZSCORE, OutlierMethod.ZSCORE.getDefaultThreshold());
    }

    /**
     * Flag rows that are outliers in any target column. Columns that are all missing or have zero spread contribute
     * nothing.
     * 
     * @param columns
     *            target columns, null for all numeric columns
     * @param method
     *            {@link OutlierMethod#ZSCORE} (sample std) or {@link OutlierMethod#IQR}
     * @return mask aligned to the rows of the working copy
     */
    public boolean[] detectOutliers(List<String> columns, OutlierMethod method, double threshold) {
        boolean[] isOutlier = new boolean[df.getRowCount()];
        for(String name: numericTargets(columns)) {
            double[] values = df.getColumn(name).toDoubleArray();
            boolean[] mask;
            switch(method) {
                case ZSCORE:
                    mask = OutlierDetector.zScoreMask(values, threshold, true);
                    break;
                case IQR:
                    mask = OutlierDetector.iqrMask(values, threshold, true);
                    break;
                default:
                    throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD,
                            "Unsupported outlier detection method: " + method);
            }
            for(int i = 0; i < isOutlier.length; i++) {
                isOutlier[i] |= mask[i];
            }
        }
        return isOutlier;
    }

    public Preprocessor removeOutliers(List<String> columns, OutlierMethod method, double threshold) {
        boolean[] isOutlier = detectOutliers(columns, method, threshold);
        boolean[] keep = new boolean[isOutlier.length];
        int removed = 0;
        for(int i = 0; i < keep.length; i++) {
            keep[i] = !isOutlier[i];
            if(isOutlier[i]) {
                removed++;
            }
        }
        log.info("Removing {} outlier rows by {}", removed, method);
        df = df.filter(keep);
        return this;
    }

    /**
     * Keep the rows satisfying a boolean expression over column names, see {@link DataPurifier}.
     */
    public Preprocessor filterRows(String condition) {
        DataPurifier purifier = new DataPurifier(condition, df.getColumnNames());
        df = df.filter(purifier.filter(df));
        return this;
    }

    /**
     * Sample rows without replacement. Does nothing when both n and frac are null.
     * 
     * @param seed
     *            random seed for a reproducible sample, may be null
     */
    public Preprocessor sampleData(Integer n, Double frac, Long seed) {
        if(n == null && frac == null) {
            return this;
        }
        int size = DataSampler.sampleSize(df.getRowCount(), n, frac);
        df = df.take(DataSampler.sample(df.getRowCount(), size, seed));
        return this;
    }

    /**
     * Discard all changes and start again from the original table.
     */
    public Preprocessor reset() {
        df = original.copy();
        return this;
    }

    public DataTable getProcessedData() {
        return df.copy();
    }

    public Map<String, DataType> getOriginalTypes() {
        return originalTypes;
    }

    public PreprocessSummary getSummary() {
        PreprocessSummary summary = new PreprocessSummary();
        summary.setOriginalShape(original.getShape());
        summary.setProcessedShape(df.getShape());
        summary.setMissingValues(df.getTotalMissingCount());
        summary.setNumericColumns(df.getNumericColumnNames());
        summary.setCategoricalColumns(df.getCategoricalColumnNames());
        return summary;
    }
}
