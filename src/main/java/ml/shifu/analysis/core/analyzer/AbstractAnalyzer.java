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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import ml.shifu.analysis.chart.Chart;
import ml.shifu.analysis.chart.ChartProvider;
import ml.shifu.analysis.chart.DefaultChartProvider;
import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.Column;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Constants;

/**
 * Shared contract of the analyzers: a dataset to work on, a bag of parameters and the history of results produced.
 * 
 * <p>
 * Concrete analyzers call {@link #validateDataset()} first and build their output through
 * {@link #createResult(Object, Map, List)}, which records it in the history. Instances are not thread-safe.
 */
public abstract class AbstractAnalyzer {

    private static Logger log = LoggerFactory.getLogger(AbstractAnalyzer.class);

    protected Dataset dataset;

    protected final Map<String, Object> parameters = new LinkedHashMap<String, Object>();

    private final List<AnalysisResult> results = new ArrayList<AnalysisResult>();

    protected final ChartProvider chartProvider;

    protected AbstractAnalyzer(ChartProvider chartProvider) {
        this.chartProvider = (chartProvider == null ? new DefaultChartProvider() : chartProvider);
    }

    public AbstractAnalyzer setDataset(Dataset dataset) {
        this.dataset = dataset;
        return this;
    }

    public Dataset getDataset() {
        return dataset;
    }

    /**
     * Merge into the current parameters; existing keys are overwritten.
     */
    public AbstractAnalyzer setParameters(Map<String, ?> params) {
        if(params != null) {
            this.parameters.putAll(params);
        }
        return this;
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * @throws AnalysisException
     *             with {@link AnalysisErrorCode#INVALID_INPUT} when no dataset or no table is set
     */
    public void validateDataset() {
        if(dataset == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Dataset is not set");
        }
        if(dataset.getData() == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Dataset carries no data");
        }
    }

    /**
     * Run the analysis configured through {@link #setParameters(Map)}.
     */
    public abstract AnalysisResult analyze();

    protected AnalysisResult createResult(Object data, Map<String, Object> metadata, List<Chart> charts) {
        Map<String, Object> merged = new LinkedHashMap<String, Object>();
        merged.put(Constants.ANALYSIS_TYPE, getClass().getSimpleName());
        merged.put(Constants.PARAMETERS, new LinkedHashMap<String, Object>(parameters));
        if(metadata != null) {
            merged.putAll(metadata);
        }
        AnalysisResult result = new AnalysisResult(data, merged, charts);
        results.add(result);
        log.info("{} produced result {} with {} charts", getClass().getSimpleName(), result.getId(),
                result.getCharts().size());
        return result;
    }

    public List<AnalysisResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public AnalysisResult getLastResult() {
        return results.isEmpty() ? null : results.get(results.size() - 1);
    }

    public void clearResults() {
        results.clear();
    }

    protected DataTable table() {
        return dataset.getData();
    }

    /**
     * @throws AnalysisException
     *             with COLUMN_NOT_FOUND for the first unknown name
     */
    protected void requireColumns(List<String> names) {
        for(String name: names) {
            if(!table().hasColumn(name)) {
                throw new AnalysisException(AnalysisErrorCode.COLUMN_NOT_FOUND, "Column '" + name
                        + "' does not exist in the dataset");
            }
        }
    }

    /**
     * @throws AnalysisException
     *             with COLUMN_NOT_FOUND or NON_NUMERIC_COLUMN
     */
    protected void requireNumericColumns(List<String> names) {
        requireColumns(names);
        for(String name: names) {
            Column column = table().getColumn(name);
            if(!column.isNumeric()) {
                throw new AnalysisException(AnalysisErrorCode.NON_NUMERIC_COLUMN, "Column '" + name
                        + "' is not numeric");
            }
        }
    }

    @SuppressWarnings("unchecked")
    protected <T> T param(String key, T defValue) {
        Object value = parameters.get(key);
        return value == null ? defValue : (T) value;
    }

    @SuppressWarnings("unchecked")
    protected List<String> listParam(String key) {
        Object value = parameters.get(key);
        if(value == null) {
            return null;
        }
        if(value instanceof String) {
            return Lists.newArrayList(Splitter.on(',').trimResults().omitEmptyStrings().split((String) value));
        }
        return new ArrayList<String>((List<String>) value);
    }

    protected int intParam(String key, int defValue) {
        Object value = parameters.get(key);
        if(value == null) {
            return defValue;
        }
        return value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString().trim());
    }

    protected double doubleParam(String key, double defValue) {
        Object value = parameters.get(key);
        if(value == null) {
            return defValue;
        }
        return value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString().trim());
    }

    protected boolean boolParam(String key, boolean defValue) {
        Object value = parameters.get(key);
        if(value == null) {
            return defValue;
        }
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString().trim());
    }

    protected Double doubleParamOrNull(String key) {
        Object value = parameters.get(key);
        if(value == null) {
            return null;
        }
        return value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString().trim());
    }
}
