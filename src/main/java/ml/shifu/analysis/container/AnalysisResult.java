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
package ml.shifu.analysis.container;

import java.lang.reflect.Array;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

import ml.shifu.analysis.chart.Chart;
import ml.shifu.analysis.util.Constants;
import ml.shifu.analysis.util.JSONUtils;

/**
 * Output of one analyzer invocation: a payload, a metadata envelope and the charts built for it.
 * 
 * <p>
 * The metadata always carries {@code analysis_type}, {@code timestamp} and {@code id}. Apart from
 * {@link #addChart(Chart)} a result does not change after construction.
 */
public class AnalysisResult {

    private static Logger log = LoggerFactory.getLogger(AnalysisResult.class);

    private final String id;
    private final LocalDateTime timestamp;
    private final Object data;
    private final Map<String, Object> metadata;
    private final List<Chart> charts;

    public AnalysisResult(Object data, Map<String, Object> metadata, List<Chart> charts) {
        this.id = UUID.randomUUID().toString();
        this.timestamp = LocalDateTime.ofInstant(Instant.now(), ZoneId.systemDefault());
        this.data = data;
        this.metadata = (metadata == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<String, Object>(
                metadata));
        this.charts = (charts == null ? new ArrayList<Chart>() : new ArrayList<Chart>(charts));

        if(!this.metadata.containsKey(Constants.ANALYSIS_TYPE)) {
            this.metadata.put(Constants.ANALYSIS_TYPE, "unknown");
        }
        if(!this.metadata.containsKey(Constants.TIMESTAMP)) {
            this.metadata.put(Constants.TIMESTAMP, timestamp.toString());
        }
        if(!this.metadata.containsKey(Constants.ID)) {
            this.metadata.put(Constants.ID, id);
        }
    }

    public AnalysisResult addChart(Chart chart) {
        this.charts.add(chart);
        return this;
    }

    public String getId() {
        return id;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public Object getData() {
        return data;
    }

    /**
     * Typed lookup into a map payload.
     * 
     * @throws IllegalStateException
     *             if the payload is not a map
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        if(!(data instanceof Map)) {
            throw new IllegalStateException("Result data is not a mapping");
        }
        return (T) ((Map<String, Object>) data).get(key);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public String getAnalysisType() {
        return String.valueOf(metadata.get(Constants.ANALYSIS_TYPE));
    }

    public List<Chart> getCharts() {
        return Collections.unmodifiableList(charts);
    }

    /**
     * JSON-friendly view of this result. Tables become lists of row mappings, arrays become nested lists, non-finite
     * doubles become null and unknown objects are stringified.
     */
    public Map<String, Object> toDict() {
        Map<String, Object> dict = new LinkedHashMap<String, Object>();
        dict.put(Constants.ID, id);
        dict.put(Constants.TIMESTAMP, timestamp.toString());
        dict.put(Constants.METADATA, toSerializable(metadata));
        dict.put(Constants.CHARTS_COUNT, charts.size());
        dict.put(Constants.DATA, toSerializable(data));
        return dict;
    }

    public String toJson() {
        Map<String, Object> dict = toDict();
        try {
            return JSONUtils.writeValueAsString(dict);
        } catch (JsonProcessingException e) {
            log.warn("Result {} could not be written as json, falling back to string rendering", id, e);
            return dict.toString();
        }
    }

    /**
     * Recursively convert a value into maps, lists, strings, booleans and finite numbers.
     */
    public static Object toSerializable(Object value) {
        if(value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if(value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return (Double.isNaN(d) || Double.isInfinite(d)) ? null : value;
        }
        if(value instanceof Number) {
            return value;
        }
        if(value instanceof Enum) {
            return ((Enum<?>) value).name().toLowerCase();
        }
        if(value instanceof TemporalAccessor) {
            return value.toString();
        }
        if(value instanceof DataTable) {
            return toSerializable(((DataTable) value).toRecords());
        }
        if(value instanceof Map) {
            Map<String, Object> map = new LinkedHashMap<String, Object>();
            for(Map.Entry<?, ?> entry: ((Map<?, ?>) value).entrySet()) {
                map.put(String.valueOf(entry.getKey()), toSerializable(entry.getValue()));
            }
            return map;
        }
        if(value instanceof Collection) {
            List<Object> list = new ArrayList<Object>();
            for(Object item: (Collection<?>) value) {
                list.add(toSerializable(item));
            }
            return list;
        }
        if(value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<Object> list = new ArrayList<Object>(len);
            for(int i = 0; i < len; i++) {
                list.add(toSerializable(Array.get(value, i)));
            }
            return list;
        }
        if(value instanceof Chart) {
            return ((Chart) value).getTitle();
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return "AnalysisResult(id=" + id + ", type=" + metadata.get(Constants.ANALYSIS_TYPE) + ", charts="
                + charts.size() + ")";
    }
}
