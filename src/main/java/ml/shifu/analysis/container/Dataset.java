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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A table plus name, description and an open metadata bag.
 * 
 * <p>
 * {@link #from(Object)} is the normalizing entry point: it accepts a {@link DataTable}, a 2-D array, a mapping of
 * column name to values or a list of row mappings, and fails with {@link IllegalArgumentException} on any other
 * shape.
 */
public class Dataset {

    public static final String DEFAULT_NAME = "Unnamed Dataset";

    private DataTable data;
    private String name;
    private String description;
    private Map<String, Object> metadata;

    public Dataset(DataTable data) {
        this(data, DEFAULT_NAME, "", null);
    }

    public Dataset(DataTable data, String name, String description, Map<String, Object> metadata) {
        this.data = data;
        this.name = (name == null ? DEFAULT_NAME : name);
        this.description = (description == null ? "" : description);
        this.metadata = (metadata == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<String, Object>(
                metadata));
    }

    public static Dataset from(Object raw) {
        return new Dataset(toTable(raw));
    }

    public static Dataset from(Object raw, String name) {
        return new Dataset(toTable(raw), name, "", null);
    }

    /**
     * Rebuild a dataset from the output of {@link #toDict()}.
     */
    @SuppressWarnings("unchecked")
    public static Dataset fromDict(Map<String, Object> dict) {
        Object raw = dict.containsKey("data") ? dict.get("data") : new ArrayList<Object>();
        Object meta = dict.get("metadata");
        return new Dataset(toTable(raw), (String) dict.get("name"), (String) dict.get("description"),
                meta instanceof Map ? (Map<String, Object>) meta : null);
    }

    /**
     * Normalize any supported table-like input to a {@link DataTable}. A {@link DataTable} is copied.
     */
    public static DataTable toTable(Object raw) {
        if(raw instanceof DataTable) {
            return ((DataTable) raw).copy();
        }
        if(raw instanceof double[][]) {
            return fromArray((double[][]) raw);
        }
        if(raw instanceof Object[][]) {
            return fromRows(Arrays.asList((Object[][]) raw));
        }
        if(raw instanceof Map) {
            return fromColumns((Map<?, ?>) raw);
        }
        if(raw instanceof List) {
            List<?> list = (List<?>) raw;
            if(list.isEmpty()) {
                return new DataTable();
            }
            Object first = list.get(0);
            if(first instanceof Map) {
                return fromRecords(list);
            }
            if(first instanceof List || (first != null && first.getClass().isArray())) {
                return fromRows(list);
            }
            throw new IllegalArgumentException("Unsupported list element type: "
                    + (first == null ? "null" : first.getClass().getSimpleName()));
        }
        throw new IllegalArgumentException("Unsupported data type: "
                + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    public static DataTable fromArray(double[][] array) {
        DataTable table = new DataTable();
        if(array.length == 0) {
            return table;
        }
        int width = array[0].length;
        for(double[] row: array) {
            if(row.length != width) {
                throw new IllegalArgumentException("Ragged 2-D array, expected rows of width " + width);
            }
        }
        for(int j = 0; j < width; j++) {
            double[] col = new double[array.length];
            for(int i = 0; i < array.length; i++) {
                col[i] = array[i][j];
            }
            table.addColumn(Column.ofDoubles(String.valueOf(j), col));
        }
        return table;
    }

    public static DataTable fromColumns(Map<?, ?> columns) {
        DataTable table = new DataTable();
        int expected = -1;
        for(Map.Entry<?, ?> entry: columns.entrySet()) {
            List<Object> values = asList(entry.getValue());
            if(values == null) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " is not a sequence");
            }
            if(expected >= 0 && values.size() != expected) {
                throw new IllegalArgumentException("All arrays must be of the same length");
            }
            expected = values.size();
            table.addColumn(Column.inferred(String.valueOf(entry.getKey()), values));
        }
        return table;
    }

    public static DataTable fromRecords(List<?> records) {
        Set<String> names = new LinkedHashSet<String>();
        for(Object record: records) {
            if(!(record instanceof Map)) {
                throw new IllegalArgumentException("Mixed record types, every record must be a mapping");
            }
            for(Object key: ((Map<?, ?>) record).keySet()) {
                names.add(String.valueOf(key));
            }
        }
        Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
        for(String name: names) {
            columns.put(name, new ArrayList<Object>(records.size()));
        }
        for(Object record: records) {
            Map<?, ?> map = (Map<?, ?>) record;
            for(String name: names) {
                columns.get(name).add(map.get(name));
            }
        }
        return fromColumns(columns);
    }

    public static DataTable fromRows(List<?> rows) {
        int width = -1;
        List<List<Object>> parsed = new ArrayList<List<Object>>(rows.size());
        for(Object row: rows) {
            List<Object> values = asList(row);
            if(values == null) {
                throw new IllegalArgumentException("Row is not a sequence: " + row);
            }
            if(width >= 0 && values.size() != width) {
                throw new IllegalArgumentException("Ragged rows, expected width " + width);
            }
            width = values.size();
            parsed.add(values);
        }
        Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
        for(int j = 0; j < Math.max(width, 0); j++) {
            List<Object> col = new ArrayList<Object>(parsed.size());
            for(List<Object> row: parsed) {
                col.add(row.get(j));
            }
            columns.put(String.valueOf(j), col);
        }
        return fromColumns(columns);
    }

    private static List<Object> asList(Object value) {
        if(value instanceof Collection) {
            return new ArrayList<Object>((Collection<?>) value);
        }
        if(value != null && value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<Object> list = new ArrayList<Object>(len);
            for(int i = 0; i < len; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        return null;
    }

    public DataTable getData() {
        return data;
    }

    /**
     * Replace the table wholesale, normalizing the input like {@link #from(Object)}.
     */
    public void setData(Object raw) {
        this.data = toTable(raw);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public int[] getShape() {
        return data == null ? new int[] { 0, 0 } : data.getShape();
    }

    public List<String> getColumns() {
        return data == null ? new ArrayList<String>() : data.getColumnNames();
    }

    public List<String> getNumericColumns() {
        return data == null ? new ArrayList<String>() : data.getNumericColumnNames();
    }

    public List<String> getCategoricalColumns() {
        return data == null ? new ArrayList<String>() : data.getCategoricalColumnNames();
    }

    public Map<String, String> getDtypes() {
        Map<String, String> dtypes = new LinkedHashMap<String, String>();
        if(data != null) {
            for(Column c: data.getColumns()) {
                dtypes.put(c.getName(), c.getType().name().toLowerCase());
            }
        }
        return dtypes;
    }

    public Map<String, Object> toDict() {
        Map<String, Object> dict = new LinkedHashMap<String, Object>();
        dict.put("name", name);
        dict.put("description", description);
        dict.put("metadata", metadata);
        dict.put("data", data == null ? new ArrayList<Object>() : data.toRecords());
        return dict;
    }

    @Override
    public String toString() {
        int[] shape = getShape();
        return "Dataset [name=" + name + ", shape=(" + shape[0] + ", " + shape[1] + ")]";
    }
}
