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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named, typed sequence of values. {@code null} marks a missing value; a {@code NaN} double is treated as missing
 * as well.
 */
public class Column {

    private final String name;
    private DataType type;
    private final List<Object> values;

    public Column(String name, DataType type, List<?> rawValues) {
        if(name == null) {
            throw new IllegalArgumentException("Column name can't be null");
        }
        this.name = name;
        this.type = type;
        this.values = new ArrayList<Object>(rawValues.size());
        for(Object v: rawValues) {
            this.values.add(type.convert(v));
        }
    }

    /**
     * Build a column whose type is inferred from its values.
     */
    public static Column inferred(String name, List<?> rawValues) {
        return new Column(name, DataType.infer(rawValues), rawValues);
    }

    public static Column ofDoubles(String name, double[] data) {
        List<Object> list = new ArrayList<Object>(data.length);
        for(double d: data) {
            list.add(d);
        }
        return new Column(name, DataType.FLOAT, list);
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public boolean isNumeric() {
        return type.isNumeric();
    }

    public int size() {
        return values.size();
    }

    public Object get(int i) {
        return values.get(i);
    }

    /**
     * Set a value, converting it to the column type.
     */
    public void set(int i, Object value) {
        values.set(i, type.convert(value));
    }

    public boolean isMissing(int i) {
        Object v = values.get(i);
        return v == null || (v instanceof Double && ((Double) v).isNaN());
    }

    public int getMissingCount() {
        int count = 0;
        for(int i = 0; i < values.size(); i++) {
            if(isMissing(i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Numeric value at row i, NaN when missing.
     */
    public double getDouble(int i) {
        if(isMissing(i)) {
            return Double.NaN;
        }
        Object v = values.get(i);
        if(v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        if(v instanceof Boolean) {
            return ((Boolean) v) ? 1d : 0d;
        }
        throw new IllegalStateException("Column " + name + " of type " + type + " is not numeric");
    }

    /**
     * All values as doubles, NaN for missing.
     */
    public double[] toDoubleArray() {
        double[] result = new double[values.size()];
        for(int i = 0; i < result.length; i++) {
            result[i] = getDouble(i);
        }
        return result;
    }

    /**
     * Non-missing values as doubles, in row order.
     */
    public double[] nonMissingDoubles() {
        double[] buffer = new double[values.size()];
        int n = 0;
        for(int i = 0; i < buffer.length; i++) {
            if(!isMissing(i)) {
                buffer[n++] = getDouble(i);
            }
        }
        double[] result = new double[n];
        System.arraycopy(buffer, 0, result, 0, n);
        return result;
    }

    public List<Object> getValues() {
        return Collections.unmodifiableList(values);
    }

    /**
     * Cast all values to a new type in place.
     */
    public void castTo(DataType newType) {
        for(int i = 0; i < values.size(); i++) {
            values.set(i, newType.convert(values.get(i)));
        }
        this.type = newType;
    }

    /**
     * Select rows by position into a new column of the same type.
     */
    public Column take(List<Integer> positions) {
        List<Object> taken = new ArrayList<Object>(positions.size());
        for(Integer p: positions) {
            taken.add(values.get(p));
        }
        return new Column(name, type, taken);
    }

    public Column rename(String newName) {
        return new Column(newName, type, values);
    }

    public Column copy() {
        return new Column(name, type, values);
    }

    @Override
    public String toString() {
        return "Column [name=" + name + ", type=" + type + ", size=" + values.size() + "]";
    }
}
