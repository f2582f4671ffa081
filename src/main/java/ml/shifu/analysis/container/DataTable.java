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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * {@link DataTable} is an ordered collection of equal-length, uniquely named columns whose rows are aligned by
 * position.
 * 
 * <p>
 * Every row also carries an integer label. Labels start as {@code 0..n-1} and survive row selection, so a row
 * identifier reported after filtering still points to the row of the original table.
 */
public class DataTable {

    private final LinkedHashMap<String, Column> columns = new LinkedHashMap<String, Column>();

    private final List<Integer> rowIndex;

    public DataTable() {
        this.rowIndex = new ArrayList<Integer>();
    }

    public DataTable(List<Integer> rowIndex) {
        this.rowIndex = new ArrayList<Integer>(rowIndex);
    }

    /**
     * Append a column. The first column added to a table without labels defines the default labels.
     * 
     * @throws IllegalArgumentException
     *             if the name is duplicated or the length differs from the table
     */
    public DataTable addColumn(Column column) {
        if(columns.containsKey(column.getName())) {
            throw new IllegalArgumentException("Duplicated column name " + column.getName());
        }
        if(columns.isEmpty() && rowIndex.isEmpty()) {
            for(int i = 0; i < column.size(); i++) {
                rowIndex.add(i);
            }
        }
        if(column.size() != rowIndex.size()) {
            throw new IllegalArgumentException("Column " + column.getName() + " has " + column.size()
                    + " values while the table has " + rowIndex.size() + " rows");
        }
        columns.put(column.getName(), column);
        return this;
    }

    /**
     * Replace an existing column keeping its position.
     */
    public void replaceColumn(Column column) {
        if(!columns.containsKey(column.getName())) {
            throw new AnalysisException(AnalysisErrorCode.COLUMN_NOT_FOUND, "Column not found: " + column.getName());
        }
        if(column.size() != rowIndex.size()) {
            throw new IllegalArgumentException("Column " + column.getName() + " has " + column.size()
                    + " values while the table has " + rowIndex.size() + " rows");
        }
        columns.put(column.getName(), column);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @return the column, or null if absent
     */
    public Column getColumn(String name) {
        return columns.get(name);
    }

    /**
     * @throws AnalysisException
     *             with {@link AnalysisErrorCode#COLUMN_NOT_FOUND} if absent
     */
    public Column requireColumn(String name) {
        Column column = columns.get(name);
        if(column == null) {
            throw new AnalysisException(AnalysisErrorCode.COLUMN_NOT_FOUND, "Column not found: " + name);
        }
        return column;
    }

    public List<String> getColumnNames() {
        return new ArrayList<String>(columns.keySet());
    }

    public Collection<Column> getColumns() {
        return Collections.unmodifiableCollection(columns.values());
    }

    public List<String> getNumericColumnNames() {
        List<String> names = new ArrayList<String>();
        for(Column c: columns.values()) {
            if(c.isNumeric()) {
                names.add(c.getName());
            }
        }
        return names;
    }

    public List<String> getCategoricalColumnNames() {
        List<String> names = new ArrayList<String>();
        for(Column c: columns.values()) {
            if(c.getType().isCategorical()) {
                names.add(c.getName());
            }
        }
        return names;
    }

    public int getRowCount() {
        return rowIndex.size();
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int[] getShape() {
        return new int[] { getRowCount(), getColumnCount() };
    }

    public List<Integer> getRowIndex() {
        return Collections.unmodifiableList(rowIndex);
    }

    public int getTotalMissingCount() {
        int total = 0;
        for(Column c: columns.values()) {
            total += c.getMissingCount();
        }
        return total;
    }

    /**
     * Rows at the given positions, in the given order, as a new table.
     */
    public DataTable take(List<Integer> positions) {
        List<Integer> labels = new ArrayList<Integer>(positions.size());
        for(Integer p: positions) {
            labels.add(rowIndex.get(p));
        }
        DataTable table = new DataTable(labels);
        for(Column c: columns.values()) {
            table.addColumn(c.take(positions));
        }
        return table;
    }

    /**
     * Rows whose mask entry is true, as a new table.
     */
    public DataTable filter(boolean[] keep) {
        if(keep.length != getRowCount()) {
            throw new IllegalArgumentException("Mask length " + keep.length + " does not match row count "
                    + getRowCount());
        }
        List<Integer> positions = new ArrayList<Integer>();
        for(int i = 0; i < keep.length; i++) {
            if(keep[i]) {
                positions.add(i);
            }
        }
        return take(positions);
    }

    /**
     * A copy restricted to the given columns, in the given order.
     */
    public DataTable select(List<String> names) {
        DataTable table = new DataTable(rowIndex);
        for(String name: names) {
            table.addColumn(requireColumn(name).copy());
        }
        return table;
    }

    /**
     * Rows with no missing value in any of the given columns.
     */
    public DataTable dropMissing(List<String> names) {
        boolean[] keep = new boolean[getRowCount()];
        for(int i = 0; i < keep.length; i++) {
            keep[i] = true;
            for(String name: names) {
                if(requireColumn(name).isMissing(i)) {
                    keep[i] = false;
                    break;
                }
            }
        }
        return filter(keep);
    }

    /**
     * Numeric matrix of the given columns, row-major, NaN for missing.
     */
    public double[][] toMatrix(List<String> names) {
        double[][] matrix = new double[getRowCount()][names.size()];
        for(int j = 0; j < names.size(); j++) {
            Column column = requireColumn(names.get(j));
            for(int i = 0; i < matrix.length; i++) {
                matrix[i][j] = column.getDouble(i);
            }
        }
        return matrix;
    }

    public Map<String, Object> getRow(int position) {
        Map<String, Object> row = new LinkedHashMap<String, Object>();
        for(Column c: columns.values()) {
            row.put(c.getName(), c.get(position));
        }
        return row;
    }

    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<Map<String, Object>>(getRowCount());
        for(int i = 0; i < getRowCount(); i++) {
            records.add(getRow(i));
        }
        return records;
    }

    /**
     * Deep copy of values, types and labels.
     */
    public DataTable copy() {
        DataTable table = new DataTable(rowIndex);
        for(Column c: columns.values()) {
            table.addColumn(c.copy());
        }
        return table;
    }

    @Override
    public String toString() {
        return "DataTable [rows=" + getRowCount() + ", columns=" + columns.keySet() + "]";
    }
}
