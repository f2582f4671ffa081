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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of what a preprocessor did to its working table.
 */
public class PreprocessSummary {

    private int[] originalShape;
    private int[] processedShape;
    private int missingValues;
    private List<String> numericColumns = new ArrayList<String>();
    private List<String> categoricalColumns = new ArrayList<String>();

    public int[] getOriginalShape() {
        return originalShape;
    }

    public void setOriginalShape(int[] originalShape) {
        this.originalShape = originalShape;
    }

    public int[] getProcessedShape() {
        return processedShape;
    }

    public void setProcessedShape(int[] processedShape) {
        this.processedShape = processedShape;
    }

    public int getMissingValues() {
        return missingValues;
    }

    public void setMissingValues(int missingValues) {
        this.missingValues = missingValues;
    }

    public List<String> getNumericColumns() {
        return numericColumns;
    }

    public void setNumericColumns(List<String> numericColumns) {
        this.numericColumns = numericColumns;
    }

    public List<String> getCategoricalColumns() {
        return categoricalColumns;
    }

    public void setCategoricalColumns(List<String> categoricalColumns) {
        this.categoricalColumns = categoricalColumns;
    }

    public Map<String, Object> toDict() {
        Map<String, Object> dict = new LinkedHashMap<String, Object>();
        dict.put("original_shape", originalShape);
        dict.put("processed_shape", processedShape);
        dict.put("missing_values", missingValues);
        dict.put("numeric_columns", numericColumns);
        dict.put("categorical_columns", categoricalColumns);
        return dict;
    }

    @Override
    public String toString() {
        return "PreprocessSummary " + AnalysisResult.toSerializable(toDict());
    }
}
