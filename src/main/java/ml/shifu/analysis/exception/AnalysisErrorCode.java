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
package ml.shifu.analysis.exception;

/**
 * Analysis error code
 */
public enum AnalysisErrorCode {
    /*
     * Input validation: 1001 - 1100
     */
    INVALID_INPUT(1001, "The input is invalid"), COLUMN_NOT_FOUND(1002, "The column is not found in the dataset"), NON_NUMERIC_COLUMN(
            1003, "The column is not numeric"), EMPTY_COLUMNS(1004, "No columns left to analyze"), UNSUPPORTED_METHOD(
            1005, "Un-support method or strategy"), INVALID_FILTER_EXPRESSION(1006,
            "The filter expression could not be parsed or evaluated"),

    /*
     * Numeric / fitting: 1101 - 1200
     */
    INSUFFICIENT_DATA(1101, "Not enough observations for the computation"), MODEL_FIT_FAILED(1102,
            "The model could not be fitted"),

    /*
     * State: 1201 - 1300
     */
    MODEL_NOT_TRAINED(1201, "Model not trained, call analyze() first"),

    /*
     * Configuration: 1301 - 1400
     */
    CONFIG_LOAD_FAILED(1301, "Errors happen when loading analysis configuration");

    /**
     * error code
     */
    private final int code;

    /**
     * error description
     */
    private final String description;

    private AnalysisErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }

}
