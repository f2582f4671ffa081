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

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

public enum RegressionType {
    LINEAR, POLYNOMIAL, MULTIPLE, LOGISTIC;

    public static RegressionType of(String name) {
        for(RegressionType type: values()) {
            if(type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported regression type: " + name);
    }

    /**
     * The model actually fitted for a requested type and predictor count. Logistic always wins; linear and polynomial
     * need a single predictor, anything with more predictors becomes a multiple regression.
     */
    public static RegressionType resolve(RegressionType requested, int predictorCount) {
        if(predictorCount < 1) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "At least one independent variable is needed");
        }
        if(requested == LOGISTIC) {
            return LOGISTIC;
        }
        if(predictorCount > 1) {
            return MULTIPLE;
        }
        return requested;
    }
}
