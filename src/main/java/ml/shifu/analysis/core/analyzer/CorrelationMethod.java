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

import ml.shifu.analysis.core.stats.CorrelationCalculator;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

public enum CorrelationMethod {
    PEARSON("pearson", "Pearson correlation coefficient"),
    SPEARMAN("spearman", "Spearman rank correlation coefficient"),
    KENDALL("kendall", "Kendall rank correlation coefficient");

    private final String value;

    private final String description;

    private CorrelationMethod(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return {coefficient, two-sided p-value} over complete pairs
     */
    public double[] test(double[] x, double[] y) {
        switch(this) {
            case SPEARMAN:
                return CorrelationCalculator.spearman(x, y);
            case KENDALL:
                return CorrelationCalculator.kendall(x, y);
            case PEARSON:
            default:
                return CorrelationCalculator.pearson(x, y);
        }
    }

    public static CorrelationMethod of(String name) {
        for(CorrelationMethod method: values()) {
            if(method.value.equalsIgnoreCase(name.trim())) {
                return method;
            }
        }
        throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported correlation method: " + name);
    }
}
