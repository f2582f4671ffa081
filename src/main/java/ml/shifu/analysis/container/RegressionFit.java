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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw output of a regression backend: coefficients (intercept first), in-sample fitted values (probabilities for
 * logistic fits) and the backend specific statistics keyed by output name.
 */
public class RegressionFit {

    private final double[] coefficients;

    private final double[] fitted;

    private final Map<String, Object> statistics;

    public RegressionFit(double[] coefficients, double[] fitted, Map<String, Object> statistics) {
        this.coefficients = coefficients.clone();
        this.fitted = fitted.clone();
        this.statistics = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(statistics));
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getIntercept() {
        return coefficients[0];
    }

    public double[] getFitted() {
        return fitted.clone();
    }

    public Map<String, Object> getStatistics() {
        return statistics;
    }
}
