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
package ml.shifu.analysis.di.spi;

import java.util.List;
import java.util.Map;

import ml.shifu.analysis.container.FittedRegression;
import ml.shifu.analysis.container.RegressionFit;

/**
 * Estimation capability behind the regression analyzer. A backend fits linear and logistic models on a design
 * matrix (without the constant column, which the backend adds) and reports the residual diagnostics it supports.
 */
public interface RegressionBackend {

    String getName();

    /**
     * @param termNames
     *            names of the design columns, used to key the per-coefficient statistics together with
     *            {@code intercept}
     */
    RegressionFit fitLinear(double[][] design, double[] y, List<String> termNames);

    /**
     * @param y
     *            0/1 response
     */
    RegressionFit fitLogistic(double[][] design, double[] y, List<String> termNames);

    Map<String, Object> diagnostics(FittedRegression model);
}
