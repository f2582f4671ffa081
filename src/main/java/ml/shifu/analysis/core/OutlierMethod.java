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
package ml.shifu.analysis.core;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Constants;

public enum OutlierMethod {
    ZSCORE(Constants.DEFAULT_ZSCORE_THRESHOLD), IQR(Constants.DEFAULT_IQR_THRESHOLD), ISOLATION_FOREST(
            Constants.DEFAULT_CONTAMINATION);

    /**
     * z threshold, IQR multiplier or contamination, depending on the method
     */
    private final double defaultThreshold;

    private OutlierMethod(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public static OutlierMethod of(String name) {
        String lower = name.trim().toLowerCase();
        if("zscore".equals(lower) || "z_score".equals(lower)) {
            return ZSCORE;
        }
        if("iqr".equals(lower)) {
            return IQR;
        }
        if("isolation".equals(lower) || "isolation_forest".equals(lower)) {
            return ISOLATION_FOREST;
        }
        throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported outlier detection method: "
                + name);
    }
}
