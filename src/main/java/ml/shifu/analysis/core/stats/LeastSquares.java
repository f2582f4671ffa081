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
package ml.shifu.analysis.core.stats;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Small wrappers over {@link OLSMultipleLinearRegression} for auxiliary regressions (partial correlation, VIF and
 * heteroscedasticity tests).
 */
public final class LeastSquares {

    private LeastSquares() {
    }

    /**
     * Fit y on x; when {@code intercept} is true a constant column is added.
     */
    public static OLSMultipleLinearRegression fit(double[][] x, double[] y, boolean intercept) {
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.setNoIntercept(!intercept);
        try {
            ols.newSampleData(y, x);
            // force the QR solve so singular designs fail here
            ols.estimateRegressionParameters();
        } catch (SingularMatrixException e) {
            throw new AnalysisException(AnalysisErrorCode.MODEL_FIT_FAILED, e, "Singular design matrix");
        } catch (MathIllegalArgumentException e) {
            throw new AnalysisException(AnalysisErrorCode.INSUFFICIENT_DATA, e, e.getMessage());
        }
        return ols;
    }

    public static double[] residuals(double[][] x, double[] y, boolean intercept) {
        if(x.length > 0 && x[0].length == 0) {
            double[] centered = y.clone();
            if(intercept) {
                double mean = 0d;
                for(double v: y) {
                    mean += v;
                }
                mean /= y.length;
                for(int i = 0; i < centered.length; i++) {
                    centered[i] -= mean;
                }
            }
            return centered;
        }
        return fit(x, y, intercept).estimateResiduals();
    }

    /**
     * Coefficient of determination; centered when the fit has an intercept, uncentered (1 - RSS / sum y^2)
     * otherwise.
     */
    public static double rSquared(double[][] x, double[] y, boolean intercept) {
        OLSMultipleLinearRegression ols = fit(x, y, intercept);
        if(intercept) {
            return ols.calculateRSquared();
        }
        double total = 0d;
        for(double v: y) {
            total += v * v;
        }
        return total == 0d ? 0d : 1d - ols.calculateResidualSumOfSquares() / total;
    }
}
