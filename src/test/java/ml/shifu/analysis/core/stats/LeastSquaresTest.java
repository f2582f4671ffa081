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

import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.testng.Assert;
import org.testng.annotations.Test;

public class LeastSquaresTest {

    @Test
    public void testExactLine() {
        double[][] x = { { 1 }, { 2 }, { 3 }, { 4 }, { 5 } };
        double[] y = { 5, 7, 9, 11, 13 };
        OLSMultipleLinearRegression ols = LeastSquares.fit(x, y, true);
        double[] beta = ols.estimateRegressionParameters();
        Assert.assertEquals(beta[0], 3d, 1e-9);
        Assert.assertEquals(beta[1], 2d, 1e-9);
        Assert.assertEquals(LeastSquares.rSquared(x, y, true), 1d, 1e-9);
    }

    @Test
    public void testResidualsWithoutPredictors() {
        double[][] x = new double[3][0];
        double[] residuals = LeastSquares.residuals(x, new double[] { 1, 2, 6 }, true);
        Assert.assertEquals(residuals, new double[] { -2, -1, 3 });
    }
}
