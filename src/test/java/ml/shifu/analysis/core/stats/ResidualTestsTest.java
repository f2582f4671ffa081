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

import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ResidualTestsTest {

    @Test
    public void testDurbinWatson() {
        Assert.assertEquals(ResidualTests.durbinWatson(new double[] { 1, -1, 1, -1 }), 3d, 1e-12);
    }

    @Test
    public void testJarqueBeraSymmetric() {
        double[] jb = ResidualTests.jarqueBera(new double[] { -1, 0, 1 });
        // skewness 0, kurtosis 1.5
        Assert.assertEquals(jb[0], 0.28125d, 1e-12);
        Assert.assertTrue(jb[1] > 0.8);
    }

    @Test
    public void testLjungBoxAlternatingSeries() {
        double[] residuals = new double[40];
        for(int i = 0; i < residuals.length; i++) {
            residuals[i] = i % 2 == 0 ? 1d : -1d;
        }
        double[] q = ResidualTests.ljungBox(residuals);
        Assert.assertTrue(q[0] > 30d);
        Assert.assertTrue(q[1] < 1e-6);

        double[] constant = ResidualTests.ljungBox(new double[] { 2, 2, 2 });
        Assert.assertTrue(Double.isNaN(constant[0]));
    }

    @Test
    public void testVarianceInflationOrthogonal() {
        double[][] x = { { 1, 1 }, { 2, -1 }, { 3, -1 }, { 4, 1 } };
        double[] vif = ResidualTests.varianceInflation(x);
        Assert.assertEquals(vif.length, 3);
        Assert.assertEquals(vif[1], 1d, 1e-9);
        Assert.assertEquals(vif[2], 1d, 1e-9);
        Assert.assertTrue(vif[0] > 1d);
    }

    @Test
    public void testBreuschPaganGrowingSpread() {
        int n = 60;
        double[][] x = new double[n][1];
        double[] residuals = new double[n];
        for(int i = 0; i < n; i++) {
            x[i][0] = i + 1;
            residuals[i] = (i % 2 == 0 ? 1d : -1d) * (i + 1);
        }
        Map<String, Object> bp = ResidualTests.breuschPagan(residuals, x);
        Assert.assertEquals(bp.keySet().toString(), "[lagrange_multiplier, p_value, f_value, f_p_value]");
        Assert.assertTrue((Double) bp.get("p_value") < 0.05);
        Assert.assertTrue((Double) bp.get("f_p_value") < 0.05);
    }
}
