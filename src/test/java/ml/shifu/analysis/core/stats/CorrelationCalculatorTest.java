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

import org.apache.commons.math3.special.Erf;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CorrelationCalculatorTest {

    @Test
    public void testPerfectPearson() {
        double[] r = CorrelationCalculator.pearson(new double[] { 1, 2, 3, 4, 5 }, new double[] { 3, 5, 7, 9, 11 });
        Assert.assertEquals(r[0], 1d, 1e-12);
        Assert.assertEquals(r[1], 0d, 1e-12);
    }

    @Test
    public void testPearsonPValue() {
        double[] r = CorrelationCalculator.pearson(new double[] { 1, 2, 3, 4, 5 }, new double[] { 2, 4, 5, 4, 5 });
        Assert.assertEquals(r[0], 0.7745966692414834, 1e-9);
        // t = 2.1213 on 3 degrees of freedom
        Assert.assertEquals(r[1], 0.1247, 1e-3);
    }

    @Test
    public void testSpearmanAveragesTies() {
        double[] r = CorrelationCalculator.spearman(new double[] { 1, 2, 3, 4, 5 }, new double[] { 5, 6, 7, 8, 7 });
        Assert.assertEquals(r[0], 8d / Math.sqrt(95d), 1e-9);
    }

    @Test
    public void testKendallTauB() {
        double[] r = CorrelationCalculator.kendall(new double[] { 12, 2, 1, 12, 2 }, new double[] { 1, 4, 7, 1, 0 });
        Assert.assertEquals(r[0], -0.4714045207910317, 1e-9);
        Assert.assertEquals(r[1], 0.2827, 1e-3);
    }

    @Test
    public void testKendallMonotone() {
        double[] r = CorrelationCalculator.kendall(new double[] { 1, 2, 3, 4, 5, 6 }, new double[] { 1, 4, 9, 16, 25,
                36 });
        Assert.assertEquals(r[0], 1d, 1e-12);
        // exact: 2 / 6!
        Assert.assertEquals(r[1], 2d / 720d, 1e-12);
    }

    @Test
    public void testKendallExactOneSwap() {
        double[] r = CorrelationCalculator.kendall(new double[] { 1, 2, 3, 4, 5, 6 }, new double[] { 1, 2, 3, 4, 6, 5 });
        Assert.assertEquals(r[0], 13d / 15d, 1e-12);
        Assert.assertEquals(r[1], 2d * 6d / 720d, 1e-12);
    }

    @Test
    public void testKendallExactByInversionCount() {
        // 2 discordant pairs of 10; 1 + 4 + 9 permutations of 5 have at most 2 inversions
        double[] r = CorrelationCalculator.kendall(new double[] { 1, 2, 3, 4, 5 }, new double[] { 2, 1, 4, 3, 5 });
        Assert.assertEquals(r[0], 0.6, 1e-12);
        Assert.assertEquals(r[1], 28d / 120d, 1e-12);
    }

    @Test
    public void testKendallExactHalfDiscordant() {
        Assert.assertEquals(CorrelationCalculator.kendallExactPValue(4, 3L), 1d, 1e-12);
    }

    @Test
    public void testKendallLargeSampleUsesNormalApproximation() {
        int n = 40;
        double[] x = new double[n];
        double[] y = new double[n];
        for(int i = 0; i < n; i++) {
            x[i] = i;
            y[i] = (i % 2 == 0) ? i + 1 : i - 1;
        }
        double[] r = CorrelationCalculator.kendall(x, y);
        // 20 discordant pairs, z = (780 - 40) / sqrt(40 * 39 * 85 / 18)
        double z = 740d / Math.sqrt(40d * 39d * 85d / 18d);
        Assert.assertEquals(r[1], Erf.erfc(z / Math.sqrt(2d)), 1e-12);
    }

    @Test
    public void testTTestPValueBounds() {
        Assert.assertEquals(CorrelationCalculator.tTestPValue(0d, 10), 1d, 1e-12);
        Assert.assertEquals(CorrelationCalculator.tTestPValue(1d, 10), 0d, 1e-12);
    }
}
