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

import org.apache.commons.math3.distribution.NormalDistribution;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ShapiroWilkTest {

    @Test
    public void testNormalScoresLookNormal() {
        NormalDistribution normal = new NormalDistribution(0d, 1d);
        int n = 50;
        double[] values = new double[n];
        for(int i = 0; i < n; i++) {
            values[i] = normal.inverseCumulativeProbability((i + 1 - 0.375d) / (n + 0.25d));
        }
        double[] result = ShapiroWilk.test(values);
        Assert.assertTrue(result[0] > 0.98, "W=" + result[0]);
        Assert.assertTrue(result[1] > 0.5, "p=" + result[1]);
    }

    @Test
    public void testExponentialGrowthIsRejected() {
        double[] values = new double[20];
        for(int i = 0; i < values.length; i++) {
            values[i] = Math.exp(i + 1);
        }
        double[] result = ShapiroWilk.test(values);
        Assert.assertTrue(result[0] < 0.9);
        Assert.assertTrue(result[1] < 0.05);
    }

    @Test
    public void testThreeEquallySpacedPoints() {
        double[] result = ShapiroWilk.test(new double[] { 3, 1, 2 });
        Assert.assertEquals(result[0], 1d, 1e-12);
        Assert.assertEquals(result[1], 1d, 1e-9);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTooFewValues() {
        ShapiroWilk.test(new double[] { 1, 2 });
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testConstantValues() {
        ShapiroWilk.test(new double[] { 4, 4, 4, 4 });
    }
}
