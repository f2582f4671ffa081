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

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.analysis.core.Normalizer.NormalizeMethod;

public class NormalizerTest {

    @Test
    public void computeZScore() {
        Assert.assertEquals(Normalizer.computeZScore(2, 2, 1), 0.0);
        Assert.assertEquals(Normalizer.computeZScore(12, 2, 2), 5.0);
        Assert.assertEquals(Normalizer.computeZScore(2, 4, 1), -2.0);

        // If stdDev == 0, return 0
        Assert.assertEquals(Normalizer.computeZScore(12, 2, 0), 0.0);
    }

    @Test
    public void testStandard() {
        double[] scaled = Normalizer.normalize(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 }, NormalizeMethod.STANDARD);
        BasicStatsCalculator stats = new BasicStatsCalculator(scaled);
        Assert.assertEquals(stats.getMean(), 0d, 1e-9);
        Assert.assertEquals(stats.getStdDev(), 1d, 1e-9);
    }

    @Test
    public void testMinMaxKeepsMissing() {
        double[] scaled = Normalizer.normalize(new double[] { 10, Double.NaN, 20, 15 }, NormalizeMethod.MIN_MAX);
        Assert.assertEquals(scaled[0], 0d);
        Assert.assertTrue(Double.isNaN(scaled[1]));
        Assert.assertEquals(scaled[2], 1d);
        Assert.assertEquals(scaled[3], 0.5d, 1e-12);
    }

    @Test
    public void testRobustAndMaxAbs() {
        double[] robust = Normalizer.normalize(new double[] { 1, 2, 3, 4, 5 }, NormalizeMethod.ROBUST);
        // median 3, Q1 2, Q3 4
        Assert.assertEquals(robust[0], -1d, 1e-12);
        Assert.assertEquals(robust[4], 1d, 1e-12);

        double[] maxAbs = Normalizer.normalize(new double[] { -8, 2, 4 }, NormalizeMethod.MAX_ABS);
        Assert.assertEquals(maxAbs[0], -1d, 1e-12);
        Assert.assertEquals(maxAbs[2], 0.5d, 1e-12);
    }

    @Test
    public void testZeroScale() {
        Assert.assertNull(Normalizer.normalize(new double[] { 3, 3, 3 }, NormalizeMethod.STANDARD));
        Assert.assertNull(Normalizer.normalize(new double[] { 3, 3, 3 }, NormalizeMethod.MIN_MAX));
    }

    @Test
    public void testMethodOf() {
        Assert.assertEquals(NormalizeMethod.of("min_max"), NormalizeMethod.MIN_MAX);
        Assert.assertEquals(NormalizeMethod.of("Robust"), NormalizeMethod.ROBUST);
    }
}
