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

import org.testng.Assert;
import org.testng.annotations.Test;

public class GaussianMixtureEMTest {

    @Test
    public void testTwoComponents() {
        double[][] data = ClusterFixtures.blobs(new double[][] { { 0, 0 }, { 8, 8 } }, 25);
        GaussianMixtureEM gmm = new GaussianMixtureEM(2, 42L).fit(data);

        Assert.assertTrue(gmm.getIterations() >= 1);
        Assert.assertEquals(gmm.getWeights()[0] + gmm.getWeights()[1], 1d, 1e-9);
        Assert.assertEquals(gmm.getWeights()[0], 0.5d, 1e-6);

        int[] labels = gmm.predict(data);
        for(int i = 1; i < 25; i++) {
            Assert.assertEquals(labels[i], labels[0]);
            Assert.assertEquals(labels[25 + i], labels[25]);
        }
        Assert.assertNotEquals(labels[0], labels[25]);
        Assert.assertEquals(gmm.predict(new double[] { 7.9, 8.1 }), labels[25]);
    }

    @Test
    public void testFittedParametersAreCopies() {
        double[][] data = ClusterFixtures.blobs(new double[][] { { 0, 0 }, { 8, 8 } }, 25);
        GaussianMixtureEM gmm = new GaussianMixtureEM(2, 42L).fit(data);
        int[] labels = gmm.predict(data);

        double[] weights = gmm.getWeights();
        weights[0] = 0d;
        gmm.getMeans()[0][0] = 100d;
        gmm.getCovariances()[0][0][0] = 1e-9;

        Assert.assertEquals(gmm.getWeights()[0], 0.5d, 1e-6);
        Assert.assertTrue(gmm.getMeans()[0][0] < 10d);
        Assert.assertTrue(gmm.getCovariances()[0][0][0] > 1e-6);
        Assert.assertEquals(gmm.predict(data), labels);
    }

    @Test
    public void testInformationCriteria() {
        double[][] data = ClusterFixtures.blobs(new double[][] { { 0, 0 }, { 8, 8 } }, 25);
        GaussianMixtureEM one = new GaussianMixtureEM(1, 7L).fit(data);
        GaussianMixtureEM two = new GaussianMixtureEM(2, 7L).fit(data);

        Assert.assertFalse(Double.isNaN(two.bic(data)));
        Assert.assertTrue(two.bic(data) < one.bic(data));
        Assert.assertTrue(two.aic(data) < one.aic(data));

        double[] scores = two.scoreSamples(data);
        Assert.assertEquals(scores.length, data.length);
    }
}
