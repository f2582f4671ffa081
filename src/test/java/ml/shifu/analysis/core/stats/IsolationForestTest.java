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

public class IsolationForestTest {

    @Test
    public void testIsolatedPointScoresHighest() {
        double[][] data = new double[41][];
        for(int i = 0; i < 40; i++) {
            data[i] = new double[] { (i % 8) * 0.1d, (i / 8) * 0.1d };
        }
        data[40] = new double[] { 25d, 25d };
        IsolationForest forest = new IsolationForest(100, IsolationForest.DEFAULT_SAMPLE_SIZE, 42L).fit(data);

        double[] scores = forest.scoreSamples(data);
        for(int i = 0; i < 40; i++) {
            Assert.assertTrue(scores[40] > scores[i]);
        }
        boolean[] outliers = forest.predict(data, 0.02d);
        Assert.assertTrue(outliers[40]);
    }

    @Test
    public void testAveragePathLength() {
        Assert.assertEquals(IsolationForest.averagePathLength(1), 0d);
        Assert.assertEquals(IsolationForest.averagePathLength(2), 1d);
        Assert.assertTrue(IsolationForest.averagePathLength(256) > IsolationForest.averagePathLength(16));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testScoreBeforeFit() {
        new IsolationForest(10, 16, 1L).scoreSamples(new double[][] { { 1 } });
    }
}
