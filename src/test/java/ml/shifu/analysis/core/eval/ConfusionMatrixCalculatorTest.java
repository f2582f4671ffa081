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
package ml.shifu.analysis.core.eval;

import java.util.Arrays;
import java.util.List;

import ml.shifu.analysis.container.ConfusionMatrixObject;
import ml.shifu.analysis.container.PerformanceObject;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ConfusionMatrixCalculatorTest {

    private static final double[] ACTUAL = { 0, 0, 1, 1 };
    private static final double[] SCORES = { 0.1, 0.4, 0.35, 0.8 };

    @Test
    public void testAtDefaultThreshold() {
        ConfusionMatrixObject cmo = new ConfusionMatrixCalculator(ACTUAL, SCORES)
                .atThreshold(ConfusionMatrixCalculator.DEFAULT_THRESHOLD);
        Assert.assertEquals(cmo.getTp(), 1d);
        Assert.assertEquals(cmo.getFn(), 1d);
        Assert.assertEquals(cmo.getTn(), 2d);
        Assert.assertEquals(cmo.getFp(), 0d);
        Assert.assertEquals(cmo.getAccuracy(), 0.75d, 1e-12);
        Assert.assertEquals(cmo.getPrecision(), 1d, 1e-12);
        Assert.assertEquals(cmo.getRecall(), 0.5d, 1e-12);
        Assert.assertEquals(cmo.getF1(), 2d / 3d, 1e-12);

        List<List<Long>> matrix = cmo.toMatrix();
        Assert.assertEquals(matrix.get(0), Arrays.asList(2L, 0L));
        Assert.assertEquals(matrix.get(1), Arrays.asList(1L, 1L));
    }

    @Test
    public void testRocAndAuc() {
        ConfusionMatrixCalculator calculator = new ConfusionMatrixCalculator(ACTUAL, SCORES);
        List<PerformanceObject> roc = calculator.roc();
        Assert.assertEquals(roc.size(), 5);
        Assert.assertEquals(roc.get(0).fpr, 0d);
        Assert.assertEquals(roc.get(roc.size() - 1).fpr, 1d);
        Assert.assertEquals(roc.get(roc.size() - 1).recall, 1d);
        Assert.assertEquals(calculator.auc(), 0.75d, 1e-12);
    }

    @Test
    public void testTiedScoresShareOnePoint() {
        ConfusionMatrixCalculator calculator = new ConfusionMatrixCalculator(new double[] { 0, 1, 0, 1 },
                new double[] { 0.5, 0.5, 0.5, 0.5 });
        Assert.assertEquals(calculator.roc().size(), 2);
        Assert.assertEquals(calculator.auc(), 0.5d, 1e-12);
    }

    @Test
    public void testSingleClass() {
        ConfusionMatrixCalculator calculator = new ConfusionMatrixCalculator(new double[] { 1, 1 }, new double[] {
                0.2, 0.9 });
        Assert.assertFalse(calculator.hasBothClasses());
        Assert.assertTrue(calculator.roc().isEmpty());
        Assert.assertNull(calculator.auc());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLengthMismatch() {
        new ConfusionMatrixCalculator(new double[] { 1 }, new double[] { 0.2, 0.3 });
    }
}
