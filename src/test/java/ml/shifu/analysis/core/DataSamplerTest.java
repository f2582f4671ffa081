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

import java.util.HashSet;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.analysis.exception.AnalysisException;

public class DataSamplerTest {

    @Test
    public void testSampleSize() {
        Assert.assertEquals(DataSampler.sampleSize(10, 4, null), 4);
        Assert.assertEquals(DataSampler.sampleSize(10, null, 0.25d), 2);
        Assert.assertEquals(DataSampler.sampleSize(10, null, 1d), 10);
    }

    @Test(expectedExceptions = AnalysisException.class)
    public void testTooLargeSample() {
        DataSampler.sampleSize(10, 11, null);
    }

    @Test(expectedExceptions = AnalysisException.class)
    public void testFractionOutOfRange() {
        DataSampler.sampleSize(10, null, 1.5d);
    }

    @Test
    public void testSampleWithoutReplacement() {
        List<Integer> positions = DataSampler.sample(100, 30, 7L);
        Assert.assertEquals(positions.size(), 30);
        Assert.assertEquals(new HashSet<Integer>(positions).size(), 30);
        for(int p: positions) {
            Assert.assertTrue(p >= 0 && p < 100);
        }
        Assert.assertEquals(DataSampler.sample(100, 30, 7L), positions);
    }
}
