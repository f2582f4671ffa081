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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.analysis.container.Column;
import ml.shifu.analysis.container.DataTable;

public class OutlierDetectorTest {

    private static final double[] VALUES = { 1, 2, 3, 4, 5, 100 };

    @Test
    public void testZScoreMask() {
        boolean[] mask = OutlierDetector.zScoreMask(VALUES, 2.0d, true);
        Assert.assertEquals(mask, new boolean[] { false, false, false, false, false, true });
        Assert.assertEquals(OutlierDetector.zScoreMask(new double[] { 4, 4, 4 }, 1d, true), new boolean[3]);
    }

    @Test
    public void testIqrMask() {
        double[] bounds = OutlierDetector.iqrBounds(VALUES, 1.5d);
        // Q1 = 2.25, Q3 = 4.75 with linear interpolation
        Assert.assertEquals(bounds[0], 2.25d - 1.5d * 2.5d, 1e-12);
        Assert.assertEquals(bounds[1], 4.75d + 1.5d * 2.5d, 1e-12);
        boolean[] mask = OutlierDetector.iqrMask(VALUES, 1.5d, false);
        for(int i = 0; i < VALUES.length; i++) {
            Assert.assertEquals(mask[i], VALUES[i] < bounds[0] || VALUES[i] > bounds[1]);
        }
        Assert.assertTrue(mask[5]);
    }

    @Test
    public void testIsolationForestFlagsExtremeValue() {
        double[] values = new double[50];
        for(int i = 0; i < 49; i++) {
            values[i] = 10d + (i % 7) * 0.1d;
        }
        values[49] = 500d;
        boolean[] mask = OutlierDetector.isolationForestMask(values, 0.02d, 100, 42L);
        Assert.assertTrue(mask[49]);
        int flagged = 0;
        for(boolean b: mask) {
            flagged += b ? 1 : 0;
        }
        Assert.assertTrue(flagged <= 2);
    }

    @Test
    public void testReport() {
        DataTable table = new DataTable().addColumn(Column.ofDoubles("A", VALUES));
        Map<String, Object> report = OutlierDetector.report(table, table.getColumn("A"), OutlierMethod.ZSCORE, 2.0d,
                100, 42L);
        @SuppressWarnings("unchecked")
        List<Integer> indices = (List<Integer>) report.get("outlier_indices");
        Assert.assertEquals(indices, Arrays.asList(5));
        Assert.assertEquals(report.get("outlier_count"), 1);
        Assert.assertEquals(report.get("threshold"), 2.0d);
    }
}
