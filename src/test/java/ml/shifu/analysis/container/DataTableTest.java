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
package ml.shifu.analysis.container;

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

public class DataTableTest {

    private DataTable newTable() {
        return new DataTable().addColumn(Column.ofDoubles("a", new double[] { 1, Double.NaN, 3, 4 }))
                .addColumn(Column.inferred("b", Arrays.asList("x", "y", "z", "w")));
    }

    @Test
    public void testTakeKeepsRowLabels() {
        DataTable table = newTable().take(Arrays.asList(3, 0));
        Assert.assertEquals(table.getRowIndex(), Arrays.asList(3, 0));
        Assert.assertEquals(table.getColumn("b").get(0), "w");

        DataTable filtered = newTable().dropMissing(Arrays.asList("a"));
        Assert.assertEquals(filtered.getRowIndex(), Arrays.asList(0, 2, 3));
        Assert.assertEquals(filtered.toMatrix(Arrays.asList("a"))[1][0], 3d);
    }

    @Test
    public void testShapeAndTypes() {
        DataTable table = newTable();
        Assert.assertEquals(table.getShape(), new int[] { 4, 2 });
        Assert.assertEquals(table.getNumericColumnNames(), Arrays.asList("a"));
        Assert.assertEquals(table.getCategoricalColumnNames(), Arrays.asList("b"));
        Assert.assertEquals(table.getTotalMissingCount(), 1);
    }

    @Test
    public void testRequireColumn() {
        try {
            newTable().requireColumn("c");
            Assert.fail();
        } catch (AnalysisException e) {
            Assert.assertEquals(e.getError(), AnalysisErrorCode.COLUMN_NOT_FOUND);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLengthMismatch() {
        newTable().addColumn(Column.ofDoubles("c", new double[] { 1 }));
    }

    @Test
    public void testCopyIsDeep() {
        DataTable table = newTable();
        DataTable copy = table.copy();
        copy.getColumn("a").set(0, 10d);
        Assert.assertEquals(table.getColumn("a").getDouble(0), 1d);
    }
}
