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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

public class DatasetTest {

    @Test
    public void testFromColumns() {
        Map<String, Object> columns = new LinkedHashMap<String, Object>();
        columns.put("x", new double[] { 1.5, 2.5, Double.NaN });
        columns.put("n", Arrays.asList(1, 2, 3));
        columns.put("s", Arrays.asList("a", "b", null));
        Dataset dataset = Dataset.from(columns, "sample");

        Assert.assertEquals(dataset.getName(), "sample");
        Assert.assertEquals(dataset.getShape(), new int[] { 3, 3 });
        Assert.assertEquals(dataset.getNumericColumns(), Arrays.asList("x", "n"));
        Assert.assertEquals(dataset.getCategoricalColumns(), Arrays.asList("s"));
        Assert.assertEquals(dataset.getDtypes().get("n"), "integer");
        Assert.assertEquals(dataset.getData().getColumn("x").getMissingCount(), 1);
    }

    @Test
    public void testFromRecords() {
        List<Map<String, Object>> records = new ArrayList<Map<String, Object>>();
        Map<String, Object> first = new LinkedHashMap<String, Object>();
        first.put("a", 1);
        first.put("b", "x");
        Map<String, Object> second = new LinkedHashMap<String, Object>();
        second.put("a", 2);
        second.put("c", 3.5);
        records.add(first);
        records.add(second);

        DataTable table = Dataset.from(records).getData();
        Assert.assertEquals(table.getColumnNames(), Arrays.asList("a", "b", "c"));
        Assert.assertTrue(table.getColumn("b").isMissing(1));
        Assert.assertTrue(table.getColumn("c").isMissing(0));
    }

    @Test
    public void testFromArray() {
        DataTable table = Dataset.from(new double[][] { { 1, 2 }, { 3, 4 }, { 5, 6 } }).getData();
        Assert.assertEquals(table.getColumnNames(), Arrays.asList("0", "1"));
        Assert.assertEquals(table.getColumn("1").getDouble(2), 6d);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnsupportedInput() {
        Dataset.from("not a table");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRaggedColumns() {
        Map<String, Object> columns = new LinkedHashMap<String, Object>();
        columns.put("a", Arrays.asList(1, 2));
        columns.put("b", Arrays.asList(1, 2, 3));
        Dataset.from(columns);
    }

    @Test
    public void testDictRoundTrip() {
        Map<String, Object> columns = new LinkedHashMap<String, Object>();
        columns.put("a", Arrays.asList(1, 2));
        columns.put("b", Arrays.asList("x", "y"));
        Dataset dataset = new Dataset(Dataset.toTable(columns), "demo", "two rows", null);
        dataset.getMetadata().put("source", "unit");

        Dataset restored = Dataset.fromDict(dataset.toDict());
        Assert.assertEquals(restored.getName(), "demo");
        Assert.assertEquals(restored.getDescription(), "two rows");
        Assert.assertEquals(restored.getMetadata().get("source"), "unit");
        Assert.assertEquals(restored.getData().toRecords(), dataset.getData().toRecords());
    }
}
