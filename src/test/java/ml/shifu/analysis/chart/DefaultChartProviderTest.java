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
package ml.shifu.analysis.chart;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

public class DefaultChartProviderTest {

    private static class RecordingRenderer implements ChartRenderer {
        private final List<String> rendered = new ArrayList<String>();

        @Override
        public void render(ChartSpec spec) {
            rendered.add(spec.getTitle());
        }
    }

    @Test
    public void testPlotDelegatesToRenderer() {
        RecordingRenderer renderer = new RecordingRenderer();
        ChartProvider provider = new DefaultChartProvider(renderer);

        Map<String, double[]> series = new LinkedHashMap<String, double[]>();
        series.put("inertia", new double[] { 3d, 2d });
        Chart line = provider.lineChart("Elbow", "k", "inertia", new double[] { 2d, 3d }, series);
        line.plot();

        Assert.assertEquals(renderer.rendered, Arrays.asList("Elbow"));
        Assert.assertEquals(line.getType(), ChartType.LINE);
        Assert.assertEquals(line.getSpec().getXLabel(), "k");
        Assert.assertTrue(line.getSpec().getSeries().containsKey("inertia"));
    }

    @Test
    public void testScatterGroupsAreOptional() {
        ChartProvider provider = new DefaultChartProvider();
        Chart plain = provider.scatter("s", "x", "y", new double[] { 1d }, new double[] { 2d }, null);
        Chart grouped = provider.scatter("s", "x", "y", new double[] { 1d }, new double[] { 2d }, new int[] { 0 });
        Assert.assertFalse(plain.getSpec().getSeries().containsKey("group"));
        Assert.assertTrue(grouped.getSpec().getSeries().containsKey("group"));
        // the logging renderer only writes a debug line
        grouped.plot();
    }
}
