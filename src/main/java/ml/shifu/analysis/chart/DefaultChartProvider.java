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

import java.util.List;
import java.util.Map;

import com.google.inject.Inject;

/**
 * Builds {@link SimpleChart} handles backed by a {@link ChartRenderer}, the {@link LoggingChartRenderer} unless one
 * is injected.
 */
public class DefaultChartProvider implements ChartProvider {

    private final ChartRenderer renderer;

    public DefaultChartProvider() {
        this(new LoggingChartRenderer());
    }

    @Inject
    public DefaultChartProvider(ChartRenderer renderer) {
        this.renderer = renderer;
    }

    private Chart of(ChartSpec spec) {
        return new SimpleChart(spec, renderer);
    }

    @Override
    public Chart histogram(String title, String column, double[] values) {
        return of(new ChartSpec(title, ChartType.HISTOGRAM).axes(column, "Frequency").series(column, values));
    }

    @Override
    public Chart boxPlot(String title, String column, double[] values) {
        return of(new ChartSpec(title, ChartType.BOX).axes(null, column).series(column, values));
    }

    @Override
    public Chart barChart(String title, List<String> categories, List<Number> counts) {
        return of(new ChartSpec(title, ChartType.BAR).axes("Value", "Count").labels(categories)
                .series("count", counts));
    }

    @Override
    public Chart heatmap(String title, List<String> rowLabels, List<String> columnLabels, double[][] values) {
        return of(new ChartSpec(title, ChartType.HEATMAP).labels(columnLabels).series("rows", rowLabels)
                .series("values", values));
    }

    @Override
    public Chart scatter(String title, String xLabel, String yLabel, double[] x, double[] y, int[] groups) {
        ChartSpec spec = new ChartSpec(title, ChartType.SCATTER).axes(xLabel, yLabel).series("x", x).series("y", y);
        if(groups != null) {
            spec.series("group", groups);
        }
        return of(spec);
    }

    @Override
    public Chart scatter3d(String title, List<String> axes, double[][] points, int[] groups) {
        ChartSpec spec = new ChartSpec(title, ChartType.SCATTER_3D).labels(axes).series("points", points);
        if(groups != null) {
            spec.series("group", groups);
        }
        return of(spec);
    }

    @Override
    public Chart lineChart(String title, String xLabel, String yLabel, double[] x, Map<String, double[]> series) {
        ChartSpec spec = new ChartSpec(title, ChartType.LINE).axes(xLabel, yLabel).series("x", x);
        for(Map.Entry<String, double[]> entry: series.entrySet()) {
            spec.series(entry.getKey(), entry.getValue());
        }
        return of(spec);
    }

    @Override
    public Chart dendrogram(String title, double[][] linkage) {
        return of(new ChartSpec(title, ChartType.DENDROGRAM).axes("Sample index", "Distance").series("linkage",
                linkage));
    }
}
