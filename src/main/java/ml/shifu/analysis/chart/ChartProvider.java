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

/**
 * Factory the analyzers use to obtain chart handles. Implementations decide the concrete {@link Chart} type, which
 * keeps the analysis code free of any rendering library.
 */
public interface ChartProvider {

    Chart histogram(String title, String column, double[] values);

    Chart boxPlot(String title, String column, double[] values);

    Chart barChart(String title, List<String> categories, List<Number> counts);

    Chart heatmap(String title, List<String> rowLabels, List<String> columnLabels, double[][] values);

    Chart scatter(String title, String xLabel, String yLabel, double[] x, double[] y, int[] groups);

    Chart scatter3d(String title, List<String> axes, double[][] points, int[] groups);

    /**
     * @param series
     *            ordered map of series name to y values, sharing the x values
     */
    Chart lineChart(String title, String xLabel, String yLabel, double[] x, Map<String, double[]> series);

    Chart dendrogram(String title, double[][] linkage);
}
