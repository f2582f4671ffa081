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

/**
 * Opaque chart handle attached to an analysis result. The analysis core only relies on {@link #getTitle()} and
 * {@link #plot()}; how a chart is rendered is up to the implementation.
 */
public interface Chart {

    String getTitle();

    ChartType getType();

    /**
     * @return the data the chart was built from
     */
    ChartSpec getSpec();

    /**
     * Render the chart.
     */
    void plot();
}
