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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renderer-neutral description of a chart: axis names, category labels and named data series.
 */
public class ChartSpec {

    private final String title;
    private final ChartType type;
    private String xLabel;
    private String yLabel;
    private List<String> labels = new ArrayList<String>();
    private final Map<String, Object> series = new LinkedHashMap<String, Object>();

    public ChartSpec(String title, ChartType type) {
        this.title = title;
        this.type = type;
    }

    public ChartSpec axes(String xLabel, String yLabel) {
        this.xLabel = xLabel;
        this.yLabel = yLabel;
        return this;
    }

    public ChartSpec labels(List<String> labels) {
        this.labels = new ArrayList<String>(labels);
        return this;
    }

    public ChartSpec series(String name, Object data) {
        this.series.put(name, data);
        return this;
    }

    public String getTitle() {
        return title;
    }

    public ChartType getType() {
        return type;
    }

    public String getXLabel() {
        return xLabel;
    }

    public String getYLabel() {
        return yLabel;
    }

    public List<String> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    public Map<String, Object> getSeries() {
        return Collections.unmodifiableMap(series);
    }

    @Override
    public String toString() {
        return "ChartSpec [title=" + title + ", type=" + type + ", series=" + series.keySet() + "]";
    }
}
