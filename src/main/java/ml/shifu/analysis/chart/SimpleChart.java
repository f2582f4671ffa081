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

public class SimpleChart implements Chart {

    private final ChartSpec spec;
    private final ChartRenderer renderer;

    public SimpleChart(ChartSpec spec, ChartRenderer renderer) {
        this.spec = spec;
        this.renderer = renderer;
    }

    @Override
    public String getTitle() {
        return spec.getTitle();
    }

    @Override
    public ChartType getType() {
        return spec.getType();
    }

    @Override
    public ChartSpec getSpec() {
        return spec;
    }

    @Override
    public void plot() {
        renderer.render(spec);
    }

    @Override
    public String toString() {
        return "Chart [" + spec.getType() + ": " + spec.getTitle() + "]";
    }
}
