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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renderer that only writes the chart description to the log.
 */
public class LoggingChartRenderer implements ChartRenderer {

    private static Logger log = LoggerFactory.getLogger(LoggingChartRenderer.class);

    @Override
    public void render(ChartSpec spec) {
        log.debug("Rendering {}", spec);
    }
}
