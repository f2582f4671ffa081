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
package ml.shifu.analysis.core.eval;

import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.container.PerformanceObject;

/**
 * Area under a curve by the trapezoidal rule.
 */
public final class AreaUnderCurve {

    private AreaUnderCurve() {
    }

    private static final Logger LOG = LoggerFactory.getLogger(AreaUnderCurve.class);

    /**
     * Area under the segment (x1, y1) - (x2, y2); x2 is expected to be no less than x1.
     */
    public static double trapezoid(double x1, double y1, double x2, double y2) {
        return (y2 + y1) * (x2 - x1) / 2.0;
    }

    /**
     * @return area under the ROC curve, 0 if fewer than 2 points
     */
    public static double ofRoc(List<PerformanceObject> roc) {
        return calculateArea(roc, Performances.fpr(), Performances.recall());
    }

    public static double ofPr(List<PerformanceObject> pr) {
        return calculateArea(pr, Performances.recall(), Performances.precision());
    }

    /**
     * @throws IllegalArgumentException
     *             if either extractor is null
     */
    public static double calculateArea(List<PerformanceObject> perform, PerformanceExtractor xExtractor,
            PerformanceExtractor yExtractor) {
        if(perform == null) {
            LOG.warn("Input PerformanceObject list is null.");
            return 0;
        }

        if(perform.size() < 2) {
            LOG.warn("At least 2 points are needed to calculate an area.");
            return 0;
        }

        if(xExtractor == null || yExtractor == null) {
            throw new IllegalArgumentException("The xExtractor and yExtractor can't be null!");
        }

        Iterator<PerformanceObject> iterator = perform.iterator();
        double sum = 0.0;
        PerformanceObject per = iterator.next();
        double x1 = xExtractor.extract(per);
        double y1 = yExtractor.extract(per);
        while(iterator.hasNext()) {
            per = iterator.next();
            double x2 = xExtractor.extract(per);
            double y2 = yExtractor.extract(per);
            sum += trapezoid(x1, y1, x2, y2);
            x1 = x2;
            y1 = y2;
        }
        return sum;
    }

}
