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

/**
 * One point of a ROC / PR curve, computed at a score threshold.
 */
public class PerformanceObject {

    /**
     * scores &gt;= threshold are predicted positive
     */
    public double threshold;

    /**
     * true positive rate = tp / (tp + fn)
     */
    public double recall;

    /**
     * tp / (tp + fp)
     */
    public double precision;

    /**
     * false positive rate = fp / (fp + tn)
     */
    public double fpr;

    public PerformanceObject() {
    }

    public PerformanceObject(double threshold, double recall, double precision, double fpr) {
        this.threshold = threshold;
        this.recall = recall;
        this.precision = precision;
        this.fpr = fpr;
    }

    @Override
    public String toString() {
        return "PerformanceObject [threshold=" + threshold + ", recall=" + recall + ", precision=" + precision
                + ", fpr=" + fpr + "]";
    }
}
