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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import ml.shifu.analysis.container.ConfusionMatrixObject;
import ml.shifu.analysis.container.PerformanceObject;

/**
 * Classification metrics for 0/1 targets against probability scores.
 */
public class ConfusionMatrixCalculator {

    public static final double DEFAULT_THRESHOLD = 0.5d;

    private final double[] actual;

    private final double[] scores;

    /**
     * @param actual
     *            0/1 labels
     * @param scores
     *            predicted probability of class 1
     */
    public ConfusionMatrixCalculator(double[] actual, double[] scores) {
        if(actual.length != scores.length) {
            throw new IllegalArgumentException("actual and scores must have the same length");
        }
        this.actual = actual;
        this.scores = scores;
    }

    public ConfusionMatrixObject atThreshold(double threshold) {
        ConfusionMatrixObject cmo = new ConfusionMatrixObject();
        cmo.setScore(threshold);
        for(int i = 0; i < actual.length; i++) {
            boolean positive = scores[i] >= threshold;
            if(actual[i] > 0.5d) {
                if(positive) {
                    cmo.setTp(cmo.getTp() + 1);
                } else {
                    cmo.setFn(cmo.getFn() + 1);
                }
            } else {
                if(positive) {
                    cmo.setFp(cmo.getFp() + 1);
                } else {
                    cmo.setTn(cmo.getTn() + 1);
                }
            }
        }
        return cmo;
    }

    public boolean hasBothClasses() {
        boolean pos = false, neg = false;
        for(double a: actual) {
            if(a > 0.5d) {
                pos = true;
            } else {
                neg = true;
            }
        }
        return pos && neg;
    }

    /**
     * ROC points at every distinct score, from (0, 0) to (1, 1). Empty when only one class is present.
     */
    public List<PerformanceObject> roc() {
        List<PerformanceObject> curve = new ArrayList<PerformanceObject>();
        if(!hasBothClasses()) {
            return curve;
        }
        Integer[] order = new Integer[scores.length];
        for(int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, new Comparator<Integer>() {
            @Override
            public int compare(Integer a, Integer b) {
                return Double.compare(scores[b], scores[a]);
            }
        });
        double positives = 0d, negatives = 0d;
        for(double a: actual) {
            if(a > 0.5d) {
                positives++;
            } else {
                negatives++;
            }
        }
        curve.add(new PerformanceObject(Double.POSITIVE_INFINITY, 0d, 1d, 0d));
        double tp = 0d, fp = 0d;
        for(int i = 0; i < order.length; i++) {
            int idx = order[i];
            if(actual[idx] > 0.5d) {
                tp++;
            } else {
                fp++;
            }
            // emit a point once all tied scores are consumed
            if(i == order.length - 1 || scores[order[i + 1]] != scores[idx]) {
                curve.add(new PerformanceObject(scores[idx], tp / positives, tp / (tp + fp), fp / negatives));
            }
        }
        return curve;
    }

    /**
     * @return ROC AUC, or null when only one class is present
     */
    public Double auc() {
        if(!hasBothClasses()) {
            return null;
        }
        return AreaUnderCurve.ofRoc(roc());
    }
}
