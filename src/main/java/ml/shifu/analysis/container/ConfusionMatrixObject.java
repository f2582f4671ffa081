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

import java.util.Arrays;
import java.util.List;

/**
 * Binary confusion matrix counts at one score threshold.
 */
public class ConfusionMatrixObject {

    private double tp, fp, tn, fn;

    private double score;

    public ConfusionMatrixObject() {
        this.tp = 0.0;
        this.fn = 0.0;
        this.fp = 0.0;
        this.tn = 0.0;
    }

    public ConfusionMatrixObject(ConfusionMatrixObject cmo) {
        this.tp = cmo.tp;
        this.fn = cmo.fn;
        this.fp = cmo.fp;
        this.tn = cmo.tn;
        this.score = cmo.score;
    }

    public double getTp() {
        return tp;
    }

    public void setTp(double tp) {
        this.tp = tp;
    }

    public double getFp() {
        return fp;
    }

    public void setFp(double fp) {
        this.fp = fp;
    }

    public double getTn() {
        return tn;
    }

    public void setTn(double tn) {
        this.tn = tn;
    }

    public double getFn() {
        return fn;
    }

    public void setFn(double fn) {
        this.fn = fn;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public double getTotal() {
        return tp + fp + tn + fn;
    }

    public double getAccuracy() {
        double total = getTotal();
        return total == 0d ? 0d : (tp + tn) / total;
    }

    /**
     * 0 when nothing is predicted positive.
     */
    public double getPrecision() {
        return tp + fp == 0d ? 0d : tp / (tp + fp);
    }

    public double getRecall() {
        return tp + fn == 0d ? 0d : tp / (tp + fn);
    }

    public double getF1() {
        double p = getPrecision(), r = getRecall();
        return p + r == 0d ? 0d : 2d * p * r / (p + r);
    }

    /**
     * [[TN, FP], [FN, TP]]
     */
    public List<List<Long>> toMatrix() {
        return Arrays.asList(Arrays.asList((long) tn, (long) fp), Arrays.asList((long) fn, (long) tp));
    }

    @Override
    public String toString() {
        return "ConfusionMatrixObject [tp=" + tp + ", fp=" + fp + ", tn=" + tn + ", fn=" + fn + ", score=" + score
                + "]";
    }
}
