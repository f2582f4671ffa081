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
package ml.shifu.analysis.core.stats;

import java.util.HashMap;
import java.util.Map;

/**
 * Mean silhouette coefficient with euclidean distance.
 */
public final class Silhouette {

    private Silhouette() {
    }

    /**
     * @return mean silhouette over all points, or 0 when the labels define fewer than 2 or as many clusters as points
     */
    public static double score(double[][] points, int[] labels) {
        int n = points.length;
        Map<Integer, Integer> sizes = new HashMap<Integer, Integer>();
        for(int label: labels) {
            Integer size = sizes.get(label);
            sizes.put(label, size == null ? 1 : size + 1);
        }
        int k = sizes.size();
        if(k < 2 || k >= n) {
            return 0d;
        }

        double total = 0d;
        for(int i = 0; i < n; i++) {
            Map<Integer, Double> distanceSums = new HashMap<Integer, Double>();
            for(int j = 0; j < n; j++) {
                if(i == j) {
                    continue;
                }
                Double sum = distanceSums.get(labels[j]);
                distanceSums.put(labels[j], (sum == null ? 0d : sum) + euclidean(points[i], points[j]));
            }
            int own = sizes.get(labels[i]);
            if(own <= 1) {
                // singleton clusters score 0
                continue;
            }
            double a = distanceSums.get(labels[i]) / (own - 1);
            double b = Double.POSITIVE_INFINITY;
            for(Map.Entry<Integer, Double> entry: distanceSums.entrySet()) {
                if(entry.getKey() != labels[i]) {
                    b = Math.min(b, entry.getValue() / sizes.get(entry.getKey()));
                }
            }
            double denominator = Math.max(a, b);
            total += denominator == 0d ? 0d : (b - a) / denominator;
        }
        return total / n;
    }

    public static double euclidean(double[] a, double[] b) {
        return Math.sqrt(squaredEuclidean(a, b));
    }

    public static double squaredEuclidean(double[] a, double[] b) {
        double sum = 0d;
        for(int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }
}
