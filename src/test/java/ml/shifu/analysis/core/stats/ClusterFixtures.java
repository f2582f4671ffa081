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

/**
 * Deterministic blobs on a small grid around fixed centers.
 */
public final class ClusterFixtures {

    public static final double[][] CENTERS = { { 0, 0 }, { 10, 10 }, { 0, 10 } };

    private ClusterFixtures() {
    }

    public static double[][] blobs(double[][] centers, int perCenter) {
        double[][] points = new double[centers.length * perCenter][];
        int idx = 0;
        for(double[] center: centers) {
            for(int i = 0; i < perCenter; i++) {
                double dx = ((i % 5) - 2) * 0.2d;
                double dy = ((i / 5) % 5 - 2) * 0.2d;
                points[idx++] = new double[] { center[0] + dx, center[1] + dy };
            }
        }
        return points;
    }
}
