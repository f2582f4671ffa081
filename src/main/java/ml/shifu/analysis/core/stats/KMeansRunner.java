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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * k-means++ with several restarts; the run with the lowest inertia wins.
 */
public class KMeansRunner {

    private static Logger log = LoggerFactory.getLogger(KMeansRunner.class);

    private final int k;
    private final int nInit;
    private final int maxIter;
    private final long seed;

    private double[][] centers;
    private int[] labels;
    private double inertia = Double.NaN;

    public KMeansRunner(int k, int nInit, int maxIter, long seed) {
        this.k = k;
        this.nInit = nInit;
        this.maxIter = maxIter;
        this.seed = seed;
    }

    public KMeansRunner fit(double[][] data) {
        if(data.length < k) {
            throw new AnalysisException(AnalysisErrorCode.INSUFFICIENT_DATA, "n_samples=" + data.length
                    + " should be >= n_clusters=" + k);
        }
        List<LabeledPoint> points = new ArrayList<LabeledPoint>(data.length);
        for(int i = 0; i < data.length; i++) {
            points.add(new LabeledPoint(i, data[i]));
        }

        double bestInertia = Double.POSITIVE_INFINITY;
        for(int run = 0; run < nInit; run++) {
            JDKRandomGenerator random = new JDKRandomGenerator();
            random.setSeed(seed + run);
            KMeansPlusPlusClusterer<LabeledPoint> clusterer = new KMeansPlusPlusClusterer<LabeledPoint>(k, maxIter,
                    new EuclideanDistance(), random);
            List<CentroidCluster<LabeledPoint>> clusters;
            try {
                clusters = clusterer.cluster(points);
            } catch (MathIllegalArgumentException e) {
                throw new AnalysisException(AnalysisErrorCode.MODEL_FIT_FAILED, e, "k-means failed: " + e.getMessage());
            }

            double[][] runCenters = new double[clusters.size()][];
            int[] runLabels = new int[data.length];
            double runInertia = 0d;
            for(int c = 0; c < clusters.size(); c++) {
                CentroidCluster<LabeledPoint> cluster = clusters.get(c);
                runCenters[c] = cluster.getCenter().getPoint();
                for(LabeledPoint point: cluster.getPoints()) {
                    runLabels[point.getPosition()] = c;
                    runInertia += Silhouette.squaredEuclidean(point.getPoint(), runCenters[c]);
                }
            }
            log.debug("k-means run {} with k={} has inertia {}", run, k, runInertia);
            if(runInertia < bestInertia) {
                bestInertia = runInertia;
                centers = runCenters;
                labels = runLabels;
            }
        }
        inertia = bestInertia;
        return this;
    }

    public int predict(double[] point) {
        return nearest(centers, point);
    }

    /**
     * Index of the closest center, ties go to the lowest index.
     */
    public static int nearest(double[][] centers, double[] point) {
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for(int c = 0; c < centers.length; c++) {
            double d = Silhouette.squaredEuclidean(point, centers[c]);
            if(d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return best;
    }

    public double[][] getCenters() {
        return centers;
    }

    public int[] getLabels() {
        return labels;
    }

    public double getInertia() {
        return inertia;
    }
}
