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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.ml.distance.ManhattanDistance;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Agglomerative clustering with Lance-Williams distance updates. The merge history is kept in the usual linkage
 * matrix layout: one row per merge holding {clusterA, clusterB, distance, size}, where ids below n are original points
 * and id n + i is the cluster created by row i.
 */
public class HierarchicalClusterer {

    public static enum Linkage {
        WARD, COMPLETE, AVERAGE, SINGLE;

        public static Linkage of(String name) {
            for(Linkage linkage: values()) {
                if(linkage.name().equalsIgnoreCase(name)) {
                    return linkage;
                }
            }
            throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported linkage: " + name);
        }
    }

    private final Linkage linkage;

    private final DistanceMeasure measure;

    private double[][] linkageMatrix;

    private int n;

    public HierarchicalClusterer(Linkage linkage) {
        this(linkage, new EuclideanDistance());
    }

    public HierarchicalClusterer(Linkage linkage, DistanceMeasure measure) {
        if(linkage == Linkage.WARD && !(measure instanceof EuclideanDistance)) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Ward linkage requires euclidean distance");
        }
        this.linkage = linkage;
        this.measure = measure;
    }

    /**
     * Distance measure for an affinity name, {@code euclidean} or {@code manhattan}.
     */
    public static DistanceMeasure affinity(String name) {
        if(name == null || "euclidean".equalsIgnoreCase(name)) {
            return new EuclideanDistance();
        }
        if("manhattan".equalsIgnoreCase(name) || "l1".equalsIgnoreCase(name)) {
            return new ManhattanDistance();
        }
        throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported affinity: " + name);
    }

    public HierarchicalClusterer fit(double[][] points) {
        this.n = points.length;
        if(n < 2) {
            throw new AnalysisException(AnalysisErrorCode.INSUFFICIENT_DATA,
                    "Hierarchical clustering needs at least 2 points");
        }
        double[][] dist = new double[n][n];
        for(int i = 0; i < n; i++) {
            for(int j = i + 1; j < n; j++) {
                dist[i][j] = dist[j][i] = measure.compute(points[i], points[j]);
            }
        }
        int[] ids = new int[n];
        int[] sizes = new int[n];
        boolean[] active = new boolean[n];
        for(int i = 0; i < n; i++) {
            ids[i] = i;
            sizes[i] = 1;
            active[i] = true;
        }

        linkageMatrix = new double[n - 1][];
        for(int step = 0; step < n - 1; step++) {
            int a = -1, b = -1;
            double best = Double.POSITIVE_INFINITY;
            for(int i = 0; i < n; i++) {
                if(!active[i]) {
                    continue;
                }
                for(int j = i + 1; j < n; j++) {
                    if(active[j] && dist[i][j] < best) {
                        best = dist[i][j];
                        a = i;
                        b = j;
                    }
                }
            }
            int merged = sizes[a] + sizes[b];
            linkageMatrix[step] = new double[] { Math.min(ids[a], ids[b]), Math.max(ids[a], ids[b]), best, merged };

            for(int k = 0; k < n; k++) {
                if(!active[k] || k == a || k == b) {
                    continue;
                }
                double updated = update(dist[a][k], dist[b][k], dist[a][b], sizes[a], sizes[b], sizes[k]);
                dist[a][k] = dist[k][a] = updated;
            }
            active[b] = false;
            sizes[a] = merged;
            ids[a] = n + step;
        }
        return this;
    }

    private double update(double dik, double djk, double dij, int ni, int nj, int nk) {
        switch(linkage) {
            case SINGLE:
                return Math.min(dik, djk);
            case COMPLETE:
                return Math.max(dik, djk);
            case AVERAGE:
                return (ni * dik + nj * djk) / (ni + nj);
            case WARD:
            default:
                double total = ni + nj + nk;
                double value = ((ni + nk) * dik * dik + (nj + nk) * djk * djk - nk * dij * dij) / total;
                return Math.sqrt(Math.max(value, 0d));
        }
    }

    /**
     * Cut the tree into k flat clusters by replaying the first n - k merges. Labels are numbered from 0 in order of
     * first appearance.
     */
    public int[] cut(int k) {
        if(linkageMatrix == null) {
            throw new IllegalStateException("Hierarchical clusterer is not fitted");
        }
        if(k < 1 || k > n) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Cannot cut " + n + " points into " + k
                    + " clusters");
        }
        int[] parent = new int[2 * n - 1];
        for(int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for(int step = 0; step < n - k; step++) {
            parent[(int) linkageMatrix[step][0]] = n + step;
            parent[(int) linkageMatrix[step][1]] = n + step;
        }
        Map<Integer, Integer> labelOfRoot = new HashMap<Integer, Integer>();
        int[] labels = new int[n];
        for(int i = 0; i < n; i++) {
            int root = i;
            while(parent[root] != root) {
                root = parent[root];
            }
            Integer label = labelOfRoot.get(root);
            if(label == null) {
                label = labelOfRoot.size();
                labelOfRoot.put(root, label);
            }
            labels[i] = label;
        }
        return labels;
    }

    public double[][] getLinkageMatrix() {
        double[][] copy = new double[linkageMatrix.length][];
        for(int i = 0; i < linkageMatrix.length; i++) {
            copy[i] = Arrays.copyOf(linkageMatrix[i], 4);
        }
        return copy;
    }

    public Linkage getLinkage() {
        return linkage;
    }
}
