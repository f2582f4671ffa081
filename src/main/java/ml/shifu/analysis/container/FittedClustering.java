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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.analysis.core.analyzer.ClusteringMethod;
import ml.shifu.analysis.core.stats.GaussianMixtureEM;
import ml.shifu.analysis.core.stats.KMeansRunner;
import ml.shifu.analysis.core.stats.Silhouette;

/**
 * Result of one clustering fit: the method and features, the scaler that mapped the features into the fitted space,
 * the labels of the used rows and the cluster centroids in the fitted space. Noise points carry label -1 and have no
 * centroid.
 */
public class FittedClustering {

    public static final int NOISE = -1;

    private final ClusteringMethod method;
    private final List<String> features;
    private final boolean standardize;
    private final double[] means;
    private final double[] scales;

    private final List<Integer> rowIndices;
    private final double[][] points;
    private final int[] labels;
    private final int[] clusterIds;
    private final double[][] centroids;

    private final GaussianMixtureEM mixture;
    private final Map<String, Object> statistics;

    public FittedClustering(ClusteringMethod method, List<String> features, boolean standardize, double[] means,
            double[] scales, List<Integer> rowIndices, double[][] points, int[] labels, GaussianMixtureEM mixture,
            Map<String, Object> statistics) {
        this.method = method;
        this.features = Collections.unmodifiableList(new ArrayList<String>(features));
        this.standardize = standardize;
        this.means = means.clone();
        this.scales = scales.clone();
        this.rowIndices = Collections.unmodifiableList(new ArrayList<Integer>(rowIndices));
        this.points = copy(points);
        this.labels = labels.clone();
        this.mixture = mixture;
        this.statistics = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(statistics));

        List<Integer> ids = new ArrayList<Integer>();
        for(int label: labels) {
            if(label != NOISE && !ids.contains(label)) {
                ids.add(label);
            }
        }
        Collections.sort(ids);
        this.clusterIds = new int[ids.size()];
        this.centroids = new double[ids.size()][features.size()];
        int[] counts = new int[ids.size()];
        for(int c = 0; c < clusterIds.length; c++) {
            clusterIds[c] = ids.get(c);
        }
        for(int i = 0; i < points.length; i++) {
            int c = ids.indexOf(labels[i]);
            if(c < 0) {
                continue;
            }
            counts[c]++;
            for(int j = 0; j < features.size(); j++) {
                centroids[c][j] += points[i][j];
            }
        }
        for(int c = 0; c < clusterIds.length; c++) {
            for(int j = 0; j < features.size(); j++) {
                centroids[c][j] /= counts[c];
            }
        }
    }

    /**
     * Z-score scaler with population standard deviation; a zero deviation scales by 1. Identity when
     * {@code standardize} is false.
     * 
     * @return {means, scales}
     */
    public static double[][] fitScaler(double[][] raw, boolean standardize) {
        int d = raw.length == 0 ? 0 : raw[0].length;
        double[] means = new double[d];
        double[] scales = new double[d];
        for(int j = 0; j < d; j++) {
            scales[j] = 1d;
        }
        if(!standardize || raw.length == 0) {
            return new double[][] { means, scales };
        }
        for(int j = 0; j < d; j++) {
            double sum = 0d;
            for(double[] row: raw) {
                sum += row[j];
            }
            means[j] = sum / raw.length;
            double ss = 0d;
            for(double[] row: raw) {
                ss += (row[j] - means[j]) * (row[j] - means[j]);
            }
            double std = Math.sqrt(ss / raw.length);
            scales[j] = std == 0d ? 1d : std;
        }
        return new double[][] { means, scales };
    }

    public static double[] transform(double[] raw, double[] means, double[] scales) {
        double[] scaled = new double[raw.length];
        for(int j = 0; j < raw.length; j++) {
            scaled[j] = (raw[j] - means[j]) / scales[j];
        }
        return scaled;
    }

    public double[] transform(double[] raw) {
        return transform(raw, means, scales);
    }

    public double[] inverseTransform(double[] scaled) {
        double[] raw = new double[scaled.length];
        for(int j = 0; j < scaled.length; j++) {
            raw[j] = scaled[j] * scales[j] + means[j];
        }
        return raw;
    }

    /**
     * Cluster label for one raw feature row: the nearest center for k-means and hierarchical, the most probable
     * component for a Gaussian mixture, and for DBSCAN the nearest centroid within eps or {@link #NOISE}.
     */
    public int predict(double[] raw) {
        double[] point = transform(raw);
        switch(method.getKind()) {
            case GAUSSIAN_MIXTURE:
                return mixture.predict(point);
            case DBSCAN:
                if(centroids.length == 0) {
                    return NOISE;
                }
                int nearest = KMeansRunner.nearest(centroids, point);
                double eps = ((ClusteringMethod.Dbscan) method).getEps();
                return Silhouette.euclidean(centroids[nearest], point) <= eps ? clusterIds[nearest] : NOISE;
            case KMEANS:
            case HIERARCHICAL:
            default:
                return clusterIds[KMeansRunner.nearest(centroids, point)];
        }
    }

    public int[] getClusterSizes() {
        int[] sizes = new int[clusterIds.length];
        for(int label: labels) {
            for(int c = 0; c < clusterIds.length; c++) {
                if(clusterIds[c] == label) {
                    sizes[c]++;
                }
            }
        }
        return sizes;
    }

    /**
     * Mean Euclidean distance from the members of each cluster to its centroid, in the fitted space.
     */
    public double[] getMeanDistances() {
        double[] sums = new double[clusterIds.length];
        int[] sizes = getClusterSizes();
        for(int i = 0; i < points.length; i++) {
            for(int c = 0; c < clusterIds.length; c++) {
                if(clusterIds[c] == labels[i]) {
                    sums[c] += Silhouette.euclidean(points[i], centroids[c]);
                }
            }
        }
        for(int c = 0; c < sums.length; c++) {
            sums[c] /= sizes[c];
        }
        return sums;
    }

    public int getNoiseCount() {
        int count = 0;
        for(int label: labels) {
            if(label == NOISE) {
                count++;
            }
        }
        return count;
    }

    public int getClusterCount() {
        return clusterIds.length;
    }

    public ClusteringMethod getMethod() {
        return method;
    }

    public List<String> getFeatures() {
        return features;
    }

    public boolean isStandardize() {
        return standardize;
    }

    public List<Integer> getRowIndices() {
        return rowIndices;
    }

    public double[][] getPoints() {
        return copy(points);
    }

    public int[] getLabels() {
        return labels.clone();
    }

    public int[] getClusterIds() {
        return clusterIds.clone();
    }

    public double[][] getCentroids() {
        return copy(centroids);
    }

    public GaussianMixtureEM getMixture() {
        return mixture;
    }

    /**
     * Method specific values such as inertia, linkage matrix or information criteria.
     */
    public Map<String, Object> getStatistics() {
        return statistics;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for(int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }
}
