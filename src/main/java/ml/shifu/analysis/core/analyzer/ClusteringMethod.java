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
package ml.shifu.analysis.core.analyzer;

import java.util.Map;

import ml.shifu.analysis.core.stats.HierarchicalClusterer;
import ml.shifu.analysis.core.stats.HierarchicalClusterer.Linkage;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Constants;
import ml.shifu.analysis.util.Environment;

/**
 * Clustering algorithm together with its parameters. The variants are the nested classes; each one validates its
 * parameters when constructed, so an instance is always runnable.
 */
public abstract class ClusteringMethod {

    public static enum Kind {
        KMEANS("kmeans"), HIERARCHICAL("hierarchical"), DBSCAN("dbscan"), GAUSSIAN_MIXTURE("gaussian_mixture");

        private final String value;

        private Kind(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public static Kind of(String name) {
            String normalized = name.trim().replace('-', '_');
            for(Kind kind: values()) {
                if(kind.value.equalsIgnoreCase(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                    return kind;
                }
            }
            throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported clustering method: "
                    + name);
        }
    }

    private ClusteringMethod() {
    }

    public abstract Kind getKind();

    /**
     * Requested number of clusters; -1 when the algorithm discovers it.
     */
    public abstract int getClusterCount();

    /**
     * Same method asking for a different number of clusters, used by the cluster count sweep.
     */
    public abstract ClusteringMethod withClusterCount(int k);

    /**
     * Builds a method from loose parameters: {@code n_clusters}, {@code linkage}, {@code affinity}, {@code eps},
     * {@code min_samples} and {@code random_state}.
     */
    public static ClusteringMethod of(String name, Map<String, Object> params) {
        Kind kind = Kind.of(name);
        int nClusters = intValue(params.get("n_clusters"), 3);
        long seed = intValue(params.get("random_state"),
                Environment.getInt(Environment.RANDOM_SEED, (int) Constants.DEFAULT_RANDOM_SEED));
        switch(kind) {
            case HIERARCHICAL:
                Object linkage = params.get("linkage");
                Object affinity = params.get("affinity");
                return new Hierarchical(nClusters, linkage == null ? Linkage.WARD : Linkage.of(linkage.toString()),
                        affinity == null ? Hierarchical.EUCLIDEAN : affinity.toString());
            case DBSCAN:
                Object eps = params.get("eps");
                return new Dbscan(eps == null ? Dbscan.DEFAULT_EPS : Double.parseDouble(eps.toString()), intValue(
                        params.get("min_samples"), Dbscan.DEFAULT_MIN_SAMPLES));
            case GAUSSIAN_MIXTURE:
                return new GaussianMixture(nClusters, seed);
            case KMEANS:
            default:
                return new KMeans(nClusters, KMeans.DEFAULT_N_INIT, KMeans.DEFAULT_MAX_ITER, seed);
        }
    }

    private static int intValue(Object value, int defValue) {
        if(value == null) {
            return defValue;
        }
        return value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString().trim());
    }

    private static void checkClusterCount(int k) {
        if(k < 1) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Number of clusters must be at least 1, got "
                    + k);
        }
    }

    public static final class KMeans extends ClusteringMethod {

        public static final int DEFAULT_N_INIT = 10;

        public static final int DEFAULT_MAX_ITER = 300;

        private final int nClusters;
        private final int nInit;
        private final int maxIter;
        private final long seed;

        public KMeans(int nClusters) {
            this(nClusters, DEFAULT_N_INIT, DEFAULT_MAX_ITER, Constants.DEFAULT_RANDOM_SEED);
        }

        public KMeans(int nClusters, int nInit, int maxIter, long seed) {
            checkClusterCount(nClusters);
            if(nInit < 1 || maxIter < 1) {
                throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT,
                        "nInit and maxIter must be positive for k-means");
            }
            this.nClusters = nClusters;
            this.nInit = nInit;
            this.maxIter = maxIter;
            this.seed = seed;
        }

        @Override
        public Kind getKind() {
            return Kind.KMEANS;
        }

        @Override
        public int getClusterCount() {
            return nClusters;
        }

        @Override
        public ClusteringMethod withClusterCount(int k) {
            return new KMeans(k, nInit, maxIter, seed);
        }

        public int getNInit() {
            return nInit;
        }

        public int getMaxIter() {
            return maxIter;
        }

        public long getSeed() {
            return seed;
        }
    }

    public static final class Hierarchical extends ClusteringMethod {

        public static final String EUCLIDEAN = "euclidean";

        private final int nClusters;
        private final Linkage linkage;
        private final String affinity;

        public Hierarchical(int nClusters) {
            this(nClusters, Linkage.WARD, EUCLIDEAN);
        }

        public Hierarchical(int nClusters, Linkage linkage, String affinity) {
            checkClusterCount(nClusters);
            // fails fast on an unknown affinity or ward with a non euclidean metric
            new HierarchicalClusterer(linkage, HierarchicalClusterer.affinity(affinity));
            this.nClusters = nClusters;
            this.linkage = linkage;
            this.affinity = affinity.toLowerCase();
        }

        @Override
        public Kind getKind() {
            return Kind.HIERARCHICAL;
        }

        @Override
        public int getClusterCount() {
            return nClusters;
        }

        @Override
        public ClusteringMethod withClusterCount(int k) {
            return new Hierarchical(k, linkage, affinity);
        }

        public Linkage getLinkage() {
            return linkage;
        }

        public String getAffinity() {
            return affinity;
        }

        public HierarchicalClusterer newClusterer() {
            return new HierarchicalClusterer(linkage, HierarchicalClusterer.affinity(affinity));
        }
    }

    public static final class Dbscan extends ClusteringMethod {

        public static final double DEFAULT_EPS = 0.5d;

        public static final int DEFAULT_MIN_SAMPLES = 5;

        private final double eps;
        private final int minSamples;

        public Dbscan(double eps, int minSamples) {
            if(!(eps > 0d)) {
                throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "eps must be positive, got " + eps);
            }
            if(minSamples < 1) {
                throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "minSamples must be at least 1, got "
                        + minSamples);
            }
            this.eps = eps;
            this.minSamples = minSamples;
        }

        @Override
        public Kind getKind() {
            return Kind.DBSCAN;
        }

        @Override
        public int getClusterCount() {
            return -1;
        }

        @Override
        public ClusteringMethod withClusterCount(int k) {
            throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD,
                    "DBSCAN does not take a number of clusters");
        }

        public double getEps() {
            return eps;
        }

        public int getMinSamples() {
            return minSamples;
        }
    }

    public static final class GaussianMixture extends ClusteringMethod {

        private final int nComponents;
        private final long seed;

        public GaussianMixture(int nComponents) {
            this(nComponents, Constants.DEFAULT_RANDOM_SEED);
        }

        public GaussianMixture(int nComponents, long seed) {
            checkClusterCount(nComponents);
            this.nComponents = nComponents;
            this.seed = seed;
        }

        @Override
        public Kind getKind() {
            return Kind.GAUSSIAN_MIXTURE;
        }

        @Override
        public int getClusterCount() {
            return nComponents;
        }

        @Override
        public ClusteringMethod withClusterCount(int k) {
            return new GaussianMixture(k, seed);
        }

        public long getSeed() {
            return seed;
        }
    }
}
