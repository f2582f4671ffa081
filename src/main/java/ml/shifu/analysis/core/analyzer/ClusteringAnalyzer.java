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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;
import com.google.inject.Inject;

import ml.shifu.analysis.chart.Chart;
import ml.shifu.analysis.chart.ChartProvider;
import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.Column;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.container.DataType;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.container.FittedClustering;
import ml.shifu.analysis.core.stats.GaussianMixtureEM;
import ml.shifu.analysis.core.stats.HierarchicalClusterer;
import ml.shifu.analysis.core.stats.KMeansRunner;
import ml.shifu.analysis.core.stats.LabeledPoint;
import ml.shifu.analysis.core.stats.Silhouette;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Constants;

/**
 * Clustering with k-means, agglomerative hierarchical clustering, DBSCAN and Gaussian mixtures on optionally
 * standardized numeric features.
 */
public class ClusteringAnalyzer extends AbstractAnalyzer {

    private static Logger log = LoggerFactory.getLogger(ClusteringAnalyzer.class);

    public static final String ANALYSIS_TYPE = "clustering";

    public static final String CLUSTER_COLUMN = "cluster";

    public static final int DEFAULT_MAX_CLUSTERS = 10;

    private FittedClustering model;

    public ClusteringAnalyzer() {
        this((ChartProvider) null);
    }

    public ClusteringAnalyzer(Dataset dataset) {
        this((ChartProvider) null);
        setDataset(dataset);
    }

    @Inject
    public ClusteringAnalyzer(ChartProvider chartProvider) {
        super(chartProvider);
    }

    /**
     * Reads {@code features}, {@code method} (name or {@link ClusteringMethod}), {@code standardize} and
     * {@code include_charts}; the method parameters are read by {@link ClusteringMethod#of(String, Map)}.
     */
    @Override
    public AnalysisResult analyze() {
        List<String> features = listParam("features");
        if(features == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Parameter features is required");
        }
        Object method = parameters.get("method");
        ClusteringMethod clusteringMethod = method instanceof ClusteringMethod ? (ClusteringMethod) method
                : ClusteringMethod.of(method == null ? ClusteringMethod.Kind.KMEANS.getValue() : method.toString(),
                        parameters);
        return analyze(features, clusteringMethod, boolParam("standardize", true), boolParam("include_charts", true));
    }

    public AnalysisResult analyze(List<String> features, ClusteringMethod method, boolean standardize,
            boolean includeCharts) {
        FittedClustering fitted = fit(features, method, standardize);
        this.model = fitted;

        Map<String, Object> data = output(fitted);

        Map<String, Object> metadata = new LinkedHashMap<String, Object>();
        metadata.put(Constants.ANALYSIS_TYPE, ANALYSIS_TYPE);
        metadata.put("clustering_method", method.getKind().getValue());
        metadata.put("features", new ArrayList<String>(features));
        metadata.put("n_clusters", method.getKind() == ClusteringMethod.Kind.DBSCAN ? fitted.getClusterCount()
                : method.getClusterCount());
        metadata.put("standardize", standardize);
        metadata.put("sample_size", fitted.getRowIndices().size());

        List<Chart> charts = includeCharts ? createCharts(fitted) : new ArrayList<Chart>();
        return createResult(data, metadata, charts);
    }

    public AnalysisResult analyze(List<String> features, ClusteringMethod method) {
        return analyze(features, method, true, true);
    }

    /**
     * Fits the method on the complete rows of {@code features} without touching the analyzer state.
     */
    public FittedClustering fit(List<String> features, ClusteringMethod method, boolean standardize) {
        validateDataset();
        if(features == null || features.isEmpty()) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "At least one feature is needed");
        }
        requireNumericColumns(features);

        DataTable clean = table().dropMissing(features);
        int dropped = table().getRowCount() - clean.getRowCount();
        if(dropped > 0) {
            log.info("Dropped {} rows with missing features before clustering", dropped);
        }
        double[][] raw = clean.toMatrix(features);
        double[][] scaler = FittedClustering.fitScaler(raw, standardize);
        double[][] points = new double[raw.length][];
        for(int i = 0; i < raw.length; i++) {
            points[i] = FittedClustering.transform(raw[i], scaler[0], scaler[1]);
        }

        log.info("Running {} clustering on {} rows and {} features", method.getKind().getValue(), points.length,
                features.size());
        Map<String, Object> statistics = new LinkedHashMap<String, Object>();
        int[] labels;
        GaussianMixtureEM mixture = null;
        switch(method.getKind()) {
            case HIERARCHICAL:
                HierarchicalClusterer clusterer = ((ClusteringMethod.Hierarchical) method).newClusterer().fit(points);
                labels = clusterer.cut(method.getClusterCount());
                statistics.put("linkage_matrix", clusterer.getLinkageMatrix());
                break;
            case DBSCAN:
                ClusteringMethod.Dbscan dbscan = (ClusteringMethod.Dbscan) method;
                labels = dbscan(points, dbscan.getEps(), dbscan.getMinSamples());
                statistics.put("eps", dbscan.getEps());
                statistics.put("min_samples", dbscan.getMinSamples());
                break;
            case GAUSSIAN_MIXTURE:
                ClusteringMethod.GaussianMixture gm = (ClusteringMethod.GaussianMixture) method;
                mixture = new GaussianMixtureEM(gm.getClusterCount(), gm.getSeed()).fit(points);
                if(!mixture.isConverged()) {
                    log.warn("Gaussian mixture did not converge in {} iterations", mixture.getIterations());
                }
                labels = mixture.predict(points);
                statistics.put("weights", mixture.getWeights());
                statistics.put("bic", mixture.bic(points));
                statistics.put("aic", mixture.aic(points));
                statistics.put("log_likelihood", mixture.scoreSamples(points));
                break;
            case KMEANS:
            default:
                ClusteringMethod.KMeans km = (ClusteringMethod.KMeans) method;
                KMeansRunner runner = new KMeansRunner(km.getClusterCount(), km.getNInit(), km.getMaxIter(),
                        km.getSeed()).fit(points);
                labels = runner.getLabels();
                statistics.put("inertia", runner.getInertia());
                break;
        }
        return new FittedClustering(method, features, standardize, scaler[0], scaler[1], clean.getRowIndex(), points,
                labels, mixture, statistics);
    }

    /**
     * DBSCAN through commons-math3. A point counts itself among its {@code minSamples} neighbours, commons-math3 does
     * not, hence {@code minSamples - 1}.
     */
    static int[] dbscan(double[][] points, double eps, int minSamples) {
        List<LabeledPoint> labeled = new ArrayList<LabeledPoint>(points.length);
        for(int i = 0; i < points.length; i++) {
            labeled.add(new LabeledPoint(i, points[i]));
        }
        List<Cluster<LabeledPoint>> clusters = new DBSCANClusterer<LabeledPoint>(eps, minSamples - 1)
                .cluster(labeled);
        int[] labels = new int[points.length];
        for(int i = 0; i < labels.length; i++) {
            labels[i] = FittedClustering.NOISE;
        }
        for(int c = 0; c < clusters.size(); c++) {
            for(LabeledPoint point: clusters.get(c).getPoints()) {
                labels[point.getPosition()] = c;
            }
        }
        return labels;
    }

    private Map<String, Object> output(FittedClustering fitted) {
        int[] labels = fitted.getLabels();
        int[] sizes = fitted.getClusterSizes();
        double[] distances = fitted.getMeanDistances();
        int[] ids = fitted.getClusterIds();
        boolean dbscan = fitted.getMethod().getKind() == ClusteringMethod.Kind.DBSCAN;

        Map<String, Object> data = new LinkedHashMap<String, Object>();
        data.put("labels", labels);
        data.put("row_indices", fitted.getRowIndices());
        data.put("centroids", fitted.getCentroids());
        data.put("silhouette_score", silhouette(fitted));
        if(dbscan) {
            Map<Integer, Integer> counts = new LinkedHashMap<Integer, Integer>();
            Map<Integer, Double> meanDistances = new LinkedHashMap<Integer, Double>();
            for(int c = 0; c < ids.length; c++) {
                counts.put(ids[c], sizes[c]);
                meanDistances.put(ids[c], distances[c]);
            }
            if(fitted.getNoiseCount() > 0) {
                counts.put(FittedClustering.NOISE, fitted.getNoiseCount());
            }
            data.put("cluster_counts", counts);
            data.put("cluster_distances", meanDistances);
            data.put("noise_points", fitted.getNoiseCount());
        } else {
            data.put("cluster_counts", sizes);
            data.put("cluster_distances", distances);
        }
        data.put("n_clusters", fitted.getClusterCount());
        data.putAll(fitted.getStatistics());

        DataTable clustered = table().take(positions(fitted.getRowIndices())).select(fitted.getFeatures());
        clustered.addColumn(new Column(CLUSTER_COLUMN, DataType.INTEGER, Ints.asList(labels)));
        data.put("clustered_data", clustered);
        return data;
    }

    /**
     * Positions in the current table of the given row labels.
     */
    private List<Integer> positions(List<Integer> rowLabels) {
        List<Integer> index = table().getRowIndex();
        Map<Integer, Integer> positionOf = new LinkedHashMap<Integer, Integer>();
        for(int p = 0; p < index.size(); p++) {
            positionOf.put(index.get(p), p);
        }
        List<Integer> positions = new ArrayList<Integer>(rowLabels.size());
        for(Integer label: rowLabels) {
            positions.add(positionOf.get(label));
        }
        return positions;
    }

    /**
     * Mean silhouette in the fitted space. DBSCAN results with noise or a single cluster score 0.
     */
    static double silhouette(FittedClustering fitted) {
        if(fitted.getMethod().getKind() == ClusteringMethod.Kind.DBSCAN
                && (fitted.getNoiseCount() > 0 || fitted.getClusterCount() <= 1)) {
            return 0d;
        }
        return Silhouette.score(fitted.getPoints(), fitted.getLabels());
    }

    /**
     * Cluster labels for every row of {@code data}; rows with a missing feature get -1.
     */
    public int[] predict(FittedClustering fitted, DataTable data) {
        for(String feature: fitted.getFeatures()) {
            if(!data.hasColumn(feature)) {
                throw new AnalysisException(AnalysisErrorCode.COLUMN_NOT_FOUND, "Feature " + feature
                        + " used by the model is not in the prediction data");
            }
        }
        double[][] raw = data.toMatrix(fitted.getFeatures());
        int[] labels = new int[raw.length];
        for(int i = 0; i < raw.length; i++) {
            boolean complete = true;
            for(double v: raw[i]) {
                if(Double.isNaN(v)) {
                    complete = false;
                    break;
                }
            }
            labels[i] = complete ? fitted.predict(raw[i]) : FittedClustering.NOISE;
        }
        return labels;
    }

    public int[] predict(DataTable data) {
        return predict(getModel(), data);
    }

    /**
     * @throws AnalysisException
     *             with {@link AnalysisErrorCode#MODEL_NOT_TRAINED} before the first successful analyze call
     */
    public FittedClustering getModel() {
        if(model == null) {
            throw new AnalysisException(AnalysisErrorCode.MODEL_NOT_TRAINED);
        }
        return model;
    }

    /**
     * Sweeps k = 2..maxClusters and reports the quality curve of each k: inertia for k-means, BIC and AIC for
     * Gaussian mixtures, silhouette for all of them.
     */
    public AnalysisResult evaluateOptimalClusters(List<String> features, int maxClusters, ClusteringMethod method,
            boolean standardize) {
        if(method.getKind() == ClusteringMethod.Kind.DBSCAN) {
            throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD,
                    "DBSCAN determines the number of clusters itself");
        }
        if(maxClusters < 2) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "maxClusters must be at least 2, got "
                    + maxClusters);
        }
        int steps = maxClusters - 1;
        double[] range = new double[steps];
        List<Integer> ks = new ArrayList<Integer>(steps);
        double[] silhouettes = new double[steps];
        double[] inertias = new double[steps];
        double[] bics = new double[steps];
        double[] aics = new double[steps];
        double[][] linkage = null;
        for(int s = 0; s < steps; s++) {
            int k = s + 2;
            range[s] = k;
            ks.add(k);
            FittedClustering fitted = fit(features, method.withClusterCount(k), standardize);
            silhouettes[s] = silhouette(fitted);
            Map<String, Object> stats = fitted.getStatistics();
            if(stats.containsKey("inertia")) {
                inertias[s] = (Double) stats.get("inertia");
            }
            if(stats.containsKey("bic")) {
                bics[s] = (Double) stats.get("bic");
                aics[s] = (Double) stats.get("aic");
            }
            if(linkage == null && stats.containsKey("linkage_matrix")) {
                linkage = (double[][]) stats.get("linkage_matrix");
            }
            log.debug("k={} silhouette={}", k, silhouettes[s]);
        }

        Map<String, Object> data = new LinkedHashMap<String, Object>();
        data.put("n_clusters_range", ks);
        List<Chart> charts = new ArrayList<Chart>();
        switch(method.getKind()) {
            case KMEANS:
                data.put("inertias", inertias);
                charts.add(chartProvider.lineChart("Elbow method", "number of clusters", "inertia", range,
                        series("inertia", inertias)));
                break;
            case HIERARCHICAL:
                data.put("linkage_matrix", linkage);
                charts.add(chartProvider.dendrogram("Hierarchical clustering dendrogram", linkage));
                break;
            case GAUSSIAN_MIXTURE:
                data.put("bic_scores", bics);
                data.put("aic_scores", aics);
                Map<String, double[]> criteria = series("bic", bics);
                criteria.put("aic", aics);
                charts.add(chartProvider.lineChart("Information criteria", "number of components", "score", range,
                        criteria));
                break;
            default:
                break;
        }
        data.put("silhouette_scores", silhouettes);
        charts.add(chartProvider.lineChart("Silhouette score", "number of clusters", "silhouette", range, series(
                "silhouette", silhouettes)));

        Map<String, Object> metadata = new LinkedHashMap<String, Object>();
        metadata.put(Constants.ANALYSIS_TYPE, "cluster_evaluation");
        metadata.put("clustering_method", method.getKind().getValue());
        metadata.put("features", new ArrayList<String>(features));
        metadata.put("max_clusters", maxClusters);
        metadata.put("standardize", standardize);
        return createResult(data, metadata, charts);
    }

    private static Map<String, double[]> series(String name, double[] values) {
        Map<String, double[]> series = new LinkedHashMap<String, double[]>();
        series.put(name, values);
        return series;
    }

    private List<Chart> createCharts(FittedClustering fitted) {
        List<Chart> charts = new ArrayList<Chart>();
        List<String> features = fitted.getFeatures();
        double[][] points = fitted.getPoints();
        int[] labels = fitted.getLabels();
        double[][] centroids = fitted.getCentroids();
        String method = fitted.getMethod().getKind().getValue();

        double[][] raw = new double[points.length][];
        for(int i = 0; i < points.length; i++) {
            raw[i] = fitted.inverseTransform(points[i]);
        }
        double[][] rawCentroids = new double[centroids.length][];
        for(int c = 0; c < centroids.length; c++) {
            rawCentroids[c] = fitted.inverseTransform(centroids[c]);
        }

        if(features.size() == 2) {
            charts.add(chartProvider.scatter(method + " clustering", features.get(0), features.get(1), column(raw, 0),
                    column(raw, 1), labels));
            charts.add(chartProvider.scatter(method + " cluster centroids", features.get(0), features.get(1), column(
                    rawCentroids, 0), column(rawCentroids, 1), fitted.getClusterIds()));
        } else if(features.size() == 3) {
            charts.add(chartProvider.scatter3d(method + " clustering", features, raw, labels));
            charts.add(chartProvider.scatter3d(method + " cluster centroids", features, rawCentroids, fitted
                    .getClusterIds()));
        }

        if(centroids.length > 0) {
            List<String> rows = new ArrayList<String>();
            for(int id: fitted.getClusterIds()) {
                rows.add("cluster " + id);
            }
            charts.add(chartProvider.heatmap("Cluster feature means", rows, features, rawCentroids));
        }

        if(fitted.getStatistics().containsKey("linkage_matrix")) {
            charts.add(chartProvider.dendrogram("Hierarchical clustering dendrogram", (double[][]) fitted
                    .getStatistics().get("linkage_matrix")));
        }
        return charts;
    }

    private static double[] column(double[][] matrix, int j) {
        double[] values = new double[matrix.length];
        for(int i = 0; i < matrix.length; i++) {
            values[i] = matrix[i][j];
        }
        return values;
    }
}
