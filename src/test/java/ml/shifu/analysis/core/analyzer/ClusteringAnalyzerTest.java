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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.container.FittedClustering;
import ml.shifu.analysis.core.stats.ClusterFixtures;
import ml.shifu.analysis.core.stats.HierarchicalClusterer.Linkage;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

public class ClusteringAnalyzerTest {

    private static final List<String> FEATURES = Arrays.asList("f1", "f2");

    private ClusteringAnalyzer analyzer;

    @BeforeMethod
    public void setUp() {
        double[][] points = ClusterFixtures.blobs(ClusterFixtures.CENTERS, 20);
        List<Object> f1 = new ArrayList<Object>();
        List<Object> f2 = new ArrayList<Object>();
        List<Object> tag = new ArrayList<Object>();
        for(double[] point: points) {
            f1.add(point[0]);
            f2.add(point[1]);
            tag.add("t");
        }
        // incomplete row, left out of every fit
        f1.add(null);
        f2.add(3d);
        tag.add("t");

        Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
        columns.put("f1", f1);
        columns.put("f2", f2);
        columns.put("tag", tag);
        analyzer = new ClusteringAnalyzer(new Dataset(Dataset.fromColumns(columns)));
    }

    private static void assertBlobsSeparated(int[] labels) {
        Assert.assertEquals(labels.length, 60);
        for(int blob = 0; blob < 3; blob++) {
            for(int i = 1; i < 20; i++) {
                Assert.assertEquals(labels[blob * 20 + i], labels[blob * 20]);
            }
        }
        Assert.assertNotEquals(labels[0], labels[20]);
        Assert.assertNotEquals(labels[20], labels[40]);
        Assert.assertNotEquals(labels[0], labels[40]);
    }

    @Test
    public void testKMeans() {
        AnalysisResult result = analyzer.analyze(FEATURES, new ClusteringMethod.KMeans(3));
        int[] labels = result.get("labels");
        assertBlobsSeparated(labels);
        Assert.assertTrue((Double) result.get("silhouette_score") > 0.5d);
        Assert.assertEquals((int[]) result.get("cluster_counts"), new int[] { 20, 20, 20 });
        Assert.assertEquals(((double[][]) result.get("centroids")).length, 3);
        Assert.assertNotNull(result.get("inertia"));
        Assert.assertEquals(((List<?>) result.get("row_indices")).size(), 60);

        DataTable clustered = result.get("clustered_data");
        Assert.assertEquals(clustered.getColumnNames(), Arrays.asList("f1", "f2", "cluster"));
        Assert.assertEquals(clustered.getRowCount(), 60);

        Assert.assertEquals(result.getAnalysisType(), "clustering");
        Assert.assertEquals(result.getMetadata().get("clustering_method"), "kmeans");
        Assert.assertEquals(result.getMetadata().get("sample_size"), 60);
        // scatter, centroid overlay and cluster means heatmap
        Assert.assertEquals(result.getCharts().size(), 3);
    }

    @Test
    public void testPredict() {
        analyzer.analyze(FEATURES, new ClusteringMethod.KMeans(3), true, false);
        FittedClustering model = analyzer.getModel();
        int[] labels = model.getLabels();

        Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
        columns.put("f1", Arrays.<Object> asList(0.1d, 9.9d, null));
        columns.put("f2", Arrays.<Object> asList(-0.1d, 10.2d, 1d));
        int[] predicted = analyzer.predict(Dataset.fromColumns(columns));
        Assert.assertEquals(predicted[0], labels[0]);
        Assert.assertEquals(predicted[1], labels[20]);
        Assert.assertEquals(predicted[2], FittedClustering.NOISE);
    }

    @Test
    public void testHierarchical() {
        AnalysisResult result = analyzer.analyze(FEATURES, new ClusteringMethod.Hierarchical(3, Linkage.AVERAGE,
                ClusteringMethod.Hierarchical.EUCLIDEAN), false, true);
        assertBlobsSeparated((int[]) result.get("labels"));
        Assert.assertEquals(((double[][]) result.get("linkage_matrix")).length, 59);
        Assert.assertEquals(result.getMetadata().get("clustering_method"), "hierarchical");
        // scatter, centroid overlay, means heatmap and dendrogram
        Assert.assertEquals(result.getCharts().size(), 4);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testDbscanMarksNoise() {
        Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
        double[][] points = ClusterFixtures.blobs(ClusterFixtures.CENTERS, 20);
        List<Object> f1 = new ArrayList<Object>();
        List<Object> f2 = new ArrayList<Object>();
        for(double[] point: points) {
            f1.add(point[0]);
            f2.add(point[1]);
        }
        f1.add(50d);
        f2.add(50d);
        columns.put("f1", f1);
        columns.put("f2", f2);
        ClusteringAnalyzer dbscan = new ClusteringAnalyzer(new Dataset(Dataset.fromColumns(columns)));

        AnalysisResult result = dbscan.analyze(FEATURES, new ClusteringMethod.Dbscan(0.5d, 3), false, false);
        int[] labels = result.get("labels");
        Assert.assertEquals(labels[60], FittedClustering.NOISE);
        Assert.assertEquals(((Number) result.get("noise_points")).intValue(), 1);
        Assert.assertEquals(((Number) result.get("n_clusters")).intValue(), 3);
        Assert.assertEquals(result.getMetadata().get("n_clusters"), 3);
        Map<Integer, Integer> counts = (Map<Integer, Integer>) result.get("cluster_counts");
        Assert.assertEquals(counts.get(FittedClustering.NOISE), Integer.valueOf(1));
        // noise present
        Assert.assertEquals((Double) result.get("silhouette_score"), 0d, 1e-12);
        Assert.assertEquals((Double) result.get("eps"), 0.5d, 1e-12);
    }

    @Test
    public void testGaussianMixture() {
        AnalysisResult result = analyzer.analyze(FEATURES, new ClusteringMethod.GaussianMixture(3, 42L), true, false);
        assertBlobsSeparated((int[]) result.get("labels"));
        double[] weights = result.get("weights");
        Assert.assertEquals(weights.length, 3);
        Assert.assertFalse(Double.isNaN((Double) result.get("bic")));
    }

    @Test
    public void testParametersPath() {
        Map<String, Object> params = new LinkedHashMap<String, Object>();
        params.put("features", "f1,f2");
        params.put("method", "hierarchical");
        params.put("n_clusters", "3");
        params.put("linkage", "complete");
        params.put("include_charts", false);
        analyzer.setParameters(params);
        AnalysisResult result = analyzer.analyze();
        assertBlobsSeparated((int[]) result.get("labels"));
        Assert.assertEquals(result.getMetadata().get("n_clusters"), 3);
    }

    @Test
    public void testEvaluateOptimalClusters() {
        AnalysisResult result = analyzer.evaluateOptimalClusters(FEATURES, 4, new ClusteringMethod.KMeans(3), true);
        Assert.assertEquals(result.getAnalysisType(), "cluster_evaluation");
        Assert.assertEquals((List<?>) result.get("n_clusters_range"), Arrays.asList(2, 3, 4));
        double[] inertias = result.get("inertias");
        Assert.assertTrue(inertias[0] > inertias[1]);
        double[] silhouettes = result.get("silhouette_scores");
        Assert.assertTrue(silhouettes[1] > silhouettes[0]);
        Assert.assertTrue(silhouettes[1] > silhouettes[2]);
        // elbow and silhouette curves
        Assert.assertEquals(result.getCharts().size(), 2);
    }

    @Test
    public void testEvaluateRejectsDbscan() {
        try {
            analyzer.evaluateOptimalClusters(FEATURES, 4, new ClusteringMethod.Dbscan(0.5d, 5), true);
            Assert.fail("DBSCAN has no cluster count to sweep");
        } catch (AnalysisException e) {
            Assert.assertEquals(e.getError(), AnalysisErrorCode.UNSUPPORTED_METHOD);
        }
    }

    @Test
    public void testNonNumericFeature() {
        try {
            analyzer.analyze(Arrays.asList("f1", "tag"), new ClusteringMethod.KMeans(2));
            Assert.fail("string feature");
        } catch (AnalysisException e) {
            Assert.assertEquals(e.getError(), AnalysisErrorCode.NON_NUMERIC_COLUMN);
        }
    }

    @Test
    public void testModelNotTrained() {
        try {
            analyzer.getModel();
            Assert.fail("no model yet");
        } catch (AnalysisException e) {
            Assert.assertEquals(e.getError(), AnalysisErrorCode.MODEL_NOT_TRAINED);
        }
    }

    @Test(expectedExceptions = AnalysisException.class)
    public void testInvalidClusterCount() {
        new ClusteringMethod.KMeans(0);
    }
}
