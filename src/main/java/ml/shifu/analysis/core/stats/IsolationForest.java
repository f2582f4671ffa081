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
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.core.BasicStatsCalculator;
import ml.shifu.analysis.core.DataSampler;

/**
 * Isolation forest anomaly scoring. Each tree isolates a random subsample by random axis-aligned splits; points with
 * short average path lengths get scores close to 1.
 */
public class IsolationForest {

    private static Logger log = LoggerFactory.getLogger(IsolationForest.class);

    public static final int DEFAULT_SAMPLE_SIZE = 256;

    private static final double EULER_GAMMA = 0.5772156649015329d;

    private final int nTrees;
    private final int sampleSize;
    private final long seed;

    private List<Node> trees;
    private int subSample;

    public IsolationForest(int nTrees, int sampleSize, long seed) {
        if(nTrees < 1 || sampleSize < 2) {
            throw new IllegalArgumentException("nTrees should be >= 1 and sampleSize >= 2");
        }
        this.nTrees = nTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    public IsolationForest fit(double[][] data) {
        Random rd = new Random(seed);
        this.subSample = Math.min(sampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(subSample, 2)) / Math.log(2));
        this.trees = new ArrayList<Node>(nTrees);
        for(int t = 0; t < nTrees; t++) {
            List<Integer> indices = DataSampler.sample(data.length, subSample, rd.nextLong());
            trees.add(build(data, indices, 0, heightLimit, rd));
        }
        log.debug("Isolation forest with {} trees fitted on {} points", nTrees, data.length);
        return this;
    }

    private Node build(double[][] data, List<Integer> indices, int depth, int heightLimit, Random rd) {
        if(depth >= heightLimit || indices.size() <= 1) {
            return Node.leaf(indices.size());
        }
        int dims = data[0].length;
        int feature = rd.nextInt(dims);
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for(int i: indices) {
            min = Math.min(min, data[i][feature]);
            max = Math.max(max, data[i][feature]);
        }
        if(min == max) {
            return Node.leaf(indices.size());
        }
        double split = min + rd.nextDouble() * (max - min);
        List<Integer> left = new ArrayList<Integer>();
        List<Integer> right = new ArrayList<Integer>();
        for(int i: indices) {
            if(data[i][feature] < split) {
                left.add(i);
            } else {
                right.add(i);
            }
        }
        return Node.split(feature, split, build(data, left, depth + 1, heightLimit, rd),
                build(data, right, depth + 1, heightLimit, rd));
    }

    /**
     * Anomaly score in (0, 1]; higher is more abnormal.
     */
    public double[] scoreSamples(double[][] data) {
        if(trees == null) {
            throw new IllegalStateException("Isolation forest is not fitted");
        }
        double norm = averagePathLength(subSample);
        double[] scores = new double[data.length];
        for(int i = 0; i < data.length; i++) {
            double total = 0d;
            for(Node tree: trees) {
                total += pathLength(data[i], tree, 0);
            }
            double mean = total / trees.size();
            scores[i] = norm <= 0d ? 0.5d : Math.pow(2d, -mean / norm);
        }
        return scores;
    }

    /**
     * Flag the points whose score exceeds the (1 - contamination) quantile of the scores.
     */
    public boolean[] predict(double[][] data, double contamination) {
        double[] scores = scoreSamples(data);
        double threshold = BasicStatsCalculator.quantile(scores, 1d - contamination);
        boolean[] outliers = new boolean[scores.length];
        for(int i = 0; i < scores.length; i++) {
            outliers[i] = scores[i] > threshold;
        }
        return outliers;
    }

    private static double pathLength(double[] x, Node node, int depth) {
        if(node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        return pathLength(x, x[node.feature] < node.split ? node.left : node.right, depth + 1);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of n points.
     */
    static double averagePathLength(int n) {
        if(n <= 1) {
            return 0d;
        }
        if(n == 2) {
            return 1d;
        }
        return 2d * (Math.log(n - 1d) + EULER_GAMMA) - 2d * (n - 1d) / n;
    }

    private static class Node {
        int feature;
        double split;
        Node left;
        Node right;
        int size;

        static Node leaf(int size) {
            Node node = new Node();
            node.size = size;
            return node;
        }

        static Node split(int feature, double split, Node left, Node right) {
            Node node = new Node();
            node.feature = feature;
            node.split = split;
            node.left = left;
            node.right = right;
            return node;
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
