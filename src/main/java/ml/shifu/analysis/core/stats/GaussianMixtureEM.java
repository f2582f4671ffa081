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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.core.ConvergeJudger;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Gaussian mixture with full covariance matrices, fitted by expectation maximization. Responsibilities are seeded from
 * a single k-means run.
 */
public class GaussianMixtureEM {

    private static Logger log = LoggerFactory.getLogger(GaussianMixtureEM.class);

    public static final int DEFAULT_MAX_ITER = 100;

    public static final double DEFAULT_TOLERANCE = 1e-3d;

    private static final double REG_COVAR = 1e-6d;

    private static final double LOG_2PI = Math.log(2d * Math.PI);

    private final int k;
    private final int maxIter;
    private final double tolerance;
    private final long seed;

    private double[] weights;
    private double[][] means;
    private double[][][] covariances;

    private DecompositionSolver[] solvers;
    private double[] logDeterminants;

    private int iterations;
    private boolean converged;

    public GaussianMixtureEM(int k, long seed) {
        this(k, DEFAULT_MAX_ITER, DEFAULT_TOLERANCE, seed);
    }

    public GaussianMixtureEM(int k, int maxIter, double tolerance, long seed) {
        this.k = k;
        this.maxIter = maxIter;
        this.tolerance = tolerance;
        this.seed = seed;
    }

    public GaussianMixtureEM fit(double[][] data) {
        int n = data.length;
        if(n < k || n < 2) {
            throw new AnalysisException(AnalysisErrorCode.INSUFFICIENT_DATA, "n_samples=" + n
                    + " should be >= n_components=" + k);
        }
        int[] init = new KMeansRunner(k, 1, 300, seed).fit(data).getLabels();
        double[][] resp = new double[n][k];
        for(int i = 0; i < n; i++) {
            resp[i][init[i]] = 1d;
        }
        maximize(data, resp);

        ConvergeJudger judger = new ConvergeJudger();
        double lowerBound = Double.NEGATIVE_INFINITY;
        converged = false;
        for(iterations = 1; iterations <= maxIter; iterations++) {
            double previous = lowerBound;
            lowerBound = expect(data, resp);
            maximize(data, resp);
            if(judger.judge(Math.abs(lowerBound - previous), tolerance)) {
                converged = true;
                break;
            }
        }
        if(!converged) {
            log.warn("Gaussian mixture did not converge after {} iterations", maxIter);
        }
        log.debug("Gaussian mixture with {} components fitted in {} iterations", k, iterations);
        return this;
    }

    /**
     * Fill the responsibilities and return the mean log-likelihood.
     */
    private double expect(double[][] data, double[][] resp) {
        double total = 0d;
        for(int i = 0; i < data.length; i++) {
            double[] weighted = weightedLogProbabilities(data[i]);
            double norm = logSumExp(weighted);
            for(int c = 0; c < k; c++) {
                resp[i][c] = Math.exp(weighted[c] - norm);
            }
            total += norm;
        }
        return total / data.length;
    }

    private void maximize(double[][] data, double[][] resp) {
        int n = data.length;
        int d = data[0].length;
        weights = new double[k];
        means = new double[k][d];
        covariances = new double[k][d][d];
        for(int c = 0; c < k; c++) {
            double nk = 10d * Math.ulp(1d);
            for(int i = 0; i < n; i++) {
                nk += resp[i][c];
            }
            for(int i = 0; i < n; i++) {
                for(int j = 0; j < d; j++) {
                    means[c][j] += resp[i][c] * data[i][j];
                }
            }
            for(int j = 0; j < d; j++) {
                means[c][j] /= nk;
            }
            for(int i = 0; i < n; i++) {
                for(int a = 0; a < d; a++) {
                    double da = data[i][a] - means[c][a];
                    for(int b = a; b < d; b++) {
                        covariances[c][a][b] += resp[i][c] * da * (data[i][b] - means[c][b]);
                    }
                }
            }
            for(int a = 0; a < d; a++) {
                for(int b = a; b < d; b++) {
                    covariances[c][a][b] /= nk;
                    covariances[c][b][a] = covariances[c][a][b];
                }
                covariances[c][a][a] += REG_COVAR;
            }
            weights[c] = nk / n;
        }
        decompose();
    }

    private void decompose() {
        solvers = new DecompositionSolver[k];
        logDeterminants = new double[k];
        for(int c = 0; c < k; c++) {
            try {
                CholeskyDecomposition cholesky = new CholeskyDecomposition(new Array2DRowRealMatrix(covariances[c]));
                solvers[c] = cholesky.getSolver();
                double logDet = 0d;
                double[][] l = cholesky.getL().getData();
                for(int j = 0; j < l.length; j++) {
                    logDet += 2d * Math.log(l[j][j]);
                }
                logDeterminants[c] = logDet;
            } catch (NonPositiveDefiniteMatrixException e) {
                throw new AnalysisException(AnalysisErrorCode.MODEL_FIT_FAILED, e,
                        "Ill-defined empirical covariance in gaussian mixture component " + c);
            } catch (NonSymmetricMatrixException e) {
                throw new AnalysisException(AnalysisErrorCode.MODEL_FIT_FAILED, e,
                        "Non-symmetric covariance in gaussian mixture component " + c);
            }
        }
    }

    private double[] weightedLogProbabilities(double[] x) {
        double[] result = new double[k];
        RealVector point = new ArrayRealVector(x);
        for(int c = 0; c < k; c++) {
            RealVector diff = point.subtract(new ArrayRealVector(means[c]));
            double mahalanobis = diff.dotProduct(solvers[c].solve(diff));
            result[c] = Math.log(weights[c]) - 0.5d * (x.length * LOG_2PI + logDeterminants[c] + mahalanobis);
        }
        return result;
    }

    private static double logSumExp(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for(double v: values) {
            max = Math.max(max, v);
        }
        if(Double.isInfinite(max)) {
            return max;
        }
        double sum = 0d;
        for(double v: values) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /**
     * Component with the highest posterior probability.
     */
    public int predict(double[] x) {
        double[] weighted = weightedLogProbabilities(x);
        int best = 0;
        for(int c = 1; c < k; c++) {
            if(weighted[c] > weighted[best]) {
                best = c;
            }
        }
        return best;
    }

    public int[] predict(double[][] data) {
        int[] labels = new int[data.length];
        for(int i = 0; i < data.length; i++) {
            labels[i] = predict(data[i]);
        }
        return labels;
    }

    /**
     * Per-sample log-likelihood under the mixture.
     */
    public double[] scoreSamples(double[][] data) {
        double[] scores = new double[data.length];
        for(int i = 0; i < data.length; i++) {
            scores[i] = logSumExp(weightedLogProbabilities(data[i]));
        }
        return scores;
    }

    public double bic(double[][] data) {
        return -2d * totalLogLikelihood(data) + parameterCount(data[0].length) * Math.log(data.length);
    }

    public double aic(double[][] data) {
        return -2d * totalLogLikelihood(data) + 2d * parameterCount(data[0].length);
    }

    private double totalLogLikelihood(double[][] data) {
        double total = 0d;
        for(double score: scoreSamples(data)) {
            total += score;
        }
        return total;
    }

    private int parameterCount(int d) {
        return k * d + k * d * (d + 1) / 2 + k - 1;
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public double[][] getMeans() {
        return copy(means);
    }

    public double[][][] getCovariances() {
        double[][][] result = new double[covariances.length][][];
        for(int c = 0; c < covariances.length; c++) {
            result[c] = copy(covariances[c]);
        }
        return result;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for(int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return converged;
    }
}
