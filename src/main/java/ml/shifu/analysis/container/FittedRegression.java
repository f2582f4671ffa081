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
import java.util.List;
import java.util.Map;

import ml.shifu.analysis.core.analyzer.RegressionType;

/**
 * An immutable fitted regression: the variables and expansion that produced it, the estimated coefficients and the
 * data it was fitted on. Safe to share between threads.
 */
public class FittedRegression {

    private final RegressionType type;
    private final String dependentVar;
    private final List<String> independentVars;
    private final int degree;
    private final List<String> termNames;
    private final String backendName;

    private final double[][] predictors;
    private final double[] response;
    private final RegressionFit fit;

    public FittedRegression(RegressionType type, String dependentVar, List<String> independentVars, int degree,
            List<String> termNames, String backendName, double[][] predictors, double[] response, RegressionFit fit) {
        this.type = type;
        this.dependentVar = dependentVar;
        this.independentVars = Collections.unmodifiableList(new ArrayList<String>(independentVars));
        this.degree = degree;
        this.termNames = Collections.unmodifiableList(new ArrayList<String>(termNames));
        this.backendName = backendName;
        this.predictors = copy(predictors);
        this.response = response.clone();
        this.fit = fit;
    }

    /**
     * Design row without the constant term: the raw predictors, or the powers x^1..x^degree for a polynomial model.
     */
    public double[] expand(double[] raw) {
        return expand(type, degree, raw);
    }

    public double[][] expand(double[][] raw) {
        return expand(type, degree, raw);
    }

    public static double[] expand(RegressionType type, int degree, double[] raw) {
        if(type != RegressionType.POLYNOMIAL) {
            return raw.clone();
        }
        double[] row = new double[degree];
        double power = 1d;
        for(int d = 0; d < degree; d++) {
            power *= raw[0];
            row[d] = power;
        }
        return row;
    }

    public static double[][] expand(RegressionType type, int degree, double[][] raw) {
        double[][] design = new double[raw.length][];
        for(int i = 0; i < raw.length; i++) {
            design[i] = expand(type, degree, raw[i]);
        }
        return design;
    }

    /**
     * Predicted value for one raw predictor row; a probability for logistic models.
     */
    public double predict(double[] raw) {
        double[] coefficients = fit.getCoefficients();
        double[] row = expand(raw);
        double value = coefficients[0];
        for(int j = 0; j < row.length; j++) {
            value += coefficients[j + 1] * row[j];
        }
        return type == RegressionType.LOGISTIC ? sigmoid(value) : value;
    }

    public static double sigmoid(double z) {
        if(z >= 0) {
            return 1d / (1d + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1d + e);
    }

    public boolean isLogistic() {
        return type == RegressionType.LOGISTIC;
    }

    public double[] getResiduals() {
        double[] fitted = fit.getFitted();
        double[] residuals = new double[response.length];
        for(int i = 0; i < residuals.length; i++) {
            residuals[i] = response[i] - fitted[i];
        }
        return residuals;
    }

    public RegressionType getType() {
        return type;
    }

    public String getDependentVar() {
        return dependentVar;
    }

    public List<String> getIndependentVars() {
        return independentVars;
    }

    public int getDegree() {
        return degree;
    }

    public List<String> getTermNames() {
        return termNames;
    }

    public String getBackendName() {
        return backendName;
    }

    public double[][] getPredictors() {
        return copy(predictors);
    }

    public double[] getResponse() {
        return response.clone();
    }

    public double[] getFitted() {
        return fit.getFitted();
    }

    public double[] getCoefficients() {
        return fit.getCoefficients();
    }

    public Map<String, Object> getStatistics() {
        return fit.getStatistics();
    }

    public int getObservationCount() {
        return response.length;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for(int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }
}
