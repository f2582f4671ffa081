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
package ml.shifu.analysis.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Column scaling used by {@link Preprocessor#normalize}. Missing values (NaN) stay NaN.
 */
public class Normalizer {

    private static Logger log = LoggerFactory.getLogger(Normalizer.class);

    public enum NormalizeMethod {
        /**
         * (x - min) / (max - min)
         */
        MIN_MAX,
        /**
         * (x - mean) / std, sample std
         */
        STANDARD,
        /**
         * (x - median) / (Q3 - Q1)
         */
        ROBUST,
        /**
         * x / max(|x|)
         */
        MAX_ABS;

        public static NormalizeMethod of(String name) {
            for(NormalizeMethod m: values()) {
                if(m.name().equalsIgnoreCase(name)) {
                    return m;
                }
            }
            throw new IllegalArgumentException("Unsupported normalization method: " + name);
        }
    }

    private Normalizer() {
    }

    /**
     * Normalize a column.
     * 
     * @param values
     *            column values, NaN for missing
     * @param method
     *            the method
     * @return scaled values, or null if the scale is zero or undefined
     */
    public static double[] normalize(double[] values, NormalizeMethod method) {
        BasicStatsCalculator stats = new BasicStatsCalculator(values);
        double center;
        double scale;
        switch(method) {
            case MIN_MAX:
                center = stats.getMin();
                scale = stats.getMax() - stats.getMin();
                break;
            case STANDARD:
                center = stats.getMean();
                scale = stats.getStdDev();
                break;
            case ROBUST:
                center = stats.getMedian();
                scale = stats.getIqr();
                break;
            case MAX_ABS:
                center = 0d;
                scale = Math.max(Math.abs(stats.getMin()), Math.abs(stats.getMax()));
                break;
            default:
                throw new IllegalArgumentException("Unsupported normalization method: " + method);
        }

        if(Double.isNaN(scale) || scale == 0d) {
            log.debug("Scale of {} normalization is {}, skip", method, scale);
            return null;
        }

        double[] result = new double[values.length];
        for(int i = 0; i < values.length; i++) {
            result[i] = (values[i] - center) / scale;
        }
        return result;
    }

    /**
     * Compute the z-score of one value, 0 if the standard deviation is 0.
     */
    public static double computeZScore(double var, double mean, double stdDev) {
        if(stdDev == 0d) {
            return 0d;
        }
        return (var - mean) / stdDev;
    }
}
