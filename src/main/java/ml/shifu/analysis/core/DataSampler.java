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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * DataSampler picks rows without replacement, either an exact count or a fraction of the table.
 */
public class DataSampler {

    private static Logger log = LoggerFactory.getLogger(DataSampler.class);

    private DataSampler() {
    }

    /**
     * Resolve the requested sample size.
     * 
     * @param rowCount
     *            rows available
     * @param n
     *            exact count, may be null
     * @param frac
     *            fraction in [0, 1], may be null; gives {@code rint(rowCount * frac)} rows
     * @return sample size
     */
    public static int sampleSize(int rowCount, Integer n, Double frac) {
        if(n != null && frac != null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Please enter a value for `frac` OR `n`, not both");
        }
        if(n != null) {
            if(n < 0) {
                throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "A negative number of rows requested: " + n);
            }
            if(n > rowCount) {
                throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Cannot take a larger sample (" + n
                        + ") than population (" + rowCount + ") without replacement");
            }
            return n;
        }
        if(frac == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Either `n` or `frac` is required");
        }
        if(frac < 0d || frac > 1d || Double.isNaN(frac)) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "`frac` must be within [0, 1], got " + frac);
        }
        return (int) Math.rint(rowCount * frac);
    }

    /**
     * Draw row positions by a partial Fisher-Yates shuffle, in draw order.
     * 
     * @param seed
     *            random seed, null for a non-deterministic draw
     */
    public static List<Integer> sample(int rowCount, int size, Long seed) {
        Random rd = (seed == null ? new Random() : new Random(seed));
        int[] positions = new int[rowCount];
        for(int i = 0; i < rowCount; i++) {
            positions[i] = i;
        }
        List<Integer> sampled = new ArrayList<Integer>(size);
        for(int i = 0; i < size; i++) {
            int j = i + rd.nextInt(rowCount - i);
            int tmp = positions[i];
            positions[i] = positions[j];
            positions[j] = tmp;
            sampled.add(positions[i]);
        }
        log.debug("Sampled {} of {} rows", size, rowCount);
        return sampled;
    }
}
