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
package ml.shifu.analysis.util;

/**
 * Constants shared by the preprocessor and the analyzers.
 */
public interface Constants {

    public static final String ANALYSIS_TYPE = "analysis_type";
    public static final String TIMESTAMP = "timestamp";
    public static final String ID = "id";
    public static final String PARAMETERS = "parameters";
    public static final String CHARTS_COUNT = "charts_count";
    public static final String DATA = "data";
    public static final String METADATA = "metadata";

    public static final String CONST_TERM = "const";
    public static final String MISSING_BUCKET = "NaN";

    public static final double DEFAULT_ZSCORE_THRESHOLD = 3.0d;
    public static final double DEFAULT_IQR_THRESHOLD = 1.5d;
    public static final double DEFAULT_CONTAMINATION = 0.1d;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    public static final double EPS = 1e-12d;

}
