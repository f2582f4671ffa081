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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * {@link Environment} stores global analysis settings and returns them to callers through
 * {@link #getProperty(String)} and the typed getters.
 */
public class Environment {

    public static final String ANALYSIS_HOME = "SHIFU_ANALYSIS_HOME";

    /**
     * Prefix of JVM system properties that override file settings, e.g. -Dshifu.analysis.regressionBackend=reduced
     */
    public static final String SYSTEM_PROPERTY_PREFIX = "shifu.analysis.";

    public static final String REGRESSION_BACKEND = "regressionBackend";
    public static final String RANDOM_SEED = "randomSeed";
    public static final String ISOLATION_FOREST_TREES = "isolationForest.trees";
    public static final String CORRELATION_TOP_PAIRS = "correlation.topPairs";

    private static Logger logger = LoggerFactory.getLogger(Environment.class);
    private static Properties properties = new Properties();

    static {
        String homePath = ((System.getenv(ANALYSIS_HOME) == null) ? System.getProperty(ANALYSIS_HOME) : System
                .getenv(ANALYSIS_HOME));
        properties.put(ANALYSIS_HOME, ((homePath == null) ? "" : homePath));

        try {
            loadAnalysisConfig();
        } catch (IOException e) {
            throw new AnalysisException(AnalysisErrorCode.CONFIG_LOAD_FAILED, e);
        }

        if(properties.size() == 1) {
            logger.debug("No analysis config is found, defaults are used");
        }
    }

    /*
     * Load properties from
     * 1. ${SHIFU_ANALYSIS_HOME}/conf/analysis.properties
     * 2. ~/.shifu-analysis.properties
     * 3. -Dshifu.analysis.* system properties
     *
     * Later sources win. Can be called again to reload.
     */
    public static void loadAnalysisConfig() throws IOException {
        String home = getProperty(ANALYSIS_HOME);
        if(StringUtils.isNotBlank(home)) {
            loadProperties(properties, home + File.separator + "conf" + File.separator + "analysis.properties");
        }

        String userHome = System.getProperty("user.home");
        loadProperties(properties, userHome + File.separator + ".shifu-analysis.properties");

        for(Map.Entry<Object, Object> entry: System.getProperties().entrySet()) {
            String key = entry.getKey().toString();
            if(key.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                properties.put(key.substring(SYSTEM_PROPERTY_PREFIX.length()), entry.getValue().toString());
            }
        }
    }

    /*
     * Get global property by property name
     */
    public static String getProperty(String propertyName) {
        return properties.getProperty(propertyName);
    }

    public static void setProperty(String propertyName, String propertyValue) {
        properties.put(propertyName, propertyValue);
    }

    public static void removeProperty(String propertyName) {
        properties.remove(propertyName);
    }

    /*
     * Get property, if null return default value
     */
    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return (propertyValue == null) ? defValue : propertyValue;
    }

    /*
     * Get property as Integer value, if null return default value
     */
    public static Integer getInt(String propertyName, Integer defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Integer.valueOf(propertyValue.trim());
    }

    /*
     * Get property as Double value, if null return default value
     */
    public static Double getDouble(String propertyName, Double defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Double.valueOf(propertyValue.trim());
    }

    /*
     * Get property as Boolean value, if null return default value
     */
    public static Boolean getBoolean(String propertyName, Boolean defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Boolean.valueOf(propertyValue.trim());
    }

    private static void loadProperties(Properties props, String fileName) throws IOException {
        File configFile = new File(fileName);
        if(!configFile.exists()) {
            return;
        }

        logger.info("Loading analysis config from {}", fileName);
        InputStream in = null;
        try {
            in = new FileInputStream(configFile);
            props.load(in);
        } finally {
            IOUtils.closeQuietly(in);
        }
    }
}
