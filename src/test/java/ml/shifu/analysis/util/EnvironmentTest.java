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

import java.io.IOException;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * EnvironmentTest class
 */
public class EnvironmentTest {

    @Test
    public void testLoadAnalysisConfig() throws IOException {
        Environment.setProperty(Environment.ANALYSIS_HOME, "src/test/resources");
        Environment.loadAnalysisConfig();
        Assert.assertEquals(Environment.getInt(Environment.ISOLATION_FOREST_TREES, null).intValue(), 100);
        Assert.assertEquals(Environment.getProperty(Environment.REGRESSION_BACKEND), "full");
    }

    @Test
    public void testDefaults() {
        Assert.assertEquals(Environment.getInt("no.such.key", 7).intValue(), 7);
        Assert.assertEquals(Environment.getDouble("no.such.key", 0.5d), Double.valueOf(0.5d));
        Assert.assertTrue(Environment.getBoolean("no.such.key", true));

        Environment.setProperty("test.flag", " false ");
        Assert.assertFalse(Environment.getBoolean("test.flag", true));
        Environment.removeProperty("test.flag");
        Assert.assertNull(Environment.getProperty("test.flag"));
    }
}
