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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

public class CorrelationAnalyzerTest {

    private CorrelationAnalyzer analyzer;

    @BeforeMethod
    public void setUp() {
        Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
        columns.put("a", Arrays.<Object> asList(1, 2, 3, 4, 5, 6, 7, 8));
        columns.put("b", Arrays.<Object> asList(2.1, 3.9, 6.2, 8.1, 9.8, 12.2, 13.9, 16.1));
        columns.put("c", Arrays.<Object> asList(5, 3, 8, 1, 7, 2, 6, 4));
        columns.put("d", Arrays.<Object> asList(1, 4, 9, 16, null, 36, 49, 64));
        columns.put("name", Arrays.<Object> asList("p", "q", "r", "s", "t", "u", "v", "w"));
        analyzer = new CorrelationAnalyzer(new Dataset(Dataset.fromColumns(columns)));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testMatrixIsSymmetricWithUnitDiagonal() {
        for(CorrelationMethod method: CorrelationMethod.values()) {
            AnalysisResult result = analyzer.analyze(null, method, true, false);
            Map<String, Map<String, Double>> corr = result.get("correlation");
            Assert.assertEquals(corr.keySet().toString(), "[a, b, c, d]");
            for(String row: corr.keySet()) {
                Assert.assertEquals(corr.get(row).get(row), 1d, 1e-12);
                for(String col: corr.keySet()) {
                    Assert.assertEquals(corr.get(row).get(col), corr.get(col).get(row), 1e-12, method + " " + row
                            + "/" + col);
                }
            }
            Map<String, Map<String, Double>> p = result.get("p_values");
            Assert.assertEquals(p.get("a").get("a"), 0d, 1e-12);
            Assert.assertEquals(result.getMetadata().get("method"), method.getValue());
            Assert.assertEquals(result.getAnalysisType(), "correlation");
        }
    }

    @Test
    public void testMonotoneColumnsUnderRankMethods() {
        Map<String, Map<String, Double>> spearman = analyzer.correlationMatrix(null, CorrelationMethod.SPEARMAN);
        // d is strictly increasing in a on the rows both have
        Assert.assertEquals(spearman.get("a").get("d"), 1d, 1e-12);
        Map<String, Map<String, Double>> kendall = analyzer.correlationMatrix(null, CorrelationMethod.KENDALL);
        Assert.assertEquals(kendall.get("a").get("d"), 1d, 1e-12);
        Map<String, Map<String, Double>> pearson = analyzer.correlationMatrix(null, CorrelationMethod.PEARSON);
        Assert.assertTrue(pearson.get("a").get("d") < 1d);
        Assert.assertTrue(pearson.get("a").get("b") > 0.99d);
    }

    @Test
    public void testNonNumericColumnsAreLeftOut() {
        AnalysisResult result = analyzer.analyze(Arrays.asList("a", "name", "b"), CorrelationMethod.PEARSON);
        Assert.assertEquals(result.getMetadata().get("columns"), Arrays.asList("a", "b"));
        // heatmap, p-value heatmap and one scatter for the single pair
        Assert.assertEquals(result.getCharts().size(), 3);
    }

    @Test
    public void testOnlyNonNumericColumns() {
        try {
            analyzer.analyze(Collections.singletonList("name"), CorrelationMethod.PEARSON);
            Assert.fail("no numeric column selected");
        } catch (AnalysisException e) {
            Assert.assertEquals(e.getError(), AnalysisErrorCode.EMPTY_COLUMNS);
        }
    }

    @Test
    public void testParametersPath() {
        Map<String, Object> params = new LinkedHashMap<String, Object>();
        params.put("columns", Arrays.asList("a", "c"));
        params.put("method", "spearman");
        params.put("include_p_values", false);
        params.put("include_charts", false);
        analyzer.setParameters(params);
        AnalysisResult result = analyzer.analyze();
        Assert.assertNull(result.get("p_values"));
        Assert.assertEquals(result.getMetadata().get("include_p_values"), Boolean.FALSE);
        Assert.assertTrue(result.getCharts().isEmpty());
    }

    @Test(expectedExceptions = AnalysisException.class)
    public void testUnknownMethod() {
        CorrelationMethod.of("distance");
    }

    @Test
    public void testSignificantCorrelations() {
        List<Map<String, Object>> pairs = analyzer.significantCorrelations(Arrays.asList("a", "b", "c"),
                CorrelationMethod.PEARSON);
        Assert.assertEquals(pairs.size(), 1);
        Assert.assertEquals(pairs.get(0).get("variable1"), "a");
        Assert.assertEquals(pairs.get(0).get("variable2"), "b");
        Assert.assertEquals(pairs.get(0).get("significant"), "Yes");
    }

    @Test
    public void testPartialCorrelation() {
        double[] result = analyzer.partialCorrelation("b", "c", Arrays.asList("a"));
        Assert.assertEquals(result.length, 2);
        Assert.assertTrue(Math.abs(result[0]) <= 1d);
        Assert.assertTrue(result[1] >= 0d && result[1] <= 1d);
    }

    @Test(expectedExceptions = AnalysisException.class)
    public void testPartialCorrelationNeedsRows() {
        Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
        columns.put("x", Arrays.<Object> asList(1, 2, 3));
        columns.put("y", Arrays.<Object> asList(2, 1, 3));
        columns.put("z", Arrays.<Object> asList(0, 1, 1));
        new CorrelationAnalyzer(new Dataset(Dataset.fromColumns(columns))).partialCorrelation("x", "y",
                Arrays.asList("z"));
    }

    @Test
    public void testCorrelationTest() {
        Map<String, Object> test = analyzer.correlationTest("a", "b", CorrelationMethod.PEARSON);
        double r = (Double) test.get("correlation");
        Assert.assertTrue((Double) test.get("ci_lower") < r);
        Assert.assertTrue((Double) test.get("ci_upper") > r);
        Assert.assertEquals(test.get("sample_size"), 8);
        Assert.assertEquals(test.get("significant"), Boolean.TRUE);
        Assert.assertEquals(test.get("method"), CorrelationMethod.PEARSON.getDescription());
    }
}
