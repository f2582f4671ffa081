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
package ml.shifu.analysis.di.module;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.inject.Guice;
import com.google.inject.Injector;

import ml.shifu.analysis.chart.ChartRenderer;
import ml.shifu.analysis.chart.ChartSpec;
import ml.shifu.analysis.container.AnalysisResult;
import ml.shifu.analysis.container.Dataset;
import ml.shifu.analysis.core.analyzer.CorrelationAnalyzer;
import ml.shifu.analysis.core.analyzer.CorrelationMethod;
import ml.shifu.analysis.core.analyzer.RegressionAnalyzer;
import ml.shifu.analysis.di.builtin.FullRegressionBackend;
import ml.shifu.analysis.di.builtin.ReducedRegressionBackend;
import ml.shifu.analysis.di.spi.RegressionBackend;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Environment;

public class AnalysisModuleTest {

    public static class RecordingRenderer implements ChartRenderer {

        static final List<String> RENDERED = new ArrayList<String>();

        @Override
        public void render(ChartSpec spec) {
            RENDERED.add(spec.getTitle());
        }
    }

    @BeforeMethod
    public void setUp() {
        Environment.removeProperty(Environment.REGRESSION_BACKEND);
        RecordingRenderer.RENDERED.clear();
    }

    @Test
    public void testDefaultBackend() {
        Injector injector = Guice.createInjector(new AnalysisModule());
        RegressionAnalyzer analyzer = injector.getInstance(RegressionAnalyzer.class);
        Assert.assertTrue(analyzer.getBackend() instanceof FullRegressionBackend);
    }

    @Test
    public void testBackendFromProperty() {
        Environment.setProperty(Environment.REGRESSION_BACKEND, "reduced");
        try {
            Injector injector = Guice.createInjector(new AnalysisModule());
            Assert.assertTrue(injector.getInstance(RegressionBackend.class) instanceof ReducedRegressionBackend);
        } finally {
            Environment.removeProperty(Environment.REGRESSION_BACKEND);
        }
    }

    @Test
    public void testBackendByClassName() {
        AnalysisModule module = new AnalysisModule();
        module.setRegressionBackendImplClass(ReducedRegressionBackend.class.getName());
        RegressionAnalyzer analyzer = Guice.createInjector(module).getInstance(RegressionAnalyzer.class);
        Assert.assertEquals(analyzer.getBackend().getName(), ReducedRegressionBackend.NAME);
    }

    @Test
    public void testUnknownBackend() {
        try {
            AnalysisModule.resolveBackend("gpu");
            Assert.fail("unknown backend");
        } catch (AnalysisException e) {
            Assert.assertEquals(e.getError(), AnalysisErrorCode.UNSUPPORTED_METHOD);
        }
        try {
            AnalysisModule.resolveBackend(String.class.getName());
            Assert.fail("not a backend");
        } catch (AnalysisException e) {
            Assert.assertEquals(e.getError(), AnalysisErrorCode.UNSUPPORTED_METHOD);
        }
    }

    @Test
    public void testCustomRendererReceivesCharts() {
        AnalysisModule module = new AnalysisModule();
        module.setChartRendererImplClass(RecordingRenderer.class);
        CorrelationAnalyzer analyzer = Guice.createInjector(module).getInstance(CorrelationAnalyzer.class);
        analyzer.setDataset(Dataset.from(new double[][] { { 1, 2 }, { 2, 4.1 }, { 3, 5.9 }, { 4, 8.2 } }));

        AnalysisResult result = analyzer.analyze(Arrays.asList("0", "1"), CorrelationMethod.PEARSON);
        result.getCharts().get(0).plot();
        Assert.assertEquals(RecordingRenderer.RENDERED, Arrays.asList("Correlation heatmap"));
    }
}
