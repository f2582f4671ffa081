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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.AbstractModule;

import ml.shifu.analysis.chart.ChartProvider;
import ml.shifu.analysis.chart.ChartRenderer;
import ml.shifu.analysis.chart.DefaultChartProvider;
import ml.shifu.analysis.chart.LoggingChartRenderer;
import ml.shifu.analysis.di.builtin.FullRegressionBackend;
import ml.shifu.analysis.di.builtin.ReducedRegressionBackend;
import ml.shifu.analysis.di.spi.RegressionBackend;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;
import ml.shifu.analysis.util.Environment;

/**
 * Binds the analyzers' collaborators. Unless an implementation class is set explicitly, the regression backend comes
 * from the {@code regressionBackend} property: {@code full} (default), {@code reduced} or a fully qualified class
 * name.
 */
public class AnalysisModule extends AbstractModule {

    private static Logger log = LoggerFactory.getLogger(AnalysisModule.class);

    private Class<? extends RegressionBackend> regressionBackendImplClass;
    private Class<? extends ChartRenderer> chartRendererImplClass;
    private Class<? extends ChartProvider> chartProviderImplClass;

    public AnalysisModule() {
    }

    public void setRegressionBackendImplClass(String name) {
        regressionBackendImplClass = resolveBackend(name);
    }

    public void setRegressionBackendImplClass(Class<? extends RegressionBackend> clazz) {
        regressionBackendImplClass = clazz;
    }

    public void setChartRendererImplClass(Class<? extends ChartRenderer> clazz) {
        chartRendererImplClass = clazz;
    }

    public void setChartProviderImplClass(Class<? extends ChartProvider> clazz) {
        chartProviderImplClass = clazz;
    }

    @Override
    protected void configure() {
        Class<? extends RegressionBackend> backend = regressionBackendImplClass;
        if(backend == null) {
            backend = resolveBackend(Environment.getProperty(Environment.REGRESSION_BACKEND,
                    FullRegressionBackend.NAME));
        }
        log.debug("Regression backend bound to {}", backend.getName());
        bind(RegressionBackend.class).to(backend);

        bind(ChartRenderer.class).to(chartRendererImplClass == null ? LoggingChartRenderer.class
                : chartRendererImplClass);
        bind(ChartProvider.class).to(chartProviderImplClass == null ? DefaultChartProvider.class
                : chartProviderImplClass);
    }

    @SuppressWarnings("unchecked")
    static Class<? extends RegressionBackend> resolveBackend(String name) {
        if(name == null || FullRegressionBackend.NAME.equalsIgnoreCase(name.trim())) {
            return FullRegressionBackend.class;
        }
        if(ReducedRegressionBackend.NAME.equalsIgnoreCase(name.trim())) {
            return ReducedRegressionBackend.class;
        }
        try {
            Class<?> clazz = Class.forName(name.trim());
            if(!RegressionBackend.class.isAssignableFrom(clazz)) {
                throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, name
                        + " is not a RegressionBackend");
            }
            return (Class<? extends RegressionBackend>) clazz;
        } catch (ClassNotFoundException e) {
            throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, e, "Unknown regression backend: "
                    + name);
        }
    }
}
