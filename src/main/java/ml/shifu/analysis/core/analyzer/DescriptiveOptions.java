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

import java.util.ArrayList;
import java.util.List;

import ml.shifu.analysis.core.OutlierMethod;

/**
 * Options of {@link DescriptiveAnalyzer#analyze(DescriptiveOptions)}, with fluent setters.
 */
public class DescriptiveOptions {

    private List<String> columns;
    private StatType statType = StatType.ALL;
    private boolean basicStats = true;
    private boolean distributionStats = true;
    private boolean outliers = false;
    private OutlierMethod outlierMethod = OutlierMethod.IQR;
    private Double outlierThreshold;
    private boolean frequencyTable = false;
    private boolean includeCharts = true;

    public List<String> getColumns() {
        return columns;
    }

    public DescriptiveOptions columns(List<String> columns) {
        this.columns = (columns == null ? null : new ArrayList<String>(columns));
        return this;
    }

    public StatType getStatType() {
        return statType;
    }

    public DescriptiveOptions statType(StatType statType) {
        this.statType = statType;
        return this;
    }

    public boolean isBasicStats() {
        return basicStats;
    }

    public DescriptiveOptions basicStats(boolean basicStats) {
        this.basicStats = basicStats;
        return this;
    }

    public boolean isDistributionStats() {
        return distributionStats;
    }

    public DescriptiveOptions distributionStats(boolean distributionStats) {
        this.distributionStats = distributionStats;
        return this;
    }

    public boolean isOutliers() {
        return outliers;
    }

    public DescriptiveOptions outliers(boolean outliers) {
        this.outliers = outliers;
        return this;
    }

    public OutlierMethod getOutlierMethod() {
        return outlierMethod;
    }

    public DescriptiveOptions outlierMethod(OutlierMethod outlierMethod) {
        this.outlierMethod = outlierMethod;
        return this;
    }

    /**
     * Threshold for the chosen method; the method default when unset.
     */
    public double getOutlierThreshold() {
        return outlierThreshold == null ? outlierMethod.getDefaultThreshold() : outlierThreshold;
    }

    public DescriptiveOptions outlierThreshold(Double outlierThreshold) {
        this.outlierThreshold = outlierThreshold;
        return this;
    }

    public boolean isFrequencyTable() {
        return frequencyTable;
    }

    public DescriptiveOptions frequencyTable(boolean frequencyTable) {
        this.frequencyTable = frequencyTable;
        return this;
    }

    public boolean isIncludeCharts() {
        return includeCharts;
    }

    public DescriptiveOptions includeCharts(boolean includeCharts) {
        this.includeCharts = includeCharts;
        return this;
    }

    @Override
    public String toString() {
        return "DescriptiveOptions [columns=" + columns + ", statType=" + statType + ", outliers=" + outliers
                + ", outlierMethod=" + outlierMethod + ", frequencyTable=" + frequencyTable + "]";
    }
}
