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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Registry of datasets keyed by name.
 */
public class DataManager {

    private static Logger log = LoggerFactory.getLogger(DataManager.class);

    private final Map<String, Dataset> datasets = new LinkedHashMap<String, Dataset>();

    public void addDataset(Dataset dataset) {
        if(dataset == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Dataset can't be null");
        }
        if(datasets.containsKey(dataset.getName())) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Dataset with name '" + dataset.getName()
                    + "' already exists");
        }
        datasets.put(dataset.getName(), dataset);
        log.debug("Dataset {} registered", dataset.getName());
    }

    public Dataset getDataset(String name) {
        return datasets.get(name);
    }

    public boolean removeDataset(String name) {
        return datasets.remove(name) != null;
    }

    public void renameDataset(String oldName, String newName) {
        Dataset dataset = datasets.get(oldName);
        if(dataset == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Dataset '" + oldName + "' not found");
        }
        if(!oldName.equals(newName) && datasets.containsKey(newName)) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT, "Dataset with name '" + newName
                    + "' already exists");
        }
        // rebuild to keep insertion order with the new key
        Map<String, Dataset> renamed = new LinkedHashMap<String, Dataset>();
        for(Map.Entry<String, Dataset> entry: datasets.entrySet()) {
            if(entry.getKey().equals(oldName)) {
                dataset.setName(newName);
                renamed.put(newName, dataset);
            } else {
                renamed.put(entry.getKey(), entry.getValue());
            }
        }
        datasets.clear();
        datasets.putAll(renamed);
    }

    public List<String> listDatasets() {
        return new ArrayList<String>(datasets.keySet());
    }

    public int size() {
        return datasets.size();
    }

    public void clear() {
        datasets.clear();
    }
}
