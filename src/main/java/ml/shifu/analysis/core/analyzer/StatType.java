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

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Which statistic groups a descriptive analysis computes.
 */
public enum StatType {
    BASIC, DISTRIBUTION, ALL;

    public boolean includesBasic() {
        return this == BASIC || this == ALL;
    }

    public boolean includesDistribution() {
        return this == DISTRIBUTION || this == ALL;
    }

    public static StatType of(String name) {
        for(StatType type: values()) {
            if(type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, "Unsupported stat type: " + name);
    }
}
