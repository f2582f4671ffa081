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

import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * How {@link Preprocessor#handleMissingValues} treats missing entries. {@link #fillValue(Object)} carries its own
 * replacement value, so a fill strategy without a value can't be built.
 */
public final class MissingValueStrategy {

    public enum Kind {
        DROP, FILL_MEAN, FILL_MEDIAN, FILL_MODE, FILL_VALUE, INTERPOLATE
    }

    public static final MissingValueStrategy DROP = new MissingValueStrategy(Kind.DROP, null);
    public static final MissingValueStrategy FILL_MEAN = new MissingValueStrategy(Kind.FILL_MEAN, null);
    public static final MissingValueStrategy FILL_MEDIAN = new MissingValueStrategy(Kind.FILL_MEDIAN, null);
    public static final MissingValueStrategy FILL_MODE = new MissingValueStrategy(Kind.FILL_MODE, null);
    public static final MissingValueStrategy INTERPOLATE = new MissingValueStrategy(Kind.INTERPOLATE, null);

    private final Kind kind;
    private final Object fillValue;

    private MissingValueStrategy(Kind kind, Object fillValue) {
        this.kind = kind;
        this.fillValue = fillValue;
    }

    public static MissingValueStrategy fillValue(Object value) {
        if(value == null) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT,
                    "fill_value must be provided when using FILL_VALUE strategy");
        }
        return new MissingValueStrategy(Kind.FILL_VALUE, value);
    }

    /**
     * Parse a strategy name such as {@code "fill_mean"}; FILL_VALUE needs {@link #fillValue(Object)}.
     */
    public static MissingValueStrategy of(String name) {
        Kind kind;
        try {
            kind = Kind.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new AnalysisException(AnalysisErrorCode.UNSUPPORTED_METHOD, e,
                    "Unsupported missing value strategy: " + name);
        }
        switch(kind) {
            case DROP:
                return DROP;
            case FILL_MEAN:
                return FILL_MEAN;
            case FILL_MEDIAN:
                return FILL_MEDIAN;
            case FILL_MODE:
                return FILL_MODE;
            case INTERPOLATE:
                return INTERPOLATE;
            default:
                throw new AnalysisException(AnalysisErrorCode.INVALID_INPUT,
                        "fill_value must be provided when using FILL_VALUE strategy");
        }
    }

    public Kind getKind() {
        return kind;
    }

    public Object getFillValue() {
        return fillValue;
    }

    @Override
    public String toString() {
        return kind == Kind.FILL_VALUE ? "FILL_VALUE(" + fillValue + ")" : kind.name();
    }
}
