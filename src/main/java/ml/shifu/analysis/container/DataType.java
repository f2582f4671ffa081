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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Semantic type of a {@link Column}. Each type fixes the java representation of its non-missing values:
 * INTEGER holds {@link Long}, FLOAT holds {@link Double}, STRING and CATEGORY hold {@link String}, DATETIME holds
 * {@link LocalDateTime} and BOOLEAN holds {@link Boolean}. Missing values are always {@code null}.
 */
public enum DataType {
    INTEGER("int", "int64", "int32", "integer", "long"), FLOAT("float", "float64", "float32", "double", "number"), STRING(
            "str", "string", "object", "text"), CATEGORY("category", "categorical"), DATETIME("datetime",
            "datetime64", "datetime64[ns]", "date", "timestamp"), BOOLEAN("bool", "boolean");

    private final List<String> aliases;

    private DataType(String... aliases) {
        this.aliases = Arrays.asList(aliases);
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public boolean isCategorical() {
        return this == STRING || this == CATEGORY || this == BOOLEAN;
    }

    public static DataType of(String dataType) {
        if(dataType == null) {
            throw new IllegalArgumentException("Cannot find DataType null");
        }
        String lower = dataType.trim().toLowerCase();
        for(DataType dt: values()) {
            if(dt.name().equalsIgnoreCase(lower) || dt.aliases.contains(lower)) {
                return dt;
            }
        }
        throw new IllegalArgumentException("Cannot find DataType " + dataType);
    }

    /**
     * Cast one value to this type's representation. Cast failures surface as the JDK's own exceptions
     * ({@link NumberFormatException}, {@link java.time.format.DateTimeParseException},
     * {@link IllegalArgumentException}).
     * 
     * @param value
     *            raw value, may be null
     * @return converted value, null for missing
     */
    public Object convert(Object value) {
        if(value == null || (value instanceof Double && ((Double) value).isNaN())
                || (value instanceof Float && ((Float) value).isNaN())) {
            return null;
        }
        switch(this) {
            case INTEGER:
                return toLong(value);
            case FLOAT:
                return toDouble(value);
            case STRING:
            case CATEGORY:
                return value.toString();
            case DATETIME:
                return toDateTime(value);
            case BOOLEAN:
                return toBoolean(value);
            default:
                throw new IllegalStateException("Unknown data type " + this);
        }
    }

    private static Long toLong(Object value) {
        if(value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if(Double.isInfinite(d)) {
                throw new IllegalArgumentException("Cannot convert non-finite value " + value + " to integer");
            }
            return ((Number) value).longValue();
        }
        if(value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        return Long.parseLong(value.toString().trim());
    }

    private static Double toDouble(Object value) {
        if(value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if(value instanceof Boolean) {
            return ((Boolean) value) ? 1d : 0d;
        }
        return Double.parseDouble(value.toString().trim());
    }

    private static LocalDateTime toDateTime(Object value) {
        if(value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if(value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if(value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if(value instanceof java.util.Date) {
            return LocalDateTime.ofInstant(((java.util.Date) value).toInstant(), ZoneOffset.UTC);
        }
        if(value instanceof Number) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Number) value).longValue()), ZoneOffset.UTC);
        }
        String text = value.toString().trim();
        if(text.length() <= 10) {
            return LocalDate.parse(text).atStartOfDay();
        }
        return LocalDateTime.parse(text.replace(' ', 'T'));
    }

    private static Boolean toBoolean(Object value) {
        if(value instanceof Boolean) {
            return (Boolean) value;
        }
        if(value instanceof Number) {
            return ((Number) value).doubleValue() != 0d;
        }
        String text = value.toString().trim().toLowerCase();
        if("true".equals(text) || "1".equals(text) || "yes".equals(text) || "y".equals(text)) {
            return Boolean.TRUE;
        }
        if("false".equals(text) || "0".equals(text) || "no".equals(text) || "n".equals(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Cannot convert '" + value + "' to boolean");
    }

    /**
     * Infer the narrowest type able to hold all non-missing values. Integral data with missing entries is widened to
     * FLOAT.
     */
    public static DataType infer(List<?> values) {
        boolean allIntegral = true, allNumber = true, allBoolean = true, allDate = true, hasMissing = false;
        int nonMissing = 0;
        for(Object v: values) {
            if(v == null || (v instanceof Double && ((Double) v).isNaN()) || (v instanceof Float && ((Float) v).isNaN())) {
                hasMissing = true;
                continue;
            }
            nonMissing++;
            boolean integral = v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte;
            allIntegral &= integral;
            allNumber &= (v instanceof Number);
            allBoolean &= (v instanceof Boolean);
            allDate &= (v instanceof LocalDateTime || v instanceof LocalDate || v instanceof Instant);
        }
        if(nonMissing == 0) {
            return FLOAT;
        }
        if(allIntegral) {
            return hasMissing ? FLOAT : INTEGER;
        }
        if(allNumber) {
            return FLOAT;
        }
        if(allBoolean) {
            return BOOLEAN;
        }
        if(allDate) {
            return DATETIME;
        }
        return STRING;
    }
}
