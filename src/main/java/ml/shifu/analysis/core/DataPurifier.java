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

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.jexl2.JexlArithmetic;
import org.apache.commons.jexl2.JexlEngine;
import org.apache.commons.jexl2.JexlException;
import org.apache.commons.jexl2.MapContext;
import org.apache.commons.jexl2.Script;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.analysis.container.Column;
import ml.shifu.analysis.container.DataTable;
import ml.shifu.analysis.exception.AnalysisErrorCode;
import ml.shifu.analysis.exception.AnalysisException;

/**
 * Row filter driven by a JEXL boolean expression whose free variables are column names, e.g.
 * {@code age > 30 and income > 50000}.
 * 
 * <p>
 * Missing numeric cells are bound as NaN and every ordered or equality comparison involving NaN is false, so rows with
 * missing values never pass a comparison on that column.
 */
public class DataPurifier {

    private static Logger log = LoggerFactory.getLogger(DataPurifier.class);

    private final String expression;
    private final Script dataFilterExpr;
    private final AnalysisMapContext jc = new AnalysisMapContext();

    public DataPurifier(String expression, Collection<String> columnNames) {
        if(StringUtils.isBlank(expression)) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_FILTER_EXPRESSION, "Filter expression is empty");
        }
        this.expression = expression;
        JexlEngine jexl = new JexlEngine(null, new MissingAwareArithmetic(), null, null);
        jexl.setSilent(false);
        try {
            dataFilterExpr = jexl.createScript(expression);
        } catch (JexlException e) {
            log.error("The expression `{}` is invalid, please use correct expression.", expression);
            throw new AnalysisException(AnalysisErrorCode.INVALID_FILTER_EXPRESSION, e, "Invalid filter expression `"
                    + expression + "`: " + e.getMessage());
        }

        Set<String> unknown = new HashSet<String>();
        for(List<String> variable: jexl.getVariables(dataFilterExpr)) {
            String name = StringUtils.join(variable, ".");
            if(!columnNames.contains(name) && !columnNames.contains(variable.get(0))) {
                unknown.add(name);
            }
        }
        if(!unknown.isEmpty()) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_FILTER_EXPRESSION, "Expression `" + expression
                    + "` references unknown columns " + unknown);
        }
    }

    /**
     * Evaluate the expression on one row.
     * 
     * @return true if the row satisfies the expression
     * @throws AnalysisException
     *             if evaluation fails or the result is not boolean
     */
    public boolean isFilter(DataTable table, int position) {
        jc.clear();
        for(Column column: table.getColumns()) {
            Object value = column.get(position);
            if(value == null && column.isNumeric()) {
                value = Double.NaN;
            }
            jc.set(column.getName(), value);
        }

        Object retObj;
        try {
            retObj = dataFilterExpr.execute(jc);
        } catch (JexlException e) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_FILTER_EXPRESSION, e, "Error occurred when "
                    + "evaluating `" + expression + "`: " + e.getMessage());
        }

        if(retObj instanceof Boolean) {
            return (Boolean) retObj;
        }
        throw new AnalysisException(AnalysisErrorCode.INVALID_FILTER_EXPRESSION, "Expression `" + expression
                + "` returned " + retObj + " instead of a boolean");
    }

    /**
     * @return mask of rows satisfying the expression
     */
    public boolean[] filter(DataTable table) {
        boolean[] keep = new boolean[table.getRowCount()];
        for(int i = 0; i < keep.length; i++) {
            keep[i] = isFilter(table, i);
        }
        return keep;
    }

    public String getExpression() {
        return expression;
    }

    public static class AnalysisMapContext extends MapContext {
        public AnalysisMapContext() {
            super();
        }

        public void clear() {
            if(super.map != null) {
                map.clear();
            }
        }
    }

    /**
     * Strict arithmetic where comparisons with NaN are false.
     */
    public static class MissingAwareArithmetic extends JexlArithmetic {

        public MissingAwareArithmetic() {
            super(false);
        }

        private static boolean isNaN(Object o) {
            return (o instanceof Double && ((Double) o).isNaN()) || (o instanceof Float && ((Float) o).isNaN());
        }

        @Override
        public boolean equals(Object left, Object right) {
            if(isNaN(left) || isNaN(right)) {
                return false;
            }
            return super.equals(left, right);
        }

        @Override
        public boolean lessThan(Object left, Object right) {
            if(isNaN(left) || isNaN(right)) {
                return false;
            }
            return super.lessThan(left, right);
        }

        @Override
        public boolean greaterThan(Object left, Object right) {
            if(isNaN(left) || isNaN(right)) {
                return false;
            }
            return super.greaterThan(left, right);
        }

        @Override
        public boolean lessThanOrEqual(Object left, Object right) {
            if(isNaN(left) || isNaN(right)) {
                return false;
            }
            return super.lessThanOrEqual(left, right);
        }

        @Override
        public boolean greaterThanOrEqual(Object left, Object right) {
            if(isNaN(left) || isNaN(right)) {
                return false;
            }
            return super.greaterThanOrEqual(left, right);
        }
    }
}
