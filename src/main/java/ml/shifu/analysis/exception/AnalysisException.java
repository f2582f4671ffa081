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
package ml.shifu.analysis.exception;

/**
 * AnalysisException, carries an {@link AnalysisErrorCode} so that callers can tell validation, state and numeric
 * failures apart.
 */
public class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = -2417093356518402174L;

    /**
     * error code
     */
    private AnalysisErrorCode error = null;

    public AnalysisException(AnalysisErrorCode code) {
        super(code.getDescription());
        setError(code);
    }

    public AnalysisException(AnalysisErrorCode code, Exception e) {
        super(code.getDescription(), e);
        this.setError(code);
    }

    public AnalysisException(AnalysisErrorCode code, String msg) {
        super(msg);
        this.setError(code);
    }

    public AnalysisException(AnalysisErrorCode code, Exception e, String msg) {
        super(msg, e);
        this.setError(code);
    }

    public AnalysisErrorCode getError() {
        return error;
    }

    public void setError(AnalysisErrorCode error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return "AnalysisException [error=" + error + ", message=" + getMessage() + "]";
    }

}
