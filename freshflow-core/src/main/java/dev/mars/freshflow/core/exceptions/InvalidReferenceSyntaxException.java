/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.freshflow.core.exceptions;

/**
 * Thrown when a configuration value looks like a reference but cannot be used as one.
 * <p>
 * Covers templates embedded in a longer string (partial interpolation is not
 * supported) and structured references with a missing, blank or non-string
 * {@code module_id} or {@code output_key}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class InvalidReferenceSyntaxException extends ReferenceException {

    private final String moduleId;
    private final String expression;
    private final String reason;

    public InvalidReferenceSyntaxException(String expression, String reason) {
        this(null, expression, reason);
    }

    public InvalidReferenceSyntaxException(String moduleId, String expression, String reason) {
        super(ErrorCategory.CONFIGURATION, null, reason);
        this.moduleId = moduleId;
        this.expression = expression;
        this.reason = reason;
    }

    /**
     * @return the module whose configuration holds the expression, if known
     */
    public String getModuleId() {
        return moduleId;
    }

    public String getExpression() {
        return expression;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (moduleId != null) {
            sb.append("Module '").append(moduleId).append("': ");
        }
        sb.append(reason).append(" [").append(expression).append("]");
        return sb.toString();
    }
}
