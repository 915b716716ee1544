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

package dev.mars.freshflow.workflow;

import dev.mars.freshflow.core.exceptions.WorkflowConfigurationException;

/**
 * Exception thrown when a workflow configuration document cannot be parsed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class WorkflowParseException extends WorkflowConfigurationException {

    private final String workflowName;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public WorkflowParseException(String workflowName, String fieldPath, String message) {
        this(workflowName, fieldPath, message, null);
    }

    public WorkflowParseException(String workflowName, String fieldPath, String message, Throwable cause) {
        super(null, message, cause);
        this.workflowName = workflowName;
        this.fieldPath = fieldPath;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (workflowName != null) {
            sb.append("Workflow '").append(workflowName).append("'");
        }
        if (fieldPath != null) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append("field '").append(fieldPath).append("'");
        }
        if (sb.length() > 0) {
            sb.append(": ");
        }
        sb.append(super.getMessage());

        return sb.toString();
    }
}
