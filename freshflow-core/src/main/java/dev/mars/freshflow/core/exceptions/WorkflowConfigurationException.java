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
 * Base class for errors found while building a workflow from its configuration.
 * These are raised before any module executes and fail the whole submission.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class WorkflowConfigurationException extends FreshflowException {

    private final String moduleId;

    public WorkflowConfigurationException(String moduleId, String message) {
        super(ErrorCategory.CONFIGURATION, message);
        this.moduleId = moduleId;
    }

    public WorkflowConfigurationException(String moduleId, String message, Throwable cause) {
        super(ErrorCategory.CONFIGURATION, message, cause);
        this.moduleId = moduleId;
    }

    /**
     * @return the offending module id, or null when the error is not tied to one module
     */
    public String getModuleId() {
        return moduleId;
    }

    @Override
    public String getMessage() {
        if (moduleId == null) {
            return super.getMessage();
        }
        return "Module '" + moduleId + "': " + super.getMessage();
    }
}
