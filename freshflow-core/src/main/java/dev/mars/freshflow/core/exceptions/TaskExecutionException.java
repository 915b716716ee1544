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
 * Exception thrown when a task handler fails to execute a module.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TaskExecutionException extends FreshflowException {

    private final String moduleId;

    public TaskExecutionException(String moduleId, String message) {
        super(ErrorCategory.HANDLER, message);
        this.moduleId = moduleId;
    }

    public TaskExecutionException(String moduleId, String message, Throwable cause) {
        super(ErrorCategory.HANDLER, message, cause);
        this.moduleId = moduleId;
    }

    public String getModuleId() {
        return moduleId;
    }

    @Override
    public String getMessage() {
        return String.format("Task %s failed: %s", moduleId, super.getMessage());
    }
}
