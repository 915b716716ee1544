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

package dev.mars.freshflow.core;

import dev.mars.freshflow.core.exceptions.ErrorCategory;
import dev.mars.freshflow.core.exceptions.FreshflowException;

import java.util.Objects;
import java.util.Optional;

/**
 * The recorded failure of one module within a run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ModuleError {

    private final String message;
    private final String errorType;
    private final ErrorCategory category;
    private final String detail;

    public ModuleError(String message, String errorType, ErrorCategory category, String detail) {
        this.message = Objects.requireNonNull(message, "Message cannot be null");
        this.errorType = Objects.requireNonNull(errorType, "Error type cannot be null");
        this.category = Objects.requireNonNull(category, "Category cannot be null");
        this.detail = detail;
    }

    /**
     * Records a FAILED handler result.
     */
    public static ModuleError fromResult(TaskResult result) {
        return new ModuleError(result.getErrorMessage(), "TaskFailed", ErrorCategory.HANDLER, null);
    }

    public static ModuleError fromException(FreshflowException e) {
        Throwable cause = e.getCause();
        return new ModuleError(e.getMessage(), e.getClass().getSimpleName(), e.getCategory(),
                cause != null ? cause.toString() : null);
    }

    public String getMessage() {
        return message;
    }

    public String getErrorType() {
        return errorType;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public String toString() {
        return "ModuleError{" +
                "message='" + message + '\'' +
                ", errorType='" + errorType + '\'' +
                ", category=" + category +
                ", detail='" + detail + '\'' +
                '}';
    }
}
