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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Result of a single task handler invocation.
 * <p>
 * A FAILED result carries its message in the {@code error} field of the output.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class TaskResult {

    public static final String ERROR_FIELD = "error";

    private final TaskStatus status;
    private final ObjectNode output;

    public TaskResult(TaskStatus status, ObjectNode output) {
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = output != null ? output : JsonNodeFactory.instance.objectNode();
    }

    public static TaskResult completed(ObjectNode output) {
        return new TaskResult(TaskStatus.COMPLETED, output);
    }

    public static TaskResult failed(String errorMessage) {
        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put(ERROR_FIELD, errorMessage);
        return new TaskResult(TaskStatus.FAILED, output);
    }

    public TaskStatus getStatus() {
        return status;
    }

    public ObjectNode getOutput() {
        return output;
    }

    public boolean isSuccessful() {
        return status == TaskStatus.COMPLETED;
    }

    /**
     * @return the text of the output's {@code error} field, or a generic message if absent
     */
    public String getErrorMessage() {
        JsonNode error = output.get(ERROR_FIELD);
        if (error == null || error.isNull()) {
            return "Task reported failure without an error message";
        }
        return error.isTextual() ? error.asText() : error.toString();
    }

    @Override
    public String toString() {
        return "TaskResult{" +
                "status=" + status +
                ", output=" + output +
                '}';
    }
}
