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

package dev.mars.freshflow.workflow.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Progress notification emitted by the workflow engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public final class WorkflowEvent {

    public enum Type {
        WORKFLOW_STARTED,
        WORKFLOW_COMPLETED,
        WORKFLOW_FAILED,
        WORKFLOW_CANCELLED,
        MODULE_STARTED,
        MODULE_COMPLETED,
        MODULE_FAILED,
        MODULE_SKIPPED,
        MODULE_CANCELLED;

        public boolean isWorkflowEvent() {
            return name().startsWith("WORKFLOW_");
        }

        /**
         * @return true for the last event a run ever emits
         */
        public boolean isTerminal() {
            return this == WORKFLOW_COMPLETED || this == WORKFLOW_FAILED || this == WORKFLOW_CANCELLED;
        }
    }

    private final Type type;
    private final String executionId;
    private final String workflowName;
    private final String moduleId;
    private final Instant timestamp;
    private final String message;
    private final Map<String, Object> details;

    private WorkflowEvent(Type type, String executionId, String workflowName, String moduleId,
                          String message, Map<String, Object> details) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowName = workflowName;
        this.moduleId = moduleId;
        this.timestamp = Instant.now();
        this.message = message;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static WorkflowEvent workflow(Type type, String executionId, String workflowName, String message) {
        return new WorkflowEvent(type, executionId, workflowName, null, message, null);
    }

    public static WorkflowEvent workflow(Type type, String executionId, String workflowName, String message,
                                         Map<String, Object> details) {
        return new WorkflowEvent(type, executionId, workflowName, null, message, details);
    }

    public static WorkflowEvent module(Type type, String executionId, String workflowName, String moduleId,
                                       String message, Map<String, Object> details) {
        Objects.requireNonNull(moduleId, "Module id cannot be null");
        return new WorkflowEvent(type, executionId, workflowName, moduleId, message, details);
    }

    public Type getType() {
        return type;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public Optional<String> getModuleId() {
        return Optional.ofNullable(moduleId);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    /**
     * Brief output for module events, summary counts for terminal workflow events.
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "WorkflowEvent{" +
               "type=" + type +
               ", executionId='" + executionId + '\'' +
               (moduleId != null ? ", moduleId='" + moduleId + '\'' : "") +
               ", timestamp=" + timestamp +
               (message != null ? ", message='" + message + '\'' : "") +
               '}';
    }
}
