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

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time view of a workflow run. Snapshots of live runs report RUNNING and partial progress.
 */
public class WorkflowExecution {

    private final String executionId;
    private final String workflowName;
    private final WorkflowStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final List<ModuleExecution> moduleExecutions;
    private final Map<String, JsonNode> outputs;
    private final String errorMessage;

    public WorkflowExecution(String executionId, String workflowName, WorkflowStatus status,
                             Instant startTime, Instant endTime, List<ModuleExecution> moduleExecutions,
                             Map<String, JsonNode> outputs, String errorMessage) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.moduleExecutions = moduleExecutions != null ? List.copyOf(moduleExecutions) : List.of();
        // LinkedHashMap: unresolved outputs are reported as null values
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.errorMessage = errorMessage;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return endTime != null ? Optional.of(Duration.between(startTime, endTime)) : Optional.empty();
    }

    /**
     * @return per-module reports in execution order
     */
    public List<ModuleExecution> getModuleExecutions() {
        return moduleExecutions;
    }

    public Optional<ModuleExecution> getModuleExecution(String moduleId) {
        return moduleExecutions.stream()
                .filter(m -> m.getModuleId().equals(moduleId))
                .findFirst();
    }

    /**
     * Final outputs: the resolved output mapping, or every completed module's output when the
     * workflow declares no mapping. Empty until the run finishes.
     */
    public Map<String, JsonNode> getOutputs() {
        return outputs;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.COMPLETED;
    }

    public boolean isRunning() {
        return status == WorkflowStatus.RUNNING;
    }

    public boolean isCompleted() {
        return status.isTerminal();
    }

    public Summary getSummary() {
        return new Summary(
                moduleExecutions.size(),
                countByStatus(ModuleStatus.COMPLETED),
                countByStatus(ModuleStatus.FAILED),
                countByStatus(ModuleStatus.SKIPPED),
                countByStatus(ModuleStatus.CANCELLED));
    }

    private int countByStatus(ModuleStatus moduleStatus) {
        return (int) moduleExecutions.stream().filter(m -> m.getStatus() == moduleStatus).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return Objects.equals(executionId, that.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
               "executionId='" + executionId + '\'' +
               ", workflowName='" + workflowName + '\'' +
               ", status=" + status +
               ", startTime=" + startTime +
               ", endTime=" + endTime +
               ", moduleCount=" + moduleExecutions.size() +
               '}';
    }

    /**
     * Module counts by outcome.
     */
    public static class Summary {
        private final int total;
        private final int completed;
        private final int failed;
        private final int skipped;
        private final int cancelled;

        public Summary(int total, int completed, int failed, int skipped, int cancelled) {
            this.total = total;
            this.completed = completed;
            this.failed = failed;
            this.skipped = skipped;
            this.cancelled = cancelled;
        }

        public int getTotal() {
            return total;
        }

        public int getCompleted() {
            return completed;
        }

        public int getFailed() {
            return failed;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getCancelled() {
            return cancelled;
        }

        @Override
        public String toString() {
            return "Summary{" +
                   "total=" + total +
                   ", completed=" + completed +
                   ", failed=" + failed +
                   ", skipped=" + skipped +
                   ", cancelled=" + cancelled +
                   '}';
        }
    }
}
