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
import dev.mars.freshflow.core.ModuleDefinition;
import dev.mars.freshflow.state.InMemoryStateStore;
import dev.mars.freshflow.state.StateStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Mutable state of one execution, owned by {@link SimpleWorkflowEngine}.
 */
class WorkflowRun {

    private final WorkflowDefinition definition;
    private final ExecutionContext context;
    private final StateStore store;
    private final Map<String, ModuleState> modules;
    private final CountDownLatch cancelSignal = new CountDownLatch(1);

    private volatile WorkflowStatus status = WorkflowStatus.PENDING;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile Map<String, JsonNode> outputs = Map.of();
    private volatile String errorMessage;
    private volatile String firstFailedModule;

    WorkflowRun(WorkflowDefinition definition, ExecutionContext context) {
        this.definition = definition;
        this.context = context;
        this.store = new InMemoryStateStore();
        this.modules = new LinkedHashMap<>();
        for (String moduleId : definition.getExecutionOrder()) {
            ModuleDefinition module = definition.getModule(moduleId).orElseThrow();
            modules.put(moduleId, new ModuleState(moduleId, module.getIdentifier()));
        }
        this.startTime = Instant.now();
    }

    WorkflowDefinition getDefinition() {
        return definition;
    }

    ExecutionContext getContext() {
        return context;
    }

    String getExecutionId() {
        return context.getExecutionId();
    }

    StateStore getStore() {
        return store;
    }

    ModuleState module(String moduleId) {
        return modules.get(moduleId);
    }

    List<ModuleState> modules() {
        return new ArrayList<>(modules.values());
    }

    WorkflowStatus getStatus() {
        return status;
    }

    void markStarted() {
        startTime = Instant.now();
        status = WorkflowStatus.RUNNING;
    }

    void markFinished(WorkflowStatus finalStatus, Map<String, JsonNode> finalOutputs, String error) {
        outputs = finalOutputs;
        errorMessage = error;
        endTime = Instant.now();
        status = finalStatus;
    }

    Duration elapsed() {
        Instant end = endTime != null ? endTime : Instant.now();
        return Duration.between(startTime, end);
    }

    /**
     * @return false if the run had already been cancelled or has finished
     */
    boolean cancel() {
        if (status.isTerminal() || cancelSignal.getCount() == 0) {
            return false;
        }
        cancelSignal.countDown();
        return true;
    }

    boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    /**
     * Sleeps for the given delay unless the run is cancelled first.
     *
     * @return true if the run was cancelled while waiting
     */
    boolean awaitCancellation(Duration delay) throws InterruptedException {
        return cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void recordFailure(String moduleId) {
        if (firstFailedModule == null) {
            firstFailedModule = moduleId;
        }
    }

    String getFirstFailedModule() {
        return firstFailedModule;
    }

    WorkflowExecution snapshot() {
        List<ModuleExecution> moduleExecutions = new ArrayList<>();
        for (ModuleState state : modules.values()) {
            moduleExecutions.add(state.snapshot());
        }
        return new WorkflowExecution(context.getExecutionId(), definition.getName(), status, startTime,
                endTime, moduleExecutions, outputs, errorMessage);
    }

    /**
     * Progress of one module. All mutators are synchronized on the instance.
     */
    static final class ModuleState {
        private final String moduleId;
        private final String identifier;
        private ModuleStatus status = ModuleStatus.PENDING;
        private Instant startTime;
        private Instant endTime;
        private int attempts;
        private Map<String, Object> briefOutput = Map.of();
        private String errorMessage;

        ModuleState(String moduleId, String identifier) {
            this.moduleId = moduleId;
            this.identifier = identifier;
        }

        String getModuleId() {
            return moduleId;
        }

        String getIdentifier() {
            return identifier;
        }

        synchronized ModuleStatus getStatus() {
            return status;
        }

        synchronized void running() {
            status = ModuleStatus.RUNNING;
            startTime = Instant.now();
            briefOutput = Map.of("message", "Starting module " + moduleId);
        }

        synchronized void attempt() {
            attempts++;
        }

        synchronized int getAttempts() {
            return attempts;
        }

        synchronized void completed(Map<String, Object> brief) {
            finish(ModuleStatus.COMPLETED, brief, null);
        }

        synchronized void failed(String error) {
            finish(ModuleStatus.FAILED, Map.of("message", "Module execution failed", "error", error), error);
        }

        synchronized void skipped(String reason) {
            finish(ModuleStatus.SKIPPED, Map.of("message", reason), reason);
        }

        synchronized void cancelled() {
            finish(ModuleStatus.CANCELLED, Map.of("message", "Run cancelled before module " + moduleId + " started"), null);
        }

        private void finish(ModuleStatus finalStatus, Map<String, Object> brief, String error) {
            status = finalStatus;
            endTime = Instant.now();
            briefOutput = brief;
            errorMessage = error;
        }

        synchronized Map<String, Object> getBriefOutput() {
            return briefOutput;
        }

        synchronized ModuleExecution snapshot() {
            return new ModuleExecution(moduleId, identifier, status, startTime, endTime, attempts,
                    briefOutput, errorMessage);
        }
    }
}
