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

import dev.mars.freshflow.workflow.event.WorkflowEventListener;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for executing validated workflows.
 */
public interface WorkflowEngine {

    /**
     * Starts executing a workflow definition.
     * <p>
     * The run is registered before this method returns, so {@link #getStatus(String)} and
     * {@link #cancel(String)} work immediately with the context's execution id.
     *
     * @param definition the workflow definition to execute
     * @param context the execution context
     * @return future completed with the final execution report; never completed exceptionally
     *         for module failures
     */
    CompletableFuture<WorkflowExecution> execute(WorkflowDefinition definition, ExecutionContext context);

    /**
     * Gets a snapshot of a running or recently finished workflow execution.
     *
     * @param executionId the execution ID
     * @return the snapshot, or empty if the execution is unknown or no longer retained
     */
    Optional<WorkflowExecution> getStatus(String executionId);

    /**
     * Cancels a running workflow execution. Modules already running finish;
     * modules not yet dispatched are marked cancelled.
     *
     * @param executionId the execution ID
     * @return true if a running execution was found and flagged
     */
    boolean cancel(String executionId);

    void addListener(WorkflowEventListener listener);

    void removeListener(WorkflowEventListener listener);

    /**
     * Shuts down the workflow engine and cleans up resources.
     */
    void shutdown();
}
