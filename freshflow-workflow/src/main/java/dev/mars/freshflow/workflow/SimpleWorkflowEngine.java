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
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.freshflow.core.ModuleDefinition;
import dev.mars.freshflow.core.ModuleError;
import dev.mars.freshflow.core.TaskInput;
import dev.mars.freshflow.core.TaskResult;
import dev.mars.freshflow.core.exceptions.CircularDependencyException;
import dev.mars.freshflow.core.exceptions.ReferenceException;
import dev.mars.freshflow.core.exceptions.TaskExecutionException;
import dev.mars.freshflow.core.exceptions.UnknownHandlerTypeException;
import dev.mars.freshflow.handler.TaskHandler;
import dev.mars.freshflow.handler.TaskHandlerRegistry;
import dev.mars.freshflow.reference.ReferenceResolver;
import dev.mars.freshflow.workflow.event.WorkflowEvent;
import dev.mars.freshflow.workflow.event.WorkflowEventListener;
import dev.mars.freshflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Default {@link WorkflowEngine}.
 * <p>
 * Each run gets its own {@link dev.mars.freshflow.state.StateStore}. Modules are dispatched in
 * execution order, or batch by batch for the parallel strategy, and a module never starts before
 * every module it references has finished. What happens to dependents of a failed module is
 * decided by the run's {@link FailurePolicy}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleWorkflowEngine.class);

    static final int DEFAULT_RETAINED_RUNS = 100;

    private final TaskHandlerRegistry handlerRegistry;
    private final ReferenceResolver referenceResolver;
    private final ExecutorService executorService;
    private final Map<String, WorkflowRun> activeExecutions;
    private final Map<String, WorkflowRun> completedExecutions;
    private final List<WorkflowEventListener> listeners = new CopyOnWriteArrayList<>();
    private final WorkflowMetrics metrics;
    private volatile boolean shutdown = false;

    public SimpleWorkflowEngine(TaskHandlerRegistry handlerRegistry) {
        this(handlerRegistry, new ReferenceResolver(), DEFAULT_RETAINED_RUNS);
    }

    public SimpleWorkflowEngine(TaskHandlerRegistry handlerRegistry, ReferenceResolver referenceResolver,
                                int retainCompletedRuns) {
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "Handler registry cannot be null");
        this.referenceResolver = Objects.requireNonNull(referenceResolver, "Reference resolver cannot be null");
        this.executorService = Executors.newCachedThreadPool();
        this.activeExecutions = new ConcurrentHashMap<>();
        int retained = Math.max(0, retainCompletedRuns);
        this.completedExecutions = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, WorkflowRun> eldest) {
                return size() > retained;
            }
        });
        this.metrics = WorkflowMetrics.getInstance();
    }

    @Override
    public CompletableFuture<WorkflowExecution> execute(WorkflowDefinition definition, ExecutionContext context) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }

        WorkflowRun run = new WorkflowRun(definition, context);
        String executionId = context.getExecutionId();
        if (activeExecutions.putIfAbsent(executionId, run) != null
                || completedExecutions.containsKey(executionId)) {
            activeExecutions.remove(executionId, run);
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Execution id already in use: " + executionId));
        }

        return CompletableFuture.supplyAsync(() -> executeRun(run), executorService);
    }

    @Override
    public Optional<WorkflowExecution> getStatus(String executionId) {
        WorkflowRun run = activeExecutions.get(executionId);
        if (run == null) {
            run = completedExecutions.get(executionId);
        }
        return run != null ? Optional.of(run.snapshot()) : Optional.empty();
    }

    @Override
    public boolean cancel(String executionId) {
        WorkflowRun run = activeExecutions.get(executionId);
        if (run != null && run.cancel()) {
            logger.info("Cancelling workflow execution: {}", executionId);
            return true;
        }
        return false;
    }

    @Override
    public void addListener(WorkflowEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeListener(WorkflowEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        for (WorkflowRun run : activeExecutions.values()) {
            run.cancel();
        }
        executorService.shutdown();
        logger.info("SimpleWorkflowEngine shutdown initiated");
    }

    private WorkflowExecution executeRun(WorkflowRun run) {
        WorkflowDefinition definition = run.getDefinition();
        ExecutionContext context = run.getContext();
        String executionId = run.getExecutionId();
        String strategy = context.getStrategy().name();

        run.markStarted();
        metrics.recordWorkflowStarted(definition.getName(), strategy);
        logger.info("Starting workflow execution: {} ({}, strategy {}, failure policy {})",
                executionId, definition.getName(), strategy, context.getFailurePolicy());
        emit(WorkflowEvent.workflow(WorkflowEvent.Type.WORKFLOW_STARTED, executionId, definition.getName(),
                "Workflow " + definition.getName() + " started"));

        String unexpectedError = null;
        try {
            if (context.getStrategy() == ExecutionStrategy.PARALLEL) {
                executeParallel(run);
            } else {
                for (String moduleId : definition.getExecutionOrder()) {
                    processModule(run, moduleId);
                }
            }
        } catch (RuntimeException | CircularDependencyException e) {
            logger.error("Workflow execution failed: {} - {}", executionId, e.getMessage(), e);
            unexpectedError = "Workflow execution failed: " + e.getMessage();
            for (WorkflowRun.ModuleState state : run.modules()) {
                if (!state.getStatus().isTerminal()) {
                    state.skipped("Workflow aborted before module " + state.getModuleId() + " ran");
                }
            }
        }

        return finish(run, unexpectedError);
    }

    private void executeParallel(WorkflowRun run) throws CircularDependencyException {
        ExecutionContext context = run.getContext();
        List<List<String>> batches = run.getDefinition().getGraph().getParallelExecutionBatches();
        ExecutorService batchExecutor = Executors.newFixedThreadPool(context.getParallelism());
        try {
            for (List<String> batch : batches) {
                logger.debug("Dispatching batch {} for execution {}", batch, run.getExecutionId());
                List<CompletableFuture<Void>> futures = new ArrayList<>();
                for (String moduleId : batch) {
                    futures.add(CompletableFuture.runAsync(() -> processModule(run, moduleId), batchExecutor));
                }
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            }
        } finally {
            batchExecutor.shutdown();
        }
    }

    private void processModule(WorkflowRun run, String moduleId) {
        WorkflowRun.ModuleState state = run.module(moduleId);
        ModuleDefinition module = run.getDefinition().getModule(moduleId).orElseThrow();

        if (run.isCancelled()) {
            state.cancelled();
            emitModule(run, WorkflowEvent.Type.MODULE_CANCELLED, state, "Module " + moduleId + " cancelled");
            return;
        }

        String skipReason = skipReason(run, moduleId);
        if (skipReason != null) {
            logger.info("Skipping module {} in execution {}: {}", moduleId, run.getExecutionId(), skipReason);
            state.skipped(skipReason);
            emitModule(run, WorkflowEvent.Type.MODULE_SKIPPED, state, skipReason);
            return;
        }

        state.running();
        emitModule(run, WorkflowEvent.Type.MODULE_STARTED, state, "Module " + moduleId + " started");

        TaskInput input;
        try {
            input = referenceResolver.resolveInput(module, run.getStore());
        } catch (ReferenceException e) {
            failModule(run, state, ModuleError.fromException(e));
            return;
        }

        TaskHandler handler = handlerRegistry.getHandler(module.getIdentifier());
        if (handler == null) {
            failModule(run, state, ModuleError.fromException(
                    new UnknownHandlerTypeException(moduleId, module.getIdentifier())));
            return;
        }

        runAttempts(run, state, handler, input);
    }

    private void runAttempts(WorkflowRun run, WorkflowRun.ModuleState state, TaskHandler handler, TaskInput input) {
        ExecutionContext context = run.getContext();
        String moduleId = state.getModuleId();
        int maxAttempts = context.getMaxRetries() + 1;
        ModuleError lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            state.attempt();
            metrics.recordModuleExecuted(run.getDefinition().getName(), state.getIdentifier());
            TaskResult result;
            try {
                result = handler.execute(input);
                if (result == null) {
                    throw new TaskExecutionException(moduleId, "Handler returned no result");
                }
            } catch (TaskExecutionException e) {
                result = null;
                lastError = ModuleError.fromException(e);
            } catch (RuntimeException e) {
                result = null;
                lastError = ModuleError.fromException(new TaskExecutionException(moduleId, e.getMessage(), e));
            }

            if (result != null && result.isSuccessful()) {
                ObjectNode output = result.getOutput();
                run.getStore().setOutput(moduleId, output);
                state.completed(ModuleExecution.briefOutputOf(moduleId, output));
                logger.info("Module {} completed in execution {} after {} attempt(s)",
                        moduleId, run.getExecutionId(), attempt);
                emitModule(run, WorkflowEvent.Type.MODULE_COMPLETED, state, "Module " + moduleId + " completed");
                return;
            }
            if (result != null) {
                lastError = ModuleError.fromResult(result);
            }
            run.getStore().setError(moduleId, lastError);

            if (attempt < maxAttempts) {
                logger.warn("Module {} attempt {}/{} failed: {}", moduleId, attempt, maxAttempts, lastError.getMessage());
                if (waitBeforeRetry(run)) {
                    break;
                }
            }
        }

        failModule(run, state, lastError);
    }

    /**
     * @return true if the run was cancelled or the thread interrupted while waiting
     */
    private boolean waitBeforeRetry(WorkflowRun run) {
        try {
            return run.awaitCancellation(run.getContext().getRetryDelay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void failModule(WorkflowRun run, WorkflowRun.ModuleState state, ModuleError error) {
        String moduleId = state.getModuleId();
        run.getStore().setError(moduleId, error);
        run.recordFailure(moduleId);
        state.failed(error.getMessage());
        metrics.recordModuleFailed(run.getDefinition().getName(), state.getIdentifier(), error.getErrorType());
        logger.warn("Module {} failed in execution {}: {}", moduleId, run.getExecutionId(), error.getMessage());

        Map<String, Object> details = new LinkedHashMap<>(state.getBriefOutput());
        details.put("error_type", error.getErrorType());
        details.put("category", error.getCategory().name());
        emit(WorkflowEvent.module(WorkflowEvent.Type.MODULE_FAILED, run.getExecutionId(),
                run.getDefinition().getName(), moduleId, error.getMessage(), details));
    }

    private String skipReason(WorkflowRun run, String moduleId) {
        switch (run.getContext().getFailurePolicy()) {
            case ABORT_RUN:
                String failed = run.getFirstFailedModule();
                return failed != null ? "Run aborted after module " + failed + " failed" : null;
            case SKIP_DEPENDENTS:
                for (String dependency : run.getDefinition().getGraph().getDependencies(moduleId)) {
                    ModuleStatus status = run.module(dependency).getStatus();
                    if (status != ModuleStatus.COMPLETED) {
                        return "Dependency " + dependency + " did not complete (" + status + ")";
                    }
                }
                return null;
            case ATTEMPT_ALL:
            default:
                return null;
        }
    }

    private WorkflowExecution finish(WorkflowRun run, String unexpectedError) {
        WorkflowDefinition definition = run.getDefinition();
        String executionId = run.getExecutionId();
        String strategy = run.getContext().getStrategy().name();

        Map<String, JsonNode> outputs = collectOutputs(run);
        List<WorkflowRun.ModuleState> modules = run.modules();

        WorkflowStatus finalStatus;
        String errorMessage = unexpectedError;
        if (run.isCancelled()) {
            finalStatus = WorkflowStatus.CANCELLED;
            errorMessage = errorMessage != null ? errorMessage : "Workflow execution cancelled";
        } else if (unexpectedError == null
                && modules.stream().allMatch(m -> m.getStatus() == ModuleStatus.COMPLETED)) {
            finalStatus = WorkflowStatus.COMPLETED;
        } else {
            finalStatus = WorkflowStatus.FAILED;
            if (errorMessage == null) {
                errorMessage = describeFailures(modules);
            }
        }

        run.markFinished(finalStatus, outputs, errorMessage);
        completedExecutions.put(executionId, run);
        activeExecutions.remove(executionId);

        WorkflowExecution execution = run.snapshot();
        double durationSeconds = run.elapsed().toMillis() / 1000.0;
        switch (finalStatus) {
            case COMPLETED:
                metrics.recordWorkflowCompleted(definition.getName(), strategy, durationSeconds);
                break;
            case CANCELLED:
                metrics.recordWorkflowCancelled(definition.getName(), strategy);
                break;
            default:
                metrics.recordWorkflowFailed(definition.getName(), strategy, durationSeconds, "module_failure");
                break;
        }
        logger.info("Workflow execution completed: {} with status: {} {}", executionId, finalStatus,
                execution.getSummary());

        emit(WorkflowEvent.workflow(terminalEventType(finalStatus), executionId, definition.getName(),
                errorMessage != null ? errorMessage : "Workflow " + definition.getName() + " completed",
                summaryDetails(execution)));
        return execution;
    }

    /**
     * Resolves the declared output mapping against the run's state. An entry whose reference
     * cannot be resolved is reported as null. Without a mapping every completed module's output
     * is returned, in execution order.
     */
    private Map<String, JsonNode> collectOutputs(WorkflowRun run) {
        Map<String, JsonNode> outputs = new LinkedHashMap<>();
        Map<String, JsonNode> mapping = run.getDefinition().getOutputs();
        if (mapping.isEmpty()) {
            for (String moduleId : run.getDefinition().getExecutionOrder()) {
                run.getStore().getOutput(moduleId).ifPresent(output -> outputs.put(moduleId, output));
            }
            return outputs;
        }

        for (Map.Entry<String, JsonNode> entry : mapping.entrySet()) {
            try {
                outputs.put(entry.getKey(), referenceResolver.resolve(entry.getValue(), run.getStore()));
            } catch (ReferenceException e) {
                logger.debug("Output {} of execution {} unresolved: {}",
                        entry.getKey(), run.getExecutionId(), e.getMessage());
                outputs.put(entry.getKey(), null);
            }
        }
        return outputs;
    }

    private static String describeFailures(List<WorkflowRun.ModuleState> modules) {
        List<String> failed = new ArrayList<>();
        List<String> notRun = new ArrayList<>();
        for (WorkflowRun.ModuleState state : modules) {
            if (state.getStatus() == ModuleStatus.FAILED) {
                failed.add(state.getModuleId());
            } else if (state.getStatus() != ModuleStatus.COMPLETED) {
                notRun.add(state.getModuleId());
            }
        }
        StringBuilder message = new StringBuilder("Modules failed: ").append(failed);
        if (!notRun.isEmpty()) {
            message.append(", skipped: ").append(notRun);
        }
        return message.toString();
    }

    static WorkflowEvent.Type terminalEventType(WorkflowStatus status) {
        switch (status) {
            case COMPLETED:
                return WorkflowEvent.Type.WORKFLOW_COMPLETED;
            case CANCELLED:
                return WorkflowEvent.Type.WORKFLOW_CANCELLED;
            default:
                return WorkflowEvent.Type.WORKFLOW_FAILED;
        }
    }

    static Map<String, Object> summaryDetails(WorkflowExecution execution) {
        WorkflowExecution.Summary summary = execution.getSummary();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", execution.getStatus().name());
        details.put("total", summary.getTotal());
        details.put("completed", summary.getCompleted());
        details.put("failed", summary.getFailed());
        details.put("skipped", summary.getSkipped());
        details.put("cancelled", summary.getCancelled());
        return details;
    }

    private void emitModule(WorkflowRun run, WorkflowEvent.Type type, WorkflowRun.ModuleState state, String message) {
        emit(WorkflowEvent.module(type, run.getExecutionId(), run.getDefinition().getName(),
                state.getModuleId(), message, state.getBriefOutput()));
    }

    private void emit(WorkflowEvent event) {
        for (WorkflowEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Workflow event listener failed on {}: {}", event.getType(), e.getMessage());
            }
        }
    }
}
