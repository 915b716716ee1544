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

import dev.mars.freshflow.config.FreshflowConfiguration;
import dev.mars.freshflow.core.exceptions.InvalidReferenceSyntaxException;
import dev.mars.freshflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.freshflow.handler.TaskHandlerRegistry;
import dev.mars.freshflow.reference.ReferenceResolver;
import dev.mars.freshflow.workflow.event.Subscription;
import dev.mars.freshflow.workflow.event.WorkflowEvent;
import dev.mars.freshflow.workflow.event.WorkflowEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Entry point for submitting and observing workflows.
 * <p>
 * Submission parses and builds synchronously, so configuration errors reach the caller before
 * anything runs. Execution then proceeds in the background and is observed through
 * {@link #getStatus(String)} or {@link #subscribe(String, Consumer)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public class WorkflowService {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowService.class);

    private final FreshflowConfiguration configuration;
    private final WorkflowConfigParser jsonParser;
    private final WorkflowConfigParser yamlParser;
    private final WorkflowBuilder builder;
    private final WorkflowEngine engine;
    private final WorkflowEventPublisher publisher;

    public WorkflowService(TaskHandlerRegistry handlerRegistry) {
        this(handlerRegistry, new FreshflowConfiguration());
    }

    public WorkflowService(TaskHandlerRegistry handlerRegistry, FreshflowConfiguration configuration) {
        this(handlerRegistry, configuration, new ReferenceResolver());
    }

    private WorkflowService(TaskHandlerRegistry handlerRegistry, FreshflowConfiguration configuration,
                            ReferenceResolver resolver) {
        this(configuration, new WorkflowBuilder(handlerRegistry, resolver),
                new SimpleWorkflowEngine(handlerRegistry, resolver, configuration.getRetainCompletedRuns()));
    }

    public WorkflowService(FreshflowConfiguration configuration, WorkflowBuilder builder, WorkflowEngine engine) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.builder = Objects.requireNonNull(builder, "Workflow builder cannot be null");
        this.engine = Objects.requireNonNull(engine, "Workflow engine cannot be null");
        this.jsonParser = new JsonWorkflowConfigParser();
        this.yamlParser = new YamlWorkflowConfigParser();
        this.publisher = new WorkflowEventPublisher();
        engine.addListener(publisher);
    }

    /**
     * Parses, validates and starts a workflow given as a JSON document.
     *
     * @return the execution id
     */
    public String submit(String json) throws WorkflowConfigurationException, InvalidReferenceSyntaxException {
        return submit(jsonParser.parseFromString(json));
    }

    /**
     * Parses, validates and starts a workflow given as a YAML document.
     *
     * @return the execution id
     */
    public String submitYaml(String yaml) throws WorkflowConfigurationException, InvalidReferenceSyntaxException {
        return submit(yamlParser.parseFromString(yaml));
    }

    /**
     * Validates and starts a workflow. The run continues after this method returns.
     *
     * @return the execution id
     */
    public String submit(WorkflowConfig config) throws WorkflowConfigurationException, InvalidReferenceSyntaxException {
        ExecutionContext context = ExecutionContext.fromConfiguration(configuration).build();
        start(config, context);
        return context.getExecutionId();
    }

    /**
     * Validates and starts a workflow with explicit execution settings.
     *
     * @return future completed with the final execution report
     */
    public CompletableFuture<WorkflowExecution> execute(WorkflowConfig config, ExecutionContext context)
            throws WorkflowConfigurationException, InvalidReferenceSyntaxException {
        return start(config, context);
    }

    public CompletableFuture<WorkflowExecution> execute(WorkflowConfig config)
            throws WorkflowConfigurationException, InvalidReferenceSyntaxException {
        return start(config, ExecutionContext.fromConfiguration(configuration).build());
    }

    private CompletableFuture<WorkflowExecution> start(WorkflowConfig config, ExecutionContext context)
            throws WorkflowConfigurationException, InvalidReferenceSyntaxException {
        WorkflowDefinition definition = builder.build(config);
        logger.info("Submitting workflow '{}' as execution {}", definition.getName(), context.getExecutionId());
        return engine.execute(definition, context);
    }

    public Optional<WorkflowExecution> getStatus(String executionId) {
        return engine.getStatus(executionId);
    }

    /**
     * Subscribes to the events of one execution. A subscriber attaching after the run has finished
     * receives a single terminal event built from the final report. For an unknown or no longer
     * retained execution the returned subscription is already inactive and receives nothing.
     */
    public Subscription subscribe(String executionId, Consumer<WorkflowEvent> consumer) {
        Subscription subscription = publisher.subscribe(executionId, consumer);

        Optional<WorkflowExecution> status = engine.getStatus(executionId);
        if (status.isEmpty()) {
            subscription.cancel();
            logger.debug("No execution {} to subscribe to", executionId);
            return subscription;
        }
        if (status.get().isCompleted() && subscription.cancel()) {
            // the live terminal event was not delivered to this subscriber, so replay it
            WorkflowExecution execution = status.get();
            WorkflowEvent.Type type = SimpleWorkflowEngine.terminalEventType(execution.getStatus());
            consumer.accept(WorkflowEvent.workflow(type, executionId,
                    execution.getWorkflowName(), execution.getErrorMessage().orElse(null),
                    SimpleWorkflowEngine.summaryDetails(execution)));
        }
        return subscription;
    }

    public boolean cancel(String executionId) {
        return engine.cancel(executionId);
    }

    WorkflowEventPublisher getPublisher() {
        return publisher;
    }

    public WorkflowEngine getEngine() {
        return engine;
    }

    public void shutdown() {
        engine.removeListener(publisher);
        engine.shutdown();
    }
}
