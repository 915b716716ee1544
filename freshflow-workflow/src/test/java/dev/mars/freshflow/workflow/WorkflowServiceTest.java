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
import dev.mars.freshflow.core.exceptions.CircularDependencyException;
import dev.mars.freshflow.core.exceptions.UnknownModuleReferenceException;
import dev.mars.freshflow.handler.TaskHandlerRegistry;
import dev.mars.freshflow.handler.UserInputTaskHandler;
import dev.mars.freshflow.workflow.event.Subscription;
import dev.mars.freshflow.workflow.event.WorkflowEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowService submission, status and subscriptions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-05
 */
class WorkflowServiceTest {

    private static final String QUERY_WORKFLOW = """
            {"canvas_name": "search",
             "modules": {
               "query": {"identifier": "user_input", "user_config": {"query": "refund policy"}},
               "echo": {"identifier": "echo", "user_config": {"question": "${query.output.input}"}}
             },
             "outputs": {"question": {"module_id": "echo", "output_key": "question"}}}
            """;

    private TaskHandlerRegistry registry;
    private WorkflowService service;

    @BeforeEach
    void setUp() {
        registry = new TaskHandlerRegistry();
        registry.registerHandler(TestTaskHandler.echo("echo"));
        service = new WorkflowService(registry, new FreshflowConfiguration(new Properties()));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private WorkflowExecution awaitFinished(String executionId) {
        await().atMost(Duration.ofSeconds(5))
                .until(() -> service.getStatus(executionId).map(WorkflowExecution::isCompleted).orElse(false));
        return service.getStatus(executionId).orElseThrow();
    }

    @Test
    void testSubmitJsonRunsToCompletion() throws Exception {
        String executionId = service.submit(QUERY_WORKFLOW);

        assertNotNull(executionId);
        WorkflowExecution execution = awaitFinished(executionId);
        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertEquals("search", execution.getWorkflowName());
        assertEquals("refund policy",
                execution.getOutputs().get("question").get("query").textValue());
        assertEquals(UserInputTaskHandler.IDENTIFIER,
                execution.getOutputs().get("question").get("metadata").get("source").textValue());
    }

    @Test
    void testSubmitYaml() throws Exception {
        String executionId = service.submitYaml("""
                canvas_name: yaml-search
                modules:
                  query:
                    identifier: user_input
                    user_config:
                      query: hello
                """);

        WorkflowExecution execution = awaitFinished(executionId);
        assertEquals(WorkflowStatus.COMPLETED, execution.getStatus());
        assertTrue(execution.getOutputs().containsKey("query"));
    }

    @Test
    void testConfigurationErrorsAreSynchronous() {
        assertThrows(UnknownModuleReferenceException.class, () -> service.submit("""
                {"modules": {"a": {"identifier": "echo", "user_config": {"x": "${missing.output.y}"}}}}
                """));
        CircularDependencyException e = assertThrows(CircularDependencyException.class, () -> service.submit("""
                {"modules": {
                  "a": {"identifier": "echo", "user_config": {"x": "${b.output.y}"}},
                  "b": {"identifier": "echo", "user_config": {"x": "${a.output.y}"}}
                }}
                """));
        assertEquals(List.of("a", "b", "a"), e.getCyclePath());
        assertThrows(WorkflowParseException.class, () -> service.submit("not json"));
    }

    @Test
    void testExecuteReturnsFinalReport() throws Exception {
        WorkflowConfig config = new JsonWorkflowConfigParser().parseFromString(QUERY_WORKFLOW);

        WorkflowExecution execution = service.execute(config,
                ExecutionContext.builder().executionId("explicit").build()).get(5, TimeUnit.SECONDS);

        assertEquals("explicit", execution.getExecutionId());
        assertTrue(execution.isSuccessful());
    }

    @Test
    void testSubscribeReceivesTerminalEvent() throws Exception {
        WorkflowConfig config = new JsonWorkflowConfigParser().parseFromString(QUERY_WORKFLOW);
        ExecutionContext context = ExecutionContext.builder().executionId("observed").build();
        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
        Subscription subscription = service.subscribe("observed", events::add);

        service.execute(config, context).get(5, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(5)).until(() -> !subscription.isActive());
        assertEquals(WorkflowEvent.Type.WORKFLOW_STARTED, events.get(0).getType());
        assertEquals(WorkflowEvent.Type.WORKFLOW_COMPLETED, events.get(events.size() - 1).getType());
        assertEquals(1, events.stream().filter(event -> event.getType().isTerminal()).count());
    }

    @Test
    void testLateSubscriberGetsSingleTerminalEvent() throws Exception {
        String executionId = service.submit(QUERY_WORKFLOW);
        awaitFinished(executionId);

        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
        Subscription subscription = service.subscribe(executionId, events::add);

        assertEquals(1, events.size());
        assertEquals(WorkflowEvent.Type.WORKFLOW_COMPLETED, events.get(0).getType());
        assertEquals(2, events.get(0).getDetails().get("completed"));
        assertFalse(subscription.isActive());
    }

    @Test
    void testFailurePolicyFromConfiguration() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(FreshflowConfiguration.ENGINE_FAILURE_POLICY, "abort-run");
        WorkflowService configured = new WorkflowService(registry, new FreshflowConfiguration(properties));
        try {
            String executionId = configured.submit("""
                    {"modules": {
                      "empty": {"identifier": "user_input", "user_config": {"query": ""}},
                      "independent": {"identifier": "echo"}
                    }}
                    """);

            await().atMost(Duration.ofSeconds(5)).until(() -> configured.getStatus(executionId)
                    .map(WorkflowExecution::isCompleted).orElse(false));
            WorkflowExecution execution = configured.getStatus(executionId).orElseThrow();
            assertEquals(WorkflowStatus.FAILED, execution.getStatus());
            assertEquals(ModuleStatus.SKIPPED,
                    execution.getModuleExecution("independent").orElseThrow().getStatus());
        } finally {
            configured.shutdown();
        }
    }

    @Test
    void testCancelUnknownExecution() {
        assertFalse(service.cancel("nope"));
        assertTrue(service.getStatus("nope").isEmpty());
    }

    @Test
    void testSubscribeToUnknownExecution() {
        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();

        for (int i = 0; i < 100; i++) {
            Subscription subscription = service.subscribe("no-such-run-" + i, events::add);
            assertFalse(subscription.isActive());
            assertFalse(subscription.cancel());
        }

        assertTrue(events.isEmpty());
        assertEquals(0, service.getPublisher().getSubscriberCount("no-such-run-5"));
    }

    @Test
    void testSubscribeToEvictedExecution() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(FreshflowConfiguration.ENGINE_RETAIN_COMPLETED_RUNS, "1");
        WorkflowService retaining = new WorkflowService(registry, new FreshflowConfiguration(properties));
        try {
            String first = retaining.submit(QUERY_WORKFLOW);
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> retaining.getStatus(first).map(WorkflowExecution::isCompleted).orElse(false));
            String second = retaining.submit(QUERY_WORKFLOW);
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> retaining.getStatus(second).map(WorkflowExecution::isCompleted).orElse(false));
            assertTrue(retaining.getStatus(first).isEmpty());

            List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
            Subscription subscription = retaining.subscribe(first, events::add);

            assertFalse(subscription.isActive());
            assertTrue(events.isEmpty());
            assertEquals(0, retaining.getPublisher().getSubscriberCount(first));
        } finally {
            retaining.shutdown();
        }
    }
}
