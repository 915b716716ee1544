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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowEventPublisher delivery and subscription lifecycle.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-05
 */
class WorkflowEventPublisherTest {

    private WorkflowEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new WorkflowEventPublisher();
    }

    private static WorkflowEvent moduleEvent(String executionId, WorkflowEvent.Type type) {
        return WorkflowEvent.module(type, executionId, "wf", "m1", null, null);
    }

    private static WorkflowEvent terminal(String executionId) {
        return WorkflowEvent.workflow(WorkflowEvent.Type.WORKFLOW_COMPLETED, executionId, "wf", "done");
    }

    @Test
    void testDeliversOnlyMatchingExecution() {
        List<WorkflowEvent> received = new ArrayList<>();
        publisher.subscribe("e1", received::add);

        publisher.publish(moduleEvent("e1", WorkflowEvent.Type.MODULE_STARTED));
        publisher.publish(moduleEvent("e2", WorkflowEvent.Type.MODULE_STARTED));

        assertEquals(1, received.size());
        assertEquals("e1", received.get(0).getExecutionId());
    }

    @Test
    void testTerminalEventEndsSubscription() {
        List<WorkflowEvent> received = new ArrayList<>();
        Subscription subscription = publisher.subscribe("e1", received::add);

        publisher.publish(terminal("e1"));
        publisher.publish(moduleEvent("e1", WorkflowEvent.Type.MODULE_STARTED));

        assertEquals(1, received.size());
        assertFalse(subscription.isActive());
        assertEquals(0, publisher.getSubscriberCount("e1"));
        assertFalse(subscription.cancel());
    }

    @Test
    void testCancelStopsDelivery() {
        List<WorkflowEvent> received = new ArrayList<>();
        Subscription subscription = publisher.subscribe("e1", received::add);

        assertTrue(subscription.cancel());
        publisher.publish(moduleEvent("e1", WorkflowEvent.Type.MODULE_COMPLETED));

        assertTrue(received.isEmpty());
        assertEquals(0, publisher.getSubscriberCount("e1"));
        assertEquals("e1", subscription.getExecutionId());
    }

    @Test
    void testFailingSubscriberIsDropped() {
        List<WorkflowEvent> received = new ArrayList<>();
        Subscription failing = publisher.subscribe("e1", event -> {
            throw new IllegalStateException("subscriber bug");
        });
        publisher.subscribe("e1", received::add);

        publisher.publish(moduleEvent("e1", WorkflowEvent.Type.MODULE_STARTED));
        publisher.publish(moduleEvent("e1", WorkflowEvent.Type.MODULE_COMPLETED));

        assertFalse(failing.isActive());
        assertEquals(2, received.size());
        assertEquals(1, publisher.getSubscriberCount("e1"));
    }

    @Test
    void testEventTypeClassification() {
        assertTrue(WorkflowEvent.Type.WORKFLOW_FAILED.isTerminal());
        assertTrue(WorkflowEvent.Type.WORKFLOW_CANCELLED.isTerminal());
        assertFalse(WorkflowEvent.Type.WORKFLOW_STARTED.isTerminal());
        assertFalse(WorkflowEvent.Type.MODULE_FAILED.isTerminal());
        assertTrue(WorkflowEvent.Type.WORKFLOW_STARTED.isWorkflowEvent());
        assertFalse(WorkflowEvent.Type.MODULE_SKIPPED.isWorkflowEvent());
    }
}
