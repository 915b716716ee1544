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

package dev.mars.freshflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Freshflow workflow engine.
 *
 * Provides 8 workflow-specific metrics:
 * - freshflow.workflow.active (gauge) - Currently active workflow executions
 * - freshflow.workflow.total (counter) - Total workflows started
 * - freshflow.workflow.completed (counter) - Successfully completed workflows
 * - freshflow.workflow.failed (counter) - Failed workflows
 * - freshflow.workflow.cancelled (counter) - Cancelled workflows
 * - freshflow.module.total (counter) - Total module handler invocations
 * - freshflow.module.failed (counter) - Failed modules
 * - freshflow.workflow.duration.seconds (histogram) - Workflow duration distribution
 *
 * Without an installed OpenTelemetry SDK the global meter is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "freshflow-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter modulesTotal;
    private final LongCounter modulesFailed;

    // Histograms
    private final DoubleHistogram workflowDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> EXECUTION_STRATEGY_KEY = AttributeKey.stringKey("execution.strategy");
    private static final AttributeKey<String> MODULE_IDENTIFIER_KEY = AttributeKey.stringKey("module.identifier");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("freshflow.workflow.total")
                .setDescription("Total number of workflows started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("freshflow.workflow.completed")
                .setDescription("Number of successfully completed workflows")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("freshflow.workflow.failed")
                .setDescription("Number of failed workflows")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("freshflow.workflow.cancelled")
                .setDescription("Number of cancelled workflows")
                .setUnit("1")
                .build();

        modulesTotal = meter.counterBuilder("freshflow.module.total")
                .setDescription("Total number of module handler invocations")
                .setUnit("1")
                .build();

        modulesFailed = meter.counterBuilder("freshflow.module.failed")
                .setDescription("Number of failed modules")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("freshflow.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("freshflow.workflow.active")
                .setDescription("Number of currently active workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowName, String strategy) {
        workflowsTotal.add(1, workflowAttributes(workflowName, strategy));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowName, String strategy, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowName, strategy);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String workflowName, String strategy, double durationSeconds,
                                     String failureReason) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(EXECUTION_STRATEGY_KEY, strategy)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, workflowAttributes(workflowName, strategy));
    }

    public void recordWorkflowCancelled(String workflowName, String strategy) {
        activeWorkflows.decrementAndGet();
        workflowsCancelled.add(1, workflowAttributes(workflowName, strategy));
    }

    /**
     * Record one handler invocation, retries included.
     */
    public void recordModuleExecuted(String workflowName, String identifier) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(MODULE_IDENTIFIER_KEY, identifier)
                .build();
        modulesTotal.add(1, attrs);
    }

    public void recordModuleFailed(String workflowName, String identifier, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(MODULE_IDENTIFIER_KEY, identifier)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        modulesFailed.add(1, attrs);
    }

    /**
     * Get the current number of active workflows.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowName, String strategy) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(EXECUTION_STRATEGY_KEY, strategy)
                .build();
    }
}
