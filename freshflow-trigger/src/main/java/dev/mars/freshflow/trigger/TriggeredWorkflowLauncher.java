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

package dev.mars.freshflow.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.freshflow.core.exceptions.FreshflowException;
import dev.mars.freshflow.workflow.WorkflowConfig;
import dev.mars.freshflow.workflow.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trigger callback that submits a workflow every time its trigger fires.
 * <p>
 * Optionally the event is handed to one module as {@code user_config.trigger_event}, so the
 * workflow can act on the message or payload that caused the run. Submission failures are logged
 * and do not stop the trigger.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
public class TriggeredWorkflowLauncher implements TriggerCallback {

    private static final Logger logger = LoggerFactory.getLogger(TriggeredWorkflowLauncher.class);

    public static final String EVENT_FIELD = "trigger_event";

    private final WorkflowService service;
    private final WorkflowConfig config;
    private final ObjectMapper objectMapper;
    private final List<String> launchedExecutions = Collections.synchronizedList(new ArrayList<>());
    private String eventInputModule;

    public TriggeredWorkflowLauncher(WorkflowService service, WorkflowConfig config) {
        this.service = Objects.requireNonNull(service, "Workflow service cannot be null");
        this.config = Objects.requireNonNull(config, "Workflow config cannot be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Passes each trigger event to the given module under {@code user_config.trigger_event}.
     *
     * @throws IllegalArgumentException if the workflow has no such module
     */
    public TriggeredWorkflowLauncher withEventInput(String moduleId) {
        if (!config.getModules().containsKey(moduleId)) {
            throw new IllegalArgumentException("Workflow '" + config.getName() + "' has no module '" + moduleId + "'");
        }
        this.eventInputModule = moduleId;
        return this;
    }

    @Override
    public void onEvent(TriggerEvent event) {
        try {
            String executionId = service.submit(configFor(event));
            launchedExecutions.add(executionId);
            logger.info("Trigger event {} launched workflow '{}' as execution {}",
                    event.getType(), config.getName(), executionId);
        } catch (FreshflowException e) {
            logger.warn("Trigger event {} could not launch workflow '{}': {}",
                    event.getType(), config.getName(), e.getMessage());
        }
    }

    WorkflowConfig configFor(TriggerEvent event) {
        if (eventInputModule == null) {
            return config;
        }

        WorkflowConfig.Builder builder = WorkflowConfig.builder().name(config.getName());
        for (Map.Entry<String, ObjectNode> entry : config.getModules().entrySet()) {
            ObjectNode module = entry.getValue().deepCopy();
            if (entry.getKey().equals(eventInputModule)) {
                JsonNode userConfig = module.get("user_config");
                ObjectNode target = userConfig instanceof ObjectNode
                        ? (ObjectNode) userConfig
                        : module.putObject("user_config");
                target.set(EVENT_FIELD, toNode(event));
            }
            builder.module(entry.getKey(), module);
        }
        config.getOutputs().forEach(builder::output);
        config.getOutputControl().ifPresent(builder::outputControl);
        return builder.build();
    }

    private JsonNode toNode(TriggerEvent event) {
        try {
            return objectMapper.readTree(event.toJson().encode());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Trigger event is not valid JSON", e);
        }
    }

    /**
     * @return execution ids started by this launcher, oldest first
     */
    public List<String> getLaunchedExecutions() {
        synchronized (launchedExecutions) {
            return List.copyOf(launchedExecutions);
        }
    }
}
