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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Maps a parsed document tree onto {@link WorkflowConfig}. Subclasses only turn text into a tree.
 * <p>
 * Recognised top-level keys: {@code canvas_name} (or {@code workflow_name}), {@code modules},
 * {@code outputs} and {@code output_control}. Unknown keys are ignored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public abstract class AbstractWorkflowConfigParser implements WorkflowConfigParser {

    static final String CANVAS_NAME = "canvas_name";
    static final String WORKFLOW_NAME = "workflow_name";
    static final String MODULES = "modules";
    static final String OUTPUTS = "outputs";
    static final String OUTPUT_CONTROL = "output_control";

    @Override
    public WorkflowConfig parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        }
    }

    @Override
    public WorkflowConfig parseFromString(String content) throws WorkflowParseException {
        if (content == null || content.isBlank()) {
            throw new WorkflowParseException("Empty workflow document");
        }
        return fromTree(readTree(content));
    }

    /**
     * Turns document text into a JSON tree.
     */
    protected abstract JsonNode readTree(String content) throws WorkflowParseException;

    protected WorkflowConfig fromTree(JsonNode root) throws WorkflowParseException {
        if (root == null || !root.isObject()) {
            throw new WorkflowParseException("Workflow document must be an object");
        }

        String name = getStringValue(root, CANVAS_NAME);
        if (name == null) {
            name = getStringValue(root, WORKFLOW_NAME);
        }

        WorkflowConfig.Builder builder = WorkflowConfig.builder().name(name);

        for (Map.Entry<String, JsonNode> entry : getObjectEntries(root, MODULES, name)) {
            if (!entry.getValue().isObject()) {
                throw new WorkflowParseException(name, MODULES + "." + entry.getKey(), "Module must be an object");
            }
            builder.module(entry.getKey(), (ObjectNode) entry.getValue());
        }

        for (Map.Entry<String, JsonNode> entry : getObjectEntries(root, OUTPUTS, name)) {
            builder.output(entry.getKey(), entry.getValue());
        }

        JsonNode outputControl = root.get(OUTPUT_CONTROL);
        if (outputControl != null && !outputControl.isNull()) {
            builder.outputControl(outputControl);
        }

        return builder.build();
    }

    private String getStringValue(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private Iterable<Map.Entry<String, JsonNode>> getObjectEntries(JsonNode root, String key, String workflowName)
            throws WorkflowParseException {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isObject()) {
            throw new WorkflowParseException(workflowName, key, "Expected an object");
        }
        return value::fields;
    }
}
