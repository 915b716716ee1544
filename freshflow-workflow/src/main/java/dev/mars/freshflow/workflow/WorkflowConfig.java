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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A workflow as submitted by a client, before validation.
 * <p>
 * Modules are kept as raw JSON objects in submission order; the order is significant
 * because it breaks ties in the execution order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class WorkflowConfig {

    public static final String DEFAULT_NAME = "default_workflow";

    private final String name;
    private final Map<String, ObjectNode> modules;
    private final Map<String, JsonNode> outputs;
    private final JsonNode outputControl;

    private WorkflowConfig(Builder builder) {
        this.name = builder.name != null ? builder.name : DEFAULT_NAME;
        this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(builder.modules));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.outputControl = builder.outputControl;
    }

    public String getName() {
        return name;
    }

    /**
     * @return module id to raw module object ({@code identifier}, {@code user_config}), in submission order
     */
    public Map<String, ObjectNode> getModules() {
        return modules;
    }

    /**
     * @return output name to reference expression, empty when no mapping was given
     */
    public Map<String, JsonNode> getOutputs() {
        return outputs;
    }

    public Optional<JsonNode> getOutputControl() {
        return Optional.ofNullable(outputControl);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "WorkflowConfig{" +
                "name='" + name + '\'' +
                ", modules=" + modules.keySet() +
                ", outputs=" + outputs.keySet() +
                '}';
    }

    public static class Builder {
        private String name;
        private final Map<String, ObjectNode> modules = new LinkedHashMap<>();
        private final Map<String, JsonNode> outputs = new LinkedHashMap<>();
        private JsonNode outputControl;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder module(String id, ObjectNode module) {
            Objects.requireNonNull(id, "Module id cannot be null");
            Objects.requireNonNull(module, "Module cannot be null");
            modules.put(id, module.deepCopy());
            return this;
        }

        public Builder output(String name, JsonNode reference) {
            Objects.requireNonNull(name, "Output name cannot be null");
            Objects.requireNonNull(reference, "Output reference cannot be null");
            outputs.put(name, reference.deepCopy());
            return this;
        }

        public Builder outputControl(JsonNode outputControl) {
            this.outputControl = outputControl != null ? outputControl.deepCopy() : null;
            return this;
        }

        public WorkflowConfig build() {
            return new WorkflowConfig(this);
        }
    }
}
