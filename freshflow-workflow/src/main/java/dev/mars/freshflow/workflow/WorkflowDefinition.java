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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A validated, ordered workflow ready for execution.
 * Instances are produced by {@link WorkflowBuilder} and never change afterwards.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class WorkflowDefinition {

    private final String name;
    private final Map<String, ModuleDefinition> modules;
    private final List<String> executionOrder;
    private final DependencyGraph graph;
    private final Map<String, JsonNode> outputs;
    private final JsonNode outputControl;

    public WorkflowDefinition(String name, List<ModuleDefinition> modules, List<String> executionOrder,
                              DependencyGraph graph, Map<String, JsonNode> outputs, JsonNode outputControl) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        Objects.requireNonNull(modules, "Modules cannot be null");
        Map<String, ModuleDefinition> byId = new LinkedHashMap<>();
        for (ModuleDefinition module : modules) {
            byId.put(module.getId(), module);
        }
        this.modules = Collections.unmodifiableMap(byId);
        this.executionOrder = List.copyOf(Objects.requireNonNull(executionOrder, "Execution order cannot be null"));
        this.graph = Objects.requireNonNull(graph, "Dependency graph cannot be null");
        this.outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        this.outputControl = outputControl;
    }

    public String getName() {
        return name;
    }

    /**
     * @return modules in submission order
     */
    public List<ModuleDefinition> getModules() {
        return List.copyOf(modules.values());
    }

    public Optional<ModuleDefinition> getModule(String moduleId) {
        return Optional.ofNullable(modules.get(moduleId));
    }

    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    /**
     * @return module id to the ids of the modules it references
     */
    public Map<String, Set<String>> getDependencyEdges() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (String moduleId : graph.getModuleIds()) {
            edges.put(moduleId, Set.copyOf(graph.getDependencies(moduleId)));
        }
        return Collections.unmodifiableMap(edges);
    }

    /**
     * @return output name to reference expression; empty when the workflow returns all module outputs
     */
    public Map<String, JsonNode> getOutputs() {
        return outputs;
    }

    public Optional<JsonNode> getOutputControl() {
        return Optional.ofNullable(outputControl);
    }

    public int getModuleCount() {
        return modules.size();
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", executionOrder=" + executionOrder +
               ", outputs=" + outputs.keySet() +
               '}';
    }
}
