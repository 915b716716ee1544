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
import dev.mars.freshflow.core.exceptions.CircularDependencyException;
import dev.mars.freshflow.core.exceptions.InvalidReferenceSyntaxException;
import dev.mars.freshflow.core.exceptions.MissingRequiredFieldException;
import dev.mars.freshflow.core.exceptions.UnknownModuleReferenceException;
import dev.mars.freshflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.freshflow.handler.TaskHandler;
import dev.mars.freshflow.handler.TaskHandlerRegistry;
import dev.mars.freshflow.reference.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a {@link WorkflowConfig} and orders its modules.
 * <p>
 * Checks run in a fixed order and the first failure is thrown:
 * <ol>
 *   <li>at least one module, each with an {@code identifier}</li>
 *   <li>reference syntax in every {@code user_config}</li>
 *   <li>every referenced module exists</li>
 *   <li>every identifier has a registered handler</li>
 *   <li>every handler's required fields are present</li>
 *   <li>no reference cycles</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class WorkflowBuilder {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowBuilder.class);

    static final String IDENTIFIER = "identifier";
    static final String USER_CONFIG = "user_config";

    private final TaskHandlerRegistry handlerRegistry;
    private final ReferenceResolver referenceResolver;

    public WorkflowBuilder(TaskHandlerRegistry handlerRegistry, ReferenceResolver referenceResolver) {
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "Handler registry cannot be null");
        this.referenceResolver = Objects.requireNonNull(referenceResolver, "Reference resolver cannot be null");
    }

    /**
     * @throws WorkflowConfigurationException if the configuration is structurally invalid
     * @throws InvalidReferenceSyntaxException if a reference is malformed or embedded in a longer string
     */
    public WorkflowDefinition build(WorkflowConfig config)
            throws WorkflowConfigurationException, InvalidReferenceSyntaxException {
        Objects.requireNonNull(config, "Workflow config cannot be null");

        if (config.getModules().isEmpty()) {
            throw new MissingRequiredFieldException(null, AbstractWorkflowConfigParser.MODULES);
        }

        List<ModuleDefinition> modules = toModuleDefinitions(config);

        for (ModuleDefinition module : modules) {
            referenceResolver.validateSyntax(module.getId(), module.getUserConfig());
        }
        for (Map.Entry<String, JsonNode> output : config.getOutputs().entrySet()) {
            referenceResolver.validateSyntax(null, output.getValue());
        }

        DependencyGraph graph = new DependencyGraph();
        for (ModuleDefinition module : modules) {
            Set<String> dependsOn = referenceResolver.detectReferences(module.getUserConfig());
            graph.addModule(module.getId(), dependsOn);
            logger.debug("Module {} depends on {}", module.getId(), dependsOn);
        }

        Map<String, Set<String>> missing = graph.getMissingDependencies();
        if (!missing.isEmpty()) {
            Map.Entry<String, Set<String>> first = missing.entrySet().iterator().next();
            throw new UnknownModuleReferenceException(first.getKey(), first.getValue().iterator().next());
        }

        for (ModuleDefinition module : modules) {
            TaskHandler handler = handlerRegistry.requireHandler(module.getId(), module.getIdentifier());
            validateRequiredFields(module, handler);
        }

        Optional<List<String>> cycle = graph.findCycle();
        if (cycle.isPresent()) {
            throw new CircularDependencyException(cycle.get());
        }

        List<String> executionOrder = graph.topologicalSort();
        logger.info("Built workflow '{}' with {} modules, execution order: {}",
                config.getName(), modules.size(), executionOrder);

        return new WorkflowDefinition(config.getName(), modules, executionOrder, graph,
                config.getOutputs(), config.getOutputControl().orElse(null));
    }

    private List<ModuleDefinition> toModuleDefinitions(WorkflowConfig config) throws WorkflowConfigurationException {
        List<ModuleDefinition> modules = new ArrayList<>();
        for (Map.Entry<String, ObjectNode> entry : config.getModules().entrySet()) {
            String moduleId = entry.getKey();
            ObjectNode raw = entry.getValue();

            JsonNode identifier = raw.get(IDENTIFIER);
            if (identifier == null || !identifier.isTextual() || identifier.textValue().isBlank()) {
                throw new MissingRequiredFieldException(moduleId, IDENTIFIER);
            }

            JsonNode userConfig = raw.get(USER_CONFIG);
            if (userConfig != null && !userConfig.isNull() && !userConfig.isObject()) {
                throw new WorkflowConfigurationException(moduleId, "Field '" + USER_CONFIG + "' must be an object");
            }

            modules.add(new ModuleDefinition(moduleId, identifier.textValue(),
                    userConfig != null && userConfig.isObject() ? (ObjectNode) userConfig : null));
        }
        return modules;
    }

    private void validateRequiredFields(ModuleDefinition module, TaskHandler handler)
            throws MissingRequiredFieldException {
        ObjectNode userConfig = module.getUserConfig();
        for (String field : handler.getRequiredFields()) {
            JsonNode value = userConfig.get(field);
            if (value == null || value.isNull()) {
                throw new MissingRequiredFieldException(module.getId(), field);
            }
        }
    }
}
