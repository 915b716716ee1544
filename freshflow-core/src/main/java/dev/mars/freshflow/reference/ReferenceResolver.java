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

package dev.mars.freshflow.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.freshflow.core.ModuleDefinition;
import dev.mars.freshflow.core.ModuleReference;
import dev.mars.freshflow.core.TaskInput;
import dev.mars.freshflow.core.exceptions.ErrorCategory;
import dev.mars.freshflow.core.exceptions.InvalidReferenceSyntaxException;
import dev.mars.freshflow.core.exceptions.MissingOutputKeyException;
import dev.mars.freshflow.core.exceptions.ReferenceException;
import dev.mars.freshflow.core.exceptions.UnresolvedDependencyException;
import dev.mars.freshflow.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds and resolves references between module configurations.
 * <p>
 * Detection, resolution and syntax validation all go through {@link ConfigTraversal},
 * so the three can never disagree about what counts as a reference. A string that is
 * exactly one template resolves to the raw referenced value, keeping its JSON type.
 * Templates embedded in longer strings are detected but rejected on resolution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ReferenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    /**
     * Collects the ids of every module referenced anywhere in the configuration,
     * in order of first appearance.
     */
    public Set<String> detectReferences(JsonNode config) {
        Set<String> moduleIds = new LinkedHashSet<>();
        for (ModuleReference reference : findReferences(config)) {
            moduleIds.add(reference.getModuleId());
        }
        return Collections.unmodifiableSet(moduleIds);
    }

    /**
     * Collects every reference in the configuration, including those embedded in longer strings.
     */
    public List<ModuleReference> findReferences(JsonNode config) {
        List<ModuleReference> references = new ArrayList<>();
        ConfigTraversal.walk(config, new ConfigVisitor<RuntimeException>() {
            @Override
            public JsonNode visitReference(ModuleReference reference, JsonNode site) {
                references.add(reference);
                return site;
            }

            @Override
            public JsonNode visitEmbeddedTemplate(TextNode site, List<ModuleReference> embedded) {
                references.addAll(embedded);
                return site;
            }
        });
        return references;
    }

    /**
     * Returns a copy of the configuration with every reference replaced by its value from the store.
     *
     * @throws UnresolvedDependencyException if a referenced module has no recorded output
     * @throws MissingOutputKeyException if the output lacks the referenced key
     * @throws InvalidReferenceSyntaxException if a template is embedded in a longer string
     */
    public JsonNode resolve(JsonNode config, StateStore store) throws ReferenceException {
        Objects.requireNonNull(store, "State store cannot be null");
        return ConfigTraversal.walk(config, new ConfigVisitor<ReferenceException>() {
            @Override
            public JsonNode visitReference(ModuleReference reference, JsonNode site) throws ReferenceException {
                return lookup(reference, store);
            }

            @Override
            public JsonNode visitEmbeddedTemplate(TextNode site, List<ModuleReference> embedded)
                    throws ReferenceException {
                throw new InvalidReferenceSyntaxException(site.textValue(),
                        "Partial string interpolation is not supported");
            }
        });
    }

    /**
     * Builds the handler input for a module by resolving its configuration.
     *
     * @throws ReferenceException if a reference cannot be resolved, or if a {@code user_config} that
     *         is itself a reference resolves to something other than an object
     */
    public TaskInput resolveInput(ModuleDefinition module, StateStore store) throws ReferenceException {
        Objects.requireNonNull(module, "Module cannot be null");
        JsonNode resolved = resolve(module.getUserConfig(), store);
        if (!(resolved instanceof ObjectNode)) {
            List<ModuleReference> references = findReferences(module.getUserConfig());
            String referencedModuleId = references.isEmpty() ? null : references.get(0).getModuleId();
            throw new ReferenceException(ErrorCategory.RESOLUTION, referencedModuleId,
                    "user_config of module '" + module.getId() + "' resolved to "
                            + resolved.getNodeType() + ", expected an object");
        }
        return new TaskInput(module.getId(), module.getIdentifier(), (ObjectNode) resolved);
    }

    /**
     * Checks that every reference-like value in the configuration can be resolved structurally.
     * Does not check that the referenced modules exist.
     *
     * @throws InvalidReferenceSyntaxException on an embedded template or an incomplete structured reference
     */
    public void validateSyntax(String moduleId, JsonNode config) throws InvalidReferenceSyntaxException {
        ConfigTraversal.walk(config, new ConfigVisitor<InvalidReferenceSyntaxException>() {
            @Override
            public JsonNode visitReference(ModuleReference reference, JsonNode site) {
                return site;
            }

            @Override
            public JsonNode visitEmbeddedTemplate(TextNode site, List<ModuleReference> embedded)
                    throws InvalidReferenceSyntaxException {
                throw new InvalidReferenceSyntaxException(moduleId, site.textValue(),
                        "Partial string interpolation is not supported");
            }

            @Override
            public JsonNode visitIncompleteReference(ObjectNode site, String reason)
                    throws InvalidReferenceSyntaxException {
                throw new InvalidReferenceSyntaxException(moduleId, site.toString(), reason);
            }
        });
    }

    private JsonNode lookup(ModuleReference reference, StateStore store) throws ReferenceException {
        ObjectNode output = store.getOutput(reference.getModuleId())
                .orElseThrow(() -> new UnresolvedDependencyException(reference.getModuleId()));
        JsonNode value = output.get(reference.getOutputKey());
        if (value == null) {
            throw new MissingOutputKeyException(reference.getModuleId(), reference.getOutputKey());
        }
        logger.debug("Resolved {} to {}", reference, value.getNodeType());
        return value.deepCopy();
    }
}
