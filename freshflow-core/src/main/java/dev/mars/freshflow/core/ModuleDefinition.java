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

package dev.mars.freshflow.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A single named unit of work within a workflow.
 * <p>
 * The identifier selects the task handler; the user configuration is an arbitrary
 * JSON tree that may contain references to other modules' outputs. Instances are
 * immutable: the configuration is copied on the way in and on the way out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ModuleDefinition {

    private final String id;
    private final String identifier;
    private final ObjectNode userConfig;

    public ModuleDefinition(String id, String identifier, ObjectNode userConfig) {
        this.id = Objects.requireNonNull(id, "Module id cannot be null");
        this.identifier = Objects.requireNonNull(identifier, "Identifier cannot be null");
        this.userConfig = userConfig != null ? userConfig.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public String getId() {
        return id;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * @return a copy of the module's configuration tree
     */
    public ObjectNode getUserConfig() {
        return userConfig.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleDefinition that = (ModuleDefinition) o;
        return id.equals(that.id) && identifier.equals(that.identifier) && userConfig.equals(that.userConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, identifier, userConfig);
    }

    @Override
    public String toString() {
        return "ModuleDefinition{" +
                "id='" + id + '\'' +
                ", identifier='" + identifier + '\'' +
                ", userConfig=" + userConfig +
                '}';
    }
}
