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
 * The fully resolved input handed to a task handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class TaskInput {

    private final String moduleId;
    private final String identifier;
    private final ObjectNode userConfig;

    public TaskInput(String moduleId, String identifier, ObjectNode userConfig) {
        this.moduleId = Objects.requireNonNull(moduleId, "Module id cannot be null");
        this.identifier = Objects.requireNonNull(identifier, "Identifier cannot be null");
        this.userConfig = Objects.requireNonNull(userConfig, "User config cannot be null");
    }

    public String getModuleId() {
        return moduleId;
    }

    public String getIdentifier() {
        return identifier;
    }

    public ObjectNode getUserConfig() {
        return userConfig;
    }

    /**
     * Renders the input in its wire shape: {@code module_id}, {@code identifier}, {@code user_config}.
     */
    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("module_id", moduleId);
        node.put("identifier", identifier);
        node.set("user_config", userConfig.deepCopy());
        return node;
    }

    @Override
    public String toString() {
        return "TaskInput{" +
                "moduleId='" + moduleId + '\'' +
                ", identifier='" + identifier + '\'' +
                ", userConfig=" + userConfig +
                '}';
    }
}
