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

package dev.mars.freshflow.core.exceptions;

/**
 * Thrown when a module's configuration references a module id that is not
 * part of the workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class UnknownModuleReferenceException extends WorkflowConfigurationException {

    private final String referencedModuleId;

    public UnknownModuleReferenceException(String moduleId, String referencedModuleId) {
        super(moduleId, "References unknown module '" + referencedModuleId + "'");
        this.referencedModuleId = referencedModuleId;
    }

    public String getReferencedModuleId() {
        return referencedModuleId;
    }
}
