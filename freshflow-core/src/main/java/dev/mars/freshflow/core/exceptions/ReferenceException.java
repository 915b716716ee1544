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
 * Base class for failures concerning inter-module references.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ReferenceException extends FreshflowException {

    private final String referencedModuleId;

    public ReferenceException(ErrorCategory category, String referencedModuleId, String message) {
        super(category, message);
        this.referencedModuleId = referencedModuleId;
    }

    /**
     * @return the upstream module the reference names, or null if the reference could not be parsed
     */
    public String getReferencedModuleId() {
        return referencedModuleId;
    }
}
