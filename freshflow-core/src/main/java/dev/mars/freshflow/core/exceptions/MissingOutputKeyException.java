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
 * Thrown when a referenced module has recorded output but that output lacks the requested key.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class MissingOutputKeyException extends ReferenceException {

    private final String outputKey;

    public MissingOutputKeyException(String referencedModuleId, String outputKey) {
        super(ErrorCategory.RESOLUTION, referencedModuleId,
              "Key '" + outputKey + "' not found in output of module '" + referencedModuleId + "'");
        this.outputKey = outputKey;
    }

    public String getOutputKey() {
        return outputKey;
    }
}
