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

package dev.mars.freshflow.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.freshflow.core.ModuleError;

import java.util.Map;
import java.util.Optional;

/**
 * Per-run record of module outputs and module errors.
 * <p>
 * A module with neither an output nor an error has not finished. Writing an
 * output clears any earlier error for the same module and vice versa, so the
 * latest attempt always wins.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface StateStore {

    void setOutput(String moduleId, ObjectNode output);

    void setError(String moduleId, ModuleError error);

    Optional<ObjectNode> getOutput(String moduleId);

    Optional<ModuleError> getError(String moduleId);

    default boolean hasOutput(String moduleId) {
        return getOutput(moduleId).isPresent();
    }

    /**
     * Removes every recorded output and error.
     */
    void clear();

    /**
     * @return an immutable copy of all recorded outputs
     */
    Map<String, ObjectNode> snapshot();

    /**
     * @return an immutable copy of all recorded errors
     */
    Map<String, ModuleError> errorSnapshot();
}
