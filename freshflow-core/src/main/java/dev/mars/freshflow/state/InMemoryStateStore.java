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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StateStore} backed by concurrent maps. One instance per run.
 * <p>
 * Outputs are copied on write and on read so callers can never mutate recorded state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final Map<String, ObjectNode> outputs = new ConcurrentHashMap<>();
    private final Map<String, ModuleError> errors = new ConcurrentHashMap<>();

    @Override
    public void setOutput(String moduleId, ObjectNode output) {
        Objects.requireNonNull(moduleId, "Module id cannot be null");
        Objects.requireNonNull(output, "Output cannot be null");
        errors.remove(moduleId);
        outputs.put(moduleId, output.deepCopy());
        logger.debug("Recorded output for module {}", moduleId);
    }

    @Override
    public void setError(String moduleId, ModuleError error) {
        Objects.requireNonNull(moduleId, "Module id cannot be null");
        Objects.requireNonNull(error, "Error cannot be null");
        outputs.remove(moduleId);
        errors.put(moduleId, error);
        logger.debug("Recorded error for module {}: {}", moduleId, error.getMessage());
    }

    @Override
    public Optional<ObjectNode> getOutput(String moduleId) {
        ObjectNode output = outputs.get(moduleId);
        return output != null ? Optional.of(output.deepCopy()) : Optional.empty();
    }

    @Override
    public Optional<ModuleError> getError(String moduleId) {
        return Optional.ofNullable(errors.get(moduleId));
    }

    @Override
    public boolean hasOutput(String moduleId) {
        return outputs.containsKey(moduleId);
    }

    @Override
    public void clear() {
        outputs.clear();
        errors.clear();
    }

    @Override
    public Map<String, ObjectNode> snapshot() {
        Map<String, ObjectNode> copy = new LinkedHashMap<>();
        outputs.forEach((id, output) -> copy.put(id, output.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public Map<String, ModuleError> errorSnapshot() {
        return Map.copyOf(errors);
    }
}
