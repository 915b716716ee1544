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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A pointer from one module's configuration to a named key of another module's output.
 * <p>
 * Two surface forms are recognised:
 * <ul>
 *   <li>structured: {@code {"module_id": "m", "output_key": "x"}} with exactly those two keys</li>
 *   <li>templated: {@code "${m.output.x}"}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ModuleReference {

    public static final String FIELD_MODULE_ID = "module_id";
    public static final String FIELD_OUTPUT_KEY = "output_key";

    /**
     * Module id: anything but '.' and '}'. Output key: anything but '}'.
     */
    public static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\$\\{([^.}]+)\\.output\\.([^}]+)}");

    private final String moduleId;
    private final String outputKey;

    public ModuleReference(String moduleId, String outputKey) {
        this.moduleId = Objects.requireNonNull(moduleId, "Module id cannot be null");
        this.outputKey = Objects.requireNonNull(outputKey, "Output key cannot be null");
    }

    public String getModuleId() {
        return moduleId;
    }

    public String getOutputKey() {
        return outputKey;
    }

    public String toTemplate() {
        return "${" + moduleId + ".output." + outputKey + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleReference that = (ModuleReference) o;
        return moduleId.equals(that.moduleId) && outputKey.equals(that.outputKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleId, outputKey);
    }

    @Override
    public String toString() {
        return toTemplate();
    }
}
