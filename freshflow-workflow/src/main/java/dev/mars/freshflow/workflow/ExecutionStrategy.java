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

import java.util.Locale;

/**
 * How the engine walks a workflow's modules.
 */
public enum ExecutionStrategy {

    /**
     * One module at a time, in execution order.
     */
    SEQUENTIAL,

    /**
     * Batch by batch; modules within a batch run concurrently.
     */
    PARALLEL;

    /**
     * Parses a configuration value such as {@code sequential} or {@code parallel}.
     *
     * @throws IllegalArgumentException if the value names no strategy
     */
    public static ExecutionStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            return SEQUENTIAL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
