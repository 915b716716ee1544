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
 * What the engine does with the rest of a run once a module has failed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public enum FailurePolicy {

    /**
     * Skip every transitive dependent of the failed module; independent modules still run.
     */
    SKIP_DEPENDENTS,

    /**
     * Skip every module not yet dispatched.
     */
    ABORT_RUN,

    /**
     * Dispatch everything; dependents of a failed module fail during input resolution.
     */
    ATTEMPT_ALL;

    /**
     * Parses a configuration value such as {@code skip-dependents} or {@code ABORT_RUN}.
     *
     * @throws IllegalArgumentException if the value names no policy
     */
    public static FailurePolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return SKIP_DEPENDENTS;
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
