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

import java.util.List;

/**
 * Thrown when module references form a cycle.
 * <p>
 * The cycle path starts and ends on the same module id and every consecutive
 * pair of ids is a dependency edge, e.g. {@code [a, b, c, a]}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class CircularDependencyException extends WorkflowConfigurationException {

    private final List<String> cyclePath;

    public CircularDependencyException(List<String> cyclePath) {
        super(cyclePath.isEmpty() ? null : cyclePath.get(0),
              "Circular dependency detected: " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> getCyclePath() {
        return cyclePath;
    }
}
