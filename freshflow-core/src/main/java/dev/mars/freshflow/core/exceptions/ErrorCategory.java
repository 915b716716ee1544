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
 * Classifies Freshflow failures by the stage at which they are detected.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum ErrorCategory {

    /**
     * Detected while building a workflow, before any module executes.
     * Fails the whole submission.
     */
    CONFIGURATION,

    /**
     * Detected while resolving a module's input at dispatch time.
     * Recorded as that module's failure.
     */
    RESOLUTION,

    /**
     * Signalled by a task handler, either as a FAILED result or a raised fault.
     * Recorded as that module's failure.
     */
    HANDLER,

    /**
     * Raised by the event trigger subsystem.
     */
    TRIGGER
}
