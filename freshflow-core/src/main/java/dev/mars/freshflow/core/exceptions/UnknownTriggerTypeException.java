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
 * Thrown when a trigger type tag has no registered provider.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class UnknownTriggerTypeException extends FreshflowException {

    private final String triggerType;

    public UnknownTriggerTypeException(String triggerType) {
        super(ErrorCategory.TRIGGER, "Unknown trigger type: " + triggerType);
        this.triggerType = triggerType;
    }

    public String getTriggerType() {
        return triggerType;
    }
}
