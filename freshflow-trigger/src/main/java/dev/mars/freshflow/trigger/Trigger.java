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

package dev.mars.freshflow.trigger;

/**
 * An asynchronous event source that invokes a callback whenever it fires.
 * <p>
 * Triggers move from {@link TriggerState#IDLE} to {@link TriggerState#RUNNING} on
 * {@link #start()} and back on {@link #stop()}, and may be restarted.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public interface Trigger {

    /**
     * Starts firing events.
     *
     * @return false if the trigger was already running
     */
    boolean start();

    /**
     * Stops firing events. Safe to call repeatedly. When this method returns no callback
     * invocation is in progress and none will begin until the trigger is started again.
     */
    void stop();

    TriggerState getState();

    /**
     * @return the type tag, e.g. {@code schedule}, {@code email} or {@code webhook}
     */
    String getType();

    String getId();
}
