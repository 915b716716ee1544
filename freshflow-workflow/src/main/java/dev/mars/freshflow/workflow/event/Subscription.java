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

package dev.mars.freshflow.workflow.event;

/**
 * Handle for a per-execution event subscription.
 */
public interface Subscription {

    String getExecutionId();

    /**
     * Stops delivery. Idempotent.
     *
     * @return true if this call ended an active subscription
     */
    boolean cancel();

    /**
     * @return false once cancelled, once the subscriber failed, or once the run finished
     */
    boolean isActive();
}
