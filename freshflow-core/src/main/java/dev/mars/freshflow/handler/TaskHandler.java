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

package dev.mars.freshflow.handler;

import dev.mars.freshflow.core.TaskInput;
import dev.mars.freshflow.core.TaskResult;
import dev.mars.freshflow.core.exceptions.TaskExecutionException;

import java.util.List;

/**
 * Capability interface implemented by every concrete task (download, chunking, embedding, ...).
 * <p>
 * A handler reports an expected failure by returning {@link TaskResult#failed(String)};
 * an unexpected fault may be thrown as {@link TaskExecutionException}. Either way the engine
 * records the failure against the module and carries on according to its failure policy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface TaskHandler {

    /**
     * @return the type tag modules use in their {@code identifier} field
     */
    String getIdentifier();

    /**
     * Top-level {@code user_config} keys that must be present for this handler.
     * Checked when the workflow is built.
     */
    default List<String> getRequiredFields() {
        return List.of();
    }

    TaskResult execute(TaskInput input) throws TaskExecutionException;
}
