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

import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * A mailbox-like source polled by {@link EmailTrigger}.
 */
@FunctionalInterface
public interface MailboxSource {

    /**
     * Fetches messages that arrived since the previous poll. Called from a worker thread.
     *
     * @return new messages, empty if there are none
     * @throws Exception if the mailbox cannot be reached
     */
    List<JsonObject> poll() throws Exception;
}
