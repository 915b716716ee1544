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

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Polls a {@link MailboxSource} and fires one event per message.
 * <p>
 * Without a source the trigger fires a single event with empty data on every poll.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class EmailTrigger extends AbstractPollingTrigger {

    public static final String TYPE = "email";

    private final MailboxSource source;

    public EmailTrigger(Vertx vertx, String id, Duration pollInterval, TriggerCallback callback) {
        this(vertx, id, pollInterval, null, callback);
    }

    public EmailTrigger(Vertx vertx, String id, Duration pollInterval, MailboxSource source,
                        TriggerCallback callback) {
        super(vertx, id, TYPE, pollInterval, callback);
        this.source = source;
    }

    public boolean hasSource() {
        return source != null;
    }

    @Override
    protected List<TriggerEvent> check() throws Exception {
        if (source == null) {
            return List.of(TriggerEvent.now(TYPE, new JsonObject()));
        }

        List<JsonObject> messages = source.poll();
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<TriggerEvent> events = new ArrayList<>(messages.size());
        for (JsonObject message : messages) {
            events.add(TriggerEvent.now(TYPE, message));
        }
        return events;
    }
}
