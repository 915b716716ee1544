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

import java.time.Instant;
import java.util.Objects;

/**
 * A single firing of a trigger. Events are handed to the callback and not kept afterwards.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public final class TriggerEvent {

    private final String type;
    private final Instant timestamp;
    private final JsonObject data;

    public TriggerEvent(String type, Instant timestamp, JsonObject data) {
        this.type = Objects.requireNonNull(type, "Trigger type cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.data = data != null ? data.copy() : new JsonObject();
    }

    public static TriggerEvent now(String type, JsonObject data) {
        return new TriggerEvent(type, Instant.now(), data);
    }

    /**
     * @return the type tag of the trigger that fired, e.g. {@code schedule}
     */
    public String getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return a copy of the trigger-specific payload
     */
    public JsonObject getData() {
        return data.copy();
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("type", type)
                .put("timestamp", timestamp.toString())
                .put("data", data.copy());
    }

    @Override
    public String toString() {
        return "TriggerEvent{" +
               "type='" + type + '\'' +
               ", timestamp=" + timestamp +
               ", data=" + data.encode() +
               '}';
    }
}
