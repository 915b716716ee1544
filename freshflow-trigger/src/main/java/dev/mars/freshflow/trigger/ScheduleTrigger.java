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
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fires once per interval. The first event arrives one interval after {@link #start()}.
 */
public class ScheduleTrigger extends AbstractPollingTrigger {

    public static final String TYPE = "schedule";

    private final AtomicLong sequence = new AtomicLong();

    public ScheduleTrigger(Vertx vertx, String id, Duration interval, TriggerCallback callback) {
        super(vertx, id, TYPE, interval, callback);
    }

    @Override
    protected List<TriggerEvent> check() {
        JsonObject data = new JsonObject()
                .put("trigger_id", getId())
                .put("interval_ms", getInterval().toMillis())
                .put("sequence", sequence.incrementAndGet());
        return List.of(TriggerEvent.now(TYPE, data));
    }
}
