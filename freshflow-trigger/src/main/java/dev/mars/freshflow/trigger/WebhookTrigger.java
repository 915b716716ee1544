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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fires on inbound signals instead of polling.
 * <p>
 * While running, the trigger consumes messages sent to its event-bus address. Transports that
 * do not use the event bus can call {@link #deliver(JsonObject)} directly. Signals received
 * while the trigger is idle are dropped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class WebhookTrigger extends AbstractTrigger {

    private static final Logger logger = LoggerFactory.getLogger(WebhookTrigger.class);

    public static final String TYPE = "webhook";

    private final Vertx vertx;
    private final String address;
    private volatile MessageConsumer<Object> consumer;

    public WebhookTrigger(Vertx vertx, String id, String address, TriggerCallback callback) {
        super(id, TYPE, callback);
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.address = Objects.requireNonNull(address, "Address cannot be null");
    }

    public String getAddress() {
        return address;
    }

    /**
     * @return completes once the event-bus consumer is registered; already complete when idle
     */
    public Future<Void> registration() {
        MessageConsumer<Object> current = consumer;
        return current != null ? current.completion() : Future.succeededFuture();
    }

    /**
     * Forwards an inbound signal to the callback.
     *
     * @return false if the trigger is not running and the signal was dropped
     */
    public boolean deliver(JsonObject payload) {
        return fire(TriggerEvent.now(TYPE, payload));
    }

    @Override
    protected void onStart() {
        consumer = vertx.eventBus().consumer(address, this::handleMessage);
        logger.debug("Webhook trigger {} listening on {}", getId(), address);
    }

    @Override
    protected void onStop() {
        MessageConsumer<Object> current = consumer;
        consumer = null;
        if (current != null) {
            current.unregister().onFailure(e ->
                    logger.warn("Failed to unregister webhook consumer on {}: {}", address, e.getMessage()));
        }
    }

    private void handleMessage(Message<Object> message) {
        Object body = message.body();
        JsonObject payload = body instanceof JsonObject
                ? (JsonObject) body
                : new JsonObject().put("payload", body != null ? body.toString() : null);
        boolean forwarded = deliver(payload);
        message.reply(forwarded);
    }
}
