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
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WebhookTrigger event-bus and direct delivery.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-10
 */
@ExtendWith(VertxExtension.class)
class WebhookTriggerTest {

    private static final String ADDRESS = "freshflow.webhook.orders";

    private final List<TriggerEvent> events = new CopyOnWriteArrayList<>();
    private WebhookTrigger trigger;

    @AfterEach
    void tearDown() {
        if (trigger != null) {
            trigger.stop();
        }
    }

    private void startAndAwaitRegistration() throws Exception {
        assertTrue(trigger.start());
        trigger.registration().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    void testEventBusMessageIsForwarded(Vertx vertx) throws Exception {
        trigger = new WebhookTrigger(vertx, "orders", ADDRESS, events::add);
        startAndAwaitRegistration();

        Message<Object> reply = vertx.eventBus()
                .request(ADDRESS, new JsonObject().put("order_id", 42))
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(Boolean.TRUE, reply.body());
        assertEquals(1, events.size());
        assertEquals(WebhookTrigger.TYPE, events.get(0).getType());
        assertEquals(42, events.get(0).getData().getInteger("order_id"));
    }

    @Test
    void testNonJsonBodyIsWrapped(Vertx vertx) throws Exception {
        trigger = new WebhookTrigger(vertx, "orders", ADDRESS, events::add);
        startAndAwaitRegistration();

        vertx.eventBus().send(ADDRESS, "ping");

        await().atMost(Duration.ofSeconds(5)).until(() -> events.size() == 1);
        assertEquals("ping", events.get(0).getData().getString("payload"));
    }

    @Test
    void testDirectDelivery(Vertx vertx) {
        trigger = new WebhookTrigger(vertx, "direct", ADDRESS, events::add);

        assertFalse(trigger.deliver(new JsonObject().put("ignored", true)), "Idle trigger drops signals");
        assertTrue(events.isEmpty());

        trigger.start();
        assertTrue(trigger.deliver(new JsonObject().put("accepted", true)));
        assertEquals(1, events.size());
        assertTrue(events.get(0).getData().getBoolean("accepted"));
    }

    @Test
    void testNoDeliveryAfterStop(Vertx vertx) throws Exception {
        trigger = new WebhookTrigger(vertx, "orders", ADDRESS, events::add);
        startAndAwaitRegistration();
        trigger.stop();

        vertx.eventBus().send(ADDRESS, new JsonObject().put("late", true));

        assertFalse(trigger.deliver(new JsonObject().put("late", true)));
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(events::isEmpty);
        assertEquals(TriggerState.IDLE, trigger.getState());
    }

    @Test
    void testRegistrationCompleteWhenIdle(Vertx vertx) {
        trigger = new WebhookTrigger(vertx, "idle", ADDRESS, events::add);

        assertTrue(trigger.registration().succeeded());
        assertEquals(ADDRESS, trigger.getAddress());
    }
}
