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
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScheduleTrigger and the start/stop contract shared by polling triggers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-10
 */
@ExtendWith(VertxExtension.class)
class ScheduleTriggerTest {

    private final List<TriggerEvent> events = new CopyOnWriteArrayList<>();
    private ScheduleTrigger trigger;

    @AfterEach
    void tearDown() {
        if (trigger != null) {
            trigger.stop();
        }
    }

    @Test
    void testFiresOncePerInterval(Vertx vertx) throws InterruptedException {
        trigger = new ScheduleTrigger(vertx, "every-100ms", Duration.ofMillis(100), events::add);

        assertTrue(trigger.start());
        Thread.sleep(350);
        trigger.stop();

        // ticks at 100, 200 and 300ms; the timer never catches up on late ticks
        assertTrue(events.size() >= 2 && events.size() <= 3,
                "Expected about 3 events after 3.5 intervals but got " + events.size());
    }

    @Test
    void testKeepsFiringWhileRunning(Vertx vertx) {
        trigger = new ScheduleTrigger(vertx, "fast", Duration.ofMillis(20), events::add);
        trigger.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> events.size() >= 3);

        TriggerEvent first = events.get(0);
        assertEquals(ScheduleTrigger.TYPE, first.getType());
        assertEquals("fast", first.getData().getString("trigger_id"));
        assertEquals(20L, first.getData().getLong("interval_ms"));
        assertEquals(1L, first.getData().getLong("sequence"));
        assertEquals(2L, events.get(1).getData().getLong("sequence"));
    }

    @Test
    void testNoDeliveryAfterStop(Vertx vertx) {
        trigger = new ScheduleTrigger(vertx, "stoppable", Duration.ofMillis(20), events::add);
        trigger.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> events.size() >= 2);

        trigger.stop();
        int deliveredBeforeStop = events.size();

        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(1))
                .until(() -> events.size() == deliveredBeforeStop);
    }

    @Test
    void testStateTransitions(Vertx vertx) {
        trigger = new ScheduleTrigger(vertx, "states", Duration.ofSeconds(10), events::add);
        assertEquals(TriggerState.IDLE, trigger.getState());

        assertTrue(trigger.start());
        assertEquals(TriggerState.RUNNING, trigger.getState());

        trigger.stop();
        assertEquals(TriggerState.IDLE, trigger.getState());

        assertTrue(trigger.start(), "A stopped trigger can be started again");
        assertEquals(TriggerState.RUNNING, trigger.getState());
    }

    @Test
    void testStartWhileRunningIsNoOp(Vertx vertx) {
        trigger = new ScheduleTrigger(vertx, "twice", Duration.ofMillis(50), events::add);

        assertTrue(trigger.start());
        assertFalse(trigger.start());
        assertEquals(TriggerState.RUNNING, trigger.getState());
    }

    @Test
    void testStopIsIdempotent(Vertx vertx) {
        trigger = new ScheduleTrigger(vertx, "idle", Duration.ofMillis(50), events::add);

        trigger.stop();
        trigger.start();
        trigger.stop();
        trigger.stop();

        assertEquals(TriggerState.IDLE, trigger.getState());
    }

    @Test
    void testCallbackFailureDoesNotStopTrigger(Vertx vertx) {
        AtomicInteger invocations = new AtomicInteger();
        trigger = new ScheduleTrigger(vertx, "flaky", Duration.ofMillis(20), event -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("downstream unavailable");
        });
        trigger.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> invocations.get() >= 3);
        assertEquals(TriggerState.RUNNING, trigger.getState());
    }

    @Test
    void testIntervalValidation(Vertx vertx) {
        assertThrows(IllegalArgumentException.class,
                () -> new ScheduleTrigger(vertx, "zero", Duration.ZERO, events::add));
        assertThrows(NullPointerException.class,
                () -> new ScheduleTrigger(vertx, "none", null, events::add));
    }
}
