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

import dev.mars.freshflow.trigger.observability.TriggerMetrics;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for triggers that check a condition on a fixed interval.
 * <p>
 * A Vert.x periodic timer schedules the checks and each check runs on a worker thread
 * through {@code executeBlocking}. A tick that arrives while the previous check is still
 * running is skipped. A failing check is logged and the next tick proceeds as usual.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public abstract class AbstractPollingTrigger extends AbstractTrigger {

    private static final Logger logger = LoggerFactory.getLogger(AbstractPollingTrigger.class);

    private final Vertx vertx;
    private final Duration interval;
    private final AtomicBoolean checking = new AtomicBoolean(false);
    private final TriggerMetrics metrics = TriggerMetrics.getInstance();
    private volatile long timerId = -1;

    protected AbstractPollingTrigger(Vertx vertx, String id, String type, Duration interval,
                                     TriggerCallback callback) {
        super(id, type, callback);
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
        if (interval.toMillis() < 1) {
            throw new IllegalArgumentException("Trigger interval must be at least 1ms");
        }
        this.interval = interval;
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    protected void onStart() {
        timerId = vertx.setPeriodic(interval.toMillis(), id -> poll());
        logger.debug("Trigger {} polling every {}ms", getId(), interval.toMillis());
    }

    @Override
    protected void onStop() {
        long id = timerId;
        if (id >= 0) {
            vertx.cancelTimer(id);
            timerId = -1;
        }
    }

    private void poll() {
        if (!isRunning()) {
            return;
        }
        if (!checking.compareAndSet(false, true)) {
            metrics.recordCheckSkipped(getType());
            logger.debug("Trigger {} still checking, skipping tick", getId());
            return;
        }

        vertx.executeBlocking(() -> {
            int delivered = 0;
            for (TriggerEvent event : check()) {
                if (fire(event)) {
                    delivered++;
                }
            }
            return delivered;
        }).onComplete(ar -> {
            checking.set(false);
            if (ar.failed()) {
                metrics.recordError(getType(), "check");
                logger.warn("Check of trigger {} failed: {}", getId(), ar.cause().getMessage());
            } else if (ar.result() > 0) {
                logger.debug("Trigger {} delivered {} event(s)", getId(), ar.result());
            }
        });
    }

    /**
     * Evaluates the firing condition. Runs on a worker thread.
     *
     * @return the events to deliver, possibly none
     * @throws Exception if the condition could not be evaluated; the trigger keeps running
     */
    protected abstract List<TriggerEvent> check() throws Exception;
}
