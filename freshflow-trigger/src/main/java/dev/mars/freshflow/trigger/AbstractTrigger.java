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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Start/stop state machine and callback delivery shared by all triggers.
 * <p>
 * Every callback invocation happens under the delivery lock and re-checks the running flag,
 * so once {@link #stop()} has cleared the flag and passed through the lock no event can be
 * delivered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public abstract class AbstractTrigger implements Trigger {

    private static final Logger logger = LoggerFactory.getLogger(AbstractTrigger.class);

    private final String id;
    private final String type;
    private final TriggerCallback callback;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ReentrantLock deliveryLock = new ReentrantLock();
    private final TriggerMetrics metrics;

    protected AbstractTrigger(String id, String type, TriggerCallback callback) {
        this.id = Objects.requireNonNull(id, "Trigger id cannot be null");
        this.type = Objects.requireNonNull(type, "Trigger type cannot be null");
        this.callback = Objects.requireNonNull(callback, "Trigger callback cannot be null");
        this.metrics = TriggerMetrics.getInstance();
    }

    @Override
    public final boolean start() {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Trigger {} already running", id);
            return false;
        }
        try {
            onStart();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        logger.info("Started {} trigger {}", type, id);
        return true;
    }

    @Override
    public final void stop() {
        boolean wasRunning = running.getAndSet(false);
        if (wasRunning) {
            onStop();
        }
        // wait for an in-flight delivery to finish
        deliveryLock.lock();
        deliveryLock.unlock();
        if (wasRunning) {
            logger.info("Stopped {} trigger {}", type, id);
        }
    }

    @Override
    public TriggerState getState() {
        return running.get() ? TriggerState.RUNNING : TriggerState.IDLE;
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public String getId() {
        return id;
    }

    protected boolean isRunning() {
        return running.get();
    }

    /**
     * Hands an event to the callback if the trigger is still running.
     *
     * @return true if the callback was invoked
     */
    protected boolean fire(TriggerEvent event) {
        deliveryLock.lock();
        try {
            if (!running.get()) {
                logger.debug("Trigger {} stopped, dropping event {}", id, event);
                return false;
            }
            metrics.recordFired(type);
            callback.onEvent(event);
            return true;
        } catch (RuntimeException e) {
            metrics.recordError(type, "callback");
            logger.warn("Callback of trigger {} failed: {}", id, e.getMessage());
            return true;
        } finally {
            deliveryLock.unlock();
        }
    }

    /**
     * Acquires the trigger's resources. Called once per successful {@link #start()}.
     */
    protected abstract void onStart();

    /**
     * Releases the trigger's resources. Called once per effective {@link #stop()}.
     */
    protected abstract void onStop();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
               "id='" + id + '\'' +
               ", state=" + getState() +
               '}';
    }
}
