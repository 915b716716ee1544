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

package dev.mars.freshflow.workflow.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fans engine events out to per-execution subscribers.
 * <p>
 * A subscriber that throws is logged and dropped. Subscriptions end by themselves after the
 * run's terminal event has been delivered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public class WorkflowEventPublisher implements WorkflowEventListener {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEventPublisher.class);

    private final Map<String, List<Entry>> subscribers = new ConcurrentHashMap<>();

    public Subscription subscribe(String executionId, Consumer<WorkflowEvent> consumer) {
        Objects.requireNonNull(executionId, "Execution ID cannot be null");
        Objects.requireNonNull(consumer, "Consumer cannot be null");

        Entry entry = new Entry(executionId, consumer);
        subscribers.computeIfAbsent(executionId, id -> new CopyOnWriteArrayList<>()).add(entry);
        logger.debug("New subscriber added for execution {}", executionId);
        return entry;
    }

    @Override
    public void onEvent(WorkflowEvent event) {
        publish(event);
    }

    public void publish(WorkflowEvent event) {
        String executionId = event.getExecutionId();
        List<Entry> entries = subscribers.get(executionId);
        if (entries == null) {
            return;
        }

        boolean terminal = event.getType().isTerminal();
        for (Entry entry : entries) {
            // the terminal event is delivered at most once, so claim the subscription first
            boolean deliver = terminal ? entry.active.compareAndSet(true, false) : entry.active.get();
            if (!deliver) {
                continue;
            }
            try {
                entry.consumer.accept(event);
            } catch (RuntimeException e) {
                logger.warn("Removing failed subscriber for execution {}: {}", executionId, e.getMessage());
                entry.cancel();
            }
        }

        if (terminal) {
            subscribers.remove(executionId);
        }
    }

    public int getSubscriberCount(String executionId) {
        List<Entry> entries = subscribers.get(executionId);
        return entries != null ? entries.size() : 0;
    }

    private void remove(Entry entry) {
        subscribers.computeIfPresent(entry.executionId, (id, entries) -> {
            entries.remove(entry);
            return entries.isEmpty() ? null : entries;
        });
    }

    private final class Entry implements Subscription {
        private final String executionId;
        private final Consumer<WorkflowEvent> consumer;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Entry(String executionId, Consumer<WorkflowEvent> consumer) {
            this.executionId = executionId;
            this.consumer = consumer;
        }

        @Override
        public String getExecutionId() {
            return executionId;
        }

        @Override
        public boolean cancel() {
            boolean wasActive = active.getAndSet(false);
            remove(this);
            return wasActive;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
