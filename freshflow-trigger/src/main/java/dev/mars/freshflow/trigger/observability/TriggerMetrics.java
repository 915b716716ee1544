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

package dev.mars.freshflow.trigger.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for Freshflow triggers.
 *
 * Provides 3 trigger-specific metrics:
 * - freshflow.trigger.fired (counter) - Events handed to callbacks
 * - freshflow.trigger.errors (counter) - Failed checks and failed callbacks
 * - freshflow.trigger.checks.skipped (counter) - Polls skipped because the previous check was still running
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class TriggerMetrics {

    private static final Logger logger = LoggerFactory.getLogger(TriggerMetrics.class);
    private static final String METER_NAME = "freshflow-trigger";

    private static TriggerMetrics instance;

    private final LongCounter eventsFired;
    private final LongCounter errors;
    private final LongCounter checksSkipped;

    private static final AttributeKey<String> TRIGGER_TYPE_KEY = AttributeKey.stringKey("trigger.type");
    private static final AttributeKey<String> ERROR_STAGE_KEY = AttributeKey.stringKey("error.stage");

    private TriggerMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        eventsFired = meter.counterBuilder("freshflow.trigger.fired")
                .setDescription("Number of trigger events delivered to callbacks")
                .setUnit("1")
                .build();

        errors = meter.counterBuilder("freshflow.trigger.errors")
                .setDescription("Number of failed trigger checks and callbacks")
                .setUnit("1")
                .build();

        checksSkipped = meter.counterBuilder("freshflow.trigger.checks.skipped")
                .setDescription("Number of polls skipped while a check was in flight")
                .setUnit("1")
                .build();

        logger.info("TriggerMetrics initialized");
    }

    public static synchronized TriggerMetrics getInstance() {
        if (instance == null) {
            instance = new TriggerMetrics();
        }
        return instance;
    }

    public void recordFired(String triggerType) {
        eventsFired.add(1, Attributes.of(TRIGGER_TYPE_KEY, triggerType));
    }

    /**
     * @param stage {@code check} or {@code callback}
     */
    public void recordError(String triggerType, String stage) {
        errors.add(1, Attributes.of(TRIGGER_TYPE_KEY, triggerType, ERROR_STAGE_KEY, stage));
    }

    public void recordCheckSkipped(String triggerType) {
        checksSkipped.add(1, Attributes.of(TRIGGER_TYPE_KEY, triggerType));
    }
}
