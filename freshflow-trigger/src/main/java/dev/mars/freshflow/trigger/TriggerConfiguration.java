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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Configuration for a trigger instance.
 * <p>
 * Each trigger type uses a subset of the fields:
 * <ul>
 *   <li>{@code schedule}: {@code interval_ms}</li>
 *   <li>{@code email}: {@code interval_ms} (poll interval)</li>
 *   <li>{@code webhook}: {@code address}</li>
 * </ul>
 * A missing {@code trigger_type} means {@code schedule}. A missing interval or address falls
 * back to the process configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-10
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerConfiguration {

    private final String id;
    private final String type;
    private final long intervalMs;
    private final String address;

    @JsonCreator
    public TriggerConfiguration(
            @JsonProperty("id") String id,
            @JsonProperty("trigger_type") String type,
            @JsonProperty("interval_ms") long intervalMs,
            @JsonProperty("address") String address) {
        this.id = Objects.requireNonNull(id, "Trigger id cannot be null");
        this.type = type;
        this.intervalMs = intervalMs;
        this.address = address;
    }

    /**
     * Creates a schedule trigger configuration.
     */
    public static TriggerConfiguration schedule(String id, long intervalMs) {
        return new TriggerConfiguration(id, ScheduleTrigger.TYPE, intervalMs, null);
    }

    /**
     * Creates an email trigger configuration.
     */
    public static TriggerConfiguration email(String id, long pollIntervalMs) {
        return new TriggerConfiguration(id, EmailTrigger.TYPE, pollIntervalMs, null);
    }

    /**
     * Creates a webhook trigger configuration.
     *
     * @param address the event-bus address, or null for the configured prefix plus the id
     */
    public static TriggerConfiguration webhook(String id, String address) {
        return new TriggerConfiguration(id, WebhookTrigger.TYPE, 0, address);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /**
     * @return the type tag as given, possibly null or blank
     */
    @JsonProperty("trigger_type")
    public String getType() {
        return type;
    }

    /**
     * @return the interval in milliseconds, 0 when not set
     */
    @JsonProperty("interval_ms")
    public long getIntervalMs() {
        return intervalMs;
    }

    @JsonProperty("address")
    public String getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "TriggerConfiguration{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", intervalMs=" + intervalMs +
               (address != null ? ", address='" + address + '\'' : "") +
               '}';
    }
}
