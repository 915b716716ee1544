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

import dev.mars.freshflow.config.FreshflowConfiguration;
import dev.mars.freshflow.core.exceptions.UnknownTriggerTypeException;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registration table from trigger type tag to {@link TriggerProvider}.
 * <p>
 * The {@code schedule}, {@code email} and {@code webhook} types are registered on construction.
 * Further types can be added with {@link #register(String, TriggerProvider)}. Tags are
 * case-insensitive.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class TriggerFactory {

    private static final Logger logger = LoggerFactory.getLogger(TriggerFactory.class);

    public static final String DEFAULT_TYPE = ScheduleTrigger.TYPE;

    private final Vertx vertx;
    private final FreshflowConfiguration configuration;
    private final Map<String, TriggerProvider> providers = new ConcurrentHashMap<>();

    public TriggerFactory(Vertx vertx) {
        this(vertx, new FreshflowConfiguration());
    }

    public TriggerFactory(Vertx vertx, FreshflowConfiguration configuration) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        registerDefaultProviders();
    }

    private void registerDefaultProviders() {
        register(ScheduleTrigger.TYPE, (config, callback) -> new ScheduleTrigger(vertx, config.getId(),
                interval(config, configuration.getTriggerDefaultIntervalMs()), callback));
        register(EmailTrigger.TYPE, (config, callback) -> new EmailTrigger(vertx, config.getId(),
                interval(config, configuration.getEmailPollIntervalMs()), callback));
        register(WebhookTrigger.TYPE, (config, callback) -> new WebhookTrigger(vertx, config.getId(),
                webhookAddress(config), callback));
        logger.debug("Registered default trigger types: {}", getSupportedTypes());
    }

    public void register(String type, TriggerProvider provider) {
        Objects.requireNonNull(provider, "Provider cannot be null");
        providers.put(normalize(type), provider);
        logger.debug("Registered trigger type: {}", normalize(type));
    }

    public void unregister(String type) {
        if (providers.remove(normalize(type)) != null) {
            logger.debug("Unregistered trigger type: {}", normalize(type));
        }
    }

    /**
     * @param type a type tag; null or blank means {@link #DEFAULT_TYPE}
     */
    public boolean isSupported(String type) {
        return providers.containsKey(resolveType(type));
    }

    public Set<String> getSupportedTypes() {
        return new TreeSet<>(providers.keySet());
    }

    /**
     * Creates an idle trigger for the given configuration.
     *
     * @throws UnknownTriggerTypeException if no provider is registered for the type
     */
    public Trigger create(TriggerConfiguration config, TriggerCallback callback)
            throws UnknownTriggerTypeException {
        Objects.requireNonNull(config, "Trigger configuration cannot be null");
        Objects.requireNonNull(callback, "Trigger callback cannot be null");

        String type = resolveType(config.getType());
        TriggerProvider provider = providers.get(type);
        if (provider == null) {
            throw new UnknownTriggerTypeException(config.getType());
        }
        Trigger trigger = provider.create(config, callback);
        logger.debug("Created {} trigger {}", type, config.getId());
        return trigger;
    }

    String webhookAddress(TriggerConfiguration config) {
        String address = config.getAddress();
        return address != null && !address.isBlank()
                ? address
                : configuration.getWebhookAddressPrefix() + config.getId();
    }

    private static Duration interval(TriggerConfiguration config, long defaultMs) {
        return Duration.ofMillis(config.getIntervalMs() > 0 ? config.getIntervalMs() : defaultMs);
    }

    private static String resolveType(String type) {
        return type == null || type.isBlank() ? DEFAULT_TYPE : normalize(type);
    }

    private static String normalize(String type) {
        Objects.requireNonNull(type, "Trigger type cannot be null");
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
