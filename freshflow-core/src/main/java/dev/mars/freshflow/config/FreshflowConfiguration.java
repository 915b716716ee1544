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

package dev.mars.freshflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for the Freshflow engine and trigger subsystem.
 * <p>
 * Values are layered: built-in defaults, then the first {@code freshflow.properties}
 * found on disk (or on the classpath), then system properties starting with {@code freshflow.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FreshflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FreshflowConfiguration.class);

    public static final String ENGINE_STRATEGY = "freshflow.engine.strategy";
    public static final String ENGINE_PARALLELISM = "freshflow.engine.parallelism";
    public static final String ENGINE_FAILURE_POLICY = "freshflow.engine.failure.policy";
    public static final String ENGINE_MAX_RETRIES = "freshflow.engine.module.max.retries";
    public static final String ENGINE_RETRY_DELAY_MS = "freshflow.engine.module.retry.delay.ms";
    public static final String ENGINE_RETAIN_COMPLETED_RUNS = "freshflow.engine.retain.completed.runs";
    public static final String TRIGGER_DEFAULT_INTERVAL_MS = "freshflow.trigger.default.interval.ms";
    public static final String TRIGGER_EMAIL_POLL_INTERVAL_MS = "freshflow.trigger.email.poll.interval.ms";
    public static final String TRIGGER_WEBHOOK_ADDRESS_PREFIX = "freshflow.trigger.webhook.address.prefix";

    // Default configuration values
    private static final String DEFAULT_STRATEGY = "sequential";
    private static final int DEFAULT_PARALLELISM = 4;
    private static final String DEFAULT_FAILURE_POLICY = "skip-dependents";
    private static final int DEFAULT_MAX_RETRIES = 0;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final int DEFAULT_RETAIN_COMPLETED_RUNS = 100;
    private static final long DEFAULT_TRIGGER_INTERVAL_MS = 60000;
    private static final long DEFAULT_EMAIL_POLL_INTERVAL_MS = 60000;
    private static final String DEFAULT_WEBHOOK_ADDRESS_PREFIX = "freshflow.webhook.";

    private static final String CONFIG_FILE_NAME = "freshflow.properties";

    private final Properties properties;

    public FreshflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Creates a configuration from defaults overlaid with the given properties only.
     * Files and system properties are not consulted.
     */
    public FreshflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Engine Configuration
    public String getEngineStrategy() {
        return getStringProperty(ENGINE_STRATEGY, DEFAULT_STRATEGY);
    }

    public int getParallelism() {
        return Math.max(1, getIntProperty(ENGINE_PARALLELISM, DEFAULT_PARALLELISM));
    }

    public String getFailurePolicy() {
        return getStringProperty(ENGINE_FAILURE_POLICY, DEFAULT_FAILURE_POLICY);
    }

    public int getModuleMaxRetries() {
        return Math.max(0, getIntProperty(ENGINE_MAX_RETRIES, DEFAULT_MAX_RETRIES));
    }

    public long getModuleRetryDelayMs() {
        return Math.max(0, getLongProperty(ENGINE_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS));
    }

    public int getRetainCompletedRuns() {
        return Math.max(0, getIntProperty(ENGINE_RETAIN_COMPLETED_RUNS, DEFAULT_RETAIN_COMPLETED_RUNS));
    }

    // Trigger Configuration
    public long getTriggerDefaultIntervalMs() {
        return getLongProperty(TRIGGER_DEFAULT_INTERVAL_MS, DEFAULT_TRIGGER_INTERVAL_MS);
    }

    public long getEmailPollIntervalMs() {
        return getLongProperty(TRIGGER_EMAIL_POLL_INTERVAL_MS, DEFAULT_EMAIL_POLL_INTERVAL_MS);
    }

    public String getWebhookAddressPrefix() {
        return getStringProperty(TRIGGER_WEBHOOK_ADDRESS_PREFIX, DEFAULT_WEBHOOK_ADDRESS_PREFIX);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(ENGINE_STRATEGY, DEFAULT_STRATEGY);
        properties.setProperty(ENGINE_PARALLELISM, String.valueOf(DEFAULT_PARALLELISM));
        properties.setProperty(ENGINE_FAILURE_POLICY, DEFAULT_FAILURE_POLICY);
        properties.setProperty(ENGINE_MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(ENGINE_RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(ENGINE_RETAIN_COMPLETED_RUNS, String.valueOf(DEFAULT_RETAIN_COMPLETED_RUNS));
        properties.setProperty(TRIGGER_DEFAULT_INTERVAL_MS, String.valueOf(DEFAULT_TRIGGER_INTERVAL_MS));
        properties.setProperty(TRIGGER_EMAIL_POLL_INTERVAL_MS, String.valueOf(DEFAULT_EMAIL_POLL_INTERVAL_MS));
        properties.setProperty(TRIGGER_WEBHOOK_ADDRESS_PREFIX, DEFAULT_WEBHOOK_ADDRESS_PREFIX);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE_NAME,
                "config/" + CONFIG_FILE_NAME,
                System.getProperty("user.home") + "/.freshflow/" + CONFIG_FILE_NAME
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("freshflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FreshflowConfiguration{" +
                "strategy='" + getEngineStrategy() + '\'' +
                ", parallelism=" + getParallelism() +
                ", failurePolicy='" + getFailurePolicy() + '\'' +
                ", maxRetries=" + getModuleMaxRetries() +
                '}';
    }
}
