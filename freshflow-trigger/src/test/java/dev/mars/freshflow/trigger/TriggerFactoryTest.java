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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.freshflow.config.FreshflowConfiguration;
import dev.mars.freshflow.core.exceptions.ErrorCategory;
import dev.mars.freshflow.core.exceptions.UnknownTriggerTypeException;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TriggerFactory and TriggerConfiguration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-10
 */
@ExtendWith(VertxExtension.class)
class TriggerFactoryTest {

    private static final TriggerCallback NO_OP = event -> { };

    private TriggerFactory factory;

    @BeforeEach
    void setUp(Vertx vertx) {
        Properties properties = new Properties();
        properties.setProperty(FreshflowConfiguration.TRIGGER_DEFAULT_INTERVAL_MS, "250");
        properties.setProperty(FreshflowConfiguration.TRIGGER_EMAIL_POLL_INTERVAL_MS, "500");
        properties.setProperty(FreshflowConfiguration.TRIGGER_WEBHOOK_ADDRESS_PREFIX, "hooks.");
        factory = new TriggerFactory(vertx, new FreshflowConfiguration(properties));
    }

    @Test
    void testDefaultTypesRegistered() {
        assertThat(factory.getSupportedTypes()).containsExactly("email", "schedule", "webhook");
        assertThat(factory.isSupported("WEBHOOK")).isTrue();
        assertThat(factory.isSupported("sms")).isFalse();
    }

    @Test
    void testCreateSchedule() throws Exception {
        Trigger trigger = factory.create(TriggerConfiguration.schedule("nightly", 1000), NO_OP);

        assertThat(trigger).isInstanceOf(ScheduleTrigger.class);
        assertThat(trigger.getId()).isEqualTo("nightly");
        assertThat(trigger.getState()).isEqualTo(TriggerState.IDLE);
        assertThat(((ScheduleTrigger) trigger).getInterval()).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void testIntervalsFallBackToConfiguration() throws Exception {
        ScheduleTrigger schedule = (ScheduleTrigger) factory.create(TriggerConfiguration.schedule("s", 0), NO_OP);
        EmailTrigger email = (EmailTrigger) factory.create(TriggerConfiguration.email("e", 0), NO_OP);

        assertThat(schedule.getInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(email.getInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(email.hasSource()).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  "})
    void testMissingTypeDefaultsToSchedule(String type) throws Exception {
        Trigger trigger = factory.create(new TriggerConfiguration("untyped", type, 100, null), NO_OP);

        assertThat(trigger).isInstanceOf(ScheduleTrigger.class);
        assertThat(trigger.getType()).isEqualTo(ScheduleTrigger.TYPE);
    }

    @Test
    void testWebhookAddress() throws Exception {
        WebhookTrigger generated = (WebhookTrigger) factory.create(TriggerConfiguration.webhook("orders", null), NO_OP);
        WebhookTrigger explicit = (WebhookTrigger) factory.create(
                TriggerConfiguration.webhook("orders", "custom.orders"), NO_OP);

        assertThat(generated.getAddress()).isEqualTo("hooks.orders");
        assertThat(explicit.getAddress()).isEqualTo("custom.orders");
    }

    @Test
    void testUnknownType() {
        TriggerConfiguration config = new TriggerConfiguration("texts", "sms", 0, null);

        assertThatThrownBy(() -> factory.create(config, NO_OP))
                .isInstanceOf(UnknownTriggerTypeException.class)
                .hasMessage("Unknown trigger type: sms")
                .satisfies(e -> {
                    UnknownTriggerTypeException ex = (UnknownTriggerTypeException) e;
                    assertThat(ex.getTriggerType()).isEqualTo("sms");
                    assertThat(ex.getCategory()).isEqualTo(ErrorCategory.TRIGGER);
                });
    }

    @Test
    void testRegisterCustomProvider(Vertx vertx) throws Exception {
        MailboxSource mailbox = List::of;
        factory.register("imap", (config, callback) ->
                new EmailTrigger(vertx, config.getId(), Duration.ofSeconds(30), mailbox, callback));

        Trigger trigger = factory.create(new TriggerConfiguration("support", "IMAP", 0, null), NO_OP);

        assertThat(trigger).isInstanceOf(EmailTrigger.class);
        assertThat(((EmailTrigger) trigger).hasSource()).isTrue();
        assertThat(factory.getSupportedTypes()).contains("imap");

        factory.unregister("imap");
        assertThatThrownBy(() -> factory.create(new TriggerConfiguration("support", "imap", 0, null), NO_OP))
                .isInstanceOf(UnknownTriggerTypeException.class);
    }

    @Test
    void testConfigurationFromJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        TriggerConfiguration config = mapper.readValue(
                "{\"id\": \"hourly\", \"trigger_type\": \"schedule\", \"interval_ms\": 3600000, \"note\": \"x\"}",
                TriggerConfiguration.class);
        TriggerConfiguration webhook = mapper.readValue(
                "{\"id\": \"orders\", \"trigger_type\": \"webhook\"}", TriggerConfiguration.class);

        assertThat(config.getId()).isEqualTo("hourly");
        assertThat(config.getType()).isEqualTo("schedule");
        assertThat(config.getIntervalMs()).isEqualTo(3600000L);
        assertThat(webhook.getIntervalMs()).isZero();
        assertThat(webhook.getAddress()).isNull();
        assertThat(((WebhookTrigger) factory.create(webhook, NO_OP)).getAddress()).isEqualTo("hooks.orders");
    }
}
