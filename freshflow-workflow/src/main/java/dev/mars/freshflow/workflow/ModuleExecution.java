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

package dev.mars.freshflow.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time report for one module of a run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class ModuleExecution {

    private final String moduleId;
    private final String identifier;
    private final ModuleStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final int attempts;
    private final Map<String, Object> briefOutput;
    private final String errorMessage;

    public ModuleExecution(String moduleId, String identifier, ModuleStatus status, Instant startTime,
                           Instant endTime, int attempts, Map<String, Object> briefOutput, String errorMessage) {
        this.moduleId = Objects.requireNonNull(moduleId, "Module id cannot be null");
        this.identifier = Objects.requireNonNull(identifier, "Identifier cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = startTime;
        this.endTime = endTime;
        this.attempts = attempts;
        this.briefOutput = briefOutput != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(briefOutput)) : Map.of();
        this.errorMessage = errorMessage;
    }

    public String getModuleId() {
        return moduleId;
    }

    public String getIdentifier() {
        return identifier;
    }

    public ModuleStatus getStatus() {
        return status;
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return startTime != null && endTime != null
                ? Optional.of(Duration.between(startTime, endTime)) : Optional.empty();
    }

    /**
     * @return number of handler invocations, including retries
     */
    public int getAttempts() {
        return attempts;
    }

    public Map<String, Object> getBriefOutput() {
        return briefOutput;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * Summarises a completed module's output for status displays.
     * Known size, chunk, token and embedding fields are surfaced next to a message.
     */
    public static Map<String, Object> briefOutputOf(String moduleId, ObjectNode output) {
        Map<String, Object> brief = new LinkedHashMap<>();
        brief.put("message", "Module " + moduleId + " completed successfully");
        if (output == null) {
            return brief;
        }
        putNumber(brief, "size", output.get("content_length"));
        putNumber(brief, "chunks", output.get("total_chunks"));
        putNumber(brief, "tokens", output.get("total_tokens"));
        JsonNode embeddings = output.get("embeddings");
        if (embeddings != null && embeddings.isContainerNode()) {
            brief.put("embeddings_count", embeddings.size());
        }
        return brief;
    }

    private static void putNumber(Map<String, Object> brief, String key, JsonNode value) {
        if (value != null && value.isNumber()) {
            brief.put(key, value.numberValue());
        }
    }

    @Override
    public String toString() {
        return "ModuleExecution{" +
               "moduleId='" + moduleId + '\'' +
               ", status=" + status +
               ", attempts=" + attempts +
               (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
               '}';
    }
}
