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

import dev.mars.freshflow.config.FreshflowConfiguration;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-run execution settings: identity, strategy, failure handling and retry.
 */
public class ExecutionContext {

    private final String executionId;
    private final Instant createdAt;
    private final ExecutionStrategy strategy;
    private final int parallelism;
    private final FailurePolicy failurePolicy;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Map<String, String> metadata;

    public ExecutionContext(String executionId, ExecutionStrategy strategy, int parallelism,
                            FailurePolicy failurePolicy, int maxRetries, Duration retryDelay,
                            Map<String, String> metadata) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.strategy = Objects.requireNonNull(strategy, "Execution strategy cannot be null");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "Failure policy cannot be null");
        this.retryDelay = Objects.requireNonNull(retryDelay, "Retry delay cannot be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        this.parallelism = parallelism;
        this.maxRetries = maxRetries;
        this.createdAt = Instant.now();
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public String getExecutionId() {
        return executionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ExecutionStrategy getStrategy() {
        return strategy;
    }

    public int getParallelism() {
        return parallelism;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated with the engine settings of the given configuration.
     */
    public static Builder fromConfiguration(FreshflowConfiguration configuration) {
        return new Builder()
                .strategy(ExecutionStrategy.fromString(configuration.getEngineStrategy()))
                .parallelism(configuration.getParallelism())
                .failurePolicy(FailurePolicy.fromString(configuration.getFailurePolicy()))
                .maxRetries(configuration.getModuleMaxRetries())
                .retryDelay(Duration.ofMillis(configuration.getModuleRetryDelayMs()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionContext that = (ExecutionContext) o;
        return Objects.equals(executionId, that.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "executionId='" + executionId + '\'' +
               ", strategy=" + strategy +
               ", parallelism=" + parallelism +
               ", failurePolicy=" + failurePolicy +
               ", maxRetries=" + maxRetries +
               '}';
    }

    /**
     * Builder for ExecutionContext.
     */
    public static class Builder {
        private String executionId;
        private ExecutionStrategy strategy = ExecutionStrategy.SEQUENTIAL;
        private int parallelism = 4;
        private FailurePolicy failurePolicy = FailurePolicy.SKIP_DEPENDENTS;
        private int maxRetries = 0;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Map<String, String> metadata = Map.of();

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder strategy(ExecutionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public ExecutionContext build() {
            if (executionId == null) {
                executionId = UUID.randomUUID().toString();
            }
            return new ExecutionContext(executionId, strategy, parallelism, failurePolicy,
                    maxRetries, retryDelay, metadata);
        }
    }
}
