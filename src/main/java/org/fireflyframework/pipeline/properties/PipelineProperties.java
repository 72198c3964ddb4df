/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.pipeline.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.fireflyframework.pipeline.checkpoint.IntegrityMode;
import org.fireflyframework.pipeline.escalation.BackoffMode;
import org.fireflyframework.pipeline.escalation.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the pipeline resilience library.
 */
@ConfigurationProperties(prefix = "firefly.pipeline")
@Validated
@Data
public class PipelineProperties {

    /**
     * Whether the pipeline resilience engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable health checks.
     */
    private boolean healthEnabled = true;

    /**
     * Checkpoint configuration.
     */
    @Valid
    @NotNull
    private CheckpointConfig checkpoint = new CheckpointConfig();

    /**
     * Escalation configuration.
     */
    @Valid
    @NotNull
    private EscalationConfig escalation = new EscalationConfig();

    /**
     * Coordination configuration.
     */
    @Valid
    @NotNull
    private CoordinationConfig coordination = new CoordinationConfig();

    /**
     * Startup recovery configuration.
     */
    @Valid
    @NotNull
    private RecoveryConfig recovery = new RecoveryConfig();

    /**
     * Checkpoint configuration.
     */
    @Data
    public static class CheckpointConfig {

        /**
         * Whether to GZIP checkpoint payloads when that makes them smaller.
         */
        private boolean compressionEnabled = true;

        /**
         * What to do when a stored checksum does not match on restore.
         */
        @NotNull
        private IntegrityMode integrityMode = IntegrityMode.BEST_EFFORT;

        /**
         * How long checkpoints are kept before cleanup removes them.
         */
        @NotNull
        private Duration retention = Duration.ofDays(7);

        /**
         * Whether to run periodic cleanup of expired checkpoints.
         */
        private boolean cleanupEnabled = true;

        /**
         * Interval between cleanup runs.
         */
        @NotNull
        private Duration cleanupInterval = Duration.ofHours(1);

        /**
         * Key-value storage backing the checkpoint store.
         */
        @Valid
        @NotNull
        private StorageConfig storage = new StorageConfig();
    }

    /**
     * Key-value storage configuration.
     */
    @Data
    public static class StorageConfig {

        /**
         * Storage type: memory or mvstore.
         */
        @NotNull
        private StorageType type = StorageType.MEMORY;

        /**
         * File of the MVStore database; required for the mvstore type.
         */
        private String path = "data/pipeline-checkpoints.mv.db";
    }

    public enum StorageType {
        MEMORY,
        MVSTORE
    }

    /**
     * Escalation configuration.
     */
    @Data
    public static class EscalationConfig {

        /**
         * Whether recoverable failures may be redirected to corrective tools.
         */
        private boolean enabled = true;

        /**
         * Whether to register the built-in routing rules.
         */
        private boolean defaultRulesEnabled = true;

        /**
         * Retry policy for first attempts of a tool.
         */
        @Valid
        @NotNull
        private RetryConfig defaultRetry = new RetryConfig(3, BackoffMode.EXPONENTIAL,
                Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);

        /**
         * Retry policy for escalated builds.
         */
        @Valid
        @NotNull
        private RetryConfig escalatedRetry = new RetryConfig(2, BackoffMode.FIXED,
                Duration.ofSeconds(5), Duration.ofSeconds(5), 1.0);
    }

    /**
     * Retry policy configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Maximum number of attempts, including the first one.
         */
        @Min(1)
        private int maxAttempts;

        /**
         * Backoff mode: fixed or exponential.
         */
        @NotNull
        private BackoffMode backoff;

        /**
         * Delay before the first retry.
         */
        @NotNull
        private Duration initialDelay;

        /**
         * Upper bound for any delay.
         */
        @NotNull
        private Duration maxDelay;

        /**
         * Growth factor for exponential backoff.
         */
        @DecimalMin("1.0")
        private double multiplier;

        public RetryConfig() {
            this(3, BackoffMode.EXPONENTIAL, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
        }

        public RetryConfig(int maxAttempts, BackoffMode backoff, Duration initialDelay,
                           Duration maxDelay, double multiplier) {
            this.maxAttempts = maxAttempts;
            this.backoff = backoff;
            this.initialDelay = initialDelay;
            this.maxDelay = maxDelay;
            this.multiplier = multiplier;
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, backoff, initialDelay, maxDelay, multiplier);
        }
    }

    /**
     * Coordination configuration.
     */
    @Data
    public static class CoordinationConfig {

        /**
         * How long a coordination waits for the target tool.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Whether to register the built-in pipeline tools and coordination rules.
         */
        private boolean defaultRulesEnabled = true;

        /**
         * Capacity of the queue applying usage metadata off the coordination path.
         */
        @Min(1)
        private int metricsQueueCapacity = 1024;
    }

    /**
     * Startup recovery configuration.
     */
    @Data
    public static class RecoveryConfig {

        /**
         * Whether to restore interrupted sessions from checkpoints on startup.
         */
        private boolean enabled = true;
    }
}
