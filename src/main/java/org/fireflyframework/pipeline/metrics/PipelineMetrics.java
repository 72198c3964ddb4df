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

package org.fireflyframework.pipeline.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.checkpoint.IntegrityMode;
import org.fireflyframework.pipeline.coordination.CoordinationStatus;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides Micrometer metrics for checkpointing, escalation and coordination.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>checkpoint.created</b> - Counter of checkpoints written (tags: type)</li>
 *   <li><b>checkpoint.payload.bytes</b> - Summary of stored payload sizes (tags: type, compressed)</li>
 *   <li><b>checkpoint.restored</b> - Counter of restores (tags: format)</li>
 *   <li><b>checkpoint.integrity.failures</b> - Counter of checksum mismatches (tags: mode)</li>
 *   <li><b>checkpoint.unreadable</b> - Counter of stored records skipped because they could not be decoded</li>
 *   <li><b>checkpoint.deleted</b> - Counter of deleted checkpoints (tags: reason)</li>
 *   <li><b>escalation.routed</b> - Counter of escalation decisions (tags: sourceTool, targetTool, action)</li>
 *   <li><b>coordination.completed</b> - Counter of resolved coordinations (tags: sourceTool, targetTool, status)</li>
 *   <li><b>coordination.duration</b> - Timer for coordination round trips (tags: sourceTool, targetTool, status)</li>
 *   <li><b>coordination.active</b> - Gauge of in-flight coordinations</li>
 *   <li><b>stage.retries</b> - Counter of stage retry attempts (tags: policy)</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.pipeline.".
 */
@Slf4j
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "firefly.pipeline.";

    private static final String TAG_TYPE = "type";
    private static final String TAG_STATUS = "status";
    private static final String TAG_SOURCE_TOOL = "sourceTool";
    private static final String TAG_TARGET_TOOL = "targetTool";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeCoordinations = new AtomicInteger();

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(METRIC_PREFIX + "coordination.active", activeCoordinations, AtomicInteger::get)
                .description("Number of in-flight coordinations")
                .register(meterRegistry);
        log.info("PipelineMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    // ==================== Checkpoint Metrics ====================

    public void recordCheckpointCreated(boolean incremental, boolean compressed, int storedSize) {
        String type = incremental ? "incremental" : "full";

        Counter.builder(METRIC_PREFIX + "checkpoint.created")
                .description("Number of checkpoints written")
                .tag(TAG_TYPE, type)
                .register(meterRegistry)
                .increment();

        DistributionSummary.builder(METRIC_PREFIX + "checkpoint.payload.bytes")
                .description("Stored checkpoint payload size")
                .baseUnit("bytes")
                .tag(TAG_TYPE, type)
                .tag("compressed", String.valueOf(compressed))
                .register(meterRegistry)
                .record(storedSize);

        log.debug("METRIC: checkpoint.created type={}, compressed={}, storedSize={}", type, compressed, storedSize);
    }

    public void recordCheckpointRestored(boolean legacyFormat) {
        Counter.builder(METRIC_PREFIX + "checkpoint.restored")
                .description("Number of sessions restored from checkpoints")
                .tag("format", legacyFormat ? "legacy" : "envelope")
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: checkpoint.restored legacy={}", legacyFormat);
    }

    public void recordIntegrityFailure(IntegrityMode mode) {
        Counter.builder(METRIC_PREFIX + "checkpoint.integrity.failures")
                .description("Number of checkpoint checksum mismatches")
                .tag("mode", normalizeTag(mode.name()))
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: checkpoint.integrity.failures mode={}", mode);
    }

    public void recordUnreadableRecord() {
        Counter.builder(METRIC_PREFIX + "checkpoint.unreadable")
                .description("Number of stored checkpoint records skipped because they could not be decoded")
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: checkpoint.unreadable");
    }

    public void recordCheckpointsDeleted(String reason, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + "checkpoint.deleted")
                .description("Number of checkpoints deleted")
                .tag("reason", normalizeTag(reason))
                .register(meterRegistry)
                .increment(count);

        log.debug("METRIC: checkpoint.deleted reason={}, count={}", reason, count);
    }

    // ==================== Escalation Metrics ====================

    public void recordEscalation(String sourceTool, String targetTool, String action) {
        Counter.builder(METRIC_PREFIX + "escalation.routed")
                .description("Number of escalation decisions")
                .tag(TAG_SOURCE_TOOL, normalizeTag(sourceTool))
                .tag(TAG_TARGET_TOOL, normalizeTag(targetTool))
                .tag("action", normalizeTag(action))
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: escalation.routed sourceTool={}, targetTool={}, action={}", sourceTool, targetTool, action);
    }

    public void recordStageRetry(String policyClass, int attempt) {
        Counter.builder(METRIC_PREFIX + "stage.retries")
                .description("Number of stage retry attempts")
                .tag("policy", normalizeTag(policyClass))
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: stage.retries policy={}, attempt={}", policyClass, attempt);
    }

    // ==================== Coordination Metrics ====================

    public void recordCoordinationStarted() {
        activeCoordinations.incrementAndGet();
    }

    public void recordCoordinationCompleted(String sourceTool, String targetTool,
                                            CoordinationStatus status, Duration duration) {
        String statusTag = status.name().toLowerCase(Locale.ROOT);

        Counter.builder(METRIC_PREFIX + "coordination.completed")
                .description("Number of coordinations resolved")
                .tag(TAG_SOURCE_TOOL, normalizeTag(sourceTool))
                .tag(TAG_TARGET_TOOL, normalizeTag(targetTool))
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "coordination.duration")
                .description("Coordination round trip duration")
                .tag(TAG_SOURCE_TOOL, normalizeTag(sourceTool))
                .tag(TAG_TARGET_TOOL, normalizeTag(targetTool))
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .record(duration);

        activeCoordinations.updateAndGet(current -> current > 0 ? current - 1 : 0);

        log.debug("METRIC: coordination.completed {} -> {} status={}, durationMs={}",
                sourceTool, targetTool, status, duration.toMillis());
    }

    private String normalizeTag(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }
        return value.replaceAll("[^a-zA-Z0-9._-]", "_").toLowerCase(Locale.ROOT);
    }
}
