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

package org.fireflyframework.pipeline.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.checkpoint.CheckpointCodec;
import org.fireflyframework.pipeline.checkpoint.CheckpointStore;
import org.fireflyframework.pipeline.checkpoint.KeyValueCheckpointStore;
import org.fireflyframework.pipeline.coordination.CommunicationBridge;
import org.fireflyframework.pipeline.coordination.InMemoryCommunicationBridge;
import org.fireflyframework.pipeline.coordination.ToolCoordinator;
import org.fireflyframework.pipeline.error.ErrorClassifier;
import org.fireflyframework.pipeline.escalation.EscalationRouter;
import org.fireflyframework.pipeline.graph.ToolDependencyGraph;
import org.fireflyframework.pipeline.health.CheckpointStoreHealthIndicator;
import org.fireflyframework.pipeline.kv.InMemoryKeyValueStore;
import org.fireflyframework.pipeline.kv.KeyValueStore;
import org.fireflyframework.pipeline.kv.MvStoreKeyValueStore;
import org.fireflyframework.pipeline.metrics.PipelineMetrics;
import org.fireflyframework.pipeline.properties.PipelineProperties;
import org.fireflyframework.pipeline.recovery.CheckpointCleanupScheduler;
import org.fireflyframework.pipeline.recovery.CheckpointRecoveryService;
import org.fireflyframework.pipeline.retry.StageRetryExecutor;
import org.fireflyframework.pipeline.session.SessionManager;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Auto-configuration for the Firefly Pipeline Resilience engine.
 * <p>
 * This configuration provides the beans for checkpointing and failure handling:
 * <ul>
 *   <li>KeyValueStore - in-memory or MVStore storage for checkpoints</li>
 *   <li>CheckpointStore - compressed, checksummed checkpoint persistence</li>
 *   <li>EscalationRouter - routing rules and retry policies</li>
 *   <li>ToolCoordinator - coordination and escalation of tool failures</li>
 *   <li>StageRetryExecutor - Resilience4j retries of stage executions</li>
 *   <li>CheckpointCleanupScheduler - periodic deletion of expired checkpoints</li>
 *   <li>CheckpointRecoveryService - session recovery on startup, requires a SessionManager</li>
 *   <li>CheckpointStoreHealthIndicator - health monitoring</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(PipelineProperties.class)
@ConditionalOnProperty(prefix = "firefly.pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.pipeline", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry) {
        log.info("Creating PipelineMetrics");
        return new PipelineMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore pipelineKeyValueStore(PipelineProperties properties) {
        PipelineProperties.StorageConfig storage = properties.getCheckpoint().getStorage();
        if (storage.getType() == PipelineProperties.StorageType.MVSTORE) {
            log.info("Creating MvStoreKeyValueStore at {}", storage.getPath());
            return new MvStoreKeyValueStore(Path.of(storage.getPath()));
        }
        log.info("Creating InMemoryKeyValueStore, checkpoints will not survive a restart");
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckpointStore checkpointStore(KeyValueStore keyValueStore,
                                           PipelineProperties properties,
                                           @Nullable PipelineMetrics pipelineMetrics) {
        PipelineProperties.CheckpointConfig checkpoint = properties.getCheckpoint();
        log.info("Creating KeyValueCheckpointStore with compression: {}, integrityMode: {}",
                checkpoint.isCompressionEnabled(), checkpoint.getIntegrityMode());
        return new KeyValueCheckpointStore(keyValueStore,
                new CheckpointCodec(checkpoint.isCompressionEnabled()),
                checkpoint.getIntegrityMode(),
                Clock.systemUTC(),
                pipelineMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolDependencyGraph toolDependencyGraph() {
        return new ToolDependencyGraph();
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationRouter escalationRouter(PipelineProperties properties) {
        PipelineProperties.EscalationConfig escalation = properties.getEscalation();
        EscalationRouter router = new EscalationRouter(
                escalation.getDefaultRetry().toPolicy(),
                escalation.getEscalatedRetry().toPolicy());
        if (escalation.isDefaultRulesEnabled()) {
            router.registerDefaultRules();
        }
        log.info("Creating EscalationRouter with default rules: {}", escalation.isDefaultRulesEnabled());
        return router;
    }

    @Bean
    @ConditionalOnMissingBean
    public CommunicationBridge communicationBridge() {
        log.info("Creating InMemoryCommunicationBridge");
        return new InMemoryCommunicationBridge();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolCoordinator toolCoordinator(ToolDependencyGraph graph,
                                           EscalationRouter escalationRouter,
                                           CommunicationBridge communicationBridge,
                                           ErrorClassifier errorClassifier,
                                           PipelineProperties properties,
                                           @Nullable PipelineMetrics pipelineMetrics) {
        PipelineProperties.CoordinationConfig coordination = properties.getCoordination();
        ToolCoordinator coordinator = new ToolCoordinator(graph, escalationRouter, communicationBridge,
                errorClassifier, coordination.getTimeout(), properties.getEscalation().isEnabled(),
                coordination.getMetricsQueueCapacity(), pipelineMetrics);
        if (coordination.isDefaultRulesEnabled()) {
            coordinator.registerDefaultTools();
            coordinator.registerDefaultRules();
        }
        log.info("Creating ToolCoordinator with timeout: {}, escalation: {}, default rules: {}",
                coordination.getTimeout(), properties.getEscalation().isEnabled(),
                coordination.isDefaultRulesEnabled());
        return coordinator;
    }

    @Bean
    @ConditionalOnMissingBean
    public StageRetryExecutor stageRetryExecutor(EscalationRouter escalationRouter,
                                                 ErrorClassifier errorClassifier,
                                                 @Nullable PipelineMetrics pipelineMetrics) {
        return new StageRetryExecutor(escalationRouter, errorClassifier, pipelineMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.pipeline.checkpoint", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
    public CheckpointCleanupScheduler checkpointCleanupScheduler(CheckpointStore checkpointStore,
                                                                 PipelineProperties properties) {
        PipelineProperties.CheckpointConfig checkpoint = properties.getCheckpoint();
        CheckpointCleanupScheduler scheduler = new CheckpointCleanupScheduler(
                checkpointStore, checkpoint.getCleanupInterval(), checkpoint.getRetention());
        scheduler.start();
        log.info("Created and started CheckpointCleanupScheduler with interval={}, retention={}",
                checkpoint.getCleanupInterval(), checkpoint.getRetention());
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SessionManager.class)
    @ConditionalOnProperty(prefix = "firefly.pipeline.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CheckpointRecoveryService checkpointRecoveryService(CheckpointStore checkpointStore,
                                                               SessionManager sessionManager,
                                                               PipelineProperties properties) {
        log.info("Creating CheckpointRecoveryService");
        return new CheckpointRecoveryService(checkpointStore, sessionManager, properties.getRecovery().isEnabled());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    @ConditionalOnProperty(prefix = "firefly.pipeline", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public CheckpointStoreHealthIndicator checkpointStoreHealthIndicator(CheckpointStore checkpointStore,
                                                                         ToolCoordinator toolCoordinator) {
        log.info("Creating CheckpointStoreHealthIndicator");
        return new CheckpointStoreHealthIndicator(checkpointStore, toolCoordinator);
    }
}
