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

package org.fireflyframework.pipeline.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.checkpoint.CheckpointStore;
import org.fireflyframework.pipeline.coordination.ToolCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the pipeline resilience engine.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Checkpoint store connectivity</li>
 *   <li>Number of in-flight coordinations</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class CheckpointStoreHealthIndicator implements ReactiveHealthIndicator {

    private final CheckpointStore checkpointStore;
    private final ToolCoordinator toolCoordinator;

    @Override
    public Mono<Health> health() {
        return checkStore()
                .map(storeHealthy -> {
                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();
                    return builder
                            .withDetail("checkpointStore", storeHealthy ? "connected" : "disconnected")
                            .withDetail("activeCoordinations", toolCoordinator.getActiveCoordinations().size())
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Pipeline health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkStore() {
        return checkpointStore.isHealthy()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }
}
