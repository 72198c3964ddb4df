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

package org.fireflyframework.pipeline.recovery;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.checkpoint.CheckpointStore;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Deletes expired checkpoints on a fixed interval.
 */
@Slf4j
public class CheckpointCleanupScheduler implements DisposableBean {

    private final CheckpointStore checkpointStore;
    private final Duration interval;
    private final Duration retention;
    private volatile Disposable subscription;

    public CheckpointCleanupScheduler(CheckpointStore checkpointStore, Duration interval, Duration retention) {
        this.checkpointStore = checkpointStore;
        this.interval = interval;
        this.retention = retention;
    }

    /**
     * Starts the cleanup loop. Later calls while running are no-ops.
     */
    public void start() {
        if (isRunning()) {
            log.debug("CheckpointCleanupScheduler already running");
            return;
        }

        log.info("Starting CheckpointCleanupScheduler with interval={}, retention={}", interval, retention);

        subscription = Flux.interval(interval)
                .concatMap(tick -> runCleanup())
                .subscribe();
    }

    public void stop() {
        if (isRunning()) {
            log.info("Stopping CheckpointCleanupScheduler");
            subscription.dispose();
        }
    }

    public boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    @Override
    public void destroy() {
        stop();
    }

    /**
     * Runs one cleanup pass. Failures are logged and reported as zero deletions so the loop survives.
     */
    Mono<Integer> runCleanup() {
        return checkpointStore.cleanupExpiredCheckpoints(retention)
                .doOnNext(deleted -> {
                    if (deleted > 0) {
                        log.info("Deleted {} checkpoints older than {}", deleted, retention);
                    }
                })
                .onErrorResume(error -> {
                    log.warn("Checkpoint cleanup failed, retrying next interval: {}", error.getMessage());
                    return Mono.just(0);
                });
    }
}
