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
import org.fireflyframework.pipeline.model.WorkflowSession;
import org.fireflyframework.pipeline.session.SessionManager;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Reconstructs interrupted sessions after application restart.
 *
 * <p>On {@link ApplicationReadyEvent}, restores every session that has checkpoints from its
 * latest checkpoint. Sessions whose restored status is still pending, running or paused are
 * handed to the {@link SessionManager}; completed, failed and cancelled sessions are left alone.</p>
 *
 * <p>Configuration:
 * <pre>
 * firefly.pipeline.recovery.enabled=true
 * </pre>
 */
@Slf4j
public class CheckpointRecoveryService {

    private final CheckpointStore checkpointStore;
    private final SessionManager sessionManager;
    private final boolean enabled;

    public CheckpointRecoveryService(CheckpointStore checkpointStore,
                                     SessionManager sessionManager,
                                     boolean enabled) {
        this.checkpointStore = checkpointStore;
        this.sessionManager = sessionManager;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        recoverSessions().subscribe();
    }

    /**
     * Runs one recovery scan.
     *
     * @return the recovery counts, emitted when the scan finishes
     */
    public Mono<RecoverySummary> recoverSessions() {
        if (!enabled) {
            log.info("Checkpoint recovery is disabled");
            return Mono.just(new RecoverySummary(0, 0, 0));
        }

        log.info("Starting checkpoint recovery scan");

        AtomicLong recovered = new AtomicLong();
        AtomicLong skipped = new AtomicLong();
        AtomicLong failed = new AtomicLong();

        return checkpointStore.findSessionIds()
                .concatMap(sessionId -> attemptRecovery(sessionId)
                        .doOnNext(restored -> recovered.incrementAndGet())
                        .switchIfEmpty(Mono.fromRunnable(skipped::incrementAndGet))
                        .doOnError(e -> {
                            failed.incrementAndGet();
                            log.error("Failed to recover session {}: {}", sessionId, e.getMessage());
                        })
                        .onErrorResume(e -> Mono.empty()))
                .then(Mono.fromSupplier(() -> new RecoverySummary(recovered.get(), skipped.get(), failed.get())))
                .doOnNext(summary -> log.info("Checkpoint recovery complete: recovered={}, skipped={}, failed={}",
                        summary.recovered(), summary.skipped(), summary.failed()));
    }

    private Mono<WorkflowSession> attemptRecovery(String sessionId) {
        return checkpointStore.getLatestCheckpoint(sessionId)
                .flatMap(latest -> {
                    log.info("Recovering session {} from checkpoint {} (stage={}, taken={})",
                            sessionId, latest.id(), latest.stageName(), latest.timestamp());
                    return checkpointStore.restoreFromCheckpoint(sessionId, latest.id());
                })
                .flatMap(session -> {
                    if (!session.getStatus().isResumable()) {
                        log.debug("Session {} is {}, nothing to recover", sessionId, session.getStatus());
                        return Mono.empty();
                    }
                    return sessionManager.restoreSession(session)
                            .doOnNext(restored -> log.info("Successfully recovered session {} at stage {}",
                                    restored.getSessionId(), restored.getCurrentStage()));
                });
    }

    /**
     * Counts of one recovery scan.
     */
    public record RecoverySummary(long recovered, long skipped, long failed) {
    }
}
