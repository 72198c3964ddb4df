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

package org.fireflyframework.pipeline.checkpoint;

import org.fireflyframework.pipeline.model.WorkflowSession;
import org.fireflyframework.pipeline.model.WorkflowSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Interface for durable workflow checkpoints.
 * <p>
 * Every mutating operation is a single transaction against the underlying store: a crash
 * mid-write leaves either the previous state or the new one, never a partial checkpoint.
 */
public interface CheckpointStore {

    /**
     * Takes a full snapshot of the session and appends a reference to it on the session.
     *
     * @param session the live session
     * @param stageName stage at capture time
     * @param message human readable message
     * @param spec workflow specification in force, may be null
     * @return the stored checkpoint
     */
    Mono<WorkflowCheckpoint> createCheckpoint(WorkflowSession session, String stageName,
                                              String message, WorkflowSpec spec);

    /**
     * Stores only what changed since the session's latest checkpoint, or a full
     * snapshot when the session has none.
     *
     * @param session the live session
     * @param stageName stage at capture time
     * @param message human readable message
     * @param spec workflow specification in force, may be null
     * @return the stored checkpoint
     */
    Mono<WorkflowCheckpoint> createIncrementalCheckpoint(WorkflowSession session, String stageName,
                                                         String message, WorkflowSpec spec);

    /**
     * Reconstructs a session from a checkpoint.
     *
     * @param sessionId the session ID
     * @param checkpointId the checkpoint ID
     * @return the reconstructed session
     */
    Mono<WorkflowSession> restoreFromCheckpoint(String sessionId, String checkpointId);

    /**
     * Lists the checkpoints of a session, newest first.
     *
     * @param sessionId the session ID
     * @return checkpoints of the session
     */
    Flux<WorkflowCheckpoint> listCheckpoints(String sessionId);

    /**
     * Deletes a single checkpoint.
     *
     * @param checkpointId the checkpoint ID
     * @return completes when deleted, errors if the checkpoint does not exist
     */
    Mono<Void> deleteCheckpoint(String checkpointId);

    /**
     * Deletes every checkpoint of a session atomically.
     *
     * @param sessionId the session ID
     * @return number of checkpoints deleted
     */
    Mono<Integer> deleteSessionCheckpoints(String sessionId);

    /**
     * Deletes checkpoints whose timestamp is strictly older than {@code now - maxAge}.
     * Individual delete failures are logged and skipped.
     *
     * @param maxAge retention period
     * @return number of checkpoints deleted
     */
    Mono<Integer> cleanupExpiredCheckpoints(Duration maxAge);

    /**
     * Gets the newest checkpoint of a session.
     *
     * @param sessionId the session ID
     * @return the newest checkpoint, errors if the session has none
     */
    Mono<WorkflowCheckpoint> getLatestCheckpoint(String sessionId);

    /**
     * Computes totals over every stored checkpoint.
     *
     * @return checkpoint metrics
     */
    Mono<CheckpointMetrics> getCheckpointMetrics();

    /**
     * Lists the distinct ids of sessions that have checkpoints.
     *
     * @return session ids
     */
    Flux<String> findSessionIds();

    /**
     * Checks if the store is reachable.
     *
     * @return true if healthy
     */
    Mono<Boolean> isHealthy();
}
