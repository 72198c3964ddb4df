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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.checkpoint.CheckpointCodec.DecodedCheckpoint;
import org.fireflyframework.pipeline.exception.CheckpointException;
import org.fireflyframework.pipeline.exception.CheckpointIntegrityException;
import org.fireflyframework.pipeline.exception.CheckpointNotFoundException;
import org.fireflyframework.pipeline.exception.CheckpointStorageException;
import org.fireflyframework.pipeline.kv.KeyValue;
import org.fireflyframework.pipeline.kv.KeyValueStore;
import org.fireflyframework.pipeline.metrics.PipelineMetrics;
import org.fireflyframework.pipeline.model.WorkflowSession;
import org.fireflyframework.pipeline.model.WorkflowSpec;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * {@link CheckpointStore} on top of an embedded {@link KeyValueStore}.
 * <p>
 * Buckets:
 * <ul>
 *   <li>{@code workflow_checkpoints}: {@code {sessionId}_{checkpointId}} to the serialized envelope</li>
 *   <li>{@code checkpoint_index}: {@code {checkpointId}} to the primary key</li>
 * </ul>
 * The index entry is written and removed in the same transaction as the checkpoint. Session
 * membership is read from the envelope metadata rather than parsed out of the key, so session
 * ids may contain the separator.
 * <p>
 * Store access is blocking and runs on {@link Schedulers#boundedElastic()}.
 */
@Slf4j
public class KeyValueCheckpointStore implements CheckpointStore {

    public static final String CHECKPOINT_BUCKET = "workflow_checkpoints";
    static final String INDEX_BUCKET = "checkpoint_index";
    private static final String KEY_SEPARATOR = "_";

    private final KeyValueStore store;
    private final CheckpointCodec codec;
    private final IntegrityMode integrityMode;
    private final Clock clock;
    @Nullable
    private final PipelineMetrics metrics;

    public KeyValueCheckpointStore(KeyValueStore store,
                                   CheckpointCodec codec,
                                   IntegrityMode integrityMode,
                                   Clock clock,
                                   @Nullable PipelineMetrics metrics) {
        this.store = store;
        this.codec = codec;
        this.integrityMode = integrityMode;
        this.clock = clock;
        this.metrics = metrics;
        log.info("KeyValueCheckpointStore initialized: integrityMode={}", integrityMode);
    }

    // ==================== Create ====================

    @Override
    public Mono<WorkflowCheckpoint> createCheckpoint(WorkflowSession session, String stageName,
                                                     String message, WorkflowSpec spec) {
        return blocking(() -> writeFull(session, stageName, message, spec))
                .doOnSuccess(checkpoint -> onCreated(session, checkpoint))
                .doOnError(e -> log.error("Failed to create checkpoint for session {} at stage {}",
                        session.getSessionId(), stageName, e));
    }

    @Override
    public Mono<WorkflowCheckpoint> createIncrementalCheckpoint(WorkflowSession session, String stageName,
                                                                String message, WorkflowSpec spec) {
        return blocking(() -> writeIncremental(session, stageName, message, spec))
                .doOnSuccess(checkpoint -> onCreated(session, checkpoint))
                .doOnError(e -> log.error("Failed to create incremental checkpoint for session {} at stage {}",
                        session.getSessionId(), stageName, e));
    }

    private WorkflowCheckpoint writeFull(WorkflowSession session, String stageName, String message,
                                         WorkflowSpec spec) {
        WorkflowCheckpoint checkpoint = new WorkflowCheckpoint(
                UUID.randomUUID().toString(),
                session.getSessionId(),
                session.getWorkflowId(),
                stageName,
                clock.instant(),
                spec,
                FullSessionState.from(session),
                session.getStageResults(),
                message);
        writeCheckpoint(checkpoint, baseMetadata(session, checkpoint));
        return checkpoint;
    }

    private WorkflowCheckpoint writeIncremental(WorkflowSession session, String stageName, String message,
                                                WorkflowSpec spec) {
        String sessionId = session.getSessionId();
        Optional<DecodedCheckpoint> latest = loadSession(sessionId).stream().findFirst();
        if (latest.isEmpty()) {
            log.debug("No previous checkpoint for session {}, writing a full checkpoint", sessionId);
            return writeFull(session, stageName, message, spec);
        }

        DecodedCheckpoint parent = verify(latest.get(), sessionId, null);
        Materialized base = materialize(sessionId, parent);
        FullSessionState current = FullSessionState.from(session);
        SessionStateDelta delta = SessionStateDelta.between(base.state(), current, codec::sameValue);

        Map<String, Object> changedResults = new LinkedHashMap<>();
        session.getStageResults().forEach((stage, result) -> {
            if (!codec.sameValue(result, base.stageResults().get(stage))) {
                changedResults.put(stage, result);
            }
        });

        WorkflowCheckpoint checkpoint = new WorkflowCheckpoint(
                UUID.randomUUID().toString(),
                sessionId,
                session.getWorkflowId(),
                stageName,
                clock.instant(),
                spec,
                delta,
                changedResults,
                message);

        Map<String, String> metadata = baseMetadata(session, checkpoint);
        metadata.put(CheckpointEnvelope.META_INCREMENTAL, "true");
        metadata.put(CheckpointEnvelope.META_PARENT_CHECKPOINT, parent.checkpoint().id());
        writeCheckpoint(checkpoint, metadata);

        log.debug("Incremental checkpoint {} for session {}: parent={}, changedResults={}",
                checkpoint.id(), sessionId, parent.checkpoint().id(), changedResults.keySet());
        return checkpoint;
    }

    private void writeCheckpoint(WorkflowCheckpoint checkpoint, Map<String, String> metadata) {
        String sessionId = checkpoint.sessionId();
        String key = primaryKey(sessionId, checkpoint.id());
        CheckpointEnvelope envelope;
        byte[] record;
        try {
            envelope = codec.encode(checkpoint, metadata, clock.instant());
            record = codec.write(envelope);
        } catch (IOException e) {
            throw new CheckpointStorageException("Failed to serialize checkpoint", sessionId, checkpoint.id(), e);
        }

        inTransaction(sessionId, checkpoint.id(), () -> store.write(tx -> {
            tx.put(CHECKPOINT_BUCKET, key, record);
            tx.put(INDEX_BUCKET, checkpoint.id(), key.getBytes(StandardCharsets.UTF_8));
            return null;
        }));

        if (metrics != null) {
            metrics.recordCheckpointCreated(checkpoint.isIncremental(), envelope.compressed(), envelope.data().length);
        }
    }

    private Map<String, String> baseMetadata(WorkflowSession session, WorkflowCheckpoint checkpoint) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(CheckpointEnvelope.META_SESSION_ID, session.getSessionId());
        metadata.put(CheckpointEnvelope.META_CHECKPOINT_ID, checkpoint.id());
        metadata.put(CheckpointEnvelope.META_STAGE_NAME, checkpoint.stageName());
        metadata.put(CheckpointEnvelope.META_WORKFLOW_NAME, session.getWorkflowName());
        return metadata;
    }

    private void onCreated(WorkflowSession session, WorkflowCheckpoint checkpoint) {
        session.recordCheckpoint(checkpoint.toRef());
        log.info("Created {} checkpoint {} for session {} at stage {}",
                checkpoint.isIncremental() ? "incremental" : "full",
                checkpoint.id(), session.getSessionId(), checkpoint.stageName());
    }

    // ==================== Restore ====================

    @Override
    public Mono<WorkflowSession> restoreFromCheckpoint(String sessionId, String checkpointId) {
        return blocking(() -> {
            String key = primaryKey(sessionId, checkpointId);
            byte[] raw = inTransaction(sessionId, checkpointId,
                    () -> store.read(tx -> tx.get(CHECKPOINT_BUCKET, key)))
                    .orElseThrow(() -> new CheckpointNotFoundException(sessionId, checkpointId));

            DecodedCheckpoint decoded = decode(raw, sessionId, checkpointId);
            Materialized materialized = materialize(sessionId, decoded);
            WorkflowSession session = materialized.state().toSession(materialized.stageResults(),
                    decoded.checkpoint().toRef(), clock.instant(), sessionId);

            if (metrics != null) {
                metrics.recordCheckpointRestored(decoded.isLegacy());
            }
            return session;
        })
                .doOnSuccess(session -> log.info("Restored session {} from checkpoint {}: status={}, currentStage={}",
                        sessionId, checkpointId, session.getStatus(), session.getCurrentStage()))
                .doOnError(e -> log.error("Failed to restore session {} from checkpoint {}",
                        sessionId, checkpointId, e));
    }

    /**
     * Resolves a checkpoint to a full state, walking delta parents back to a full snapshot
     * and applying the deltas forward.
     */
    private Materialized materialize(String sessionId, DecodedCheckpoint decoded) {
        Deque<DecodedCheckpoint> deltas = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        DecodedCheckpoint current = decoded;
        visited.add(current.checkpoint().id());

        while (current.checkpoint().sessionState() instanceof SessionStateDelta) {
            deltas.push(current);
            String parentId = current.envelope() != null
                    ? current.envelope().metadataValue(CheckpointEnvelope.META_PARENT_CHECKPOINT)
                    : null;
            if (parentId == null || !visited.add(parentId)) {
                throw new CheckpointStorageException("Incremental checkpoint has no resolvable parent",
                        sessionId, current.checkpoint().id());
            }
            current = readById(sessionId, parentId);
        }

        FullSessionState state = SessionStateMigrator.toCurrent(current.checkpoint().sessionState(), clock.instant());
        Map<String, Object> stageResults = new LinkedHashMap<>(current.checkpoint().stageResults());
        while (!deltas.isEmpty()) {
            WorkflowCheckpoint delta = deltas.pop().checkpoint();
            state = state.apply((SessionStateDelta) delta.sessionState());
            stageResults.putAll(delta.stageResults());
        }
        return new Materialized(state, stageResults);
    }

    private DecodedCheckpoint readById(String sessionId, String checkpointId) {
        byte[] raw = inTransaction(sessionId, checkpointId, () -> store.read(tx -> tx.get(INDEX_BUCKET, checkpointId)
                .map(key -> new String(key, StandardCharsets.UTF_8))
                .flatMap(key -> tx.get(CHECKPOINT_BUCKET, key))))
                .orElseThrow(() -> new CheckpointNotFoundException(sessionId, checkpointId));
        return decode(raw, sessionId, checkpointId);
    }

    // ==================== Query ====================

    @Override
    public Flux<WorkflowCheckpoint> listCheckpoints(String sessionId) {
        return blocking(() -> loadSession(sessionId))
                .flatMapMany(Flux::fromIterable)
                .map(DecodedCheckpoint::checkpoint);
    }

    @Override
    public Mono<WorkflowCheckpoint> getLatestCheckpoint(String sessionId) {
        return listCheckpoints(sessionId)
                .next()
                .switchIfEmpty(Mono.error(() -> new CheckpointNotFoundException(sessionId, null)));
    }

    @Override
    public Mono<CheckpointMetrics> getCheckpointMetrics() {
        return blocking(() -> {
            Map<String, Integer> sessionCounts = new LinkedHashMap<>();
            Map<String, Integer> stageCounts = new LinkedHashMap<>();
            Instant last = null;
            List<Stored> all = loadAll();
            for (Stored stored : all) {
                WorkflowCheckpoint checkpoint = stored.decoded().checkpoint();
                sessionCounts.merge(stored.sessionId(), 1, Integer::sum);
                if (checkpoint.stageName() != null) {
                    stageCounts.merge(checkpoint.stageName(), 1, Integer::sum);
                }
                if (checkpoint.timestamp() != null && (last == null || checkpoint.timestamp().isAfter(last))) {
                    last = checkpoint.timestamp();
                }
            }
            return new CheckpointMetrics(all.size(), sessionCounts, stageCounts, last);
        });
    }

    @Override
    public Flux<String> findSessionIds() {
        return blocking(() -> {
            Set<String> sessionIds = new LinkedHashSet<>();
            loadAll().forEach(stored -> sessionIds.add(stored.sessionId()));
            return new ArrayList<>(sessionIds);
        }).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return blocking(() -> store.read(tx -> tx.get(INDEX_BUCKET, "__health_check__")))
                .map(ignored -> true)
                .onErrorResume(e -> {
                    log.warn("Checkpoint store health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    // ==================== Delete ====================

    @Override
    public Mono<Void> deleteCheckpoint(String checkpointId) {
        return blocking(() -> inTransaction(null, checkpointId, () -> store.write(tx -> {
            Optional<String> indexed = tx.get(INDEX_BUCKET, checkpointId)
                    .map(key -> new String(key, StandardCharsets.UTF_8));
            if (indexed.isPresent()) {
                tx.delete(INDEX_BUCKET, checkpointId);
                if (tx.delete(CHECKPOINT_BUCKET, indexed.get())) {
                    return indexed.get();
                }
            }
            // records written without an index entry
            String suffix = KEY_SEPARATOR + checkpointId;
            for (KeyValue entry : tx.scan(CHECKPOINT_BUCKET, "")) {
                if (entry.key().endsWith(suffix)) {
                    tx.delete(CHECKPOINT_BUCKET, entry.key());
                    return entry.key();
                }
            }
            throw new CheckpointNotFoundException(null, checkpointId);
        })))
                .doOnSuccess(key -> {
                    log.info("Deleted checkpoint {} (key {})", checkpointId, key);
                    if (metrics != null) {
                        metrics.recordCheckpointsDeleted("manual", 1);
                    }
                })
                .then();
    }

    @Override
    public Mono<Integer> deleteSessionCheckpoints(String sessionId) {
        return blocking(() -> inTransaction(sessionId, null, () -> store.write(tx -> {
            int deleted = 0;
            for (KeyValue entry : tx.scan(CHECKPOINT_BUCKET, sessionPrefix(sessionId))) {
                Optional<DecodedCheckpoint> readable = decodeForScan(entry);
                if (readable.isEmpty() || !belongsTo(readable.get(), sessionId)) {
                    continue;
                }
                DecodedCheckpoint decoded = readable.get();
                tx.delete(CHECKPOINT_BUCKET, entry.key());
                tx.delete(INDEX_BUCKET, decoded.checkpoint().id());
                deleted++;
            }
            return deleted;
        })))
                .doOnSuccess(count -> {
                    log.info("Deleted {} checkpoints for session {}", count, sessionId);
                    if (metrics != null) {
                        metrics.recordCheckpointsDeleted("session", count);
                    }
                });
    }

    @Override
    public Mono<Integer> cleanupExpiredCheckpoints(Duration maxAge) {
        return blocking(() -> {
            Instant cutoff = clock.instant().minus(maxAge);
            List<Stored> expired = loadAll().stream()
                    .filter(stored -> stored.decoded().checkpoint().timestamp() != null
                            && stored.decoded().checkpoint().timestamp().isBefore(cutoff))
                    .toList();
            if (expired.isEmpty()) {
                return 0;
            }

            int deleted = inTransaction(null, null, () -> store.write(tx -> {
                int count = 0;
                for (Stored stored : expired) {
                    try {
                        tx.delete(CHECKPOINT_BUCKET, stored.key());
                        tx.delete(INDEX_BUCKET, stored.decoded().checkpoint().id());
                        count++;
                    } catch (RuntimeException e) {
                        log.warn("Failed to delete expired checkpoint {}: {}", stored.key(), e.getMessage());
                    }
                }
                return count;
            }));
            log.info("Cleaned up {} of {} expired checkpoints older than {}", deleted, expired.size(), cutoff);
            if (metrics != null) {
                metrics.recordCheckpointsDeleted("expired", deleted);
            }
            return deleted;
        });
    }

    // ==================== Helpers ====================

    /**
     * Scans a session's checkpoints without checksum verification, skipping unreadable records.
     * Integrity is enforced when a checkpoint is restored or used as an incremental parent.
     */
    private List<DecodedCheckpoint> loadSession(String sessionId) {
        List<KeyValue> entries = inTransaction(sessionId, null,
                () -> store.read(tx -> tx.scan(CHECKPOINT_BUCKET, sessionPrefix(sessionId))));
        List<DecodedCheckpoint> result = new ArrayList<>();
        for (KeyValue entry : entries) {
            decodeForScan(entry)
                    .filter(decoded -> belongsTo(decoded, sessionId))
                    .ifPresent(result::add);
        }
        result.sort(Comparator.comparing((DecodedCheckpoint d) -> d.checkpoint().timestamp(),
                Comparator.nullsFirst(Comparator.naturalOrder())).reversed());
        return result;
    }

    private List<Stored> loadAll() {
        List<KeyValue> entries = inTransaction(null, null, () -> store.read(tx -> tx.scan(CHECKPOINT_BUCKET, "")));
        List<Stored> result = new ArrayList<>(entries.size());
        for (KeyValue entry : entries) {
            decodeForScan(entry).ifPresent(decoded ->
                    result.add(new Stored(entry.key(), sessionIdOf(entry.key(), decoded), decoded)));
        }
        return result;
    }

    private Optional<DecodedCheckpoint> decodeForScan(KeyValue entry) {
        try {
            return Optional.of(codec.decode(entry.value()));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Skipping unreadable checkpoint record {}: {}", entry.key(), e.getMessage());
            if (metrics != null) {
                metrics.recordUnreadableRecord();
            }
            return Optional.empty();
        }
    }

    private DecodedCheckpoint decode(byte[] raw, String sessionId, String checkpointId) {
        DecodedCheckpoint decoded;
        try {
            decoded = codec.decode(raw);
        } catch (IOException e) {
            throw new CheckpointStorageException("Failed to decode checkpoint record", sessionId, checkpointId, e);
        }
        return verify(decoded, sessionId, checkpointId);
    }

    private DecodedCheckpoint verify(DecodedCheckpoint decoded, String sessionId, String checkpointId) {
        if (!decoded.checksumValid()) {
            String id = decoded.checkpoint().id() != null ? decoded.checkpoint().id() : checkpointId;
            if (metrics != null) {
                metrics.recordIntegrityFailure(integrityMode);
            }
            if (integrityMode == IntegrityMode.STRICT) {
                throw new CheckpointIntegrityException(sessionId, id,
                        decoded.envelope().checksum(), decoded.actualChecksum());
            }
            log.warn("Checksum mismatch for checkpoint {} of session {}, continuing with best-effort restore",
                    id, sessionId);
        }
        return decoded;
    }

    private boolean belongsTo(DecodedCheckpoint decoded, String sessionId) {
        String owner = decoded.envelope() != null
                ? decoded.envelope().metadataValue(CheckpointEnvelope.META_SESSION_ID)
                : null;
        if (owner == null) {
            owner = decoded.checkpoint().sessionId();
        }
        return owner == null || owner.equals(sessionId);
    }

    private String sessionIdOf(String key, DecodedCheckpoint decoded) {
        if (decoded.envelope() != null) {
            String owner = decoded.envelope().metadataValue(CheckpointEnvelope.META_SESSION_ID);
            if (owner != null) {
                return owner;
            }
        }
        if (decoded.checkpoint().sessionId() != null) {
            return decoded.checkpoint().sessionId();
        }
        String checkpointId = decoded.checkpoint().id();
        if (checkpointId != null && key.endsWith(KEY_SEPARATOR + checkpointId)) {
            return key.substring(0, key.length() - checkpointId.length() - KEY_SEPARATOR.length());
        }
        return key;
    }

    private static String primaryKey(String sessionId, String checkpointId) {
        return sessionId + KEY_SEPARATOR + checkpointId;
    }

    private static String sessionPrefix(String sessionId) {
        return sessionId + KEY_SEPARATOR;
    }

    private <T> T inTransaction(String sessionId, String checkpointId, Callable<T> action) {
        try {
            return action.call();
        } catch (CheckpointException e) {
            throw e;
        } catch (Exception e) {
            throw new CheckpointStorageException("Checkpoint store transaction failed: " + e.getMessage(),
                    sessionId, checkpointId, e);
        }
    }

    private static <T> Mono<T> blocking(Callable<T> action) {
        return Mono.fromCallable(action).subscribeOn(Schedulers.boundedElastic());
    }

    private record Materialized(FullSessionState state, Map<String, Object> stageResults) {
    }

    private record Stored(String key, String sessionId, DecodedCheckpoint decoded) {
    }
}
