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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.pipeline.error.WorkflowError;
import org.fireflyframework.pipeline.exception.CheckpointIntegrityException;
import org.fireflyframework.pipeline.exception.CheckpointNotFoundException;
import org.fireflyframework.pipeline.exception.CheckpointStorageException;
import org.fireflyframework.pipeline.kv.InMemoryKeyValueStore;
import org.fireflyframework.pipeline.metrics.PipelineMetrics;
import org.fireflyframework.pipeline.model.StageDefinition;
import org.fireflyframework.pipeline.model.WorkflowSession;
import org.fireflyframework.pipeline.model.WorkflowSpec;
import org.fireflyframework.pipeline.model.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KeyValueCheckpointStore} backed by {@link InMemoryKeyValueStore}.
 */
class KeyValueCheckpointStoreTest {

    private static final String SESSION_ID = "session-1";
    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");
    private static final WorkflowSpec SPEC = new WorkflowSpec("containerize", "1.0", List.of(
            StageDefinition.of("analyze", "analyze_repository"),
            StageDefinition.of("dockerfile", "generate_dockerfile", "analyze"),
            StageDefinition.of("build", "build_image", "dockerfile")), Map.of());

    private InMemoryKeyValueStore kv;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private KeyValueCheckpointStore store;

    @BeforeEach
    void setUp() {
        kv = new InMemoryKeyValueStore();
        clock = new MutableClock(START);
        meterRegistry = new SimpleMeterRegistry();
        store = newStore(true, IntegrityMode.BEST_EFFORT);
    }

    private KeyValueCheckpointStore newStore(boolean compression, IntegrityMode mode) {
        return new KeyValueCheckpointStore(kv, new CheckpointCodec(compression), mode, clock,
                new PipelineMetrics(meterRegistry));
    }

    private static WorkflowSession runningSession(String sessionId) {
        WorkflowSession session = WorkflowSession.create(sessionId, "wf-1", "containerize");
        session.start();
        session.startStage("analyze");
        session.completeStage("analyze", Map.of("language", "java", "port", 8080));
        session.startStage("dockerfile");
        session.putContext("registry", "registry.local");
        session.bindResource("repository", "/src/app");
        return session;
    }

    private WorkflowCheckpoint checkpoint(WorkflowSession session, String stage) {
        WorkflowCheckpoint checkpoint = store.createCheckpoint(session, stage, "at " + stage, SPEC).block();
        clock.advance(Duration.ofMinutes(1));
        return checkpoint;
    }

    private byte[] rawRecord(String sessionId, String checkpointId) {
        return kv.read(tx -> tx.get(KeyValueCheckpointStore.CHECKPOINT_BUCKET, sessionId + "_" + checkpointId))
                .orElseThrow();
    }

    private static void assertSameState(WorkflowSession actual, WorkflowSession expected) {
        assertThat(actual.getSessionId()).isEqualTo(expected.getSessionId());
        assertThat(actual.getWorkflowId()).isEqualTo(expected.getWorkflowId());
        assertThat(actual.getWorkflowName()).isEqualTo(expected.getWorkflowName());
        assertThat(actual.getStatus()).isEqualTo(expected.getStatus());
        assertThat(actual.getCurrentStage()).isEqualTo(expected.getCurrentStage());
        assertThat(actual.getCompletedStages()).containsExactlyInAnyOrderElementsOf(expected.getCompletedStages());
        assertThat(actual.getFailedStages()).containsExactlyInAnyOrderElementsOf(expected.getFailedStages());
        assertThat(actual.getSkippedStages()).containsExactlyInAnyOrderElementsOf(expected.getSkippedStages());
        assertThat(actual.getStageResults()).isEqualTo(expected.getStageResults());
        assertThat(actual.getSharedContext()).isEqualTo(expected.getSharedContext());
        assertThat(actual.getResourceBindings()).isEqualTo(expected.getResourceBindings());
        assertThat(actual.getErrors()).extracting(WorkflowError::errorType)
                .containsExactlyElementsOf(expected.getErrors().stream().map(WorkflowError::errorType).toList());
    }

    // ========================================================================
    // Create and restore
    // ========================================================================

    @Nested
    @DisplayName("Create and restore")
    class CreateAndRestore {

        @Test
        @DisplayName("Restores the session captured by a full checkpoint")
        void shouldRestoreFullCheckpoint() {
            WorkflowSession session = runningSession(SESSION_ID);
            WorkflowCheckpoint checkpoint = checkpoint(session, "dockerfile");

            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, checkpoint.id()))
                    .assertNext(restored -> {
                        assertSameState(restored, session);
                        assertThat(restored.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
                        assertThat(restored.getCurrentStage()).isEqualTo("dockerfile");
                        assertThat(restored.getCheckpoints()).extracting(ref -> ref.checkpointId())
                                .containsExactly(checkpoint.id());
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Records the checkpoint on the live session")
        void shouldRecordCheckpointOnSession() {
            WorkflowSession session = runningSession(SESSION_ID);
            WorkflowCheckpoint checkpoint = checkpoint(session, "dockerfile");

            assertThat(session.getCheckpoints()).hasSize(1);
            assertThat(session.getCheckpoints().get(0).checkpointId()).isEqualTo(checkpoint.id());
            assertThat(checkpoint.timestamp()).isEqualTo(START);
            assertThat(checkpoint.workflowSpec()).isEqualTo(SPEC);
        }

        @Test
        @DisplayName("Compressed payloads are always smaller than the original")
        void compressedPayloadIsSmaller() throws Exception {
            WorkflowSession session = runningSession(SESSION_ID);
            session.putContext("build_log", "Step 1/12 : FROM eclipse-temurin:17\n".repeat(200));
            WorkflowCheckpoint checkpoint = checkpoint(session, "build");

            CheckpointCodec.DecodedCheckpoint decoded = new CheckpointCodec(true)
                    .decode(rawRecord(SESSION_ID, checkpoint.id()));

            assertThat(decoded.envelope().compressed()).isTrue();
            assertThat(decoded.envelope().data().length).isLessThan(decoded.envelope().dataSize());
            assertThat(decoded.envelope().metadataValue(CheckpointEnvelope.META_COMPRESSION_MODE)).isEqualTo("gzip");
            assertThat(decoded.envelope().metadataValue(CheckpointEnvelope.META_SESSION_ID)).isEqualTo(SESSION_ID);
            assertThat(decoded.checksumValid()).isTrue();
        }

        @Test
        @DisplayName("Compression can be disabled")
        void shouldStoreUncompressed() throws Exception {
            store = newStore(false, IntegrityMode.BEST_EFFORT);
            WorkflowSession session = runningSession(SESSION_ID);
            session.putContext("build_log", "x".repeat(5000));
            WorkflowCheckpoint checkpoint = checkpoint(session, "build");

            CheckpointCodec.DecodedCheckpoint decoded = new CheckpointCodec(false)
                    .decode(rawRecord(SESSION_ID, checkpoint.id()));

            assertThat(decoded.envelope().compressed()).isFalse();
            assertThat(decoded.envelope().data().length).isEqualTo(decoded.envelope().dataSize());
            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, checkpoint.id()))
                    .assertNext(restored -> assertSameState(restored, session))
                    .verifyComplete();
        }

        @Test
        void restoringUnknownCheckpointFails() {
            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, "missing"))
                    .expectError(CheckpointNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Errors recorded on the session survive a round trip")
        void shouldRestoreErrors() {
            WorkflowSession session = runningSession(SESSION_ID);
            session.failStage("dockerfile", WorkflowError.of("dockerfile", "generate_dockerfile",
                    "template_error", "no template for language"));
            WorkflowCheckpoint checkpoint = checkpoint(session, "dockerfile");

            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, checkpoint.id()))
                    .assertNext(restored -> {
                        assertThat(restored.getFailedStages()).containsExactly("dockerfile");
                        assertThat(restored.getErrors()).singleElement()
                                .satisfies(error -> assertThat(error.message()).isEqualTo("no template for language"));
                    })
                    .verifyComplete();
        }
    }

    // ========================================================================
    // Incremental checkpoints
    // ========================================================================

    @Nested
    @DisplayName("Incremental checkpoints")
    class Incremental {

        @Test
        @DisplayName("Without a previous checkpoint a full checkpoint is written")
        void firstIncrementalIsFull() {
            WorkflowSession session = runningSession(SESSION_ID);

            WorkflowCheckpoint checkpoint = store.createIncrementalCheckpoint(session, "dockerfile", "first", SPEC)
                    .block();

            assertThat(checkpoint.isIncremental()).isFalse();
            assertThat(checkpoint.sessionState()).isInstanceOf(FullSessionState.class);
        }

        @Test
        @DisplayName("A delta chain restores to the same state as a full checkpoint")
        void deltaChainMatchesFullCheckpoint() {
            WorkflowSession session = runningSession(SESSION_ID);
            checkpoint(session, "dockerfile");

            session.completeStage("dockerfile", Map.of("path", "Dockerfile"));
            session.startStage("build");
            WorkflowCheckpoint first = store.createIncrementalCheckpoint(session, "build", "building", SPEC).block();
            clock.advance(Duration.ofMinutes(1));

            session.completeStage("build", Map.of("image", "app:1.0"));
            session.bindResource("image", "registry.local/app:1.0");
            session.putContext("registry", "registry.prod");
            WorkflowCheckpoint second = store.createIncrementalCheckpoint(session, "build", "built", SPEC).block();
            clock.advance(Duration.ofMinutes(1));

            WorkflowCheckpoint full = checkpoint(session, "build");

            assertThat(first.isIncremental()).isTrue();
            assertThat(second.isIncremental()).isTrue();
            assertThat(second.stageResults()).containsOnlyKeys("build");

            WorkflowSession fromDelta = store.restoreFromCheckpoint(SESSION_ID, second.id()).block();
            WorkflowSession fromFull = store.restoreFromCheckpoint(SESSION_ID, full.id()).block();
            assertSameState(fromDelta, fromFull);
            assertSameState(fromDelta, session);
        }

        @Test
        @DisplayName("Incremental metadata links to the parent checkpoint")
        void shouldLinkParent() throws Exception {
            WorkflowSession session = runningSession(SESSION_ID);
            WorkflowCheckpoint parent = checkpoint(session, "dockerfile");
            session.completeStage("dockerfile", Map.of("path", "Dockerfile"));
            WorkflowCheckpoint child = store.createIncrementalCheckpoint(session, "build", "delta", SPEC).block();

            CheckpointEnvelope envelope = new CheckpointCodec(true).decode(rawRecord(SESSION_ID, child.id())).envelope();

            assertThat(envelope.metadataValue(CheckpointEnvelope.META_INCREMENTAL)).isEqualTo("true");
            assertThat(envelope.metadataValue(CheckpointEnvelope.META_PARENT_CHECKPOINT)).isEqualTo(parent.id());
        }
    }

    // ========================================================================
    // Integrity
    // ========================================================================

    @Nested
    @DisplayName("Integrity verification")
    class Integrity {

        private String tamperedCheckpointId() throws Exception {
            WorkflowCheckpoint checkpoint = checkpoint(runningSession(SESSION_ID), "dockerfile");
            tamper(checkpoint.id());
            return checkpoint.id();
        }

        private void tamper(String checkpointId) throws Exception {
            ObjectMapper mapper = new ObjectMapper();
            ObjectNode record = (ObjectNode) mapper.readTree(rawRecord(SESSION_ID, checkpointId));
            record.put("checksum", "0000");
            byte[] tampered = mapper.writeValueAsBytes(record);
            kv.write(tx -> {
                tx.put(KeyValueCheckpointStore.CHECKPOINT_BUCKET, SESSION_ID + "_" + checkpointId, tampered);
                return null;
            });
        }

        @Test
        @DisplayName("Strict mode rejects a checksum mismatch")
        void strictModeRejects() throws Exception {
            store = newStore(true, IntegrityMode.STRICT);
            String checkpointId = tamperedCheckpointId();

            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, checkpointId))
                    .expectError(CheckpointIntegrityException.class)
                    .verify();
            assertThat(meterRegistry.counter("firefly.pipeline.checkpoint.integrity.failures", "mode", "strict")
                    .count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Best-effort mode restores despite a checksum mismatch")
        void bestEffortModeRestores() throws Exception {
            String checkpointId = tamperedCheckpointId();

            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, checkpointId))
                    .assertNext(restored -> assertThat(restored.getCurrentStage()).isEqualTo("dockerfile"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Strict mode still lists and extends a session whose older checkpoint is tampered")
        void strictModeIgnoresTamperedOlderCheckpoint() throws Exception {
            store = newStore(true, IntegrityMode.STRICT);
            WorkflowSession session = runningSession(SESSION_ID);
            WorkflowCheckpoint older = checkpoint(session, "analyze");
            WorkflowCheckpoint newest = checkpoint(session, "dockerfile");
            tamper(older.id());

            StepVerifier.create(store.listCheckpoints(SESSION_ID).map(WorkflowCheckpoint::id).collectList())
                    .assertNext(ids -> assertThat(ids).containsExactly(newest.id(), older.id()))
                    .verifyComplete();
            StepVerifier.create(store.getLatestCheckpoint(SESSION_ID))
                    .assertNext(latest -> assertThat(latest.id()).isEqualTo(newest.id()))
                    .verifyComplete();

            session.completeStage("dockerfile", Map.of("path", "Dockerfile"));
            StepVerifier.create(store.createIncrementalCheckpoint(session, "build", "delta", SPEC))
                    .assertNext(delta -> assertThat(delta.isIncremental()).isTrue())
                    .verifyComplete();
            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, newest.id()))
                    .assertNext(restored -> assertThat(restored.getCurrentStage()).isEqualTo("dockerfile"))
                    .verifyComplete();
            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, older.id()))
                    .expectError(CheckpointIntegrityException.class)
                    .verify();
        }

        @Test
        @DisplayName("Strict mode refuses to extend a tampered latest checkpoint")
        void strictModeRejectsTamperedParent() throws Exception {
            store = newStore(true, IntegrityMode.STRICT);
            WorkflowSession session = runningSession(SESSION_ID);
            WorkflowCheckpoint latest = checkpoint(session, "dockerfile");
            tamper(latest.id());

            StepVerifier.create(store.createIncrementalCheckpoint(session, "build", "delta", SPEC))
                    .expectError(CheckpointIntegrityException.class)
                    .verify();
        }
    }

    // ========================================================================
    // Unreadable records
    // ========================================================================

    @Nested
    @DisplayName("Unreadable records")
    class UnreadableRecords {

        private WorkflowCheckpoint first;
        private WorkflowCheckpoint second;

        @BeforeEach
        void storeGarbageBesideValidCheckpoints() {
            WorkflowSession session = runningSession(SESSION_ID);
            first = checkpoint(session, "analyze");
            second = checkpoint(session, "dockerfile");
            kv.write(tx -> {
                tx.put(KeyValueCheckpointStore.CHECKPOINT_BUCKET, SESSION_ID + "_garbage",
                        "not json".getBytes(StandardCharsets.UTF_8));
                return null;
            });
        }

        @Test
        @DisplayName("Listing skips records that cannot be decoded")
        void listingSkipsUnreadable() {
            StepVerifier.create(store.listCheckpoints(SESSION_ID).map(WorkflowCheckpoint::id).collectList())
                    .assertNext(ids -> assertThat(ids).containsExactly(second.id(), first.id()))
                    .verifyComplete();
            StepVerifier.create(store.getLatestCheckpoint(SESSION_ID))
                    .assertNext(latest -> assertThat(latest.id()).isEqualTo(second.id()))
                    .verifyComplete();
            assertThat(meterRegistry.counter("firefly.pipeline.checkpoint.unreadable").count()).isGreaterThan(0);
        }

        @Test
        @DisplayName("Cleanup removes expired checkpoints and leaves the unreadable record in place")
        void cleanupSkipsUnreadable() {
            clock.advance(Duration.ofHours(1));

            StepVerifier.create(store.cleanupExpiredCheckpoints(Duration.ofMinutes(30)))
                    .expectNext(2)
                    .verifyComplete();
            assertThat(kv.<Optional<byte[]>>read(tx -> tx.get(KeyValueCheckpointStore.CHECKPOINT_BUCKET, SESSION_ID + "_garbage")))
                    .isPresent();
        }

        @Test
        @DisplayName("Metrics and session discovery count only readable checkpoints")
        void metricsSkipUnreadable() {
            StepVerifier.create(store.getCheckpointMetrics())
                    .assertNext(metrics -> {
                        assertThat(metrics.totalCheckpoints()).isEqualTo(2);
                        assertThat(metrics.sessionCounts()).containsOnlyKeys(SESSION_ID);
                    })
                    .verifyComplete();
            StepVerifier.create(store.findSessionIds())
                    .expectNext(SESSION_ID)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Session deletion removes the readable checkpoints")
        void sessionDeletionSkipsUnreadable() {
            StepVerifier.create(store.deleteSessionCheckpoints(SESSION_ID))
                    .expectNext(2)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Restoring the unreadable record by id still fails")
        void restoringUnreadableRecordFails() {
            StepVerifier.create(store.restoreFromCheckpoint(SESSION_ID, "garbage"))
                    .expectError(CheckpointStorageException.class)
                    .verify();
        }
    }

    // ========================================================================
    // Legacy records
    // ========================================================================

    @Test
    @DisplayName("Restores unwrapped records written before envelopes existed")
    void shouldRestoreLegacyRecord() {
        String legacy = """
                {
                  "id": "cp-legacy",
                  "stage_name": "build",
                  "timestamp": "2024-11-02T08:00:00Z",
                  "session_state": {
                    "session_id": "legacy-session",
                    "workflow_name": "containerize",
                    "status": "running",
                    "current_stage": "build",
                    "completed_stages": ["analyze", "dockerfile"],
                    "shared_context": {"registry": "registry.local"},
                    "start_time": "2024-11-02T07:00:00Z"
                  },
                  "stage_results": {"analyze": {"language": "go"}},
                  "message": "written by an older version"
                }
                """;
        kv.write(tx -> {
            tx.put(KeyValueCheckpointStore.CHECKPOINT_BUCKET, "legacy-session_cp-legacy",
                    legacy.getBytes(StandardCharsets.UTF_8));
            return null;
        });

        StepVerifier.create(store.restoreFromCheckpoint("legacy-session", "cp-legacy"))
                .assertNext(restored -> {
                    assertThat(restored.getSessionId()).isEqualTo("legacy-session");
                    assertThat(restored.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
                    assertThat(restored.getCompletedStages()).containsExactly("analyze", "dockerfile");
                    assertThat(restored.getSharedContext()).containsEntry("registry", "registry.local");
                    assertThat(restored.getStageResults()).containsKey("analyze");
                    assertThat(restored.getStartTime()).isEqualTo(Instant.parse("2024-11-02T07:00:00Z"));
                    assertThat(restored.getLastActivity()).isEqualTo(START);
                })
                .verifyComplete();
        assertThat(meterRegistry.counter("firefly.pipeline.checkpoint.restored", "format", "legacy").count())
                .isEqualTo(1.0);
    }

    // ========================================================================
    // Listing and deletion
    // ========================================================================

    @Nested
    @DisplayName("Listing and deletion")
    class ListingAndDeletion {

        @Test
        @DisplayName("Lists only the session's checkpoints, newest first")
        void shouldListNewestFirst() {
            WorkflowSession session = runningSession(SESSION_ID);
            WorkflowCheckpoint first = checkpoint(session, "analyze");
            WorkflowCheckpoint second = checkpoint(session, "dockerfile");
            checkpoint(runningSession(SESSION_ID + "_other"), "analyze");

            StepVerifier.create(store.listCheckpoints(SESSION_ID).map(WorkflowCheckpoint::id).collectList())
                    .assertNext(ids -> assertThat(ids).containsExactly(second.id(), first.id()))
                    .verifyComplete();
            StepVerifier.create(store.getLatestCheckpoint(SESSION_ID))
                    .assertNext(latest -> assertThat(latest.id()).isEqualTo(second.id()))
                    .verifyComplete();
        }

        @Test
        void latestCheckpointOfUnknownSessionFails() {
            StepVerifier.create(store.getLatestCheckpoint("nobody"))
                    .expectError(CheckpointNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Deletes by id when the session id contains the key separator")
        void shouldDeleteBySeparatorContainingSession() {
            WorkflowCheckpoint team = checkpoint(runningSession("team"), "analyze");
            WorkflowCheckpoint teamA = checkpoint(runningSession("team_a"), "analyze");

            StepVerifier.create(store.deleteCheckpoint(teamA.id())).verifyComplete();

            StepVerifier.create(store.listCheckpoints("team_a")).verifyComplete();
            StepVerifier.create(store.listCheckpoints("team").map(WorkflowCheckpoint::id))
                    .expectNext(team.id())
                    .verifyComplete();
            assertThat(kv.<Optional<byte[]>>read(tx -> tx.get(KeyValueCheckpointStore.INDEX_BUCKET, teamA.id()))).isEmpty();
        }

        @Test
        @DisplayName("Deletes unindexed records by suffix")
        void shouldDeleteUnindexedRecord() {
            WorkflowCheckpoint checkpoint = checkpoint(runningSession(SESSION_ID), "analyze");
            kv.write(tx -> tx.delete(KeyValueCheckpointStore.INDEX_BUCKET, checkpoint.id()));

            StepVerifier.create(store.deleteCheckpoint(checkpoint.id())).verifyComplete();
            StepVerifier.create(store.listCheckpoints(SESSION_ID)).verifyComplete();
        }

        @Test
        void deletingUnknownCheckpointFails() {
            StepVerifier.create(store.deleteCheckpoint("missing"))
                    .expectError(CheckpointNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Deletes every checkpoint of one session only")
        void shouldDeleteSessionCheckpoints() {
            WorkflowSession session = runningSession("team");
            WorkflowCheckpoint first = checkpoint(session, "analyze");
            checkpoint(session, "dockerfile");
            WorkflowCheckpoint other = checkpoint(runningSession("team_a"), "analyze");

            StepVerifier.create(store.deleteSessionCheckpoints("team"))
                    .expectNext(2)
                    .verifyComplete();

            StepVerifier.create(store.listCheckpoints("team")).verifyComplete();
            StepVerifier.create(store.listCheckpoints("team_a").map(WorkflowCheckpoint::id))
                    .expectNext(other.id())
                    .verifyComplete();
            assertThat(kv.<Optional<byte[]>>read(tx -> tx.get(KeyValueCheckpointStore.INDEX_BUCKET, first.id()))).isEmpty();
        }
    }

    // ========================================================================
    // Expiry and metrics
    // ========================================================================

    @Nested
    @DisplayName("Expiry and metrics")
    class ExpiryAndMetrics {

        @Test
        @DisplayName("Removes exactly the checkpoints strictly older than the cutoff")
        void shouldCleanupStrictlyOlder() {
            WorkflowSession session = runningSession(SESSION_ID);
            WorkflowCheckpoint old = store.createCheckpoint(session, "analyze", "old", SPEC).block();
            clock.advance(Duration.ofHours(2));
            WorkflowCheckpoint recent = store.createCheckpoint(session, "dockerfile", "recent", SPEC).block();
            clock.advance(Duration.ofHours(1));

            // cutoff equals the old checkpoint's timestamp, nothing is strictly older
            StepVerifier.create(store.cleanupExpiredCheckpoints(Duration.ofHours(3)))
                    .expectNext(0)
                    .verifyComplete();

            StepVerifier.create(store.cleanupExpiredCheckpoints(Duration.ofHours(2)))
                    .expectNext(1)
                    .verifyComplete();

            StepVerifier.create(store.listCheckpoints(SESSION_ID).map(WorkflowCheckpoint::id))
                    .expectNext(recent.id())
                    .verifyComplete();
            assertThat(kv.<Optional<byte[]>>read(tx -> tx.get(KeyValueCheckpointStore.INDEX_BUCKET, old.id()))).isEmpty();
        }

        @Test
        @DisplayName("Reports totals per session and per stage")
        void shouldReportMetrics() {
            WorkflowSession session = runningSession("team_a");
            checkpoint(session, "analyze");
            checkpoint(session, "dockerfile");
            checkpoint(runningSession("team"), "analyze");

            StepVerifier.create(store.getCheckpointMetrics())
                    .assertNext(metrics -> {
                        assertThat(metrics.totalCheckpoints()).isEqualTo(3);
                        assertThat(metrics.sessionCounts()).containsEntry("team_a", 2).containsEntry("team", 1);
                        assertThat(metrics.stageCounts()).containsEntry("analyze", 2).containsEntry("dockerfile", 1);
                        assertThat(metrics.lastCheckpoint()).isEqualTo(START.plus(Duration.ofMinutes(2)));
                    })
                    .verifyComplete();
            StepVerifier.create(store.findSessionIds().collectList())
                    .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder("team", "team_a"))
                    .verifyComplete();
        }

        @Test
        void shouldReportHealthy() {
            StepVerifier.create(store.isHealthy())
                    .expectNext(true)
                    .verifyComplete();
        }
    }
}
