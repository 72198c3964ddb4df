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

import org.fireflyframework.pipeline.checkpoint.CheckpointCodec;
import org.fireflyframework.pipeline.checkpoint.CheckpointStore;
import org.fireflyframework.pipeline.checkpoint.IntegrityMode;
import org.fireflyframework.pipeline.checkpoint.KeyValueCheckpointStore;
import org.fireflyframework.pipeline.checkpoint.WorkflowCheckpoint;
import org.fireflyframework.pipeline.exception.CheckpointNotFoundException;
import org.fireflyframework.pipeline.kv.InMemoryKeyValueStore;
import org.fireflyframework.pipeline.model.StageDefinition;
import org.fireflyframework.pipeline.model.WorkflowSession;
import org.fireflyframework.pipeline.model.WorkflowSpec;
import org.fireflyframework.pipeline.model.WorkflowStatus;
import org.fireflyframework.pipeline.session.SessionManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CheckpointRecoveryService}.
 */
@ExtendWith(MockitoExtension.class)
class CheckpointRecoveryServiceTest {

    @Mock
    private CheckpointStore checkpointStore;

    @Mock
    private SessionManager sessionManager;

    private static WorkflowCheckpoint latest(String sessionId, String checkpointId) {
        return new WorkflowCheckpoint(checkpointId, sessionId, "wf-1", "build", Instant.now(), null, null,
                Map.of(), "latest");
    }

    private static WorkflowSession session(String sessionId, WorkflowStatus status) {
        return WorkflowSession.builder()
                .sessionId(sessionId)
                .workflowName("containerize")
                .status(status)
                .currentStage("build")
                .build();
    }

    @Test
    @DisplayName("Restores resumable sessions and skips finished ones")
    void recoversResumableSessions() {
        WorkflowSession running = session("s-running", WorkflowStatus.RUNNING);
        when(checkpointStore.findSessionIds()).thenReturn(Flux.just("s-running", "s-done", "s-broken"));
        when(checkpointStore.getLatestCheckpoint("s-running")).thenReturn(Mono.just(latest("s-running", "cp-1")));
        when(checkpointStore.getLatestCheckpoint("s-done")).thenReturn(Mono.just(latest("s-done", "cp-2")));
        when(checkpointStore.getLatestCheckpoint("s-broken"))
                .thenReturn(Mono.error(new CheckpointNotFoundException("s-broken", null)));
        when(checkpointStore.restoreFromCheckpoint("s-running", "cp-1")).thenReturn(Mono.just(running));
        when(checkpointStore.restoreFromCheckpoint("s-done", "cp-2"))
                .thenReturn(Mono.just(session("s-done", WorkflowStatus.COMPLETED)));
        when(sessionManager.restoreSession(running)).thenReturn(Mono.just(running));

        CheckpointRecoveryService service = new CheckpointRecoveryService(checkpointStore, sessionManager, true);

        StepVerifier.create(service.recoverSessions())
                .assertNext(summary -> {
                    assertThat(summary.recovered()).isEqualTo(1);
                    assertThat(summary.skipped()).isEqualTo(1);
                    assertThat(summary.failed()).isEqualTo(1);
                })
                .verifyComplete();

        verify(sessionManager).restoreSession(running);
    }

    @Test
    void sessionManagerFailureCountsAsFailed() {
        WorkflowSession paused = session("s-paused", WorkflowStatus.PAUSED);
        when(checkpointStore.findSessionIds()).thenReturn(Flux.just("s-paused"));
        when(checkpointStore.getLatestCheckpoint("s-paused")).thenReturn(Mono.just(latest("s-paused", "cp-1")));
        when(checkpointStore.restoreFromCheckpoint("s-paused", "cp-1")).thenReturn(Mono.just(paused));
        when(sessionManager.restoreSession(any())).thenReturn(Mono.error(new IllegalStateException("busy")));

        CheckpointRecoveryService service = new CheckpointRecoveryService(checkpointStore, sessionManager, true);

        StepVerifier.create(service.recoverSessions())
                .assertNext(summary -> {
                    assertThat(summary.recovered()).isZero();
                    assertThat(summary.failed()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("An unreadable record does not stop recovery of the other sessions")
    void recoversPastUnreadableRecord() {
        InMemoryKeyValueStore kv = new InMemoryKeyValueStore();
        KeyValueCheckpointStore store = new KeyValueCheckpointStore(kv, new CheckpointCodec(true),
                IntegrityMode.STRICT, Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC), null);
        WorkflowSpec spec = new WorkflowSpec("containerize", "1.0",
                List.of(StageDefinition.of("build", "build_image")), Map.of());
        for (String sessionId : List.of("s-1", "s-2")) {
            WorkflowSession session = WorkflowSession.create(sessionId, "wf-1", "containerize");
            session.start();
            session.startStage("build");
            store.createCheckpoint(session, "build", "before build", spec).block();
        }
        kv.write(tx -> {
            tx.put(KeyValueCheckpointStore.CHECKPOINT_BUCKET, "s-1_garbage", "not json".getBytes(StandardCharsets.UTF_8));
            return null;
        });
        when(sessionManager.restoreSession(any()))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0, WorkflowSession.class)));

        CheckpointRecoveryService service = new CheckpointRecoveryService(store, sessionManager, true);

        StepVerifier.create(service.recoverSessions())
                .assertNext(summary -> {
                    assertThat(summary.recovered()).isEqualTo(2);
                    assertThat(summary.failed()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void disabledRecoveryDoesNothing() {
        CheckpointRecoveryService service = new CheckpointRecoveryService(checkpointStore, sessionManager, false);

        StepVerifier.create(service.recoverSessions())
                .assertNext(summary -> assertThat(summary).isEqualTo(new CheckpointRecoveryService.RecoverySummary(0, 0, 0)))
                .verifyComplete();

        verifyNoInteractions(checkpointStore);
        verify(sessionManager, never()).restoreSession(any());
    }
}
