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

package org.fireflyframework.pipeline.model;

import org.fireflyframework.pipeline.error.WorkflowError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowSessionTest {

    private WorkflowSession newSession() {
        return WorkflowSession.create("s-1", "wf-1", "containerize");
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void shouldStartPending() {
            WorkflowSession session = newSession();

            assertThat(session.getStatus()).isEqualTo(WorkflowStatus.PENDING);
            assertThat(session.getCurrentStage()).isEmpty();
            assertThat(session.getLastActivity()).isEqualTo(session.getStartTime());
        }

        @Test
        void shouldPauseAndResume() {
            WorkflowSession session = newSession();
            session.start();
            session.pause();
            assertThat(session.getStatus()).isEqualTo(WorkflowStatus.PAUSED);

            session.resume();
            assertThat(session.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
        }

        @Test
        void cannotPauseUnlessRunning() {
            assertThatThrownBy(() -> newSession().pause())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Cannot pause");
        }

        @Test
        @DisplayName("Terminal sessions reject further stages")
        void terminalSessionRejectsStages() {
            WorkflowSession session = newSession();
            session.start();
            session.complete();

            assertThat(session.getStatus().isTerminal()).isTrue();
            assertThat(session.getStatus().isResumable()).isFalse();
            assertThatThrownBy(() -> session.startStage("build"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("terminal status");
        }

        @Test
        void startingAStageStartsThePendingSession() {
            WorkflowSession session = newSession();

            session.startStage("analyze");

            assertThat(session.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(session.getCurrentStage()).isEqualTo("analyze");
        }
    }

    // ========================================================================
    // Stage transitions
    // ========================================================================

    @Nested
    @DisplayName("Stage transitions")
    class StageTransitions {

        @Test
        @DisplayName("Completing the current stage clears it")
        void completeClearsCurrentStage() {
            WorkflowSession session = newSession();
            session.startStage("analyze");

            session.completeStage("analyze", Map.of("language", "java"));

            assertThat(session.getCurrentStage()).isEmpty();
            assertThat(session.getCompletedStages()).containsExactly("analyze");
            assertThat(session.getStageResults()).containsEntry("analyze", Map.of("language", "java"));
        }

        @Test
        @DisplayName("Restarting a stage removes it from the completed set")
        void restartRemovesFromCompleted() {
            WorkflowSession session = newSession();
            session.startStage("build");
            session.completeStage("build", "ok");

            session.startStage("build");

            assertThat(session.getCompletedStages()).doesNotContain("build");
            assertThat(session.getCurrentStage()).isEqualTo("build");
        }

        @Test
        void failingRecordsTheError() {
            WorkflowSession session = newSession();
            session.startStage("build");
            WorkflowError error = WorkflowError.of("build", "build_image", "build_error", "Dockerfile syntax");

            session.failStage("build", error);

            assertThat(session.getFailedStages()).containsExactly("build");
            assertThat(session.getErrors()).containsExactly(error);
        }

        @Test
        void skippingClearsCurrentStage() {
            WorkflowSession session = newSession();
            session.startStage("scan");

            session.skipStage("scan");

            assertThat(session.getSkippedStages()).containsExactly("scan");
            assertThat(session.getCurrentStage()).isEmpty();
        }

        @Test
        @DisplayName("The builder never keeps the current stage among completed stages")
        void builderDropsCurrentFromCompleted() {
            WorkflowSession session = WorkflowSession.builder()
                    .sessionId("s-2")
                    .currentStage("build")
                    .completedStages(Set.of("analyze", "build"))
                    .build();

            assertThat(session.getCompletedStages()).containsExactly("analyze");
        }

        @Test
        void viewsAreReadOnly() {
            WorkflowSession session = newSession();
            session.putContext("port", 8080);

            assertThatThrownBy(() -> session.getSharedContext().put("other", 1))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
