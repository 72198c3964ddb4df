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

import lombok.Builder;
import lombok.Getter;
import org.fireflyframework.pipeline.error.WorkflowError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One pipeline run and its accumulated state.
 * <p>
 * A session is owned by a single orchestration thread at a time and is mutated only
 * through the stage-transition methods below. The current stage, when non-empty, is
 * never part of {@link #getCompletedStages()}.
 */
@Getter
public class WorkflowSession {

    private final String sessionId;
    private final String workflowId;
    private final String workflowName;
    private WorkflowStatus status;
    private String currentStage;
    private final Set<String> completedStages;
    private final Set<String> failedStages;
    private final Set<String> skippedStages;
    private final Map<String, Object> stageResults;
    private final Map<String, Object> sharedContext;
    private final Map<String, String> resourceBindings;
    private final Instant startTime;
    private Instant lastActivity;
    private final List<CheckpointRef> checkpoints;
    private final List<WorkflowError> errors;

    @Builder
    private WorkflowSession(String sessionId,
                            String workflowId,
                            String workflowName,
                            WorkflowStatus status,
                            String currentStage,
                            Set<String> completedStages,
                            Set<String> failedStages,
                            Set<String> skippedStages,
                            Map<String, Object> stageResults,
                            Map<String, Object> sharedContext,
                            Map<String, String> resourceBindings,
                            Instant startTime,
                            Instant lastActivity,
                            List<CheckpointRef> checkpoints,
                            List<WorkflowError> errors) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.status = status != null ? status : WorkflowStatus.PENDING;
        this.currentStage = currentStage != null ? currentStage : "";
        this.completedStages = completedStages != null ? new LinkedHashSet<>(completedStages) : new LinkedHashSet<>();
        this.failedStages = failedStages != null ? new LinkedHashSet<>(failedStages) : new LinkedHashSet<>();
        this.skippedStages = skippedStages != null ? new LinkedHashSet<>(skippedStages) : new LinkedHashSet<>();
        this.stageResults = stageResults != null ? new LinkedHashMap<>(stageResults) : new LinkedHashMap<>();
        this.sharedContext = sharedContext != null ? new LinkedHashMap<>(sharedContext) : new LinkedHashMap<>();
        this.resourceBindings = resourceBindings != null ? new LinkedHashMap<>(resourceBindings) : new LinkedHashMap<>();
        this.startTime = startTime != null ? startTime : Instant.now();
        this.lastActivity = lastActivity != null ? lastActivity : this.startTime;
        this.checkpoints = checkpoints != null ? new ArrayList<>(checkpoints) : new ArrayList<>();
        this.errors = errors != null ? new ArrayList<>(errors) : new ArrayList<>();
        if (!this.currentStage.isEmpty()) {
            this.completedStages.remove(this.currentStage);
        }
    }

    /**
     * Creates a pending session.
     */
    public static WorkflowSession create(String sessionId, String workflowId, String workflowName) {
        return builder()
                .sessionId(sessionId)
                .workflowId(workflowId)
                .workflowName(workflowName)
                .build();
    }

    // ==================== Lifecycle ====================

    public void start() {
        requireNotTerminal("start");
        status = WorkflowStatus.RUNNING;
        touch();
    }

    public void pause() {
        if (status != WorkflowStatus.RUNNING) {
            throw new IllegalStateException("Cannot pause session " + sessionId + " in status " + status);
        }
        status = WorkflowStatus.PAUSED;
        touch();
    }

    public void resume() {
        if (status != WorkflowStatus.PAUSED) {
            throw new IllegalStateException("Cannot resume session " + sessionId + " in status " + status);
        }
        status = WorkflowStatus.RUNNING;
        touch();
    }

    public void cancel() {
        requireNotTerminal("cancel");
        status = WorkflowStatus.CANCELLED;
        touch();
    }

    public void complete() {
        requireNotTerminal("complete");
        status = WorkflowStatus.COMPLETED;
        currentStage = "";
        touch();
    }

    public void fail() {
        status = WorkflowStatus.FAILED;
        touch();
    }

    // ==================== Stage transitions ====================

    /**
     * Marks a stage as current. A stage that is started again leaves the failed,
     * skipped and completed sets.
     */
    public void startStage(String stageName) {
        requireNotTerminal("start stage " + stageName);
        if (status == WorkflowStatus.PENDING) {
            status = WorkflowStatus.RUNNING;
        }
        currentStage = stageName;
        completedStages.remove(stageName);
        failedStages.remove(stageName);
        skippedStages.remove(stageName);
        touch();
    }

    public void completeStage(String stageName, Object result) {
        completedStages.add(stageName);
        failedStages.remove(stageName);
        if (result != null) {
            stageResults.put(stageName, result);
        }
        if (stageName.equals(currentStage)) {
            currentStage = "";
        }
        touch();
    }

    public void failStage(String stageName, WorkflowError error) {
        failedStages.add(stageName);
        completedStages.remove(stageName);
        if (error != null) {
            errors.add(error);
        }
        touch();
    }

    public void skipStage(String stageName) {
        skippedStages.add(stageName);
        completedStages.remove(stageName);
        if (stageName.equals(currentStage)) {
            currentStage = "";
        }
        touch();
    }

    public void putContext(String key, Object value) {
        sharedContext.put(key, value);
        touch();
    }

    public void bindResource(String key, String value) {
        resourceBindings.put(key, value);
        touch();
    }

    public void recordCheckpoint(CheckpointRef checkpoint) {
        checkpoints.add(checkpoint);
    }

    // ==================== Read-only views ====================

    public Set<String> getCompletedStages() {
        return Collections.unmodifiableSet(completedStages);
    }

    public Set<String> getFailedStages() {
        return Collections.unmodifiableSet(failedStages);
    }

    public Set<String> getSkippedStages() {
        return Collections.unmodifiableSet(skippedStages);
    }

    public Map<String, Object> getStageResults() {
        return Collections.unmodifiableMap(stageResults);
    }

    public Map<String, Object> getSharedContext() {
        return Collections.unmodifiableMap(sharedContext);
    }

    public Map<String, String> getResourceBindings() {
        return Collections.unmodifiableMap(resourceBindings);
    }

    public List<CheckpointRef> getCheckpoints() {
        return Collections.unmodifiableList(checkpoints);
    }

    public List<WorkflowError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    private void requireNotTerminal(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot " + action + " for session " + sessionId
                    + " in terminal status " + status);
        }
    }

    private void touch() {
        lastActivity = Instant.now();
    }
}
