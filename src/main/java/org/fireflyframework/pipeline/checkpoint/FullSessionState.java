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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.fireflyframework.pipeline.error.WorkflowError;
import org.fireflyframework.pipeline.model.CheckpointRef;
import org.fireflyframework.pipeline.model.WorkflowSession;
import org.fireflyframework.pipeline.model.WorkflowStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Complete snapshot of a session's state, excluding stage results which a checkpoint stores separately.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FullSessionState(
        int schemaVersion,
        String sessionId,
        String workflowId,
        String workflowName,
        WorkflowStatus status,
        String currentStage,
        List<String> completedStages,
        List<String> failedStages,
        List<String> skippedStages,
        Map<String, Object> sharedContext,
        Map<String, String> resourceBindings,
        Instant startTime,
        Instant lastActivity,
        List<WorkflowError> errors
) implements SessionState {

    public static final String KIND = "full";
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public FullSessionState {
        schemaVersion = schemaVersion > 0 ? schemaVersion : CURRENT_SCHEMA_VERSION;
        status = status != null ? status : WorkflowStatus.PENDING;
        currentStage = currentStage != null ? currentStage : "";
        completedStages = completedStages != null ? List.copyOf(completedStages) : List.of();
        failedStages = failedStages != null ? List.copyOf(failedStages) : List.of();
        skippedStages = skippedStages != null ? List.copyOf(skippedStages) : List.of();
        sharedContext = sharedContext != null ? new LinkedHashMap<>(sharedContext) : new LinkedHashMap<>();
        resourceBindings = resourceBindings != null ? new LinkedHashMap<>(resourceBindings) : new LinkedHashMap<>();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /**
     * Captures the current state of a session.
     */
    public static FullSessionState from(WorkflowSession session) {
        return new FullSessionState(
                CURRENT_SCHEMA_VERSION,
                session.getSessionId(),
                session.getWorkflowId(),
                session.getWorkflowName(),
                session.getStatus(),
                session.getCurrentStage(),
                new ArrayList<>(session.getCompletedStages()),
                new ArrayList<>(session.getFailedStages()),
                new ArrayList<>(session.getSkippedStages()),
                session.getSharedContext(),
                session.getResourceBindings(),
                session.getStartTime(),
                session.getLastActivity(),
                session.getErrors()
        );
    }

    /**
     * Applies a delta on top of this state.
     */
    public FullSessionState apply(SessionStateDelta delta) {
        Set<String> completed = new LinkedHashSet<>(completedStages);
        completed.removeAll(delta.removedCompletedStages());
        completed.addAll(delta.newCompletedStages());
        String stage = delta.currentStage() != null ? delta.currentStage() : currentStage;
        if (!stage.isEmpty()) {
            completed.remove(stage);
        }
        List<WorkflowError> allErrors = new ArrayList<>(errors);
        allErrors.addAll(delta.newErrors());

        return new FullSessionState(
                CURRENT_SCHEMA_VERSION,
                sessionId,
                workflowId,
                workflowName,
                delta.status() != null ? delta.status() : status,
                stage,
                new ArrayList<>(completed),
                delta.failedStages() != null ? delta.failedStages() : failedStages,
                delta.skippedStages() != null ? delta.skippedStages() : skippedStages,
                delta.sharedContext() != null ? delta.sharedContext() : sharedContext,
                delta.resourceBindings() != null ? delta.resourceBindings() : resourceBindings,
                startTime,
                delta.lastActivity() != null ? delta.lastActivity() : lastActivity,
                allErrors
        );
    }

    /**
     * Rebuilds a live session from this state.
     *
     * @param stageResults stage results stored alongside the snapshot
     * @param restoredFrom the checkpoint the session is restored from
     * @param restoredAt fallback for missing timestamps
     * @param fallbackSessionId used when the snapshot carries no session id
     */
    public WorkflowSession toSession(Map<String, Object> stageResults, CheckpointRef restoredFrom,
                                     Instant restoredAt, String fallbackSessionId) {
        return WorkflowSession.builder()
                .sessionId(sessionId != null && !sessionId.isEmpty() ? sessionId : fallbackSessionId)
                .workflowId(workflowId)
                .workflowName(workflowName)
                .status(status)
                .currentStage(currentStage)
                .completedStages(new LinkedHashSet<>(completedStages))
                .failedStages(new LinkedHashSet<>(failedStages))
                .skippedStages(new LinkedHashSet<>(skippedStages))
                .stageResults(stageResults)
                .sharedContext(sharedContext)
                .resourceBindings(resourceBindings)
                .startTime(startTime != null ? startTime : restoredAt)
                .lastActivity(lastActivity != null ? lastActivity : restoredAt)
                .checkpoints(restoredFrom != null ? List.of(restoredFrom) : List.of())
                .errors(errors)
                .build();
    }
}
