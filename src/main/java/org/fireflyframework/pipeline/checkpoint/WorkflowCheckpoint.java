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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.fireflyframework.pipeline.model.CheckpointRef;
import org.fireflyframework.pipeline.model.WorkflowSpec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable point-in-time snapshot of a workflow session.
 *
 * @param id globally unique checkpoint id
 * @param sessionId owning session
 * @param workflowId workflow id of the session
 * @param stageName stage at capture time
 * @param timestamp capture time
 * @param workflowSpec specification in force, may be null
 * @param sessionState session-state snapshot, full or delta
 * @param stageResults stage results; for a delta only the changed ones
 * @param message human readable message
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowCheckpoint(
        String id,
        String sessionId,
        String workflowId,
        String stageName,
        Instant timestamp,
        WorkflowSpec workflowSpec,
        SessionState sessionState,
        Map<String, Object> stageResults,
        String message
) {

    public WorkflowCheckpoint {
        stageResults = stageResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(stageResults))
                : Map.of();
    }

    @JsonIgnore
    public boolean isIncremental() {
        return sessionState instanceof SessionStateDelta;
    }

    public CheckpointRef toRef() {
        return new CheckpointRef(id, stageName, timestamp, isIncremental());
    }
}
