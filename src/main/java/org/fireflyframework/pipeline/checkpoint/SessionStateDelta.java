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
import org.fireflyframework.pipeline.model.WorkflowStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Changes to a session since its parent checkpoint. A {@code null} field means "unchanged";
 * the last activity time is always present.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStateDelta(
        int schemaVersion,
        WorkflowStatus status,
        String currentStage,
        List<String> newCompletedStages,
        List<String> removedCompletedStages,
        List<String> failedStages,
        List<String> skippedStages,
        Map<String, Object> sharedContext,
        Map<String, String> resourceBindings,
        Instant lastActivity,
        List<WorkflowError> newErrors
) implements SessionState {

    public static final String KIND = "delta";
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public SessionStateDelta {
        schemaVersion = schemaVersion > 0 ? schemaVersion : CURRENT_SCHEMA_VERSION;
        newCompletedStages = newCompletedStages != null ? List.copyOf(newCompletedStages) : List.of();
        removedCompletedStages = removedCompletedStages != null ? List.copyOf(removedCompletedStages) : List.of();
        newErrors = newErrors != null ? List.copyOf(newErrors) : List.of();
    }

    /**
     * Computes the changes from {@code base} to {@code current}.
     *
     * @param sameValue structural equality used for context values
     */
    public static SessionStateDelta between(FullSessionState base, FullSessionState current,
                                            BiPredicate<Object, Object> sameValue) {
        Set<String> added = new LinkedHashSet<>(current.completedStages());
        added.removeAll(base.completedStages());
        Set<String> removed = new LinkedHashSet<>(base.completedStages());
        removed.removeAll(current.completedStages());

        List<WorkflowError> newErrors = current.errors().size() > base.errors().size()
                ? new ArrayList<>(current.errors().subList(base.errors().size(), current.errors().size()))
                : List.of();

        return new SessionStateDelta(
                CURRENT_SCHEMA_VERSION,
                current.status() != base.status() ? current.status() : null,
                !Objects.equals(current.currentStage(), base.currentStage()) ? current.currentStage() : null,
                new ArrayList<>(added),
                new ArrayList<>(removed),
                sameStages(current.failedStages(), base.failedStages()) ? null : current.failedStages(),
                sameStages(current.skippedStages(), base.skippedStages()) ? null : current.skippedStages(),
                sameValue.test(current.sharedContext(), base.sharedContext()) ? null : current.sharedContext(),
                sameValue.test(current.resourceBindings(), base.resourceBindings()) ? null : current.resourceBindings(),
                current.lastActivity(),
                newErrors
        );
    }

    private static boolean sameStages(List<String> left, List<String> right) {
        return new LinkedHashSet<>(left).equals(new LinkedHashSet<>(right));
    }
}
