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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.fireflyframework.pipeline.error.WorkflowError;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something a tool reported: a failure, a finished run, a finding.
 *
 * @param sourceTool tool that emitted the event
 * @param eventType event type, e.g. {@code build_failed}
 * @param data structured output of the tool
 * @param context caller context (session variables, metrics, escalation markers)
 * @param timestamp when the event was emitted
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ToolEvent(
        String sourceTool,
        String eventType,
        Map<String, Object> data,
        Map<String, Object> context,
        Instant timestamp
) {

    public static final String TOOL_FAILED = "tool_failed";

    public ToolEvent {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ToolEvent of(String sourceTool, String eventType, Map<String, Object> data) {
        return new ToolEvent(sourceTool, eventType, data, Map.of(), Instant.now());
    }

    /**
     * Wraps a failure as a {@code tool_failed} event whose data holds the error's fields.
     */
    public static ToolEvent fromError(WorkflowError error, Map<String, Object> context) {
        return new ToolEvent(error.toolName(), TOOL_FAILED, error.toFields(), context,
                error.timestamp() != null ? error.timestamp() : Instant.now());
    }
}
