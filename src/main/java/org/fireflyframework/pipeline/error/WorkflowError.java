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

package org.fireflyframework.pipeline.error;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured description of a stage failure.
 *
 * @param id unique error id
 * @param message human readable message
 * @param code machine code
 * @param type coarse type (e.g. "build", "deploy")
 * @param errorType fine-grained type used for classification and rule matching
 * @param severity severity
 * @param retryable whether the producing tool considers the failure retryable
 * @param stageName stage that produced the error
 * @param toolName tool that produced the error
 * @param timestamp when the error occurred
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkflowError(
        String id,
        String message,
        String code,
        String type,
        String errorType,
        ErrorSeverity severity,
        boolean retryable,
        String stageName,
        String toolName,
        Instant timestamp
) {

    /**
     * Creates a retryable, medium severity error.
     */
    public static WorkflowError of(String stageName, String toolName, String errorType, String message) {
        return new WorkflowError(UUID.randomUUID().toString(), message, null, null, errorType,
                ErrorSeverity.MEDIUM, true, stageName, toolName, Instant.now());
    }

    /**
     * Flattens this error into the field map used by rule conditions.
     * Keys follow the persisted snake_case names; null values are omitted.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "id", id);
        putIfPresent(fields, "message", message);
        putIfPresent(fields, "code", code);
        putIfPresent(fields, "type", type);
        putIfPresent(fields, "error_type", errorType);
        putIfPresent(fields, "severity", severity != null ? severity.value() : null);
        fields.put("retryable", retryable);
        putIfPresent(fields, "stage_name", stageName);
        putIfPresent(fields, "tool_name", toolName);
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
