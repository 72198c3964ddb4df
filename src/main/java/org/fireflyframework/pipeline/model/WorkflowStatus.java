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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Represents the status of a workflow session.
 */
public enum WorkflowStatus {

    /**
     * Session has been created but no stage has started.
     */
    PENDING,

    /**
     * Session is executing stages.
     */
    RUNNING,

    /**
     * Session has been paused and can be resumed.
     */
    PAUSED,

    /**
     * All stages finished.
     */
    COMPLETED,

    /**
     * Session failed with an unrecoverable error.
     */
    FAILED,

    /**
     * Session was cancelled by the caller.
     */
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a status case-insensitively. Missing or unknown values map to {@link #PENDING}.
     *
     * @param value the textual status
     * @return the status
     */
    @JsonCreator
    public static WorkflowStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }

    /**
     * Checks if the session is in a terminal state.
     *
     * @return true if the session has ended
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the session can still make progress after a restart.
     *
     * @return true if the session is pending, running or paused
     */
    public boolean isResumable() {
        return this == PENDING || this == RUNNING || this == PAUSED;
    }
}
