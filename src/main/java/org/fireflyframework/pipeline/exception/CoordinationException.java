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

package org.fireflyframework.pipeline.exception;

/**
 * Exception thrown when a cross-tool coordination cannot be set up or resolved.
 */
public class CoordinationException extends PipelineException {

    private final String coordinationId;

    public CoordinationException(String message) {
        super(message);
        this.coordinationId = null;
    }

    public CoordinationException(String coordinationId, String message) {
        super(message);
        this.coordinationId = coordinationId;
    }

    public CoordinationException(String coordinationId, String message, Throwable cause) {
        super(message, cause);
        this.coordinationId = coordinationId;
    }

    public String getCoordinationId() {
        return coordinationId;
    }
}
