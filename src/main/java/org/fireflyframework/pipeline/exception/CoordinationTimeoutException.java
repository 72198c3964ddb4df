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

import java.time.Duration;

/**
 * Exception thrown when the target tool never signals completion within the coordination timeout.
 */
public class CoordinationTimeoutException extends CoordinationException {

    private final Duration timeout;

    public CoordinationTimeoutException(String coordinationId, String targetTool, Duration timeout) {
        super(coordinationId, "Coordination " + coordinationId + " with tool '" + targetTool
                + "' timed out after " + timeout);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
