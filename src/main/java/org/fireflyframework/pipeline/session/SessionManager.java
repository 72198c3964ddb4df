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

package org.fireflyframework.pipeline.session;

import org.fireflyframework.pipeline.model.WorkflowSession;
import reactor.core.publisher.Mono;

/**
 * Owner of live workflow sessions. Implemented by the orchestration layer.
 */
public interface SessionManager {

    /**
     * Looks up a live session.
     *
     * @return the session, or empty if it is not loaded
     */
    Mono<WorkflowSession> getSession(String sessionId);

    /**
     * Takes ownership of a session reconstructed from a checkpoint.
     *
     * @return the session as registered by the manager
     */
    Mono<WorkflowSession> restoreSession(WorkflowSession session);
}
