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

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Upgrades stored session-state snapshots to the current {@link FullSessionState} schema.
 * <p>
 * Migration path:
 * <ul>
 *   <li>schema 0 (untagged map) - {@link LegacySessionState#migrate}</li>
 *   <li>schema 1 - current, used as is</li>
 * </ul>
 * Delta snapshots are resolved against their parent by the checkpoint store, not here.
 */
@Slf4j
public final class SessionStateMigrator {

    private SessionStateMigrator() {
    }

    public static FullSessionState toCurrent(SessionState state, Instant now) {
        if (state instanceof FullSessionState full) {
            if (full.schemaVersion() > FullSessionState.CURRENT_SCHEMA_VERSION) {
                log.warn("Session state schema {} is newer than supported schema {}, reading known fields only",
                        full.schemaVersion(), FullSessionState.CURRENT_SCHEMA_VERSION);
            }
            return full;
        }
        if (state instanceof LegacySessionState legacy) {
            log.debug("Migrating legacy session state with {} keys", legacy.values().size());
            return legacy.migrate(now);
        }
        if (state == null) {
            return new LegacySessionState().migrate(now);
        }
        throw new IllegalArgumentException("Cannot migrate session state of kind "
                + state.getClass().getSimpleName() + " without its parent checkpoint");
    }
}
