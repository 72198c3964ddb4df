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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Session-state snapshot stored inside a checkpoint.
 * <p>
 * Snapshots are tagged with a {@code kind} discriminator and carry a {@code schema_version}:
 * <ul>
 *   <li>{@code full} - {@link FullSessionState}, every session field</li>
 *   <li>{@code delta} - {@link SessionStateDelta}, only fields changed since the parent checkpoint</li>
 *   <li>untagged - {@link LegacySessionState}, the open key/value map written before snapshots
 *       were tagged, upgraded through {@link LegacySessionState#migrate}</li>
 * </ul>
 * A new schema version adds a migration step to {@link SessionStateMigrator}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind",
        defaultImpl = LegacySessionState.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = FullSessionState.class, name = FullSessionState.KIND),
        @JsonSubTypes.Type(value = SessionStateDelta.class, name = SessionStateDelta.KIND)
})
public interface SessionState {

    int schemaVersion();
}
