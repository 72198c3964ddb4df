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

import java.time.Instant;

/**
 * Reference to a checkpoint taken for a session.
 *
 * @param checkpointId checkpoint id
 * @param stageName stage at capture time
 * @param timestamp capture time
 * @param incremental whether the checkpoint stores a delta
 */
public record CheckpointRef(
        String checkpointId,
        String stageName,
        Instant timestamp,
        boolean incremental
) {
}
