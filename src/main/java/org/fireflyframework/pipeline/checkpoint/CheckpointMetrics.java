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

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over every stored checkpoint.
 *
 * @param totalCheckpoints number of checkpoints
 * @param sessionCounts checkpoints per session id
 * @param stageCounts checkpoints per stage name
 * @param lastCheckpoint most recent checkpoint time, null when the store is empty
 */
public record CheckpointMetrics(
        int totalCheckpoints,
        Map<String, Integer> sessionCounts,
        Map<String, Integer> stageCounts,
        Instant lastCheckpoint
) {

    public CheckpointMetrics {
        sessionCounts = Map.copyOf(sessionCounts);
        stageCounts = Map.copyOf(stageCounts);
    }
}
