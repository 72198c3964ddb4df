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

package org.fireflyframework.pipeline.coordination;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of coordination usage.
 *
 * @param totalCoordinations resolved coordinations
 * @param successfulCoordinations coordinations the target reported as successful
 * @param failedCoordinations failed, timed out or cancelled coordinations
 * @param averageLatency mean round trip
 * @param toolPairs usage per {@code source->target} pair
 */
public record CoordinationMetrics(
        long totalCoordinations,
        long successfulCoordinations,
        long failedCoordinations,
        Duration averageLatency,
        Map<String, ToolPairMetric> toolPairs
) {

    public CoordinationMetrics {
        toolPairs = Map.copyOf(toolPairs);
    }

    public static String pairKey(String sourceTool, String targetTool) {
        return sourceTool + "->" + targetTool;
    }

    /**
     * Usage of one source/target pair.
     */
    public record ToolPairMetric(long count, long successes, long failures, Duration totalTime, Instant lastUsed) {
    }
}
