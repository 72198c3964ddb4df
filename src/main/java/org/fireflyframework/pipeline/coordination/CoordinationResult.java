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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a coordination, reported by the target tool or produced by the engine.
 *
 * @param success whether the hand-off succeeded
 * @param output target tool output
 * @param duration round trip duration, filled in by the engine
 * @param metadata engine metadata (coordination id, rule id, status)
 * @param error error message when not successful
 */
public record CoordinationResult(
        boolean success,
        Map<String, Object> output,
        Duration duration,
        Map<String, Object> metadata,
        String error
) {

    public static final String NO_APPLICABLE_RULES = "no applicable rules";

    public CoordinationResult {
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static CoordinationResult success(Map<String, Object> output) {
        return new CoordinationResult(true, output, Duration.ZERO, Map.of(), null);
    }

    public static CoordinationResult failure(String error) {
        return new CoordinationResult(false, Map.of(), Duration.ZERO, Map.of(), error);
    }

    public static CoordinationResult noApplicableRules() {
        return new CoordinationResult(true, Map.of("message", NO_APPLICABLE_RULES), Duration.ZERO, Map.of(), null);
    }

    CoordinationResult withTiming(Duration elapsed, Map<String, Object> engineMetadata) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(engineMetadata);
        return new CoordinationResult(success, output, elapsed, merged, error);
    }
}
