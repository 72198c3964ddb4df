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

import lombok.Builder;
import org.fireflyframework.pipeline.escalation.RuleCondition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Hands an event of a source tool over to a target tool.
 *
 * @param id rule id
 * @param name short name
 * @param sourceTool tool whose events trigger the rule
 * @param targetTool tool receiving the hand-off
 * @param triggerEvent event type that triggers the rule
 * @param conditions conjunctive conditions on the event
 * @param transform optional payload transform, applied outside any lock
 * @param priority higher runs first
 * @param metadata free-form rule metadata
 */
@Builder(toBuilder = true)
public record CoordinationRule(
        String id,
        String name,
        String sourceTool,
        String targetTool,
        String triggerEvent,
        List<RuleCondition> conditions,
        UnaryOperator<Map<String, Object>> transform,
        int priority,
        Map<String, String> metadata
) {

    public CoordinationRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id is required");
        }
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public Map<String, Object> applyTransform(Map<String, Object> data) {
        return transform != null ? transform.apply(data) : data;
    }
}
