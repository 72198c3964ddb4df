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

package org.fireflyframework.pipeline.escalation;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a matching failure of a source tool.
 *
 * @param id rule id
 * @param name short name
 * @param description what the rule corrects
 * @param conditions conjunctive conditions
 * @param action what to do on match
 * @param redirectTo target tool for {@link RoutingAction#REDIRECT}
 * @param fixErrors whether the target should try to fix the reported errors
 * @param parameters extra parameters handed to the target tool
 * @param priority higher wins
 * @param enabled disabled rules never match
 */
@Builder(toBuilder = true)
public record ErrorRoutingRule(
        String id,
        String name,
        String description,
        List<RuleCondition> conditions,
        RoutingAction action,
        String redirectTo,
        boolean fixErrors,
        Map<String, String> parameters,
        int priority,
        boolean enabled
) {

    public ErrorRoutingRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id is required");
        }
        action = action != null ? action : RoutingAction.REDIRECT;
        if (action == RoutingAction.REDIRECT && (redirectTo == null || redirectTo.isBlank())) {
            throw new IllegalArgumentException("Redirect rule " + id + " needs a target tool");
        }
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }
}
