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

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates rule conditions against an event's data and context.
 * <p>
 * Numeric operators compare through {@code double}. A missing field or a non-numeric
 * operand makes the condition false; evaluation never throws.
 */
@Slf4j
public final class ConditionEvaluator {

    static final String METRICS_KEY = "metrics";

    private ConditionEvaluator() {
    }

    public static boolean matchesAll(List<RuleCondition> conditions, Map<String, Object> data,
                                     Map<String, Object> context) {
        if (conditions == null) {
            return true;
        }
        for (RuleCondition condition : conditions) {
            if (!matches(condition, data, context)) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(RuleCondition condition, Map<String, Object> data, Map<String, Object> context) {
        Optional<Object> actual = lookup(condition, data != null ? data : Map.of(), context != null ? context : Map.of());
        if (condition.operator() == ConditionOperator.EXISTS) {
            return actual.isPresent();
        }
        if (actual.isEmpty()) {
            return false;
        }
        Object expected = condition.value();
        Object value = actual.get();
        return switch (condition.operator()) {
            case EQUALS -> isEqual(value, expected);
            case CONTAINS -> expected != null
                    && value.toString().toLowerCase(Locale.ROOT).contains(expected.toString().toLowerCase(Locale.ROOT));
            case GREATER_THAN -> compare(value, expected) > 0;
            case LESS_THAN -> compare(value, expected) < 0;
            case EXISTS -> true;
        };
    }

    private static Optional<Object> lookup(RuleCondition condition, Map<String, Object> data,
                                           Map<String, Object> context) {
        String field = condition.field();
        return switch (condition.source()) {
            case DATA -> Optional.ofNullable(data.get(field));
            case CONTEXT -> Optional.ofNullable(context.get(field));
            case METRICS -> context.get(METRICS_KEY) instanceof Map<?, ?> metrics
                    ? Optional.ofNullable(metrics.get(field))
                    : Optional.empty();
            case ANY -> Optional.ofNullable(data.get(field)).or(() -> Optional.ofNullable(context.get(field)));
        };
    }

    private static boolean isEqual(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Returns the sign of {@code actual - expected}, or 0 when either side is not numeric,
     * which fails both ordering operators.
     */
    private static int compare(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            double left = a.doubleValue();
            double right = e.doubleValue();
            if (Double.isNaN(left) || Double.isNaN(right)) {
                return 0;
            }
            return Double.compare(left, right);
        }
        log.debug("Non-numeric operands {} and {} fail numeric comparison", actual, expected);
        return 0;
    }
}
