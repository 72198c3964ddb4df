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

/**
 * A single predicate of a rule. All conditions of a rule must hold for it to match.
 *
 * @param source where the field is looked up
 * @param field field name
 * @param operator comparison
 * @param value expected value
 */
public record RuleCondition(ConditionSource source, String field, ConditionOperator operator, Object value) {

    public RuleCondition {
        source = source != null ? source : ConditionSource.ANY;
    }

    public static RuleCondition equalTo(String field, Object value) {
        return new RuleCondition(ConditionSource.ANY, field, ConditionOperator.EQUALS, value);
    }

    public static RuleCondition contains(String field, String value) {
        return new RuleCondition(ConditionSource.ANY, field, ConditionOperator.CONTAINS, value);
    }

    public static RuleCondition greaterThan(String field, Number value) {
        return new RuleCondition(ConditionSource.ANY, field, ConditionOperator.GREATER_THAN, value);
    }

    public static RuleCondition lessThan(String field, Number value) {
        return new RuleCondition(ConditionSource.ANY, field, ConditionOperator.LESS_THAN, value);
    }

    public static RuleCondition metricAbove(String metric, Number threshold) {
        return new RuleCondition(ConditionSource.METRICS, metric, ConditionOperator.GREATER_THAN, threshold);
    }

    public static RuleCondition contextExists(String field) {
        return new RuleCondition(ConditionSource.CONTEXT, field, ConditionOperator.EXISTS, null);
    }
}
