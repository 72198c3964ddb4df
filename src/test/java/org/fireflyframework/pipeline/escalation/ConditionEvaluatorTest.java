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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private static final Map<String, Object> DATA = Map.of(
            "error_type", "build_error",
            "message", "Failed to parse Dockerfile at line 3",
            "exit_code", 2);

    // ========================================================================
    // Operators
    // ========================================================================

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        void containsIgnoresCase() {
            assertThat(ConditionEvaluator.matches(RuleCondition.contains("message", "dockerfile"), DATA, Map.of()))
                    .isTrue();
            assertThat(ConditionEvaluator.matches(RuleCondition.contains("message", "manifest"), DATA, Map.of()))
                    .isFalse();
        }

        @Test
        @DisplayName("Equality compares numbers by value")
        void equalsComparesNumbersByValue() {
            assertThat(ConditionEvaluator.matches(RuleCondition.equalTo("exit_code", 2.0), DATA, Map.of())).isTrue();
            assertThat(ConditionEvaluator.matches(RuleCondition.equalTo("error_type", "build_error"), DATA, Map.of()))
                    .isTrue();
            assertThat(ConditionEvaluator.matches(RuleCondition.equalTo("error_type", "BUILD_ERROR"), DATA, Map.of()))
                    .isFalse();
        }

        @Test
        void numericComparisons() {
            assertThat(ConditionEvaluator.matches(RuleCondition.greaterThan("exit_code", 1), DATA, Map.of())).isTrue();
            assertThat(ConditionEvaluator.matches(RuleCondition.lessThan("exit_code", 1), DATA, Map.of())).isFalse();
        }

        @Test
        @DisplayName("Non-numeric operands fail ordering operators")
        void nonNumericOperandsFail() {
            assertThat(ConditionEvaluator.matches(RuleCondition.greaterThan("message", 1), DATA, Map.of())).isFalse();
            assertThat(ConditionEvaluator.matches(RuleCondition.lessThan("message", 1), DATA, Map.of())).isFalse();
        }

        @Test
        void missingFieldNeverMatches() {
            assertThat(ConditionEvaluator.matches(RuleCondition.equalTo("code", null), DATA, Map.of())).isFalse();
            assertThat(ConditionEvaluator.matches(RuleCondition.contains("code", "x"), DATA, Map.of())).isFalse();
        }
    }

    // ========================================================================
    // Sources
    // ========================================================================

    @Nested
    @DisplayName("Sources")
    class Sources {

        @Test
        @DisplayName("Unscoped fields fall back from data to context")
        void anyLooksInDataThenContext() {
            Map<String, Object> context = Map.of("error_type", "ignored", "registry", "registry.local");

            assertThat(ConditionEvaluator.matches(RuleCondition.equalTo("error_type", "build_error"), DATA, context))
                    .isTrue();
            assertThat(ConditionEvaluator.matches(RuleCondition.equalTo("registry", "registry.local"), DATA, context))
                    .isTrue();
        }

        @Test
        void metricThresholdReadsMetricsMap() {
            Map<String, Object> context = Map.of("metrics", Map.of("severity_score", 8.5));

            assertThat(ConditionEvaluator.matches(RuleCondition.metricAbove("severity_score", 7.0), Map.of(), context))
                    .isTrue();
            assertThat(ConditionEvaluator.matches(RuleCondition.metricAbove("severity_score", 9), Map.of(), context))
                    .isFalse();
            assertThat(ConditionEvaluator.matches(RuleCondition.metricAbove("severity_score", 1), Map.of(), Map.of()))
                    .isFalse();
        }

        @Test
        void contextExistsIgnoresData() {
            assertThat(ConditionEvaluator.matches(RuleCondition.contextExists("message"), DATA, Map.of())).isFalse();
            assertThat(ConditionEvaluator.matches(RuleCondition.contextExists("deployment"), Map.of(),
                    Map.of("deployment", "web"))).isTrue();
        }
    }

    @Test
    @DisplayName("All conditions must hold; none means always")
    void matchesAllRequiresEveryCondition() {
        List<RuleCondition> conditions = List.of(
                RuleCondition.contains("error_type", "build_error"),
                RuleCondition.contains("message", "dockerfile"));

        assertThat(ConditionEvaluator.matchesAll(conditions, DATA, Map.of())).isTrue();
        assertThat(ConditionEvaluator.matchesAll(List.of(conditions.get(0), RuleCondition.contains("message", "oom")),
                DATA, Map.of())).isFalse();
        assertThat(ConditionEvaluator.matchesAll(List.of(), DATA, Map.of())).isTrue();
    }
}
