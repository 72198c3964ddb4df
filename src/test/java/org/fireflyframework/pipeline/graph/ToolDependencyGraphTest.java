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

package org.fireflyframework.pipeline.graph;

import org.fireflyframework.pipeline.exception.CyclicDependencyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolDependencyGraphTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private ToolDependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ToolDependencyGraph(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========================================================================
    // Ordering
    // ========================================================================

    @Nested
    @DisplayName("Execution order")
    class Ordering {

        @Test
        @DisplayName("Every dependency precedes its dependents")
        void dependenciesComeFirst() {
            graph.addNode("deploy_kubernetes", List.of("generate_manifests"));
            graph.addNode("generate_manifests", List.of("build_image"));
            graph.addNode("build_image", List.of("generate_dockerfile"));
            graph.addNode("generate_dockerfile", List.of("analyze_repository"));
            graph.addNode("analyze_repository", List.of());

            assertThat(graph.getExecutionOrder()).containsExactly(
                    "analyze_repository", "generate_dockerfile", "build_image",
                    "generate_manifests", "deploy_kubernetes");
        }

        @Test
        @DisplayName("Unregistered dependencies are scheduled as leaves")
        void unregisteredDependenciesAreIncluded() {
            graph.addNode("push_image", List.of("build_image"));

            assertThat(graph.getExecutionOrder()).containsExactly("build_image", "push_image");
            assertThat(graph.contains("build_image")).isFalse();
        }

        @Test
        @DisplayName("A cycle is reported with its path")
        void cycleIsReported() {
            graph.addNode("a", List.of("b"));
            graph.addNode("b", List.of("c"));
            graph.addNode("c", List.of("a"));

            assertThatThrownBy(graph::getExecutionOrder)
                    .isInstanceOfSatisfying(CyclicDependencyException.class,
                            e -> assertThat(e.getCycle()).containsExactly("a", "b", "c", "a"));
        }

        @Test
        void selfDependencyIsACycle() {
            graph.addNode("a", List.of("a"));

            assertThatThrownBy(graph::getExecutionLayers).isInstanceOf(CyclicDependencyException.class);
        }

        @Test
        @DisplayName("Independent tools share a layer")
        void layersGroupIndependentTools() {
            graph.addNode("build_image", List.of());
            graph.addNode("scan_security", List.of("build_image"));
            graph.addNode("push_image", List.of("build_image"));
            graph.addNode("deploy_kubernetes", List.of("push_image", "scan_security"));

            assertThat(graph.getExecutionLayers()).containsExactly(
                    List.of("build_image"),
                    List.of("scan_security", "push_image"),
                    List.of("deploy_kubernetes"));
        }
    }

    // ========================================================================
    // Node bookkeeping
    // ========================================================================

    @Nested
    @DisplayName("Node bookkeeping")
    class Bookkeeping {

        @Test
        @DisplayName("Dependents are back-filled when a dependency registers late")
        void dependentsAreBackFilled() {
            graph.addNode("push_image", List.of("build_image"));
            graph.addNode("scan_security", List.of("build_image"));
            graph.addNode("build_image", List.of());

            assertThat(graph.getNode("build_image")).hasValueSatisfying(node ->
                    assertThat(node.dependents()).containsExactlyInAnyOrder("push_image", "scan_security"));
            assertThat(graph.getDependents("build_image")).containsExactlyInAnyOrder("push_image", "scan_security");
        }

        @Test
        @DisplayName("Re-registering replaces edges but keeps run state")
        void reRegisterKeepsRunState() {
            graph.addNode("build_image", List.of());
            graph.addNode("push_image", List.of("build_image"));
            graph.markCompleted("push_image");

            graph.addNode("push_image", List.of());

            assertThat(graph.getDependents("build_image")).isEmpty();
            assertThat(graph.getNode("build_image")).hasValueSatisfying(node ->
                    assertThat(node.dependents()).isEmpty());
            assertThat(graph.getNode("push_image")).hasValueSatisfying(node -> {
                assertThat(node.status()).isEqualTo(NodeStatus.COMPLETED);
                assertThat(node.runCount()).isEqualTo(1);
            });
        }

        @Test
        @DisplayName("Finishing a run stamps the time and counts it")
        void finishedRunsAreCounted() {
            graph.addNode("build_image", List.of());

            graph.markRunning("build_image");
            assertThat(graph.getNode("build_image")).hasValueSatisfying(node -> {
                assertThat(node.status()).isEqualTo(NodeStatus.RUNNING);
                assertThat(node.runCount()).isZero();
            });

            graph.markFailed("build_image");
            graph.markCompleted("build_image");

            assertThat(graph.getNode("build_image")).hasValueSatisfying(node -> {
                assertThat(node.status()).isEqualTo(NodeStatus.COMPLETED);
                assertThat(node.runCount()).isEqualTo(2);
                assertThat(node.lastRun()).isEqualTo(NOW);
            });
        }

        @Test
        void statusOfUnknownToolIsIgnored() {
            graph.markRunning("ghost");

            assertThat(graph.getNode("ghost")).isEmpty();
            assertThat(graph.getNodes()).isEmpty();
        }
    }
}
