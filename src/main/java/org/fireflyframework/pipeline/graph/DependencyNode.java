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

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Snapshot of a tool in the dependency graph.
 *
 * @param toolName the tool
 * @param dependencies tools that must run first, in declaration order
 * @param dependents tools that declared this one as a dependency
 * @param status scheduling status
 * @param lastRun when the tool last finished, null if never
 * @param runCount number of finished runs
 */
public record DependencyNode(
        String toolName,
        List<String> dependencies,
        Set<String> dependents,
        NodeStatus status,
        Instant lastRun,
        int runCount
) {

    public DependencyNode {
        dependencies = List.copyOf(dependencies);
        dependents = Set.copyOf(dependents);
    }
}
