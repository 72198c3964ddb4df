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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.exception.CyclicDependencyException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tool-to-tool dependency graph.
 * <p>
 * Registration stores a tool's declared dependencies and back-fills the reverse
 * edges. {@link #getExecutionOrder()} is a depth-first post-order traversal with
 * three-color marking, so a back edge is reported as a {@link CyclicDependencyException}
 * instead of recursing forever. Dependencies that were never registered are scheduled
 * like leaf tools.
 */
@Slf4j
public class ToolDependencyGraph {

    private enum Color { WHITE, GRAY, BLACK }

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    // dependency -> tools depending on it, kept even before the dependency registers
    private final Map<String, Set<String>> edges = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public ToolDependencyGraph() {
        this(Clock.systemUTC());
    }

    public ToolDependencyGraph(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a tool, replacing any previous declaration.
     *
     * @param toolName the tool
     * @param dependencies tools that must run before it
     */
    public void addNode(String toolName, List<String> dependencies) {
        List<String> deps = dependencies != null ? List.copyOf(dependencies) : List.of();
        lock.writeLock().lock();
        try {
            Node previous = nodes.get(toolName);
            if (previous != null) {
                previous.dependencies.forEach(dep -> edges.getOrDefault(dep, Set.of()).remove(toolName));
            }
            Node node = new Node(toolName, deps);
            if (previous != null) {
                node.status = previous.status;
                node.lastRun = previous.lastRun;
                node.runCount = previous.runCount;
            }
            node.dependents.addAll(edges.getOrDefault(toolName, Set.of()));
            nodes.put(toolName, node);

            for (String dep : deps) {
                edges.computeIfAbsent(dep, d -> new LinkedHashSet<>()).add(toolName);
                Node depNode = nodes.get(dep);
                if (depNode != null) {
                    depNode.dependents.add(toolName);
                }
            }
            if (previous != null) {
                nodes.values().forEach(other -> {
                    if (!other.name.equals(toolName)) {
                        other.dependents.retainAll(edges.getOrDefault(other.name, Set.of()));
                    }
                });
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Registered tool {} with dependencies {}", toolName, deps);
    }

    /**
     * Computes an order in which every dependency precedes its dependents.
     *
     * @return tool names in execution order
     * @throws CyclicDependencyException if the graph contains a cycle
     */
    public List<String> getExecutionOrder() {
        lock.readLock().lock();
        try {
            Map<String, Color> colors = new HashMap<>();
            List<String> order = new ArrayList<>();
            List<String> path = new ArrayList<>();
            for (String toolName : nodes.keySet()) {
                visit(toolName, colors, path, order);
            }
            return order;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void visit(String toolName, Map<String, Color> colors, List<String> path, List<String> order) {
        Color color = colors.getOrDefault(toolName, Color.WHITE);
        if (color == Color.BLACK) {
            return;
        }
        if (color == Color.GRAY) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(toolName), path.size()));
            cycle.add(toolName);
            log.warn("Circular dependency detected: {}", String.join(" -> ", cycle));
            throw new CyclicDependencyException(cycle);
        }

        colors.put(toolName, Color.GRAY);
        path.add(toolName);
        Node node = nodes.get(toolName);
        if (node != null) {
            for (String dep : node.dependencies) {
                visit(dep, colors, path, order);
            }
        }
        path.remove(path.size() - 1);
        colors.put(toolName, Color.BLACK);
        order.add(toolName);
    }

    /**
     * Groups tools into layers; every tool's dependencies sit in earlier layers, so the
     * tools of one layer can run in parallel.
     *
     * @return execution layers
     * @throws CyclicDependencyException if the graph contains a cycle
     */
    public List<List<String>> getExecutionLayers() {
        List<String> order = getExecutionOrder();
        lock.readLock().lock();
        try {
            Map<String, Integer> depth = new HashMap<>();
            List<List<String>> layers = new ArrayList<>();
            for (String toolName : order) {
                Node node = nodes.get(toolName);
                int level = 0;
                if (node != null) {
                    for (String dep : node.dependencies) {
                        level = Math.max(level, depth.getOrDefault(dep, 0) + 1);
                    }
                }
                depth.put(toolName, level);
                while (layers.size() <= level) {
                    layers.add(new ArrayList<>());
                }
                layers.get(level).add(toolName);
            }
            return layers;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DependencyNode> getNode(String toolName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(toolName)).map(Node::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String toolName) {
        lock.readLock().lock();
        try {
            return nodes.containsKey(toolName);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> getDependents(String toolName) {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(edges.getOrDefault(toolName, Set.of())));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DependencyNode> getNodes() {
        lock.readLock().lock();
        try {
            return nodes.values().stream().map(Node::snapshot).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Run bookkeeping ====================

    public void markWaiting(String toolName) {
        updateStatus(toolName, NodeStatus.WAITING, false);
    }

    public void markRunning(String toolName) {
        updateStatus(toolName, NodeStatus.RUNNING, false);
    }

    public void markCompleted(String toolName) {
        updateStatus(toolName, NodeStatus.COMPLETED, true);
    }

    public void markFailed(String toolName) {
        updateStatus(toolName, NodeStatus.FAILED, true);
    }

    private void updateStatus(String toolName, NodeStatus status, boolean finished) {
        lock.writeLock().lock();
        try {
            Node node = nodes.get(toolName);
            if (node == null) {
                log.debug("Ignoring status {} for unregistered tool {}", status, toolName);
                return;
            }
            node.status = status;
            if (finished) {
                node.lastRun = clock.instant();
                node.runCount++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static final class Node {

        private final String name;
        private final List<String> dependencies;
        private final Set<String> dependents = new LinkedHashSet<>();
        private NodeStatus status = NodeStatus.READY;
        private Instant lastRun;
        private int runCount;

        private Node(String name, List<String> dependencies) {
            this.name = name;
            this.dependencies = dependencies;
        }

        private DependencyNode snapshot() {
            return new DependencyNode(name, dependencies, dependents, status, lastRun, runCount);
        }
    }
}
