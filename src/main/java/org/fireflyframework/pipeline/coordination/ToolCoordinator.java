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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.error.ErrorClassifier;
import org.fireflyframework.pipeline.error.WorkflowError;
import org.fireflyframework.pipeline.escalation.ConditionEvaluator;
import org.fireflyframework.pipeline.escalation.EscalationRouter;
import org.fireflyframework.pipeline.escalation.MatchedRule;
import org.fireflyframework.pipeline.escalation.RetryPolicy;
import org.fireflyframework.pipeline.escalation.RuleCondition;
import org.fireflyframework.pipeline.exception.CoordinationDispatchException;
import org.fireflyframework.pipeline.exception.CoordinationException;
import org.fireflyframework.pipeline.exception.CoordinationNotFoundException;
import org.fireflyframework.pipeline.exception.CoordinationTimeoutException;
import org.fireflyframework.pipeline.graph.ToolDependencyGraph;
import org.fireflyframework.pipeline.metrics.PipelineMetrics;
import org.fireflyframework.pipeline.model.ToolEvent;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orchestrates hand-offs between tools.
 * <p>
 * {@link #coordinateExecution(ToolEvent)} runs every coordination rule matching an event,
 * highest priority first, one after the other. An error from a hand-off (dispatch failure,
 * timeout, cancellation) aborts the chain with that error. A hand-off the target resolves as
 * unsuccessful is kept as the current result and the chain moves on; the last result is returned. Each hand-off sends one message through the
 * {@link CommunicationBridge} and waits until the target resolves it with
 * {@link #completeCoordination(String, CoordinationResult)}, the timeout elapses or the
 * subscriber cancels.
 * <p>
 * {@link #escalate(WorkflowError, Map)} turns a stage failure into a decision: abort fatal
 * errors, redirect to a corrective tool when an escalation rule matches, otherwise retry.
 * <p>
 * Registry maps are guarded by a read/write lock held only for the map operation itself.
 * Transforms and message dispatch run outside the lock.
 */
@Slf4j
public class ToolCoordinator implements AutoCloseable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final ToolDependencyGraph graph;
    private final EscalationRouter router;
    private final CommunicationBridge bridge;
    private final ErrorClassifier errorClassifier;
    private final Duration timeout;
    private final boolean escalationEnabled;
    private final PipelineMetrics metrics;
    private final CoordinationUsageRecorder usage;
    private final Clock clock;

    private final Map<String, ToolCapability> tools = new LinkedHashMap<>();
    private final Map<String, CoordinationRule> rules = new LinkedHashMap<>();
    private final Map<String, ActiveCoordination> active = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public ToolCoordinator(ToolDependencyGraph graph, EscalationRouter router, CommunicationBridge bridge,
                           ErrorClassifier errorClassifier, Duration timeout, boolean escalationEnabled,
                           int usageQueueCapacity, @Nullable PipelineMetrics metrics) {
        this(graph, router, bridge, errorClassifier, timeout, escalationEnabled, usageQueueCapacity, metrics,
                Clock.systemUTC());
    }

    public ToolCoordinator(ToolDependencyGraph graph, EscalationRouter router, CommunicationBridge bridge,
                           ErrorClassifier errorClassifier, Duration timeout, boolean escalationEnabled,
                           int usageQueueCapacity, @Nullable PipelineMetrics metrics, Clock clock) {
        this.graph = graph;
        this.router = router;
        this.bridge = bridge;
        this.errorClassifier = errorClassifier;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.escalationEnabled = escalationEnabled;
        this.metrics = metrics;
        this.usage = new CoordinationUsageRecorder(usageQueueCapacity);
        this.clock = clock;
    }

    // ==================== Registration ====================

    /**
     * Registers a tool and adds it to the dependency graph.
     */
    public void registerTool(ToolCapability capability) {
        lock.writeLock().lock();
        try {
            tools.put(capability.toolName(), capability);
        } finally {
            lock.writeLock().unlock();
        }
        graph.addNode(capability.toolName(), capability.dependencies());
        log.debug("Registered tool {}", capability.toolName());
    }

    /**
     * Adds or replaces a coordination rule.
     *
     * @throws CoordinationException if the source or target tool is not registered
     */
    public void addCoordinationRule(CoordinationRule rule) {
        lock.writeLock().lock();
        try {
            if (!tools.containsKey(rule.sourceTool())) {
                throw new CoordinationException("Unknown source tool: " + rule.sourceTool());
            }
            if (!tools.containsKey(rule.targetTool())) {
                throw new CoordinationException("Unknown target tool: " + rule.targetTool());
            }
            rules.put(rule.id(), rule);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added coordination rule {}: {}/{} -> {}",
                rule.id(), rule.sourceTool(), rule.triggerEvent(), rule.targetTool());
    }

    public boolean isToolRegistered(String toolName) {
        lock.readLock().lock();
        try {
            return tools.containsKey(toolName);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Coordination ====================

    /**
     * Runs the coordination rules matching an event.
     *
     * @return the result of the last executed hand-off, or a successful
     * {@link CoordinationResult#NO_APPLICABLE_RULES} result when nothing matched
     */
    public Mono<CoordinationResult> coordinateExecution(ToolEvent event) {
        return Mono.defer(() -> {
            List<CoordinationRule> matching = findMatchingRules(event);
            if (matching.isEmpty()) {
                log.debug("No coordination rules for {}/{}", event.sourceTool(), event.eventType());
                return Mono.just(CoordinationResult.noApplicableRules());
            }
            log.debug("Coordinating {}/{} through {} rules", event.sourceTool(), event.eventType(), matching.size());
            return Flux.fromIterable(matching)
                    .concatMap(rule -> executeCoordination(rule, event))
                    .last();
        });
    }

    private List<CoordinationRule> findMatchingRules(ToolEvent event) {
        List<CoordinationRule> candidates;
        lock.readLock().lock();
        try {
            candidates = new ArrayList<>(rules.values());
        } finally {
            lock.readLock().unlock();
        }
        List<CoordinationRule> matching = new ArrayList<>();
        for (CoordinationRule rule : candidates) {
            if (rule.sourceTool().equals(event.sourceTool())
                    && rule.triggerEvent().equals(event.eventType())
                    && ConditionEvaluator.matchesAll(rule.conditions(), event.data(), event.context())) {
                matching.add(rule);
            }
        }
        matching.sort(Comparator.comparingInt(CoordinationRule::priority).reversed());
        return matching;
    }

    private Mono<CoordinationResult> executeCoordination(CoordinationRule rule, ToolEvent event) {
        return Mono.defer(() -> {
            String coordinationId = "coord_" + UUID.randomUUID();
            Instant startTime = clock.instant();
            ActiveCoordination coordination = new ActiveCoordination(coordinationId, rule.id(),
                    rule.sourceTool(), rule.targetTool(), startTime, event.context());

            lock.writeLock().lock();
            try {
                active.put(coordinationId, coordination);
            } finally {
                lock.writeLock().unlock();
            }
            if (metrics != null) {
                metrics.recordCoordinationStarted();
            }

            Map<String, Object> payload;
            try {
                payload = rule.applyTransform(event.data());
            } catch (RuntimeException e) {
                coordination.transition(CoordinationStatus.FAILED);
                finish(coordination);
                return Mono.error(new CoordinationDispatchException(coordinationId, rule.sourceTool(),
                        rule.targetTool(), "transform failed", e));
            }

            ToolMessage message = ToolMessage.coordination(rule.sourceTool(), rule.targetTool(), payload,
                    event.context(), coordinationId, startTime);
            coordination.addMessage(message);
            log.debug("Coordination {} started: {} -> {} (rule {})",
                    coordinationId, rule.sourceTool(), rule.targetTool(), rule.id());

            return bridge.send(rule.sourceTool(), rule.targetTool(), message)
                    .onErrorMap(e -> !(e instanceof CoordinationException),
                            e -> new CoordinationDispatchException(coordinationId, rule.sourceTool(),
                                    rule.targetTool(), "dispatch failed", e))
                    .then(coordination.completion().timeout(timeout))
                    .onErrorMap(TimeoutException.class,
                            e -> new CoordinationTimeoutException(coordinationId, rule.targetTool(), timeout))
                    .map(result -> result.withTiming(Duration.between(startTime, clock.instant()), Map.of(
                            "coordination_id", coordinationId,
                            "rule_id", rule.id(),
                            "status", coordination.getStatus().value())))
                    .doOnNext(result -> finish(coordination))
                    .doOnError(e -> {
                        coordination.transition(e instanceof CoordinationTimeoutException
                                ? CoordinationStatus.TIMEOUT
                                : CoordinationStatus.FAILED);
                        log.warn("Coordination {} {} -> {} ended with {}: {}", coordinationId,
                                rule.sourceTool(), rule.targetTool(), coordination.getStatus(), e.getMessage());
                        finish(coordination);
                    })
                    .doOnCancel(() -> {
                        if (coordination.transition(CoordinationStatus.CANCELLED)) {
                            log.info("Coordination {} cancelled", coordinationId);
                        }
                        finish(coordination);
                    });
        });
    }

    /**
     * Removes a resolved coordination and records its usage. Idempotent.
     */
    private void finish(ActiveCoordination coordination) {
        ActiveCoordination removed;
        lock.writeLock().lock();
        try {
            removed = active.remove(coordination.getId());
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            return;
        }
        Instant finishedAt = clock.instant();
        Duration elapsed = Duration.between(coordination.getStartTime(), finishedAt);
        CoordinationStatus status = coordination.getStatus();
        usage.recordCoordination(coordination.getSourceTool(), coordination.getTargetTool(),
                status == CoordinationStatus.COMPLETED, elapsed, finishedAt);
        if (metrics != null) {
            metrics.recordCoordinationCompleted(coordination.getSourceTool(), coordination.getTargetTool(),
                    status, elapsed);
        }
        log.debug("Coordination {} finished with status {} in {}ms", coordination.getId(), status, elapsed.toMillis());
    }

    /**
     * Resolves an in-flight coordination with the target tool's result.
     *
     * @throws CoordinationNotFoundException if no such coordination is in flight
     * @throws IllegalStateException if the coordination was already resolved
     */
    public void completeCoordination(String coordinationId, CoordinationResult result) {
        ActiveCoordination coordination;
        lock.readLock().lock();
        try {
            coordination = active.get(coordinationId);
        } finally {
            lock.readLock().unlock();
        }
        if (coordination == null) {
            throw new CoordinationNotFoundException(coordinationId);
        }
        if (!coordination.resolve(result)) {
            throw new IllegalStateException("Coordination " + coordinationId + " already completed");
        }
        log.debug("Coordination {} resolved, success={}", coordinationId, result.success());
    }

    public List<ActiveCoordination> getActiveCoordinations() {
        lock.readLock().lock();
        try {
            return List.copyOf(active.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns coordination usage. Updates applied off the hot path may lag slightly.
     */
    public CoordinationMetrics getMetrics() {
        return usage.snapshot();
    }

    /**
     * Waits until queued usage and graph updates have been applied.
     */
    public void flushUsage(Duration timeout) {
        usage.flush(timeout);
    }

    // ==================== Escalation ====================

    /**
     * Decides what to do with a failed stage.
     * <ul>
     *   <li>fatal errors abort;</li>
     *   <li>with escalation disabled, or when no rule matches, retryable errors retry with the
     *   tool's policy and the others abort;</li>
     *   <li>otherwise the highest-priority rule decides. A redirect hands the failure to the
     *   target tool and completes with the coordination result.</li>
     * </ul>
     */
    public Mono<EscalationDecision> escalate(WorkflowError error, Map<String, Object> context) {
        return Mono.defer(() -> {
            String sourceTool = error.toolName();
            if (errorClassifier.isFatal(error)) {
                log.warn("Fatal error in {} ({}), aborting: {}", sourceTool, error.errorType(), error.message());
                recordEscalation(sourceTool, null, "abort");
                return Mono.just(EscalationDecision.abort(sourceTool, "fatal error"));
            }

            List<MatchedRule> matches = escalationEnabled
                    ? router.route(ToolEvent.fromError(error, context))
                    : List.of();
            if (matches.isEmpty()) {
                return Mono.just(fallback(error, escalationEnabled ? "no matching rule" : "escalation disabled"));
            }

            MatchedRule top = matches.get(0);
            if (matches.size() > 1) {
                log.debug("{} escalation rules matched for {}, applying {}", matches.size(), sourceTool,
                        top.rule().id());
            }
            return switch (top.action()) {
                case ABORT -> {
                    recordEscalation(sourceTool, null, "abort");
                    yield Mono.just(EscalationDecision.abort(sourceTool, "rule " + top.rule().id()));
                }
                case RETRY -> {
                    recordEscalation(sourceTool, sourceTool, "retry");
                    yield Mono.just(EscalationDecision.retry(sourceTool, top.retryPolicy(), "rule " + top.rule().id()));
                }
                case REDIRECT -> redirect(top, error, context);
            };
        });
    }

    private EscalationDecision fallback(WorkflowError error, String reason) {
        String sourceTool = error.toolName();
        if (!error.retryable()) {
            recordEscalation(sourceTool, null, "abort");
            return EscalationDecision.abort(sourceTool, "not retryable, " + reason);
        }
        RetryPolicy policy = router.retryPolicyFor(sourceTool);
        recordEscalation(sourceTool, sourceTool, "retry");
        return EscalationDecision.retry(sourceTool, policy, reason);
    }

    private Mono<EscalationDecision> redirect(MatchedRule match, WorkflowError error, Map<String, Object> context) {
        String sourceTool = match.sourceTool();
        String targetTool = match.targetTool();
        if (!isToolRegistered(targetTool)) {
            return Mono.error(new CoordinationException("No target tool registered for escalation: " + targetTool));
        }

        Map<String, String> parameters = router.buildRedirectParameters(match);
        Map<String, Object> escalatedContext = new LinkedHashMap<>(context != null ? context : Map.of());
        escalatedContext.putAll(parameters);

        CoordinationRule handOff = CoordinationRule.builder()
                .id(match.rule().id())
                .name(match.rule().name())
                .sourceTool(sourceTool)
                .targetTool(targetTool)
                .triggerEvent(ToolEvent.TOOL_FAILED)
                .transform(data -> {
                    Map<String, Object> payload = new LinkedHashMap<>(data);
                    payload.put("parameters", parameters);
                    return payload;
                })
                .priority(match.priority())
                .build();

        usage.submit(() -> {
            graph.markFailed(sourceTool);
            graph.markRunning(targetTool);
        });
        log.info("Escalating {} failure to {} (rule {})", sourceTool, targetTool, match.rule().id());
        recordEscalation(sourceTool, targetTool, "redirect");

        ToolEvent event = new ToolEvent(sourceTool, ToolEvent.TOOL_FAILED, error.toFields(), escalatedContext, null);
        return executeCoordination(handOff, event)
                .doOnNext(result -> usage.submit(() -> {
                    if (result.success()) {
                        graph.markCompleted(targetTool);
                    } else {
                        graph.markFailed(targetTool);
                    }
                }))
                .doOnError(e -> usage.submit(() -> graph.markFailed(targetTool)))
                .map(result -> EscalationDecision.redirected(sourceTool, targetTool, parameters, result));
    }

    private void recordEscalation(String sourceTool, String targetTool, String action) {
        if (metrics != null) {
            metrics.recordEscalation(sourceTool, targetTool, action);
        }
    }

    // ==================== Defaults ====================

    /**
     * Registers the tools of the containerization pipeline with their dependencies.
     */
    public void registerDefaultTools() {
        registerTool(ToolCapability.of("analyze_repository"));
        registerTool(ToolCapability.of("generate_dockerfile", "analyze_repository"));
        registerTool(ToolCapability.of("build_image", "generate_dockerfile"));
        registerTool(ToolCapability.of("scan_security", "build_image"));
        registerTool(ToolCapability.of("push_image", "build_image"));
        registerTool(ToolCapability.of("generate_manifests", "build_image"));
        registerTool(ToolCapability.of("deploy_kubernetes", "generate_manifests"));
        registerTool(ToolCapability.of("verify_deployment", "deploy_kubernetes"));
    }

    /**
     * Registers the built-in coordination rules. The referenced tools must be registered.
     */
    public void registerDefaultRules() {
        addCoordinationRule(CoordinationRule.builder()
                .id("build_failure_analysis")
                .name("Re-analyze repository on Dockerfile errors")
                .sourceTool("build_image")
                .targetTool("analyze_repository")
                .triggerEvent("build_failed")
                .conditions(List.of(RuleCondition.equalTo("error_type", "dockerfile_error")))
                .priority(10)
                .build());
        addCoordinationRule(CoordinationRule.builder()
                .id("security_vulnerability_rebuild")
                .name("Rebuild on severe vulnerabilities")
                .sourceTool("scan_security")
                .targetTool("build_image")
                .triggerEvent("vulnerabilities_found")
                .conditions(List.of(RuleCondition.metricAbove("severity_score", 7.0)))
                .priority(9)
                .build());
        addCoordinationRule(CoordinationRule.builder()
                .id("deployment_manifest_fix")
                .name("Regenerate manifests on invalid manifests")
                .sourceTool("deploy_kubernetes")
                .targetTool("generate_manifests")
                .triggerEvent("deployment_failed")
                .conditions(List.of(RuleCondition.equalTo("error_type", "manifest_invalid")))
                .priority(8)
                .build());
    }

    @Override
    public void close() {
        usage.close();
    }
}
