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
import org.fireflyframework.pipeline.model.ToolEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds per-source-tool routing rules and per-class retry policies, and matches
 * tool events against them.
 * <p>
 * Matching is conjunctive over a rule's conditions and ignores disabled rules. Matches
 * are returned in descending priority; rules of equal priority keep registration order.
 * An event that already carries escalation markers is never routed again, which bounds
 * redirect chains to a single hop.
 */
@Slf4j
public class EscalationRouter {

    public static final String ESCALATED_BUILD = "escalated_build";

    public static final String PARAM_ESCALATION_SOURCE = "escalation_source";
    public static final String PARAM_ESCALATION_MODE = "escalation_mode";
    public static final String PARAM_ESCALATION_RULE = "escalation_rule";
    public static final String PARAM_FIX_ERRORS = "fix_errors";
    public static final String ESCALATION_MODE_AUTO = "auto";

    static final String BUILD_IMAGE = "build_image";

    private final Map<String, List<ErrorRoutingRule>> rulesByTool = new HashMap<>();
    private final Map<String, RetryPolicy> retryPolicies = new HashMap<>();
    private final RetryPolicy defaultPolicy;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public EscalationRouter() {
        this(RetryPolicy.DEFAULT, RetryPolicy.ESCALATED_BUILD);
    }

    public EscalationRouter(RetryPolicy defaultPolicy, RetryPolicy escalatedBuildPolicy) {
        this.defaultPolicy = defaultPolicy;
        this.retryPolicies.put(ESCALATED_BUILD, escalatedBuildPolicy);
    }

    // ==================== Registration ====================

    /**
     * Replaces the rule set of a source tool.
     */
    public void registerRules(String sourceTool, List<ErrorRoutingRule> rules) {
        lock.writeLock().lock();
        try {
            rulesByTool.put(sourceTool, new ArrayList<>(rules));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Registered {} routing rules for tool {}", rules.size(), sourceTool);
    }

    /**
     * Appends a rule to a source tool's rule set.
     */
    public void addRule(String sourceTool, ErrorRoutingRule rule) {
        lock.writeLock().lock();
        try {
            rulesByTool.computeIfAbsent(sourceTool, t -> new ArrayList<>()).add(rule);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added routing rule {} for tool {}", rule.id(), sourceTool);
    }

    public void registerRetryPolicy(String policyClass, RetryPolicy policy) {
        lock.writeLock().lock();
        try {
            retryPolicies.put(policyClass, policy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ErrorRoutingRule> getRules(String sourceTool) {
        lock.readLock().lock();
        try {
            return List.copyOf(rulesByTool.getOrDefault(sourceTool, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Routing ====================

    /**
     * Returns the rules of the event's source tool that match it, highest priority first.
     */
    public List<MatchedRule> route(ToolEvent event) {
        if (isEscalation(event.context()) || isEscalation(event.data())) {
            log.debug("Event from {} is already an escalation from {}, not routing again",
                    event.sourceTool(), escalationSource(event.context()).or(() -> escalationSource(event.data()))
                            .orElse("unknown"));
            return List.of();
        }

        List<ErrorRoutingRule> candidates = getRules(event.sourceTool());
        List<MatchedRule> matched = new ArrayList<>();
        for (ErrorRoutingRule rule : candidates) {
            if (rule.enabled() && ConditionEvaluator.matchesAll(rule.conditions(), event.data(), event.context())) {
                matched.add(new MatchedRule(event.sourceTool(), rule, policyForMatch(event.sourceTool(), rule)));
            }
        }
        matched.sort(Comparator.comparingInt(MatchedRule::priority).reversed());

        log.debug("Routing event {} from {}: {} of {} rules matched",
                event.eventType(), event.sourceTool(), matched.size(), candidates.size());
        return matched;
    }

    /**
     * Returns the retry policy of a tool or escalation class, falling back to the default policy.
     */
    public RetryPolicy retryPolicyFor(String policyClass) {
        lock.readLock().lock();
        try {
            return retryPolicies.getOrDefault(policyClass, defaultPolicy);
        } finally {
            lock.readLock().unlock();
        }
    }

    private RetryPolicy policyForMatch(String sourceTool, ErrorRoutingRule rule) {
        if (rule.action() != RoutingAction.REDIRECT) {
            return retryPolicyFor(sourceTool);
        }
        return BUILD_IMAGE.equals(rule.redirectTo()) ? retryPolicyFor(ESCALATED_BUILD) : retryPolicyFor(rule.redirectTo());
    }

    /**
     * Builds the flat parameter map handed to the redirect target.
     */
    public Map<String, String> buildRedirectParameters(MatchedRule match) {
        Map<String, String> params = new LinkedHashMap<>(match.rule().parameters());
        if (match.rule().fixErrors()) {
            params.put(PARAM_FIX_ERRORS, "true");
        }
        params.put(PARAM_ESCALATION_RULE, match.rule().id());
        params.put(PARAM_ESCALATION_SOURCE, match.sourceTool());
        params.put(PARAM_ESCALATION_MODE, ESCALATION_MODE_AUTO);
        return params;
    }

    /**
     * Whether the given parameters mark an invocation made as a correction.
     */
    public static boolean isEscalation(Map<String, ?> params) {
        return params != null && ESCALATION_MODE_AUTO.equals(String.valueOf(params.get(PARAM_ESCALATION_MODE)));
    }

    /**
     * The tool whose failure caused an escalated invocation.
     */
    public static Optional<String> escalationSource(Map<String, ?> params) {
        if (!isEscalation(params)) {
            return Optional.empty();
        }
        return Optional.ofNullable(params.get(PARAM_ESCALATION_SOURCE)).map(String::valueOf);
    }

    // ==================== Defaults ====================

    /**
     * Registers the built-in rules of the containerization pipeline.
     */
    public void registerDefaultRules() {
        registerRules(BUILD_IMAGE, List.of(
                ErrorRoutingRule.builder()
                        .id("build_dockerfile_escalation")
                        .name("Dockerfile escalation")
                        .description("Regenerate the Dockerfile when the build fails on it")
                        .conditions(List.of(
                                RuleCondition.contains("error_type", "build_error"),
                                RuleCondition.contains("message", "dockerfile")))
                        .action(RoutingAction.REDIRECT)
                        .redirectTo("generate_dockerfile")
                        .fixErrors(true)
                        .priority(100)
                        .enabled(true)
                        .build(),
                ErrorRoutingRule.builder()
                        .id("build_resource_escalation")
                        .name("Resource escalation")
                        .description("Regenerate manifests with adjusted resources when the build runs out of them")
                        .conditions(List.of(
                                RuleCondition.contains("error_type", "build_error"),
                                RuleCondition.contains("message", "resource")))
                        .action(RoutingAction.REDIRECT)
                        .redirectTo("generate_manifests")
                        .parameters(Map.of("fix_resources", "true"))
                        .priority(90)
                        .enabled(true)
                        .build()));

        addRedirect("deploy_kubernetes", "generate_manifests");
        addRedirect("scan_security", "generate_dockerfile");
        addRedirect("push_image", BUILD_IMAGE);
        addRedirect("verify_deployment", "deploy_kubernetes");
    }

    private void addRedirect(String sourceTool, String targetTool) {
        addRule(sourceTool, ErrorRoutingRule.builder()
                .id(sourceTool + "_to_" + targetTool)
                .name(sourceTool + " -> " + targetTool)
                .description("Hand failures of " + sourceTool + " to " + targetTool)
                .action(RoutingAction.REDIRECT)
                .redirectTo(targetTool)
                .fixErrors(true)
                .priority(50)
                .enabled(true)
                .build());
    }
}
