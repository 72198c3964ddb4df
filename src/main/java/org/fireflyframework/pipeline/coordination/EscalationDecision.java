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

import org.fireflyframework.pipeline.escalation.RetryPolicy;

import java.util.Map;

/**
 * What the engine decided for a failed stage.
 *
 * @param action decision
 * @param sourceTool tool that failed
 * @param targetTool redirect target, null unless redirected
 * @param parameters parameters handed to the redirect target
 * @param retryPolicy policy to apply when the decision is {@link Action#RETRY}
 * @param result coordination result of a redirect
 * @param reason short explanation
 */
public record EscalationDecision(
        Action action,
        String sourceTool,
        String targetTool,
        Map<String, String> parameters,
        RetryPolicy retryPolicy,
        CoordinationResult result,
        String reason
) {

    public enum Action {
        ABORT,
        RETRY,
        REDIRECTED
    }

    public EscalationDecision {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static EscalationDecision abort(String sourceTool, String reason) {
        return new EscalationDecision(Action.ABORT, sourceTool, null, Map.of(), null, null, reason);
    }

    public static EscalationDecision retry(String sourceTool, RetryPolicy policy, String reason) {
        return new EscalationDecision(Action.RETRY, sourceTool, null, Map.of(), policy, null, reason);
    }

    public static EscalationDecision redirected(String sourceTool, String targetTool, Map<String, String> parameters,
                                                CoordinationResult result) {
        return new EscalationDecision(Action.REDIRECTED, sourceTool, targetTool, parameters, null, result,
                "redirected to " + targetTool);
    }
}
