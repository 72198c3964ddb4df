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

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An in-flight hand-off. Exists only while its status is {@link CoordinationStatus#RUNNING};
 * the coordinator removes it once it is resolved, cancelled or timed out.
 */
public class ActiveCoordination {

    private final String id;
    private final String ruleId;
    private final String sourceTool;
    private final String targetTool;
    private final Instant startTime;
    private final Map<String, Object> context;
    private final List<ToolMessage> messages = new CopyOnWriteArrayList<>();
    private final AtomicReference<CoordinationStatus> status = new AtomicReference<>(CoordinationStatus.RUNNING);
    private final Sinks.One<CoordinationResult> completion = Sinks.one();

    ActiveCoordination(String id, String ruleId, String sourceTool, String targetTool,
                       Instant startTime, Map<String, Object> context) {
        this.id = id;
        this.ruleId = ruleId;
        this.sourceTool = sourceTool;
        this.targetTool = targetTool;
        this.startTime = startTime;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String getId() {
        return id;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getSourceTool() {
        return sourceTool;
    }

    public String getTargetTool() {
        return targetTool;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public List<ToolMessage> getMessages() {
        return List.copyOf(messages);
    }

    public CoordinationStatus getStatus() {
        return status.get();
    }

    void addMessage(ToolMessage message) {
        messages.add(message);
    }

    /**
     * Moves a running coordination to a final status.
     *
     * @return false if the coordination was already resolved
     */
    boolean transition(CoordinationStatus next) {
        return status.compareAndSet(CoordinationStatus.RUNNING, next);
    }

    boolean resolve(CoordinationResult result) {
        if (!transition(result.success() ? CoordinationStatus.COMPLETED : CoordinationStatus.FAILED)) {
            return false;
        }
        completion.tryEmitValue(result);
        return true;
    }

    Mono<CoordinationResult> completion() {
        return completion.asMono();
    }
}
