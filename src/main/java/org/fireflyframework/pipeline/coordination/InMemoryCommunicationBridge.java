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
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local bridge: delivers to a registered handler, otherwise queues the message.
 */
@Slf4j
public class InMemoryCommunicationBridge implements CommunicationBridge {

    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, Queue<ToolMessage>> pending = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> send(String fromTool, String toTool, ToolMessage message) {
        return Mono.defer(() -> {
            MessageHandler handler = handlers.get(toTool);
            if (handler == null) {
                pending.computeIfAbsent(toTool, t -> new ConcurrentLinkedQueue<>()).add(message);
                log.debug("Queued message {} from {} to {}, no handler registered", message.id(), fromTool, toTool);
                return Mono.empty();
            }
            log.debug("Delivering message {} from {} to {}", message.id(), fromTool, toTool);
            return handler.handle(message);
        });
    }

    @Override
    public void registerHandler(String toolName, MessageHandler handler) {
        handlers.put(toolName, handler);
        log.debug("Registered message handler for tool {}", toolName);
    }

    @Override
    public List<ToolMessage> getPendingMessages(String toolName) {
        Queue<ToolMessage> queue = pending.get(toolName);
        List<ToolMessage> drained = new ArrayList<>();
        if (queue == null) {
            return drained;
        }
        ToolMessage message;
        while ((message = queue.poll()) != null) {
            drained.add(message);
        }
        return drained;
    }
}
