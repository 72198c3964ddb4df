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

import java.util.List;

/**
 * Channel through which coordinated tools talk to each other.
 */
public interface CommunicationBridge {

    /**
     * Delivers a message to the target tool.
     *
     * @return completes once the message has been accepted by the channel
     */
    Mono<Void> send(String fromTool, String toTool, ToolMessage message);

    /**
     * Registers the handler of a tool. Messages queued for the tool before registration stay
     * queued and can be drained with {@link #getPendingMessages(String)}.
     */
    void registerHandler(String toolName, MessageHandler handler);

    /**
     * Drains the messages queued for a tool without a handler.
     */
    List<ToolMessage> getPendingMessages(String toolName);
}
