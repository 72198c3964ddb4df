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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Message exchanged between tools through a {@link CommunicationBridge}.
 *
 * @param id message id ({@code msg_...})
 * @param from sending tool
 * @param to receiving tool
 * @param type message type, {@code coordination} for rule hand-offs
 * @param payload transformed event data
 * @param context caller context
 * @param timestamp creation time
 * @param replyTo id of the message this one answers, if any
 * @param correlationId id of the coordination the message belongs to
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ToolMessage(
        String id,
        String from,
        String to,
        String type,
        Map<String, Object> payload,
        Map<String, Object> context,
        Instant timestamp,
        String replyTo,
        String correlationId
) {

    public static final String TYPE_COORDINATION = "coordination";

    public ToolMessage {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public static ToolMessage coordination(String from, String to, Map<String, Object> payload,
                                           Map<String, Object> context, String correlationId, Instant timestamp) {
        return new ToolMessage("msg_" + UUID.randomUUID(), from, to, TYPE_COORDINATION, payload, context,
                timestamp, null, correlationId);
    }
}
