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

package org.fireflyframework.pipeline.checkpoint;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import org.fireflyframework.pipeline.model.WorkflowStatus;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Untagged session state as written before snapshots carried a {@code kind}: an open
 * key/value map. Kept verbatim and upgraded on read.
 */
public class LegacySessionState implements SessionState {

    public static final int SCHEMA_VERSION = 0;

    private final Map<String, Object> values = new LinkedHashMap<>();

    public LegacySessionState() {
    }

    public LegacySessionState(Map<String, Object> values) {
        this.values.putAll(values);
    }

    @JsonAnySetter
    public void set(String key, Object value) {
        values.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public int schemaVersion() {
        return SCHEMA_VERSION;
    }

    /**
     * Extracts typed fields, defaulting anything missing or mistyped: status falls back to
     * {@code pending}, stage lists to empty, timestamps to {@code now}.
     *
     * @param now fallback timestamp
     * @return the equivalent full state
     */
    public FullSessionState migrate(Instant now) {
        return new FullSessionState(
                FullSessionState.CURRENT_SCHEMA_VERSION,
                stringValue("session_id", ""),
                stringValue("workflow_id", ""),
                stringValue("workflow_name", ""),
                WorkflowStatus.fromValue(stringValue("status", null)),
                stringValue("current_stage", ""),
                stringList("completed_stages"),
                stringList("failed_stages"),
                stringList("skipped_stages"),
                objectMap("shared_context"),
                stringMap("resource_bindings"),
                timeValue("start_time", now),
                timeValue("last_activity", now),
                List.of()
        );
    }

    private String stringValue(String key, String defaultValue) {
        Object value = values.get(key);
        return value instanceof String text ? text : defaultValue;
    }

    private List<String> stringList(String key) {
        List<String> result = new ArrayList<>();
        if (values.get(key) instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String text) {
                    result.add(text);
                }
            }
        }
        return result;
    }

    private Map<String, Object> objectMap(String key) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (values.get(key) instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
        }
        return result;
    }

    private Map<String, String> stringMap(String key) {
        Map<String, String> result = new LinkedHashMap<>();
        if (values.get(key) instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (v instanceof String text) {
                    result.put(String.valueOf(k), text);
                }
            });
        }
        return result;
    }

    private Instant timeValue(String key, Instant defaultValue) {
        String text = stringValue(key, null);
        if (text == null) {
            return defaultValue;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return defaultValue;
        }
    }
}
