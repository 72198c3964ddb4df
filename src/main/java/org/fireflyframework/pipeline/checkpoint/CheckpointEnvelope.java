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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Durable wire format around checkpoint bytes.
 * <p>
 * When {@code compressed} is true, {@code data.length} is strictly less than {@code dataSize}.
 *
 * @param version envelope format version, 1 or greater
 * @param compressed whether {@code data} is GZIP compressed
 * @param checksum SHA-256 hex digest of {@code data} as stored
 * @param dataSize size of the uncompressed payload
 * @param createdAt when the envelope was written
 * @param metadata descriptive metadata, see the {@code META_*} keys
 * @param data the payload, base64 in JSON
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointEnvelope(
        int version,
        boolean compressed,
        String checksum,
        int dataSize,
        Instant createdAt,
        Map<String, String> metadata,
        byte[] data
) {

    public static final int CURRENT_VERSION = 1;

    public static final String META_SESSION_ID = "session_id";
    public static final String META_CHECKPOINT_ID = "checkpoint_id";
    public static final String META_STAGE_NAME = "stage_name";
    public static final String META_WORKFLOW_NAME = "workflow_name";
    public static final String META_COMPRESSION_MODE = "compression_mode";
    public static final String META_INCREMENTAL = "incremental";
    public static final String META_PARENT_CHECKPOINT = "parent_checkpoint";

    public CheckpointEnvelope {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public String metadataValue(String key) {
        return metadata.get(key);
    }
}
