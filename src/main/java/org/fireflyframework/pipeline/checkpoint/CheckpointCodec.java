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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Serializes checkpoints into {@link CheckpointEnvelope}s and back.
 * <p>
 * The payload is GZIP compressed only when that makes it strictly smaller. The checksum is a
 * SHA-256 hex digest of the payload bytes as stored. Reading accepts both envelopes and the
 * unwrapped checkpoint JSON written before envelopes existed; the {@code version} field decides.
 */
@Slf4j
public class CheckpointCodec {

    static final String COMPRESSION_GZIP = "gzip";
    static final String COMPRESSION_NONE = "none";

    private final ObjectMapper objectMapper;
    private final ObjectWriter canonicalWriter;
    private final boolean compressionEnabled;

    public CheckpointCodec(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        this.canonicalWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Wraps a checkpoint into an envelope.
     *
     * @param checkpoint the checkpoint
     * @param metadata envelope metadata; null values are dropped
     * @param createdAt envelope creation time
     * @return the envelope
     * @throws IOException if the checkpoint cannot be serialized or compressed
     */
    public CheckpointEnvelope encode(WorkflowCheckpoint checkpoint, Map<String, String> metadata, Instant createdAt)
            throws IOException {
        byte[] payload = objectMapper.writeValueAsBytes(checkpoint);
        byte[] stored = payload;
        boolean compressed = false;
        if (compressionEnabled) {
            byte[] gzipped = compress(payload);
            if (gzipped.length < payload.length) {
                stored = gzipped;
                compressed = true;
            }
        }

        Map<String, String> meta = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (value != null) {
                meta.put(key, value);
            }
        });
        meta.put(CheckpointEnvelope.META_COMPRESSION_MODE, compressed ? COMPRESSION_GZIP : COMPRESSION_NONE);

        log.debug("Encoded checkpoint {}: dataSize={}, storedSize={}, compressed={}",
                checkpoint.id(), payload.length, stored.length, compressed);

        return new CheckpointEnvelope(CheckpointEnvelope.CURRENT_VERSION, compressed, checksum(stored),
                payload.length, createdAt, meta, stored);
    }

    public byte[] write(CheckpointEnvelope envelope) throws IOException {
        return objectMapper.writeValueAsBytes(envelope);
    }

    /**
     * Reads a stored record, either an envelope or a legacy unwrapped checkpoint.
     *
     * @param raw the stored bytes
     * @return the decoded checkpoint with its envelope and checksum outcome
     * @throws IOException if the record cannot be parsed or decompressed
     */
    public DecodedCheckpoint decode(byte[] raw) throws IOException {
        JsonNode root = objectMapper.readTree(raw);
        if (root == null || !root.isObject()) {
            throw new IOException("Checkpoint record is not a JSON object");
        }
        JsonNode version = root.get("version");
        if (version == null || !version.isInt() || version.asInt() < 1) {
            WorkflowCheckpoint legacy = objectMapper.treeToValue(root, WorkflowCheckpoint.class);
            return new DecodedCheckpoint(legacy, null, true, null);
        }

        CheckpointEnvelope envelope = objectMapper.treeToValue(root, CheckpointEnvelope.class);
        byte[] stored = envelope.data() != null ? envelope.data() : new byte[0];
        String actual = checksum(stored);
        boolean checksumValid = envelope.checksum() == null
                || envelope.checksum().isEmpty()
                || envelope.checksum().equalsIgnoreCase(actual);
        byte[] payload = envelope.compressed() ? decompress(stored) : stored;
        WorkflowCheckpoint checkpoint = objectMapper.readValue(payload, WorkflowCheckpoint.class);
        return new DecodedCheckpoint(checkpoint, envelope, checksumValid, actual);
    }

    /**
     * Structural equality through canonical JSON, map keys sorted.
     */
    public boolean sameValue(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        try {
            return Objects.equals(canonicalWriter.writeValueAsString(left), canonicalWriter.writeValueAsString(right));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize values for comparison, treating them as different: {}", e.getMessage());
            return false;
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    static byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(data);
        }
        return buffer.toByteArray();
    }

    static byte[] decompress(byte[] data) throws IOException {
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return gzip.readAllBytes();
        }
    }

    static String checksum(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Outcome of {@link #decode(byte[])}.
     *
     * @param checkpoint the checkpoint
     * @param envelope the envelope, null for legacy records
     * @param checksumValid false when the stored checksum does not match the data
     * @param actualChecksum checksum computed on read, null for legacy records
     */
    public record DecodedCheckpoint(
            WorkflowCheckpoint checkpoint,
            CheckpointEnvelope envelope,
            boolean checksumValid,
            String actualChecksum
    ) {

        public boolean isLegacy() {
            return envelope == null;
        }
    }
}
