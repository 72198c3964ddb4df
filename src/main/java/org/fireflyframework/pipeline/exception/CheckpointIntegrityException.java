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

package org.fireflyframework.pipeline.exception;

/**
 * Exception thrown when a stored checkpoint fails checksum verification
 * and the store runs with strict integrity.
 */
public class CheckpointIntegrityException extends CheckpointException {

    private final String expectedChecksum;
    private final String actualChecksum;

    public CheckpointIntegrityException(String sessionId, String checkpointId,
                                        String expectedChecksum, String actualChecksum) {
        super("Checkpoint checksum mismatch for " + checkpointId
                        + ": expected " + expectedChecksum + ", got " + actualChecksum,
                sessionId, checkpointId);
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }

    public String getExpectedChecksum() {
        return expectedChecksum;
    }

    public String getActualChecksum() {
        return actualChecksum;
    }
}
