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

package org.fireflyframework.pipeline.kv;

import java.util.List;
import java.util.Optional;

/**
 * Read view of the key-value store, valid only inside a {@link KeyValueStore#read} or
 * {@link KeyValueStore#write} callback.
 */
public interface ReadTransaction {

    /**
     * Gets the value stored under a key.
     *
     * @param bucket the bucket name
     * @param key the key
     * @return the value, or empty if the bucket or key does not exist
     */
    Optional<byte[]> get(String bucket, String key);

    /**
     * Returns all entries whose key starts with the prefix, in ascending key order.
     * A missing bucket yields an empty list.
     *
     * @param bucket the bucket name
     * @param prefix the key prefix, empty for a full scan
     * @return matching entries
     */
    List<KeyValue> scan(String bucket, String prefix);
}
