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

/**
 * Embedded transactional key-value store with ordered keys.
 * <p>
 * Write transactions are serialized: at most one write callback runs at a time and
 * its changes are committed together, or not at all if the callback throws.
 */
public interface KeyValueStore extends AutoCloseable {

    <T> T read(ReadCallback<T> callback);

    <T> T write(WriteCallback<T> callback);

    @Override
    void close();

    @FunctionalInterface
    interface ReadCallback<T> {
        T doInTransaction(ReadTransaction transaction);
    }

    @FunctionalInterface
    interface WriteCallback<T> {
        T doInTransaction(WriteTransaction transaction);
    }
}
