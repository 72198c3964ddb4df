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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.exception.KeyValueStoreException;
import org.h2.mvstore.Cursor;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Durable {@link KeyValueStore} backed by an H2 MVStore file.
 * <p>
 * Each bucket is an {@link MVMap}. Auto-commit is disabled: a write transaction ends
 * with {@link MVStore#commit()} on success and {@link MVStore#rollback()} on failure,
 * so a crash leaves the last committed version on disk.
 */
@Slf4j
public class MvStoreKeyValueStore implements KeyValueStore {

    private final MVStore store;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public MvStoreKeyValueStore(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.store = new MVStore.Builder()
                    .fileName(file.toString())
                    .autoCommitDisabled()
                    .open();
        } catch (IOException | MVStoreException e) {
            throw new KeyValueStoreException("Failed to open checkpoint store at " + file, e);
        }
        log.info("Opened MVStore key-value store at {}", file);
    }

    @Override
    public <T> T read(ReadCallback<T> callback) {
        lock.readLock().lock();
        try {
            return callback.doInTransaction(new MapTransaction());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T> T write(WriteCallback<T> callback) {
        lock.writeLock().lock();
        try {
            T result;
            try {
                result = callback.doInTransaction(new MapTransaction());
            } catch (RuntimeException e) {
                store.rollback();
                throw e;
            }
            try {
                store.commit();
            } catch (MVStoreException e) {
                store.rollback();
                throw new KeyValueStoreException("Failed to commit write transaction", e);
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        if (!store.isClosed()) {
            log.info("Closing MVStore key-value store");
            store.close();
        }
    }

    private class MapTransaction implements WriteTransaction {

        @Override
        public Optional<byte[]> get(String bucket, String key) {
            if (!store.hasMap(bucket)) {
                return Optional.empty();
            }
            MVMap<String, byte[]> map = store.openMap(bucket);
            return Optional.ofNullable(map.get(key)).map(byte[]::clone);
        }

        @Override
        public List<KeyValue> scan(String bucket, String prefix) {
            List<KeyValue> result = new ArrayList<>();
            if (!store.hasMap(bucket)) {
                return result;
            }
            MVMap<String, byte[]> map = store.openMap(bucket);
            Cursor<String, byte[]> cursor = map.cursor(prefix);
            while (cursor.hasNext()) {
                String key = cursor.next();
                if (!key.startsWith(prefix)) {
                    break;
                }
                result.add(new KeyValue(key, cursor.getValue().clone()));
            }
            return result;
        }

        @Override
        public void put(String bucket, String key, byte[] value) {
            if (value == null) {
                throw new IllegalArgumentException("Value must not be null for key " + key);
            }
            MVMap<String, byte[]> map = store.openMap(bucket);
            map.put(key, value.clone());
        }

        @Override
        public boolean delete(String bucket, String key) {
            if (!store.hasMap(bucket)) {
                return false;
            }
            MVMap<String, byte[]> map = store.openMap(bucket);
            return map.remove(key) != null;
        }
    }
}
