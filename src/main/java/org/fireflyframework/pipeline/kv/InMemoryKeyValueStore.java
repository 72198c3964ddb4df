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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory {@link KeyValueStore} backed by sorted maps.
 * <p>
 * A write transaction stages its changes in an overlay and applies them under the
 * exclusive lock once the callback succeeds. Readers hold the shared lock, so they
 * see either all of a transaction's changes or none of them.
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, ConcurrentSkipListMap<String, byte[]>> buckets = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock writerLock = new ReentrantLock();

    @Override
    public <T> T read(ReadCallback<T> callback) {
        lock.readLock().lock();
        try {
            return callback.doInTransaction(new CommittedView());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T> T write(WriteCallback<T> callback) {
        writerLock.lock();
        try {
            StagedTransaction transaction = new StagedTransaction();
            T result;
            lock.readLock().lock();
            try {
                result = callback.doInTransaction(transaction);
            } finally {
                lock.readLock().unlock();
            }
            lock.writeLock().lock();
            try {
                transaction.apply();
            } finally {
                lock.writeLock().unlock();
            }
            return result;
        } finally {
            writerLock.unlock();
        }
    }

    @Override
    public void close() {
        log.debug("Closing in-memory key-value store with {} buckets", buckets.size());
    }

    private class CommittedView implements ReadTransaction {

        @Override
        public Optional<byte[]> get(String bucket, String key) {
            NavigableMap<String, byte[]> entries = buckets.get(bucket);
            if (entries == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(entries.get(key)).map(byte[]::clone);
        }

        @Override
        public List<KeyValue> scan(String bucket, String prefix) {
            NavigableMap<String, byte[]> entries = buckets.get(bucket);
            List<KeyValue> result = new ArrayList<>();
            if (entries == null) {
                return result;
            }
            for (Map.Entry<String, byte[]> entry : entries.tailMap(prefix, true).entrySet()) {
                if (!entry.getKey().startsWith(prefix)) {
                    break;
                }
                result.add(new KeyValue(entry.getKey(), entry.getValue().clone()));
            }
            return result;
        }
    }

    private class StagedTransaction extends CommittedView implements WriteTransaction {

        // empty Optional marks a deletion
        private final Map<String, TreeMap<String, Optional<byte[]>>> staged = new TreeMap<>();

        @Override
        public Optional<byte[]> get(String bucket, String key) {
            TreeMap<String, Optional<byte[]>> changes = staged.get(bucket);
            if (changes != null && changes.containsKey(key)) {
                return changes.get(key).map(byte[]::clone);
            }
            return super.get(bucket, key);
        }

        @Override
        public List<KeyValue> scan(String bucket, String prefix) {
            TreeMap<String, Optional<byte[]>> changes = staged.get(bucket);
            if (changes == null) {
                return super.scan(bucket, prefix);
            }
            TreeMap<String, byte[]> merged = new TreeMap<>();
            super.scan(bucket, prefix).forEach(kv -> merged.put(kv.key(), kv.value()));
            for (Map.Entry<String, Optional<byte[]>> change : changes.tailMap(prefix, true).entrySet()) {
                if (!change.getKey().startsWith(prefix)) {
                    break;
                }
                if (change.getValue().isPresent()) {
                    merged.put(change.getKey(), change.getValue().get().clone());
                } else {
                    merged.remove(change.getKey());
                }
            }
            List<KeyValue> result = new ArrayList<>(merged.size());
            merged.forEach((key, value) -> result.add(new KeyValue(key, value)));
            return result;
        }

        @Override
        public void put(String bucket, String key, byte[] value) {
            if (value == null) {
                throw new IllegalArgumentException("Value must not be null for key " + key);
            }
            staged.computeIfAbsent(bucket, b -> new TreeMap<>()).put(key, Optional.of(value.clone()));
        }

        @Override
        public boolean delete(String bucket, String key) {
            boolean existed = get(bucket, key).isPresent();
            staged.computeIfAbsent(bucket, b -> new TreeMap<>()).put(key, Optional.empty());
            return existed;
        }

        void apply() {
            staged.forEach((bucket, changes) -> {
                ConcurrentSkipListMap<String, byte[]> entries =
                        buckets.computeIfAbsent(bucket, b -> new ConcurrentSkipListMap<>());
                changes.forEach((key, value) -> {
                    if (value.isPresent()) {
                        entries.put(key, value.get());
                    } else {
                        entries.remove(key);
                    }
                });
            });
        }
    }
}
