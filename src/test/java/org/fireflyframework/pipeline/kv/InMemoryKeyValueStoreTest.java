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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryKeyValueStore}.
 */
class InMemoryKeyValueStoreTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPutAndGet() {
        store.write(tx -> {
            tx.put("bucket", "a", bytes("1"));
            return null;
        });

        assertThat(store.<Optional<byte[]>>read(tx -> tx.get("bucket", "a"))).hasValueSatisfying(
                value -> assertThat(new String(value, StandardCharsets.UTF_8)).isEqualTo("1"));
        assertThat(store.<Optional<byte[]>>read(tx -> tx.get("bucket", "missing"))).isEmpty();
        assertThat(store.<Optional<byte[]>>read(tx -> tx.get("other", "a"))).isEmpty();
    }

    @Test
    @DisplayName("Scan returns keys with the prefix in key order")
    void shouldScanByPrefixInOrder() {
        store.write(tx -> {
            tx.put("bucket", "s1_c", bytes("c"));
            tx.put("bucket", "s1_a", bytes("a"));
            tx.put("bucket", "s2_b", bytes("b"));
            return null;
        });

        List<KeyValue> entries = store.read(tx -> tx.scan("bucket", "s1_"));

        assertThat(entries).extracting(KeyValue::key).containsExactly("s1_a", "s1_c");
        assertThat(store.<List<KeyValue>>read(tx -> tx.scan("bucket", ""))).hasSize(3);
    }

    @Test
    @DisplayName("A failing write transaction leaves no trace")
    void shouldDiscardFailedTransaction() {
        store.write(tx -> {
            tx.put("bucket", "kept", bytes("1"));
            return null;
        });

        assertThatThrownBy(() -> store.write(tx -> {
            tx.put("bucket", "new", bytes("2"));
            tx.delete("bucket", "kept");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(store.<Optional<byte[]>>read(tx -> tx.get("bucket", "kept"))).isPresent();
        assertThat(store.<Optional<byte[]>>read(tx -> tx.get("bucket", "new"))).isEmpty();
    }

    @Test
    @DisplayName("Writes are visible inside their own transaction")
    void shouldReadOwnWrites() {
        List<String> seen = store.write(tx -> {
            tx.put("bucket", "a", bytes("1"));
            tx.put("bucket", "b", bytes("2"));
            tx.delete("bucket", "a");
            return tx.scan("bucket", "").stream().map(KeyValue::key).toList();
        });

        assertThat(seen).containsExactly("b");
    }

    @Test
    void deleteReportsWhetherKeyExisted() {
        store.write(tx -> {
            tx.put("bucket", "a", bytes("1"));
            return null;
        });

        assertThat(store.<Boolean>write(tx -> tx.delete("bucket", "a"))).isTrue();
        assertThat(store.<Boolean>write(tx -> tx.delete("bucket", "a"))).isFalse();
    }

    @Test
    void storedValuesAreCopied() {
        byte[] value = bytes("1");
        store.write(tx -> {
            tx.put("bucket", "a", value);
            return null;
        });
        value[0] = 'x';

        assertThat(store.<Optional<byte[]>>read(tx -> tx.get("bucket", "a")).orElseThrow()).isEqualTo(bytes("1"));
    }
}
