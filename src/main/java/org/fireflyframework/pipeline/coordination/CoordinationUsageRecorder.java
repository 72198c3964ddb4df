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

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies usage metadata off the coordination path.
 * <p>
 * Updates go through a single worker with a bounded queue. When the queue is full the
 * update runs on the calling thread, so metrics lag by at most the queue length. Every
 * update runs under one lock so concurrent increments are never lost.
 */
@Slf4j
class CoordinationUsageRecorder implements AutoCloseable {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ThreadPoolExecutor worker;
    private final ReentrantLock lock = new ReentrantLock();

    private long total;
    private long successes;
    private long failures;
    private Duration totalLatency = Duration.ZERO;
    private final Map<String, PairCounter> pairs = new HashMap<>();

    CoordinationUsageRecorder(int queueCapacity) {
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                runnable -> {
                    Thread thread = new Thread(runnable, "pipeline-usage-" + THREAD_COUNTER.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Queues an arbitrary bookkeeping update.
     */
    void submit(Runnable update) {
        worker.execute(() -> {
            lock.lock();
            try {
                update.run();
            } catch (RuntimeException e) {
                log.warn("Usage update failed: {}", e.getMessage(), e);
            } finally {
                lock.unlock();
            }
        });
    }

    void recordCoordination(String sourceTool, String targetTool, boolean success, Duration latency, Instant at) {
        submit(() -> {
            total++;
            if (success) {
                successes++;
            } else {
                failures++;
            }
            totalLatency = totalLatency.plus(latency);
            PairCounter pair = pairs.computeIfAbsent(CoordinationMetrics.pairKey(sourceTool, targetTool),
                    key -> new PairCounter());
            pair.count++;
            if (success) {
                pair.successes++;
            } else {
                pair.failures++;
            }
            pair.totalTime = pair.totalTime.plus(latency);
            pair.lastUsed = at;
        });
    }

    CoordinationMetrics snapshot() {
        lock.lock();
        try {
            Map<String, CoordinationMetrics.ToolPairMetric> pairMetrics = new HashMap<>();
            pairs.forEach((key, pair) -> pairMetrics.put(key, new CoordinationMetrics.ToolPairMetric(
                    pair.count, pair.successes, pair.failures, pair.totalTime, pair.lastUsed)));
            Duration average = total == 0 ? Duration.ZERO : totalLatency.dividedBy(total);
            return new CoordinationMetrics(total, successes, failures, average, pairMetrics);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until every update queued so far has been applied.
     */
    void flush(Duration timeout) {
        try {
            worker.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while flushing usage updates", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Usage updates did not drain within " + timeout, e);
        }
    }

    @Override
    public void close() {
        worker.shutdown();
    }

    private static final class PairCounter {
        private long count;
        private long successes;
        private long failures;
        private Duration totalTime = Duration.ZERO;
        private Instant lastUsed;
    }
}
