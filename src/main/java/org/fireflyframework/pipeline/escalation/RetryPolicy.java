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

package org.fireflyframework.pipeline.escalation;

import java.time.Duration;

/**
 * Retry behavior of a tool or of an escalation class.
 *
 * @param maxAttempts maximum number of attempts (including the initial attempt)
 * @param backoff delay progression
 * @param initialDelay delay before the first retry
 * @param maxDelay upper bound for any delay
 * @param multiplier growth factor for exponential backoff
 */
public record RetryPolicy(
        int maxAttempts,
        BackoffMode backoff,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier
) {

    /**
     * Policy for first attempts: 3 attempts, exponential from 1s up to 30s.
     */
    public static final RetryPolicy DEFAULT = exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);

    /**
     * Policy for escalated builds, which are already a second chance.
     */
    public static final RetryPolicy ESCALATED_BUILD = fixed(2, Duration.ofSeconds(5));

    /**
     * Fail immediately on error.
     */
    public static final RetryPolicy NO_RETRY = fixed(1, Duration.ZERO);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        backoff = backoff != null ? backoff : BackoffMode.EXPONENTIAL;
        initialDelay = initialDelay != null ? initialDelay : Duration.ZERO;
        maxDelay = maxDelay != null ? maxDelay : initialDelay;
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, BackoffMode.FIXED, delay, delay, 1.0);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        return new RetryPolicy(maxAttempts, BackoffMode.EXPONENTIAL, initialDelay, maxDelay, multiplier);
    }

    /**
     * Calculates the delay before a given attempt.
     *
     * @param attempt the attempt number (1-based)
     * @return the delay duration
     */
    public Duration getDelayForAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        if (backoff == BackoffMode.FIXED) {
            return initialDelay;
        }

        long delayMs = (long) (initialDelay.toMillis() * Math.pow(multiplier, attempt - 2));
        return Duration.ofMillis(Math.min(delayMs, maxDelay.toMillis()));
    }

    /**
     * Checks if another retry attempt should be made.
     *
     * @param currentAttempt the current attempt number (1-based)
     * @return true if retry should be attempted
     */
    public boolean shouldRetry(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }
}
