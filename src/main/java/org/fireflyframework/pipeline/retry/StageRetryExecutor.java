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

package org.fireflyframework.pipeline.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.pipeline.error.ErrorClassifier;
import org.fireflyframework.pipeline.escalation.BackoffMode;
import org.fireflyframework.pipeline.escalation.EscalationRouter;
import org.fireflyframework.pipeline.escalation.RetryPolicy;
import org.fireflyframework.pipeline.exception.CheckpointException;
import org.fireflyframework.pipeline.exception.CoordinationException;
import org.fireflyframework.pipeline.exception.StageExecutionException;
import org.fireflyframework.pipeline.metrics.PipelineMetrics;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Applies a {@link RetryPolicy} to a stage execution with Resilience4j.
 * <p>
 * Fatal and non-retryable stage errors fail on the first attempt, as do coordination and
 * checkpoint failures. Everything else is retried with the policy's backoff.
 */
@Slf4j
public class StageRetryExecutor {

    private final EscalationRouter router;
    private final ErrorClassifier errorClassifier;
    private final PipelineMetrics metrics;

    public StageRetryExecutor(EscalationRouter router, ErrorClassifier errorClassifier,
                              @Nullable PipelineMetrics metrics) {
        this.router = router;
        this.errorClassifier = errorClassifier;
        this.metrics = metrics;
    }

    /**
     * Runs a stage with the retry policy registered for a tool or escalation class.
     */
    public <T> Mono<T> execute(String policyClass, Mono<T> stage) {
        return execute(policyClass, router.retryPolicyFor(policyClass), stage);
    }

    /**
     * Runs a stage with an explicit policy. The stage is resubscribed for every attempt.
     */
    public <T> Mono<T> execute(String name, RetryPolicy policy, Mono<T> stage) {
        if (policy.maxAttempts() <= 1) {
            return stage;
        }
        Retry retry = Retry.of("stage-" + name, toConfig(policy));
        retry.getEventPublisher()
                .onRetry(event -> {
                    log.info("STAGE_RETRY: name={}, attempt={}, waitMs={}, error={}",
                            name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null);
                    if (metrics != null) {
                        metrics.recordStageRetry(name, event.getNumberOfRetryAttempts());
                    }
                })
                .onError(event -> log.warn("STAGE_RETRY_EXHAUSTED: name={}, attempts={}",
                        name, event.getNumberOfRetryAttempts()));
        return stage.transformDeferred(RetryOperator.of(retry));
    }

    /**
     * Whether a failure may be retried at all.
     */
    public boolean isRetryable(Throwable error) {
        if (error instanceof StageExecutionException stageError) {
            return stageError.getError().retryable() && !errorClassifier.isFatal(stageError.getError());
        }
        return !(error instanceof CoordinationException) && !(error instanceof CheckpointException);
    }

    private RetryConfig toConfig(RetryPolicy policy) {
        IntervalFunction interval = policy.backoff() == BackoffMode.FIXED
                ? IntervalFunction.of(atLeastOneMilli(policy.initialDelay().toMillis()))
                : IntervalFunction.ofExponentialBackoff(
                        atLeastOneMilli(policy.initialDelay().toMillis()),
                        Math.max(1.0, policy.multiplier()),
                        atLeastOneMilli(policy.maxDelay().toMillis()));
        return RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(interval)
                .retryOnException(this::isRetryable)
                .build();
    }

    private static long atLeastOneMilli(long millis) {
        return Math.max(1L, millis);
    }
}
