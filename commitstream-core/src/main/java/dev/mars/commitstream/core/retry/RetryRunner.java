package dev.mars.commitstream.core.retry;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import dev.mars.commitstream.api.error.RetriesExhaustedException;
import dev.mars.commitstream.core.backoff.JitteredBackoff;
import dev.mars.commitstream.core.concurrent.Futures;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Retries an asynchronous operation with jittered backoff until it succeeds, fails with a
 * non-retryable error, or its time budget is spent.
 *
 * <p>Non-retryable errors are passed through unwrapped on first occurrence. Each delay is capped
 * to the budget that remains, and the budget is checked again once the delay is over, so an
 * exhausted run ends at most one backoff interval past the timeout. Delays are scheduled rather
 * than slept, leaving the calling thread free.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class RetryRunner implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RetryRunner.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final CommitStreamMetrics metrics;

    public RetryRunner() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "commitstream-retry-scheduler");
            t.setDaemon(true);
            return t;
        }), true, CommitStreamMetrics.noop());
    }

    public RetryRunner(ScheduledExecutorService scheduler, CommitStreamMetrics metrics) {
        this(scheduler, false, metrics);
    }

    private RetryRunner(ScheduledExecutorService scheduler, boolean ownsScheduler, CommitStreamMetrics metrics) {
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.metrics = metrics;
    }

    public <T> CompletableFuture<T> retry(Supplier<CompletableFuture<T>> operation, RetryOptions options) {
        CompletableFuture<T> result = new CompletableFuture<>();
        JitteredBackoff backoff = new JitteredBackoff(options.getBackoff(), options.getRandom());
        attempt(new Run<>(operation, options, backoff, result, System.nanoTime()));
        return result;
    }

    private <T> void attempt(Run<T> run) {
        run.attempts++;

        CompletableFuture<T> future;
        try {
            future = run.operation.get();
            if (future == null) {
                future = CompletableFuture.failedFuture(new NullPointerException("Operation returned no future"));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                run.result.complete(value);
            } else {
                onFailure(run, Futures.unwrap(error));
            }
        });
    }

    private <T> void onFailure(Run<T> run, Throwable error) {
        if (!run.options.getIsRetryable().test(error)) {
            logger.debug("Attempt {} failed with non-retryable error: {}", run.attempts, error.toString());
            run.result.completeExceptionally(error);
            return;
        }

        run.lastError = error;
        long remainingMs = run.remainingMillis();
        if (remainingMs <= 0) {
            exhaust(run);
            return;
        }

        long delayMs = Math.min(run.backoff.delayMillis(run.attempts), remainingMs);
        logger.debug("Attempt {} failed with retryable error, retrying in {} ms: {}",
            run.attempts, delayMs, error.getMessage());

        try {
            scheduler.schedule(() -> afterDelay(run), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            run.result.completeExceptionally(e);
        }
    }

    private <T> void afterDelay(Run<T> run) {
        if (run.remainingMillis() <= 0) {
            exhaust(run);
            return;
        }

        metrics.recordRetryAttempt();
        Supplier<CompletableFuture<Void>> beforeRetry = run.options.getBeforeRetry();
        if (beforeRetry == null) {
            attempt(run);
            return;
        }

        CompletableFuture<Void> hook;
        try {
            hook = beforeRetry.get();
        } catch (RuntimeException e) {
            hook = CompletableFuture.failedFuture(e);
        }
        hook.whenComplete((ignored, error) -> {
            if (error != null) {
                run.result.completeExceptionally(Futures.unwrap(error));
            } else {
                attempt(run);
            }
        });
    }

    private <T> void exhaust(Run<T> run) {
        metrics.recordRetriesExhausted();
        RetriesExhaustedException exhausted = run.options.getExhaustedMessage() != null
            ? new RetriesExhaustedException(run.options.getExhaustedMessage().apply(run.lastError, run.attempts),
                run.lastError, run.attempts)
            : new RetriesExhaustedException(run.lastError, run.attempts);
        logger.warn("{}", exhausted.getMessage());
        run.result.completeExceptionally(exhausted);
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private static final class Run<T> {
        private final Supplier<CompletableFuture<T>> operation;
        private final RetryOptions options;
        private final JitteredBackoff backoff;
        private final CompletableFuture<T> result;
        private final long startNanos;
        private volatile int attempts;
        private volatile Throwable lastError;

        Run(Supplier<CompletableFuture<T>> operation, RetryOptions options, JitteredBackoff backoff,
            CompletableFuture<T> result, long startNanos) {
            this.operation = operation;
            this.options = options;
            this.backoff = backoff;
            this.result = result;
            this.startNanos = startNanos;
        }

        long remainingMillis() {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            return options.getTimeout().toMillis() - elapsedMs;
        }
    }
}
