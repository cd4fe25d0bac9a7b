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

import dev.mars.commitstream.api.Commit;
import dev.mars.commitstream.api.error.VersionConflictException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry policy for optimistic-concurrency commits: only {@link VersionConflictException} is
 * retried.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class VersionConflictRetries {

    public static final Predicate<Throwable> IS_VERSION_CONFLICT = error -> error instanceof VersionConflictException;

    private final RetryRunner runner;
    private final RetryOptions defaults;

    public VersionConflictRetries(RetryRunner runner) {
        this(runner, defaultOptions());
    }

    public VersionConflictRetries(RetryRunner runner, RetryOptions defaults) {
        this.runner = runner;
        this.defaults = defaults.toBuilder()
            .isRetryable(IS_VERSION_CONFLICT)
            .exhaustedMessage(VersionConflictRetries::describe)
            .build();
    }

    public static RetryOptions defaultOptions() {
        return RetryOptions.builder()
            .timeout(Duration.ofMillis(2000))
            .minDelay(Duration.ofMillis(2))
            .maxDelay(Duration.ofMillis(500))
            .exponent(2)
            .build();
    }

    public <T> CompletableFuture<T> retryOnVersionConflict(Supplier<CompletableFuture<T>> operation) {
        return runner.retry(operation, defaults);
    }

    /**
     * Retries a command, re-hydrating state through {@code beforeRetry} before each new attempt.
     */
    public <T> CompletableFuture<T> retryCommand(Supplier<CompletableFuture<T>> command,
                                                 Supplier<CompletableFuture<Void>> beforeRetry) {
        return runner.retry(command, defaults.toBuilder().beforeRetry(beforeRetry).build());
    }

    public RetryOptions getOptions() {
        return defaults;
    }

    static String describe(Throwable lastError, int attempts) {
        if (lastError instanceof VersionConflictException) {
            Commit commit = ((VersionConflictException) lastError).getCommit();
            if (commit != null) {
                return "Gave up committing version " + commit.getAggregateVersion() + " of " +
                       commit.getAggregateType() + "<" + commit.getAggregateKey() + "> after " +
                       attempts + " attempts";
            }
        }
        return "Gave up after " + attempts + " attempts: " + lastError.getMessage();
    }
}
