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

import dev.mars.commitstream.core.backoff.BackoffParams;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BiFunction;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Settings for one {@link RetryRunner#retry} call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class RetryOptions {

    private final Duration timeout;
    private final BackoffParams backoff;
    private final Predicate<Throwable> isRetryable;
    private final Supplier<CompletableFuture<Void>> beforeRetry;
    private final BiFunction<Throwable, Integer, String> exhaustedMessage;
    private final DoubleSupplier random;

    private RetryOptions(Builder builder) {
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout cannot be null");
        this.backoff = new BackoffParams(builder.minDelayMs, builder.maxDelayMs, builder.exponent);
        this.isRetryable = Objects.requireNonNull(builder.isRetryable, "Retry predicate cannot be null");
        this.beforeRetry = builder.beforeRetry;
        this.exhaustedMessage = builder.exhaustedMessage;
        this.random = builder.random;

        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .timeout(timeout)
            .backoff(backoff)
            .isRetryable(isRetryable)
            .beforeRetry(beforeRetry)
            .exhaustedMessage(exhaustedMessage)
            .random(random);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public BackoffParams getBackoff() {
        return backoff;
    }

    public Predicate<Throwable> getIsRetryable() {
        return isRetryable;
    }

    /**
     * Hook awaited between the delay and the next attempt, or {@code null}.
     */
    public Supplier<CompletableFuture<Void>> getBeforeRetry() {
        return beforeRetry;
    }

    public BiFunction<Throwable, Integer, String> getExhaustedMessage() {
        return exhaustedMessage;
    }

    public DoubleSupplier getRandom() {
        return random;
    }

    @Override
    public String toString() {
        return "RetryOptions{" +
                "timeout=" + timeout +
                ", backoff=" + backoff +
                ", beforeRetry=" + (beforeRetry != null) +
                '}';
    }

    public static class Builder {
        private Duration timeout = Duration.ofSeconds(2);
        private long minDelayMs = 2;
        private long maxDelayMs = 500;
        private double exponent = 2;
        private Predicate<Throwable> isRetryable = error -> true;
        private Supplier<CompletableFuture<Void>> beforeRetry;
        private BiFunction<Throwable, Integer, String> exhaustedMessage;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder minDelay(Duration minDelay) {
            this.minDelayMs = minDelay.toMillis();
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelayMs = maxDelay.toMillis();
            return this;
        }

        public Builder exponent(double exponent) {
            this.exponent = exponent;
            return this;
        }

        public Builder backoff(BackoffParams backoff) {
            this.minDelayMs = backoff.minDelayMs();
            this.maxDelayMs = backoff.maxDelayMs();
            this.exponent = backoff.exponent();
            return this;
        }

        public Builder isRetryable(Predicate<Throwable> isRetryable) {
            this.isRetryable = isRetryable;
            return this;
        }

        public Builder beforeRetry(Supplier<CompletableFuture<Void>> beforeRetry) {
            this.beforeRetry = beforeRetry;
            return this;
        }

        /**
         * Message for the exhausted error, given the last error and the attempt count.
         */
        public Builder exhaustedMessage(BiFunction<Throwable, Integer, String> exhaustedMessage) {
            this.exhaustedMessage = exhaustedMessage;
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "Random source cannot be null");
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(this);
        }
    }
}
