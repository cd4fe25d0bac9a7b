package dev.mars.commitstream.core.backoff;

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

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential backoff shared by retries, polling and projection waits.
 *
 * <p>Attempt 0 always yields the min delay. Any later attempt draws a uniform random integer in
 * {@code [0, minDelay * exponent^attempt]} and clamps it into {@code [minDelay, maxDelay]}, so
 * the spread of possible delays widens as attempts grow until it covers the whole range.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class JitteredBackoff {

    private final BackoffParams params;
    private final DoubleSupplier random;

    public JitteredBackoff(BackoffParams params) {
        this(params, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in {@code [0, 1)}
     */
    public JitteredBackoff(BackoffParams params, DoubleSupplier random) {
        this.params = params;
        this.random = random;
    }

    public static long delayMillis(long minDelayMs, long maxDelayMs, double exponent, int attempt) {
        return new JitteredBackoff(new BackoffParams(minDelayMs, maxDelayMs, exponent)).delayMillis(attempt);
    }

    public long delayMillis(int attempt) {
        long min = params.minDelayMs();
        long max = params.maxDelayMs();
        if (attempt <= 0) {
            return min;
        }

        double ceiling = Math.min(min * Math.pow(params.exponent(), attempt), (double) max);
        long drawn = (long) Math.floor(random.getAsDouble() * (ceiling + 1));
        return Math.max(min, Math.min(drawn, max));
    }

    public Duration delay(int attempt) {
        return Duration.ofMillis(delayMillis(attempt));
    }

    public BackoffParams getParams() {
        return params;
    }
}
