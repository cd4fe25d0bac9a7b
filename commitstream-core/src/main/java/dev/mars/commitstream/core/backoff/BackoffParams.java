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

/**
 * Bounds of a jittered exponential backoff, in milliseconds.
 *
 * @param minDelayMs lower bound, also the delay of attempt 0
 * @param maxDelayMs upper bound
 * @param exponent growth factor per attempt
 */
public record BackoffParams(long minDelayMs, long maxDelayMs, double exponent) {

    public BackoffParams {
        if (minDelayMs < 0) {
            throw new IllegalArgumentException("Min delay cannot be negative: " + minDelayMs);
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("Max delay " + maxDelayMs + " is below min delay " + minDelayMs);
        }
        if (exponent < 1.0) {
            throw new IllegalArgumentException("Exponent must be at least 1: " + exponent);
        }
    }

    public static BackoffParams of(Duration minDelay, Duration maxDelay, double exponent) {
        return new BackoffParams(minDelay.toMillis(), maxDelay.toMillis(), exponent);
    }
}
