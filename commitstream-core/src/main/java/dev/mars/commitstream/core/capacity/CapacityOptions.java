package dev.mars.commitstream.core.capacity;

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

/**
 * Throughput settings for throttled store writes.
 *
 * @param unitsPerSecond capacity budget per one-second window, 0 for unthrottled
 * @param initialCostPerItem assumed capacity cost of one item before any consumption is reported
 * @param maxItemsPerRequest largest chunk sent in a single store request
 * @param queueSize mutations buffered before callers are made to wait
 */
public record CapacityOptions(double unitsPerSecond, double initialCostPerItem, int maxItemsPerRequest, int queueSize) {

    public CapacityOptions {
        if (unitsPerSecond < 0) {
            throw new IllegalArgumentException("Units per second cannot be negative");
        }
        if (initialCostPerItem <= 0) {
            throw new IllegalArgumentException("Initial cost per item must be positive");
        }
        if (maxItemsPerRequest < 1) {
            throw new IllegalArgumentException("Max items per request must be at least 1");
        }
        if (queueSize < 1) {
            throw new IllegalArgumentException("Queue size must be at least 1");
        }
    }

    public static CapacityOptions defaults() {
        return new CapacityOptions(0, 1, 25, 50);
    }

    public boolean isThrottled() {
        return unitsPerSecond > 0;
    }
}
