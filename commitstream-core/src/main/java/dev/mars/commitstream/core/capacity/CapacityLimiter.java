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

import dev.mars.commitstream.core.concurrent.AbortSignal;
import dev.mars.commitstream.core.concurrent.Sleeper;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Per-second capacity budget for store requests.
 *
 * <p>The budget refills at every wall-clock second boundary. Callers ask how many items they may
 * send now, which is the remaining budget divided by the learned average cost of one item, then
 * report what a request actually consumed. The average is exponentially smoothed: the previous
 * average keeps a weight of {@code 2^-2} and the newest sample gets the rest.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class CapacityLimiter {
    private static final Logger logger = LoggerFactory.getLogger(CapacityLimiter.class);

    static final double SMOOTHING_WEIGHT = Math.pow(2, -1 / 0.5);

    private final double capacityLimit;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AbortSignal abortSignal;
    private final CommitStreamMetrics metrics;

    private double averageCostPerItem;
    private double capacityRemainder;
    private long lastSampleSecond = Long.MIN_VALUE;

    public CapacityLimiter(double capacityLimit, double initialCostPerItem) {
        this(capacityLimit, initialCostPerItem, Clock.systemUTC(), Sleeper.system(), AbortSignal.create(),
            CommitStreamMetrics.noop());
    }

    public CapacityLimiter(double capacityLimit, double initialCostPerItem, Clock clock, Sleeper sleeper,
                           AbortSignal abortSignal, CommitStreamMetrics metrics) {
        if (capacityLimit <= 0) {
            throw new IllegalArgumentException("Capacity limit must be positive");
        }
        if (initialCostPerItem <= 0) {
            throw new IllegalArgumentException("Initial cost per item must be positive");
        }
        this.capacityLimit = capacityLimit;
        this.averageCostPerItem = initialCostPerItem;
        this.clock = clock;
        this.sleeper = sleeper;
        this.abortSignal = abortSignal;
        this.metrics = metrics;
    }

    public static CapacityLimiter from(CapacityOptions options, Clock clock, Sleeper sleeper,
                                       CommitStreamMetrics metrics) {
        return new CapacityLimiter(options.unitsPerSecond(), options.initialCostPerItem(), clock, sleeper,
            AbortSignal.create(), metrics);
    }

    public synchronized double availableCapacity() {
        return lastSampleSecond != currentSecond() ? capacityLimit : capacityRemainder;
    }

    public long millisUntilNextWindow() {
        long now = clock.millis();
        return 1000 - Math.floorMod(now, 1000L);
    }

    /**
     * Blocks until some capacity is left in the current window.
     *
     * @return number of items that fit in the remaining budget; may be 0 when the remainder is
     *         smaller than one item's average cost
     */
    public int permittedItemCount() throws InterruptedException {
        while (true) {
            double available;
            double costPerItem;
            synchronized (this) {
                available = availableCapacity();
                costPerItem = averageCostPerItem;
            }
            if (available > 0) {
                return (int) Math.floor(available / costPerItem);
            }

            long waitMs = millisUntilNextWindow();
            logger.debug("Capacity exhausted ({}), waiting {} ms for next window", available, waitMs);
            if (!sleeper.sleep(Duration.ofMillis(waitMs), abortSignal)) {
                throw new InterruptedException("Capacity wait aborted");
            }
            metrics.recordCapacityWait(Duration.ofMillis(waitMs));
        }
    }

    public synchronized void registerConsumption(double consumedCapacity, int itemCount) {
        long thisSecond = currentSecond();
        if (lastSampleSecond == thisSecond) {
            capacityRemainder -= consumedCapacity;
        } else {
            capacityRemainder = capacityLimit - consumedCapacity;
        }
        lastSampleSecond = thisSecond;

        if (itemCount > 0) {
            averageCostPerItem = SMOOTHING_WEIGHT * averageCostPerItem
                + (1.0 - SMOOTHING_WEIGHT) * consumedCapacity / itemCount;
        }
    }

    public synchronized double getAverageCostPerItem() {
        return averageCostPerItem;
    }

    public double getCapacityLimit() {
        return capacityLimit;
    }

    private long currentSecond() {
        return Math.floorDiv(clock.millis(), 1000L);
    }
}
