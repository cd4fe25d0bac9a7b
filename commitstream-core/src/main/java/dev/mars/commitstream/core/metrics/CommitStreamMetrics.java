package dev.mars.commitstream.core.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for polling, batching, retries, projections and capacity throttling.
 *
 * <p>Record methods are safe to call before {@link #bindTo(MeterRegistry)}; they are ignored
 * until the binder has been attached to a registry.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class CommitStreamMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(CommitStreamMetrics.class);

    private final String instanceId;
    private volatile MeterRegistry registry;

    // Counters
    private Counter polls;
    private Counter emptyPolls;
    private Counter commitsPolled;
    private Counter batchesEmitted;
    private Counter commitsBatched;
    private Counter retryAttempts;
    private Counter retriesExhausted;
    private Counter capacityThrottles;
    private Counter eventsPublished;

    // Timers
    private Timer capacityWaitTime;

    // Gauges
    private final AtomicLong backlogSize = new AtomicLong(0);

    public CommitStreamMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * Metrics bound to a registry with no children, so every meter is a no-op.
     */
    public static CommitStreamMetrics noop() {
        CommitStreamMetrics metrics = new CommitStreamMetrics("noop");
        metrics.bindTo(new CompositeMeterRegistry());
        return metrics;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        polls = Counter.builder("commitstream.polls")
            .description("Total number of store polls")
            .tag("instance", instanceId)
            .register(registry);

        emptyPolls = Counter.builder("commitstream.polls.empty")
            .description("Polls that returned no items")
            .tag("instance", instanceId)
            .register(registry);

        commitsPolled = Counter.builder("commitstream.commits.polled")
            .description("Commits yielded by chronological pollers")
            .tag("instance", instanceId)
            .register(registry);

        batchesEmitted = Counter.builder("commitstream.batches.emitted")
            .description("Parallelizable batches yielded")
            .tag("instance", instanceId)
            .register(registry);

        commitsBatched = Counter.builder("commitstream.commits.batched")
            .description("Commits placed into parallelizable batches")
            .tag("instance", instanceId)
            .register(registry);

        retryAttempts = Counter.builder("commitstream.retry.attempts")
            .description("Retries scheduled after a retryable failure")
            .tag("instance", instanceId)
            .register(registry);

        retriesExhausted = Counter.builder("commitstream.retry.exhausted")
            .description("Retried operations that ran out of time budget")
            .tag("instance", instanceId)
            .register(registry);

        capacityThrottles = Counter.builder("commitstream.capacity.throttled")
            .description("Items handed back unprocessed by a throttled store write")
            .tag("instance", instanceId)
            .register(registry);

        eventsPublished = Counter.builder("commitstream.events.published")
            .description("Events delivered to stream subscribers")
            .tag("instance", instanceId)
            .register(registry);

        capacityWaitTime = Timer.builder("commitstream.capacity.wait.time")
            .description("Time spent waiting for the next capacity window")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("commitstream.batcher.backlog.size", backlogSize, AtomicLong::get)
            .description("Commits held back in the batcher backlog")
            .tag("instance", instanceId)
            .register(registry);

        this.registry = registry;
        logger.debug("CommitStream metrics registered for instance: {}", instanceId);
    }

    public void recordPoll(int itemCount) {
        if (registry == null) {
            return;
        }
        polls.increment();
        if (itemCount == 0) {
            emptyPolls.increment();
        }
    }

    public void recordCommitPolled() {
        if (registry != null) {
            commitsPolled.increment();
        }
    }

    public void recordBatch(int batchSize, int currentBacklogSize) {
        backlogSize.set(currentBacklogSize);
        if (registry != null) {
            batchesEmitted.increment();
            commitsBatched.increment(batchSize);
        }
    }

    public void recordRetryAttempt() {
        if (registry != null) {
            retryAttempts.increment();
        }
    }

    public void recordRetriesExhausted() {
        if (registry != null) {
            retriesExhausted.increment();
        }
    }

    public void recordProjectionBatch(String projection, int eventCount, Duration processingTime) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder("commitstream.projection.events.processed")
            .description("Events handed to a projection")
            .tag("instance", instanceId)
            .tag("projection", projection)
            .register(current)
            .increment(eventCount);

        Timer.builder("commitstream.projection.batch.time")
            .description("Time taken by a projection to process one batch")
            .tag("instance", instanceId)
            .tag("projection", projection)
            .register(current)
            .record(processingTime);
    }

    public void recordHeadSortKeyAdvance(String projection) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder("commitstream.projection.head.advances")
            .description("Persisted head sort key advances")
            .tag("instance", instanceId)
            .tag("projection", projection)
            .register(current)
            .increment();
    }

    public void recordCapacityWait(Duration waited) {
        if (registry != null) {
            capacityWaitTime.record(waited);
        }
    }

    public void recordThrottled(int itemCount) {
        if (registry != null) {
            capacityThrottles.increment(itemCount);
        }
    }

    public void recordEventPublished() {
        if (registry != null) {
            eventsPublished.increment();
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
