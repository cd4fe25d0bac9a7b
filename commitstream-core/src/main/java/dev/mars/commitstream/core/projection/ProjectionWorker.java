package dev.mars.commitstream.core.projection;

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

import dev.mars.commitstream.api.ChronologicalKeys;
import dev.mars.commitstream.api.EventWithMetadata;
import dev.mars.commitstream.core.concurrent.Futures;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bounded, dependency-aware queue in front of one {@link Projection}.
 *
 * <p>{@link #addToQueue} admits an event, or parks the caller in a FIFO of waiters while the queue
 * is full. A single drain loop repeatedly snapshots the queue and selects a batch holding at most
 * one event per stream and no event that depends on another event of the same batch. An event
 * skipped in a pass keeps later events of its stream, and events depending on it, out of that
 * pass too. Skipped events stay queued for the next pass.</p>
 *
 * <p>After each batch the head sort key is moved to the last key accepted before the first skip
 * of any pass, held strictly below the lowest sort key still queued. Events of one commit share
 * a sort key, so the head never reaches a commit while any of its events is outstanding. Once the
 * queue is empty it is moved to the highest key processed. Head writes only ever move forward.</p>
 *
 * <p>{@link #addAllToQueue} admits the events of one commit together, so a drain loop never sees
 * part of a commit.</p>
 *
 * <p>If the projection fails to process a batch the loop stops, {@link #drained()} and every later
 * {@link #addToQueue} fail with the cause, and the remaining events stay in the queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ProjectionWorker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionWorker.class);

    private final Projection projection;
    private final int maxQueueSize;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final CommitStreamMetrics metrics;

    private final Object lock = new Object();
    private final LinkedHashSet<EventWithMetadata> queue = new LinkedHashSet<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final List<CompletableFuture<Void>> drainedFutures = new ArrayList<>();
    private boolean running;
    private Throwable failure;
    private volatile String persistedHeadSortKey;

    public ProjectionWorker(Projection projection) {
        this(projection, ProjectionWorkerOptions.defaults());
    }

    public ProjectionWorker(Projection projection, ProjectionWorkerOptions options) {
        this.projection = projection;
        this.maxQueueSize = options.getMaxQueueSize();
        this.metrics = options.getMetrics();
        if (options.getExecutor() != null) {
            this.executor = options.getExecutor();
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "projection-worker-" + projection.getName());
                t.setDaemon(true);
                return t;
            });
            this.executor = ownedExecutor;
        }
    }

    /**
     * Queues an event for processing.
     *
     * @return a future completing once the event has been admitted to the queue
     */
    public CompletableFuture<Void> addToQueue(EventWithMetadata event) {
        return addAllToQueue(List.of(event));
    }

    /**
     * Queues events as one unit, typically every event of a commit. The unit is admitted once the
     * queue has room, even if it then holds more than the maximum queue size.
     *
     * @return a future completing once all the events have been admitted to the queue
     */
    public CompletableFuture<Void> addAllToQueue(List<EventWithMetadata> events) {
        if (events.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        synchronized (lock) {
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            if (queue.size() >= maxQueueSize || !waiters.isEmpty()) {
                Waiter waiter = new Waiter(List.copyOf(events));
                waiters.addLast(waiter);
                logger.debug("Projection '{}' queue full, {} callers waiting", projection.getName(), waiters.size());
                return waiter.admitted;
            }
            queue.addAll(events);
            startIfIdle();
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Completes the next time the queue is empty and no drain loop is running.
     */
    public CompletableFuture<Void> drained() {
        synchronized (lock) {
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            if (!running && queue.isEmpty() && waiters.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> future = new CompletableFuture<>();
            drainedFutures.add(future);
            return future;
        }
    }

    public int getQueueSize() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public int getWaiterCount() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    public Projection getProjection() {
        return projection;
    }

    /**
     * Last head sort key written by this worker, or {@code null}.
     */
    public String getPersistedHeadSortKey() {
        return persistedHeadSortKey;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    // Caller holds the lock.
    private void startIfIdle() {
        if (running) {
            return;
        }
        running = true;
        try {
            executor.execute(this::drainLoop);
        } catch (RejectedExecutionException e) {
            running = false;
            throw e;
        }
    }

    private void drainLoop() {
        String pessimisticHeadSortKey = null;
        String highestSortKeyProcessed = null;
        TreeSet<String> processedSortKeys = new TreeSet<>();

        try {
            while (true) {
                List<EventWithMetadata> snapshot;
                synchronized (lock) {
                    if (queue.isEmpty()) {
                        break;
                    }
                    snapshot = new ArrayList<>(queue);
                }

                List<EventWithMetadata> batch = new ArrayList<>();
                List<EventWithMetadata> deferred = new ArrayList<>();
                Set<String> streamIds = new HashSet<>();
                boolean eventSkipped = false;

                for (EventWithMetadata event : snapshot) {
                    // A deferred event still holds its stream and blocks its dependents.
                    if (!streamIds.add(event.getStreamId())
                            || dependsOnAny(event, batch) || dependsOnAny(event, deferred)) {
                        deferred.add(event);
                        eventSkipped = true;
                        continue;
                    }

                    if (!eventSkipped) {
                        pessimisticHeadSortKey = event.getSortKey();
                    }
                    if (ChronologicalKeys.isAfter(event.getSortKey(), highestSortKeyProcessed)) {
                        highestSortKeyProcessed = event.getSortKey();
                    }

                    processedSortKeys.add(event.getSortKey());
                    batch.add(event);

                    if (batch.size() >= projection.getMaxBatchSize()) {
                        break;
                    }
                }

                synchronized (lock) {
                    batch.forEach(queue::remove);
                }

                logger.debug("Projection '{}' processing {} events ({} deferred)",
                    projection.getName(), batch.size(), snapshot.size() - batch.size());
                long started = System.nanoTime();
                Futures.await(projection.processEvents(batch));
                metrics.recordProjectionBatch(projection.getName(), batch.size(),
                    Duration.ofNanos(System.nanoTime() - started));

                advanceHead(safeHeadSortKey(pessimisticHeadSortKey, processedSortKeys));
                releaseWaiters();
            }

            if (ChronologicalKeys.isAfter(highestSortKeyProcessed, pessimisticHeadSortKey)) {
                advanceHead(highestSortKeyProcessed);
            }
        } catch (RuntimeException e) {
            fail(e);
            return;
        }

        List<CompletableFuture<Void>> toComplete = List.of();
        synchronized (lock) {
            running = false;
            releaseWaitersLocked();
            if (!queue.isEmpty()) {
                startIfIdle();
            } else {
                toComplete = new ArrayList<>(drainedFutures);
                drainedFutures.clear();
            }
        }
        toComplete.forEach(future -> future.complete(null));
    }

    private boolean dependsOnAny(EventWithMetadata event, List<EventWithMetadata> others) {
        ProjectionDependencies dependencies = projection.getDependencies();
        if (others.isEmpty() || !dependencies.hasRulesFor(event.getAggregateType())) {
            return false;
        }

        EventWithMetadata depender = null;
        for (EventWithMetadata other : others) {
            EventDependency rule = dependencies.find(event.getAggregateType(), other.getAggregateType());
            if (rule == null) {
                continue;
            }
            if (depender == null) {
                depender = projection.withKeyProps(event);
            }
            if (rule.dependsOn(depender, projection.withKeyProps(other))) {
                return true;
            }
        }
        return false;
    }

    private String safeHeadSortKey(String candidate, TreeSet<String> processedSortKeys) {
        String lowestOutstanding = lowestOutstandingSortKey();
        if (candidate == null || lowestOutstanding == null || ChronologicalKeys.isAfter(lowestOutstanding, candidate)) {
            return candidate;
        }
        return processedSortKeys.lower(lowestOutstanding);
    }

    private String lowestOutstandingSortKey() {
        String lowest = null;
        synchronized (lock) {
            for (EventWithMetadata event : queue) {
                if (lowest == null || ChronologicalKeys.isAfter(lowest, event.getSortKey())) {
                    lowest = event.getSortKey();
                }
            }
            for (Waiter waiter : waiters) {
                for (EventWithMetadata event : waiter.events) {
                    if (lowest == null || ChronologicalKeys.isAfter(lowest, event.getSortKey())) {
                        lowest = event.getSortKey();
                    }
                }
            }
        }
        return lowest;
    }

    private void advanceHead(String sortKey) {
        if (sortKey == null || !ChronologicalKeys.isAfter(sortKey, persistedHeadSortKey)) {
            return;
        }
        Futures.await(projection.setHeadSortKey(sortKey));
        persistedHeadSortKey = sortKey;
        metrics.recordHeadSortKeyAdvance(projection.getName());
    }

    private void releaseWaiters() {
        synchronized (lock) {
            releaseWaitersLocked();
        }
    }

    private void releaseWaitersLocked() {
        while (!waiters.isEmpty() && queue.size() < maxQueueSize) {
            Waiter waiter = waiters.removeFirst();
            queue.addAll(waiter.events);
            waiter.admitted.complete(null);
        }
    }

    private void fail(Throwable error) {
        Throwable cause = Futures.unwrap(error);
        logger.error("Projection '{}' failed to process events, stopping its worker", projection.getName(), cause);

        List<Waiter> abandoned;
        List<CompletableFuture<Void>> toFail;
        synchronized (lock) {
            failure = cause;
            running = false;
            abandoned = new ArrayList<>(waiters);
            waiters.clear();
            toFail = new ArrayList<>(drainedFutures);
            drainedFutures.clear();
        }
        abandoned.forEach(waiter -> waiter.admitted.completeExceptionally(cause));
        toFail.forEach(future -> future.completeExceptionally(cause));
    }

    private static final class Waiter {
        private final List<EventWithMetadata> events;
        private final CompletableFuture<Void> admitted = new CompletableFuture<>();

        Waiter(List<EventWithMetadata> events) {
            this.events = events;
        }
    }
}
