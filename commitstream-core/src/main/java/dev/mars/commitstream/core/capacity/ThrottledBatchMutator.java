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

import dev.mars.commitstream.api.Commit;
import dev.mars.commitstream.api.store.BatchMutator;
import dev.mars.commitstream.core.concurrent.Futures;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base for store adapters that write commits in chunked, throttled requests.
 *
 * <p>Mutations are buffered in a bounded FIFO queue; {@link #put} and {@link #delete} resolve once
 * every mutation has been admitted, parking callers while the queue is full. A single writer loop
 * sends chunks of at most {@code maxItemsPerRequest} items, further limited by the
 * {@link CapacityLimiter} when one is configured. Items a request hands back unprocessed go back to
 * the front of the queue and count as throttled.</p>
 *
 * <p>Subclasses implement only {@link #writeChunk}, the single store request.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public abstract class ThrottledBatchMutator implements BatchMutator, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ThrottledBatchMutator.class);

    private final int maxItemsPerRequest;
    private final int queueSize;
    private final CapacityLimiter limiter;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final CommitStreamMetrics metrics;

    private final Object lock = new Object();
    private final Deque<Mutation> queue = new ArrayDeque<>();
    private final Deque<PendingMutation> waiters = new ArrayDeque<>();
    private final List<CompletableFuture<Void>> drainedFutures = new ArrayList<>();
    private boolean running;
    private Throwable failure;

    private final AtomicLong writeCount = new AtomicLong();
    private final AtomicLong deleteCount = new AtomicLong();
    private final AtomicLong throttleCount = new AtomicLong();

    /**
     * @param limiter capacity limiter, or {@code null} to send full chunks without throttling
     * @param executor runs the writer loop, or {@code null} for a dedicated daemon thread
     */
    protected ThrottledBatchMutator(CapacityOptions options, CapacityLimiter limiter, Executor executor,
                                    CommitStreamMetrics metrics) {
        this.maxItemsPerRequest = options.maxItemsPerRequest();
        this.queueSize = options.queueSize();
        this.limiter = limiter;
        this.metrics = metrics != null ? metrics : CommitStreamMetrics.noop();
        if (executor != null) {
            this.executor = executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "batch-mutator-" + getClass().getSimpleName());
                t.setDaemon(true);
                return t;
            });
            this.executor = ownedExecutor;
        }
    }

    /**
     * Sends one store request.
     *
     * @param chunk mutations to apply, never more than the configured request size
     * @return the mutations the store did not apply and the capacity the request consumed
     */
    protected abstract CompletableFuture<WriteResult> writeChunk(List<Mutation> chunk);

    @Override
    public CompletableFuture<Void> put(Collection<Commit> commits) {
        return enqueue(commits, MutationType.PUT);
    }

    @Override
    public CompletableFuture<Void> delete(Collection<Commit> commits) {
        return enqueue(commits, MutationType.DELETE);
    }

    @Override
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

    @Override
    public long getWriteCount() {
        return writeCount.get();
    }

    @Override
    public long getDeleteCount() {
        return deleteCount.get();
    }

    @Override
    public long getThrottleCount() {
        return throttleCount.get();
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private CompletableFuture<Void> enqueue(Collection<Commit> commits, MutationType type) {
        List<CompletableFuture<Void>> admissions = new ArrayList<>();
        synchronized (lock) {
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            for (Commit commit : commits) {
                Mutation mutation = new Mutation(type, commit);
                if (queue.size() >= queueSize || !waiters.isEmpty()) {
                    PendingMutation pending = new PendingMutation(mutation);
                    waiters.addLast(pending);
                    admissions.add(pending.admitted);
                } else {
                    queue.addLast(mutation);
                }
            }
            startIfIdle();
        }
        return CompletableFuture.allOf(admissions.toArray(new CompletableFuture[0]));
    }

    // Caller holds the lock.
    private void startIfIdle() {
        if (!running && !queue.isEmpty()) {
            running = true;
            executor.execute(this::writerLoop);
        }
    }

    private void writerLoop() {
        try {
            while (true) {
                int permitted = limiter != null ? Math.max(1, limiter.permittedItemCount()) : maxItemsPerRequest;

                List<Mutation> chunk = new ArrayList<>();
                synchronized (lock) {
                    while (chunk.size() < Math.min(maxItemsPerRequest, permitted) && !queue.isEmpty()) {
                        chunk.add(queue.removeFirst());
                    }
                    releaseWaiters();
                }
                if (chunk.isEmpty()) {
                    break;
                }

                WriteResult result = Futures.await(writeChunk(chunk));
                List<Mutation> unprocessed = result.unprocessed();
                if (limiter != null) {
                    limiter.registerConsumption(result.consumedCapacity(), chunk.size());
                }
                countApplied(chunk, unprocessed);

                if (!unprocessed.isEmpty()) {
                    throttleCount.addAndGet(unprocessed.size());
                    metrics.recordThrottled(unprocessed.size());
                    logger.debug("{} of {} mutations throttled, re-queueing", unprocessed.size(), chunk.size());
                    synchronized (lock) {
                        ListIterator<Mutation> it = unprocessed.listIterator(unprocessed.size());
                        while (it.hasPrevious()) {
                            queue.addFirst(it.previous());
                        }
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
            return;
        } catch (RuntimeException e) {
            fail(e);
            return;
        }

        List<CompletableFuture<Void>> toComplete = List.of();
        synchronized (lock) {
            running = false;
            if (!queue.isEmpty() || !waiters.isEmpty()) {
                releaseWaiters();
                startIfIdle();
            } else {
                toComplete = new ArrayList<>(drainedFutures);
                drainedFutures.clear();
            }
        }
        toComplete.forEach(future -> future.complete(null));
    }

    private void countApplied(List<Mutation> chunk, List<Mutation> unprocessed) {
        for (Mutation mutation : chunk) {
            if (unprocessed.contains(mutation)) {
                continue;
            }
            if (mutation.type() == MutationType.PUT) {
                writeCount.incrementAndGet();
            } else {
                deleteCount.incrementAndGet();
            }
        }
    }

    // Caller holds the lock.
    private void releaseWaiters() {
        while (!waiters.isEmpty() && queue.size() < queueSize) {
            PendingMutation pending = waiters.removeFirst();
            queue.addLast(pending.mutation);
            pending.admitted.complete(null);
        }
    }

    private void fail(Throwable error) {
        Throwable cause = Futures.unwrap(error);
        logger.error("Batch writer stopped after a failed request", cause);

        List<PendingMutation> abandoned;
        List<CompletableFuture<Void>> toFail;
        synchronized (lock) {
            failure = cause;
            running = false;
            abandoned = new ArrayList<>(waiters);
            waiters.clear();
            toFail = new ArrayList<>(drainedFutures);
            drainedFutures.clear();
        }
        abandoned.forEach(pending -> pending.admitted.completeExceptionally(cause));
        toFail.forEach(future -> future.completeExceptionally(cause));
    }

    public enum MutationType {
        PUT,
        DELETE
    }

    /**
     * One queued write or delete of a commit.
     */
    public record Mutation(MutationType type, Commit commit) {
    }

    /**
     * Outcome of one store request.
     *
     * @param unprocessed mutations the store handed back, to be retried
     * @param consumedCapacity capacity units the request used
     */
    public record WriteResult(List<Mutation> unprocessed, double consumedCapacity) {

        public WriteResult {
            unprocessed = List.copyOf(unprocessed);
        }

        public static WriteResult complete(double consumedCapacity) {
            return new WriteResult(List.of(), consumedCapacity);
        }
    }

    private static final class PendingMutation {
        private final Mutation mutation;
        private final CompletableFuture<Void> admitted = new CompletableFuture<>();

        PendingMutation(Mutation mutation) {
            this.mutation = mutation;
        }
    }
}
