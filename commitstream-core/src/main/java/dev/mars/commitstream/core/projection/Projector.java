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

import dev.mars.commitstream.api.Commit;
import dev.mars.commitstream.api.EventWithMetadata;
import dev.mars.commitstream.api.store.EventStore;
import dev.mars.commitstream.core.backoff.BackoffParams;
import dev.mars.commitstream.core.concurrent.AbortSignal;
import dev.mars.commitstream.core.concurrent.Futures;
import dev.mars.commitstream.core.concurrent.Sleeper;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import dev.mars.commitstream.core.poll.ChronologicalCursorPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Polls an event store and feeds each projection's {@link ProjectionWorker}.
 *
 * <p>On {@link #start()} polling resumes after the lowest head sort key among the projections,
 * restricted to the aggregate types they cover. Events are handed to every worker whose
 * projection covers the event's aggregate type, in commit order; a full worker queue holds the
 * poller back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class Projector implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Projector.class);

    private final EventStore store;
    private final List<ProjectionWorker> workers;
    private final String partition;
    private final BackoffParams backoff;
    private final Sleeper sleeper;
    private final CommitStreamMetrics metrics;
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();

    private volatile ChronologicalCursorPoller poller;
    private volatile AbortSignal abortSignal;
    private Thread pollingThread;

    private Projector(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "Event store cannot be null");
        this.partition = builder.partition;
        this.backoff = builder.backoff;
        this.sleeper = builder.sleeper;
        this.metrics = builder.metrics != null ? builder.metrics : CommitStreamMetrics.noop();

        if (builder.projections.isEmpty()) {
            throw new IllegalArgumentException("Projector needs at least one projection");
        }
        ProjectionWorkerOptions workerOptions = builder.workerOptions.toBuilder().metrics(metrics).build();
        List<ProjectionWorker> created = new ArrayList<>();
        for (Projection projection : builder.projections) {
            created.add(new ProjectionWorker(projection, workerOptions));
        }
        this.workers = List.copyOf(created);
    }

    public static Builder builder(EventStore store) {
        return new Builder().store(store);
    }

    /**
     * Reads the head sort keys and starts polling on a background thread.
     *
     * @throws dev.mars.commitstream.api.error.ProjectionNotSetupException if a projection has no head
     */
    public synchronized void start() {
        if (pollingThread != null) {
            throw new IllegalStateException("Projector already started");
        }

        String startAt = null;
        for (ProjectionWorker worker : workers) {
            String head = Futures.await(worker.getProjection().getHeadSortKey());
            if (startAt == null || head.compareTo(startAt) < 0) {
                startAt = head;
            }
        }

        Set<String> aggregateTypes = new LinkedHashSet<>();
        workers.forEach(worker -> aggregateTypes.addAll(worker.getProjection().getAggregateTypes()));

        abortSignal = AbortSignal.create();
        ChronologicalCursorPoller.Builder pollerBuilder = ChronologicalCursorPoller.builder(store)
            .startAt(startAt)
            .partition(partition)
            .aggregateTypes(new ArrayList<>(aggregateTypes))
            .backoff(backoff)
            .abortSignal(abortSignal)
            .metrics(metrics);
        if (sleeper != null) {
            pollerBuilder.sleeper(sleeper);
        }
        poller = pollerBuilder.build();

        logger.info("Starting projector for {} projections from {}", workers.size(), startAt);
        pollingThread = new Thread(this::pollLoop, "projector-poller");
        pollingThread.setDaemon(true);
        pollingThread.start();
    }

    private void pollLoop() {
        try {
            for (Optional<Commit> next : poller) {
                if (next.isPresent()) {
                    processCommit(next.get());
                }
            }
            logger.info("Projector stopped at cursor {}", poller.getCursor());
            stopped.complete(null);
        } catch (RuntimeException e) {
            logger.error("Projector polling failed at cursor {}", poller.getCursor(), e);
            stopped.completeExceptionally(e);
        }
    }

    /**
     * Hands every event of the commit to the workers covering its aggregate type.
     */
    public void processCommit(Commit commit) {
        List<EventWithMetadata> events = EventWithMetadata.fromCommit(commit);
        for (ProjectionWorker worker : workers) {
            if (worker.getProjection().covers(commit.getAggregateType())) {
                Futures.await(worker.addAllToQueue(events));
            }
        }
    }

    /**
     * Stops polling. Events already queued keep draining.
     */
    public void stop() {
        AbortSignal signal = abortSignal;
        if (signal != null) {
            signal.abort();
        }
    }

    /**
     * Stops polling and waits for the polling thread to exit.
     */
    public void stop(Duration timeout) throws InterruptedException {
        stop();
        Thread thread;
        synchronized (this) {
            thread = pollingThread;
        }
        if (thread != null) {
            thread.join(timeout.toMillis());
        }
    }

    public CompletableFuture<Void> drained() {
        return CompletableFuture.allOf(workers.stream()
            .map(ProjectionWorker::drained)
            .toArray(CompletableFuture[]::new));
    }

    /**
     * Completes when polling ends, exceptionally if it failed.
     */
    public CompletableFuture<Void> stopped() {
        return stopped;
    }

    public String getCursor() {
        ChronologicalCursorPoller current = poller;
        return current != null ? current.getCursor() : null;
    }

    public List<ProjectionWorker> getWorkers() {
        return workers;
    }

    @Override
    public void close() {
        stop();
        workers.forEach(ProjectionWorker::close);
    }

    public static class Builder {
        private EventStore store;
        private final List<Projection> projections = new ArrayList<>();
        private String partition;
        private BackoffParams backoff = new BackoffParams(10, 1000, 2);
        private ProjectionWorkerOptions workerOptions = ProjectionWorkerOptions.defaults();
        private Sleeper sleeper;
        private CommitStreamMetrics metrics;

        public Builder store(EventStore store) {
            this.store = store;
            return this;
        }

        public Builder projection(Projection projection) {
            this.projections.add(projection);
            return this;
        }

        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        public Builder backoff(BackoffParams backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder workerOptions(ProjectionWorkerOptions workerOptions) {
            this.workerOptions = workerOptions;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder metrics(CommitStreamMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Projector build() {
            return new Projector(this);
        }
    }
}
