package dev.mars.commitstream.core.poll;

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
import dev.mars.commitstream.api.Commit;
import dev.mars.commitstream.api.store.ChronologicalQuery;
import dev.mars.commitstream.api.store.CommitResultSet;
import dev.mars.commitstream.api.store.EventStore;
import dev.mars.commitstream.core.backoff.BackoffParams;
import dev.mars.commitstream.core.concurrent.AbortSignal;
import dev.mars.commitstream.core.concurrent.Sleeper;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.DoubleSupplier;

/**
 * Live feed of commits in chronological order, resuming from a cursor.
 *
 * <p>Each poll asks the store for commits strictly after the cursor. The cursor moves to a
 * commit's chronological key when that commit is handed out, and to a result set's own cursor
 * when the store reports one that is further ahead, which keeps the cursor from lagging when a
 * scanned range held nothing of interest.</p>
 *
 * <p>The iterator is meant for a single consumer thread; {@link #getCursor()} may be read from
 * any thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ChronologicalCursorPoller implements Iterable<Optional<Commit>> {
    private static final Logger logger = LoggerFactory.getLogger(ChronologicalCursorPoller.class);

    private final EventStore store;
    private final String partition;
    private final List<String> aggregateTypes;
    private final PollLoop<Commit> pollLoop;
    private final CommitStreamMetrics metrics;
    private volatile String cursor;

    private ChronologicalCursorPoller(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "Event store cannot be null");
        this.partition = builder.partition != null ? builder.partition : Commit.DEFAULT_PARTITION;
        this.aggregateTypes = builder.aggregateTypes != null ? List.copyOf(builder.aggregateTypes) : null;
        this.metrics = builder.metrics != null ? builder.metrics : CommitStreamMetrics.noop();
        this.cursor = builder.startAt != null
            ? builder.startAt
            : ChronologicalKeys.fromInstant(builder.clock.instant());

        this.pollLoop = PollLoop.<Commit>builder(this::pollOnce)
            .backoff(builder.backoff)
            .abortSignal(builder.abortSignal)
            .sleeper(builder.sleeper)
            .random(builder.random)
            .metrics(this.metrics)
            .build();

        logger.debug("Chronological poller for partition '{}' starting after {}", partition, cursor);
    }

    public static Builder builder(EventStore store) {
        return new Builder().store(store);
    }

    @Override
    public Iterator<Optional<Commit>> iterator() {
        return pollLoop.iterator();
    }

    public String getCursor() {
        return cursor;
    }

    public AbortSignal getAbortSignal() {
        return pollLoop.getAbortSignal();
    }

    private Iterable<Commit> pollOnce() {
        ChronologicalQuery query = ChronologicalQuery.builder()
            .min(cursor)
            .exclusiveMin(true)
            .partition(partition)
            .aggregateTypes(aggregateTypes)
            .build();
        Iterable<CommitResultSet> resultSets = store.chronologicalQuery(query);
        return () -> new PassIterator(resultSets.iterator());
    }

    private void advanceTo(String key) {
        if (ChronologicalKeys.isAfter(key, cursor)) {
            cursor = key;
        }
    }

    /**
     * Flattens the pages of one poll, moving the cursor as commits are consumed.
     */
    private final class PassIterator implements Iterator<Commit> {
        private final Iterator<CommitResultSet> pages;
        private Iterator<Commit> page = Collections.emptyIterator();
        private String pageCursor;

        PassIterator(Iterator<CommitResultSet> pages) {
            this.pages = pages;
        }

        @Override
        public boolean hasNext() {
            while (!page.hasNext()) {
                if (pageCursor != null) {
                    advanceTo(pageCursor);
                    pageCursor = null;
                }
                if (!pages.hasNext()) {
                    return false;
                }
                CommitResultSet resultSet = pages.next();
                page = resultSet.commits().iterator();
                pageCursor = resultSet.cursor();
            }
            return true;
        }

        @Override
        public Commit next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Commit commit = page.next();
            advanceTo(commit.getChronologicalKey());
            metrics.recordCommitPolled();
            return commit;
        }
    }

    public static class Builder {
        private EventStore store;
        private String startAt;
        private String partition;
        private List<String> aggregateTypes;
        private BackoffParams backoff = new BackoffParams(10, 1000, 2);
        private AbortSignal abortSignal;
        private Sleeper sleeper;
        private DoubleSupplier random;
        private Clock clock = Clock.systemUTC();
        private CommitStreamMetrics metrics;

        public Builder store(EventStore store) {
            this.store = store;
            return this;
        }

        public Builder startAt(String cursor) {
            this.startAt = cursor;
            return this;
        }

        public Builder startAt(Instant instant) {
            this.startAt = ChronologicalKeys.fromInstant(instant);
            return this;
        }

        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        public Builder aggregateTypes(List<String> aggregateTypes) {
            this.aggregateTypes = aggregateTypes;
            return this;
        }

        public Builder backoff(BackoffParams backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder abortSignal(AbortSignal abortSignal) {
            this.abortSignal = abortSignal;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(CommitStreamMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ChronologicalCursorPoller build() {
            return new ChronologicalCursorPoller(this);
        }
    }
}
