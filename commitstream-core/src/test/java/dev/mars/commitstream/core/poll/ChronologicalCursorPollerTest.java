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
import dev.mars.commitstream.api.store.AggregateCommitQuery;
import dev.mars.commitstream.api.store.BatchMutator;
import dev.mars.commitstream.api.store.ChronologicalQuery;
import dev.mars.commitstream.api.store.CommitResultSet;
import dev.mars.commitstream.api.store.EventStore;
import dev.mars.commitstream.core.concurrent.RecordingSleeper;
import dev.mars.commitstream.test.categories.TestCategories;
import dev.mars.commitstream.test.fixtures.CommitFixtures;
import dev.mars.commitstream.test.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ChronologicalCursorPollerTest {

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(Clock.systemUTC(), 2);
    }

    @Test
    void testYieldsCommitsInOrderAcrossPages() {
        List<Commit> written = List.of(
            CommitFixtures.commit("Account", "a", 1, 0),
            CommitFixtures.commit("Account", "b", 1, 1),
            CommitFixtures.commit("Account", "a", 2, 2),
            CommitFixtures.commit("Account", "c", 1, 3),
            CommitFixtures.commit("Account", "b", 2, 4));
        written.forEach(store::write);

        ChronologicalCursorPoller poller = ChronologicalCursorPoller.builder(store)
            .startAt(CommitFixtures.BASE_TIME.minusSeconds(1))
            .sleeper(new RecordingSleeper())
            .build();

        List<Commit> seen = takeUntilEmpty(poller.iterator());

        assertEquals(written, seen);
        assertEquals(written.get(4).getChronologicalKey(), poller.getCursor());
    }

    @Test
    void testResumesAfterCursorOnNextPoll() {
        store.write(CommitFixtures.commit("Account", "a", 1, 0));
        ChronologicalCursorPoller poller = ChronologicalCursorPoller.builder(store)
            .startAt(CommitFixtures.BASE_TIME.minusSeconds(1))
            .sleeper(new RecordingSleeper())
            .build();
        Iterator<Optional<Commit>> it = poller.iterator();
        assertEquals(1, takeUntilEmpty(it).size());
        String cursorAfterFirstPass = poller.getCursor();

        Commit later = CommitFixtures.commit("Account", "a", 2, 10);
        store.write(later);

        assertEquals(Optional.of(later), it.next());
        List<ChronologicalQuery> queries = store.getChronologicalQueries();
        ChronologicalQuery lastQuery = queries.get(queries.size() - 1);
        assertEquals(cursorAfterFirstPass, lastQuery.getMin());
        assertTrue(lastQuery.isExclusiveMin());
    }

    @Test
    void testFiltersByAggregateType() {
        store.write(CommitFixtures.commit("Account", "a", 1, 0));
        store.write(CommitFixtures.commit("Order", "o", 1, 1));
        store.write(CommitFixtures.commit("Account", "b", 1, 2));

        ChronologicalCursorPoller poller = ChronologicalCursorPoller.builder(store)
            .startAt(CommitFixtures.BASE_TIME.minusSeconds(1))
            .aggregateTypes(List.of("Order"))
            .sleeper(new RecordingSleeper())
            .build();

        List<Commit> seen = takeUntilEmpty(poller.iterator());

        assertEquals(1, seen.size());
        assertEquals("Order", seen.get(0).getAggregateType());
    }

    @Test
    void testDefaultStartIsNow() {
        store.write(CommitFixtures.commit("Account", "a", 1, 0));
        Clock clock = Clock.fixed(CommitFixtures.BASE_TIME.plus(Duration.ofMinutes(1)), ZoneOffset.UTC);

        ChronologicalCursorPoller poller = ChronologicalCursorPoller.builder(store)
            .clock(clock)
            .sleeper(new RecordingSleeper())
            .build();

        assertEquals(ChronologicalKeys.fromInstant(clock.instant()), poller.getCursor());
        assertTrue(takeUntilEmpty(poller.iterator()).isEmpty());
    }

    @Test
    void testResultSetCursorMovesPastFilteredCommits() {
        String scannedUpTo = ChronologicalKeys.fromInstant(CommitFixtures.BASE_TIME.plusSeconds(30));
        EventStore scanningStore = new ScanOnlyStore(scannedUpTo);

        ChronologicalCursorPoller poller = ChronologicalCursorPoller.builder(scanningStore)
            .startAt(CommitFixtures.BASE_TIME)
            .sleeper(new RecordingSleeper())
            .build();

        assertTrue(poller.iterator().next().isEmpty());
        assertEquals(scannedUpTo, poller.getCursor());
    }

    private static List<Commit> takeUntilEmpty(Iterator<Optional<Commit>> it) {
        List<Commit> seen = new ArrayList<>();
        while (true) {
            Optional<Commit> next = it.next();
            if (next.isEmpty()) {
                return seen;
            }
            seen.add(next.get());
        }
    }

    /**
     * Store whose chronological query returns no commits but reports how far it scanned.
     */
    private static final class ScanOnlyStore implements EventStore {
        private final String scannedUpTo;

        ScanOnlyStore(String scannedUpTo) {
            this.scannedUpTo = scannedUpTo;
        }

        @Override
        public Iterable<CommitResultSet> chronologicalQuery(ChronologicalQuery query) {
            return List.of(CommitResultSet.of(List.of(), scannedUpTo));
        }

        @Override
        public CompletableFuture<Void> commit(Commit commit) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Iterable<CommitResultSet> queryAggregateCommits(String aggregateType, String aggregateKey,
                                                               AggregateCommitQuery query) {
            throw new UnsupportedOperationException();
        }

        @Override
        public CompletableFuture<Optional<Commit>> getAggregateHeadCommit(String aggregateType, String aggregateKey) {
            throw new UnsupportedOperationException();
        }

        @Override
        public CompletableFuture<Optional<Commit>> getHeadCommit(String partition) {
            throw new UnsupportedOperationException();
        }

        @Override
        public BatchMutator createBatchMutator() {
            throw new UnsupportedOperationException();
        }
    }
}
