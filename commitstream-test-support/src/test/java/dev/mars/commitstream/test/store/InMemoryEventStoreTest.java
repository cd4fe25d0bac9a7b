package dev.mars.commitstream.test.store;

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
import dev.mars.commitstream.api.error.VersionConflictException;
import dev.mars.commitstream.api.store.AggregateCommitQuery;
import dev.mars.commitstream.api.store.BatchMutator;
import dev.mars.commitstream.api.store.ChronologicalQuery;
import dev.mars.commitstream.api.store.CommitResultSet;
import dev.mars.commitstream.test.categories.TestCategories;
import dev.mars.commitstream.test.fixtures.CommitFixtures;
import dev.mars.commitstream.test.fixtures.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static dev.mars.commitstream.test.fixtures.CommitFixtures.commit;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class InMemoryEventStoreTest {

    private MutableClock clock;
    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(CommitFixtures.BASE_TIME.plusSeconds(3600));
        store = new InMemoryEventStore(clock, 2);
    }

    @Test
    void testDuplicateVersionIsRejected() {
        store.commit(commit("Account", "a", 1, 0)).join();

        CompletionException error = assertThrows(CompletionException.class,
            () -> store.commit(commit("Account", "a", 1, 5)).join());

        assertInstanceOf(VersionConflictException.class, error.getCause());
        assertEquals(1, store.size());
        assertEquals(1, store.getVersionConflictCount());
    }

    @Test
    void testChronologicalQueryIsPagedInKeyOrder() {
        store.commit(commit("Account", "b", 1, 30)).join();
        store.commit(commit("Account", "a", 1, 10)).join();
        store.commit(commit("Order", "x", 1, 20)).join();

        List<Integer> pageSizes = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        for (CommitResultSet page : store.chronologicalQuery(ChronologicalQuery.builder()
                .min(CommitFixtures.BASE_TIME).build())) {
            pageSizes.add(page.commits().size());
            page.commits().forEach(c -> keys.add(c.getAggregateKey()));
        }

        assertEquals(List.of(2, 1), pageSizes);
        assertEquals(List.of("a", "x", "b"), keys);
    }

    @Test
    void testChronologicalQueryHonoursExclusiveMinAndTypes() {
        Commit first = commit("Account", "a", 1, 10);
        store.commit(first).join();
        store.commit(commit("Order", "x", 1, 20)).join();
        store.commit(commit("Account", "a", 2, 30)).join();

        List<Commit> result = new ArrayList<>();
        store.chronologicalQuery(ChronologicalQuery.builder()
                .min(first.getChronologicalKey())
                .exclusiveMin(true)
                .aggregateTypes(List.of("Account"))
                .build())
            .forEach(page -> result.addAll(page.commits()));

        assertEquals(1, result.size());
        assertEquals(2, result.get(0).getAggregateVersion());
    }

    @Test
    void testExpiredCommitsAreHidden() {
        store.commit(Commit.builder()
            .aggregateType("Session").aggregateKey("s").aggregateVersion(1)
            .timestamp(CommitFixtures.BASE_TIME)
            .expiresAt(clock.instant().plusSeconds(10))
            .build()).join();

        AggregateCommitQuery all = AggregateCommitQuery.all();
        assertEquals(1, count(store.queryAggregateCommits("Session", "s", all)));

        clock.advance(Duration.ofSeconds(11));
        assertEquals(0, count(store.queryAggregateCommits("Session", "s", all)));
    }

    @Test
    void testHeadCommits() {
        store.commit(commit("Account", "a", 1, 10)).join();
        store.commit(commit("Account", "a", 2, 20)).join();
        store.commit(commit("Order", "x", 1, 30)).join();

        assertEquals(2, store.getAggregateHeadCommit("Account", "a").join().orElseThrow().getAggregateVersion());
        assertEquals("x", store.getHeadCommit(Commit.DEFAULT_PARTITION).join().orElseThrow().getAggregateKey());
        assertTrue(store.getAggregateHeadCommit("Account", "missing").join().isEmpty());
    }

    @Test
    void testBatchMutatorWritesAndDeletes() {
        BatchMutator mutator = store.createBatchMutator();
        Commit first = commit("Account", "a", 1, 10);
        Commit second = commit("Account", "a", 2, 20);

        mutator.put(List.of(first, second)).join();
        mutator.delete(List.of(first)).join();

        assertEquals(List.of(second), store.getAllCommits());
        assertEquals(2, mutator.getWriteCount());
        assertEquals(1, mutator.getDeleteCount());
        assertEquals(0, mutator.getThrottleCount());
        assertTrue(mutator.drained().isDone());
    }

    private static int count(Iterable<CommitResultSet> pages) {
        int total = 0;
        for (CommitResultSet page : pages) {
            total += page.commits().size();
        }
        return total;
    }
}
