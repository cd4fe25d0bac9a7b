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
import dev.mars.commitstream.api.Commit;
import dev.mars.commitstream.api.EventWithMetadata;
import dev.mars.commitstream.api.KeySchema;
import dev.mars.commitstream.api.error.ProjectionNotSetupException;
import dev.mars.commitstream.api.store.MetaStoreKey;
import dev.mars.commitstream.core.backoff.BackoffParams;
import dev.mars.commitstream.test.categories.TestCategories;
import dev.mars.commitstream.test.fixtures.CommitFixtures;
import dev.mars.commitstream.test.store.InMemoryMetaStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ProjectionTest {

    private static final BackoffParams FAST = new BackoffParams(1, 20, 2);

    private InMemoryMetaStore metaStore;
    private Projection projection;

    @BeforeEach
    void setUp() {
        metaStore = new InMemoryMetaStore();
        projection = Projection.builder("orders")
            .metaStore(metaStore)
            .aggregateType("Order", KeySchema.of("tenant", "orderId"))
            .aggregateType("Customer")
            .processor(events -> CompletableFuture.completedFuture(null))
            .build();
    }

    @Test
    void testHeadSortKeyLocation() {
        assertEquals(MetaStoreKey.of("Projection:orders", "headSortKey"), projection.headSortKeyLocation());
    }

    @Test
    void testHeadSortKeyMissingBeforeSetup() {
        ExecutionException thrown = assertThrows(ExecutionException.class,
            () -> projection.getHeadSortKey().get(1, TimeUnit.SECONDS));

        assertInstanceOf(ProjectionNotSetupException.class, thrown.getCause());
        assertTrue(thrown.getCause().getMessage().contains("orders"));
    }

    @Test
    void testSetupStoresStartOnlyOnce() throws Exception {
        projection.setup(CommitFixtures.BASE_TIME).get(1, TimeUnit.SECONDS);
        projection.setup(CommitFixtures.BASE_TIME.plusSeconds(60)).get(1, TimeUnit.SECONDS);

        assertEquals(ChronologicalKeys.fromInstant(CommitFixtures.BASE_TIME),
            projection.getHeadSortKey().get(1, TimeUnit.SECONDS));
        assertEquals(1, metaStore.getWrites(projection.headSortKeyLocation()).size());
    }

    @Test
    void testTeardownRemovesHead() throws Exception {
        projection.setup(CommitFixtures.BASE_TIME).get(1, TimeUnit.SECONDS);

        projection.teardown().get(1, TimeUnit.SECONDS);

        assertTrue(projection.findHeadSortKey().get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testCommitIsProcessedOnceHeadPassesIt() throws Exception {
        Commit commit = CommitFixtures.commit("Order", "acme.1", 1, 0);
        projection.setHeadSortKey(commit.getChronologicalKey()).get(1, TimeUnit.SECONDS);

        assertTrue(projection.commitIsProcessed(commit, FAST, Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS));
    }

    @Test
    @Tag(TestCategories.SLOW)
    void testWhenSortKeyReachedTimesOut() throws Exception {
        projection.setup(CommitFixtures.BASE_TIME).get(1, TimeUnit.SECONDS);
        Commit later = CommitFixtures.commit("Order", "acme.1", 1, 5_000);

        long started = System.nanoTime();
        assertFalse(projection.whenSortKeyReached(later.getChronologicalKey(), FAST, Duration.ofMillis(100))
            .get(5, TimeUnit.SECONDS));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 2000);
    }

    @Test
    void testWhenSortKeyReachedSeesLaterAdvance() throws Exception {
        projection.setup(CommitFixtures.BASE_TIME).get(1, TimeUnit.SECONDS);
        Commit commit = CommitFixtures.commit("Order", "acme.1", 1, 10);

        CompletableFuture<Boolean> reached = projection.whenSortKeyReached(commit.getChronologicalKey(), FAST,
            Duration.ofSeconds(5));
        CompletableFuture.runAsync(() -> projection.setHeadSortKey(commit.getChronologicalKey()),
            CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));

        assertTrue(reached.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testCoversOnlyDeclaredTypes() {
        assertTrue(projection.covers("Order"));
        assertTrue(projection.covers("Customer"));
        assertFalse(projection.covers("Invoice"));
    }

    @Test
    void testKeyPropsDecodedWithSchema() {
        EventWithMetadata order = EventWithMetadata.fromCommit(CommitFixtures.commit("Order", "acme.42", 1, 0)).get(0);
        EventWithMetadata customer = EventWithMetadata.fromCommit(CommitFixtures.commit("Customer", "c.1", 1, 0)).get(0);

        assertEquals(Map.of("tenant", "acme", "orderId", "42"), projection.withKeyProps(order).getKeyProps());
        assertSame(customer, projection.withKeyProps(customer));
    }

    @Test
    void testBuilderRejectsProjectionWithoutTypes() {
        assertThrows(IllegalArgumentException.class, () -> Projection.builder("empty")
            .metaStore(metaStore)
            .processor(events -> CompletableFuture.completedFuture(null))
            .build());
    }
}
