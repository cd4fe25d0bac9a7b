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

import dev.mars.commitstream.api.Event;
import dev.mars.commitstream.api.EventWithMetadata;
import dev.mars.commitstream.api.KeySchema;
import dev.mars.commitstream.core.concurrent.ManualExecutor;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import dev.mars.commitstream.test.categories.TestCategories;
import dev.mars.commitstream.test.fixtures.CommitFixtures;
import dev.mars.commitstream.test.store.InMemoryMetaStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ProjectionWorkerTest {

    private InMemoryMetaStore metaStore;
    private ManualExecutor executor;
    private List<List<EventWithMetadata>> batches;

    @BeforeEach
    void setUp() {
        metaStore = new InMemoryMetaStore();
        executor = new ManualExecutor();
        batches = new CopyOnWriteArrayList<>();
    }

    @Test
    void testSameStreamEventsGoToSuccessiveBatches() {
        ProjectionWorker worker = worker(projection(ProjectionDependencies.none()), 100);
        EventWithMetadata k1v1 = event("Account", "k1", 1, 0);
        EventWithMetadata k1v2 = event("Account", "k1", 2, 1);
        EventWithMetadata k2v1 = event("Account", "k2", 1, 2);

        worker.addToQueue(k1v1);
        worker.addToQueue(k1v2);
        worker.addToQueue(k2v1);
        executor.runAll();

        assertEquals(List.of(List.of(k1v1, k2v1), List.of(k1v2)), batches);
        assertEquals(0, worker.getQueueSize());
        assertFalse(worker.isRunning());
    }

    @Test
    void testDependentEventWaitsForDependee() {
        ProjectionDependencies dependencies = ProjectionDependencies.builder()
            .add("Invoice", "Order", EventDependency.ALWAYS)
            .build();
        ProjectionWorker worker = worker(projection(dependencies), 100);
        EventWithMetadata order = event("Order", "o1", 1, 0);
        EventWithMetadata invoice = event("Invoice", "i1", 1, 1);
        EventWithMetadata customer = event("Customer", "c1", 1, 2);

        worker.addToQueue(order);
        worker.addToQueue(invoice);
        worker.addToQueue(customer);
        executor.runAll();

        assertEquals(List.of(List.of(order, customer), List.of(invoice)), batches);
    }

    @Test
    void testDeferredEventBlocksItsOwnDependents() {
        ProjectionDependencies dependencies = ProjectionDependencies.builder()
            .add("Invoice", "Order", EventDependency.ALWAYS)
            .add("Payment", "Invoice", EventDependency.ALWAYS)
            .build();
        ProjectionWorker worker = worker(projection(dependencies), 100);
        EventWithMetadata order = event("Order", "o1", 1, 0);
        EventWithMetadata invoice = event("Invoice", "i1", 1, 1);
        EventWithMetadata payment = event("Payment", "p1", 1, 2);

        worker.addToQueue(order);
        worker.addToQueue(invoice);
        worker.addToQueue(payment);
        executor.runAll();

        assertEquals(List.of(List.of(order), List.of(invoice), List.of(payment)), batches);
    }

    @Test
    void testDeferredEventHoldsItsStream() {
        ProjectionDependencies dependencies = ProjectionDependencies.builder()
            .add("Invoice", "Order", EventDependency.ALWAYS)
            .build();
        ProjectionWorker worker = worker(projection(dependencies), 100);
        EventWithMetadata order = event("Order", "o1", 1, 0);
        EventWithMetadata invoiceV1 = event("Invoice", "i1", 1, 1);
        EventWithMetadata invoiceV2 = event("Invoice", "i1", 2, 2);

        worker.addToQueue(order);
        worker.addToQueue(invoiceV1);
        worker.addToQueue(invoiceV2);
        executor.runAll();

        assertEquals(List.of(List.of(order), List.of(invoiceV1), List.of(invoiceV2)), batches);
    }

    @Test
    void testKeyPropDependencyOnlyBlocksMatchingTenant() {
        ProjectionDependencies dependencies = ProjectionDependencies.builder()
            .add("Invoice", "Order", EventDependency.sameKeyProp("tenant"))
            .build();
        Projection projection = Projection.builder("billing")
            .metaStore(metaStore)
            .aggregateType("Order", KeySchema.of("tenant", "orderId"))
            .aggregateType("Invoice", KeySchema.of("tenant", "invoiceId"))
            .dependencies(dependencies)
            .processor(this::record)
            .build();
        ProjectionWorker worker = worker(projection, 100);
        EventWithMetadata order = event("Order", "acme.o1", 1, 0);
        EventWithMetadata otherTenant = event("Invoice", "globex.i1", 1, 1);
        EventWithMetadata sameTenant = event("Invoice", "acme.i2", 1, 2);

        worker.addToQueue(order);
        worker.addToQueue(otherTenant);
        worker.addToQueue(sameTenant);
        executor.runAll();

        assertEquals(List.of(List.of(order, otherTenant), List.of(sameTenant)), batches);
    }

    @Test
    void testMaxBatchSizeSplitsBatches() {
        Projection projection = Projection.builder("small")
            .metaStore(metaStore)
            .maxBatchSize(2)
            .aggregateType("Account")
            .processor(this::record)
            .build();
        ProjectionWorker worker = worker(projection, 100);
        for (int i = 0; i < 5; i++) {
            worker.addToQueue(event("Account", "k" + i, 1, i));
        }
        executor.runAll();

        assertEquals(List.of(2, 2, 1), batches.stream().map(List::size).collect(Collectors.toList()));
    }

    @Test
    void testHeadMovesPessimisticallyThenToHighestProcessed() {
        Projection projection = projection(ProjectionDependencies.none());
        ProjectionWorker worker = worker(projection, 100);
        EventWithMetadata a1 = event("Account", "a", 1, 0);
        EventWithMetadata a2 = event("Account", "a", 2, 1);
        EventWithMetadata b1 = event("Account", "b", 1, 2);

        worker.addToQueue(a1);
        worker.addToQueue(a2);
        worker.addToQueue(b1);
        executor.runAll();

        assertEquals(List.of(a1.getSortKey(), a2.getSortKey(), b1.getSortKey()),
            metaStore.getWrites(projection.headSortKeyLocation()));
        assertEquals(b1.getSortKey(), worker.getPersistedHeadSortKey());
    }

    @Test
    void testHeadStaysBelowCommitWithUnprocessedEvents() {
        IllegalStateException indexDown = new IllegalStateException("index down");
        AtomicInteger calls = new AtomicInteger();
        Projection projection = Projection.builder("accounts")
            .metaStore(metaStore)
            .aggregateType("Account")
            .processor(events -> calls.incrementAndGet() == 1
                ? record(events)
                : CompletableFuture.failedFuture(indexDown))
            .build();
        ProjectionWorker worker = worker(projection, 100);
        List<EventWithMetadata> events = EventWithMetadata.fromCommit(CommitFixtures.commitWithEvents(
            "Account", "a", 1, 0, Event.of("Opened"), Event.of("Deposited")));

        worker.addAllToQueue(events);
        executor.runAll();

        assertEquals(2, calls.get());
        assertEquals(List.of(List.of(events.get(0))), batches);
        assertTrue(metaStore.getWrites(projection.headSortKeyLocation()).isEmpty());
        assertNull(worker.getPersistedHeadSortKey());
    }

    @Test
    void testHeadReachesCommitOnceAllItsEventsAreProcessed() {
        Projection projection = projection(ProjectionDependencies.none());
        ProjectionWorker worker = worker(projection, 100);
        List<EventWithMetadata> events = EventWithMetadata.fromCommit(CommitFixtures.commitWithEvents(
            "Account", "a", 1, 0, Event.of("Opened"), Event.of("Deposited")));
        EventWithMetadata other = event("Account", "b", 1, 5);

        worker.addAllToQueue(events);
        worker.addToQueue(other);
        executor.runAll();

        assertEquals(List.of(List.of(events.get(0), other), List.of(events.get(1))), batches);
        assertEquals(List.of(events.get(0).getSortKey(), other.getSortKey()),
            metaStore.getWrites(projection.headSortKeyLocation()));
    }

    @Test
    void testCommitEventsAreAdmittedTogether() throws Exception {
        ProjectionWorker worker = worker(projection(ProjectionDependencies.none()), 1);
        List<EventWithMetadata> events = EventWithMetadata.fromCommit(CommitFixtures.commitWithEvents(
            "Account", "a", 2, 10, Event.of("Deposited"), Event.of("Withdrawn")));

        worker.addToQueue(event("Account", "b", 1, 0));
        CompletableFuture<Void> admitted = worker.addAllToQueue(events);

        assertFalse(admitted.isDone());
        assertEquals(1, worker.getQueueSize());
        assertEquals(1, worker.getWaiterCount());

        executor.runAll();

        admitted.get(1, TimeUnit.SECONDS);
        assertEquals(3, batches.size());
        assertEquals(List.of(events.get(0)), batches.get(1));
        assertEquals(List.of(events.get(1)), batches.get(2));
        assertEquals(0, worker.getQueueSize());
    }

    @Test
    void testHeadNeverMovesBackwards() {
        Projection projection = projection(ProjectionDependencies.none());
        ProjectionWorker worker = worker(projection, 100);
        EventWithMetadata late = event("Account", "a", 1, 100);
        worker.addToQueue(late);
        executor.runAll();

        worker.addToQueue(event("Account", "b", 1, 50));
        executor.runAll();

        assertEquals(List.of(late.getSortKey()), metaStore.getWrites(projection.headSortKeyLocation()));
        assertEquals(2, batches.size());
    }

    @Test
    void testFullQueueParksCallersInOrder() throws Exception {
        ProjectionWorker worker = worker(projection(ProjectionDependencies.none()), 2);
        List<EventWithMetadata> events = new ArrayList<>();
        List<CompletableFuture<Void>> admissions = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            EventWithMetadata event = event("Account", "k" + i, 1, i);
            events.add(event);
            admissions.add(worker.addToQueue(event));
        }

        assertTrue(admissions.get(0).isDone());
        assertTrue(admissions.get(1).isDone());
        assertFalse(admissions.get(2).isDone());
        assertFalse(admissions.get(3).isDone());
        assertEquals(2, worker.getQueueSize());
        assertEquals(2, worker.getWaiterCount());

        CompletableFuture<Void> drained = worker.drained();
        assertFalse(drained.isDone());
        executor.runAll();

        for (CompletableFuture<Void> admission : admissions) {
            admission.get(1, TimeUnit.SECONDS);
        }
        drained.get(1, TimeUnit.SECONDS);
        assertEquals(List.of(events.subList(0, 2), events.subList(2, 4)), batches);
        assertEquals(0, worker.getWaiterCount());
    }

    @Test
    void testDrainedCompletesAtOnceWhenIdle() {
        ProjectionWorker worker = worker(projection(ProjectionDependencies.none()), 10);

        assertTrue(worker.drained().isDone());
    }

    @Test
    void testProcessingFailureFailsWaitersAndLaterCalls() {
        IllegalStateException indexDown = new IllegalStateException("index down");
        Projection projection = Projection.builder("failing")
            .metaStore(metaStore)
            .aggregateType("Account")
            .processor(events -> CompletableFuture.failedFuture(indexDown))
            .build();
        ProjectionWorker worker = worker(projection, 1);

        worker.addToQueue(event("Account", "a", 1, 0));
        CompletableFuture<Void> parked = worker.addToQueue(event("Account", "b", 1, 1));
        CompletableFuture<Void> drained = worker.drained();
        executor.runAll();

        ExecutionException parkedError = assertThrows(ExecutionException.class, () -> parked.get(1, TimeUnit.SECONDS));
        assertSame(indexDown, parkedError.getCause());
        ExecutionException drainedError = assertThrows(ExecutionException.class, () -> drained.get(1, TimeUnit.SECONDS));
        assertSame(indexDown, drainedError.getCause());
        assertTrue(worker.addToQueue(event("Account", "c", 1, 2)).isCompletedExceptionally());
        assertTrue(metaStore.getWrites(projection.headSortKeyLocation()).isEmpty());
        assertFalse(worker.isRunning());
    }

    @Test
    void testMetricsRecordProcessedEvents() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CommitStreamMetrics metrics = new CommitStreamMetrics("worker-test");
        metrics.bindTo(registry);
        Projection projection = projection(ProjectionDependencies.none());
        ProjectionWorker worker = new ProjectionWorker(projection,
            ProjectionWorkerOptions.builder().executor(executor).metrics(metrics).build());

        worker.addToQueue(event("Account", "a", 1, 0));
        worker.addToQueue(event("Account", "b", 1, 1));
        executor.runAll();

        assertEquals(2.0, registry.get("commitstream.projection.events.processed")
            .tag("projection", "accounts").counter().count());
        assertEquals(1.0, registry.get("commitstream.projection.head.advances")
            .tag("projection", "accounts").counter().count());
    }

    private Projection projection(ProjectionDependencies dependencies) {
        return Projection.builder("accounts")
            .metaStore(metaStore)
            .aggregateType("Account")
            .aggregateType("Order")
            .aggregateType("Invoice")
            .aggregateType("Payment")
            .aggregateType("Customer")
            .dependencies(dependencies)
            .processor(this::record)
            .build();
    }

    private ProjectionWorker worker(Projection projection, int maxQueueSize) {
        return new ProjectionWorker(projection, ProjectionWorkerOptions.builder()
            .maxQueueSize(maxQueueSize)
            .executor(executor)
            .build());
    }

    private CompletableFuture<Void> record(List<EventWithMetadata> events) {
        batches.add(List.copyOf(events));
        return CompletableFuture.completedFuture(null);
    }

    private static EventWithMetadata event(String type, String key, long version, long offsetMillis) {
        return EventWithMetadata.fromCommit(CommitFixtures.commit(type, key, version, offsetMillis)).get(0);
    }
}
