package dev.mars.commitstream.api.store;

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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Capability contract of a commit store.
 *
 * <p>Implementations are storage adapters; CommitStream only relies on the operations below:</p>
 * <ul>
 *   <li>atomic compare-and-insert of a commit keyed on (type, key, version)</li>
 *   <li>paginated, cursor-resumable reads of one aggregate's commits in version order</li>
 *   <li>paginated, cursor-resumable reads of all commits in chronological order</li>
 * </ul>
 *
 * <p>Query methods return lazy page sequences: iterating fetches pages on demand and may block on I/O.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventStore {

    /**
     * Appends a commit.
     *
     * @param commit the commit to insert
     * @return a future that fails with {@link dev.mars.commitstream.api.error.VersionConflictException}
     *         when the version is already taken
     */
    CompletableFuture<Void> commit(Commit commit);

    /**
     * Reads the commits of one aggregate instance.
     */
    Iterable<CommitResultSet> queryAggregateCommits(String aggregateType, String aggregateKey,
                                                    AggregateCommitQuery query);

    /**
     * Reads commits of all aggregates in chronological key order.
     */
    Iterable<CommitResultSet> chronologicalQuery(ChronologicalQuery query);

    CompletableFuture<Optional<Commit>> getAggregateHeadCommit(String aggregateType, String aggregateKey);

    /**
     * Most recent commit of a chronological partition.
     */
    CompletableFuture<Optional<Commit>> getHeadCommit(String partition);

    BatchMutator createBatchMutator();
}
