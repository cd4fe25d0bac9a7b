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

import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/**
 * Bulk writer that puts or deletes commits without optimistic version checks.
 *
 * Mutations are queued and written in the background; the futures returned by
 * {@link #put(Collection)} and {@link #delete(Collection)} complete once every commit has been
 * admitted to the queue, and {@link #drained()} completes once the queue is empty.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface BatchMutator {

    CompletableFuture<Void> put(Collection<Commit> commits);

    CompletableFuture<Void> delete(Collection<Commit> commits);

    CompletableFuture<Void> drained();

    long getWriteCount();

    long getDeleteCount();

    long getThrottleCount();
}
