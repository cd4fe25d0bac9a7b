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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Key-value store for coordination metadata such as projection high-water marks.
 *
 * Access is last-writer-wins; no cross-process locking is provided.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface MetaStore {

    /**
     * Reads a value.
     *
     * @param key the entry key
     * @return a future with the value, or empty when absent or expired
     */
    CompletableFuture<Optional<String>> get(MetaStoreKey key);

    /**
     * Writes a value.
     *
     * @param key the entry key
     * @param value the value to store
     * @param expiresAt when the entry stops being visible, or {@code null} for never
     * @return a future completing once the value is durable
     */
    CompletableFuture<Void> put(MetaStoreKey key, String value, Instant expiresAt);

    default CompletableFuture<Void> put(MetaStoreKey key, String value) {
        return put(key, value, null);
    }

    CompletableFuture<Void> delete(MetaStoreKey key);

    /**
     * Lists the live entries of a partition as (sub key, value) pairs.
     */
    CompletableFuture<List<Map.Entry<String, String>>> list(String partitionKey);
}
