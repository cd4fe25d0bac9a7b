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

import java.util.Objects;

/**
 * Two-part key of a {@link MetaStore} entry: a partition key grouping related entries and a sub key.
 *
 * @param partitionKey groups entries that can be listed together
 * @param subKey       identifies the entry within its partition
 */
public record MetaStoreKey(String partitionKey, String subKey) {

    public MetaStoreKey {
        Objects.requireNonNull(partitionKey, "Partition key cannot be null");
        Objects.requireNonNull(subKey, "Sub key cannot be null");
    }

    public static MetaStoreKey of(String partitionKey, String subKey) {
        return new MetaStoreKey(partitionKey, subKey);
    }
}
