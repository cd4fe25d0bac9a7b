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

import dev.mars.commitstream.api.ChronologicalKeys;
import dev.mars.commitstream.api.Commit;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Criteria for reading commits in chronological order across all aggregates.
 *
 * Bounds are chronological keys or key prefixes; {@link Builder#min(Instant)} and
 * {@link Builder#max(Instant)} convert instants with {@link ChronologicalKeys#fromInstant(Instant)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ChronologicalQuery {

    private final String min;
    private final String max;
    private final boolean exclusiveMin;
    private final boolean exclusiveMax;
    private final String partition;
    private final List<String> aggregateTypes;
    private final int limit;
    private final boolean descending;

    private ChronologicalQuery(Builder builder) {
        this.min = Objects.requireNonNull(builder.min, "You must specify the min bound");
        this.max = builder.max;
        this.exclusiveMin = builder.exclusiveMin;
        this.exclusiveMax = builder.exclusiveMax;
        this.partition = builder.partition != null ? builder.partition : Commit.DEFAULT_PARTITION;
        this.aggregateTypes = builder.aggregateTypes != null ? List.copyOf(builder.aggregateTypes) : null;
        this.limit = builder.limit;
        this.descending = builder.descending;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getMin() {
        return min;
    }

    /**
     * Upper bound, or {@code null} to let the store pick one near the present.
     */
    public String getMax() {
        return max;
    }

    public boolean isExclusiveMin() {
        return exclusiveMin;
    }

    public boolean isExclusiveMax() {
        return exclusiveMax;
    }

    public String getPartition() {
        return partition;
    }

    /**
     * Aggregate types to include, or {@code null} for all.
     */
    public List<String> getAggregateTypes() {
        return aggregateTypes;
    }

    /**
     * Maximum number of commits, 0 for unlimited.
     */
    public int getLimit() {
        return limit;
    }

    public boolean isDescending() {
        return descending;
    }

    /**
     * Whether a commit falls inside this query's partition, type filter and bounds.
     */
    public boolean matches(Commit commit) {
        if (!partition.equals(commit.getChronologicalPartition())) {
            return false;
        }
        if (aggregateTypes != null && !aggregateTypes.contains(commit.getAggregateType())) {
            return false;
        }
        String key = commit.getChronologicalKey();
        int vsMin = key.compareTo(min);
        if (exclusiveMin ? vsMin <= 0 : vsMin < 0) {
            return false;
        }
        if (max != null) {
            int vsMax = key.compareTo(max);
            return exclusiveMax ? vsMax < 0 : vsMax <= 0;
        }
        return true;
    }

    @Override
    public String toString() {
        return "ChronologicalQuery{" +
                "min='" + min + '\'' +
                ", max='" + max + '\'' +
                ", exclusiveMin=" + exclusiveMin +
                ", exclusiveMax=" + exclusiveMax +
                ", partition='" + partition + '\'' +
                ", aggregateTypes=" + aggregateTypes +
                ", limit=" + limit +
                ", descending=" + descending +
                '}';
    }

    /**
     * Builder for {@link ChronologicalQuery}.
     */
    public static class Builder {
        private String min;
        private String max;
        private boolean exclusiveMin;
        private boolean exclusiveMax;
        private String partition;
        private List<String> aggregateTypes;
        private int limit;
        private boolean descending;

        public Builder min(String min) {
            this.min = min;
            return this;
        }

        public Builder min(Instant min) {
            this.min = ChronologicalKeys.fromInstant(min);
            return this;
        }

        public Builder max(String max) {
            this.max = max;
            return this;
        }

        public Builder max(Instant max) {
            this.max = ChronologicalKeys.fromInstant(max);
            return this;
        }

        public Builder exclusiveMin(boolean exclusiveMin) {
            this.exclusiveMin = exclusiveMin;
            return this;
        }

        public Builder exclusiveMax(boolean exclusiveMax) {
            this.exclusiveMax = exclusiveMax;
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

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("Limit cannot be negative");
            }
            this.limit = limit;
            return this;
        }

        public Builder descending(boolean descending) {
            this.descending = descending;
            return this;
        }

        public ChronologicalQuery build() {
            return new ChronologicalQuery(this);
        }
    }
}
