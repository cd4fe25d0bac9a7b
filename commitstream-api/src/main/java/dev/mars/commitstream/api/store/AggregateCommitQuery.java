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

import java.time.Instant;

/**
 * Options for reading the commits of a single aggregate instance in version order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class AggregateCommitQuery {

    private final Long minVersion;
    private final Long maxVersion;
    private final Instant maxTime;
    private final int limit;
    private final boolean descending;
    private final boolean consistentRead;

    private AggregateCommitQuery(Builder builder) {
        this.minVersion = builder.minVersion;
        this.maxVersion = builder.maxVersion;
        this.maxTime = builder.maxTime;
        this.limit = builder.limit;
        this.descending = builder.descending;
        this.consistentRead = builder.consistentRead;

        if (minVersion != null && maxVersion != null && minVersion > maxVersion) {
            throw new IllegalArgumentException("minVersion cannot be greater than maxVersion");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AggregateCommitQuery all() {
        return builder().build();
    }

    public Long getMinVersion() {
        return minVersion;
    }

    public Long getMaxVersion() {
        return maxVersion;
    }

    public Instant getMaxTime() {
        return maxTime;
    }

    public int getLimit() {
        return limit;
    }

    public boolean isDescending() {
        return descending;
    }

    public boolean isConsistentRead() {
        return consistentRead;
    }

    public boolean matches(Commit commit) {
        if (minVersion != null && commit.getAggregateVersion() < minVersion) {
            return false;
        }
        if (maxVersion != null && commit.getAggregateVersion() > maxVersion) {
            return false;
        }
        return maxTime == null || !commit.getTimestamp().isAfter(maxTime);
    }

    /**
     * Builder for {@link AggregateCommitQuery}.
     */
    public static class Builder {
        private Long minVersion;
        private Long maxVersion;
        private Instant maxTime;
        private int limit;
        private boolean descending;
        private boolean consistentRead;

        public Builder minVersion(long minVersion) {
            this.minVersion = minVersion;
            return this;
        }

        public Builder maxVersion(long maxVersion) {
            this.maxVersion = maxVersion;
            return this;
        }

        public Builder maxTime(Instant maxTime) {
            this.maxTime = maxTime;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder descending(boolean descending) {
            this.descending = descending;
            return this;
        }

        public Builder consistentRead(boolean consistentRead) {
            this.consistentRead = consistentRead;
            return this;
        }

        public AggregateCommitQuery build() {
            return new AggregateCommitQuery(this);
        }
    }
}
