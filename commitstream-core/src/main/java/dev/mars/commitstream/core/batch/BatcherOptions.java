package dev.mars.commitstream.core.batch;

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

import dev.mars.commitstream.core.concurrent.AbortSignal;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;

import java.util.Objects;

/**
 * Settings for {@link ParallelizableCommitBatcher}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class BatcherOptions {

    private final int maxBatchSize;
    private final int maxBacklogSize;
    private final CommitDependency isDependent;
    private final AbortSignal abortSignal;
    private final CommitStreamMetrics metrics;

    private BatcherOptions(Builder builder) {
        this.maxBatchSize = builder.maxBatchSize;
        this.maxBacklogSize = builder.maxBacklogSize;
        this.isDependent = Objects.requireNonNull(builder.isDependent, "Dependency predicate cannot be null");
        this.abortSignal = builder.abortSignal != null ? builder.abortSignal : AbortSignal.create();
        this.metrics = builder.metrics != null ? builder.metrics : CommitStreamMetrics.noop();

        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("Max batch size must be at least 1");
        }
        if (maxBacklogSize < 1) {
            throw new IllegalArgumentException("Max backlog size must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BatcherOptions defaults() {
        return builder().build();
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public int getMaxBacklogSize() {
        return maxBacklogSize;
    }

    public CommitDependency getIsDependent() {
        return isDependent;
    }

    public AbortSignal getAbortSignal() {
        return abortSignal;
    }

    public CommitStreamMetrics getMetrics() {
        return metrics;
    }

    public Builder toBuilder() {
        return new Builder()
            .maxBatchSize(maxBatchSize)
            .maxBacklogSize(maxBacklogSize)
            .isDependent(isDependent)
            .abortSignal(abortSignal)
            .metrics(metrics);
    }

    public static class Builder {
        private int maxBatchSize = 50;
        private int maxBacklogSize = 50;
        private CommitDependency isDependent = CommitDependency.NONE;
        private AbortSignal abortSignal;
        private CommitStreamMetrics metrics;

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder maxBacklogSize(int maxBacklogSize) {
            this.maxBacklogSize = maxBacklogSize;
            return this;
        }

        public Builder isDependent(CommitDependency isDependent) {
            this.isDependent = isDependent;
            return this;
        }

        public Builder abortSignal(AbortSignal abortSignal) {
            this.abortSignal = abortSignal;
            return this;
        }

        public Builder metrics(CommitStreamMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public BatcherOptions build() {
            return new BatcherOptions(this);
        }
    }
}
