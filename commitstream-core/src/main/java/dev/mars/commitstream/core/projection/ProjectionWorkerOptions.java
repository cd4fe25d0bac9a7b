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

import dev.mars.commitstream.core.metrics.CommitStreamMetrics;

import java.util.concurrent.Executor;

/**
 * Settings for {@link ProjectionWorker}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class ProjectionWorkerOptions {

    private final int maxQueueSize;
    private final Executor executor;
    private final CommitStreamMetrics metrics;

    private ProjectionWorkerOptions(Builder builder) {
        this.maxQueueSize = builder.maxQueueSize;
        this.executor = builder.executor;
        this.metrics = builder.metrics != null ? builder.metrics : CommitStreamMetrics.noop();

        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("Max queue size must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProjectionWorkerOptions defaults() {
        return builder().build();
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    /**
     * Executor running the drain loop, or {@code null} for a dedicated daemon thread.
     */
    public Executor getExecutor() {
        return executor;
    }

    public CommitStreamMetrics getMetrics() {
        return metrics;
    }

    public Builder toBuilder() {
        return new Builder().maxQueueSize(maxQueueSize).executor(executor).metrics(metrics);
    }

    public static class Builder {
        private int maxQueueSize = 100;
        private Executor executor;
        private CommitStreamMetrics metrics;

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder metrics(CommitStreamMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ProjectionWorkerOptions build() {
            return new ProjectionWorkerOptions(this);
        }
    }
}
