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
import dev.mars.commitstream.api.store.MetaStore;
import dev.mars.commitstream.api.store.MetaStoreKey;
import dev.mars.commitstream.core.backoff.BackoffParams;
import dev.mars.commitstream.core.backoff.JitteredBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * A named read model fed with events of selected aggregate types.
 *
 * <p>The projection's head sort key lives in the meta store under
 * {@code ["Projection:<name>", "headSortKey"]}. It states that every event with a chronological
 * key at or below it has been processed, and is the point a {@link Projector} resumes from.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class Projection {
    private static final Logger logger = LoggerFactory.getLogger(Projection.class);

    public static final String HEAD_SORT_KEY = "headSortKey";

    private final String name;
    private final MetaStore metaStore;
    private final int maxBatchSize;
    private final Map<String, Optional<KeySchema>> aggregateTypes;
    private final ProjectionDependencies dependencies;
    private final EventBatchProcessor processor;

    private Projection(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Projection name cannot be null");
        this.metaStore = Objects.requireNonNull(builder.metaStore, "Meta store cannot be null");
        this.processor = Objects.requireNonNull(builder.processor, "Event processor cannot be null");
        this.maxBatchSize = builder.maxBatchSize;
        this.aggregateTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aggregateTypes));
        this.dependencies = builder.dependencies;

        if (aggregateTypes.isEmpty()) {
            throw new IllegalArgumentException("Projection '" + name + "' covers no aggregate types");
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("Max batch size must be at least 1");
        }
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public CompletableFuture<Void> processEvents(List<EventWithMetadata> events) {
        return processor.process(Collections.unmodifiableList(events));
    }

    public boolean covers(String aggregateType) {
        return aggregateTypes.containsKey(aggregateType);
    }

    /**
     * Returns the event with its aggregate key decoded by the type's key schema, if it has one.
     */
    public EventWithMetadata withKeyProps(EventWithMetadata event) {
        Optional<KeySchema> keySchema = aggregateTypes.getOrDefault(event.getAggregateType(), Optional.empty());
        return keySchema
            .map(schema -> event.withKeyProps(schema.keyPropsFromString(event.getAggregateKey())))
            .orElse(event);
    }

    public MetaStoreKey headSortKeyLocation() {
        return MetaStoreKey.of("Projection:" + name, HEAD_SORT_KEY);
    }

    /**
     * @return a future failing with {@link ProjectionNotSetupException} when no head is stored
     */
    public CompletableFuture<String> getHeadSortKey() {
        return findHeadSortKey().thenApply(head -> head.orElseThrow(() -> new ProjectionNotSetupException(name)));
    }

    public CompletableFuture<Optional<String>> findHeadSortKey() {
        return metaStore.get(headSortKeyLocation());
    }

    public CompletableFuture<Void> setHeadSortKey(String sortKey) {
        logger.debug("Projection '{}' head sort key -> {}", name, sortKey);
        return metaStore.put(headSortKeyLocation(), sortKey);
    }

    /**
     * Stores the initial head sort key unless one is already present.
     */
    public CompletableFuture<Void> setup(String startsAt) {
        return findHeadSortKey().thenCompose(existing -> {
            if (existing.isPresent()) {
                logger.info("Projection '{}' already set up at {}", name, existing.get());
                return CompletableFuture.completedFuture(null);
            }
            logger.info("Setting up projection '{}' starting at {}", name, startsAt);
            return setHeadSortKey(startsAt);
        });
    }

    public CompletableFuture<Void> setup(Instant startsAt) {
        return setup(ChronologicalKeys.fromInstant(startsAt));
    }

    public CompletableFuture<Void> teardown() {
        logger.info("Tearing down projection '{}'", name);
        return metaStore.delete(headSortKeyLocation());
    }

    /**
     * Polls the head sort key until it reaches {@code sortKey} or the timeout would be exceeded.
     *
     * @return a future with {@code true} once reached, {@code false} on timeout
     */
    public CompletableFuture<Boolean> whenSortKeyReached(String sortKey, BackoffParams backoff, Duration timeout) {
        JitteredBackoff jitter = new JitteredBackoff(backoff);
        long deadline = System.nanoTime() + timeout.toNanos();
        return awaitSortKey(sortKey, jitter, deadline, 1);
    }

    public CompletableFuture<Boolean> whenSortKeyReached(String sortKey) {
        return whenSortKeyReached(sortKey, new BackoffParams(10, 500, 2), Duration.ofSeconds(10));
    }

    public CompletableFuture<Boolean> commitIsProcessed(Commit commit, BackoffParams backoff, Duration timeout) {
        return whenSortKeyReached(commit.getChronologicalKey(), backoff, timeout);
    }

    public CompletableFuture<Boolean> commitIsProcessed(Commit commit) {
        return whenSortKeyReached(commit.getChronologicalKey());
    }

    private CompletableFuture<Boolean> awaitSortKey(String sortKey, JitteredBackoff jitter, long deadline, int attempt) {
        return getHeadSortKey().thenCompose(head -> {
            if (head.compareTo(sortKey) >= 0) {
                return CompletableFuture.completedFuture(true);
            }
            long delayMs = jitter.delayMillis(attempt);
            if (System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs) > deadline) {
                return CompletableFuture.completedFuture(false);
            }
            return CompletableFuture.supplyAsync(() -> null,
                    CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS))
                .thenCompose(ignored -> awaitSortKey(sortKey, jitter, deadline, attempt + 1));
        });
    }

    public String getName() {
        return name;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public Set<String> getAggregateTypes() {
        return aggregateTypes.keySet();
    }

    public ProjectionDependencies getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "Projection{" +
                "name='" + name + '\'' +
                ", aggregateTypes=" + aggregateTypes.keySet() +
                ", maxBatchSize=" + maxBatchSize +
                '}';
    }

    public static class Builder {
        private String name;
        private MetaStore metaStore;
        private int maxBatchSize = Integer.MAX_VALUE;
        private final Map<String, Optional<KeySchema>> aggregateTypes = new LinkedHashMap<>();
        private ProjectionDependencies dependencies = ProjectionDependencies.none();
        private EventBatchProcessor processor;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder metaStore(MetaStore metaStore) {
            this.metaStore = metaStore;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateTypes.put(aggregateType, Optional.empty());
            return this;
        }

        public Builder aggregateType(String aggregateType, KeySchema keySchema) {
            this.aggregateTypes.put(aggregateType, Optional.of(keySchema));
            return this;
        }

        public Builder dependencies(ProjectionDependencies dependencies) {
            this.dependencies = Objects.requireNonNull(dependencies, "Dependencies cannot be null");
            return this;
        }

        public Builder processor(EventBatchProcessor processor) {
            this.processor = processor;
            return this;
        }

        public Projection build() {
            return new Projection(this);
        }
    }
}
