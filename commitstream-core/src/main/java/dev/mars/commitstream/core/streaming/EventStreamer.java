package dev.mars.commitstream.core.streaming;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.commitstream.api.ChronologicalKeys;
import dev.mars.commitstream.api.Commit;
import dev.mars.commitstream.api.EventWithMetadata;
import dev.mars.commitstream.api.error.CommitStreamException;
import dev.mars.commitstream.api.store.EventStore;
import dev.mars.commitstream.core.backoff.BackoffParams;
import dev.mars.commitstream.core.concurrent.AbortSignal;
import dev.mars.commitstream.core.concurrent.Sleeper;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import dev.mars.commitstream.core.poll.ChronologicalCursorPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans out events from an event store to in-process subscribers.
 *
 * <p>The store is polled only while at least one subscription is open. Polling starts from the
 * current time the first time anyone subscribes and resumes from where it stopped afterwards.
 * Listeners are called on the polling thread, in commit order.</p>
 *
 * <p>At most one polling thread runs at a time. Subscribing while a stopped poller is still
 * finishing a commit defers the restart until that thread exits, resuming from the cursor it reached.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class EventStreamer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventStreamer.class);

    private final EventStore store;
    private final String partition;
    private final BackoffParams backoff;
    private final Sleeper sleeper;
    private final Clock clock;
    private final CommitStreamMetrics metrics;
    private final ObjectMapper objectMapper;
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();

    private String cursor;
    private AbortSignal abortSignal;
    private Thread pollingThread;
    private boolean resumeRequested;

    private EventStreamer(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "Event store cannot be null");
        this.partition = builder.partition;
        this.backoff = builder.backoff;
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
        this.cursor = builder.startAt;
        this.metrics = builder.metrics != null ? builder.metrics : CommitStreamMetrics.noop();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static Builder builder(EventStore store) {
        return new Builder().store(store);
    }

    public EventSubscription subscribe(Consumer<EventWithMetadata> listener) {
        EventSubscription subscription = new EventSubscription(UUID.randomUUID().toString(), this, listener);
        subscriptions.add(subscription);
        logger.debug("Subscriber {} added, {} active", subscription.getId(), subscriptions.size());
        ensurePolling();
        return subscription;
    }

    /**
     * Subscribes with a listener receiving each event as JSON.
     */
    public EventSubscription subscribeJson(Consumer<String> listener) {
        return subscribe(event -> listener.accept(toJson(event)));
    }

    void unsubscribe(EventSubscription subscription) {
        if (subscriptions.remove(subscription)) {
            logger.debug("Subscriber {} removed, {} active", subscription.getId(), subscriptions.size());
        }
        synchronized (this) {
            if (subscriptions.isEmpty() && abortSignal != null) {
                resumeRequested = false;
                abortSignal.abort();
            }
        }
    }

    /**
     * Delivers one event to every subscription whose filter sets accept it.
     */
    public void publish(EventWithMetadata event) {
        ObjectNode tree = toTree(event);
        for (EventSubscription subscription : subscriptions) {
            if (subscription.accepts(tree)) {
                subscription.deliver(event);
                metrics.recordEventPublished();
            }
        }
    }

    public String toJson(EventWithMetadata event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new CommitStreamException("Failed to serialize " + event, e);
        }
    }

    public synchronized boolean isPolling() {
        return pollingThread != null && pollingThread.isAlive() && (!abortSignal.isAborted() || resumeRequested);
    }

    public synchronized String getCursor() {
        return cursor;
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        subscriptions.clear();
        synchronized (this) {
            resumeRequested = false;
            if (abortSignal != null) {
                abortSignal.abort();
            }
        }
    }

    private synchronized void ensurePolling() {
        if (pollingThread != null && pollingThread.isAlive()) {
            if (abortSignal.isAborted() && !resumeRequested) {
                resumeRequested = true;
                logger.debug("Event streamer resubscribed while stopping, resuming once the current poller exits");
            }
            return;
        }
        startPolling();
    }

    // Caller holds the monitor.
    private void startPolling() {
        resumeRequested = false;
        if (cursor == null) {
            cursor = ChronologicalKeys.fromInstant(clock.instant());
        }

        AbortSignal signal = AbortSignal.create();
        ChronologicalCursorPoller.Builder pollerBuilder = ChronologicalCursorPoller.builder(store)
            .startAt(cursor)
            .partition(partition)
            .backoff(backoff)
            .abortSignal(signal)
            .metrics(metrics);
        if (sleeper != null) {
            pollerBuilder.sleeper(sleeper);
        }
        ChronologicalCursorPoller poller = pollerBuilder.build();

        abortSignal = signal;
        pollingThread = new Thread(() -> pollLoop(poller), "event-streamer-poller");
        pollingThread.setDaemon(true);
        pollingThread.start();
        logger.info("Event streamer polling from {}", cursor);
    }

    private void pollLoop(ChronologicalCursorPoller poller) {
        try {
            for (Optional<Commit> next : poller) {
                if (poller.getAbortSignal().isAborted()) {
                    break;
                }
                next.ifPresent(this::processCommit);
                synchronized (this) {
                    cursor = poller.getCursor();
                }
            }
            logger.info("Event streamer paused at {}", poller.getCursor());
        } catch (RuntimeException e) {
            logger.error("Event streamer polling failed at {}", poller.getCursor(), e);
        } finally {
            synchronized (this) {
                if (resumeRequested && !subscriptions.isEmpty()) {
                    startPolling();
                } else {
                    resumeRequested = false;
                }
            }
        }
    }

    private void processCommit(Commit commit) {
        for (EventWithMetadata event : EventWithMetadata.fromCommit(commit)) {
            publish(event);
        }
    }

    private ObjectNode toTree(EventWithMetadata event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.getType());
        node.put("version", event.getEvent().getVersion());
        node.set("properties", objectMapper.valueToTree(event.getProperties()));
        node.put("aggregateType", event.getAggregateType());
        node.put("aggregateKey", event.getAggregateKey());
        node.put("aggregateVersion", event.getAggregateVersion());
        node.put("timestamp", event.getTimestamp().toString());
        node.put("sortKey", event.getSortKey());
        return node;
    }

    public static class Builder {
        private EventStore store;
        private String partition;
        private String startAt;
        private BackoffParams backoff = new BackoffParams(10, 1000, 2);
        private Sleeper sleeper;
        private Clock clock = Clock.systemUTC();
        private CommitStreamMetrics metrics;

        public Builder store(EventStore store) {
            this.store = store;
            return this;
        }

        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        public Builder startAt(String cursor) {
            this.startAt = cursor;
            return this;
        }

        public Builder backoff(BackoffParams backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(CommitStreamMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public EventStreamer build() {
            return new EventStreamer(this);
        }
    }
}
