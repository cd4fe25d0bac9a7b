package dev.mars.commitstream.api;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An event together with the metadata of the commit it belongs to.
 *
 * <p>This is the unit handed to projections. The sort key is the chronological key of the
 * owning commit; {@code keyProps} holds the aggregate key decoded by a {@link KeySchema}
 * and is empty unless a consumer enriched the event with {@link #withKeyProps(Map)}.</p>
 *
 * <p>Instances use identity equality: two events of one commit may carry identical data and
 * must still be queued separately.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class EventWithMetadata {

    private final Event event;
    private final String aggregateType;
    private final String aggregateKey;
    private final long aggregateVersion;
    private final Instant timestamp;
    private final String sortKey;
    private final int commitEventIndex;
    private final Map<String, String> keyProps;

    @JsonCreator
    public EventWithMetadata(@JsonProperty("event") Event event,
                             @JsonProperty("aggregateType") String aggregateType,
                             @JsonProperty("aggregateKey") String aggregateKey,
                             @JsonProperty("aggregateVersion") long aggregateVersion,
                             @JsonProperty("timestamp") Instant timestamp,
                             @JsonProperty("sortKey") String sortKey,
                             @JsonProperty("commitEventIndex") int commitEventIndex,
                             @JsonProperty("keyProps") Map<String, String> keyProps) {
        this.event = Objects.requireNonNull(event, "Event cannot be null");
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        this.aggregateKey = Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        this.aggregateVersion = aggregateVersion;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.sortKey = Objects.requireNonNull(sortKey, "Sort key cannot be null");
        this.commitEventIndex = commitEventIndex;
        this.keyProps = keyProps != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(keyProps))
            : Map.of();
    }

    /**
     * Expands a commit into one entry per event, preserving event order.
     */
    public static List<EventWithMetadata> fromCommit(Commit commit) {
        List<EventWithMetadata> result = new ArrayList<>(commit.getEvents().size());
        List<Event> events = commit.getEvents();
        for (int i = 0; i < events.size(); i++) {
            result.add(new EventWithMetadata(events.get(i), commit.getAggregateType(), commit.getAggregateKey(),
                commit.getAggregateVersion(), commit.getTimestamp(), commit.getChronologicalKey(), i, null));
        }
        return result;
    }

    public EventWithMetadata withKeyProps(Map<String, String> keyProps) {
        return new EventWithMetadata(event, aggregateType, aggregateKey, aggregateVersion, timestamp,
            sortKey, commitEventIndex, keyProps);
    }

    @JsonProperty("event")
    public Event getEvent() {
        return event;
    }

    @JsonIgnore
    public String getType() {
        return event.getType();
    }

    @JsonIgnore
    public Map<String, Object> getProperties() {
        return event.getProperties();
    }

    @JsonProperty("aggregateType")
    public String getAggregateType() {
        return aggregateType;
    }

    @JsonProperty("aggregateKey")
    public String getAggregateKey() {
        return aggregateKey;
    }

    @JsonProperty("aggregateVersion")
    public long getAggregateVersion() {
        return aggregateVersion;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("sortKey")
    public String getSortKey() {
        return sortKey;
    }

    @JsonProperty("commitEventIndex")
    public int getCommitEventIndex() {
        return commitEventIndex;
    }

    @JsonProperty("keyProps")
    public Map<String, String> getKeyProps() {
        return keyProps;
    }

    @JsonIgnore
    public String getStreamId() {
        return Commit.streamId(aggregateType, aggregateKey);
    }

    @Override
    public String toString() {
        return "EventWithMetadata{" +
                aggregateType + "<" + aggregateKey + ">" +
                " v" + aggregateVersion +
                " #" + commitEventIndex +
                ", type='" + event.getType() + '\'' +
                ", sortKey='" + sortKey + '\'' +
                '}';
    }
}
