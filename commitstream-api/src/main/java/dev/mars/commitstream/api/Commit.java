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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, atomically appended batch of events for one aggregate at one version.
 *
 * <p>For a fixed aggregate type and key, versions form a gap-free sequence starting at 1.
 * Stores enforce this with a compare-and-insert on (type, key, version) and reject a
 * duplicate version with {@link dev.mars.commitstream.api.error.VersionConflictException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@JsonIgnoreProperties(value = {"chronologicalKey", "streamId"}, allowGetters = true)
public class Commit {

    public static final String DEFAULT_PARTITION = "default";

    private final String aggregateType;
    private final String aggregateKey;
    private final long aggregateVersion;
    private final List<Event> events;
    private final Instant timestamp;
    private final Instant expiresAt;
    private final String chronologicalPartition;
    private final String chronologicalKey;

    @JsonCreator
    public Commit(@JsonProperty("aggregateType") String aggregateType,
                  @JsonProperty("aggregateKey") String aggregateKey,
                  @JsonProperty("aggregateVersion") long aggregateVersion,
                  @JsonProperty("events") List<Event> events,
                  @JsonProperty("timestamp") Instant timestamp,
                  @JsonProperty("expiresAt") Instant expiresAt,
                  @JsonProperty("chronologicalPartition") String chronologicalPartition) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        this.aggregateKey = Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        this.aggregateVersion = aggregateVersion;
        this.events = events != null ? List.copyOf(events) : List.of();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.expiresAt = expiresAt;
        this.chronologicalPartition = chronologicalPartition != null ? chronologicalPartition : DEFAULT_PARTITION;

        if (aggregateVersion < 1) {
            throw new IllegalArgumentException("Aggregate version must be positive");
        }
        if (aggregateType.contains(ChronologicalKeys.SEPARATOR)) {
            throw new IllegalArgumentException("Aggregate type cannot contain '" + ChronologicalKeys.SEPARATOR + "'");
        }

        this.chronologicalKey = ChronologicalKeys.of(this.timestamp, aggregateType, aggregateKey, aggregateVersion);
    }

    public static Builder builder() {
        return new Builder();
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

    @JsonProperty("events")
    public List<Event> getEvents() {
        return events;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("expiresAt")
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @JsonProperty("chronologicalPartition")
    public String getChronologicalPartition() {
        return chronologicalPartition;
    }

    /**
     * Lexically sortable key giving this commit its position in the total order of all commits.
     */
    @JsonProperty("chronologicalKey")
    public String getChronologicalKey() {
        return chronologicalKey;
    }

    /**
     * Identifies the aggregate instance this commit belongs to.
     */
    @JsonProperty("streamId")
    public String getStreamId() {
        return streamId(aggregateType, aggregateKey);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isSameStream(Commit other) {
        return aggregateType.equals(other.aggregateType) && aggregateKey.equals(other.aggregateKey);
    }

    public static String streamId(String aggregateType, String aggregateKey) {
        return aggregateType + "|" + aggregateKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Commit commit = (Commit) o;
        return aggregateVersion == commit.aggregateVersion &&
               aggregateType.equals(commit.aggregateType) &&
               aggregateKey.equals(commit.aggregateKey) &&
               timestamp.equals(commit.timestamp) &&
               events.equals(commit.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, aggregateKey, aggregateVersion, timestamp);
    }

    @Override
    public String toString() {
        return "Commit{" +
                aggregateType + "<" + aggregateKey + ">" +
                " v" + aggregateVersion +
                ", events=" + events.size() +
                ", chronologicalKey='" + chronologicalKey + '\'' +
                '}';
    }

    /**
     * Builder for {@link Commit}.
     */
    public static class Builder {
        private String aggregateType;
        private String aggregateKey;
        private long aggregateVersion = 1;
        private final List<Event> events = new ArrayList<>();
        private Instant timestamp;
        private Instant expiresAt;
        private String chronologicalPartition;

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        public Builder aggregateKey(String aggregateKey) {
            this.aggregateKey = aggregateKey;
            return this;
        }

        public Builder aggregateVersion(long aggregateVersion) {
            this.aggregateVersion = aggregateVersion;
            return this;
        }

        public Builder event(Event event) {
            this.events.add(event);
            return this;
        }

        public Builder events(List<Event> events) {
            this.events.addAll(events);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder chronologicalPartition(String chronologicalPartition) {
            this.chronologicalPartition = chronologicalPartition;
            return this;
        }

        public Commit build() {
            return new Commit(aggregateType, aggregateKey, aggregateVersion, events, timestamp,
                expiresAt, chronologicalPartition);
        }
    }
}
