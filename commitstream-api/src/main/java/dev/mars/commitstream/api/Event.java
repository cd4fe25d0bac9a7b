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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single domain event inside a {@link Commit}.
 *
 * The schema version is carried so that stored events can be upcast by adapters;
 * it defaults to 1 when not given.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class Event {

    private final String type;
    private final int version;
    private final Map<String, Object> properties;

    @JsonCreator
    public Event(@JsonProperty("type") String type,
                 @JsonProperty("version") Integer version,
                 @JsonProperty("properties") Map<String, Object> properties) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.version = version != null ? version : 1;
        this.properties = properties != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
            : Map.of();

        if (this.version < 1) {
            throw new IllegalArgumentException("Event version must be positive");
        }
    }

    public Event(String type, Map<String, Object> properties) {
        this(type, 1, properties);
    }

    public static Event of(String type) {
        return new Event(type, 1, Map.of());
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("version")
    public int getVersion() {
        return version;
    }

    @JsonProperty("properties")
    public Map<String, Object> getProperties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return version == event.version &&
               type.equals(event.type) &&
               properties.equals(event.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, version, properties);
    }

    @Override
    public String toString() {
        return "Event{" +
                "type='" + type + '\'' +
                ", version=" + version +
                ", properties=" + properties +
                '}';
    }
}
