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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.commitstream.api.EventWithMetadata;

import java.util.List;
import java.util.function.Consumer;

/**
 * One subscriber of an {@link EventStreamer}.
 *
 * <p>A subscription without filter sets receives every event. Otherwise an event is delivered
 * only when every filter set matches it.</p>
 */
public final class EventSubscription implements AutoCloseable {

    private final String id;
    private final EventStreamer streamer;
    private final Consumer<EventWithMetadata> listener;
    private volatile List<FilterSet> filterSets = List.of();

    EventSubscription(String id, EventStreamer streamer, Consumer<EventWithMetadata> listener) {
        this.id = id;
        this.streamer = streamer;
        this.listener = listener;
    }

    public void setFilterSets(List<FilterSet> filterSets) {
        this.filterSets = List.copyOf(filterSets);
    }

    /**
     * Replaces the filter sets with the ones in a JSON array.
     */
    public void setFilterSets(String json) {
        setFilterSets(FilterSet.parseList(streamer.getObjectMapper(), json));
    }

    public List<FilterSet> getFilterSets() {
        return filterSets;
    }

    public String getId() {
        return id;
    }

    boolean accepts(JsonNode event) {
        for (FilterSet filterSet : filterSets) {
            if (!filterSet.matches(event)) {
                return false;
            }
        }
        return true;
    }

    void deliver(EventWithMetadata event) {
        listener.accept(event);
    }

    @Override
    public void close() {
        streamer.unsubscribe(this);
    }
}
