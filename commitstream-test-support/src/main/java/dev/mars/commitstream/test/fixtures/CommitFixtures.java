package dev.mars.commitstream.test.fixtures;

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
import dev.mars.commitstream.api.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Factory methods for commits used across the test suites.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class CommitFixtures {

    public static final Instant BASE_TIME = Instant.parse("2025-07-15T10:00:00Z");

    private CommitFixtures() {
    }

    public static Commit commit(String type, String key, long version, Instant timestamp) {
        return Commit.builder()
            .aggregateType(type)
            .aggregateKey(key)
            .aggregateVersion(version)
            .timestamp(timestamp)
            .event(new Event(type + "Changed", Map.of("version", version)))
            .build();
    }

    /**
     * A commit whose timestamp is {@code offsetMillis} after {@link #BASE_TIME}.
     */
    public static Commit commit(String type, String key, long version, long offsetMillis) {
        return commit(type, key, version, BASE_TIME.plusMillis(offsetMillis));
    }

    public static Commit commitWithEvents(String type, String key, long version, long offsetMillis,
                                          Event... events) {
        return Commit.builder()
            .aggregateType(type)
            .aggregateKey(key)
            .aggregateVersion(version)
            .timestamp(BASE_TIME.plusMillis(offsetMillis))
            .events(List.of(events))
            .build();
    }

    /**
     * Versions 1..count of one stream, one millisecond apart starting at {@code startOffsetMillis}.
     */
    public static List<Commit> stream(String type, String key, int count, long startOffsetMillis) {
        List<Commit> commits = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            commits.add(commit(type, key, i + 1, startOffsetMillis + i));
        }
        return commits;
    }
}
