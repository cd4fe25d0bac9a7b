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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds and compares chronological keys.
 *
 * <p>A chronological key has the shape
 * {@code <yyyyMMddHHmmssSSS>:<aggregateType>:<aggregateKey>:<version>} where the version is
 * zero-padded to ten digits. Keys sort lexically in commit order across all aggregates, and
 * the bare timestamp prefix produced by {@link #fromInstant(Instant)} is itself a valid cursor
 * that sorts before every key written in the same millisecond.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class ChronologicalKeys {

    public static final String SEPARATOR = ":";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);

    private ChronologicalKeys() {
    }

    public static String of(Instant timestamp, String aggregateType, String aggregateKey, long aggregateVersion) {
        return fromInstant(timestamp) + SEPARATOR + aggregateType + SEPARATOR + aggregateKey +
               SEPARATOR + String.format("%010d", aggregateVersion);
    }

    /**
     * Converts an instant to a cursor positioned at the start of its millisecond.
     */
    public static String fromInstant(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    /**
     * Null-tolerant lexical comparison; {@code null} sorts before every key.
     */
    public static int compare(String a, String b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }

    public static boolean isAfter(String candidate, String reference) {
        return compare(candidate, reference) > 0;
    }

    public static String max(String a, String b) {
        return compare(a, b) >= 0 ? a : b;
    }
}
