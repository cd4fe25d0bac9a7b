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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class ChronologicalKeysTest {

    private static final Instant T0 = Instant.parse("2025-07-15T10:00:00.123Z");

    @Test
    void testKeyLayout() {
        assertEquals("20250715100000123:Account:acc-1:0000000042",
            ChronologicalKeys.of(T0, "Account", "acc-1", 42));
    }

    @Test
    void testKeysSortByTimeThenStreamThenVersion() {
        String early = ChronologicalKeys.of(T0, "Order", "z", 9);
        String later = ChronologicalKeys.of(T0.plusMillis(1), "Account", "a", 1);
        String v2 = ChronologicalKeys.of(T0, "Order", "z", 10);

        assertTrue(early.compareTo(later) < 0);
        assertTrue(early.compareTo(v2) < 0);
    }

    @Test
    void testInstantPrefixSortsBeforeKeysAtThatMillisecond() {
        String prefix = ChronologicalKeys.fromInstant(T0);
        String key = ChronologicalKeys.of(T0, "Account", "a", 1);

        assertTrue(ChronologicalKeys.isAfter(key, prefix));
        assertTrue(key.startsWith(prefix));
    }

    @Test
    void testNullSortsFirst() {
        assertEquals(0, ChronologicalKeys.compare(null, null));
        assertTrue(ChronologicalKeys.compare(null, "a") < 0);
        assertTrue(ChronologicalKeys.isAfter("a", null));
        assertFalse(ChronologicalKeys.isAfter(null, "a"));
        assertEquals("b", ChronologicalKeys.max("a", "b"));
        assertEquals("a", ChronologicalKeys.max("a", null));
    }
}
