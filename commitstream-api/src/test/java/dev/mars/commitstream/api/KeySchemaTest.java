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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class KeySchemaTest {

    @Test
    void testKeyStringFromObject() {
        KeySchema schema = KeySchema.of("tenant", "accountId");

        assertEquals("acme.42", schema.keyStringFromObject(Map.of("tenant", "acme", "accountId", "42", "extra", "x")));
    }

    @Test
    void testKeyPropsFromString() {
        KeySchema schema = new KeySchema(List.of(KeySchema.Property.named("region"), KeySchema.Property.named("id")),
            "|");

        assertEquals(Map.of("region", "eu", "id", "7"), schema.keyPropsFromString("eu|7"));
    }

    @Test
    void testOptionalPropertyBecomesEmptySegment() {
        KeySchema schema = new KeySchema(List.of(KeySchema.Property.named("tenant"),
            KeySchema.Property.optional("branch")));
        Map<String, Object> object = new HashMap<>();
        object.put("tenant", "acme");

        assertEquals("acme.", schema.keyStringFromObject(object));
    }

    @Test
    void testComputedProperty() {
        KeySchema schema = new KeySchema(List.of(
            KeySchema.Property.computed("year", object -> object.get("date").toString().substring(0, 4)),
            KeySchema.Property.named("id")));

        assertEquals("2025.9", schema.keyStringFromObject(Map.of("date", "2025-07-15", "id", "9")));
    }

    @Test
    void testNonStringValueRejected() {
        KeySchema schema = KeySchema.of("id");

        assertThrows(IllegalArgumentException.class, () -> schema.keyStringFromObject(Map.of("id", 9)));
        assertThrows(IllegalArgumentException.class, () -> schema.keyStringFromObject(Map.of()));
    }
}
