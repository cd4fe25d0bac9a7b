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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * A set of conditions an event must meet, keyed by dotted property path.
 *
 * <p>A condition value is matched by kind: an array matches when it contains the event's value,
 * an object of the form {@code {"regexp": "..."}} matches a textual value containing the pattern,
 * and anything else must equal the event's value. For example
 * {@code {"aggregateType": ["Account", "Order"], "type": {"regexp": "^Money"}}}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class FilterSet {

    private static final TypeReference<List<Map<String, JsonNode>>> FILTER_SETS = new TypeReference<>() {
    };

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private final Map<String, JsonNode> conditions;

    public FilterSet(Map<String, JsonNode> conditions) {
        this.conditions = Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    /**
     * Parses a JSON array of filter set objects.
     *
     * @throws IllegalArgumentException if the JSON is malformed or not an array of objects
     */
    public static List<FilterSet> parseList(ObjectMapper mapper, String json) {
        try {
            List<Map<String, JsonNode>> raw = mapper.readValue(json, FILTER_SETS);
            return raw.stream().map(FilterSet::new).toList();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid filter sets: " + e.getOriginalMessage(), e);
        }
    }

    public boolean matches(JsonNode event) {
        for (Map.Entry<String, JsonNode> condition : conditions.entrySet()) {
            JsonNode value = valueAt(event, condition.getKey());
            if (!conditionHolds(condition.getValue(), value)) {
                return false;
            }
        }
        return true;
    }

    public Map<String, JsonNode> getConditions() {
        return conditions;
    }

    private static boolean conditionHolds(JsonNode expected, JsonNode actual) {
        if (expected.isArray()) {
            Iterator<JsonNode> options = expected.elements();
            while (options.hasNext()) {
                if (sameValue(options.next(), actual)) {
                    return true;
                }
            }
            return false;
        }
        if (expected.isObject() && expected.has("regexp")) {
            if (!actual.isTextual()) {
                return false;
            }
            Pattern pattern = PATTERNS.computeIfAbsent(expected.get("regexp").asText(), Pattern::compile);
            return pattern.matcher(actual.asText()).find();
        }
        return sameValue(expected, actual);
    }

    private static boolean sameValue(JsonNode expected, JsonNode actual) {
        if (actual.isMissingNode()) {
            return false;
        }
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.equals(actual);
    }

    private static JsonNode valueAt(JsonNode root, String path) {
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            current = current.path(segment);
            if (current.isMissingNode()) {
                break;
            }
        }
        return current;
    }

    @Override
    public String toString() {
        return "FilterSet" + conditions;
    }
}
