package dev.mars.commitstream.core.projection;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordering rules of a projection, keyed by depender aggregate type and then dependee type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class ProjectionDependencies {

    private static final ProjectionDependencies NONE = new ProjectionDependencies(Map.of());

    private final Map<String, Map<String, EventDependency>> rules;

    private ProjectionDependencies(Map<String, Map<String, EventDependency>> rules) {
        this.rules = rules;
    }

    public static ProjectionDependencies none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasRulesFor(String dependerType) {
        return rules.containsKey(dependerType);
    }

    /**
     * @return the rule, or {@code null} when events of these types never wait for each other
     */
    public EventDependency find(String dependerType, String dependeeType) {
        Map<String, EventDependency> byDependee = rules.get(dependerType);
        return byDependee != null ? byDependee.get(dependeeType) : null;
    }

    public static class Builder {
        private final Map<String, Map<String, EventDependency>> rules = new LinkedHashMap<>();

        public Builder add(String dependerType, String dependeeType, EventDependency dependency) {
            rules.computeIfAbsent(dependerType, type -> new LinkedHashMap<>()).put(dependeeType, dependency);
            return this;
        }

        public ProjectionDependencies build() {
            Map<String, Map<String, EventDependency>> copy = new LinkedHashMap<>();
            rules.forEach((depender, byDependee) ->
                copy.put(depender, Collections.unmodifiableMap(new LinkedHashMap<>(byDependee))));
            return new ProjectionDependencies(Collections.unmodifiableMap(copy));
        }
    }
}
