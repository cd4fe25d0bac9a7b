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

import dev.mars.commitstream.api.EventWithMetadata;

/**
 * Decides whether a depender event must wait for a dependee event already selected for
 * processing. Both events carry the key properties decoded by their aggregate's key schema.
 */
@FunctionalInterface
public interface EventDependency {

    EventDependency ALWAYS = (depender, dependee) -> true;

    boolean dependsOn(EventWithMetadata depender, EventWithMetadata dependee);

    /**
     * Depends when both events carry the same value for the given key property.
     */
    static EventDependency sameKeyProp(String keyProp) {
        return (depender, dependee) -> {
            String value = depender.getKeyProps().get(keyProp);
            return value != null && value.equals(dependee.getKeyProps().get(keyProp));
        };
    }
}
