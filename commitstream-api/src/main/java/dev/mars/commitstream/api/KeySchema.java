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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Describes how an aggregate key string is composed from named properties.
 *
 * <p>A schema of {@code ["tenant", "accountId"]} with separator {@code "."} maps
 * {@code {tenant: "acme", accountId: "42"}} to {@code "acme.42"} and back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class KeySchema {

    private final List<Property> properties;
    private final String separator;

    public KeySchema(List<Property> properties, String separator) {
        this.properties = List.copyOf(Objects.requireNonNull(properties, "Properties cannot be null"));
        this.separator = Objects.requireNonNull(separator, "Separator cannot be null");

        if (this.properties.isEmpty()) {
            throw new IllegalArgumentException("Key schema needs at least one property");
        }
        if (separator.isEmpty()) {
            throw new IllegalArgumentException("Separator cannot be empty");
        }
    }

    public KeySchema(List<Property> properties) {
        this(properties, ".");
    }

    public static KeySchema of(String... propertyNames) {
        List<Property> properties = new ArrayList<>();
        for (String name : propertyNames) {
            properties.add(Property.named(name));
        }
        return new KeySchema(properties);
    }

    public Map<String, String> keyPropsFromObject(Map<String, ?> object) {
        Map<String, String> keyProps = new LinkedHashMap<>();

        for (Property property : properties) {
            Object value = property.value != null ? property.value.apply(object) : object.get(property.name);

            if (value == null && property.optional) {
                keyProps.put(property.name, null);
                continue;
            }
            if (!(value instanceof String)) {
                throw new IllegalArgumentException("Value of key property '" + property.name + "' is not a string");
            }
            keyProps.put(property.name, (String) value);
        }

        return keyProps;
    }

    public String keyStringFromKeyProps(Map<String, String> keyProps) {
        List<String> parts = new ArrayList<>(properties.size());
        for (Property property : properties) {
            String value = keyProps.get(property.name);
            parts.add(value != null ? value : "");
        }
        return String.join(separator, parts);
    }

    public String keyStringFromObject(Map<String, ?> object) {
        return keyStringFromKeyProps(keyPropsFromObject(object));
    }

    public Map<String, String> keyPropsFromString(String keyString) {
        String[] values = keyString.split(Pattern.quote(separator), -1);
        Map<String, String> keyProps = new LinkedHashMap<>();

        for (int i = 0; i < values.length && i < properties.size(); i++) {
            keyProps.put(properties.get(i).name, values[i]);
        }

        return keyProps;
    }

    public List<Property> getProperties() {
        return properties;
    }

    public String getSeparator() {
        return separator;
    }

    /**
     * One named component of a key, optionally computed from the source object.
     */
    public static final class Property {
        private final String name;
        private final boolean optional;
        private final Function<Map<String, ?>, Object> value;

        public Property(String name, boolean optional, Function<Map<String, ?>, Object> value) {
            this.name = Objects.requireNonNull(name, "Property name cannot be null");
            this.optional = optional;
            this.value = value;
        }

        public static Property named(String name) {
            return new Property(name, false, null);
        }

        public static Property optional(String name) {
            return new Property(name, true, null);
        }

        public static Property computed(String name, Function<Map<String, ?>, Object> value) {
            return new Property(name, false, value);
        }

        public String getName() {
            return name;
        }

        public boolean isOptional() {
            return optional;
        }
    }
}
