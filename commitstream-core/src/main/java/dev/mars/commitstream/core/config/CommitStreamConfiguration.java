package dev.mars.commitstream.core.config;

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

import dev.mars.commitstream.core.backoff.BackoffParams;
import dev.mars.commitstream.core.batch.BatcherOptions;
import dev.mars.commitstream.core.capacity.CapacityOptions;
import dev.mars.commitstream.core.projection.ProjectionWorkerOptions;
import dev.mars.commitstream.core.retry.RetryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Layered configuration for CommitStream components.
 *
 * <p>Sources, later ones overriding earlier ones:</p>
 * <ol>
 *   <li>{@code commitstream-default.properties} on the classpath</li>
 *   <li>{@code commitstream-<profile>.properties} for a non-default profile</li>
 *   <li>{@code COMMITSTREAM_*} environment variables, lower-cased with {@code _} turned into {@code .}</li>
 *   <li>{@code commitstream.*} system properties</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class CommitStreamConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CommitStreamConfiguration.class);

    private final Properties properties;
    private final String profile;

    public CommitStreamConfiguration() {
        this(getActiveProfile());
    }

    public CommitStreamConfiguration(String profile) {
        this(profile, System.getenv());
    }

    /**
     * Loads configuration with an explicit environment, then applies programmatic overrides last.
     */
    public CommitStreamConfiguration(String profile, Map<String, String> environment, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded CommitStream configuration for profile: {}", profile);
    }

    CommitStreamConfiguration(String profile, Map<String, String> environment) {
        this(profile, environment, new Properties());
    }

    private static String getActiveProfile() {
        return System.getProperty("commitstream.profile",
               System.getenv("COMMITSTREAM_PROFILE") != null ? System.getenv("COMMITSTREAM_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/commitstream-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/commitstream-" + profile + ".properties");
        }

        Map<String, String> knownKeys = new HashMap<>();
        for (String propKey : props.stringPropertyNames()) {
            knownKeys.put(toEnvironmentName(propKey), propKey);
        }
        environment.forEach((key, value) -> {
            if (key.startsWith("COMMITSTREAM_")) {
                String propKey = knownKeys.getOrDefault(key, key.toLowerCase().replace("_", "."));
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("commitstream.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * COMMITSTREAM_BATCHER_MAX_BATCH_SIZE for commitstream.batcher.max-batch-size.
     */
    static String toEnvironmentName(String propertyKey) {
        return propertyKey.toUpperCase().replace('.', '_').replace('-', '_');
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateBackoff(errors, "commitstream.polling", 10, 1000);
        validateBackoff(errors, "commitstream.retry", 2, 500);

        if (getLong("commitstream.retry.timeout-ms", 2000) < 0) {
            errors.add("Retry timeout cannot be negative");
        }
        if (getInt("commitstream.batcher.max-batch-size", 50) < 1) {
            errors.add("Batcher max batch size must be at least 1");
        }
        if (getInt("commitstream.batcher.max-backlog-size", 50) < 1) {
            errors.add("Batcher max backlog size must be at least 1");
        }
        if (getInt("commitstream.projection.max-queue-size", 100) < 1) {
            errors.add("Projection max queue size must be at least 1");
        }
        if (getInt("commitstream.projection.max-batch-size", 0) < 0) {
            errors.add("Projection max batch size cannot be negative");
        }
        if (getDouble("commitstream.capacity.units-per-second", 0) < 0) {
            errors.add("Capacity units per second cannot be negative");
        }
        if (getDouble("commitstream.capacity.initial-cost-per-item", 1) <= 0) {
            errors.add("Capacity initial cost per item must be positive");
        }
        if (getInt("commitstream.capacity.max-items-per-request", 25) < 1) {
            errors.add("Capacity max items per request must be at least 1");
        }
        if (getInt("commitstream.capacity.queue-size", 50) < 1) {
            errors.add("Capacity queue size must be at least 1");
        }
        if (getString("commitstream.chronological.partition", "default").isEmpty()) {
            errors.add("Chronological partition cannot be empty");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateBackoff(List<String> errors, String prefix, long defaultMin, long defaultMax) {
        long min = getLong(prefix + ".min-delay-ms", defaultMin);
        long max = getLong(prefix + ".max-delay-ms", defaultMax);
        double exponent = getDouble(prefix + ".backoff-exponent", 2);

        if (min < 0) {
            errors.add(prefix + " min delay cannot be negative");
        }
        if (max < min) {
            errors.add(prefix + " max delay must be greater than or equal to min delay");
        }
        if (exponent < 1) {
            errors.add(prefix + " backoff exponent must be at least 1");
        }
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public BackoffParams getPollingBackoff() {
        return new BackoffParams(
            getLong("commitstream.polling.min-delay-ms", 10),
            getLong("commitstream.polling.max-delay-ms", 1000),
            getDouble("commitstream.polling.backoff-exponent", 2)
        );
    }

    /**
     * Retry defaults for version-conflict retries.
     */
    public RetryOptions getRetryOptions() {
        return RetryOptions.builder()
            .timeout(Duration.ofMillis(getLong("commitstream.retry.timeout-ms", 2000)))
            .backoff(new BackoffParams(
                getLong("commitstream.retry.min-delay-ms", 2),
                getLong("commitstream.retry.max-delay-ms", 500),
                getDouble("commitstream.retry.backoff-exponent", 2)))
            .build();
    }

    public BatcherOptions getBatcherOptions() {
        return BatcherOptions.builder()
            .maxBatchSize(getInt("commitstream.batcher.max-batch-size", 50))
            .maxBacklogSize(getInt("commitstream.batcher.max-backlog-size", 50))
            .build();
    }

    public ProjectionWorkerOptions getProjectionOptions() {
        return ProjectionWorkerOptions.builder()
            .maxQueueSize(getInt("commitstream.projection.max-queue-size", 100))
            .build();
    }

    /**
     * Projection batch size limit, {@link Integer#MAX_VALUE} when configured as 0.
     */
    public int getProjectionMaxBatchSize() {
        int configured = getInt("commitstream.projection.max-batch-size", 0);
        return configured == 0 ? Integer.MAX_VALUE : configured;
    }

    public CapacityOptions getCapacityOptions() {
        return new CapacityOptions(
            getDouble("commitstream.capacity.units-per-second", 0),
            getDouble("commitstream.capacity.initial-cost-per-item", 1),
            getInt("commitstream.capacity.max-items-per-request", 25),
            getInt("commitstream.capacity.queue-size", 50)
        );
    }

    public String getChronologicalPartition() {
        return getString("commitstream.chronological.partition", "default");
    }

    public String getMetricsInstanceId() {
        return getString("commitstream.metrics.instance-id",
            "commitstream-" + UUID.randomUUID().toString().substring(0, 8));
    }

    public String getProfile() {
        return profile;
    }
}
