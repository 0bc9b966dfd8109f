package dev.mars.idledger.db.config;

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

import dev.mars.idledger.db.IdLedgerDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Configuration management for IdLedger.
 *
 * <p>Sources, later ones winning:</p>
 * <ol>
 *   <li>{@code /idledger-default.properties} on the classpath</li>
 *   <li>{@code /idledger-<profile>.properties} on the classpath</li>
 *   <li>{@code IDLEDGER_*} environment variables ({@code IDLEDGER_DATABASE_HOST} becomes
 *       {@code idledger.database.host})</li>
 *   <li>{@code idledger.*} system properties</li>
 *   <li>overrides passed to {@link #IdLedgerConfiguration(String, Map)}</li>
 * </ol>
 *
 * <p>The configuration is validated on construction; every problem found is reported in one
 * {@link IllegalStateException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class IdLedgerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(IdLedgerConfiguration.class);

    private static final String PREFIX = "idledger.";
    private static final String ENV_PREFIX = "IDLEDGER_";

    private final Properties properties;
    private final String profile;

    public IdLedgerConfiguration() {
        this(getActiveProfile());
    }

    public IdLedgerConfiguration(String profile) {
        this(profile, Map.of());
    }

    /**
     * Loads the profile and applies explicit overrides on top, without touching system properties.
     * Tests use this to point a configuration at a TestContainer.
     */
    public IdLedgerConfiguration(String profile, Map<String, String> overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile, System.getenv());
        overrides.forEach(properties::setProperty);
        validateConfiguration();
        logger.info("Loaded IdLedger configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("idledger.profile",
               System.getenv("IDLEDGER_PROFILE") != null ? System.getenv("IDLEDGER_PROFILE") : "default");
    }

    Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/idledger-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/idledger-" + profile + ".properties");
        }

        // Environment first, then system properties so -D wins over the environment
        environment.forEach((key, value) -> {
            if (key.startsWith(ENV_PREFIX)) {
                props.setProperty(toPropertyKey(key), value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith(PREFIX)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * Maps an environment variable name to a property key. A double underscore stands for a
     * dash: {@code IDLEDGER_PROJECTION_BATCH__SIZE} is {@code idledger.projection.batch-size}.
     */
    static String toPropertyKey(String environmentKey) {
        return environmentKey.toLowerCase()
            .replace("__", "-")
            .replace('_', '.');
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

        validateDatabaseConfig(errors);
        validateProjectionConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString("idledger.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt("idledger.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("idledger.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString("idledger.database.username", "").isEmpty()) {
            errors.add("Database username is required");
        }

        if (getInt("idledger.database.pool.max-size", 16) < 1) {
            errors.add("Maximum pool size must be at least 1");
        }

        if (getLong("idledger.database.pool.connection-timeout-ms", 30000) < 1) {
            errors.add("Pool connection timeout must be positive");
        }
    }

    private void validateProjectionConfig(List<String> errors) {
        int batchSize = getInt("idledger.projection.batch-size", 200);
        if (batchSize < 1 || batchSize > 10000) {
            errors.add("Projection batch size must be between 1 and 10000");
        }

        Duration pollingInterval = getDuration("idledger.projection.polling-interval", Duration.ofSeconds(1));
        if (pollingInterval.toMillis() < 10) {
            errors.add("Projection polling interval must be at least 10ms");
        }

        Duration maxRetryDelay = getDuration("idledger.projection.max-retry-delay", Duration.ofSeconds(30));
        if (maxRetryDelay.compareTo(pollingInterval) < 0) {
            errors.add("Projection max retry delay must not be shorter than the polling interval");
        }
    }

    // Configuration getters with defaults
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

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Reads an ISO-8601 duration such as {@code PT1S}.
     */
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

    // Specific configuration builders
    public PgConnectionConfig getDatabaseConfig() {
        return new PgConnectionConfig.Builder()
            .host(getString("idledger.database.host", "localhost"))
            .port(getInt("idledger.database.port", 5432))
            .database(getString("idledger.database.name", "idledger"))
            .username(getString("idledger.database.username", "idledger"))
            .password(getString("idledger.database.password", ""))
            .sslEnabled(getBoolean("idledger.database.ssl.enabled", false))
            .applicationName(getString("idledger.database.application-name", "idledger"))
            .build();
    }

    public PgPoolConfig getPoolConfig() {
        return new PgPoolConfig.Builder()
            .maxSize(getInt("idledger.database.pool.max-size", 16))
            .maxWaitQueueSize(getInt("idledger.database.pool.max-wait-queue-size", 128))
            .connectionTimeout(Duration.ofMillis(getLong("idledger.database.pool.connection-timeout-ms", 30000)))
            .idleTimeout(Duration.ofMillis(getLong("idledger.database.pool.idle-timeout-ms", 600000)))
            .build();
    }

    public boolean isSchemaInitializationEnabled() {
        return getBoolean("idledger.database.schema.initialize", false);
    }

    public String getDefaultInstanceId() {
        return getString("idledger.instance.default-id", IdLedgerDefaults.DEFAULT_INSTANCE_ID);
    }

    public ProjectionConfig getProjectionConfig() {
        return new ProjectionConfig(
            getBoolean("idledger.projection.enabled", true),
            getInt("idledger.projection.batch-size", 200),
            getDuration("idledger.projection.polling-interval", Duration.ofSeconds(1)),
            getBoolean("idledger.projection.lock-enabled", true),
            getDuration("idledger.projection.max-retry-delay", Duration.ofSeconds(30)),
            getBoolean("idledger.projection.trigger-on-append", true)
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("idledger.metrics.enabled", true),
            getString("idledger.metrics.instance-id", "idledger-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    // Configuration data classes
    public static class ProjectionConfig {
        private final boolean enabled;
        private final int batchSize;
        private final Duration pollingInterval;
        private final boolean lockEnabled;
        private final Duration maxRetryDelay;
        private final boolean triggerOnAppend;

        public ProjectionConfig(boolean enabled, int batchSize, Duration pollingInterval, boolean lockEnabled,
                                Duration maxRetryDelay, boolean triggerOnAppend) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be at least 1");
            }
            this.enabled = enabled;
            this.batchSize = batchSize;
            this.pollingInterval = pollingInterval;
            this.lockEnabled = lockEnabled;
            this.maxRetryDelay = maxRetryDelay;
            this.triggerOnAppend = triggerOnAppend;
        }

        /**
         * Defaults matching {@code idledger-default.properties}.
         */
        public static ProjectionConfig defaults() {
            return new ProjectionConfig(true, 200, Duration.ofSeconds(1), true, Duration.ofSeconds(30), true);
        }

        public ProjectionConfig withBatchSize(int batchSize) {
            return new ProjectionConfig(enabled, batchSize, pollingInterval, lockEnabled, maxRetryDelay, triggerOnAppend);
        }

        public ProjectionConfig withLockEnabled(boolean lockEnabled) {
            return new ProjectionConfig(enabled, batchSize, pollingInterval, lockEnabled, maxRetryDelay, triggerOnAppend);
        }

        public boolean isEnabled() { return enabled; }
        public int getBatchSize() { return batchSize; }
        public Duration getPollingInterval() { return pollingInterval; }
        public boolean isLockEnabled() { return lockEnabled; }
        public Duration getMaxRetryDelay() { return maxRetryDelay; }
        public boolean isTriggerOnAppend() { return triggerOnAppend; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }
    public Properties getProperties() { return new Properties(properties); }
}
