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
package dev.mars.tasklist.db.config;

import dev.mars.tasklist.db.TaskListDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Process-wide configuration, loaded once at boot and handed to the components explicitly.
 *
 * <p>Sources, lowest precedence first:</p>
 * <ol>
 *   <li>{@code tasklist-default.properties} on the classpath</li>
 *   <li>{@code tasklist-<profile>.properties} on the classpath, when a profile is active</li>
 *   <li>environment variables starting with {@code TASKLIST_}, e.g. {@code TASKLIST_DATABASE_HOST};
 *       a double underscore stands for a hyphen</li>
 *   <li>system properties starting with {@code tasklist.}</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class TaskListConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TaskListConfiguration.class);

    private final Properties properties;
    private final String profile;

    public TaskListConfiguration() {
        this(getActiveProfile());
    }

    public TaskListConfiguration(String profile) {
        this(profile, System.getenv());
    }

    TaskListConfiguration(String profile, Map<String, String> environment) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        validateConfiguration();
        logger.info("Loaded task list configuration for profile: {}", profile);
    }

    /**
     * Programmatic configuration with explicit database settings, used by tests and embedders
     * that must not touch system properties.
     */
    public TaskListConfiguration(String profile, String dbHost, int dbPort, String dbName,
                                 String dbUsername, String dbPassword) {
        this.profile = profile;
        this.properties = loadProperties(profile, Map.of());

        properties.setProperty("tasklist.database.host", dbHost);
        properties.setProperty("tasklist.database.port", String.valueOf(dbPort));
        properties.setProperty("tasklist.database.name", dbName);
        properties.setProperty("tasklist.database.username", dbUsername);
        properties.setProperty("tasklist.database.password", dbPassword);

        validateConfiguration();
        logger.info("Loaded task list configuration for profile: {} with explicit database config", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("tasklist.profile",
               System.getenv("TASKLIST_PROFILE") != null ? System.getenv("TASKLIST_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/tasklist-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/tasklist-" + profile + ".properties");
        }

        // TASKLIST_DATABASE_HOST -> tasklist.database.host, TASKLIST_CONNECTION_MAX__ATTEMPTS -> tasklist.connection.max-attempts
        environment.forEach((key, value) -> {
            if (key.startsWith("TASKLIST_")) {
                String propKey = key.toLowerCase().replace("__", "-").replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        // System properties win over the environment so tests can override with -D
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("tasklist.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
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
        validateRetryConfig(errors, "tasklist.connection");
        validateRetryConfig(errors, "tasklist.health");

        if (getInt("tasklist.task.max-name-length", TaskListDefaults.MAX_NAME_LENGTH) < 1) {
            errors.add("Maximum name length must be at least 1");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.info("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString("tasklist.database.host", "").isBlank()) {
            errors.add("Database host is required");
        }

        int port = getInt("tasklist.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("tasklist.database.name", "").isBlank()) {
            errors.add("Database name is required");
        }

        if (getString("tasklist.database.username", "").isBlank()) {
            errors.add("Database username is required");
        }

        if (getString("tasklist.database.password", "").isBlank()) {
            errors.add("Database password is required");
        }
    }

    private void validateRetryConfig(List<String> errors, String prefix) {
        if (getInt(prefix + ".max-attempts", 1) < 1) {
            errors.add(prefix + ".max-attempts must be at least 1");
        }
        if (getDuration(prefix + ".retry-interval", Duration.ZERO).isNegative()) {
            errors.add(prefix + ".retry-interval must not be negative");
        }
        if (getDuration(prefix + ".attempt-timeout", Duration.ofSeconds(1)).toMillis() < 1) {
            errors.add(prefix + ".attempt-timeout must be at least 1ms");
        }
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
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

    public PgConnectionConfig getDatabaseConfig() {
        return new PgConnectionConfig.Builder()
            .host(getString("tasklist.database.host", "localhost"))
            .port(getInt("tasklist.database.port", 5432))
            .database(getString("tasklist.database.name", "todos"))
            .username(getString("tasklist.database.username", "todo_user"))
            .password(getString("tasklist.database.password", ""))
            .schema(getString("tasklist.database.schema", "public"))
            .sslEnabled(getBoolean("tasklist.database.ssl.enabled", false))
            .build();
    }

    /**
     * Retry settings for boot-time schema setup and per-request connection acquisition.
     */
    public RetryPolicy getConnectionRetryPolicy() {
        return RetryPolicy.of(
            getInt("tasklist.connection.max-attempts", TaskListDefaults.CONNECTION_MAX_ATTEMPTS),
            getDuration("tasklist.connection.retry-interval", TaskListDefaults.CONNECTION_RETRY_INTERVAL),
            getDuration("tasklist.connection.attempt-timeout", TaskListDefaults.CONNECTION_ATTEMPT_TIMEOUT));
    }

    /**
     * Retry settings for health checks.
     */
    public RetryPolicy getHealthRetryPolicy() {
        return RetryPolicy.of(
            getInt("tasklist.health.max-attempts", TaskListDefaults.HEALTH_MAX_ATTEMPTS),
            getDuration("tasklist.health.retry-interval", TaskListDefaults.HEALTH_RETRY_INTERVAL),
            getDuration("tasklist.health.attempt-timeout", TaskListDefaults.HEALTH_ATTEMPT_TIMEOUT));
    }

    public int getMaxNameLength() {
        return getInt("tasklist.task.max-name-length", TaskListDefaults.MAX_NAME_LENGTH);
    }

    public String getInstanceId() {
        return getString("tasklist.metrics.instance-id", "tasklist-" + profile);
    }

    public String getProfile() {
        return profile;
    }
}
