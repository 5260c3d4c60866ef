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
package dev.mars.tasklist.rest.config;

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * Immutable, validated configuration for the task list HTTP server.
 * Parsed once at bootstrap from the merged {@code ConfigRetriever} output and injected into the verticle.
 *
 * @param port        HTTP listen port
 * @param serviceName name reported by the health endpoint
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public record RestServerConfig(int port, String serviceName) {

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_SERVICE_NAME = "tasklist";

    public RestServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535");
        }
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        if (serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
    }

    /**
     * Parse and validate configuration from the merged file, environment and system property sources.
     *
     * @throws IllegalArgumentException if validation fails
     */
    public static RestServerConfig from(JsonObject json) {
        return new RestServerConfig(
            readInt(json, "port", DEFAULT_PORT),
            json.getString("serviceName", DEFAULT_SERVICE_NAME));
    }

    public static RestServerConfig defaults() {
        return new RestServerConfig(DEFAULT_PORT, DEFAULT_SERVICE_NAME);
    }

    // Environment and system property stores deliver raw strings
    private static int readInt(JsonObject json, String key, int defaultValue) {
        Object value = json.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }
}
