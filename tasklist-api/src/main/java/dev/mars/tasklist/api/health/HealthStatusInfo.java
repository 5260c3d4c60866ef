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
package dev.mars.tasklist.api.health;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a single health check.
 *
 * @param component name of the checked dependency
 * @param state     healthy or unhealthy
 * @param message   diagnostic detail, set when unhealthy
 * @param details   additional diagnostic values such as the attempt count
 * @param timestamp when the check completed
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public record HealthStatusInfo(
    String component,
    ComponentHealthState state,
    String message,
    Map<String, Object> details,
    Instant timestamp
) {
    public HealthStatusInfo {
        Objects.requireNonNull(component, "Component cannot be null");
        Objects.requireNonNull(state, "State cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        details = details != null ? Map.copyOf(details) : Collections.emptyMap();
    }

    public static HealthStatusInfo healthy(String component) {
        return new HealthStatusInfo(component, ComponentHealthState.HEALTHY, null, null, Instant.now());
    }

    public static HealthStatusInfo healthy(String component, Map<String, Object> details) {
        return new HealthStatusInfo(component, ComponentHealthState.HEALTHY, null, details, Instant.now());
    }

    public static HealthStatusInfo unhealthy(String component, String message) {
        return new HealthStatusInfo(component, ComponentHealthState.UNHEALTHY, message, null, Instant.now());
    }

    public static HealthStatusInfo unhealthy(String component, String message, Map<String, Object> details) {
        return new HealthStatusInfo(component, ComponentHealthState.UNHEALTHY, message, details, Instant.now());
    }

    public boolean isHealthy() {
        return state == ComponentHealthState.HEALTHY;
    }

    public boolean isUnhealthy() {
        return state == ComponentHealthState.UNHEALTHY;
    }
}
