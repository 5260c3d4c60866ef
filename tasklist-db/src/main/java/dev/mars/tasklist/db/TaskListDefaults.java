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
package dev.mars.tasklist.db;

import java.time.Duration;

/**
 * Default values shared by the configuration layer and the components it builds.
 */
public final class TaskListDefaults {

    /**
     * Connection attempts made before giving up on a cold-starting database.
     */
    public static final int CONNECTION_MAX_ATTEMPTS = 30;

    /**
     * Fixed wait between two connection attempts.
     */
    public static final Duration CONNECTION_RETRY_INTERVAL = Duration.ofSeconds(1);

    /**
     * Deadline for one connection attempt, covering TCP connect and the startup handshake.
     */
    public static final Duration CONNECTION_ATTEMPT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Health checks use a shorter budget so a health check answers within the orchestrator's timeout.
     */
    public static final int HEALTH_MAX_ATTEMPTS = 3;

    public static final Duration HEALTH_RETRY_INTERVAL = Duration.ofSeconds(1);

    /**
     * 3 attempts of at most 2s plus two 1s waits keeps a health check under 10s.
     */
    public static final Duration HEALTH_ATTEMPT_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Upper bound on the author column, matching {@code VARCHAR(255)} in the schema script.
     */
    public static final int MAX_NAME_LENGTH = 255;

    /**
     * Component name used in health reports.
     */
    public static final String DATABASE_COMPONENT = "database";

    private TaskListDefaults() {
        // Prevent instantiation
    }
}
