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

import io.vertx.core.Future;

/**
 * Reports whether the database dependency is reachable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public interface HealthService {

    /**
     * Attempts one bounded connection acquisition and releases it immediately.
     *
     * <p>The returned future never fails: an unreachable database is reported as an
     * {@link ComponentHealthState#UNHEALTHY} status carrying the cause as its message.</p>
     *
     * @return the health status of the database dependency
     */
    Future<HealthStatusInfo> checkHealth();
}
